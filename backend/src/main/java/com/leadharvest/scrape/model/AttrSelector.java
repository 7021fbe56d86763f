package com.leadharvest.scrape.model;

import java.util.List;

public record AttrSelector(List<Alternative> alternatives) implements FieldSpec {
    public AttrSelector {
        alternatives = List.copyOf(alternatives);
    }

    /**
     * @param attribute attribute to read, or {@code null} to read the element text
     */
    public record Alternative(String selector, String attribute) {
        public boolean readsText() {
            return attribute == null;
        }
    }
}
