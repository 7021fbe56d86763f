package com.leadharvest.scrape.model;

import java.util.regex.Pattern;

public record StructuredSpec(
    String selector,
    String attribute,
    Pattern regex,
    String defaultValue
) implements FieldSpec {
    public StructuredSpec {
        defaultValue = defaultValue == null ? "" : defaultValue;
    }
}
