package com.leadharvest.scrape.model;

public record PlainSelector(String selector) implements FieldSpec {
}
