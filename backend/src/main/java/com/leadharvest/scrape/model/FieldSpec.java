package com.leadharvest.scrape.model;

public interface FieldSpec {
}
