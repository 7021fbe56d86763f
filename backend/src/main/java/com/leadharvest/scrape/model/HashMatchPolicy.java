package com.leadharvest.scrape.model;

public enum HashMatchPolicy {
    GLOBAL,
    SAME_SOURCE,
    DISABLED
}
