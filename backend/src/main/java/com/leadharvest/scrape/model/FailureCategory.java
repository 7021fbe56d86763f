package com.leadharvest.scrape.model;

public enum FailureCategory {
    NETWORK,
    TIMEOUT,
    CONFIG,
    FATAL;

    public boolean isContained() {
        return this != FATAL;
    }
}
