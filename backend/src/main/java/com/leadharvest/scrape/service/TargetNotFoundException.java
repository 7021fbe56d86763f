package com.leadharvest.scrape.service;

public class TargetNotFoundException extends RuntimeException {
    public TargetNotFoundException(long targetId) {
        super("Target not found: " + targetId);
    }
}
