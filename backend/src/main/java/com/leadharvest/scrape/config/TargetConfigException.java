package com.leadharvest.scrape.config;

public class TargetConfigException extends RuntimeException {
    public TargetConfigException(String message) {
        super("invalid target config: " + message);
    }

    public TargetConfigException(String message, Throwable cause) {
        super("invalid target config: " + message, cause);
    }
}
