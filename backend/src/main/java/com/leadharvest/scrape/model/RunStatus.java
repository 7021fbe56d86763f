package com.leadharvest.scrape.model;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
