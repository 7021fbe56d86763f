package com.leadharvest.scrape.model;

public enum RunTrigger {
    SCHEDULED,
    MANUAL
}
