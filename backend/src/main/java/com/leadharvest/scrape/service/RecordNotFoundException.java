package com.leadharvest.scrape.service;

public class RecordNotFoundException extends RuntimeException {
    public RecordNotFoundException(long recordId) {
        super("Record not found: " + recordId);
    }
}
