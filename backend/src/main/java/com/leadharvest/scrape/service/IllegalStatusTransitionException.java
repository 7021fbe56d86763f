package com.leadharvest.scrape.service;

import com.leadharvest.scrape.model.RecordStatus;

public class IllegalStatusTransitionException extends RuntimeException {
    public IllegalStatusTransitionException(long recordId, RecordStatus from, RecordStatus to) {
        super("Record " + recordId + " cannot move from " + from + " to " + to);
    }
}
