package com.leadharvest.scrape.model;

public enum FetchFailureKind {
    DNS,
    CONNECTION,
    TIMEOUT,
    HTTP_STATUS,
    INVALID_URL,
    BROWSER
}
