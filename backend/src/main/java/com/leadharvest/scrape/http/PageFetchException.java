package com.leadharvest.scrape.http;

import com.leadharvest.scrape.model.FetchFailureKind;

public class PageFetchException extends RuntimeException {
    private final FetchFailureKind kind;
    private final String url;
    private final int statusCode;

    public PageFetchException(FetchFailureKind kind, String url, String message) {
        this(kind, url, 0, message, null);
    }

    public PageFetchException(FetchFailureKind kind, String url, String message, Throwable cause) {
        this(kind, url, 0, message, cause);
    }

    public PageFetchException(FetchFailureKind kind, String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
        this.statusCode = statusCode;
    }

    public FetchFailureKind getKind() {
        return kind;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
