package com.leadharvest.sync.client;

public class CrmApiException extends RuntimeException {
    static final int MAX_BODY_LENGTH = 500;

    private final int statusCode;
    private final String responseBody;

    public CrmApiException(int statusCode, String responseBody) {
        super("CRM API error " + statusCode + ": " + truncate(responseBody));
        this.statusCode = statusCode;
        this.responseBody = truncate(responseBody);
    }

    public CrmApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = "";
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_BODY_LENGTH ? body : body.substring(0, MAX_BODY_LENGTH);
    }
}
