package com.dailystatus.core;

public final class TransportFailureException extends StatusReportException {
    private final String url;
    private final int statusCode;

    public TransportFailureException(String url, int statusCode) {
        super("HTTP " + statusCode + " for " + url);
        this.url = url == null ? "" : url;
        this.statusCode = statusCode;
    }

    public TransportFailureException(String url, String message, Throwable cause) {
        super(message + " for " + url, cause);
        this.url = url == null ? "" : url;
        this.statusCode = -1;
    }

    public String url() {
        return url;
    }

    /**
     * HTTP status of the failed response, or -1 when no response arrived.
     */
    public int statusCode() {
        return statusCode;
    }
}
