package com.dailystatus.core;

/**
 * A source reported a status string outside its known vocabulary.
 */
public final class UnrecognizedStatusException extends StatusReportException {
    private final String vocabulary;
    private final String status;

    public UnrecognizedStatusException(String vocabulary, String status) {
        super("Unknown " + vocabulary + ": " + (status == null ? "null" : "'" + status + "'"));
        this.vocabulary = vocabulary == null ? "" : vocabulary;
        this.status = status;
    }

    public String vocabulary() {
        return vocabulary;
    }

    public String status() {
        return status;
    }
}
