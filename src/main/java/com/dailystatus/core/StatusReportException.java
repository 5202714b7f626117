package com.dailystatus.core;

/**
 * Base type for every failure that aborts a daily status run.
 */
public abstract class StatusReportException extends RuntimeException {

    protected StatusReportException(String message) {
        super(message);
    }

    protected StatusReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
