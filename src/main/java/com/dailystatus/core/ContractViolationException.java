package com.dailystatus.core;

/**
 * An upstream source broke an invariant the report depends on,
 * e.g. a result branch not named {@code result-<client>-<build>}.
 */
public final class ContractViolationException extends StatusReportException {

    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
