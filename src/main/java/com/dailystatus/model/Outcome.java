package com.dailystatus.model;

import com.dailystatus.core.UnrecognizedStatusException;

/**
 * Shared outcome taxonomy every source status is normalized into.
 * Unknown statuses are rejected rather than mapped to a default.
 */
public enum Outcome {
    PASS("PASSED"),
    FAIL("FAILED"),
    ERROR("ERRORED"),
    INCOMPLETE("INCOMPLETE");

    private final String label;

    Outcome(String label) {
        this.label = label;
    }

    /**
     * Label used in the report subject, e.g. {@code 3 FAILED}.
     */
    public String label() {
        return label;
    }

    /**
     * Maps a GitHub Actions run or job conclusion.
     */
    public static Outcome fromConclusion(String conclusion) {
        if (conclusion == null) {
            throw new UnrecognizedStatusException("GitHub workflow conclusion", null);
        }
        switch (conclusion) {
            case "success":
                return PASS;
            case "failure":
                return FAIL;
            case "timed_out":
                return ERROR;
            case "neutral":
            case "action_required":
            case "cancelled":
            case "skipped":
            case "stale":
                return INCOMPLETE;
            default:
                throw new UnrecognizedStatusException("GitHub workflow conclusion", conclusion);
        }
    }

    public static Outcome fromAppveyorStatus(String status) {
        if (status == null) {
            throw new UnrecognizedStatusException("Appveyor status", null);
        }
        switch (status) {
            case "success":
                return PASS;
            case "failed":
                return FAIL;
            case "cancelled":
                return INCOMPLETE;
            default:
                throw new UnrecognizedStatusException("Appveyor status", status);
        }
    }

    /**
     * Per-test return code written by a client: zero passes, anything else fails.
     */
    public static Outcome fromReturnCode(int returnCode) {
        return returnCode == 0 ? PASS : FAIL;
    }
}
