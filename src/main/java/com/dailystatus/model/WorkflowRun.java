package com.dailystatus.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * One scheduled or manually dispatched GitHub Actions run of a tracked workflow file.
 * The run-level outcome is shown in the report; only job outcomes are counted.
 */
public record WorkflowRun(
        String file,
        String name,
        long runNumber,
        String url,
        OffsetDateTime timestamp,
        Outcome outcome,
        List<JobRecord> jobs
) {
    public WorkflowRun {
        Objects.requireNonNull(file, "file");
        name = name == null ? "" : name;
        url = url == null ? "" : url;
        Objects.requireNonNull(outcome, "outcome");
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }
}
