package com.dailystatus.model;

import java.util.Objects;

public record AppveyorJob(
        long buildId,
        String jobId,
        String name,
        Outcome outcome,
        String url
) {
    public AppveyorJob {
        jobId = jobId == null ? "" : jobId;
        name = name == null ? "" : name;
        Objects.requireNonNull(outcome, "outcome");
        url = url == null ? "" : url;
    }
}
