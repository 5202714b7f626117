package com.dailystatus.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

public record AppveyorBuild(
        long id,
        String version,
        OffsetDateTime timestamp,
        Outcome outcome,
        String url,
        List<AppveyorJob> jobs
) {
    public AppveyorBuild {
        version = version == null ? "" : version;
        Objects.requireNonNull(outcome, "outcome");
        url = url == null ? "" : url;
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }
}
