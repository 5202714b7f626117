package com.dailystatus.model;

import java.time.OffsetDateTime;
import java.util.Objects;

public record JobRecord(
        String name,
        String url,
        OffsetDateTime timestamp,
        Outcome outcome
) {
    public JobRecord {
        name = name == null ? "" : name;
        url = url == null ? "" : url;
        Objects.requireNonNull(outcome, "outcome");
    }
}
