package com.dailystatus.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ClientRun(
        String clientId,
        long buildNumber,
        OffsetDateTime timestamp,
        String artifactUrl,
        Map<String, Outcome> tests
) implements ClientResult {
    public ClientRun {
        Objects.requireNonNull(clientId, "clientId");
        artifactUrl = artifactUrl == null ? "" : artifactUrl;
        // archive order is kept for display
        tests = tests == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tests));
    }
}
