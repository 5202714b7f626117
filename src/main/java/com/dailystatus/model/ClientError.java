package com.dailystatus.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * The handle-result workflow for a client build did not succeed, so no test data exists.
 * Counted as a single {@link Outcome#ERROR}.
 */
public record ClientError(
        String clientId,
        long buildNumber,
        OffsetDateTime timestamp,
        String url
) implements ClientResult {
    public ClientError {
        Objects.requireNonNull(clientId, "clientId");
        url = url == null ? "" : url;
    }
}
