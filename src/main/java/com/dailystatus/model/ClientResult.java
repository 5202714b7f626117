package com.dailystatus.model;

import java.time.OffsetDateTime;

/**
 * A result bundle uploaded by a local client: either the parsed test outcomes
 * ({@link ClientRun}) or a failure of the result-processing workflow itself ({@link ClientError}).
 */
public interface ClientResult {

    String clientId();

    long buildNumber();

    OffsetDateTime timestamp();
}
