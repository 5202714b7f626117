package com.dailystatus.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything the three sources returned inside the lookback window. Immutable once built.
 */
public record DailyStatusReport(
        List<WorkflowRun> workflowRuns,
        List<ClientResult> clientResults,
        Set<String> knownClients,
        List<AppveyorBuild> appveyorBuilds
) {
    public DailyStatusReport {
        workflowRuns = workflowRuns == null ? List.of() : List.copyOf(workflowRuns);
        clientResults = clientResults == null ? List.of() : List.copyOf(clientResults);
        knownClients = knownClients == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(knownClients));
        appveyorBuilds = appveyorBuilds == null ? List.of() : List.copyOf(appveyorBuilds);
    }
}
