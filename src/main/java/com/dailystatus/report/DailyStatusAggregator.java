package com.dailystatus.report;

import com.dailystatus.model.AppveyorBuild;
import com.dailystatus.model.AppveyorJob;
import com.dailystatus.model.ClientError;
import com.dailystatus.model.ClientResult;
import com.dailystatus.model.ClientRun;
import com.dailystatus.model.DailyStatusReport;
import com.dailystatus.model.JobRecord;
import com.dailystatus.model.Outcome;
import com.dailystatus.model.WorkflowRun;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges the three sources into one report and derives its tally and absent sources.
 */
public final class DailyStatusAggregator {
    private final String workflowRepo;
    private final List<String> expectedWorkflows;

    public DailyStatusAggregator(String workflowRepo, List<String> expectedWorkflows) {
        this.workflowRepo = workflowRepo;
        this.expectedWorkflows = expectedWorkflows == null ? List.of() : List.copyOf(expectedWorkflows);
    }

    public DailyStatusReport aggregate(
            List<WorkflowRun> workflowRuns,
            List<ClientResult> clientResults,
            Set<String> knownClients,
            List<AppveyorBuild> appveyorBuilds
    ) {
        return new DailyStatusReport(workflowRuns, clientResults, knownClients, appveyorBuilds);
    }

    /**
     * Counts job outcomes (not run outcomes) for GitHub and AppVeyor, per-test outcomes for client
     * runs, and one ERROR per failed result processing.
     */
    public StatusSummary summarize(DailyStatusReport report) {
        Map<Outcome, Integer> tally = new LinkedHashMap<>();
        for (WorkflowRun run : report.workflowRuns()) {
            for (JobRecord job : run.jobs()) {
                tally.merge(job.outcome(), 1, Integer::sum);
            }
        }
        for (ClientResult result : report.clientResults()) {
            if (result instanceof ClientRun run) {
                for (Outcome outcome : run.tests().values()) {
                    tally.merge(outcome, 1, Integer::sum);
                }
            } else if (result instanceof ClientError) {
                tally.merge(Outcome.ERROR, 1, Integer::sum);
            }
        }
        for (AppveyorBuild build : report.appveyorBuilds()) {
            for (AppveyorJob job : build.jobs()) {
                tally.merge(job.outcome(), 1, Integer::sum);
            }
        }
        return new StatusSummary(workflowRepo, tally, absentWorkflows(report), absentClients(report));
    }

    private List<String> absentWorkflows(DailyStatusReport report) {
        Set<String> seen = new HashSet<>();
        for (WorkflowRun run : report.workflowRuns()) {
            seen.add(run.file());
        }
        List<String> absent = new ArrayList<>();
        for (String file : expectedWorkflows) {
            if (!seen.contains(file) && !absent.contains(file)) {
                absent.add(file);
            }
        }
        return absent;
    }

    private List<String> absentClients(DailyStatusReport report) {
        Set<String> seen = new HashSet<>();
        for (ClientResult result : report.clientResults()) {
            seen.add(result.clientId());
        }
        Set<String> absent = new TreeSet<>(report.knownClients());
        absent.removeAll(seen);
        return new ArrayList<>(absent);
    }
}
