package com.dailystatus.github;

import com.dailystatus.model.JobRecord;
import com.dailystatus.model.Outcome;
import com.dailystatus.model.WorkflowRun;
import com.dailystatus.utils.JsonFields;
import com.dailystatus.utils.Timestamps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Collects scheduled and manually dispatched runs of the tracked workflow files.
 *
 * <p>Runs are listed newest first, so the scan of a workflow stops at the first run created at or
 * before the cutoff. If GitHub ever returns runs out of order this must become a full filter.
 */
public final class WorkflowRunFetcher {
    private static final Logger LOG = LogManager.getLogger(WorkflowRunFetcher.class);
    private static final Set<String> TRIGGERS = Set.of("schedule", "workflow_dispatch");

    private final GithubActionsClient client;
    private final String repo;
    private final List<String> workflowFiles;

    public WorkflowRunFetcher(GithubActionsClient client, String repo, List<String> workflowFiles) {
        this.client = client;
        this.repo = repo;
        this.workflowFiles = workflowFiles == null ? List.of() : List.copyOf(workflowFiles);
    }

    public List<WorkflowRun> fetch(Instant cutoff) {
        List<WorkflowRun> out = new ArrayList<>();
        for (String file : workflowFiles) {
            String name = client.workflowName(repo, file);
            int before = out.size();
            Iterator<JSONObject> runs = client.workflowRuns(repo, file);
            while (runs.hasNext()) {
                JSONObject run = runs.next();
                String status = JsonFields.optText(run, "status");
                String event = JsonFields.optText(run, "event");
                if (!"completed".equals(status) || !TRIGGERS.contains(event)) {
                    LOG.debug("skip run id={} file={} status={} event={}", run.opt("id"), file, status, event);
                    continue;
                }
                OffsetDateTime created = Timestamps.parseUtc(JsonFields.optText(run, "created_at"), "created_at");
                if (!created.toInstant().isAfter(cutoff)) {
                    break;
                }
                out.add(toWorkflowRun(file, name, run, created));
            }
            LOG.info("GitHub workflow {}: {} run(s) in window", file, out.size() - before);
        }
        return out;
    }

    private WorkflowRun toWorkflowRun(String file, String name, JSONObject run, OffsetDateTime created) {
        List<JobRecord> jobs = new ArrayList<>();
        for (JSONObject job : client.jobs(JsonFields.requireString(run, "jobs_url"))) {
            jobs.add(new JobRecord(
                    JsonFields.optText(job, "name"),
                    JsonFields.optText(job, "html_url"),
                    Timestamps.parseUtc(JsonFields.optText(job, "started_at"), "started_at"),
                    Outcome.fromConclusion(JsonFields.optText(job, "conclusion"))
            ));
        }
        return new WorkflowRun(
                file,
                name,
                JsonFields.requireLong(run, "run_number"),
                JsonFields.optText(run, "html_url"),
                created,
                Outcome.fromConclusion(JsonFields.optText(run, "conclusion")),
                jobs
        );
    }
}
