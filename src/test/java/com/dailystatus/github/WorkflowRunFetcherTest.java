package com.dailystatus.github;

import com.dailystatus.app.properties.GithubProperties;
import com.dailystatus.core.TransportFailureException;
import com.dailystatus.core.UnrecognizedStatusException;
import com.dailystatus.data.http.StubHttpClient;
import com.dailystatus.model.Outcome;
import com.dailystatus.model.WorkflowRun;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowRunFetcherTest {
    private static final String API = "https://api.test";
    private static final String WORKFLOW = API + "/repos/org/repo/actions/workflows/build.yaml";
    private static final Instant CUTOFF = Instant.parse("2026-10-16T12:00:00Z");

    @Test
    void runOutcomeShouldComeFromRunConclusionAndJobsFromTheirOwn() {
        StubHttpClient http = new StubHttpClient()
                .text(WORKFLOW, "{\"name\":\"Build Ubuntu\"}")
                .text(WORKFLOW + "/runs?per_page=2&page=1", page(5,
                        run(1, 301, "completed", "schedule", "success", "2026-10-17T06:00:00Z"),
                        run(2, 302, "completed", "push", "failure", "2026-10-17T05:00:00Z")))
                .text(WORKFLOW + "/runs?per_page=2&page=2", page(5,
                        run(3, 303, "in_progress", "workflow_dispatch", null, "2026-10-17T04:00:00Z"),
                        run(4, 299, "completed", "workflow_dispatch", "failure", "2026-10-16T11:00:00Z")))
                .text(jobsUrl(1) + "?per_page=2&page=1", jobs(
                        job("test (ubuntu)", "success", "2026-10-17T06:01:00Z"),
                        job("test (nfs)", "failure", "2026-10-17T06:02:00Z")));

        List<WorkflowRun> runs = fetcher(http).fetch(CUTOFF);

        assertEquals(1, runs.size());
        WorkflowRun run = runs.get(0);
        assertEquals("build.yaml", run.file());
        assertEquals("Build Ubuntu", run.name());
        assertEquals(301L, run.runNumber());
        assertEquals("https://github.test/org/repo/actions/runs/1", run.url());
        assertEquals(Outcome.PASS, run.outcome());
        assertEquals(2, run.jobs().size());
        assertEquals("test (ubuntu)", run.jobs().get(0).name());
        assertEquals(Outcome.PASS, run.jobs().get(0).outcome());
        assertEquals(Outcome.FAIL, run.jobs().get(1).outcome());
        assertFalse(http.requested.contains(WORKFLOW + "/runs?per_page=2&page=3"), "scan should stop at the first old run");
        assertFalse(http.requested.contains(jobsUrl(2) + "?per_page=2&page=1"), "push runs should not be expanded");
    }

    @Test
    void requestsShouldCarryBearerToken() {
        StubHttpClient http = new StubHttpClient()
                .text(WORKFLOW, "{\"name\":\"Build\"}")
                .text(WORKFLOW + "/runs?per_page=2&page=1", page(0));

        fetcher(http).fetch(CUTOFF);

        assertEquals(2, http.requested.size());
        assertEquals("Bearer tok", http.requestHeaders.get(0).get("Authorization"));
        assertEquals("application/vnd.github+json", http.requestHeaders.get(1).get("Accept"));
    }

    @Test
    void runCreatedExactlyAtCutoffShouldBeExcluded() {
        StubHttpClient http = new StubHttpClient()
                .text(WORKFLOW, "{\"name\":\"Build\"}")
                .text(WORKFLOW + "/runs?per_page=2&page=1", page(2,
                        run(7, 10, "completed", "schedule", "success", "2026-10-16T12:00:00Z"),
                        run(6, 9, "completed", "schedule", "success", "2026-10-17T01:00:00Z")));

        assertTrue(fetcher(http).fetch(CUTOFF).isEmpty());
    }

    @Test
    void timestampWithoutOffsetShouldBeReadAsUtc() {
        StubHttpClient http = new StubHttpClient()
                .text(WORKFLOW, "{\"name\":\"Build\"}")
                .text(WORKFLOW + "/runs?per_page=2&page=1", page(1,
                        run(1, 1, "completed", "schedule", "cancelled", "2026-10-17T06:00:00")))
                .text(jobsUrl(1) + "?per_page=2&page=1", jobs());

        WorkflowRun run = fetcher(http).fetch(CUTOFF).get(0);

        assertEquals(ZoneOffset.UTC, run.timestamp().getOffset());
        assertEquals(Instant.parse("2026-10-17T06:00:00Z"), run.timestamp().toInstant());
        assertEquals(Outcome.INCOMPLETE, run.outcome());
        assertTrue(run.jobs().isEmpty());
    }

    @Test
    void unknownJobConclusionShouldAbort() {
        StubHttpClient http = new StubHttpClient()
                .text(WORKFLOW, "{\"name\":\"Build\"}")
                .text(WORKFLOW + "/runs?per_page=2&page=1", page(1,
                        run(1, 1, "completed", "schedule", "success", "2026-10-17T06:00:00Z")))
                .text(jobsUrl(1) + "?per_page=2&page=1", jobs(job("test", "startup_failure", "2026-10-17T06:01:00Z")));

        UnrecognizedStatusException e = assertThrows(UnrecognizedStatusException.class, () -> fetcher(http).fetch(CUTOFF));
        assertEquals("startup_failure", e.status());
    }

    @Test
    void transportFailureShouldPropagate() {
        StubHttpClient http = new StubHttpClient()
                .text(WORKFLOW, "{\"name\":\"Build\"}")
                .text(WORKFLOW + "/runs?per_page=2&page=1", page(1,
                        run(1, 1, "completed", "schedule", "success", "2026-10-17T06:00:00Z")));

        TransportFailureException e = assertThrows(TransportFailureException.class, () -> fetcher(http).fetch(CUTOFF));
        assertEquals(404, e.statusCode());
        assertEquals(jobsUrl(1) + "?per_page=2&page=1", e.url());
    }

    private static WorkflowRunFetcher fetcher(StubHttpClient http) {
        GithubProperties props = new GithubProperties();
        props.setApiBaseUrl(API + "/");
        props.setPerPage(2);
        GithubActionsClient client = new GithubActionsClient(http, props, "tok");
        return new WorkflowRunFetcher(client, "org/repo", List.of("build.yaml"));
    }

    private static String jobsUrl(long runId) {
        return API + "/repos/org/repo/actions/runs/" + runId + "/jobs";
    }

    static String page(int total, JSONObject... runs) {
        return new JSONObject().put("total_count", total).put("workflow_runs", new JSONArray(List.of(runs))).toString();
    }

    static JSONObject run(long id, long number, String status, String event, String conclusion, String createdAt) {
        return new JSONObject()
                .put("id", id)
                .put("run_number", number)
                .put("status", status)
                .put("event", event)
                .put("conclusion", conclusion == null ? JSONObject.NULL : conclusion)
                .put("created_at", createdAt)
                .put("html_url", "https://github.test/org/repo/actions/runs/" + id)
                .put("jobs_url", jobsUrl(id));
    }

    private static String jobs(JSONObject... jobs) {
        return new JSONObject().put("total_count", jobs.length).put("jobs", new JSONArray(List.of(jobs))).toString();
    }

    private static JSONObject job(String name, String conclusion, String startedAt) {
        return new JSONObject()
                .put("name", name)
                .put("conclusion", conclusion)
                .put("started_at", startedAt)
                .put("html_url", "https://github.test/job/" + name.replace(' ', '_'));
    }
}
