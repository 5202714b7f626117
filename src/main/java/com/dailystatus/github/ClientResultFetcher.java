package com.dailystatus.github;

import com.dailystatus.core.ContractViolationException;
import com.dailystatus.model.ClientError;
import com.dailystatus.model.ClientResult;
import com.dailystatus.model.ClientRun;
import com.dailystatus.model.Outcome;
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
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Correlates runs of the client result-handling workflow with the client build that produced them.
 * Each run is triggered by a push to a branch named {@code result-<clientId>-<buildNumber>}.
 */
public final class ClientResultFetcher {
    private static final Logger LOG = LogManager.getLogger(ClientResultFetcher.class);
    private static final Pattern RESULT_BRANCH = Pattern.compile("result-(.+)-(\\d+)");

    private final GithubActionsClient client;
    private final ClientArtifactReader artifactReader;
    private final String clientsRepo;
    private final String workflowFile;
    private final String webBaseUrl;

    public ClientResultFetcher(
            GithubActionsClient client,
            ClientArtifactReader artifactReader,
            String clientsRepo,
            String workflowFile,
            String webBaseUrl
    ) {
        this.client = client;
        this.artifactReader = artifactReader;
        this.clientsRepo = clientsRepo;
        this.workflowFile = workflowFile;
        this.webBaseUrl = webBaseUrl == null ? "https://github.com" : webBaseUrl.replaceAll("/+$", "");
    }

    public List<ClientResult> fetch(Instant cutoff) {
        List<ClientResult> out = new ArrayList<>();
        Iterator<JSONObject> runs = client.workflowRuns(clientsRepo, workflowFile);
        while (runs.hasNext()) {
            JSONObject run = runs.next();
            if (!"completed".equals(JsonFields.optText(run, "status"))) {
                LOG.debug("skip unfinished result run id={}", run.opt("id"));
                continue;
            }
            OffsetDateTime created = Timestamps.parseUtc(JsonFields.optText(run, "created_at"), "created_at");
            // newest first: everything after this run is older
            if (!created.toInstant().isAfter(cutoff)) {
                break;
            }
            out.add(toClientResult(run, created));
        }
        LOG.info("Client results: {} run(s) in window", out.size());
        return out;
    }

    private ClientResult toClientResult(JSONObject run, OffsetDateTime created) {
        String branch = JsonFields.optText(run, "head_branch");
        Matcher m = RESULT_BRANCH.matcher(branch == null ? "" : branch);
        if (!m.matches()) {
            throw new ContractViolationException("result run branch does not match result-<client>-<build>: " + branch);
        }
        String clientId = m.group(1);
        long buildNumber;
        try {
            buildNumber = Long.parseLong(m.group(2));
        } catch (NumberFormatException e) {
            throw new ContractViolationException("build number out of range in branch " + branch, e);
        }

        if (Outcome.fromConclusion(JsonFields.optText(run, "conclusion")) != Outcome.PASS) {
            LOG.info("Result processing failed for {} #{}", clientId, buildNumber);
            return new ClientError(clientId, buildNumber, created, JsonFields.optText(run, "html_url"));
        }

        List<JSONObject> artifacts = client.artifacts(JsonFields.requireString(run, "artifacts_url"));
        if (artifacts.size() != 1) {
            throw new ContractViolationException("expected exactly one artifact for " + clientId + " #" + buildNumber
                    + ", found " + artifacts.size());
        }
        JSONObject artifact = artifacts.get(0);
        String artifactUrl = webBaseUrl + "/" + clientsRepo
                + "/suites/" + JsonFields.requireString(run, "check_suite_id")
                + "/artifacts/" + JsonFields.requireString(artifact, "id");
        Map<String, Outcome> tests = artifactReader.readOutcomes(
                client,
                JsonFields.requireString(artifact, "archive_download_url")
        );
        return new ClientRun(clientId, buildNumber, created, artifactUrl, tests);
    }
}
