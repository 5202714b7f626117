package com.dailystatus.github;

import com.dailystatus.app.properties.GithubProperties;
import com.dailystatus.core.TransportFailureException;
import com.dailystatus.data.http.HttpClientEx;
import com.dailystatus.utils.JsonFields;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Read-only GitHub Actions REST client: workflows, their runs, jobs and artifacts.
 */
public class GithubActionsClient {
    private static final Logger LOG = LogManager.getLogger(GithubActionsClient.class);

    private final HttpClientEx http;
    private final String apiBaseUrl;
    private final int perPage;
    private final int timeoutSec;
    private final Map<String, String> headers;

    public GithubActionsClient(HttpClientEx http, GithubProperties properties, String token) {
        this.http = http;
        this.apiBaseUrl = trimTrailingSlash(properties.getApiBaseUrl());
        this.perPage = Math.max(1, Math.min(100, properties.getPerPage()));
        this.timeoutSec = Math.max(5, properties.getTimeoutSec());
        Map<String, String> h = new LinkedHashMap<>();
        h.put("Accept", "application/vnd.github+json");
        if (token != null && !token.isBlank()) {
            h.put("Authorization", "Bearer " + token.trim());
        }
        this.headers = Map.copyOf(h);
    }

    public String workflowName(String repo, String workflowFile) {
        String url = apiBaseUrl + "/repos/" + repo + "/actions/workflows/" + workflowFile;
        return JsonFields.requireString(getJson(url), "name");
    }

    /**
     * Runs of a workflow file, newest first. Pages are requested only as the caller advances,
     * so breaking out of the iteration stops further requests.
     */
    public Iterator<JSONObject> workflowRuns(String repo, String workflowFile) {
        String base = apiBaseUrl + "/repos/" + repo + "/actions/workflows/" + workflowFile + "/runs";
        return new PagedIterator(base, "workflow_runs");
    }

    public List<JSONObject> jobs(String jobsUrl) {
        List<JSONObject> out = new ArrayList<>();
        new PagedIterator(jobsUrl, "jobs").forEachRemaining(out::add);
        return out;
    }

    public List<JSONObject> artifacts(String artifactsUrl) {
        List<JSONObject> out = new ArrayList<>();
        new PagedIterator(artifactsUrl, "artifacts").forEachRemaining(out::add);
        return out;
    }

    public Path downloadArtifact(String archiveDownloadUrl, Path target) {
        LOG.debug("Downloading artifact {}", archiveDownloadUrl);
        return http.download(archiveDownloadUrl, timeoutSec, headers, target);
    }

    private JSONObject getJson(String url) {
        String body = http.getText(url, timeoutSec, headers);
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new TransportFailureException(url, "unparseable response: " + e.getMessage(), e);
        }
    }

    private static String withQuery(String url, String query) {
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static String trimTrailingSlash(String value) {
        String v = value == null ? "" : value.trim();
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private final class PagedIterator implements Iterator<JSONObject> {
        private final String baseUrl;
        private final String arrayKey;
        private final Deque<JSONObject> buffer = new ArrayDeque<>();
        private int nextPage = 1;
        private long seen;
        private boolean exhausted;

        private PagedIterator(String baseUrl, String arrayKey) {
            this.baseUrl = baseUrl;
            this.arrayKey = arrayKey;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !exhausted) {
                fetchPage();
            }
            return !buffer.isEmpty();
        }

        @Override
        public JSONObject next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private void fetchPage() {
            String url = withQuery(baseUrl, "per_page=" + perPage + "&page=" + nextPage);
            LOG.debug("GET {}", url);
            JSONObject page = getJson(url);
            List<JSONObject> items = JsonFields.objects(page, arrayKey);
            nextPage++;
            seen += items.size();
            buffer.addAll(items);
            long total = page.optLong("total_count", -1L);
            if (items.isEmpty() || (total >= 0 && seen >= total)) {
                exhausted = true;
            }
        }
    }
}
