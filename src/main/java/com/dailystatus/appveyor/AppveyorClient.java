package com.dailystatus.appveyor;

import com.dailystatus.app.properties.AppveyorProperties;
import com.dailystatus.core.TransportFailureException;
import com.dailystatus.data.http.HttpClientEx;
import com.dailystatus.utils.JsonFields;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Minimal AppVeyor project API client: build history and build detail.
 */
public class AppveyorClient {
    private static final Logger LOG = LogManager.getLogger(AppveyorClient.class);
    private static final Map<String, String> HEADERS = Map.of("Accept", "application/json");

    private final HttpClientEx http;
    private final String baseUrl;
    private final String project;
    private final int recordsNumber;
    private final int timeoutSec;

    public AppveyorClient(HttpClientEx http, AppveyorProperties properties) {
        this.http = http;
        this.baseUrl = properties.getBaseUrl() == null ? "" : properties.getBaseUrl().trim().replaceAll("/+$", "");
        this.project = properties.getProject();
        this.recordsNumber = Math.max(1, properties.getRecordsNumber());
        this.timeoutSec = Math.max(5, properties.getTimeoutSec());
    }

    /**
     * Build history, newest first. The next page is requested with {@code startBuildId} set to the
     * last build id of the previous page, until a page comes back empty.
     */
    public Iterator<JSONObject> history() {
        return new HistoryIterator();
    }

    public JSONObject buildDetail(String version) {
        String encoded = URLEncoder.encode(version, StandardCharsets.UTF_8).replace("+", "%20");
        return getJson(baseUrl + "/api/projects/" + project + "/build/" + encoded);
    }

    public String buildUrl(long buildId) {
        return baseUrl + "/project/" + project + "/builds/" + buildId;
    }

    public String jobUrl(long buildId, String jobId) {
        return buildUrl(buildId) + "/job/" + jobId;
    }

    private JSONObject getJson(String url) {
        String body = http.getText(url, timeoutSec, HEADERS);
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new TransportFailureException(url, "unparseable response: " + e.getMessage(), e);
        }
    }

    private final class HistoryIterator implements Iterator<JSONObject> {
        private final Deque<JSONObject> buffer = new ArrayDeque<>();
        private Long startBuildId;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
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
            String url = baseUrl + "/api/projects/" + project + "/history?recordsNumber=" + recordsNumber;
            if (startBuildId != null) {
                url += "&startBuildId=" + startBuildId;
            }
            LOG.debug("GET {}", url);
            List<JSONObject> builds = JsonFields.objects(getJson(url), "builds");
            if (builds.isEmpty()) {
                exhausted = true;
                return;
            }
            buffer.addAll(builds);
            startBuildId = JsonFields.requireLong(builds.get(builds.size() - 1), "buildId");
        }
    }
}
