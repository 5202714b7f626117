package com.dailystatus.appveyor;

import com.dailystatus.model.AppveyorBuild;
import com.dailystatus.model.AppveyorJob;
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

/**
 * Collects finished AppVeyor builds inside the lookback window. History is newest first,
 * so the first build finished at or before the cutoff ends the scan, pagination included.
 */
public final class AppveyorBuildFetcher {
    private static final Logger LOG = LogManager.getLogger(AppveyorBuildFetcher.class);

    private final AppveyorClient client;

    public AppveyorBuildFetcher(AppveyorClient client) {
        this.client = client;
    }

    public List<AppveyorBuild> fetch(Instant cutoff) {
        List<AppveyorBuild> out = new ArrayList<>();
        Iterator<JSONObject> history = client.history();
        while (history.hasNext()) {
            JSONObject build = history.next();
            String finishedRaw = JsonFields.optText(build, "finished");
            if (finishedRaw == null) {
                LOG.debug("skip unfinished build id={}", build.opt("buildId"));
                continue;
            }
            OffsetDateTime finished = Timestamps.parseUtc(finishedRaw, "finished");
            if (!finished.toInstant().isAfter(cutoff)) {
                break;
            }
            out.add(toBuild(build));
        }
        LOG.info("Appveyor: {} build(s) in window", out.size());
        return out;
    }

    private AppveyorBuild toBuild(JSONObject build) {
        long buildId = JsonFields.requireLong(build, "buildId");
        String version = JsonFields.requireString(build, "version");
        JSONObject detail = JsonFields.requireObject(client.buildDetail(version), "build");
        List<AppveyorJob> jobs = new ArrayList<>();
        for (JSONObject job : JsonFields.objects(detail, "jobs")) {
            String jobId = JsonFields.requireString(job, "jobId");
            jobs.add(new AppveyorJob(
                    buildId,
                    jobId,
                    JsonFields.optText(job, "name"),
                    Outcome.fromAppveyorStatus(JsonFields.optText(job, "status")),
                    client.jobUrl(buildId, jobId)
            ));
        }
        return new AppveyorBuild(
                buildId,
                version,
                Timestamps.parseUtc(JsonFields.optText(build, "started"), "started"),
                Outcome.fromAppveyorStatus(JsonFields.optText(build, "status")),
                client.buildUrl(buildId),
                jobs
        );
    }
}
