package com.dailystatus.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small builders for report records used across test packages.
 */
public final class ReportFixtures {
    public static final OffsetDateTime T0 = OffsetDateTime.parse("2026-10-17T06:00:00Z");

    private ReportFixtures() {
    }

    public static WorkflowRun workflowRun(String file, String name, long number, Outcome outcome, Outcome... jobOutcomes) {
        List<JobRecord> jobs = new ArrayList<>();
        for (int i = 0; i < jobOutcomes.length; i++) {
            jobs.add(new JobRecord("job-" + i, "https://github.test/job/" + number + "/" + i, T0.plusMinutes(i + 1), jobOutcomes[i]));
        }
        return new WorkflowRun(file, name, number, "https://github.test/run/" + number, T0, outcome, jobs);
    }

    public static ClientRun clientRun(String clientId, long build, Object... testsAndOutcomes) {
        Map<String, Outcome> tests = new LinkedHashMap<>();
        for (int i = 0; i + 1 < testsAndOutcomes.length; i += 2) {
            tests.put((String) testsAndOutcomes[i], (Outcome) testsAndOutcomes[i + 1]);
        }
        return new ClientRun(clientId, build, T0.minusHours(build % 10), "https://github.test/artifacts/" + clientId + "/" + build, tests);
    }

    public static ClientError clientError(String clientId, long build) {
        return new ClientError(clientId, build, T0.minusHours(1), "https://github.test/logs/" + clientId + "/" + build);
    }

    public static AppveyorBuild appveyorBuild(long id, Outcome outcome, Outcome... jobOutcomes) {
        List<AppveyorJob> jobs = new ArrayList<>();
        for (int i = 0; i < jobOutcomes.length; i++) {
            jobs.add(new AppveyorJob(id, "j" + i, "Image " + i, jobOutcomes[i], "https://ci.test/builds/" + id + "/job/j" + i));
        }
        return new AppveyorBuild(id, "1.0." + id, T0.minusHours(2), outcome, "https://ci.test/builds/" + id, jobs);
    }
}
