package com.dailystatus.output;

import com.dailystatus.model.AppveyorBuild;
import com.dailystatus.model.AppveyorJob;
import com.dailystatus.model.ClientError;
import com.dailystatus.model.ClientResult;
import com.dailystatus.model.ClientRun;
import com.dailystatus.model.DailyStatusReport;
import com.dailystatus.model.JobRecord;
import com.dailystatus.model.Outcome;
import com.dailystatus.model.WorkflowRun;
import com.dailystatus.report.StatusSummary;
import com.dailystatus.utils.Timestamps;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a report and its summary into the subject line and HTML document. Output depends only on
 * the report content and ordering.
 */
public final class ReportBuilder {
    private static final String TEMPLATE = "daily_status";

    private final TemplateEngine templateEngine;
    private final HtmlPostProcessor htmlPostProcessor;

    public ReportBuilder() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
        this.htmlPostProcessor = new HtmlPostProcessor();
    }

    public RenderedReport build(DailyStatusReport report, StatusSummary summary) {
        String subject = summary.subject();
        Map<String, Object> view = new HashMap<>();
        view.put("subject", subject);
        view.put("githubRuns", githubRows(report.workflowRuns()));
        view.put("clientEntries", clientRows(report.clientResults()));
        view.put("appveyorBuilds", appveyorRows(report.appveyorBuilds()));

        Context context = new Context(Locale.ROOT);
        context.setVariable("view", view);
        String rendered = templateEngine.process(TEMPLATE, context);
        String html = htmlPostProcessor.cleanDocument(rendered);
        return new RenderedReport(subject, html, htmlPostProcessor.plainText(html));
    }

    private List<Map<String, Object>> githubRows(List<WorkflowRun> runs) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (WorkflowRun run : runs) {
            List<Map<String, Object>> jobs = new ArrayList<>();
            for (JobRecord job : run.jobs()) {
                jobs.add(kv(
                        "outcome", badge(job.outcome()),
                        "url", job.url(),
                        "name", job.name(),
                        "timestamp", Timestamps.display(job.timestamp())
                ));
            }
            rows.add(kv(
                    "outcome", badge(run.outcome()),
                    "url", run.url(),
                    "title", run.name() + " #" + run.runNumber(),
                    "timestamp", Timestamps.display(run.timestamp()),
                    "jobs", jobs
            ));
        }
        return rows;
    }

    /**
     * Only the first entry of each client gets {@code id=<clientId>}, so links into the
     * document land on the newest result of that client.
     */
    private List<Map<String, Object>> clientRows(List<ClientResult> results) {
        List<Map<String, Object>> rows = new ArrayList<>();
        Set<String> anchored = new HashSet<>();
        for (ClientResult result : results) {
            String anchor = anchored.add(result.clientId()) ? result.clientId() : null;
            String title = result.clientId() + " #" + result.buildNumber();
            String timestamp = Timestamps.display(result.timestamp());
            if (result instanceof ClientRun run) {
                List<Map<String, Object>> tests = new ArrayList<>();
                for (Map.Entry<String, Outcome> test : run.tests().entrySet()) {
                    tests.add(kv("outcome", badge(test.getValue()), "name", test.getKey()));
                }
                rows.add(kv(
                        "anchor", anchor,
                        "error", false,
                        "title", title,
                        "url", run.artifactUrl(),
                        "timestamp", timestamp,
                        "tests", tests
                ));
            } else if (result instanceof ClientError error) {
                rows.add(kv(
                        "anchor", anchor,
                        "error", true,
                        "outcome", badge(Outcome.ERROR),
                        "title", title,
                        "url", error.url(),
                        "timestamp", timestamp,
                        "tests", List.of()
                ));
            } else {
                throw new IllegalArgumentException("unsupported client result: " + result.getClass().getName());
            }
        }
        return rows;
    }

    private List<Map<String, Object>> appveyorRows(List<AppveyorBuild> builds) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (AppveyorBuild build : builds) {
            List<Map<String, Object>> jobs = new ArrayList<>();
            for (AppveyorJob job : build.jobs()) {
                jobs.add(kv("outcome", badge(job.outcome()), "url", job.url(), "name", job.name()));
            }
            rows.add(kv(
                    "outcome", badge(build.outcome()),
                    "url", build.url(),
                    "version", build.version(),
                    "timestamp", Timestamps.display(build.timestamp()),
                    "jobs", jobs
            ));
        }
        return rows;
    }

    static Map<String, Object> badge(Outcome outcome) {
        switch (outcome) {
            case PASS:
                return kv("style", "color: green", "text", "PASS");
            case FAIL:
                return kv("style", "color: red", "text", "FAIL");
            case ERROR:
                return kv("style", "color: red; font-weight: bold", "text", "ERROR");
            default:
                return kv("style", "color: grey", "text", "\u2014");
        }
    }

    private static Map<String, Object> kv(Object... values) {
        Map<String, Object> out = new HashMap<>();
        for (int i = 0; i + 1 < values.length; i += 2) out.put(String.valueOf(values[i]), values[i + 1]);
        return out;
    }
}
