package com.dailystatus.runner;

import com.dailystatus.app.DailyStatusSettings;
import com.dailystatus.app.properties.GithubProperties;
import com.dailystatus.appveyor.AppveyorBuildFetcher;
import com.dailystatus.appveyor.AppveyorClient;
import com.dailystatus.data.http.HttpClientEx;
import com.dailystatus.github.ClientArtifactReader;
import com.dailystatus.github.ClientResultFetcher;
import com.dailystatus.github.GithubActionsClient;
import com.dailystatus.github.WorkflowRunFetcher;
import com.dailystatus.model.AppveyorBuild;
import com.dailystatus.model.ClientResult;
import com.dailystatus.model.DailyStatusReport;
import com.dailystatus.model.WorkflowRun;
import com.dailystatus.output.RenderedReport;
import com.dailystatus.output.ReportBuilder;
import com.dailystatus.report.DailyStatusAggregator;
import com.dailystatus.report.StatusSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * One batch pass: fetch every source, aggregate, render. Any failure propagates and no report is produced.
 */
public final class DailyStatusRunner {
    private static final Logger LOG = LogManager.getLogger(DailyStatusRunner.class);

    private final WorkflowRunFetcher workflowFetcher;
    private final ClientResultFetcher clientFetcher;
    private final AppveyorBuildFetcher appveyorFetcher;
    private final DailyStatusAggregator aggregator;
    private final ReportBuilder reportBuilder;
    private final Duration window;

    public DailyStatusRunner(
            WorkflowRunFetcher workflowFetcher,
            ClientResultFetcher clientFetcher,
            AppveyorBuildFetcher appveyorFetcher,
            DailyStatusAggregator aggregator,
            ReportBuilder reportBuilder,
            Duration window
    ) {
        this.workflowFetcher = workflowFetcher;
        this.clientFetcher = clientFetcher;
        this.appveyorFetcher = appveyorFetcher;
        this.aggregator = aggregator;
        this.reportBuilder = reportBuilder;
        this.window = window;
    }

    /**
     * Wires the fetchers against real endpoints. The GitHub and AppVeyor clients each get their own
     * {@link HttpClientEx} so neither shares connection state with the other.
     */
    public static DailyStatusRunner create(DailyStatusSettings settings, String githubToken) {
        return create(settings, new HttpClientEx(), new HttpClientEx(), githubToken);
    }

    public static DailyStatusRunner create(
            DailyStatusSettings settings,
            HttpClientEx githubHttp,
            HttpClientEx appveyorHttp,
            String githubToken
    ) {
        GithubProperties github = settings.github();
        GithubActionsClient githubClient = new GithubActionsClient(githubHttp, github, githubToken);
        return new DailyStatusRunner(
                new WorkflowRunFetcher(githubClient, github.getWorkflowRepo(), github.getWorkflows()),
                new ClientResultFetcher(
                        githubClient,
                        new ClientArtifactReader(settings.report().getResultSuffix()),
                        github.getClientsRepo(),
                        github.getClientsWorkflow(),
                        github.getWebBaseUrl()
                ),
                new AppveyorBuildFetcher(new AppveyorClient(appveyorHttp, settings.appveyor())),
                new DailyStatusAggregator(github.getWorkflowRepo(), github.getWorkflows()),
                new ReportBuilder(),
                Duration.ofHours(settings.report().getLookbackHours())
        );
    }

    public RenderedReport run(Instant now, Set<String> knownClients) {
        Instant cutoff = now.minus(window);
        LOG.info("Daily status run started. cutoff={} window={}", cutoff, window);

        List<WorkflowRun> workflowRuns = workflowFetcher.fetch(cutoff);
        List<ClientResult> clientResults = clientFetcher.fetch(cutoff);
        List<AppveyorBuild> appveyorBuilds = appveyorFetcher.fetch(cutoff);

        DailyStatusReport report = aggregator.aggregate(workflowRuns, clientResults, knownClients, appveyorBuilds);
        StatusSummary summary = aggregator.summarize(report);
        if (!summary.absentWorkflows().isEmpty()) {
            LOG.info("Absent workflows: {}", String.join(",", summary.absentWorkflows()));
        }
        if (!summary.absentClients().isEmpty()) {
            LOG.info("Absent clients: {}", String.join(",", summary.absentClients()));
        }
        LOG.info("Tally: {} total={} absent={}", summary.tally(), summary.total(), summary.absentCount());
        return reportBuilder.build(report, summary);
    }
}
