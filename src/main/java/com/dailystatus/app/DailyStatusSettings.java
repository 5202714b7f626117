package com.dailystatus.app;

import com.dailystatus.app.properties.AppveyorProperties;
import com.dailystatus.app.properties.EmailProperties;
import com.dailystatus.app.properties.GithubProperties;
import com.dailystatus.app.properties.MailProperties;
import com.dailystatus.app.properties.ReportProperties;
import com.dailystatus.config.Config;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view over {@link Config}, bound group by group with the Spring Boot binder.
 */
public final class DailyStatusSettings {
    private final Config config;
    private final GithubProperties github;
    private final AppveyorProperties appveyor;
    private final ReportProperties report;
    private final EmailProperties email;
    private final MailProperties mail;

    private DailyStatusSettings(
            Config config,
            GithubProperties github,
            AppveyorProperties appveyor,
            ReportProperties report,
            EmailProperties email,
            MailProperties mail
    ) {
        this.config = config;
        this.github = github;
        this.appveyor = appveyor;
        this.report = report;
        this.email = email;
        this.mail = mail;
    }

    public static DailyStatusSettings bind(Config config) {
        Binder binder = new Binder(new MapConfigurationPropertySource(config.asMap()));
        GithubProperties github;
        AppveyorProperties appveyor;
        ReportProperties report;
        EmailProperties email;
        MailProperties mail;
        try {
            github = binder.bind("github", GithubProperties.class).orElseGet(GithubProperties::new);
            appveyor = binder.bind("appveyor", AppveyorProperties.class).orElseGet(AppveyorProperties::new);
            report = binder.bind("report", ReportProperties.class).orElseGet(ReportProperties::new);
            email = binder.bind("email", EmailProperties.class).orElseGet(EmailProperties::new);
            mail = binder.bind("mail", MailProperties.class).orElseGet(MailProperties::new);
        } catch (BindException e) {
            throw new IllegalArgumentException("invalid config: " + e.getMessage(), e);
        }

        github.setWorkflows(nonBlank(github.getWorkflows()));
        if (github.getWorkflows().isEmpty()) {
            throw new IllegalArgumentException("missing required config: github.workflows");
        }
        if (report.getLookbackHours() <= 0) {
            throw new IllegalArgumentException("report.lookback-hours must be positive: " + report.getLookbackHours());
        }
        return new DailyStatusSettings(config, github, appveyor, report, email, mail);
    }

    private static List<String> nonBlank(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    out.add(value.trim());
                }
            }
        }
        return out;
    }

    public Config config() {
        return config;
    }

    public GithubProperties github() {
        return github;
    }

    public AppveyorProperties appveyor() {
        return appveyor;
    }

    public ReportProperties report() {
        return report;
    }

    public EmailProperties email() {
        return email;
    }

    public MailProperties mail() {
        return mail;
    }

    public Path clientsFile() {
        return config.workingDir().resolve(report.getClientsFile()).normalize();
    }
}
