package com.dailystatus.app;

import com.dailystatus.clients.ClientRegistry;
import com.dailystatus.config.Config;
import com.dailystatus.core.StatusReportException;
import com.dailystatus.output.Mailer;
import com.dailystatus.output.RenderedReport;
import com.dailystatus.output.ReportWriter;
import com.dailystatus.runner.DailyStatusRunner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

public final class DailyStatusApplication {
    private static final Logger LOG = LogManager.getLogger(DailyStatusApplication.class);

    private final Path workingDir;
    private final Map<String, String> env;
    private final Clock clock;
    private final BiFunction<DailyStatusSettings, String, DailyStatusRunner> runnerFactory;
    private final PrintStream out;

    public DailyStatusApplication() {
        this(
                Path.of(".").toAbsolutePath().normalize(),
                System.getenv(),
                Clock.systemUTC(),
                DailyStatusRunner::create,
                System.out
        );
    }

    DailyStatusApplication(
            Path workingDir,
            Map<String, String> env,
            Clock clock,
            BiFunction<DailyStatusSettings, String, DailyStatusRunner> runnerFactory,
            PrintStream out
    ) {
        this.workingDir = workingDir;
        this.env = env;
        this.clock = clock;
        this.runnerFactory = runnerFactory;
        this.out = out;
    }

    public static void main(String[] args) {
        int exit = new DailyStatusApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("daily-status [options] <outfile>", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("daily-status [options] <outfile>", options);
            return 0;
        }

        Path outfile = resolveOutfile(cmd);
        if (outfile == null) {
            new HelpFormatter().printHelp("daily-status [options] <outfile>", options);
            System.err.println("ERROR: output file is required.");
            return 2;
        }

        DailyStatusSettings settings;
        Set<String> knownClients;
        String token;
        try {
            Config config = cmd.hasOption("config")
                    ? Config.load(workingDir, workingDir.resolve(cmd.getOptionValue("config")).normalize())
                    : Config.load(workingDir);
            settings = DailyStatusSettings.bind(config);
            token = env.get(settings.github().getTokenEnv());
            if (token == null || token.isBlank()) {
                System.err.println("ERROR: environment variable " + settings.github().getTokenEnv() + " is not set.");
                return 2;
            }
            knownClients = ClientRegistry.loadClientIds(settings.clientsFile());
        } catch (IllegalArgumentException | IllegalStateException | IOException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        try {
            DailyStatusRunner runner = runnerFactory.apply(settings, token.trim());
            RenderedReport report = runner.run(clock.instant(), knownClients);
            Path written = new ReportWriter().writeHtml(outfile, report);
            LOG.info("Report written. file={}", written);
            out.println(report.subject());
            if (cmd.hasOption("mail")) {
                Mailer mailer = new Mailer();
                mailer.send(mailer.loadSettings(settings.config(), settings.email(), settings.mail()), report);
            }
            return 0;
        } catch (StatusReportException e) {
            LOG.error("Daily status aborted: {}", e.getMessage(), e);
            return 1;
        } catch (Exception e) {
            LOG.error("FATAL: {}", e.getMessage(), e);
            return 1;
        }
    }

    private Path resolveOutfile(CommandLine cmd) {
        String raw = cmd.getOptionValue("output");
        if (raw == null) {
            List<String> rest = cmd.getArgList();
            raw = rest.isEmpty() ? null : rest.get(0);
        }
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        return workingDir.resolve(raw.trim()).normalize();
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("o").longOpt("output").hasArg().argName("file")
                .desc("File receiving the HTML report body").build());
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("file")
                .desc("Override properties file (default ./config.properties)").build());
        options.addOption(Option.builder().longOpt("mail")
                .desc("Also deliver the report by mail (see email.* / mail.* config)").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }
}
