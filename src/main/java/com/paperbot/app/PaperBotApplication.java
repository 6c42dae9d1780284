package com.paperbot.app;

import com.paperbot.config.Config;
import com.paperbot.config.ConfigurationException;
import com.paperbot.config.DigestSettings;
import com.paperbot.core.CandidateSelector;
import com.paperbot.data.arxiv.ArxivFeedSource;
import com.paperbot.data.http.HttpClientEx;
import com.paperbot.output.DiscordWebhookSink;
import com.paperbot.output.DryRunSink;
import com.paperbot.output.TransportSink;
import com.paperbot.runner.DigestOutcome;
import com.paperbot.runner.DigestRunner;
import com.paperbot.runner.Sleeper;
import com.paperbot.state.DeliveryLedger;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;

public final class PaperBotApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new PaperBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("paperbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("paperbot", options);
            return 0;
        }

        Path workingDir = Path.of(cmd.getOptionValue("config-dir", ".")).toAbsolutePath().normalize();
        Config config;
        try {
            config = Config.load(workingDir);
        } catch (ConfigurationException e) {
            System.err.println("FATAL: " + e.getMessage());
            return 1;
        }
        installLogRoutingIfNeeded(config);
        Logger logger = LogManager.getLogger(PaperBotApplication.class);

        try {
            DigestSettings settings = DigestSettings.from(config, System.getenv(), cmd.hasOption("dry-run"));
            DigestRunner runner = buildRunner(settings, Clock.systemUTC());
            DigestOutcome outcome = runner.run(cmd.hasOption("dry-run") ? "cli-dry-run" : "cli");
            logger.info("done: selected={} messages_sent={} committed={}",
                    outcome.selectedCount(), outcome.sentUnits(), outcome.committed());
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Execution interrupted", e);
            return 1;
        } catch (Exception e) {
            logger.error("Execution failed", e);
            return 1;
        }
    }

    DigestRunner buildRunner(DigestSettings settings, Clock clock) {
        HttpClientEx arxivHttp = new HttpClientEx(settings.arxivUserAgent);
        TransportSink sink = settings.dryRun
                ? new DryRunSink(settings.dryRunDir, clock.instant())
                : new DiscordWebhookSink(new HttpClientEx(null), settings.webhookUrl,
                settings.maxContentLength, settings.discordTimeoutSec);
        return new DigestRunner(
                settings,
                new ArxivFeedSource(arxivHttp, settings),
                sink,
                new DeliveryLedger(settings.ledgerPath, settings.maxDeliveredIds),
                new CandidateSelector(new Random()),
                clock,
                Sleeper.SYSTEM,
                LogManager.getLogger(DigestRunner.class)
        );
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        options.addOption(Option.builder().longOpt("dry-run")
                .desc("Write messages under discord.dry_run.dir instead of posting; the ledger is not updated")
                .build());
        options.addOption(Option.builder().longOpt("config-dir").hasArg().argName("dir")
                .desc("Directory holding config.properties (default: working directory)")
                .build());
        return options;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (PaperBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("paperbot.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(PaperBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }
}
