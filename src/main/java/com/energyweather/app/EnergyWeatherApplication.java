package com.energyweather.app;

import com.energyweather.recon.config.Config;
import com.energyweather.recon.ingest.IngestOrder;
import com.energyweather.recon.join.JoinMode;
import com.energyweather.recon.model.FileRejection;
import com.energyweather.recon.model.PipelineRunOutcome;
import com.energyweather.recon.model.RunStatus;
import com.energyweather.recon.runner.PipelineException;
import com.energyweather.recon.runner.PipelineRunner;
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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class EnergyWeatherApplication {
    private static final String APP_NAME = "energy-weather-recon";
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private final Path workingDir;
    private final boolean routeLogs;

    public EnergyWeatherApplication() {
        this(Path.of(".").toAbsolutePath().normalize(), true);
    }

    EnergyWeatherApplication(Path workingDir, boolean routeLogs) {
        this.workingDir = workingDir;
        this.routeLogs = routeLogs;
    }

    public static void main(String[] args) {
        int exit = new EnergyWeatherApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args == null ? new String[0] : args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp(APP_NAME, options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp(APP_NAME, options);
            return EXIT_OK;
        }

        Config config = Config.load(workingDir).withOverrides(cliOverrides(cmd));
        try {
            IngestOrder.parse(config.getString("ingest.order"));
            JoinMode.parse(config.getString("join.mode"));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (routeLogs) {
            installLogRoutingIfNeeded(config);
        }

        try {
            PipelineRunOutcome outcome = new PipelineRunner(config).run();
            printOutcome(outcome);
            return EXIT_OK;
        } catch (PipelineException e) {
            logger().error("FATAL: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (RuntimeException e) {
            logger().error("FATAL: unexpected failure: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    static Map<String, String> cliOverrides(CommandLine cmd) {
        Map<String, String> overrides = new LinkedHashMap<>();
        putIfPresent(cmd, "raw-dir", "paths.raw_dir", overrides);
        putIfPresent(cmd, "processed-dir", "paths.processed_dir", overrides);
        putIfPresent(cmd, "report-dir", "paths.report_dir", overrides);
        putIfPresent(cmd, "join-mode", "join.mode", overrides);
        putIfPresent(cmd, "ingest-order", "ingest.order", overrides);
        return overrides;
    }

    private static void putIfPresent(CommandLine cmd, String option, String key, Map<String, String> out) {
        String value = cmd.getOptionValue(option);
        if (value != null && !value.trim().isEmpty()) {
            out.put(key, value.trim());
        }
    }

    private void printOutcome(PipelineRunOutcome outcome) {
        if (outcome.status == RunStatus.NOTHING_TO_DO) {
            System.out.println(String.format(Locale.US,
                    "Nothing to do. files_scanned=%d rejected=%d",
                    outcome.filesScanned, outcome.rejections.size()));
            return;
        }
        System.out.println(String.format(Locale.US,
                "Run completed. files=%d parsed=%d rejected=%d rows_dropped=%d energy_rows=%d weather_rows=%d merged_rows=%d",
                outcome.filesScanned,
                outcome.filesParsed,
                outcome.rejections.size(),
                outcome.rowsDropped,
                outcome.energyRows,
                outcome.weatherRows,
                outcome.mergedRows));
        for (FileRejection rejection : outcome.rejections) {
            System.out.println("  rejected " + rejection);
        }
        if (outcome.mergedPath != null) {
            System.out.println("Merged output: " + outcome.mergedPath);
        }
        outcome.reportPaths.forEach((kind, path) -> System.out.println("Quality report (" + kind.prefix() + "): " + path));
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (EnergyWeatherApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            Path logDir = config.getPath("outputs.dir").resolve("log");
            try {
                Files.createDirectories(logDir);
            } catch (IOException e) {
                System.err.println("WARN: failed to create log dir " + logDir + ": " + e.getMessage());
                return;
            }
            System.setProperty("energyweather.log.dir", logDir.toAbsolutePath().toString());

            // Log4j context must exist before the swap so the console appender keeps the real streams.
            LogManager.getLogger(EnergyWeatherApplication.class);
            System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
            System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

            LOG_ROUTE_INSTALLED = true;
            System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
        }
    }

    // Resolved on use: the log directory property must be set before Log4j reads its configuration.
    private static Logger logger() {
        return LogManager.getLogger(EnergyWeatherApplication.class);
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("raw-dir").hasArg().argName("dir").desc("raw input directory (paths.raw_dir)").build());
        options.addOption(Option.builder().longOpt("processed-dir").hasArg().argName("dir").desc("master snapshot and merged output directory (paths.processed_dir)").build());
        options.addOption(Option.builder().longOpt("report-dir").hasArg().argName("dir").desc("quality report directory (paths.report_dir)").build());
        options.addOption(Option.builder().longOpt("join-mode").hasArg().argName("mode").desc("inner | left_on_energy").build());
        options.addOption(Option.builder().longOpt("ingest-order").hasArg().argName("order").desc("lexical | modified_time").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
