package com.transitbot.app;

import com.transitbot.config.Config;
import com.transitbot.data.CsvLightCurveLoader;
import com.transitbot.fit.QuadraticTransitModel;
import com.transitbot.output.PngTransitPlotRenderer;
import com.transitbot.output.SummaryTableWriter;
import com.transitbot.runner.BatchRunner;
import com.transitbot.runner.BatchSummary;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

/**
 * Command-line entry point: generates transit plots and summary tables for a directory of
 * light curves.
 */
public final class TransitBotApplication {
    static final String LOG_DIR_PROPERTY = "transitbot.log.dir";
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new TransitBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        return run(args, Path.of(".").toAbsolutePath().normalize(), true);
    }

    int run(String[] args, Path workingDir, boolean routeStdStreams) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("transitbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("transitbot", options);
            return 0;
        }

        Config config = Config.load(workingDir);
        try {
            applyOverrides(cmd, config);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        // A dry run leaves the output directory untouched, so no file logging either.
        if (routeStdStreams && !cmd.hasOption("dry-run")) {
            installLogRoutingIfNeeded(config);
        }
        if (cmd.hasOption("verbose")) {
            Configurator.setRootLevel(Level.DEBUG);
        }
        logEffectiveConfig(config);

        try {
            BatchRunner runner = new BatchRunner(
                    config,
                    new CsvLightCurveLoader(),
                    new QuadraticTransitModel(),
                    new PngTransitPlotRenderer(config.getInt(Config.PLOT_DPI)),
                    new SummaryTableWriter()
            );
            List<String> files = cmd.hasOption("files") ? Arrays.asList(cmd.getOptionValues("files")) : List.of();
            BatchSummary summary = runner.run(files, cmd.hasOption("dry-run"));
            if (summary.dryRun) {
                System.out.println("Dry run: " + summary.inputs.size() + " file(s) would be processed");
                for (Path p : summary.inputs) {
                    System.out.println("  " + p.getFileName());
                }
            } else {
                System.out.println("Generated " + summary.transitRecords + " transit records");
                if (summary.transitRecords > 0) {
                    System.out.println("Summary saved to " + summary.summaryPath);
                }
            }
            return 0;
        } catch (Exception e) {
            LogManager.getLogger(TransitBotApplication.class).error("Fatal error: {}", e.getMessage(), e);
            return 1;
        }
    }

    static void applyOverrides(CommandLine cmd, Config config) {
        config.override(Config.INPUT_DIR, cmd.getOptionValue("input-dir"));
        config.override(Config.OUTPUT_DIR, cmd.getOptionValue("output-dir"));
        if (cmd.hasOption("dpi")) {
            config.override(Config.PLOT_DPI, String.valueOf(positiveInt(cmd.getOptionValue("dpi"), "dpi")));
        }
        if (cmd.hasOption("threads")) {
            config.override(Config.FIT_THREADS, String.valueOf(positiveInt(cmd.getOptionValue("threads"), "threads")));
        }
        if (cmd.hasOption("skip-fitting")) {
            config.override(Config.FIT_SKIP, "true");
        }
        if (cmd.hasOption("force")) {
            config.override(Config.FIT_FORCE, "true");
        }
    }

    private static void logEffectiveConfig(Config config) {
        Logger log = LogManager.getLogger(TransitBotApplication.class);
        if (!log.isDebugEnabled()) {
            return;
        }
        for (String key : new TreeSet<>(config.defaults().keySet())) {
            log.debug("config {}={} ({})", key, config.getString(key), config.sourceOf(key));
        }
    }

    private static int positiveInt(String raw, String name) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                throw new IllegalArgumentException("--" + name + " must be positive: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: " + raw, e);
        }
    }

    private static void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TransitBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath(Config.OUTPUT_DIR).resolve("log");
                Files.createDirectories(logDir);
                System.setProperty(LOG_DIR_PROPERTY, logDir.toAbsolutePath().toString());

                // The context may already be running with the default log dir; reload it so the file appender moves.
                ((LoggerContext) LogManager.getContext(false)).reconfigure();
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("i").longOpt("input-dir").hasArg().argName("dir").desc("directory containing light-curve CSV files").build());
        options.addOption(Option.builder("o").longOpt("output-dir").hasArg().argName("dir").desc("directory for plots and summary tables").build());
        options.addOption(Option.builder("f").longOpt("files").hasArgs().argName("file").desc("process only these file names from the input directory").build());
        options.addOption(Option.builder().longOpt("dpi").hasArg().argName("n").desc("plot resolution").build());
        options.addOption(Option.builder().longOpt("skip-fitting").desc("plot the data without fitting a model").build());
        options.addOption(Option.builder().longOpt("force").desc("regenerate plots even if they exist or failed before").build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("n").desc("worker threads for per-transit fitting").build());
        options.addOption(Option.builder().longOpt("dry-run").desc("list the files that would be processed and exit").build());
        options.addOption(Option.builder("v").longOpt("verbose").desc("enable debug logging").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }
}
