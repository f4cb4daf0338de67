package io.tally.cli;

import io.tally.api.config.ReporterConfig;
import io.tally.api.engine.TestEngine;
import io.tally.api.error.ReporterConfigurationException;
import io.tally.api.error.ReporterException;
import io.tally.api.error.TestFailuresException;
import io.tally.core.config.ReporterConfigLoader;
import io.tally.core.replay.EventLogEngine;
import io.tally.core.runtime.JUnitReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * CLI command: tally [OPTIONS] [EVENT_LOG...]
 * <p>
 * Replays recorded test events and writes one JUnit XML report per module.
 * Without event logs, every {@code *.jsonl} file in {@code --events-dir} is replayed.
 * Options given on the command line override the ones read from {@code --config}.
 */
@Command(name = "tally", mixinStandardHelpOptions = true, version = "tally 0.1.0",
        description = "Write JUnit XML reports from recorded test events")
public class TallyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TallyCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_TEST_FAILURES = 1;
    public static final int EXIT_ERROR = 2;

    static final String DEFAULT_CONFIG = "tally.json";

    @Spec
    CommandSpec spec;

    @Option(names = {"-o", "--output"}, description = "Directory to write the XML reports to")
    String output;

    @Option(names = {"-c", "--config"}, description = "JSON config file (default: ${DEFAULT-VALUE} if present)",
            defaultValue = DEFAULT_CONFIG)
    Path config;

    @Option(names = "--testspec", description = "Only report the test with this name")
    String testspec;

    @Option(names = "--test-full-spec", description = "Only report the test named <module>.<test>")
    String testFullSpec;

    @Option(names = "--events-dir", description = "Directory searched for event logs when none are given",
            defaultValue = ".")
    Path eventsDir;

    @Option(names = "--no-color", description = "Print the summary without ANSI decorations")
    boolean noColor;

    @Parameters(arity = "0..*", paramLabel = "EVENT_LOG", description = "Recorded event logs to replay")
    List<String> files = new ArrayList<>();

    private final Function<Path, TestEngine> engineFactory;

    public TallyCommand() {
        this(EventLogEngine::discover);
    }

    TallyCommand(Function<Path, TestEngine> engineFactory) {
        this.engineFactory = engineFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ReporterConfig reporterConfig;
        try {
            reporterConfig = buildConfig(out);
        } catch (ReporterConfigurationException e) {
            err.println(e.getMessage());
            return EXIT_ERROR;
        }

        try (JUnitReporter reporter = new JUnitReporter(engineFactory.apply(eventsDir))) {
            reporter.run(files, reporterConfig).get();
            return EXIT_OK;
        } catch (ExecutionException e) {
            return exitCodeFor(e.getCause(), err);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted while waiting for the run to finish");
            return EXIT_ERROR;
        } catch (ReporterException e) {
            return exitCodeFor(e, err);
        }
    }

    ReporterConfig buildConfig(PrintWriter out) {
        ReporterConfig reporterConfig = ReporterConfig.create().log(line -> {
            out.println(line);
            out.flush();
        });

        boolean explicitConfig = spec.commandLine().getParseResult().hasMatchedOption("--config");
        if (explicitConfig || Files.isRegularFile(config)) {
            new ReporterConfigLoader().apply(config, reporterConfig);
        }

        if (output != null) reporterConfig.output(output);
        if (testspec != null) reporterConfig.testspec(testspec);
        if (testFullSpec != null) reporterConfig.testFullSpec(testFullSpec);
        if (noColor) reporterConfig.plain();
        return reporterConfig;
    }

    private static int exitCodeFor(Throwable error, PrintWriter err) {
        if (error instanceof TestFailuresException) {
            return EXIT_TEST_FAILURES;
        }
        log.debug("Run failed", error);
        err.println(error.getMessage());
        return EXIT_ERROR;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new TallyCommand()).execute(args));
    }
}
