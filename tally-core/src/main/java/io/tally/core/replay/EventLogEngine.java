package io.tally.core.replay;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tally.api.assertion.Assertion;
import io.tally.api.assertion.AssertionList;
import io.tally.api.engine.EngineOptions;
import io.tally.api.engine.TestEngine;
import io.tally.api.engine.TestLifecycleListener;
import io.tally.api.error.ReporterConfigurationException;
import io.tally.core.replay.EventRecord.AssertionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * A {@link TestEngine} that replays recorded lifecycle events instead of running tests.
 * <p>
 * Each log is a JSON-lines file of {@link EventRecord}s. Module and test events
 * from all replayed logs are forwarded in file order; the {@code done} records
 * are merged so the listener sees a single {@code done} carrying every assertion
 * and the summed duration. The {@code testspec} filter keeps only tests with that
 * name, {@code testFullSpec} only the test named {@code module.test}.
 */
public class EventLogEngine implements TestEngine {

    private static final Logger log = LoggerFactory.getLogger(EventLogEngine.class);

    public static final String LOG_SUFFIX = ".jsonl";

    private final ObjectMapper objectMapper;
    private final List<Path> knownLogs;

    public EventLogEngine(List<Path> knownLogs) {
        this(new ObjectMapper(), knownLogs);
    }

    public EventLogEngine(ObjectMapper objectMapper, List<Path> knownLogs) {
        this.objectMapper = objectMapper;
        this.knownLogs = List.copyOf(knownLogs);
    }

    /**
     * Create an engine that knows every {@code *.jsonl} file directly inside a directory.
     */
    public static EventLogEngine discover(Path directory) {
        if (!Files.isDirectory(directory)) {
            return new EventLogEngine(List.of());
        }
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> logs = entries
                    .filter(p -> p.getFileName().toString().endsWith(LOG_SUFFIX))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
            return new EventLogEngine(logs);
        } catch (IOException e) {
            throw new ReporterConfigurationException("Failed to list event logs in " + directory, e);
        }
    }

    @Override
    public void runFiles(List<Path> files, EngineOptions options) {
        replay(files, options);
    }

    @Override
    public void runModules(EngineOptions options) {
        replay(knownLogs, options);
    }

    public List<Path> knownLogs() {
        return knownLogs;
    }

    private void replay(List<Path> logs, EngineOptions options) {
        TestLifecycleListener listener = options.listener();
        List<Assertion> all = new ArrayList<>();
        long duration = 0;

        for (Path file : logs) {
            log.info("Replaying events from {}", file);
            duration += replayFile(file, options, all);
        }
        listener.done(new AssertionList(all, duration));
    }

    private long replayFile(Path file, EngineOptions options, List<Assertion> all) {
        TestLifecycleListener listener = options.listener();
        String currentModule = null;
        long duration = 0;
        int lineNumber = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;

                EventRecord record = objectMapper.readValue(line, EventRecord.class);
                String event = record.event() == null ? "" : record.event();
                switch (event) {
                    case EventRecord.MODULE_START -> {
                        currentModule = record.name();
                        listener.moduleStart(record.name());
                    }
                    case EventRecord.TEST_DONE -> {
                        if (!matches(options, currentModule, record.name())) {
                            continue;
                        }
                        List<Assertion> assertions = toAssertions(record.assertions());
                        all.addAll(assertions);
                        listener.testDone(record.name(), new AssertionList(assertions, 0));
                    }
                    case EventRecord.DONE -> duration += record.duration() == null ? 0 : record.duration();
                    default -> log.warn("{}:{}: unknown event '{}' ignored", file, lineNumber, event);
                }
            }
        } catch (IOException e) {
            throw new ReporterConfigurationException(
                    "Failed to read event log " + file + " at line " + lineNumber, e);
        }
        return duration;
    }

    private static boolean matches(EngineOptions options, String module, String test) {
        if (options.testspec() != null && !options.testspec().equals(test)) {
            return false;
        }
        return options.testFullSpec() == null || options.testFullSpec().equals(module + "." + test);
    }

    private static List<Assertion> toAssertions(List<AssertionRecord> records) {
        if (records == null) {
            return List.of();
        }
        List<Assertion> assertions = new ArrayList<>(records.size());
        for (AssertionRecord r : records) {
            assertions.add(new Assertion.Recorded(r.failed(), r.message(), ReplayedErrors.from(r.error())));
        }
        return assertions;
    }
}
