package io.tally.cli;

import io.tally.api.assertion.Assertion;
import io.tally.api.assertion.AssertionList;
import io.tally.api.engine.EngineOptions;
import io.tally.api.engine.TestEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TallyCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private static final String PASSING_LOG = String.join("\n",
            "{\"event\":\"moduleStart\",\"name\":\"strings\"}",
            "{\"event\":\"testDone\",\"name\":\"trims\",\"assertions\":[{\"failed\":false}]}",
            "{\"event\":\"done\",\"duration\":3}");

    private static final String FAILING_LOG = String.join("\n",
            "{\"event\":\"moduleStart\",\"name\":\"math\"}",
            "{\"event\":\"testDone\",\"name\":\"adds\",\"assertions\":[{\"failed\":true,\"message\":\"1 + 1\","
                    + "\"error\":{\"kind\":\"assertion\",\"actual\":3,\"expected\":2,\"operator\":\"==\"}}]}",
            "{\"event\":\"done\",\"duration\":4}");

    private int execute(TallyCommand command, String... args) {
        CommandLine cmd = new CommandLine(command);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path log(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content + "\n");
    }

    // ─── Exit codes ───

    @Test
    void shouldExitOkWhenAllAssertionsPass() throws IOException {
        Path events = log("strings.jsonl", PASSING_LOG);
        Path reports = tempDir.resolve("reports");

        int exit = execute(new TallyCommand(), "--no-color", "-o", reports.toString(), events.toString());

        assertThat(exit).isEqualTo(TallyCommand.EXIT_OK);
        assertThat(reports.resolve("strings.xml")).exists();
        assertThat(out.toString())
                .contains("Writing " + reports.resolve("strings.xml"))
                .contains("OK: 1 assertions (3ms)");
    }

    @Test
    void shouldExitWithFailureCodeWhenAssertionsFail() throws IOException {
        Path events = log("math.jsonl", FAILING_LOG);
        Path reports = tempDir.resolve("reports");

        int exit = execute(new TallyCommand(), "--no-color", "--output", reports.toString(), events.toString());

        assertThat(exit).isEqualTo(TallyCommand.EXIT_TEST_FAILURES);
        assertThat(out.toString()).contains("FAILURES: 1/1 assertions failed (4ms)");
        assertThat(reports.resolve("math.xml")).content()
                .contains("failures=\"1\"")
                .contains("AssertionError: 3 == 2");
    }

    @Test
    void shouldExitWithErrorWhenConfigFileIsMissing() throws IOException {
        Path events = log("strings.jsonl", PASSING_LOG);

        int exit = execute(new TallyCommand(), "--config", tempDir.resolve("empty.json").toString(), events.toString());

        assertThat(exit).isEqualTo(TallyCommand.EXIT_ERROR);
        assertThat(err.toString()).contains("Config file not found");
    }

    @Test
    void shouldExplainHowToSupplyOutput() throws IOException {
        Path config = log("tally.json", "{\"testspec\": \"trims\"}");

        int exit = execute(new TallyCommand(), "-c", config.toString(), log("s.jsonl", PASSING_LOG).toString());

        assertThat(exit).isEqualTo(TallyCommand.EXIT_ERROR);
        assertThat(err.toString())
                .contains("No output directory defined")
                .contains("--output");
    }

    // ─── Configuration ───

    @Test
    void shouldReadOutputAndDecorationsFromConfigFile() throws IOException {
        Path reports = tempDir.resolve("from-config");
        Path config = log("tally.json", "{\"output\": \"" + reports.toString().replace("\\", "\\\\") + "\","
                + " \"ok_prefix\": \"[\", \"ok_suffix\": \"]\", \"bold_prefix\": \"\", \"bold_suffix\": \"\"}");

        int exit = execute(new TallyCommand(), "-c", config.toString(), log("s.jsonl", PASSING_LOG).toString());

        assertThat(exit).isEqualTo(TallyCommand.EXIT_OK);
        assertThat(reports.resolve("strings.xml")).exists();
        assertThat(out.toString()).contains("[OK: ]1 assertions");
    }

    @Test
    void shouldLetCommandLineOverrideConfigFile() throws IOException {
        Path fromConfig = tempDir.resolve("from-config");
        Path fromFlag = tempDir.resolve("from-flag");
        Path config = log("tally.json", "{\"output\": \"" + fromConfig.toString().replace("\\", "\\\\") + "\"}");

        int exit = execute(new TallyCommand(), "-c", config.toString(), "-o", fromFlag.toString(),
                log("s.jsonl", PASSING_LOG).toString());

        assertThat(exit).isEqualTo(TallyCommand.EXIT_OK);
        assertThat(fromFlag.resolve("strings.xml")).exists();
        assertThat(fromConfig).doesNotExist();
    }

    // ─── Engine wiring ───

    @Test
    void shouldReplayEventsDirWhenNoLogsGiven() throws IOException {
        Path eventsDir = Files.createDirectories(tempDir.resolve("events"));
        Files.writeString(eventsDir.resolve("strings.jsonl"), PASSING_LOG);
        Path reports = tempDir.resolve("reports");

        int exit = execute(new TallyCommand(), "--no-color", "-o", reports.toString(), "--events-dir", eventsDir.toString());

        assertThat(exit).isEqualTo(TallyCommand.EXIT_OK);
        assertThat(reports.resolve("strings.xml")).exists();
    }

    @Test
    void shouldPassFiltersToEngine() {
        RecordingEngine engine = new RecordingEngine();

        int exit = execute(new TallyCommand(dir -> engine), "--no-color", "-o", tempDir.resolve("r").toString(),
                "--testspec", "adds", "--test-full-spec", "math.adds");

        assertThat(exit).isEqualTo(TallyCommand.EXIT_OK);
        assertThat(engine.options.testspec()).isEqualTo("adds");
        assertThat(engine.options.testFullSpec()).isEqualTo("math.adds");
    }

    @Test
    void shouldPrintDecoratedSummaryByDefault() {
        int exit = execute(new TallyCommand(dir -> new RecordingEngine()), "-o", tempDir.resolve("r").toString());

        assertThat(exit).isEqualTo(TallyCommand.EXIT_OK);
        assertThat(out.toString()).contains("\u001B[1m\u001B[32mOK: \u001B[39m\u001B[22m1 assertions");
    }

    private static final class RecordingEngine implements TestEngine {

        EngineOptions options;

        @Override
        public void runFiles(List<Path> files, EngineOptions options) {
            runModules(options);
        }

        @Override
        public void runModules(EngineOptions options) {
            this.options = options;
            options.listener().moduleStart("m");
            options.listener().testDone("t", AssertionList.of(Assertion.pass("ok")));
            options.listener().done(AssertionList.of(Assertion.pass("ok")));
        }
    }
}
