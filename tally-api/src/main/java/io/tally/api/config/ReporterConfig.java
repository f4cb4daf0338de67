package io.tally.api.config;

/**
 * Configuration for one reporter run.
 * Controls the output directory, test filters, and console decorations.
 */
public final class ReporterConfig {

    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_DEFAULT_COLOR = "\u001B[39m";
    public static final String ANSI_BOLD = "\u001B[1m";
    public static final String ANSI_NORMAL_INTENSITY = "\u001B[22m";

    private String output = null; // required, checked when the run starts
    private String testspec = null;
    private String testFullSpec = null;
    private String errorPrefix = ANSI_RED;
    private String errorSuffix = ANSI_DEFAULT_COLOR;
    private String okPrefix = ANSI_GREEN;
    private String okSuffix = ANSI_DEFAULT_COLOR;
    private String boldPrefix = ANSI_BOLD;
    private String boldSuffix = ANSI_NORMAL_INTENSITY;
    private LogSink log = LogSink.stdout();

    private ReporterConfig() {}

    public static ReporterConfig create() {
        return new ReporterConfig();
    }

    /**
     * Directory the report files are written to. Relative paths are resolved
     * against the working directory when the run starts.
     */
    public ReporterConfig output(String output) {
        this.output = output;
        return this;
    }

    public ReporterConfig testspec(String testspec) {
        this.testspec = testspec;
        return this;
    }

    public ReporterConfig testFullSpec(String testFullSpec) {
        this.testFullSpec = testFullSpec;
        return this;
    }

    public ReporterConfig errorPrefix(String errorPrefix) {
        this.errorPrefix = nullToEmpty(errorPrefix);
        return this;
    }

    public ReporterConfig errorSuffix(String errorSuffix) {
        this.errorSuffix = nullToEmpty(errorSuffix);
        return this;
    }

    public ReporterConfig okPrefix(String okPrefix) {
        this.okPrefix = nullToEmpty(okPrefix);
        return this;
    }

    public ReporterConfig okSuffix(String okSuffix) {
        this.okSuffix = nullToEmpty(okSuffix);
        return this;
    }

    public ReporterConfig boldPrefix(String boldPrefix) {
        this.boldPrefix = nullToEmpty(boldPrefix);
        return this;
    }

    public ReporterConfig boldSuffix(String boldSuffix) {
        this.boldSuffix = nullToEmpty(boldSuffix);
        return this;
    }

    /**
     * Drop all console decorations, e.g. when output is not a terminal.
     */
    public ReporterConfig plain() {
        this.errorPrefix = "";
        this.errorSuffix = "";
        this.okPrefix = "";
        this.okSuffix = "";
        this.boldPrefix = "";
        this.boldSuffix = "";
        return this;
    }

    public ReporterConfig log(LogSink log) {
        if (log == null) {
            throw new IllegalArgumentException("Log sink must not be null");
        }
        this.log = log;
        return this;
    }

    public String output() { return output; }
    public String testspec() { return testspec; }
    public String testFullSpec() { return testFullSpec; }
    public String errorPrefix() { return errorPrefix; }
    public String errorSuffix() { return errorSuffix; }
    public String okPrefix() { return okPrefix; }
    public String okSuffix() { return okSuffix; }
    public String boldPrefix() { return boldPrefix; }
    public String boldSuffix() { return boldSuffix; }
    public LogSink log() { return log; }

    public boolean hasOutput() {
        return output != null && !output.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
