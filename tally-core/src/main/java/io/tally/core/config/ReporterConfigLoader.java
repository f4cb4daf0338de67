package io.tally.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tally.api.config.ReporterConfig;
import io.tally.api.error.ReporterConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Reads reporter options from a JSON file.
 * <p>
 * Recognized keys: {@code output}, {@code testspec}, {@code testFullSpec},
 * {@code error_prefix}, {@code error_suffix}, {@code ok_prefix},
 * {@code ok_suffix}, {@code bold_prefix}, {@code bold_suffix}. Unknown keys are
 * ignored so one file can be shared with other tools.
 */
public class ReporterConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ReporterConfigLoader.class);

    private final ObjectMapper objectMapper;

    public ReporterConfigLoader() {
        this(new ObjectMapper());
    }

    public ReporterConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReporterConfig load(Path file) {
        return apply(file, ReporterConfig.create());
    }

    /**
     * Overlay the options present in the file onto an existing configuration.
     * Options missing from the file keep their current value.
     */
    public ReporterConfig apply(Path file, ReporterConfig config) {
        if (!Files.isRegularFile(file)) {
            throw new ReporterConfigurationException("Config file not found: " + file);
        }
        ConfigFile values;
        try {
            values = objectMapper.readValue(file.toFile(), ConfigFile.class);
        } catch (IOException e) {
            throw new ReporterConfigurationException("Failed to read config file " + file, e);
        }
        if (values == null) {
            return config;
        }

        set(values.output(), config::output);
        set(values.testspec(), config::testspec);
        set(values.testFullSpec(), config::testFullSpec);
        set(values.errorPrefix(), config::errorPrefix);
        set(values.errorSuffix(), config::errorSuffix);
        set(values.okPrefix(), config::okPrefix);
        set(values.okSuffix(), config::okSuffix);
        set(values.boldPrefix(), config::boldPrefix);
        set(values.boldSuffix(), config::boldSuffix);

        log.debug("Loaded reporter config from {}", file);
        return config;
    }

    private static void set(String value, Consumer<String> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConfigFile(
            @JsonProperty("output") String output,
            @JsonProperty("testspec") String testspec,
            @JsonProperty("testFullSpec") String testFullSpec,
            @JsonProperty("error_prefix") String errorPrefix,
            @JsonProperty("error_suffix") String errorSuffix,
            @JsonProperty("ok_prefix") String okPrefix,
            @JsonProperty("ok_suffix") String okSuffix,
            @JsonProperty("bold_prefix") String boldPrefix,
            @JsonProperty("bold_suffix") String boldSuffix
    ) {}
}
