package org.carball.xtd.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.xtd.error.ConfigurationConflictException;

import java.nio.file.Path;

@Data
@Builder
@Slf4j
public class XtdConfig {

    @Builder.Default
    private FinalizationMode finalizationMode = FinalizationMode.DEFAULT;

    private Integer maxColumnsThreshold;

    private boolean skipColumns;

    private String header;

    @Builder.Default
    private OutputFormat outputFormat = OutputFormat.DDL;

    // null means stdin / stdout
    private Path inputFile;
    private Path outputFile;

    private Path validationFile;

    public static XtdConfig defaults() {
        return XtdConfig.builder().build();
    }

    public static XtdConfig maxColumns(int threshold) {
        return XtdConfig.builder()
                .finalizationMode(FinalizationMode.MAX_COLUMNS)
                .maxColumnsThreshold(threshold)
                .build();
    }

    /**
     * Checks that the selected options can be used together.
     *
     * @throws ConfigurationConflictException if mutually exclusive options were combined
     * @throws IllegalArgumentException       if the threshold is negative
     */
    public void validate() {
        if (finalizationMode == null) {
            throw new IllegalArgumentException("Finalization mode not specified");
        }
        if (finalizationMode == FinalizationMode.DUPLICATE_KEYS && maxColumnsThreshold != null) {
            throw new ConfigurationConflictException(
                    "Duplicate keys and a max-columns threshold cannot be used together");
        }
        if (finalizationMode == FinalizationMode.MAX_COLUMNS && maxColumnsThreshold == null) {
            throw new ConfigurationConflictException("Max-columns mode requires a threshold");
        }
        if (finalizationMode == FinalizationMode.DEFAULT && maxColumnsThreshold != null) {
            throw new ConfigurationConflictException("A max-columns threshold requires max-columns mode");
        }
        if (maxColumnsThreshold != null && maxColumnsThreshold < 0) {
            throw new IllegalArgumentException("Max-columns threshold must not be negative: " + maxColumnsThreshold);
        }

        log.debug("Using configuration - {}", getConfigurationSummary());
    }

    public String getConfigurationSummary() {
        return String.format("Mode: %s | Threshold: %s | Skip columns: %s | Output: %s",
                finalizationMode,
                maxColumnsThreshold == null ? "none" : maxColumnsThreshold,
                skipColumns,
                outputFormat);
    }
}
