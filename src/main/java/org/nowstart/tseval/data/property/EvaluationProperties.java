package org.nowstart.tseval.data.property;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tseval.evaluation")
public record EvaluationProperties(
        // run the evaluation on startup
        @DefaultValue("true") boolean enabled,
        // dataset configuration JSON (id -> {data, labels} | {dataset})
        @DefaultValue("") String datasetConfig,
        // base directory for relative dataset paths; blank means the config file's directory
        @DefaultValue("") String datasetBaseDir,
        // dataset ids to evaluate; empty means every registered dataset
        @NotNull @DefaultValue("") List<String> datasets,
        // metric names handed to the scoring service
        @NotEmpty @DefaultValue("ROC_AUC") List<String> metrics,
        // number of trials executed concurrently
        @Positive @DefaultValue("1") int parallelism,
        // per-trial algorithm timeout; zero disables it
        @NotNull @DefaultValue("0s") Duration trialTimeout,
        // min-max scale algorithm scores before scoring
        @DefaultValue("true") boolean scaleScores,
        // directory for temporary files of file-based algorithms; blank means the JVM default
        @DefaultValue("") String tempDir,
        // output directory for results.csv and score files
        @DefaultValue("outputs/results") String resultsDir,
        // write each successful trial's scores to disk
        @DefaultValue("false") boolean writeScores
) {

    public boolean hasDatasetConfig() {
        return datasetConfig != null && !datasetConfig.isBlank();
    }

    public boolean hasTrialTimeout() {
        return trialTimeout != null && !trialTimeout.isZero() && !trialTimeout.isNegative();
    }

    public Path resolveTempDir() {
        if (tempDir == null || tempDir.isBlank()) {
            return Path.of(System.getProperty("java.io.tmpdir"));
        }
        return Path.of(tempDir.trim());
    }

    public Path resolveDatasetBaseDir() {
        if (datasetBaseDir != null && !datasetBaseDir.isBlank()) {
            return Path.of(datasetBaseDir.trim());
        }
        if (!hasDatasetConfig()) {
            return Path.of("");
        }
        Path parent = Path.of(datasetConfig.trim()).toAbsolutePath().getParent();
        return parent != null ? parent : Path.of("");
    }

    public List<String> resolveDatasetIds() {
        return datasets.stream()
                .filter(id -> id != null && !id.isBlank())
                .map(String::trim)
                .toList();
    }
}
