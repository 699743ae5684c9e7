package org.nowstart.tseval.runner;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tseval.algorithm.AlgorithmDescriptor;
import org.nowstart.tseval.algorithm.AlgorithmRegistry;
import org.nowstart.tseval.data.property.EvaluationProperties;
import org.nowstart.tseval.dataset.DatasetRegistry;
import org.nowstart.tseval.result.ResultRow;
import org.nowstart.tseval.result.ResultsCsvWriter;
import org.nowstart.tseval.result.ResultsJsonWriter;
import org.nowstart.tseval.result.ResultsStore;
import org.nowstart.tseval.result.ResultsTable;
import org.nowstart.tseval.service.EvaluationPlan;
import org.nowstart.tseval.service.ExecutionEngine;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class EvaluationRunner implements ApplicationRunner {

    private static final DateTimeFormatter RUN_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyy_MM_dd_HH_mm_ss");

    private final EvaluationProperties properties;
    private final DatasetRegistry datasetRegistry;
    private final AlgorithmRegistry algorithmRegistry;
    private final ExecutionEngine executionEngine;
    private final ResultsCsvWriter resultsCsvWriter;
    private final ResultsJsonWriter resultsJsonWriter;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.enabled()) {
            log.info("tseval.evaluation.enabled=false; pass --tseval.evaluation.enabled=true to run");
            return;
        }
        if (!properties.hasDatasetConfig()) {
            log.info("tseval.evaluation.dataset-config is not set; nothing to evaluate");
            return;
        }

        logSection("EVALUATION START");
        datasetRegistry.register(Path.of(properties.datasetConfig().trim()), properties.resolveDatasetBaseDir());
        List<String> datasetIds = properties.resolveDatasetIds().isEmpty()
                ? datasetRegistry.ids()
                : properties.resolveDatasetIds();
        if (datasetIds.isEmpty()) {
            log.warn("[Overview] dataset configuration {} registered no datasets", properties.datasetConfig());
            return;
        }
        if (algorithmRegistry.isEmpty()) {
            log.warn("[Overview] no AlgorithmDescriptor beans registered; nothing to evaluate");
            return;
        }

        Path runDir = resolveRunDir(LocalDateTime.now());
        EvaluationPlan plan = EvaluationPlan.of(datasetIds, algorithmRegistry.all());
        if (properties.writeScores()) {
            plan = plan.withArtifactDir(runDir);
        }
        log.info("[Overview] datasets={} algorithms={} trials={} metrics={} parallelism={} trialTimeout={} scaleScores={}",
                plan.datasetIds(),
                plan.algorithms().stream().map(AlgorithmDescriptor::name).toList(),
                plan.trialCount(),
                properties.metrics(),
                properties.parallelism(),
                properties.hasTrialTimeout() ? properties.trialTimeout() : "none",
                properties.scaleScores());

        logSection("TRIALS");
        ResultsStore store = executionEngine.run(plan);
        ResultsTable table = store.export();

        logSection("RESULTS");
        logRows(table);

        logSection("EXPORT");
        log.info("[Export] csv={}", resultsCsvWriter.write(runDir, table));
        log.info("[Export] json={}", resultsJsonWriter.write(runDir, table));
        logSection("EVALUATION END");
    }

    Path resolveRunDir(LocalDateTime startedAt) {
        return Path.of(properties.resultsDir()).resolve(RUN_DIR_FORMAT.format(startedAt));
    }

    private void logRows(ResultsTable table) {
        for (int i = 0; i < table.rows().size(); i++) {
            ResultRow row = table.rows().get(i);
            log.info("[Trial {}/{}] dataset={} algorithm={} status={} duration={}s metrics={}{}",
                    i + 1,
                    table.size(),
                    row.dataset(),
                    row.algorithm(),
                    row.status(),
                    String.format(Locale.US, "%.3f", row.durationSeconds()),
                    formatMetrics(row),
                    row.error() == null ? "" : " error=" + row.error());
        }
    }

    private String formatMetrics(ResultRow row) {
        StringBuilder out = new StringBuilder("{");
        row.metrics().forEach((name, value) -> {
            if (out.length() > 1) {
                out.append(", ");
            }
            out.append(name).append('=').append(value == null ? "n/a" : String.format(Locale.US, "%.4f", value));
        });
        return out.append('}').toString();
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }
}
