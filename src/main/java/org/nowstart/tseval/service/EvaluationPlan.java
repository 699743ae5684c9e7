package org.nowstart.tseval.service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.nowstart.tseval.algorithm.AlgorithmDescriptor;
import org.nowstart.tseval.data.dto.TrialKey;
import org.nowstart.tseval.data.exception.ConfigException;
import org.nowstart.tseval.data.exception.DuplicateAlgorithmException;

/**
 * Datasets and algorithms of one run. Trials are the dataset-major cross product in declared order.
 * A dataset id may be listed twice; the later trial then overwrites the earlier row.
 *
 * @param artifactDir directory for per-trial score files, {@code null} to skip writing them
 */
public record EvaluationPlan(
        List<String> datasetIds,
        List<AlgorithmDescriptor> algorithms,
        Path artifactDir
) {

    public EvaluationPlan {
        if (datasetIds == null || datasetIds.isEmpty()) {
            throw new ConfigException("evaluation plan requires at least one dataset");
        }
        if (algorithms == null || algorithms.isEmpty()) {
            throw new ConfigException("evaluation plan requires at least one algorithm");
        }
        for (String datasetId : datasetIds) {
            if (datasetId == null || datasetId.isBlank()) {
                throw new ConfigException("dataset id must not be blank");
            }
        }
        Set<String> names = new HashSet<>();
        for (AlgorithmDescriptor algorithm : algorithms) {
            if (!names.add(algorithm.name())) {
                throw new DuplicateAlgorithmException(algorithm.name());
            }
        }
        datasetIds = List.copyOf(datasetIds);
        algorithms = List.copyOf(algorithms);
    }

    public static EvaluationPlan of(List<String> datasetIds, List<AlgorithmDescriptor> algorithms) {
        return new EvaluationPlan(datasetIds, algorithms, null);
    }

    public EvaluationPlan withArtifactDir(Path dir) {
        return new EvaluationPlan(datasetIds, algorithms, dir);
    }

    public List<PlannedTrial> trials() {
        List<PlannedTrial> trials = new ArrayList<>(datasetIds.size() * algorithms.size());
        for (String datasetId : datasetIds) {
            for (AlgorithmDescriptor algorithm : algorithms) {
                trials.add(new PlannedTrial(new TrialKey(datasetId, algorithm.name()), algorithm));
            }
        }
        return List.copyOf(trials);
    }

    public int trialCount() {
        return datasetIds.size() * algorithms.size();
    }

    public record PlannedTrial(TrialKey key, AlgorithmDescriptor algorithm) {
    }
}
