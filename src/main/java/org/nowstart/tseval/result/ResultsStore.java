package org.nowstart.tseval.result;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.nowstart.tseval.data.dto.MetricScore;
import org.nowstart.tseval.data.dto.TrialKey;
import org.nowstart.tseval.data.dto.TrialResult;

/**
 * Trial results of one evaluation run, one row per (dataset, algorithm).
 * <p>
 * Writes are keyed upserts and safe under concurrent writers. A row keeps the position it was first
 * given, either by {@link #reserve(TrialKey)} or by its first {@link #append(TrialResult)}, so
 * overwriting a key never reorders the table.
 */
public class ResultsStore {

    private final ConcurrentHashMap<TrialKey, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public void reserve(TrialKey key) {
        slots.computeIfAbsent(key, ignored -> new Slot(sequence.getAndIncrement(), null));
    }

    public void append(TrialResult result) {
        slots.compute(result.key(), (key, existing) -> existing == null
                ? new Slot(sequence.getAndIncrement(), result)
                : new Slot(existing.position(), result));
    }

    public Optional<TrialResult> get(TrialKey key) {
        Slot slot = slots.get(key);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.result());
    }

    public int size() {
        return (int) slots.values().stream().filter(slot -> slot.result() != null).count();
    }

    public List<TrialResult> rows() {
        return slots.values().stream()
                .filter(slot -> slot.result() != null)
                .sorted(Comparator.comparingLong(Slot::position))
                .map(Slot::result)
                .toList();
    }

    public List<TrialResult> filter(Predicate<TrialResult> predicate) {
        return rows().stream().filter(predicate).toList();
    }

    public Map<String, List<TrialResult>> groupByAlgorithm() {
        return groupBy(TrialResult::algorithmName);
    }

    public Map<String, List<TrialResult>> groupByDataset() {
        return groupBy(TrialResult::datasetId);
    }

    public ResultsTable export() {
        List<TrialResult> rows = rows();
        Set<String> metricNames = new LinkedHashSet<>();
        for (TrialResult row : rows) {
            metricNames.addAll(row.metrics().keySet());
        }

        List<ResultRow> exported = rows.stream()
                .map(row -> toRow(row, metricNames))
                .toList();
        return new ResultsTable(List.copyOf(metricNames), exported);
    }

    private ResultRow toRow(TrialResult result, Set<String> metricNames) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (String name : metricNames) {
            MetricScore score = result.metrics().get(name);
            metrics.put(name, score != null && score.available() ? score.value() : null);
        }
        return new ResultRow(
                result.datasetId(),
                result.algorithmName(),
                result.status(),
                result.duration().toNanos() / 1_000_000_000.0,
                Collections.unmodifiableMap(metrics),
                result.errorMessage()
        );
    }

    private Map<String, List<TrialResult>> groupBy(Function<TrialResult, String> classifier) {
        Map<String, List<TrialResult>> grouped = rows().stream()
                .collect(Collectors.groupingBy(classifier, LinkedHashMap::new, Collectors.toUnmodifiableList()));
        return Collections.unmodifiableMap(grouped);
    }

    private record Slot(long position, TrialResult result) {
    }
}
