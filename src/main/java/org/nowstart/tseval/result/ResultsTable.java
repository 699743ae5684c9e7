package org.nowstart.tseval.result;

import java.util.ArrayList;
import java.util.List;

public record ResultsTable(
        List<String> metricNames,
        List<ResultRow> rows
) {

    public static final List<String> FIXED_COLUMNS = List.of("dataset", "algorithm", "status", "duration", "error");

    public ResultsTable {
        metricNames = List.copyOf(metricNames);
        rows = List.copyOf(rows);
    }

    public List<String> columns() {
        List<String> columns = new ArrayList<>(FIXED_COLUMNS.subList(0, 4));
        columns.addAll(metricNames);
        columns.add(FIXED_COLUMNS.get(4));
        return List.copyOf(columns);
    }

    public int size() {
        return rows.size();
    }
}
