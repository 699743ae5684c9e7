package org.nowstart.tseval.result;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class ResultsCsvWriter {

    public static final String RESULTS_FILE = "results.csv";

    public Path write(Path dir, ResultsTable table) {
        Path path = dir.resolve(RESULTS_FILE);
        try {
            Files.createDirectories(dir);
            Files.write(path, toLines(table), StandardCharsets.UTF_8);
            return path;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to save CSV: " + path, e);
        }
    }

    List<String> toLines(ResultsTable table) {
        List<String> lines = new ArrayList<>(table.size() + 1);
        lines.add(String.join(",", table.columns()));
        for (ResultRow row : table.rows()) {
            StringBuilder line = new StringBuilder()
                    .append(escape(row.dataset()))
                    .append(',').append(escape(row.algorithm()))
                    .append(',').append(row.status().name())
                    .append(',').append(String.format(Locale.US, "%.6f", row.durationSeconds()));
            for (String metric : table.metricNames()) {
                Double value = row.metrics().get(metric);
                line.append(',');
                if (value != null) {
                    line.append(value);
                }
            }
            line.append(',').append(escape(row.error()));
            lines.add(line.toString());
        }
        return lines;
    }

    private String escape(String raw) {
        if (raw == null) {
            return "";
        }
        if (raw.indexOf(',') < 0 && raw.indexOf('"') < 0 && raw.indexOf('\n') < 0 && raw.indexOf('\r') < 0) {
            return raw;
        }
        return '"' + raw.replace("\"", "\"\"") + '"';
    }
}
