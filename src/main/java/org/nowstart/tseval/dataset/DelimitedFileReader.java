package org.nowstart.tseval.dataset;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.nowstart.tseval.data.exception.DatasetReadException;
import org.springframework.stereotype.Component;

@Component
public class DelimitedFileReader {

    private static final Pattern DELIMITER = Pattern.compile("\\s*[,;\\t]\\s*|\\s+");
    private static final String COMMENT_PREFIX = "#";
    private static final Set<String> NON_FINITE_LITERALS = Set.of(
            "nan", "inf", "+inf", "-inf", "infinity", "+infinity", "-infinity"
    );

    public List<double[]> readRows(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DatasetReadException("Failed to read file: " + path, e);
        }

        List<double[]> rows = new ArrayList<>(lines.size());
        int expectedColumns = -1;
        boolean firstContentLine = true;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            String[] parts = DELIMITER.split(line, -1);
            if (firstContentLine) {
                firstContentLine = false;
                if (isHeader(parts)) {
                    continue;
                }
            }
            if (expectedColumns < 0) {
                expectedColumns = parts.length;
            } else if (parts.length != expectedColumns) {
                throw new DatasetReadException(
                        "Inconsistent column count at " + path + ":" + (i + 1)
                                + ", expected=" + expectedColumns + ", actual=" + parts.length
                );
            }
            rows.add(parseRow(parts, path, i + 1));
        }
        return rows;
    }

    private double[] parseRow(String[] parts, Path path, int lineNumber) {
        double[] row = new double[parts.length];
        for (int c = 0; c < parts.length; c++) {
            double value;
            try {
                value = Double.parseDouble(parts[c].trim());
            } catch (NumberFormatException e) {
                throw new DatasetReadException(
                        "Non-numeric value '" + parts[c] + "' at " + path + ":" + lineNumber, e
                );
            }
            if (!Double.isFinite(value)) {
                throw new DatasetReadException(
                        "Non-finite value '" + parts[c] + "' at " + path + ":" + lineNumber
                );
            }
            row[c] = value;
        }
        return row;
    }

    // only a row made entirely of column names is a header; anything else is data and must parse
    private boolean isHeader(String[] parts) {
        for (String part : parts) {
            String token = part.trim();
            if (token.isEmpty() || isNumeric(token)) {
                return false;
            }
        }
        return true;
    }

    private boolean isNumeric(String raw) {
        if (NON_FINITE_LITERALS.contains(raw.toLowerCase(Locale.ROOT))) {
            return true;
        }
        try {
            Double.parseDouble(raw);
            return true;
        } catch (NumberFormatException ignored) {
            return false;
        }
    }
}
