package org.nowstart.tseval.dataset;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tseval.data.dto.LoadedDataset;
import org.nowstart.tseval.data.exception.LabelFormatException;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetLoader {

    private static final int MIN_COMBINED_COLUMNS = 2;

    private final DelimitedFileReader fileReader;

    public LoadedDataset load(DatasetEntry entry) {
        DatasetLocation location = entry.location();
        if (location instanceof TwoFileLocation twoFile) {
            return loadTwoFile(entry.id(), twoFile);
        }
        if (location instanceof CombinedFileLocation combined) {
            return loadCombined(entry.id(), combined);
        }
        throw new IllegalArgumentException("Unsupported dataset location: " + location.getClass().getSimpleName());
    }

    private LoadedDataset loadTwoFile(String id, TwoFileLocation location) {
        double[][] values = fileReader.readRows(location.dataPath()).toArray(double[][]::new);
        double[] rawLabels = flatten(fileReader.readRows(location.labelsPath()));
        int[] labels = normalizeLabels(id, rawLabels, values.length, location.labelsPath());
        return new LoadedDataset(id, values, labels);
    }

    private LoadedDataset loadCombined(String id, CombinedFileLocation location) {
        List<double[]> rows = fileReader.readRows(location.combinedPath());
        double[][] values = new double[rows.size()][];
        int[] labels = new int[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            double[] row = rows.get(i);
            if (row.length < MIN_COMBINED_COLUMNS) {
                throw new LabelFormatException(
                        "Combined dataset '" + id + "' needs at least one value column and one label column, got "
                                + row.length + " column(s) in " + location.combinedPath()
                );
            }
            double label = row[row.length - 1];
            if (!isBinary(label)) {
                throw new LabelFormatException(
                        "Combined dataset '" + id + "' has non-binary label " + label + " at row " + i
                );
            }
            values[i] = Arrays.copyOf(row, row.length - 1);
            labels[i] = (int) label;
        }
        return new LoadedDataset(id, values, labels);
    }

    /**
     * Dense when there is one binary flag per step, otherwise a list of anomalous row indices.
     */
    int[] normalizeLabels(String id, double[] rawLabels, int length, Path labelsPath) {
        if (rawLabels.length == length && allBinary(rawLabels)) {
            if (length > 0 && isValidIndexList(rawLabels, length)) {
                log.warn("event=ambiguous_labels dataset={} path={} rows={} resolution=dense", id, labelsPath, length);
            }
            return toIntArray(rawLabels);
        }

        int[] dense = new int[length];
        for (double raw : rawLabels) {
            if (!isIndex(raw, length)) {
                throw new LabelFormatException(
                        "Labels of dataset '" + id + "' are neither " + length + " binary flags nor row indices in [0, "
                                + length + "): offending value " + raw + " in " + labelsPath
                );
            }
            dense[(int) raw] = 1;
        }
        return dense;
    }

    private boolean isValidIndexList(double[] raw, int length) {
        Set<Integer> seen = new HashSet<>();
        for (double value : raw) {
            if (!isIndex(value, length) || !seen.add((int) value)) {
                return false;
            }
        }
        return true;
    }

    private boolean isIndex(double value, int length) {
        return value == Math.rint(value) && value >= 0 && value < length;
    }

    private boolean allBinary(double[] values) {
        for (double value : values) {
            if (!isBinary(value)) {
                return false;
            }
        }
        return true;
    }

    private boolean isBinary(double value) {
        return value == 0.0 || value == 1.0;
    }

    private int[] toIntArray(double[] values) {
        int[] out = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (int) values[i];
        }
        return out;
    }

    private double[] flatten(List<double[]> rows) {
        return rows.stream().flatMapToDouble(Arrays::stream).toArray();
    }
}
