package org.nowstart.tseval.data.dto;

import java.util.Arrays;

public record LoadedDataset(
        String id,
        double[][] values,
        int[] labels
) {

    public LoadedDataset {
        if (values == null || labels == null) {
            throw new IllegalArgumentException("values and labels are required");
        }
        if (values.length != labels.length) {
            throw new IllegalArgumentException(
                    "values and labels must have identical lengths, values=" + values.length + ", labels=" + labels.length
            );
        }
        for (int label : labels) {
            if (label != 0 && label != 1) {
                throw new IllegalArgumentException("labels must be binary, got: " + label);
            }
        }
    }

    public int length() {
        return values.length;
    }

    public int dimensions() {
        return values.length == 0 ? 0 : values[0].length;
    }

    public boolean isUnivariate() {
        return dimensions() <= 1;
    }

    public int anomalyCount() {
        return Arrays.stream(labels).sum();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LoadedDataset that)) {
            return false;
        }
        return id.equals(that.id)
                && Arrays.deepEquals(values, that.values)
                && Arrays.equals(labels, that.labels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * id.hashCode() + Arrays.deepHashCode(values)) + Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        return "LoadedDataset[id=" + id + ", length=" + length() + ", dimensions=" + dimensions()
                + ", anomalies=" + anomalyCount() + "]";
    }
}
