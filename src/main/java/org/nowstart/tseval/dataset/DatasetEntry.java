package org.nowstart.tseval.dataset;

import java.util.Objects;

public record DatasetEntry(
        String id,
        DatasetLocation location
) {

    public DatasetEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("dataset id is required");
        }
        Objects.requireNonNull(location, "location is required");
    }
}
