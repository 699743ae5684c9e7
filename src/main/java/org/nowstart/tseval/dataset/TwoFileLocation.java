package org.nowstart.tseval.dataset;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public record TwoFileLocation(
        Path dataPath,
        Path labelsPath
) implements DatasetLocation {

    public TwoFileLocation {
        Objects.requireNonNull(dataPath, "dataPath is required");
        Objects.requireNonNull(labelsPath, "labelsPath is required");
    }

    @Override
    public List<Path> files() {
        return List.of(dataPath, labelsPath);
    }

    @Override
    public TwoFileLocation resolveAgainst(Path baseDir) {
        return new TwoFileLocation(baseDir.resolve(dataPath), baseDir.resolve(labelsPath));
    }
}
