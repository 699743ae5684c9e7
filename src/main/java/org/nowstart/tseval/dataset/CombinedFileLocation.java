package org.nowstart.tseval.dataset;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public record CombinedFileLocation(
        Path combinedPath
) implements DatasetLocation {

    public CombinedFileLocation {
        Objects.requireNonNull(combinedPath, "combinedPath is required");
    }

    @Override
    public List<Path> files() {
        return List.of(combinedPath);
    }

    @Override
    public CombinedFileLocation resolveAgainst(Path baseDir) {
        return new CombinedFileLocation(baseDir.resolve(combinedPath));
    }
}
