package org.nowstart.tseval.dataset;

import java.nio.file.Path;
import java.util.List;

public interface DatasetLocation {

    List<Path> files();

    DatasetLocation resolveAgainst(Path baseDir);
}
