package org.nowstart.tseval.dataset;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tseval.data.dto.LoadedDataset;
import org.nowstart.tseval.data.exception.ConfigException;
import org.nowstart.tseval.data.exception.UnknownDatasetException;
import org.springframework.stereotype.Service;

/**
 * Dataset id to file location lookup. Entries are immutable once registered and
 * {@link #load(String)} re-reads the files on every call, nothing is cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetRegistry {

    private final DatasetConfigParser configParser;
    private final DatasetLoader datasetLoader;
    private volatile Map<String, DatasetEntry> entriesById = Map.of();

    public List<DatasetEntry> register(Path configFile) {
        Path parent = configFile.toAbsolutePath().getParent();
        return register(configFile, parent != null ? parent : Path.of(""));
    }

    public List<DatasetEntry> register(Path configFile, Path baseDir) {
        List<DatasetEntry> entries = configParser.parse(configFile, baseDir);
        register(entries);
        log.info("event=datasets_registered source={} count={}", configFile.toAbsolutePath(), entries.size());
        return entries;
    }

    public List<DatasetEntry> register(InputStream configSource, Path baseDir) {
        List<DatasetEntry> entries = configParser.parse(configSource, baseDir);
        register(entries);
        return entries;
    }

    public void register(DatasetEntry entry) {
        register(List.of(entry));
    }

    /**
     * Adds all entries or none of them.
     *
     * @throws ConfigException if an id repeats within {@code entries} or is already registered
     */
    public synchronized void register(Collection<DatasetEntry> entries) {
        Map<String, DatasetEntry> next = new LinkedHashMap<>(entriesById);
        for (DatasetEntry entry : entries) {
            DatasetEntry previous = next.putIfAbsent(entry.id(), entry);
            if (previous != null) {
                throw new ConfigException("Duplicate dataset registered for id=" + entry.id());
            }
        }
        entriesById = Collections.unmodifiableMap(next);
    }

    public DatasetEntry resolve(String datasetId) {
        DatasetEntry entry = datasetId == null ? null : entriesById.get(datasetId);
        if (entry == null) {
            throw new UnknownDatasetException(datasetId);
        }
        return entry;
    }

    public LoadedDataset load(String datasetId) {
        return datasetLoader.load(resolve(datasetId));
    }

    public boolean contains(String datasetId) {
        return datasetId != null && entriesById.containsKey(datasetId);
    }

    public List<String> ids() {
        return List.copyOf(entriesById.keySet());
    }

    public int size() {
        return entriesById.size();
    }
}
