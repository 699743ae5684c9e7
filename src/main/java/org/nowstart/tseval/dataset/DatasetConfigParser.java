package org.nowstart.tseval.dataset;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.nowstart.tseval.data.exception.ConfigException;
import org.springframework.stereotype.Component;

@Component
public class DatasetConfigParser {

    static final String DATA_KEY = "data";
    static final String LABELS_KEY = "labels";
    static final String DATASET_KEY = "dataset";

    private final ObjectMapper objectMapper;

    public DatasetConfigParser() {
        this.objectMapper = new ObjectMapper().enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    public List<DatasetEntry> parse(Path configFile, Path baseDir) {
        try (InputStream in = Files.newInputStream(configFile)) {
            return parse(in, baseDir);
        } catch (IOException e) {
            throw new ConfigException("Failed to read dataset configuration: " + configFile, e);
        }
    }

    public List<DatasetEntry> parse(InputStream in, Path baseDir) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid dataset configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read dataset configuration", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("Dataset configuration must be a JSON object of id -> location");
        }

        List<DatasetEntry> entries = new ArrayList<>(root.size());
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            DatasetLocation location = toLocation(field.getKey(), field.getValue());
            entries.add(new DatasetEntry(field.getKey(), location.resolveAgainst(baseDir)));
        }
        return List.copyOf(entries);
    }

    private DatasetLocation toLocation(String id, JsonNode node) {
        if (id.isBlank()) {
            throw new ConfigException("Dataset id must not be blank");
        }
        if (node == null || !node.isObject()) {
            throw new ConfigException("Dataset '" + id + "' must map to an object");
        }

        boolean hasData = node.has(DATA_KEY);
        boolean hasLabels = node.has(LABELS_KEY);
        boolean hasCombined = node.has(DATASET_KEY);

        if (hasCombined && (hasData || hasLabels)) {
            throw new ConfigException(
                    "Dataset '" + id + "' must define either {data, labels} or {dataset}, not both"
            );
        }
        if (hasCombined) {
            return new CombinedFileLocation(requirePath(id, node, DATASET_KEY));
        }
        if (hasData && hasLabels) {
            return new TwoFileLocation(requirePath(id, node, DATA_KEY), requirePath(id, node, LABELS_KEY));
        }
        if (hasData || hasLabels) {
            throw new ConfigException(
                    "Dataset '" + id + "' must define both 'data' and 'labels' (missing '"
                            + (hasData ? LABELS_KEY : DATA_KEY) + "')"
            );
        }
        throw new ConfigException("Dataset '" + id + "' defines neither {data, labels} nor {dataset}");
    }

    private Path requirePath(String id, JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ConfigException("Dataset '" + id + "' has an invalid '" + key + "' path");
        }
        return Path.of(value.asText().trim());
    }
}
