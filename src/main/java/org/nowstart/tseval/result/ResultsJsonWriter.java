package org.nowstart.tseval.result;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ResultsJsonWriter {

    public static final String RESULTS_FILE = "results.json";

    private final ObjectMapper objectMapper;

    public String toJson(ResultsTable table) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(table);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize results table", e);
        }
    }

    public Path write(Path dir, ResultsTable table) {
        Path path = dir.resolve(RESULTS_FILE);
        try {
            Files.createDirectories(dir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), table);
            return path;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to save JSON: " + path, e);
        }
    }
}
