package org.nowstart.tseval.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.tseval.data.dto.TrialKey;
import org.springframework.stereotype.Component;

@Component
public class TrialArtifactWriter {

    public static final String SCORES_FILE = "anomaly_scores.ts";

    public Path writeScores(Path dir, TrialKey key, double[] scores) {
        Path trialDir = resolveTrialDir(dir, key);
        Path path = trialDir.resolve(SCORES_FILE);
        try {
            Files.createDirectories(trialDir);
            List<String> lines = new ArrayList<>(scores.length);
            for (double score : scores) {
                lines.add(Double.toString(score));
            }
            Files.write(path, lines, StandardCharsets.UTF_8);
            return path;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write scores: " + path, e);
        }
    }

    public Path resolveTrialDir(Path dir, TrialKey key) {
        return dir.resolve(safeName(key.algorithmName())).resolve(safeName(key.datasetId()));
    }

    private String safeName(String raw) {
        return raw.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
