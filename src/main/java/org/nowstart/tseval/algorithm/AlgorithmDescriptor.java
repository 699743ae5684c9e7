package org.nowstart.tseval.algorithm;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.nowstart.tseval.data.exception.AlgorithmInvocationException;
import org.nowstart.tseval.data.type.InputMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named, immutable handle to a user supplied detector and its calling convention.
 */
public record AlgorithmDescriptor(
        String name,
        InputMode inputMode,
        ArrayDetector arrayDetector,
        FileDetector fileDetector,
        ScorePostprocessor postprocessor
) {

    private static final Logger log = LoggerFactory.getLogger(AlgorithmDescriptor.class);
    private static final String TEMP_FILE_PREFIX = "tseval-";
    private static final String TEMP_FILE_SUFFIX = ".csv";

    public AlgorithmDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("algorithm name is required");
        }
        name = name.trim();
        if (inputMode == null) {
            throw new IllegalArgumentException("inputMode is required for algorithm=" + name);
        }
        if (inputMode == InputMode.ARRAY && (arrayDetector == null || fileDetector != null)) {
            throw new IllegalArgumentException("ARRAY algorithm requires exactly an array detector, algorithm=" + name);
        }
        if (inputMode == InputMode.FILE_PATH && (fileDetector == null || arrayDetector != null)) {
            throw new IllegalArgumentException("FILE_PATH algorithm requires exactly a file detector, algorithm=" + name);
        }
        postprocessor = postprocessor != null ? postprocessor : ScorePostprocessor.IDENTITY;
    }

    public static AlgorithmDescriptor ofArray(String name, ArrayDetector detector) {
        return new AlgorithmDescriptor(name, InputMode.ARRAY, detector, null, null);
    }

    public static AlgorithmDescriptor ofFile(String name, FileDetector detector) {
        return new AlgorithmDescriptor(name, InputMode.FILE_PATH, null, detector, null);
    }

    public AlgorithmDescriptor withPostprocessor(ScorePostprocessor next) {
        return new AlgorithmDescriptor(name, inputMode, arrayDetector, fileDetector, next);
    }

    public boolean expectsFilePath() {
        return inputMode == InputMode.FILE_PATH;
    }

    /**
     * Runs the detector. File based detectors get a temporary CSV copy of {@code values} created in
     * {@code tempDir}; the file is deleted before this method returns or throws.
     *
     * @throws AlgorithmInvocationException when the detector fails or its input cannot be materialized
     */
    public double[] invoke(double[][] values, Path tempDir) {
        if (inputMode == InputMode.ARRAY) {
            return call(() -> arrayDetector.detect(values));
        }

        Path datasetFile = createTempFile(values, tempDir);
        try {
            return call(() -> fileDetector.detect(datasetFile));
        } finally {
            deleteTempFile(datasetFile);
        }
    }

    private double[] call(DetectorCall detectorCall) {
        try {
            return detectorCall.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlgorithmInvocationException("Algorithm " + name + " was interrupted", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new AlgorithmInvocationException("Algorithm " + name + " failed: " + e.getMessage(), e);
        }
    }

    private Path createTempFile(double[][] values, Path tempDir) {
        Path file = null;
        try {
            Files.createDirectories(tempDir);
            file = Files.createTempFile(tempDir, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
            file.toFile().deleteOnExit();
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (double[] row : values) {
                    writer.write(joinRow(row));
                    writer.newLine();
                }
            }
            return file;
        } catch (IOException e) {
            if (file != null) {
                deleteTempFile(file);
            }
            throw new AlgorithmInvocationException("Failed to write input file for algorithm " + name, e);
        }
    }

    private void deleteTempFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("event=temp_file_cleanup_failed algorithm={} path={}", name, file, e);
        }
    }

    private String joinRow(double[] row) {
        StringBuilder line = new StringBuilder();
        for (int c = 0; c < row.length; c++) {
            if (c > 0) {
                line.append(',');
            }
            line.append(row[c]);
        }
        return line.toString();
    }

    @FunctionalInterface
    private interface DetectorCall {
        double[] run() throws Exception;
    }
}
