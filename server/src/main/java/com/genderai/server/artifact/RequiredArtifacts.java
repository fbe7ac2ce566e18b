package com.genderai.server.artifact;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The fixed set of files a model bundle is made of.
 */
public final class RequiredArtifacts {

    public static final String CLASSIFIER_WEIGHTS = "model.onnx";
    public static final String CLASSIFIER_CONFIG = "config.json";
    public static final String PREPROCESSOR_CONFIG = "preprocessor_config.json";
    public static final String DETECTOR_WEIGHTS = "detector.onnx";
    public static final String DETECTOR_CONFIG = "detector_config.json";

    public static final List<String> FILES = List.of(
            CLASSIFIER_WEIGHTS,
            CLASSIFIER_CONFIG,
            PREPROCESSOR_CONFIG,
            DETECTOR_WEIGHTS,
            DETECTOR_CONFIG);

    private RequiredArtifacts() {
    }

    /**
     * True when every required file is present in the directory.
     */
    public static boolean isComplete(Path dir) {
        if (dir == null || !Files.isDirectory(dir)) {
            return false;
        }
        for (String name : FILES) {
            if (!Files.isRegularFile(dir.resolve(name))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Joins a prefix and a file name into an object key.
     */
    public static String objectKey(String prefix, String fileName) {
        if (prefix == null || prefix.isEmpty()) {
            return fileName;
        }
        return prefix.endsWith("/") ? prefix + fileName : prefix + "/" + fileName;
    }
}
