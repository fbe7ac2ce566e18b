package com.genderai.server.model;

import com.genderai.server.ai.ImagePreprocessor;
import com.genderai.server.ai.classification.GenderModel;
import com.genderai.server.ai.detection.PersonDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * The classifier, its preprocessing and the person detector, loaded together.
 * Immutable and shared read-only once published as Ready.
 */
public class ModelBundle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ModelBundle.class);

    private final GenderModel classifier;
    private final ImagePreprocessor preprocessor;
    private final PersonDetector detector;
    private final String bucket;
    private final String prefix;
    private final Path cachePath;

    public ModelBundle(GenderModel classifier, ImagePreprocessor preprocessor, PersonDetector detector,
            String bucket, String prefix, Path cachePath) {
        this.classifier = classifier;
        this.preprocessor = preprocessor;
        this.detector = detector;
        this.bucket = bucket;
        this.prefix = prefix;
        this.cachePath = cachePath;
    }

    public GenderModel getClassifier() {
        return classifier;
    }

    public ImagePreprocessor getPreprocessor() {
        return preprocessor;
    }

    public PersonDetector getDetector() {
        return detector;
    }

    public String getBucket() {
        return bucket;
    }

    public String getPrefix() {
        return prefix;
    }

    public Path getCachePath() {
        return cachePath;
    }

    @Override
    public void close() {
        try {
            classifier.close();
        } catch (Exception e) {
            logger.warn("Failed to close classifier", e);
        }
        try {
            detector.close();
        } catch (Exception e) {
            logger.warn("Failed to close detector", e);
        }
    }
}
