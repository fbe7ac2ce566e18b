package com.genderai.server.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Which parts of a bundle have finished loading during an attempt.
 */
public class LoadProgress {
    private final AtomicBoolean preprocessor = new AtomicBoolean();
    private final AtomicBoolean classifier = new AtomicBoolean();
    private final AtomicBoolean detector = new AtomicBoolean();

    public boolean isPreprocessorLoaded() {
        return preprocessor.get();
    }

    public boolean isClassifierLoaded() {
        return classifier.get();
    }

    public boolean isDetectorLoaded() {
        return detector.get();
    }

    void markPreprocessorLoaded() {
        preprocessor.set(true);
    }

    void markClassifierLoaded() {
        classifier.set(true);
    }

    void markDetectorLoaded() {
        detector.set(true);
    }
}
