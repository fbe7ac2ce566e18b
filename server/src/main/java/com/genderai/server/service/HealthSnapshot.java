package com.genderai.server.service;

import com.genderai.server.model.LoadState;

import java.time.Instant;

public class HealthSnapshot {
    private final boolean classifierLoaded;
    private final boolean preprocessorLoaded;
    private final boolean detectorLoaded;
    private final LoadState.Kind loadState;
    private final Instant retryAfter;

    public HealthSnapshot(boolean classifierLoaded, boolean preprocessorLoaded, boolean detectorLoaded,
            LoadState.Kind loadState, Instant retryAfter) {
        this.classifierLoaded = classifierLoaded;
        this.preprocessorLoaded = preprocessorLoaded;
        this.detectorLoaded = detectorLoaded;
        this.loadState = loadState;
        this.retryAfter = retryAfter;
    }

    /**
     * Reads the state as is. Never triggers a load.
     */
    public static HealthSnapshot of(LoadState state) {
        switch (state.getKind()) {
            case READY:
                return new HealthSnapshot(true, true, true, state.getKind(), null);
            case LOADING:
                return new HealthSnapshot(
                        state.getProgress().isClassifierLoaded(),
                        state.getProgress().isPreprocessorLoaded(),
                        state.getProgress().isDetectorLoaded(),
                        state.getKind(), null);
            case FAILED:
                return new HealthSnapshot(false, false, false, state.getKind(), state.getRetryAfter());
            default:
                return new HealthSnapshot(false, false, false, state.getKind(), null);
        }
    }

    public boolean isClassifierLoaded() {
        return classifierLoaded;
    }

    public boolean isPreprocessorLoaded() {
        return preprocessorLoaded;
    }

    public boolean isDetectorLoaded() {
        return detectorLoaded;
    }

    public LoadState.Kind getLoadState() {
        return loadState;
    }

    public Instant getRetryAfter() {
        return retryAfter;
    }

    public boolean isHealthy() {
        return classifierLoaded && preprocessorLoaded && detectorLoaded;
    }
}
