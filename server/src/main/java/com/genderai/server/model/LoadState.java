package com.genderai.server.model;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Snapshot of the bundle's lifecycle. Instances are immutable; the loader swaps
 * them with compare-and-set, so identity matters.
 */
public final class LoadState {

    public enum Kind {
        NOT_LOADED,
        LOADING,
        READY,
        FAILED
    }

    private final Kind kind;
    private final ModelBundle bundle;
    private final CompletableFuture<ModelBundle> inFlight;
    private final LoadProgress progress;
    private final LoadException error;
    private final Instant retryAfter;
    private final int failedAttempts;

    private LoadState(Kind kind, ModelBundle bundle, CompletableFuture<ModelBundle> inFlight,
            LoadProgress progress, LoadException error, Instant retryAfter, int failedAttempts) {
        this.kind = kind;
        this.bundle = bundle;
        this.inFlight = inFlight;
        this.progress = progress;
        this.error = error;
        this.retryAfter = retryAfter;
        this.failedAttempts = failedAttempts;
    }

    static LoadState notLoaded(int failedAttempts) {
        return new LoadState(Kind.NOT_LOADED, null, null, null, null, null, failedAttempts);
    }

    static LoadState loading(CompletableFuture<ModelBundle> inFlight, LoadProgress progress, int failedAttempts) {
        return new LoadState(Kind.LOADING, null, inFlight, progress, null, null, failedAttempts);
    }

    static LoadState ready(ModelBundle bundle) {
        return new LoadState(Kind.READY, bundle, null, null, null, null, 0);
    }

    static LoadState failed(LoadException error, Instant retryAfter, int failedAttempts) {
        return new LoadState(Kind.FAILED, null, null, null, error, retryAfter, failedAttempts);
    }

    public Kind getKind() {
        return kind;
    }

    public ModelBundle getBundle() {
        return bundle;
    }

    CompletableFuture<ModelBundle> getInFlight() {
        return inFlight;
    }

    /**
     * Progress of the current attempt; null unless {@link Kind#LOADING}.
     */
    public LoadProgress getProgress() {
        return progress;
    }

    public LoadException getError() {
        return error;
    }

    public Instant getRetryAfter() {
        return retryAfter;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }

    @Override
    public String toString() {
        switch (kind) {
            case FAILED:
                return "FAILED(" + error.getKind() + ", retryAfter=" + retryAfter + ", attempts=" + failedAttempts + ")";
            default:
                return kind.name();
        }
    }
}
