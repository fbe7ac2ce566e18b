package com.genderai.server.model;

import com.genderai.server.ai.ImagePreprocessor;
import com.genderai.server.ai.classification.GenderModel;
import com.genderai.server.ai.detection.PersonDetector;
import com.genderai.server.artifact.ArtifactStore;
import com.genderai.server.artifact.FetchException;
import com.genderai.server.artifact.RequiredArtifacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the process's single {@link ModelBundle}.
 * <p>
 * State moves NOT_LOADED -> LOADING -> READY, or LOADING -> FAILED. A FAILED
 * state turns back into NOT_LOADED once its retry time has passed, and the next
 * caller starts a new attempt. Only the caller that wins the NOT_LOADED ->
 * LOADING swap starts a load; everyone else, winner included, waits on the same
 * future and sees the same result.
 * <p>
 * Each attempt runs on its own thread. An attempt that times out is
 * interrupted and cannot hold up the next one.
 */
public class ModelLoader implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ModelLoader.class);

    private final ArtifactStore artifactStore;
    private final ModelFactory modelFactory;
    private final LoaderSettings settings;
    private final Clock clock;
    private final ExecutorService loaderThreads;
    private final AtomicReference<LoadState> state = new AtomicReference<>(LoadState.notLoaded(0));

    public ModelLoader(ArtifactStore artifactStore, ModelFactory modelFactory, LoaderSettings settings, Clock clock) {
        this.artifactStore = artifactStore;
        this.modelFactory = modelFactory;
        this.settings = settings;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.loaderThreads = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "model-loader-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Current state without side effects; never starts a load.
     */
    public LoadState currentState() {
        return state.get();
    }

    /**
     * Returns the Ready bundle, loading it first if needed. Blocks while a load
     * is in flight, for as long as the load is allowed to take.
     *
     * @throws LoadException the recorded failure of the current or most recent
     *                       attempt, carrying the time of the next retry
     */
    public ModelBundle ensureReady() throws LoadException {
        return ensureReady(null);
    }

    /**
     * Like {@link #ensureReady()} but waits at most {@code maxWait} for an
     * attempt in flight. Giving up does not affect the attempt.
     *
     * @param maxWait how long to wait, or null for no limit
     * @throws LoadException of kind {@code STILL_LOADING} when the wait ran out
     */
    public ModelBundle ensureReady(Duration maxWait) throws LoadException {
        while (true) {
            LoadState current = state.get();
            switch (current.getKind()) {
                case READY:
                    return current.getBundle();
                case LOADING:
                    return await(current, maxWait);
                case FAILED:
                    if (clock.instant().isBefore(current.getRetryAfter())) {
                        throw current.getError().withRetryAfter(current.getRetryAfter());
                    }
                    if (state.compareAndSet(current, LoadState.notLoaded(current.getFailedAttempts()))) {
                        logger.info("Backoff elapsed after {} failed attempt(s), model load may be retried",
                                current.getFailedAttempts());
                    }
                    break;
                case NOT_LOADED:
                    LoadState loading = LoadState.loading(new CompletableFuture<>(), new LoadProgress(),
                            current.getFailedAttempts());
                    if (state.compareAndSet(current, loading)) {
                        start(loading);
                        return await(loading, maxWait);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown load state " + current);
            }
        }
    }

    private void start(LoadState loading) {
        CompletableFuture<ModelBundle> future = loading.getInFlight();
        future.orTimeout(settings.getLoadTimeout().toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Loading model bundle from {}/{} (attempt {})", settings.getBucket(), settings.getPrefix(),
                loading.getFailedAttempts() + 1);

        Future<?> attempt = loaderThreads.submit(() -> {
            ModelBundle bundle;
            try {
                bundle = load(loading.getProgress());
            } catch (LoadException e) {
                settle(loading, null, e);
                future.completeExceptionally(e);
                return;
            } catch (RuntimeException e) {
                LoadException wrapped = new LoadException(LoadException.Kind.CORRUPT_ARTIFACT,
                        "Unexpected failure while loading models: " + e.getMessage(), e);
                settle(loading, null, wrapped);
                future.completeExceptionally(wrapped);
                return;
            }
            if (settle(loading, bundle, null) == null) {
                future.complete(bundle);
                return;
            }
            // the attempt timed out while we were still loading
            logger.warn("Model load finished after the attempt was abandoned, discarding the result");
            bundle.close();
        });
        future.whenComplete((result, error) -> {
            if (error instanceof TimeoutException) {
                logger.warn("Model load exceeded {}, interrupting the attempt", settings.getLoadTimeout());
                // callers may have stopped waiting, so record the failure here
                settle(loading, null, toLoadException(error));
                attempt.cancel(true);
            }
        });
    }

    private ModelBundle await(LoadState loading, Duration maxWait) throws LoadException {
        try {
            if (maxWait == null) {
                return loading.getInFlight().get();
            }
            return loading.getInFlight().get(Math.max(0L, maxWait.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new LoadException(LoadException.Kind.STILL_LOADING, "Model is still loading",
                    clock.instant().plus(settings.getInitialBackoff()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadException(LoadException.Kind.TIMEOUT, "Interrupted while waiting for the model load", e);
        } catch (ExecutionException e) {
            LoadException recorded = settle(loading, null, toLoadException(e.getCause()));
            throw recorded != null ? recorded : toLoadException(e.getCause());
        }
    }

    /**
     * Publishes the outcome of an attempt. Idempotent: only the first call for a
     * given LOADING state changes anything.
     *
     * @return the failure as recorded on the state, or null on success
     */
    private LoadException settle(LoadState loading, ModelBundle bundle, LoadException error) {
        if (error == null) {
            if (state.compareAndSet(loading, LoadState.ready(bundle))) {
                logger.info("All models loaded successfully from {}", bundle.getCachePath());
                return null;
            }
            LoadState now = state.get();
            return now.getKind() == LoadState.Kind.FAILED
                    ? now.getError()
                    : new LoadException(LoadException.Kind.TIMEOUT, "Model load was abandoned", null);
        }

        int attempts = loading.getFailedAttempts() + 1;
        Duration backoff = settings.backoffFor(attempts);
        Instant retryAfter = clock.instant().plus(backoff);
        LoadException recorded = error.withRetryAfter(retryAfter);
        if (state.compareAndSet(loading, LoadState.failed(recorded, retryAfter, attempts))) {
            logger.error("Model load failed ({}), retry in {}s: {}", error.getKind(), backoff.getSeconds(),
                    error.getMessage(), error.getCause());
            return recorded;
        }
        LoadState now = state.get();
        return now.getKind() == LoadState.Kind.FAILED ? now.getError() : recorded;
    }

    private static LoadException toLoadException(Throwable cause) {
        if (cause instanceof LoadException) {
            return (LoadException) cause;
        }
        if (cause instanceof TimeoutException) {
            return new LoadException(LoadException.Kind.TIMEOUT, "Model load timed out", cause);
        }
        return new LoadException(LoadException.Kind.CORRUPT_ARTIFACT,
                "Model load failed: " + (cause != null ? cause.getMessage() : "unknown"), cause);
    }

    private ModelBundle load(LoadProgress progress) throws LoadException {
        Path dir = settings.getCacheDir();
        if (RequiredArtifacts.isComplete(dir)) {
            logger.info("Using cached model artifacts in {}", dir);
        } else {
            logger.info("Downloading model artifacts from {}/{} to {}", settings.getBucket(), settings.getPrefix(),
                    dir);
            try {
                artifactStore.fetch(settings.getBucket(), settings.getPrefix(), dir);
            } catch (FetchException e) {
                throw new LoadException(LoadException.Kind.ARTIFACT_UNAVAILABLE, e.getMessage(), e);
            } catch (RuntimeException e) {
                throw new LoadException(LoadException.Kind.ARTIFACT_UNAVAILABLE,
                        "Artifact store failed: " + e.getMessage(), e);
            }
            if (!RequiredArtifacts.isComplete(dir)) {
                throw new LoadException(LoadException.Kind.ARTIFACT_UNAVAILABLE,
                        "Artifact store reported success but " + dir + " is incomplete", null);
            }
        }

        ImagePreprocessor preprocessor;
        GenderModel classifier = null;
        PersonDetector detector = null;
        try {
            preprocessor = modelFactory.createPreprocessor(dir);
            progress.markPreprocessorLoaded();

            logger.info("Loading gender classification model...");
            classifier = modelFactory.createClassifier(dir);
            progress.markClassifierLoaded();

            logger.info("Loading person detection model...");
            detector = modelFactory.createDetector(dir);
            progress.markDetectorLoaded();
        } catch (Exception e) {
            closeQuietly(classifier);
            closeQuietly(detector);
            throw new LoadException(LoadException.Kind.CORRUPT_ARTIFACT,
                    "Cannot deserialize model artifacts in " + dir + ": " + e.getMessage(), e);
        }
        return new ModelBundle(classifier, preprocessor, detector, settings.getBucket(), settings.getPrefix(), dir);
    }

    private static void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            logger.warn("Failed to release partially loaded model", e);
        }
    }

    @Override
    public void close() {
        loaderThreads.shutdownNow();
        LoadState last = state.getAndSet(LoadState.notLoaded(0));
        if (last.getKind() == LoadState.Kind.READY) {
            last.getBundle().close();
            logger.info("Model bundle released");
        }
    }
}
