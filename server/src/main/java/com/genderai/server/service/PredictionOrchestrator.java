package com.genderai.server.service;

import com.genderai.server.ai.DecodedImage;
import com.genderai.server.ai.ImageDecoder;
import com.genderai.server.ai.classification.ClassificationOutcome;
import com.genderai.server.ai.classification.GenderClassifier;
import com.genderai.server.ai.detection.DetectionOutcome;
import com.genderai.server.ai.detection.PersonDetectorGate;
import com.genderai.server.config.GenderProperties;
import com.genderai.server.inference.BusyException;
import com.genderai.server.inference.CancellationSignal;
import com.genderai.server.inference.CancelledException;
import com.genderai.server.inference.InferencePool;
import com.genderai.server.model.LoadException;
import com.genderai.server.model.ModelBundle;
import com.genderai.server.model.ModelLoader;
import com.genderai.server.util.RetryHints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one image (or a batch) through decode, model readiness, the person gate
 * and the classifier. Business rejections and infrastructure failures both come
 * back as {@link PredictionOutcome} values; nothing here throws for them.
 */
@Service
public class PredictionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PredictionOrchestrator.class);

    private final ModelLoader modelLoader;
    private final InferencePool inferencePool;
    private final PersonDetectorGate detectorGate;
    private final GenderClassifier classifier;
    private final Clock clock;
    private final long requestTimeoutMillis;
    private final ImageDecoder decoder;

    public PredictionOrchestrator(ModelLoader modelLoader, InferencePool inferencePool,
            PersonDetectorGate detectorGate, GenderClassifier classifier, GenderProperties properties,
            Clock clock) {
        this.modelLoader = modelLoader;
        this.inferencePool = inferencePool;
        this.detectorGate = detectorGate;
        this.classifier = classifier;
        this.clock = clock;
        this.requestTimeoutMillis = properties.getInference().getRequestTimeout().toMillis();
        this.decoder = new ImageDecoder(properties.getUpload().getMaxPixels());
    }

    public PredictionOutcome predict(byte[] imageBytes) {
        return predict(imageBytes, CancellationSignal.create());
    }

    /**
     * The request timeout covers waiting for the models as well as inference.
     */
    public PredictionOutcome predict(byte[] imageBytes, CancellationSignal signal) {
        long startNanos = System.nanoTime();
        DecodedImage image;
        try {
            image = decoder.decode(imageBytes);
        } catch (ImageDecoder.InvalidImageException e) {
            logger.info("Rejected undecodable upload: {}", e.getMessage());
            return PredictionOutcome.failure(PredictionOutcome.FailureKind.INVALID_IMAGE,
                    "Invalid image: " + e.getMessage());
        }

        ModelBundle bundle;
        try {
            bundle = modelLoader.ensureReady(Duration.ofMillis(remainingMillis(startNanos)));
        } catch (LoadException e) {
            return modelUnavailable(e);
        }

        if (signal.isCancelled()) {
            return PredictionOutcome.failure(PredictionOutcome.FailureKind.CANCELLED, "Request cancelled");
        }

        long remaining = remainingMillis(startNanos);
        if (remaining <= 0) {
            return timedOut();
        }
        try {
            return inferencePool.call(() -> runInference(bundle, image, signal), remaining, signal);
        } catch (BusyException e) {
            logger.warn("{}", e.getMessage());
            return PredictionOutcome.failure(PredictionOutcome.FailureKind.BUSY,
                    "Server busy, please retry shortly", clock.instant().plusSeconds(1));
        } catch (TimeoutException e) {
            return timedOut();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PredictionOutcome.failure(PredictionOutcome.FailureKind.CANCELLED, "Request cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CancelledException) {
                logger.info("Prediction cancelled: {}", cause.getMessage());
                return PredictionOutcome.failure(PredictionOutcome.FailureKind.CANCELLED, "Request cancelled");
            }
            logger.error("Error in prediction", cause);
            return PredictionOutcome.failure(PredictionOutcome.FailureKind.INFERENCE_ERROR,
                    "Prediction failed due to an internal error");
        }
    }

    /**
     * Evaluates each item on its own; the result has the same length and order
     * as the input.
     */
    public List<PredictionOutcome> predictBatch(List<byte[]> images) {
        List<PredictionOutcome> outcomes = new ArrayList<>(images.size());
        for (int i = 0; i < images.size(); i++) {
            PredictionOutcome outcome;
            try {
                outcome = predict(images.get(i));
            } catch (RuntimeException e) {
                logger.error("Batch item {} failed unexpectedly", i, e);
                outcome = PredictionOutcome.failure(PredictionOutcome.FailureKind.INFERENCE_ERROR,
                        "Prediction failed due to an internal error");
            }
            outcomes.add(outcome);
        }
        logger.info("Batch of {} processed", images.size());
        return outcomes;
    }

    public HealthSnapshot health() {
        return HealthSnapshot.of(modelLoader.currentState());
    }

    private PredictionOutcome runInference(ModelBundle bundle, DecodedImage image, CancellationSignal signal) {
        signal.checkpoint("person detection");
        DetectionOutcome detection = detectorGate.evaluate(bundle.getDetector(), image);

        switch (detection.decision()) {
            case NO_PERSON:
                return PredictionOutcome.noPerson();
            case MULTIPLE_PEOPLE:
                return PredictionOutcome.multiplePeople(detection.getPersonCount());
            default:
                break;
        }

        signal.checkpoint("gender classification");
        ClassificationOutcome result = classifier.classify(bundle.getClassifier(), bundle.getPreprocessor(), image);
        return PredictionOutcome.success(result.getLabel(), result.getConfidence(), result.getMale(),
                result.getFemale(), result.isLowConfidence());
    }

    private PredictionOutcome timedOut() {
        logger.warn("Prediction exceeded {} ms", requestTimeoutMillis);
        return PredictionOutcome.failure(PredictionOutcome.FailureKind.TIMEOUT,
                "Prediction timed out after " + requestTimeoutMillis + " ms");
    }

    private long remainingMillis(long startNanos) {
        return requestTimeoutMillis - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private PredictionOutcome modelUnavailable(LoadException e) {
        Instant now = clock.instant();
        Instant retryAfter = e.getRetryAfter() != null ? e.getRetryAfter() : now.plusSeconds(1);
        long seconds = RetryHints.secondsUntil(now, retryAfter);
        logger.warn("Model unavailable ({}): {}", e.getKind(), e.getMessage());
        return PredictionOutcome.failure(PredictionOutcome.FailureKind.MODEL_UNAVAILABLE,
                "Model unavailable. Retry in " + seconds + " seconds.", retryAfter);
    }
}
