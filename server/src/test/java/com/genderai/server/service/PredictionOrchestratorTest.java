package com.genderai.server.service;

import com.genderai.server.ai.classification.GenderClassifier;
import com.genderai.server.ai.detection.Detection;
import com.genderai.server.ai.detection.DetectionSettings;
import com.genderai.server.ai.detection.PersonDetectorGate;
import com.genderai.server.artifact.FetchException;
import com.genderai.server.config.GenderProperties;
import com.genderai.server.inference.CancellationSignal;
import com.genderai.server.inference.InferencePool;
import com.genderai.server.model.LoadState;
import com.genderai.server.model.LoaderSettings;
import com.genderai.server.model.ModelLoader;
import com.genderai.server.testsupport.FakeModels;
import com.genderai.server.testsupport.FakeModels.FakeArtifactStore;
import com.genderai.server.testsupport.FakeModels.FakeDetector;
import com.genderai.server.testsupport.FakeModels.FakeGenderModel;
import com.genderai.server.testsupport.FakeModels.FakeModelFactory;
import com.genderai.server.testsupport.MutableClock;
import com.genderai.server.testsupport.TestImages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class PredictionOrchestratorTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    /** Image width selects how many people the fake detector reports. */
    private static final byte[] ONE_PERSON = TestImages.png(20, 24);
    private static final byte[] NO_PERSON = TestImages.png(10, 24);
    private static final byte[] TWO_PEOPLE = TestImages.png(30, 24);
    private static final byte[] THREE_PEOPLE = TestImages.png(40, 24);

    @TempDir
    Path tmp;

    private MutableClock clock;
    private FakeArtifactStore store;
    private FakeGenderModel genderModel;
    private FakeDetector detector;
    private volatile CountDownLatch detectorGate;
    private volatile RuntimeException detectorFailure;
    private ModelLoader loader;
    private InferencePool pool;
    private GenderProperties properties;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(START);
        store = new FakeArtifactStore();
        genderModel = FakeGenderModel.withMaleProbability(0.892);
        detector = new FakeDetector(img -> {
            CountDownLatch gate = detectorGate;
            if (gate != null) {
                try {
                    gate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (detectorFailure != null) {
                throw detectorFailure;
            }
            return FakeModels.persons(img.getWidth() / 10 - 1, 0.9);
        });
        properties = new GenderProperties();
        loader = new ModelLoader(store, new FakeModelFactory(detector, genderModel),
                new LoaderSettings("bucket", "models/", tmp.resolve("cache"), Duration.ofSeconds(1),
                        Duration.ofSeconds(60), Duration.ofMinutes(1)),
                clock);
        pool = new InferencePool(1, 4);
    }

    @AfterEach
    public void tearDown() {
        CountDownLatch gate = detectorGate;
        if (gate != null) {
            gate.countDown();
        }
        pool.close();
        loader.close();
    }

    private PredictionOrchestrator orchestrator() {
        return new PredictionOrchestrator(loader, pool, new PersonDetectorGate(DetectionSettings.defaults()),
                new GenderClassifier(0.6), properties, clock);
    }

    @Test
    public void testSinglePersonIsClassified() {
        PredictionOutcome outcome = orchestrator().predict(ONE_PERSON);

        assertEquals(PredictionOutcome.Kind.SUCCESS, outcome.getKind());
        PredictionOutcome.Success success = (PredictionOutcome.Success) outcome;
        assertEquals("male", success.getLabel());
        assertEquals(0.892, success.getConfidence(), 1e-9);
        assertEquals(0.892, success.getMale(), 1e-9);
        assertEquals(0.108, success.getFemale(), 1e-9);
        assertEquals(1, success.getPersonCount());
        assertFalse(success.isLowConfidence());
    }

    @Test
    public void testNoPersonIsRejectedWithoutClassifying() {
        PredictionOutcome outcome = orchestrator().predict(NO_PERSON);

        assertEquals(PredictionOutcome.Kind.REJECTED, outcome.getKind());
        PredictionOutcome.Rejected rejected = (PredictionOutcome.Rejected) outcome;
        assertEquals(PredictionOutcome.RejectReason.NO_PERSON, rejected.getReason());
        assertEquals("No person detected", rejected.getMessage());
        assertEquals(0, rejected.getPersonCount());
        assertEquals(0, genderModel.calls.get());
    }

    @Test
    public void testGroupPhotoIsRejectedWithCount() {
        PredictionOrchestrator orchestrator = orchestrator();

        PredictionOutcome.Rejected two = (PredictionOutcome.Rejected) orchestrator.predict(TWO_PEOPLE);
        assertEquals("Multiple people detected (2 people). Please use single-person images.", two.getMessage());
        assertEquals(2, two.getPersonCount());

        PredictionOutcome.Rejected three = (PredictionOutcome.Rejected) orchestrator.predict(THREE_PEOPLE);
        assertEquals(3, three.getPersonCount());
        assertEquals(0, genderModel.calls.get());
    }

    @Test
    public void testUndecodableImageFailsBeforeAnyModelWork() {
        PredictionOutcome outcome = orchestrator().predict(TestImages.corrupt());

        assertEquals(PredictionOutcome.Kind.FAILURE, outcome.getKind());
        assertEquals(PredictionOutcome.FailureKind.INVALID_IMAGE,
                ((PredictionOutcome.Failure) outcome).getFailureKind());
        assertEquals(0, store.fetches.get());
        assertEquals(LoadState.Kind.NOT_LOADED, loader.currentState().getKind());
    }

    @Test
    public void testModelUnavailableCarriesRetryHint() {
        store.failWith(new FetchException(FetchException.Kind.NETWORK_ERROR, "model.onnx", "connection reset"));
        PredictionOrchestrator orchestrator = orchestrator();

        PredictionOutcome.Failure failure = (PredictionOutcome.Failure) orchestrator.predict(ONE_PERSON);

        assertEquals(PredictionOutcome.FailureKind.MODEL_UNAVAILABLE, failure.getFailureKind());
        assertEquals("Model unavailable. Retry in 1 seconds.", failure.getMessage());
        assertEquals(START.plusSeconds(1), failure.getRetryAfter());

        HealthSnapshot health = orchestrator.health();
        assertFalse(health.isHealthy());
        assertEquals(LoadState.Kind.FAILED, health.getLoadState());

        // recovers once the store is back and the backoff has elapsed
        store.recover();
        clock.advance(Duration.ofSeconds(1));
        assertEquals(PredictionOutcome.Kind.SUCCESS, orchestrator.predict(ONE_PERSON).getKind());
        assertTrue(orchestrator.health().isHealthy());
    }

    @Test
    public void testModelLoadCountsAgainstRequestTimeout() throws Exception {
        properties.getInference().setRequestTimeout(Duration.ofMillis(200));
        PredictionOrchestrator orchestrator = orchestrator();
        CountDownLatch release = new CountDownLatch(1);
        store.blockUntil(release);
        try {
            long started = System.nanoTime();
            PredictionOutcome.Failure failure = (PredictionOutcome.Failure) orchestrator.predict(ONE_PERSON);
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertEquals(PredictionOutcome.FailureKind.MODEL_UNAVAILABLE, failure.getFailureKind());
            assertEquals("Model unavailable. Retry in 1 seconds.", failure.getMessage());
            assertEquals(START.plusSeconds(1), failure.getRetryAfter());
            assertTrue(elapsedMillis < 2000, "waited " + elapsedMillis + " ms for the model");
            assertEquals(LoadState.Kind.LOADING, orchestrator.health().getLoadState());
        } finally {
            release.countDown();
        }

        loader.ensureReady();
        assertEquals(PredictionOutcome.Kind.SUCCESS, orchestrator.predict(ONE_PERSON).getKind());
        assertEquals(1, store.fetches.get());
    }

    @Test
    public void testImageAbovePixelLimitIsInvalid() {
        properties.getUpload().setMaxPixels(100);

        PredictionOutcome outcome = orchestrator().predict(ONE_PERSON);

        assertEquals(PredictionOutcome.FailureKind.INVALID_IMAGE,
                ((PredictionOutcome.Failure) outcome).getFailureKind());
        assertEquals(0, store.fetches.get());
    }

    @Test
    public void testSaturatedPoolAnswersBusy() throws Exception {
        pool.close();
        pool = new InferencePool(1, 0);
        PredictionOrchestrator orchestrator = orchestrator();

        CountDownLatch hold = new CountDownLatch(1);
        CountDownLatch running = new CountDownLatch(1);
        pool.submit(() -> {
            running.countDown();
            return hold.await(10, TimeUnit.SECONDS);
        });
        try {
            assertTrue(running.await(5, TimeUnit.SECONDS));
            PredictionOutcome.Failure busy = (PredictionOutcome.Failure) orchestrator.predict(ONE_PERSON);

            assertEquals(PredictionOutcome.FailureKind.BUSY, busy.getFailureKind());
            assertEquals("Server busy, please retry shortly", busy.getMessage());
            assertNotNull(busy.getRetryAfter());
        } finally {
            hold.countDown();
        }
    }

    @Test
    public void testCancelledRequestSkipsInference() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        PredictionOutcome.Failure failure = (PredictionOutcome.Failure) orchestrator().predict(ONE_PERSON, signal);

        assertEquals(PredictionOutcome.FailureKind.CANCELLED, failure.getFailureKind());
        assertEquals(0, detector.calls.get());
        assertEquals(0, genderModel.calls.get());
    }

    @Test
    public void testSlowInferenceTimesOut() throws Exception {
        loader.ensureReady();
        properties.getInference().setRequestTimeout(Duration.ofMillis(100));
        PredictionOrchestrator orchestrator = orchestrator();
        assertEquals(PredictionOutcome.Kind.SUCCESS, orchestrator.predict(ONE_PERSON).getKind());
        detectorGate = new CountDownLatch(1);

        CancellationSignal signal = CancellationSignal.create();
        PredictionOutcome.Failure failure = (PredictionOutcome.Failure) orchestrator.predict(ONE_PERSON, signal);

        assertEquals(PredictionOutcome.FailureKind.TIMEOUT, failure.getFailureKind());
        assertTrue(signal.isCancelled());
        assertEquals(1, genderModel.calls.get(), "classification must not start after the deadline");
    }

    @Test
    public void testDetectorCrashIsAnInferenceError() {
        PredictionOrchestrator orchestrator = orchestrator();
        detectorFailure = new IllegalStateException("ONNX session died");

        PredictionOutcome.Failure failure = (PredictionOutcome.Failure) orchestrator.predict(ONE_PERSON);

        assertEquals(PredictionOutcome.FailureKind.INFERENCE_ERROR, failure.getFailureKind());
        assertFalse(failure.getMessage().contains("ONNX"), "internal details must not leak to callers");
    }

    @Test
    public void testBatchKeepsOrderAndIsolatesFailures() {
        List<PredictionOutcome> outcomes = orchestrator().predictBatch(
                Arrays.asList(ONE_PERSON, TestImages.corrupt(), TWO_PEOPLE, NO_PERSON));

        assertEquals(4, outcomes.size());
        assertEquals(PredictionOutcome.Kind.SUCCESS, outcomes.get(0).getKind());
        assertEquals(PredictionOutcome.FailureKind.INVALID_IMAGE,
                ((PredictionOutcome.Failure) outcomes.get(1)).getFailureKind());
        assertEquals(PredictionOutcome.RejectReason.MULTIPLE_PEOPLE,
                ((PredictionOutcome.Rejected) outcomes.get(2)).getReason());
        assertEquals(PredictionOutcome.RejectReason.NO_PERSON,
                ((PredictionOutcome.Rejected) outcomes.get(3)).getReason());
        assertEquals(1, store.fetches.get());
    }

    @Test
    public void testHealthNeverStartsALoad() {
        HealthSnapshot health = orchestrator().health();

        assertFalse(health.isHealthy());
        assertEquals(LoadState.Kind.NOT_LOADED, health.getLoadState());
        assertEquals(0, store.fetches.get());
    }

    @Test
    public void testDetectionsBelowThresholdCountAsNoPerson() {
        List<Detection> weak = FakeModels.persons(1, 0.5);
        loader.close();
        loader = new ModelLoader(store, new FakeModelFactory(FakeDetector.always(weak), genderModel),
                new LoaderSettings("bucket", "models/", tmp.resolve("cache2"), Duration.ofSeconds(1),
                        Duration.ofSeconds(60), Duration.ofMinutes(1)),
                clock);

        PredictionOutcome outcome = orchestrator().predict(ONE_PERSON);

        assertEquals(PredictionOutcome.RejectReason.NO_PERSON, ((PredictionOutcome.Rejected) outcome).getReason());
    }
}
