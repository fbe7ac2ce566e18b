package com.genderai.server.ai.detection;

import com.genderai.server.ai.DecodedImage;
import com.genderai.server.ai.InferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts the people in an image and decides whether classification may run.
 * <p>
 * A hit counts when its score is strictly above the threshold, it covers more
 * than the minimum share of the image and it is taller than the minimum share of
 * the image height. The size filters keep small background figures from turning
 * a portrait into a group photo.
 */
public class PersonDetectorGate {

    private static final Logger logger = LoggerFactory.getLogger(PersonDetectorGate.class);

    private final DetectionSettings settings;

    public PersonDetectorGate(DetectionSettings settings) {
        this.settings = settings;
    }

    public DetectionSettings getSettings() {
        return settings;
    }

    public DetectionOutcome evaluate(PersonDetector detector, DecodedImage image) {
        List<Detection> raw = detector.detect(image);
        if (raw == null) {
            throw new InferenceException("Detector returned no result");
        }

        List<Detection> retained = new ArrayList<>();
        for (Detection d : raw) {
            if (!Double.isFinite(d.getScore())) {
                throw new InferenceException("Detector produced a non-finite score: " + d);
            }
            if (d.getScore() > settings.getScoreThreshold()
                    && d.relativeArea() > settings.getMinRelativeArea()
                    && d.relativeHeight() > settings.getMinRelativeHeight()) {
                retained.add(d);
            }
        }

        if (settings.getSuppression() == SuppressionStrategy.GREEDY_IOU && retained.size() > 1) {
            retained = NonMaxSuppression.greedy(retained, settings.getNmsIouThreshold());
        }

        List<Double> confidences = new ArrayList<>(retained.size());
        for (Detection d : retained) {
            confidences.add(d.getScore());
        }
        logger.debug("Person detection: raw={} retained={}", raw.size(), retained.size());
        return new DetectionOutcome(confidences);
    }
}
