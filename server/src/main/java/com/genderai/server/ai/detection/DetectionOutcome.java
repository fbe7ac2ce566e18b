package com.genderai.server.ai.detection;

import java.util.Collections;
import java.util.List;

/**
 * Counted persons for one image, after filtering and suppression.
 */
public class DetectionOutcome {
    private final int personCount;
    private final List<Double> confidences;

    public DetectionOutcome(List<Double> confidences) {
        this.confidences = Collections.unmodifiableList(confidences);
        this.personCount = confidences.size();
    }

    public int getPersonCount() {
        return personCount;
    }

    public List<Double> getConfidences() {
        return confidences;
    }

    public GateDecision decision() {
        if (personCount == 0) {
            return GateDecision.NO_PERSON;
        }
        return personCount == 1 ? GateDecision.ACCEPT : GateDecision.MULTIPLE_PEOPLE;
    }

    @Override
    public String toString() {
        return "DetectionOutcome{personCount=" + personCount + ", confidences=" + confidences + '}';
    }
}
