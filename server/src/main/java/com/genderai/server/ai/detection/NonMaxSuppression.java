package com.genderai.server.ai.detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class NonMaxSuppression {

    private NonMaxSuppression() {
    }

    /**
     * Greedy NMS: walk detections by descending score and drop any that overlaps
     * an already kept one by more than {@code iouThreshold}.
     */
    public static List<Detection> greedy(List<Detection> detections, double iouThreshold) {
        List<Detection> sorted = new ArrayList<>(detections);
        sorted.sort(Comparator.comparingDouble(Detection::getScore).reversed());

        List<Detection> kept = new ArrayList<>();
        for (Detection candidate : sorted) {
            boolean suppressed = false;
            for (Detection k : kept) {
                if (candidate.iou(k) > iouThreshold) {
                    suppressed = true;
                    break;
                }
            }
            if (!suppressed) {
                kept.add(candidate);
            }
        }
        return kept;
    }
}
