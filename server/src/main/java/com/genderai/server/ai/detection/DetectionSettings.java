package com.genderai.server.ai.detection;

/**
 * Filters that decide which person hits are counted.
 */
public class DetectionSettings {

    public static final double DEFAULT_SCORE_THRESHOLD = 0.7;
    public static final double DEFAULT_MIN_RELATIVE_AREA = 0.05;
    public static final double DEFAULT_MIN_RELATIVE_HEIGHT = 0.2;
    public static final double DEFAULT_NMS_IOU_THRESHOLD = 0.5;

    private final double scoreThreshold;
    private final double minRelativeArea;
    private final double minRelativeHeight;
    private final SuppressionStrategy suppression;
    private final double nmsIouThreshold;

    public DetectionSettings(double scoreThreshold, double minRelativeArea, double minRelativeHeight,
            SuppressionStrategy suppression, double nmsIouThreshold) {
        if (scoreThreshold < 0.0 || scoreThreshold > 1.0) {
            throw new IllegalArgumentException("Score threshold must be in [0,1]: " + scoreThreshold);
        }
        if (nmsIouThreshold <= 0.0 || nmsIouThreshold > 1.0) {
            throw new IllegalArgumentException("NMS IoU threshold must be in (0,1]: " + nmsIouThreshold);
        }
        this.scoreThreshold = scoreThreshold;
        this.minRelativeArea = minRelativeArea;
        this.minRelativeHeight = minRelativeHeight;
        this.suppression = suppression != null ? suppression : SuppressionStrategy.NONE;
        this.nmsIouThreshold = nmsIouThreshold;
    }

    public static DetectionSettings defaults() {
        return new DetectionSettings(DEFAULT_SCORE_THRESHOLD, DEFAULT_MIN_RELATIVE_AREA,
                DEFAULT_MIN_RELATIVE_HEIGHT, SuppressionStrategy.NONE, DEFAULT_NMS_IOU_THRESHOLD);
    }

    public double getScoreThreshold() {
        return scoreThreshold;
    }

    public double getMinRelativeArea() {
        return minRelativeArea;
    }

    public double getMinRelativeHeight() {
        return minRelativeHeight;
    }

    public SuppressionStrategy getSuppression() {
        return suppression;
    }

    public double getNmsIouThreshold() {
        return nmsIouThreshold;
    }
}
