package com.genderai.server.ai.detection;

/**
 * One detector hit. Box corners are normalized to the image size, so
 * {@code 0 <= xmin <= xmax <= 1} and likewise for y.
 */
public class Detection {
    private final int labelId;
    private final double score;
    private final double xmin;
    private final double ymin;
    private final double xmax;
    private final double ymax;

    public Detection(int labelId, double score, double xmin, double ymin, double xmax, double ymax) {
        this.labelId = labelId;
        this.score = score;
        this.xmin = xmin;
        this.ymin = ymin;
        this.xmax = xmax;
        this.ymax = ymax;
    }

    public int getLabelId() {
        return labelId;
    }

    public double getScore() {
        return score;
    }

    public double getXmin() {
        return xmin;
    }

    public double getYmin() {
        return ymin;
    }

    public double getXmax() {
        return xmax;
    }

    public double getYmax() {
        return ymax;
    }

    public double relativeWidth() {
        return Math.max(0.0, xmax - xmin);
    }

    public double relativeHeight() {
        return Math.max(0.0, ymax - ymin);
    }

    public double relativeArea() {
        return relativeWidth() * relativeHeight();
    }

    public double iou(Detection other) {
        double ix = Math.max(0.0, Math.min(xmax, other.xmax) - Math.max(xmin, other.xmin));
        double iy = Math.max(0.0, Math.min(ymax, other.ymax) - Math.max(ymin, other.ymin));
        double inter = ix * iy;
        double union = relativeArea() + other.relativeArea() - inter;
        return union <= 0.0 ? 0.0 : inter / union;
    }

    @Override
    public String toString() {
        return "Detection{" +
                "label=" + labelId +
                ", score=" + String.format("%.3f", score) +
                ", box=[" + String.format("%.3f, %.3f, %.3f, %.3f", xmin, ymin, xmax, ymax) + "]" +
                '}';
    }
}
