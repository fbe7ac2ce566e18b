package com.genderai.server.ai.classification;

public class ClassificationOutcome {
    private final double male;
    private final double female;
    private final String label;
    private final double confidence;
    private final boolean lowConfidence;

    public ClassificationOutcome(double male, double female, boolean lowConfidence) {
        this.male = male;
        this.female = female;
        // ties resolve to male
        this.label = male >= female ? LabelMap.MALE : LabelMap.FEMALE;
        this.confidence = Math.max(male, female);
        this.lowConfidence = lowConfidence;
    }

    public double getMale() {
        return male;
    }

    public double getFemale() {
        return female;
    }

    public String getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    @Override
    public String toString() {
        return "ClassificationOutcome{" +
                "label=" + label +
                ", confidence=" + String.format("%.4f", confidence) +
                ", male=" + String.format("%.4f", male) +
                ", female=" + String.format("%.4f", female) +
                (lowConfidence ? ", lowConfidence" : "") +
                '}';
    }
}
