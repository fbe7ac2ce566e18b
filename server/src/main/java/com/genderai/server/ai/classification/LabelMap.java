package com.genderai.server.ai.classification;

import java.util.Locale;
import java.util.Map;

/**
 * Which logit index is "male" and which is "female", read from {@code id2label}.
 */
public class LabelMap {
    public static final String MALE = "male";
    public static final String FEMALE = "female";

    private final int maleIndex;
    private final int femaleIndex;

    public LabelMap(int maleIndex, int femaleIndex) {
        if (maleIndex == femaleIndex || maleIndex < 0 || femaleIndex < 0) {
            throw new IllegalArgumentException("Invalid label indices male=" + maleIndex + " female=" + femaleIndex);
        }
        this.maleIndex = maleIndex;
        this.femaleIndex = femaleIndex;
    }

    /**
     * @throws IllegalArgumentException when the map is not exactly a two-class
     *                                  male/female mapping
     */
    public static LabelMap fromId2Label(Map<String, String> id2label) {
        if (id2label == null || id2label.size() != 2) {
            throw new IllegalArgumentException("id2label must map exactly two classes, got " + id2label);
        }
        int male = -1;
        int female = -1;
        for (Map.Entry<String, String> e : id2label.entrySet()) {
            int idx;
            try {
                idx = Integer.parseInt(e.getKey().trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Non-numeric class id '" + e.getKey() + "'", ex);
            }
            String label = e.getValue() == null ? "" : e.getValue().trim().toLowerCase(Locale.ROOT);
            if (MALE.equals(label)) {
                male = idx;
            } else if (FEMALE.equals(label)) {
                female = idx;
            }
        }
        if (male < 0 || female < 0 || male > 1 || female > 1) {
            throw new IllegalArgumentException("id2label must name classes 0 and 1 male/female, got " + id2label);
        }
        return new LabelMap(male, female);
    }

    public static LabelMap standard() {
        return new LabelMap(0, 1);
    }

    public int getMaleIndex() {
        return maleIndex;
    }

    public int getFemaleIndex() {
        return femaleIndex;
    }

    public String labelOf(int index) {
        if (index == maleIndex) {
            return MALE;
        }
        if (index == femaleIndex) {
            return FEMALE;
        }
        throw new IllegalArgumentException("No label for class index " + index);
    }
}
