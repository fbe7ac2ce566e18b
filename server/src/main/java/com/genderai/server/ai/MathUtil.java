package com.genderai.server.ai;

public final class MathUtil {

    private MathUtil() {
    }

    /**
     * Computes the softmax of an array of scores.
     * Uses the "max trick" for numerical stability:
     * softmax(x_i) = exp(x_i - max(x)) / sum(exp(x_j - max(x)))
     */
    public static double[] softmax(double[] scores, double temperature) {
        if (temperature <= 0) {
            throw new IllegalArgumentException("Temperature must be positive");
        }

        double max = Double.NEGATIVE_INFINITY;
        for (double s : scores) {
            if (s > max)
                max = s;
        }

        double[] probs = new double[scores.length];
        double sum = 0.0;
        for (int i = 0; i < scores.length; i++) {
            double val = Math.exp((scores[i] - max) / temperature);
            probs[i] = val;
            sum += val;
        }

        for (int i = 0; i < probs.length; i++) {
            probs[i] /= sum;
        }
        return probs;
    }

    public static double[] softmax(double[] scores) {
        return softmax(scores, 1.0);
    }

    /**
     * Softmax over a float slice {@code [offset, offset + length)}.
     */
    public static double[] softmax(float[] scores, int offset, int length) {
        double[] slice = new double[length];
        for (int i = 0; i < length; i++) {
            slice[i] = scores[offset + i];
        }
        return softmax(slice, 1.0);
    }

    /**
     * Returns the index of the maximum value in the array.
     * Ties resolve to the lowest index.
     */
    public static int argmax(double[] x) {
        int bestIdx = -1;
        double bestVal = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < x.length; i++) {
            if (x[i] > bestVal) {
                bestVal = x[i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }

    public static boolean allFinite(double[] x) {
        for (double v : x) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    public static double clamp01(double v) {
        return v < 0.0 ? 0.0 : (v > 1.0 ? 1.0 : v);
    }
}
