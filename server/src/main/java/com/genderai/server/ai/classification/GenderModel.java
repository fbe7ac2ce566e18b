package com.genderai.server.ai.classification;

public interface GenderModel extends AutoCloseable {
    /**
     * One forward pass over a preprocessed {@code [1, 3, H, W]} tensor.
     *
     * @return the two raw class logits, indexed as in {@link #labels()}
     */
    double[] forward(float[] pixelValues, long[] shape);

    LabelMap labels();

    @Override
    default void close() {
    }
}
