package com.genderai.server.ai.classification;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.genderai.server.ai.InferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.util.Collections;

/**
 * Image classifier exported to ONNX with a {@code pixel_values} input and a
 * {@code [1, 2]} logits output.
 */
public class OnnxGenderModel implements GenderModel {

    private static final Logger logger = LoggerFactory.getLogger(OnnxGenderModel.class);

    private final OrtEnvironment env;
    private final OrtSession session;
    private final LabelMap labels;
    private final String inputName;
    private final String outputName;

    public OnnxGenderModel(OrtEnvironment env, OrtSession session, LabelMap labels, String inputName,
            String outputName) {
        this.env = env;
        this.session = session;
        this.labels = labels;
        this.inputName = inputName != null ? inputName : "pixel_values";
        this.outputName = outputName != null ? outputName : "logits";

        if (!session.getInputNames().contains(this.inputName)) {
            throw new IllegalArgumentException("Classifier has no input '" + this.inputName + "', inputs="
                    + session.getInputNames());
        }
        if (!session.getOutputNames().contains(this.outputName)) {
            throw new IllegalArgumentException("Classifier has no output '" + this.outputName + "', outputs="
                    + session.getOutputNames());
        }
    }

    @Override
    public double[] forward(float[] pixelValues, long[] shape) {
        try (OnnxTensor input = OnnxTensor.createTensor(env, FloatBuffer.wrap(pixelValues), shape);
                OrtSession.Result result = session.run(Collections.singletonMap(inputName, input))) {
            OnnxValue value = result.get(outputName)
                    .orElseThrow(() -> new InferenceException("Classifier output '" + outputName + "' missing"));
            Object raw = value.getValue();
            if (!(raw instanceof float[][]) || ((float[][]) raw).length == 0) {
                throw new InferenceException("Classifier output '" + outputName + "' is not a [1, N] float tensor");
            }
            float[] row = ((float[][]) raw)[0];
            double[] logits = new double[row.length];
            for (int i = 0; i < row.length; i++) {
                logits[i] = row[i];
            }
            return logits;
        } catch (OrtException e) {
            throw new InferenceException("Classifier forward pass failed", e);
        }
    }

    @Override
    public LabelMap labels() {
        return labels;
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            logger.warn("Failed to close classifier session", e);
        }
    }
}
