package com.genderai.server.ai.detection;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.genderai.server.ai.DecodedImage;
import com.genderai.server.ai.ImagePreprocessor;
import com.genderai.server.ai.InferenceException;
import com.genderai.server.ai.MathUtil;
import com.genderai.server.model.ModelConfigs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Set-prediction detector (DETR family) exported to ONNX.
 * <p>
 * Expects class logits {@code [1, Q, C + 1]} whose last column is "no object"
 * and boxes {@code [1, Q, 4]} as normalized (cx, cy, w, h).
 */
public class OnnxPersonDetector implements PersonDetector {

    private static final Logger logger = LoggerFactory.getLogger(OnnxPersonDetector.class);

    static final int COCO_PERSON_ID = 1;

    private final OrtEnvironment env;
    private final OrtSession session;
    private final ImagePreprocessor preprocessor;
    private final String inputName;
    private final String logitsOutput;
    private final String boxesOutput;
    private final int personClassId;

    public OnnxPersonDetector(OrtEnvironment env, OrtSession session, ModelConfigs.DetectorConfig config) {
        this.env = env;
        this.session = session;
        this.preprocessor = new ImagePreprocessor(withDetectorDefaults(config.preprocessing));
        this.inputName = config.inputName != null ? config.inputName : "pixel_values";
        this.logitsOutput = config.logitsOutput != null ? config.logitsOutput : "logits";
        this.boxesOutput = config.boxesOutput != null ? config.boxesOutput : "pred_boxes";
        this.personClassId = config.personClassId != null ? config.personClassId : COCO_PERSON_ID;

        if (!session.getInputNames().contains(inputName)) {
            throw new IllegalArgumentException("Detector has no input '" + inputName + "', inputs="
                    + session.getInputNames());
        }
        if (!session.getOutputNames().contains(logitsOutput) || !session.getOutputNames().contains(boxesOutput)) {
            throw new IllegalArgumentException("Detector outputs " + session.getOutputNames()
                    + " do not contain '" + logitsOutput + "' and '" + boxesOutput + "'");
        }
    }

    static ModelConfigs.PreprocessorConfig withDetectorDefaults(ModelConfigs.PreprocessorConfig cfg) {
        ModelConfigs.PreprocessorConfig resolved = cfg != null ? cfg : new ModelConfigs.PreprocessorConfig();
        if (resolved.size == null) {
            resolved.size = Map.of("shortest_edge", 800, "longest_edge", 1333);
        }
        if (resolved.imageMean == null) {
            resolved.imageMean = Arrays.asList(0.485, 0.456, 0.406);
        }
        if (resolved.imageStd == null) {
            resolved.imageStd = Arrays.asList(0.229, 0.224, 0.225);
        }
        return resolved;
    }

    @Override
    public List<Detection> detect(DecodedImage image) {
        float[] data = preprocessor.toTensor(image);
        long[] shape = preprocessor.tensorShape(image);

        try (OnnxTensor input = OnnxTensor.createTensor(env, FloatBuffer.wrap(data), shape);
                OrtSession.Result result = session.run(Collections.singletonMap(inputName, input))) {

            float[][] logits = firstBatch(result, logitsOutput);
            float[][] boxes = firstBatch(result, boxesOutput);
            if (logits.length != boxes.length) {
                throw new InferenceException("Detector returned " + logits.length + " logit rows but "
                        + boxes.length + " boxes");
            }
            return decode(logits, boxes, personClassId);
        } catch (OrtException e) {
            throw new InferenceException("Detector forward pass failed", e);
        }
    }

    private static float[][] firstBatch(OrtSession.Result result, String name) throws OrtException {
        OnnxValue value = result.get(name)
                .orElseThrow(() -> new InferenceException("Detector output '" + name + "' missing"));
        Object raw = value.getValue();
        if (!(raw instanceof float[][][])) {
            throw new InferenceException("Detector output '" + name + "' is not a rank-3 float tensor");
        }
        float[][][] batch = (float[][][]) raw;
        if (batch.length == 0) {
            throw new InferenceException("Detector output '" + name + "' is empty");
        }
        return batch[0];
    }

    static List<Detection> decode(float[][] logits, float[][] boxes, int personClassId) {
        List<Detection> persons = new ArrayList<>();
        for (int q = 0; q < logits.length; q++) {
            float[] row = logits[q];
            if (row.length < 2 || boxes[q].length != 4) {
                throw new InferenceException("Unexpected detector output shape at query " + q);
            }
            double[] probs = MathUtil.softmax(row, 0, row.length);
            // last column is "no object"
            int best = MathUtil.argmax(Arrays.copyOf(probs, probs.length - 1));
            if (best != personClassId) {
                continue;
            }
            double cx = boxes[q][0];
            double cy = boxes[q][1];
            double w = boxes[q][2];
            double h = boxes[q][3];
            persons.add(new Detection(best, probs[best],
                    MathUtil.clamp01(cx - w / 2), MathUtil.clamp01(cy - h / 2),
                    MathUtil.clamp01(cx + w / 2), MathUtil.clamp01(cy + h / 2)));
        }
        logger.debug("Detector decoded {} person candidates from {} queries", persons.size(), logits.length);
        return persons;
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            logger.warn("Failed to close detector session", e);
        }
    }
}
