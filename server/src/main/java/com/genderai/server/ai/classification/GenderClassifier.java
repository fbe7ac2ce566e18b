package com.genderai.server.ai.classification;

import com.genderai.server.ai.DecodedImage;
import com.genderai.server.ai.ImagePreprocessor;
import com.genderai.server.ai.InferenceException;
import com.genderai.server.ai.MathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GenderClassifier {

    private static final Logger logger = LoggerFactory.getLogger(GenderClassifier.class);

    public static final double DEFAULT_LOW_CONFIDENCE_THRESHOLD = 0.6;

    private final double lowConfidenceThreshold;

    public GenderClassifier(double lowConfidenceThreshold) {
        this.lowConfidenceThreshold = lowConfidenceThreshold;
    }

    public double getLowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }

    /**
     * Preprocesses the image, runs the model and turns the logits into a
     * male/female distribution.
     */
    public ClassificationOutcome classify(GenderModel model, ImagePreprocessor preprocessor, DecodedImage image) {
        float[] pixelValues = preprocessor.toTensor(image);
        long[] shape = preprocessor.tensorShape(image);

        double[] logits = model.forward(pixelValues, shape);
        if (logits == null || logits.length != 2) {
            throw new InferenceException("Classifier must return 2 logits, got "
                    + (logits == null ? "null" : logits.length));
        }
        if (!MathUtil.allFinite(logits)) {
            throw new InferenceException("Classifier produced non-finite logits");
        }

        double[] probs = MathUtil.softmax(logits);
        LabelMap labels = model.labels();
        double male = probs[labels.getMaleIndex()];
        double female = probs[labels.getFemaleIndex()];

        ClassificationOutcome outcome = new ClassificationOutcome(male, female,
                Math.max(male, female) < lowConfidenceThreshold);
        logger.debug("Classified: {}", outcome);
        return outcome;
    }
}
