package com.genderai.server.ai.classification;

import com.genderai.server.ai.DecodedImage;
import com.genderai.server.ai.ImagePreprocessor;
import com.genderai.server.ai.InferenceException;
import com.genderai.server.testsupport.FakeModels;
import com.genderai.server.testsupport.FakeModels.FakeGenderModel;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GenderClassifierTest {

    private static final DecodedImage IMAGE =
            new DecodedImage(new BufferedImage(20, 30, BufferedImage.TYPE_INT_RGB));

    private final ImagePreprocessor preprocessor = FakeModels.smallPreprocessor();
    private final GenderClassifier classifier = new GenderClassifier(GenderClassifier.DEFAULT_LOW_CONFIDENCE_THRESHOLD);

    @Test
    public void testConfidentMale() {
        ClassificationOutcome out = classifier.classify(FakeGenderModel.withMaleProbability(0.892), preprocessor,
                IMAGE);

        assertEquals("male", out.getLabel());
        assertEquals(0.892, out.getConfidence(), 1e-9);
        assertEquals(0.892, out.getMale(), 1e-9);
        assertEquals(0.108, out.getFemale(), 1e-9);
        assertFalse(out.isLowConfidence());
    }

    @Test
    public void testUncertainFemaleIsFlaggedButStillReturned() {
        ClassificationOutcome out = classifier.classify(FakeGenderModel.withMaleProbability(0.45), preprocessor,
                IMAGE);

        assertEquals("female", out.getLabel());
        assertEquals(0.55, out.getConfidence(), 1e-9);
        assertTrue(out.isLowConfidence());
    }

    @Test
    public void testEqualLogitsResolveToMale() {
        ClassificationOutcome out = classifier.classify(new FakeGenderModel(new double[] { 0.3, 0.3 }),
                preprocessor, IMAGE);

        assertEquals("male", out.getLabel());
        assertEquals(0.5, out.getConfidence(), 1e-12);
    }

    @Test
    public void testSwappedLabelOrderIsHonoured() {
        LabelMap swapped = new LabelMap(1, 0);
        ClassificationOutcome out = classifier.classify(
                new FakeGenderModel(new double[] { Math.log(0.9), Math.log(0.1) }, swapped), preprocessor, IMAGE);

        assertEquals("female", out.getLabel());
        assertEquals(0.1, out.getMale(), 1e-9);
    }

    @Test
    public void testModelReceivesPreprocessedTensor() {
        final long[][] seen = new long[1][];
        GenderModel spy = new GenderModel() {
            @Override
            public double[] forward(float[] pixelValues, long[] shape) {
                seen[0] = shape;
                assertEquals(3 * 8 * 8, pixelValues.length);
                return new double[] { 1.0, 0.0 };
            }

            @Override
            public LabelMap labels() {
                return LabelMap.standard();
            }
        };

        classifier.classify(spy, preprocessor, IMAGE);

        assertArrayEquals(new long[] { 1, 3, 8, 8 }, seen[0]);
    }

    @Test
    public void testBadLogitsAreInferenceErrors() {
        assertThrows(InferenceException.class,
                () -> classifier.classify(new FakeGenderModel(new double[] { 1.0, 2.0, 3.0 }), preprocessor, IMAGE));
        assertThrows(InferenceException.class,
                () -> classifier.classify(new FakeGenderModel(new double[] { Double.NaN, 0.0 }), preprocessor, IMAGE));
    }

    @Test
    public void testLabelMapFromConfig() {
        Map<String, String> id2label = new HashMap<>();
        id2label.put("0", "Female");
        id2label.put("1", "male");
        LabelMap map = LabelMap.fromId2Label(id2label);
        assertEquals(1, map.getMaleIndex());
        assertEquals(0, map.getFemaleIndex());
        assertEquals("female", map.labelOf(0));

        Map<String, String> threeClasses = new HashMap<>(id2label);
        threeClasses.put("2", "unknown");
        assertThrows(IllegalArgumentException.class, () -> LabelMap.fromId2Label(threeClasses));

        Map<String, String> wrongNames = new HashMap<>();
        wrongNames.put("0", "cat");
        wrongNames.put("1", "dog");
        assertThrows(IllegalArgumentException.class, () -> LabelMap.fromId2Label(wrongNames));
    }
}
