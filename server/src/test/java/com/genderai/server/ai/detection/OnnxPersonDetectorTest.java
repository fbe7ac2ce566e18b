package com.genderai.server.ai.detection;

import com.genderai.server.ai.DecodedImage;
import com.genderai.server.ai.ImageDecoder;
import com.genderai.server.ai.ImagePreprocessor;
import com.genderai.server.ai.InferenceException;
import com.genderai.server.testsupport.TestImages;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OnnxPersonDetectorTest {

    @Test
    public void testDecodeKeepsPersonQueriesAndConvertsBoxes() {
        float[][] logits = {
                { 0f, 6f, 0f },   // confident person
                { 6f, 0f, 0f },   // another class
                { 0f, 1f, 10f },  // mostly "no object", person is still the best real class
        };
        float[][] boxes = {
                { 0.5f, 0.5f, 0.4f, 0.8f },
                { 0.2f, 0.2f, 0.1f, 0.1f },
                { 0.9f, 0.9f, 0.4f, 0.4f },
        };

        List<Detection> persons = OnnxPersonDetector.decode(logits, boxes, 1);

        assertEquals(2, persons.size());
        Detection first = persons.get(0);
        assertEquals(1, first.getLabelId());
        assertTrue(first.getScore() > 0.99);
        assertEquals(0.3, first.getXmin(), 1e-6);
        assertEquals(0.1, first.getYmin(), 1e-6);
        assertEquals(0.7, first.getXmax(), 1e-6);
        assertEquals(0.9, first.getYmax(), 1e-6);

        Detection faint = persons.get(1);
        assertTrue(faint.getScore() < 0.01);
        // clipped to the frame
        assertEquals(1.0, faint.getXmax(), 1e-6);
        assertEquals(1.0, faint.getYmax(), 1e-6);
    }

    @Test
    public void testFaintQueriesDoNotPassTheGate() {
        float[][] logits = { { 0f, 1f, 10f } };
        float[][] boxes = { { 0.5f, 0.5f, 0.5f, 0.9f } };

        List<Detection> persons = OnnxPersonDetector.decode(logits, boxes, 1);
        DetectionOutcome outcome = new PersonDetectorGate(DetectionSettings.defaults())
                .evaluate(image -> persons, null);

        assertEquals(GateDecision.NO_PERSON, outcome.decision());
    }

    @Test
    public void testMalformedRowsAreRejected() {
        assertThrows(InferenceException.class,
                () -> OnnxPersonDetector.decode(new float[][] { { 1f } }, new float[][] { { 0f, 0f, 1f, 1f } }, 1));
        assertThrows(InferenceException.class,
                () -> OnnxPersonDetector.decode(new float[][] { { 0f, 1f, 0f } }, new float[][] { { 0f, 0f } }, 1));
    }

    @Test
    public void testDefaultInputKeepsAspectRatioWithinLongestEdge() throws Exception {
        ImagePreprocessor p = new ImagePreprocessor(OnnxPersonDetector.withDetectorDefaults(null));

        DecodedImage landscape = new ImageDecoder().decode(TestImages.png(1200, 600));
        assertArrayEquals(new long[] { 1, 3, 666, 1332 }, p.tensorShape(landscape));
        assertEquals(3 * 666 * 1332, p.toTensor(landscape).length);

        DecodedImage portrait = new ImageDecoder().decode(TestImages.png(600, 1200));
        assertArrayEquals(new long[] { 1, 3, 1332, 666 }, p.tensorShape(portrait));

        DecodedImage photo = new ImageDecoder().decode(TestImages.png(640, 480));
        assertArrayEquals(new long[] { 1, 3, 800, 1066 }, p.tensorShape(photo));
    }
}
