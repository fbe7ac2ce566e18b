package com.genderai.server.ai.detection;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NonMaxSuppressionTest {

    @Test
    public void testKeepsHighestOfOverlappingPair() {
        Detection low = new Detection(1, 0.8, 0.0, 0.0, 0.5, 0.5);
        Detection high = new Detection(1, 0.9, 0.02, 0.0, 0.5, 0.5);
        Detection apart = new Detection(1, 0.85, 0.6, 0.6, 1.0, 1.0);

        List<Detection> kept = NonMaxSuppression.greedy(Arrays.asList(low, high, apart), 0.5);

        assertEquals(Arrays.asList(high, apart), kept);
    }

    @Test
    public void testIou() {
        Detection a = new Detection(1, 0.9, 0.0, 0.0, 0.5, 0.5);
        Detection b = new Detection(1, 0.9, 0.25, 0.0, 0.75, 0.5);

        assertEquals(1.0, a.iou(a), 1e-12);
        assertEquals(1.0 / 3.0, a.iou(b), 1e-12);
        assertEquals(0.0, a.iou(new Detection(1, 0.9, 0.6, 0.6, 0.9, 0.9)), 1e-12);
    }
}
