package com.genderai.server.ai;

import com.genderai.server.model.ModelConfigs;
import com.genderai.server.testsupport.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ImagePreprocessorTest {

    private static DecodedImage decode(byte[] bytes) throws Exception {
        return new ImageDecoder().decode(bytes);
    }

    @Test
    public void testDefaultsMatchViTPreprocessing() throws Exception {
        ImagePreprocessor p = new ImagePreprocessor(new ModelConfigs.PreprocessorConfig());
        DecodedImage img = decode(TestImages.png(300, 200, new Color(255, 0, 128)));

        float[] t = p.toTensor(img);

        assertArrayEquals(new long[] { 1, 3, 224, 224 }, p.tensorShape(img));
        assertEquals(3 * 224 * 224, t.length);
        int plane = 224 * 224;
        // uniform input stays uniform through resampling
        assertEquals(1.0f, t[0], 1e-6);
        assertEquals(-1.0f, t[plane + 1000], 1e-6);
        assertEquals((128 / 255.0 - 0.5) / 0.5, t[2 * plane + plane - 1], 1e-6);
    }

    @Test
    public void testShortestEdgeAndCustomNormalization() throws Exception {
        ModelConfigs.PreprocessorConfig cfg = new ModelConfigs.PreprocessorConfig();
        cfg.size = Map.of("shortest_edge", 16);
        cfg.imageMean = Arrays.asList(0.0, 0.0, 0.0);
        cfg.imageStd = Arrays.asList(1.0, 1.0, 1.0);
        ImagePreprocessor p = new ImagePreprocessor(cfg);

        float[] t = p.toTensor(decode(TestImages.png(20, 20, new Color(51, 102, 204))));

        assertArrayEquals(new int[] { 16, 16 }, p.outputSize(20, 20));
        assertEquals(0.2f, t[0], 1e-6);
        assertEquals(0.4f, t[256], 1e-6);
        assertEquals(0.8f, t[512], 1e-6);
    }

    @Test
    public void testShortestEdgeKeepsAspectRatio() throws Exception {
        ModelConfigs.PreprocessorConfig cfg = new ModelConfigs.PreprocessorConfig();
        cfg.size = Map.of("shortest_edge", 100);
        ImagePreprocessor p = new ImagePreprocessor(cfg);
        DecodedImage img = decode(TestImages.png(300, 200));

        assertArrayEquals(new long[] { 1, 3, 100, 150 }, p.tensorShape(img));
        assertEquals(3 * 100 * 150, p.toTensor(img).length);
        // already at the target size
        assertArrayEquals(new int[] { 100, 240 }, p.outputSize(100, 240));
    }

    @Test
    public void testLongestEdgeCapsTheLongSide() {
        ModelConfigs.PreprocessorConfig cfg = new ModelConfigs.PreprocessorConfig();
        cfg.size = Map.of("shortest_edge", 800, "longest_edge", 1333);
        ImagePreprocessor p = new ImagePreprocessor(cfg);

        assertArrayEquals(new int[] { 666, 1332 }, p.outputSize(600, 1200));
        assertArrayEquals(new int[] { 1332, 666 }, p.outputSize(1200, 600));
        assertArrayEquals(new int[] { 800, 800 }, p.outputSize(500, 500));
        // long side fits, shortest edge wins
        assertArrayEquals(new int[] { 800, 1200 }, p.outputSize(400, 600));
    }

    @Test
    public void testDownscaleKeepsEdgeOrdering() throws Exception {
        BufferedImage src = new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 64; y++) {
            for (int x = 32; x < 64; x++) {
                src.setRGB(x, y, 0xffffff);
            }
        }
        ModelConfigs.PreprocessorConfig cfg = new ModelConfigs.PreprocessorConfig();
        cfg.size = Map.of("height", 8, "width", 8);
        cfg.doNormalize = false;
        float[] t = new ImagePreprocessor(cfg).toTensor(decode(TestImages.encode(src, "png")));

        assertEquals(0.0f, t[0], 1e-6);
        assertEquals(1.0f, t[7], 1e-6);
        for (int x = 1; x < 8; x++) {
            assertTrue(t[x] >= t[x - 1], "row must be non-decreasing at " + x);
        }
        for (float v : t) {
            assertTrue(v >= 0.0f && v <= 1.0f);
        }
    }

    @Test
    public void testResizeDisabledKeepsSourceSize() throws Exception {
        ModelConfigs.PreprocessorConfig cfg = new ModelConfigs.PreprocessorConfig();
        cfg.doResize = false;
        ImagePreprocessor p = new ImagePreprocessor(cfg);
        DecodedImage img = decode(TestImages.png(10, 6));

        assertArrayEquals(new long[] { 1, 3, 6, 10 }, p.tensorShape(img));
        assertEquals(3 * 60, p.toTensor(img).length);
    }

    @Test
    public void testRejectsInvalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> new ImagePreprocessor(null));

        ModelConfigs.PreprocessorConfig badStd = new ModelConfigs.PreprocessorConfig();
        badStd.imageStd = Arrays.asList(0.5, 0.0, 0.5);
        assertThrows(IllegalArgumentException.class, () -> new ImagePreprocessor(badStd));

        ModelConfigs.PreprocessorConfig badMean = new ModelConfigs.PreprocessorConfig();
        badMean.imageMean = Arrays.asList(0.5, 0.5);
        assertThrows(IllegalArgumentException.class, () -> new ImagePreprocessor(badMean));

        ModelConfigs.PreprocessorConfig badSize = new ModelConfigs.PreprocessorConfig();
        badSize.size = Map.of("height", 0, "width", 10);
        assertThrows(IllegalArgumentException.class, () -> new ImagePreprocessor(badSize));

        ModelConfigs.PreprocessorConfig badEdges = new ModelConfigs.PreprocessorConfig();
        badEdges.size = Map.of("shortest_edge", 800, "longest_edge", 400);
        assertThrows(IllegalArgumentException.class, () -> new ImagePreprocessor(badEdges));
    }
}
