package com.genderai.server.ai;

import java.awt.image.BufferedImage;

/**
 * An uploaded image decoded to 8-bit RGB. Belongs to the request that decoded it.
 */
public class DecodedImage {
    private final BufferedImage pixels; // TYPE_INT_RGB

    public DecodedImage(BufferedImage pixels) {
        if (pixels.getType() != BufferedImage.TYPE_INT_RGB) {
            throw new IllegalArgumentException("Expected TYPE_INT_RGB, got type " + pixels.getType());
        }
        this.pixels = pixels;
    }

    public int getWidth() {
        return pixels.getWidth();
    }

    public int getHeight() {
        return pixels.getHeight();
    }

    /**
     * Packed 0xRRGGBB value at (x, y).
     */
    public int rgb(int x, int y) {
        return pixels.getRGB(x, y) & 0x00ffffff;
    }

    public BufferedImage getPixels() {
        return pixels;
    }
}
