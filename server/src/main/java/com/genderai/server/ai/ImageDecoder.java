package com.genderai.server.ai;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;

public class ImageDecoder {

    public static final long DEFAULT_MAX_PIXELS = 40_000_000L;

    private final long maxPixels;

    public ImageDecoder() {
        this(DEFAULT_MAX_PIXELS);
    }

    /**
     * @param maxPixels largest accepted width times height, checked from the
     *                  image header before any pixel data is allocated
     */
    public ImageDecoder(long maxPixels) {
        if (maxPixels < 1) {
            throw new IllegalArgumentException("Pixel limit must be positive: " + maxPixels);
        }
        this.maxPixels = maxPixels;
    }

    /**
     * Decodes any format ImageIO understands and converts it to RGB, dropping
     * alpha the way a plain RGB conversion does (alpha pixels over black).
     *
     * @throws InvalidImageException when the bytes are not a readable image or
     *                               the image is larger than the pixel limit
     */
    public DecodedImage decode(byte[] bytes) throws InvalidImageException {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidImageException("Empty image payload");
        }
        BufferedImage source = read(bytes);
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return new DecodedImage(source);
        }

        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return new DecodedImage(rgb);
    }

    private BufferedImage read(byte[] bytes) throws InvalidImageException {
        try (ImageInputStream in = new MemoryCacheImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new InvalidImageException("Unrecognized image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new InvalidImageException("Image has no pixels");
                }
                if ((long) width * height > maxPixels) {
                    throw new InvalidImageException("Image is " + width + "x" + height
                            + ", above the limit of " + maxPixels + " pixels");
                }
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            throw new InvalidImageException("Cannot decode image: " + e.getMessage(), e);
        }
    }

    public static class InvalidImageException extends Exception {
        public InvalidImageException(String message) {
            super(message);
        }

        public InvalidImageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
