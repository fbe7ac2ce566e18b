package com.genderai.server.ai;

import com.genderai.server.model.ModelConfigs;

import java.util.Arrays;
import java.util.List;

/**
 * Turns a {@link DecodedImage} into a {@code [1, 3, H, W]} float tensor the way
 * the model's preprocessing config describes it.
 * <p>
 * Resizing is the separable triangle (bilinear) filter with a support that widens
 * with the downscale factor, rounding to 8 bits between the horizontal and the
 * vertical pass. That matches the resampling the Python image stack applies
 * before rescale and normalization.
 */
public class ImagePreprocessor {

    private static final double[] DEFAULT_MEAN = { 0.5, 0.5, 0.5 };
    private static final double[] DEFAULT_STD = { 0.5, 0.5, 0.5 };

    private final boolean doResize;
    // fixed output size, or 0 when resizing by edge length
    private final int height;
    private final int width;
    private final int shortestEdge;
    private final int longestEdge;
    private final boolean doRescale;
    private final double rescaleFactor;
    private final boolean doNormalize;
    private final double[] mean;
    private final double[] std;

    public ImagePreprocessor(ModelConfigs.PreprocessorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Preprocessing config is missing");
        }
        this.doResize = config.doResize == null || config.doResize;
        int[] sizes = resolveSize(config);
        this.height = sizes[0];
        this.width = sizes[1];
        this.shortestEdge = sizes[2];
        this.longestEdge = sizes[3];
        this.doRescale = config.doRescale == null || config.doRescale;
        this.rescaleFactor = config.rescaleFactor != null ? config.rescaleFactor : 1.0 / 255.0;
        this.doNormalize = config.doNormalize == null || config.doNormalize;
        this.mean = channels(config.imageMean, DEFAULT_MEAN, "image_mean");
        this.std = channels(config.imageStd, DEFAULT_STD, "image_std");
        for (double s : std) {
            if (!(s > 0.0)) {
                throw new IllegalArgumentException("image_std entries must be positive: " + Arrays.toString(std));
            }
        }
    }

    /** @return height, width, shortest edge, longest edge; unused entries are 0 */
    private static int[] resolveSize(ModelConfigs.PreprocessorConfig config) {
        if (config.size == null) {
            return new int[] { 224, 224, 0, 0 };
        }
        Integer h = config.size.get("height");
        Integer w = config.size.get("width");
        if (h != null || w != null) {
            if (h == null || w == null || h <= 0 || w <= 0) {
                throw new IllegalArgumentException("Invalid size in preprocessing config: " + config.size);
            }
            return new int[] { h, w, 0, 0 };
        }
        Integer shortest = config.size.get("shortest_edge");
        Integer longest = config.size.get("longest_edge");
        if (shortest == null || shortest <= 0 || (longest != null && longest < shortest)) {
            throw new IllegalArgumentException("Invalid size in preprocessing config: " + config.size);
        }
        return new int[] { 0, 0, shortest, longest != null ? longest : 0 };
    }

    private static double[] channels(List<Double> values, double[] fallback, String name) {
        if (values == null) {
            return fallback.clone();
        }
        if (values.size() != 3) {
            throw new IllegalArgumentException(name + " must have 3 entries, got " + values.size());
        }
        return new double[] { values.get(0), values.get(1), values.get(2) };
    }

    /**
     * Output {@code {height, width}} for a source image. With a shortest edge the
     * aspect ratio is kept: the short side becomes the shortest edge unless that
     * pushes the long side past the longest edge, in which case the target shrinks
     * so the long side fits.
     */
    public int[] outputSize(int srcH, int srcW) {
        if (!doResize) {
            return new int[] { srcH, srcW };
        }
        if (shortestEdge == 0) {
            return new int[] { height, width };
        }
        double size = shortestEdge;
        if (longestEdge > 0) {
            double minOrig = Math.min(srcH, srcW);
            double maxOrig = Math.max(srcH, srcW);
            if (maxOrig / minOrig * size > longestEdge) {
                size = Math.rint(longestEdge * minOrig / maxOrig);
            }
        }
        int target = (int) size;
        if ((srcH <= srcW && srcH == target) || (srcW <= srcH && srcW == target)) {
            return new int[] { srcH, srcW };
        }
        if (srcW < srcH) {
            return new int[] { (int) ((long) target * srcH / srcW), target };
        }
        return new int[] { target, (int) ((long) target * srcW / srcH) };
    }

    public String describeSize() {
        if (!doResize) {
            return "source size";
        }
        if (shortestEdge == 0) {
            return width + "x" + height;
        }
        return "shortest edge " + shortestEdge + (longestEdge > 0 ? ", longest edge " + longestEdge : "");
    }

    /**
     * @return CHW float data of length {@code 3 * H * W}, with H and W from
     *         {@link #outputSize(int, int)}
     */
    public float[] toTensor(DecodedImage image) {
        int srcW = image.getWidth();
        int srcH = image.getHeight();
        int[][] planes = splitChannels(image);

        int[] out = outputSize(srcH, srcW);
        int outH = out[0];
        int outW = out[1];
        if (outW != srcW || outH != srcH) {
            for (int c = 0; c < 3; c++) {
                int[] horizontal = resampleRows(planes[c], srcW, srcH, outW);
                planes[c] = resampleColumns(horizontal, outW, srcH, outH);
            }
        }

        int plane = outW * outH;
        float[] tensor = new float[3 * plane];
        for (int c = 0; c < 3; c++) {
            int[] src = planes[c];
            int base = c * plane;
            for (int i = 0; i < plane; i++) {
                double v = src[i];
                if (doRescale) {
                    v *= rescaleFactor;
                }
                if (doNormalize) {
                    v = (v - mean[c]) / std[c];
                }
                tensor[base + i] = (float) v;
            }
        }
        return tensor;
    }

    public long[] tensorShape(DecodedImage image) {
        int[] out = outputSize(image.getHeight(), image.getWidth());
        return new long[] { 1, 3, out[0], out[1] };
    }

    private static int[][] splitChannels(DecodedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] packed = image.getPixels().getRGB(0, 0, w, h, null, 0, w);
        int[][] planes = new int[3][w * h];
        for (int i = 0; i < packed.length; i++) {
            int p = packed[i];
            planes[0][i] = (p >> 16) & 0xff;
            planes[1][i] = (p >> 8) & 0xff;
            planes[2][i] = p & 0xff;
        }
        return planes;
    }

    private static int[] resampleRows(int[] src, int srcW, int srcH, int outW) {
        Kernel k = Kernel.build(srcW, outW);
        int[] out = new int[outW * srcH];
        for (int y = 0; y < srcH; y++) {
            int row = y * srcW;
            for (int x = 0; x < outW; x++) {
                double acc = 0.0;
                int start = k.start[x];
                double[] w = k.weights[x];
                for (int j = 0; j < w.length; j++) {
                    acc += src[row + start + j] * w[j];
                }
                out[y * outW + x] = toByte(acc);
            }
        }
        return out;
    }

    private static int[] resampleColumns(int[] src, int w, int srcH, int outH) {
        Kernel k = Kernel.build(srcH, outH);
        int[] out = new int[w * outH];
        for (int y = 0; y < outH; y++) {
            int start = k.start[y];
            double[] weights = k.weights[y];
            for (int x = 0; x < w; x++) {
                double acc = 0.0;
                for (int j = 0; j < weights.length; j++) {
                    acc += src[(start + j) * w + x] * weights[j];
                }
                out[y * w + x] = toByte(acc);
            }
        }
        return out;
    }

    private static int toByte(double v) {
        long r = Math.round(v);
        return (int) (r < 0 ? 0 : (r > 255 ? 255 : r));
    }

    /** Per-output-pixel source window and normalized triangle weights. */
    private static final class Kernel {
        final int[] start;
        final double[][] weights;

        private Kernel(int[] start, double[][] weights) {
            this.start = start;
            this.weights = weights;
        }

        static Kernel build(int inSize, int outSize) {
            double scale = (double) inSize / outSize;
            double filterScale = Math.max(scale, 1.0);
            double support = filterScale; // triangle filter has radius 1

            int[] start = new int[outSize];
            double[][] weights = new double[outSize][];
            for (int i = 0; i < outSize; i++) {
                double center = (i + 0.5) * scale;
                int min = Math.max((int) (center - support + 0.5), 0);
                int max = Math.min((int) (center + support + 0.5), inSize);
                double[] w = new double[Math.max(max - min, 1)];
                double total = 0.0;
                for (int j = 0; j < max - min; j++) {
                    double x = (j + min - center + 0.5) / filterScale;
                    double v = Math.abs(x) < 1.0 ? 1.0 - Math.abs(x) : 0.0;
                    w[j] = v;
                    total += v;
                }
                if (total > 0.0) {
                    for (int j = 0; j < w.length; j++) {
                        w[j] /= total;
                    }
                } else {
                    min = Math.min(min, inSize - 1);
                    w[0] = 1.0;
                }
                start[i] = min;
                weights[i] = w;
            }
            return new Kernel(start, weights);
        }
    }
}
