package com.example.slides.dedup;

import java.awt.image.BufferedImage;
import java.math.BigInteger;

/**
 * Difference hash: grayscale, box-resample to (S+1) x S, then one bit per
 * horizontally adjacent pair telling whether the left cell is brighter.
 */
public class DifferenceHashFingerprintEngine implements FingerprintEngine {

    public static final int DEFAULT_HASH_SIZE = 16;

    private final int hashSize;

    public DifferenceHashFingerprintEngine() {
        this(DEFAULT_HASH_SIZE);
    }

    public DifferenceHashFingerprintEngine(int hashSize) {
        if (hashSize < 1) {
            throw new InvalidConfigurationException("Hash size must be at least 1, got " + hashSize);
        }
        this.hashSize = hashSize;
    }

    @Override
    public Fingerprint fingerprint(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (width * height < 2) {
            throw new IllegalArgumentException(
                String.format("Image must have at least 2 pixels, got %dx%d", width, height));
        }

        double[][] luminance = toLuminance(image);
        double[][] grid = resample(luminance, width, height, hashSize + 1, hashSize);

        BigInteger bits = BigInteger.ZERO;
        for (int row = 0; row < hashSize; row++) {
            for (int col = 0; col < hashSize; col++) {
                bits = bits.shiftLeft(1);
                if (grid[row][col] > grid[row][col + 1]) {
                    bits = bits.setBit(0);
                }
            }
        }
        return new Fingerprint(bits, getBitLength());
    }

    @Override
    public int getBitLength() {
        return hashSize * hashSize;
    }

    public int getHashSize() {
        return hashSize;
    }

    /**
     * ITU-R 601 luma, alpha ignored. Indexed [y][x].
     */
    static double[][] toLuminance(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        double[][] lum = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                lum[y][x] = 0.299 * r + 0.587 * g + 0.114 * b;
            }
        }
        return lum;
    }

    /**
     * Area-averaging resample. Every target cell is the mean of the source area
     * it covers, weighted by fractional pixel overlap, which also handles
     * sources smaller than the target. Rows then columns; the box weights are separable.
     */
    static double[][] resample(double[][] src, int srcWidth, int srcHeight, int dstWidth, int dstHeight) {
        Coverage xs = Coverage.of(srcWidth, dstWidth);
        Coverage ys = Coverage.of(srcHeight, dstHeight);

        double[][] rows = new double[srcHeight][dstWidth];
        for (int y = 0; y < srcHeight; y++) {
            for (int tx = 0; tx < dstWidth; tx++) {
                double sum = 0.0;
                for (int sx = xs.first[tx]; sx <= xs.last[tx]; sx++) {
                    sum += src[y][sx] * xs.weight(tx, sx);
                }
                rows[y][tx] = sum / xs.total[tx];
            }
        }

        double[][] dst = new double[dstHeight][dstWidth];
        for (int ty = 0; ty < dstHeight; ty++) {
            for (int tx = 0; tx < dstWidth; tx++) {
                double sum = 0.0;
                for (int sy = ys.first[ty]; sy <= ys.last[ty]; sy++) {
                    sum += rows[sy][tx] * ys.weight(ty, sy);
                }
                dst[ty][tx] = sum / ys.total[ty];
            }
        }
        return dst;
    }

    /**
     * Overlap between target cell t and source pixel s along one axis, in
     * source pixel units.
     */
    private static final class Coverage {
        final double scale;
        final int[] first;
        final int[] last;
        final double[] total;

        private Coverage(double scale, int[] first, int[] last, double[] total) {
            this.scale = scale;
            this.first = first;
            this.last = last;
            this.total = total;
        }

        static Coverage of(int srcSize, int dstSize) {
            double scale = (double) srcSize / dstSize;
            int[] first = new int[dstSize];
            int[] last = new int[dstSize];
            double[] total = new double[dstSize];
            for (int t = 0; t < dstSize; t++) {
                double start = t * scale;
                double end = (t + 1) * scale;
                first[t] = Math.min(srcSize - 1, (int) Math.floor(start));
                last[t] = Math.max(first[t], Math.min(srcSize - 1, (int) Math.ceil(end) - 1));
                total[t] = end - start;
            }
            return new Coverage(scale, first, last, total);
        }

        double weight(int t, int s) {
            double start = t * scale;
            double end = (t + 1) * scale;
            return Math.max(0.0, Math.min(end, s + 1) - Math.max(start, s));
        }
    }
}
