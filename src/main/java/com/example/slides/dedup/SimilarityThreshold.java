package com.example.slides.dedup;

/**
 * Similarity threshold in [0.0, 1.0]. Higher values keep more frames; lower
 * values discard near-duplicates more aggressively.
 */
public final class SimilarityThreshold {

    private final double value;

    private SimilarityThreshold(double value) {
        this.value = value;
    }

    /**
     * @throws InvalidConfigurationException if the value is NaN or outside [0, 1]
     */
    public static SimilarityThreshold of(double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(
                String.format("Similarity threshold must be between 0.0 and 1.0, got %s", value));
        }
        return new SimilarityThreshold(value);
    }

    /**
     * Largest Hamming distance still treated as a duplicate. The product is
     * truncated toward zero, so 0.9 over 256 bits gives 25.
     *
     * @param bitLength Fingerprint length in bits
     */
    public int maxDistance(int bitLength) {
        return (int) ((1.0 - value) * bitLength);
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("%.2f", value);
    }
}
