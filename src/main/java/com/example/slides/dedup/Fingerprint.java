package com.example.slides.dedup;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fixed-length perceptual fingerprint of a single frame.
 * Bits are packed most-significant first in row-major scan order.
 */
public final class Fingerprint {

    private final BigInteger bits;
    private final int bitLength;

    public Fingerprint(BigInteger bits, int bitLength) {
        if (bitLength <= 0) {
            throw new IllegalArgumentException("Fingerprint bit length must be positive: " + bitLength);
        }
        if (bits.signum() < 0 || bits.bitLength() > bitLength) {
            throw new IllegalArgumentException(
                String.format("Fingerprint value does not fit in %d unsigned bits", bitLength));
        }
        this.bits = bits;
        this.bitLength = bitLength;
    }

    /**
     * Number of bit positions in which the two fingerprints differ.
     *
     * @throws IllegalArgumentException if the fingerprints were produced with different grid sizes
     */
    public int hammingDistance(Fingerprint other) {
        if (other.bitLength != bitLength) {
            throw new IllegalArgumentException(
                String.format("Fingerprint lengths must match: %d vs %d", bitLength, other.bitLength));
        }
        return bits.xor(other.bits).bitCount();
    }

    public BigInteger getBits() { return bits; }
    public int getBitLength() { return bitLength; }

    /**
     * Hex rendering padded to the full bit length, handy in logs.
     */
    public String toHex() {
        int digits = (bitLength + 3) / 4;
        String hex = bits.toString(16);
        StringBuilder sb = new StringBuilder(digits);
        for (int i = hex.length(); i < digits; i++) {
            sb.append('0');
        }
        return sb.append(hex).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        Fingerprint that = (Fingerprint) o;
        return bitLength == that.bitLength && bits.equals(that.bits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bits, bitLength);
    }

    @Override
    public String toString() {
        return "Fingerprint{" + bitLength + " bits, " + toHex() + "}";
    }
}
