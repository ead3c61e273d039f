package com.example.slides.dedup;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class FingerprintTest {

    @Test
    void testHammingDistanceCountsDifferingBits() {
        Fingerprint a = new Fingerprint(new BigInteger("1011", 2), 4);
        Fingerprint b = new Fingerprint(new BigInteger("0110", 2), 4);

        assertEquals(3, a.hammingDistance(b));
        assertEquals(3, b.hammingDistance(a));
        assertEquals(0, a.hammingDistance(a));
    }

    @Test
    void testHammingDistanceRequiresSameLength() {
        Fingerprint a = new Fingerprint(BigInteger.ONE, 4);
        Fingerprint b = new Fingerprint(BigInteger.ONE, 8);

        assertThrows(IllegalArgumentException.class, () -> a.hammingDistance(b));
    }

    @Test
    void testValueMustFitInBitLength() {
        assertThrows(IllegalArgumentException.class, () -> new Fingerprint(BigInteger.valueOf(16), 4));
        assertThrows(IllegalArgumentException.class, () -> new Fingerprint(BigInteger.valueOf(-1), 4));
        assertThrows(IllegalArgumentException.class, () -> new Fingerprint(BigInteger.ZERO, 0));
    }

    @Test
    void testHexIsPaddedToFullLength() {
        Fingerprint fingerprint = new Fingerprint(BigInteger.valueOf(0xAB), 256);

        String hex = fingerprint.toHex();

        assertEquals(64, hex.length());
        assertTrue(hex.endsWith("ab"));
        assertTrue(hex.startsWith("000"));
    }

    @Test
    void testEqualityUsesValueAndLength() {
        assertEquals(new Fingerprint(BigInteger.TEN, 8), new Fingerprint(BigInteger.TEN, 8));
        assertEquals(new Fingerprint(BigInteger.TEN, 8).hashCode(), new Fingerprint(BigInteger.TEN, 8).hashCode());
        assertNotEquals(new Fingerprint(BigInteger.TEN, 8), new Fingerprint(BigInteger.TEN, 16));
    }
}
