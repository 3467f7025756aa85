// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.pollkit.primitives.Hex;

/**
 * Tests for Blake2b256 hashing against known test vectors.
 */
class Blake2b256Test {

    @Test
    void testEmptyInput() {
        final byte[] hash = Blake2b256.hash(new byte[0]);

        assertEquals("0e5751c026e543b2e8ab2eb06099daa1d1e5df47778f7787faab45cdf12fe3a8", Hex.encode(hash));
    }

    @Test
    void testAbc() {
        final byte[] hash = Blake2b256.hash("abc".getBytes(StandardCharsets.UTF_8));

        assertEquals("bddd813c634239723171ef3fee98579b94964e3bb1cb3e427262c8c068d52319", Hex.encode(hash));
    }

    @Test
    void testMultipleInputs() {
        final byte[] hashConcatenated = Blake2b256.hash(
                "a".getBytes(StandardCharsets.UTF_8), "bc".getBytes(StandardCharsets.UTF_8));

        assertArrayEquals(Blake2b256.hash("abc".getBytes(StandardCharsets.UTF_8)), hashConcatenated);
    }

    @Test
    void testHashLength() {
        assertEquals(Blake2b256.DIGEST_LENGTH, Blake2b256.hash("test".getBytes(StandardCharsets.UTF_8)).length);
    }

    @Test
    void testNullInput() {
        assertThrows(NullPointerException.class, () -> Blake2b256.hash((byte[]) null));
        assertThrows(NullPointerException.class, () -> Blake2b256.hash(new byte[0], null));
    }

    @Test
    void testCachedDigestIsResetBetweenCalls() {
        final byte[] first = Blake2b256.hash("abc".getBytes(StandardCharsets.UTF_8));
        Blake2b256.hash("something else".getBytes(StandardCharsets.UTF_8));

        assertArrayEquals(first, Blake2b256.hash("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testCleanup() {
        final byte[] before = Blake2b256.hash("abc".getBytes(StandardCharsets.UTF_8));
        Blake2b256.cleanup();
        Blake2b256.cleanup();

        assertArrayEquals(before, Blake2b256.hash("abc".getBytes(StandardCharsets.UTF_8)));
    }
}
