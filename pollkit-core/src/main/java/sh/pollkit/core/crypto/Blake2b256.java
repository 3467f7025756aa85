// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.Blake2bDigest;

/**
 * Blake2b-256 hashing utility, the digest Cardano uses for transaction bodies,
 * metadata and survey hashes.
 *
 * <pre>{@code
 * byte[] hash = Blake2b256.hash("hello".getBytes(StandardCharsets.UTF_8));
 * String hashHex = Hex.encode(hash);
 * }</pre>
 *
 * <h2>Thread Safety and Memory Management</h2>
 *
 * <p>Digest instances are cached per thread. In thread pools the cached digest
 * lives as long as the thread; call {@link #cleanup()} when a pooled thread leaves
 * the application, e.g. from a servlet filter's {@code finally} block.
 *
 * @since 0.1.0
 */
public final class Blake2b256 {

    /** Digest length in bytes. */
    public static final int DIGEST_LENGTH = 32;

    private static final ThreadLocal<Blake2bDigest> DIGEST =
            ThreadLocal.withInitial(() -> new Blake2bDigest(DIGEST_LENGTH * 8));

    private Blake2b256() {
        // Utility class
    }

    /**
     * Computes the Blake2b-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final Blake2bDigest digest = DIGEST.get();
        digest.reset();
        digest.update(input, 0, input.length);
        final byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    /**
     * Computes the Blake2b-256 hash of multiple input arrays concatenated.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final Blake2bDigest digest = DIGEST.get();
        digest.reset();
        for (final byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input, 0, input.length);
        }
        final byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    /**
     * Removes the cached digest instance from the current thread. Safe to call
     * even if the thread never hashed anything.
     *
     * @see ThreadLocal#remove()
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
