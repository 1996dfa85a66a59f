package io.merklite.core;

import java.util.Objects;

/**
 * Stateless hashing capability: given a byte slice, produce a {@link Digest}
 * of a fixed, algorithm-specific size.
 * <p>
 * Contract:
 *  - hash() is deterministic and total (the empty slice is valid input).
 *  - Every digest has exactly {@link #digestSize()} bytes.
 *  - Implementations are safe to call from multiple threads.
 * <p>
 * Tree code is written against this interface only, so any fixed-output
 * algorithm can be plugged in. See {@link StandardAlgorithm} for the JCA-backed ones.
 */
public interface HashAlgorithm {

    /** Human-readable algorithm name, e.g. "SHA-256". */
    String algorithmName();

    /** Declared output size in bytes. */
    int digestSize();

    /** Hash {@code length} bytes of {@code data} starting at {@code offset}. */
    Digest hash(byte[] data, int offset, int length);

    /** Hash the whole array. */
    default Digest hash(byte[] data) {
        Objects.requireNonNull(data, "data");
        return hash(data, 0, data.length);
    }

    /** Hash the concatenation {@code left.bytes || right.bytes}. */
    default Digest hash(Digest left, Digest right) {
        byte[] buf = new byte[left.size() + right.size()];
        left.copyTo(buf, 0);
        right.copyTo(buf, left.size());
        return hash(buf, 0, buf.length);
    }

    /**
     * One-time check that the algorithm produces digests of its declared size.
     * Hashes the empty input and compares the result length to {@link #digestSize()}.
     *
     * @return the algorithm, for chaining
     * @throws AlgorithmMismatchException if the sizes differ
     */
    static HashAlgorithm verify(HashAlgorithm algorithm) {
        Objects.requireNonNull(algorithm, "algorithm");
        int declared = algorithm.digestSize();
        Digest sample = algorithm.hash(new byte[0], 0, 0);
        if (declared <= 0 || sample == null || sample.size() != declared) {
            throw new AlgorithmMismatchException(algorithm.algorithmName(), declared, sample == null ? 0 : sample.size());
        }
        return algorithm;
    }
}
