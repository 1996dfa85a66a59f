package io.merklite.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable hash output: a fixed-size byte sequence produced by a {@link HashAlgorithm}.
 * <p>
 * Design:
 *  - Value object: equals/hashCode are byte-wise.
 *  - Total order: unsigned lexicographic comparison of the bytes.
 *  - Defensive copies of the bytes are taken on input and output.
 */
public final class Digest implements Comparable<Digest> {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    private Digest(byte[] bytes) {
        this.bytes = bytes;
    }

    /** Wrap a copy of the given bytes. */
    public static Digest of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new Digest(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Parse the lowercase (or uppercase) hex rendering produced by {@link #hexDigest()}.
     *
     * @throws IllegalArgumentException if the string has odd length or a non-hex character
     */
    public static Digest fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        if ((hex.length() & 1) != 0) {
            throw new IllegalArgumentException("hex digest must have an even length, got " + hex.length());
        }
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(hex.charAt(2 * i), 16);
            int lo = Character.digit(hex.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("not a hex digest: " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return new Digest(out);
    }

    /** Digest length in bytes. */
    public int size() { return bytes.length; }

    /** Copy of the raw digest bytes. */
    public byte[] bytes() { return Arrays.copyOf(bytes, bytes.length); }

    /** Copy the digest bytes into {@code dst} starting at {@code offset}. */
    void copyTo(byte[] dst, int offset) {
        System.arraycopy(bytes, 0, dst, offset, bytes.length);
    }

    /** Two lowercase hex characters per byte, in array order, no separators. */
    public String hexDigest() {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[2 * i] = HEX[v >>> 4];
            out[2 * i + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    @Override
    public int compareTo(Digest other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Digest d)) return false;
        return Arrays.equals(bytes, d.bytes);
    }

    @Override public int hashCode() { return Arrays.hashCode(bytes); }

    @Override public String toString() { return hexDigest(); }
}
