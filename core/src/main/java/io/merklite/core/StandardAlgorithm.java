package io.merklite.core;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Objects;

/**
 * Fixed-output hash algorithms backed by the JDK's {@link MessageDigest}.
 * SHA-256 is the default throughout the project.
 */
public enum StandardAlgorithm implements HashAlgorithm {
    SHA_256("SHA-256", 32),
    SHA_384("SHA-384", 48),
    SHA_512("SHA-512", 64),
    SHA3_256("SHA3-256", 32),
    SHA3_512("SHA3-512", 64);

    private final String jcaName;
    private final int digestSize;

    StandardAlgorithm(String jcaName, int digestSize) {
        this.jcaName = jcaName;
        this.digestSize = digestSize;
    }

    /**
     * Resolve an algorithm by its JCA name ("SHA-256") or enum name ("SHA_256"),
     * case-insensitively.
     *
     * @throws ConfigurationException for an unknown name
     */
    public static StandardAlgorithm fromName(String name) {
        Objects.requireNonNull(name, "name");
        String wanted = name.trim().toUpperCase(Locale.ROOT);
        for (var a : values()) {
            if (a.jcaName.equals(wanted) || a.name().equals(wanted)) {
                return a;
            }
        }
        throw new ConfigurationException("unknown hash algorithm: " + name);
    }

    @Override public int digestSize() { return digestSize; }

    /** JCA name, e.g. "SHA3-256". */
    @Override public String algorithmName() { return jcaName; }

    @Override
    public Digest hash(byte[] data, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, data.length);
        var md = newDigest();
        md.update(data, offset, length);
        return Digest.of(md.digest());
    }

    // MessageDigest is not thread safe; a fresh instance per call keeps the enum stateless.
    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Hash algorithm not available: " + jcaName, e);
        }
    }

    @Override public String toString() { return jcaName; }
}
