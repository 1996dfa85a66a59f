package io.merklite.core;

/** A hash algorithm produced digests whose length differs from its declared size. */
public class AlgorithmMismatchException extends MerkleException {

    private final String algorithm;
    private final int declaredSize;
    private final int actualSize;

    public AlgorithmMismatchException(String algorithm, int declaredSize, int actualSize) {
        super(String.format("algorithm %s declares %d-byte digests but produced %d bytes",
                algorithm, declaredSize, actualSize));
        this.algorithm = algorithm;
        this.declaredSize = declaredSize;
        this.actualSize = actualSize;
    }

    public String algorithm() { return algorithm; }

    public int declaredSize() { return declaredSize; }

    public int actualSize() { return actualSize; }
}
