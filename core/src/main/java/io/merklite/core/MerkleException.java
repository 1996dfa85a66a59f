package io.merklite.core;

/** Base type for failures raised while configuring or building a tree. */
public class MerkleException extends RuntimeException {

    public MerkleException(String message) {
        super(message);
    }

    public MerkleException(String message, Throwable cause) {
        super(message, cause);
    }
}
