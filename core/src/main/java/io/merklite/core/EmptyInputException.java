package io.merklite.core;

/** The input produced zero leaves, so there is no root to build. */
public class EmptyInputException extends MerkleException {

    public EmptyInputException(String message) {
        super(message);
    }
}
