package io.merklite.core;

/** Invalid tree configuration: non-positive chunk size, unknown algorithm, bad config values. */
public class ConfigurationException extends MerkleException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
