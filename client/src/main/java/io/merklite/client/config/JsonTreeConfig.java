package io.merklite.client.config;

/**
 * JSON shape of a tree config file. Absent fields fall back to defaults.
 * <pre>
 * { "chunkSize": 4096, "algorithm": "SHA-256" }
 * </pre>
 */
public class JsonTreeConfig {
    public Integer chunkSize;
    public String algorithm;
}
