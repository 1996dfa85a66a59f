package io.merklite.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.merklite.core.ConfigurationException;
import io.merklite.core.HashAlgorithm;
import io.merklite.core.StandardAlgorithm;
import io.merklite.core.merkle.TreeBuilder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Validated settings for building trees from the command line.
 *
 * Sources, lowest precedence first:
 *  - built-in defaults (1024-byte chunks, SHA-256),
 *  - an optional JSON config file,
 *  - explicit CLI flags.
 */
public record TreeConfig(int chunkSize, HashAlgorithm algorithm) {

    public TreeConfig {
        Objects.requireNonNull(algorithm, "algorithm");
        if (chunkSize <= 0) throw new ConfigurationException("chunkSize must be > 0, got: " + chunkSize);
    }

    public static TreeConfig defaults() {
        return new TreeConfig(TreeBuilder.DEFAULT_CHUNK_SIZE, StandardAlgorithm.SHA_256);
    }

    /**
     * Load a config file, filling absent fields from {@link #defaults()}.
     *
     * @throws ConfigurationException if the file cannot be read or holds invalid values
     */
    public static TreeConfig fromJsonFile(Path path) {
        Objects.requireNonNull(path, "path");
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonTreeConfig cfg = mapper.readValue(path.toFile(), JsonTreeConfig.class);
            return defaults().withOverrides(cfg.chunkSize, cfg.algorithm);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load tree config from " + path, e);
        }
    }

    /** Copy with any non-null override applied. */
    public TreeConfig withOverrides(Integer chunkSizeOverride, String algorithmOverride) {
        return new TreeConfig(
                chunkSizeOverride != null ? chunkSizeOverride : chunkSize,
                algorithmOverride != null ? StandardAlgorithm.fromName(algorithmOverride) : algorithm
        );
    }

    public TreeBuilder newBuilder() {
        return new TreeBuilder(algorithm, chunkSize);
    }
}
