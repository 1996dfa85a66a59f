package io.merklite.client;

import io.merklite.core.merkle.MerkleTree;

import java.util.List;

/** JSON view of a built tree, printed by the CLI with {@code --json}. */
public record TreeSummary(
        String source,
        String algorithm,
        int chunkSize,
        long bytes,
        int leaves,
        int height,
        List<Integer> levelSizes,
        String root
) {

    public static TreeSummary of(String source, MerkleTree tree) {
        return new TreeSummary(
                source,
                tree.algorithm().algorithmName(),
                tree.chunkSize(),
                tree.totalBytes(),
                tree.leafCount(),
                tree.height(),
                tree.levelSizes(),
                tree.hexDigest()
        );
    }

    /** Result of {@code compare}. */
    public record Comparison(boolean equal, TreeSummary left, TreeSummary right) {}

    /** Result of {@code verify}. */
    public record Verification(boolean matches, String expected, TreeSummary actual) {}
}
