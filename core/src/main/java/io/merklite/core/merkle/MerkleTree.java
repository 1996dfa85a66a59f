package io.merklite.core.merkle;

import io.merklite.core.Digest;
import io.merklite.core.HashAlgorithm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Result of building a chunked binary Merkle tree over a byte stream.
 * <p>
 * The root digest commits to the stream's content and its chunk layout:
 * identical bytes, chunk size and algorithm always produce the same root,
 * and a change to any byte changes it.
 * <p>
 * Two trees are equal iff their roots are equal (see {@link TreeNode#equals(Object)}).
 * That comparison is O(1) and relies on the collision resistance of the algorithm.
 * <p>
 * Instances are created by {@link TreeBuilder}.
 */
public final class MerkleTree {

    private final HashAlgorithm algorithm;
    private final int chunkSize;
    private final TreeNode root;
    private final List<Integer> levelSizes;

    MerkleTree(HashAlgorithm algorithm, int chunkSize, TreeNode root, List<Integer> levelSizes) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.chunkSize = chunkSize;
        this.root = Objects.requireNonNull(root, "root");
        this.levelSizes = List.copyOf(levelSizes);
    }

    /** SHA-256 tree over the UTF-8 bytes of {@code contents}. */
    public static MerkleTree of(String contents, int chunkSize) {
        return new TreeBuilder(chunkSize).build(contents);
    }

    /** SHA-256 tree over {@code contents}. */
    public static MerkleTree of(byte[] contents, int chunkSize) {
        return new TreeBuilder(chunkSize).build(contents);
    }

    public TreeNode root() { return root; }

    public Digest rootDigest() { return root.digest(); }

    public String hexDigest() { return root.digest().hexDigest(); }

    public HashAlgorithm algorithm() { return algorithm; }

    public int chunkSize() { return chunkSize; }

    /** Number of bytes covered by the tree. */
    public long totalBytes() { return root.chunkSize(); }

    public int leafCount() { return levelSizes.get(0); }

    /**
     * Node count of every level, leaves first and root last.
     * "hello world" with chunk size 1 gives [11, 6, 3, 2, 1].
     */
    public List<Integer> levelSizes() { return levelSizes; }

    /** Number of folding rounds; 0 when the root is the only leaf. */
    public int height() { return levelSizes.size() - 1; }

    /** Leaves in stream order. */
    public List<TreeNode> leaves() {
        List<TreeNode> out = new ArrayList<>(leafCount());
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode n = stack.pop();
            if (n.isLeaf()) {
                out.add(n);
            } else {
                stack.push(n.right());
                stack.push(n.left());
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MerkleTree other)) return false;
        return root.equals(other.root);
    }

    @Override
    public int hashCode() { return root.hashCode(); }

    @Override
    public String toString() {
        return "MerkleTree[" + algorithm.algorithmName()
                + ", chunkSize=" + chunkSize
                + ", bytes=" + totalBytes()
                + ", leaves=" + leafCount()
                + ", root=" + hexDigest() + "]";
    }
}
