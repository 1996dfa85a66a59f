package io.merklite.core.merkle;

import io.merklite.core.ConfigurationException;
import io.merklite.core.Digest;
import io.merklite.core.EmptyInputException;
import io.merklite.core.HashAlgorithm;
import io.merklite.core.StandardAlgorithm;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a {@link MerkleTree} over a byte stream.
 * <p>
 * Two phases:
 *  1) Chunking: read the stream in non-overlapping windows of chunkSize bytes
 *     (the last one may be shorter) and emit one leaf per non-empty window.
 *  2) Folding: pair adjacent nodes left to right into parents, level by level,
 *     until a single node remains. An unpaired trailing node is promoted
 *     unchanged into the next level.
 * <p>
 * The builder is immutable and can be reused; each build owns its own nodes.
 * Construction is single-threaded and either returns a complete tree or throws.
 */
public final class TreeBuilder {
    private static final Logger log = Logger.getLogger(TreeBuilder.class.getName());

    public static final int DEFAULT_CHUNK_SIZE = 1024;

    private final HashAlgorithm algorithm;
    private final int chunkSize;

    /** SHA-256 builder with the given chunk size. */
    public TreeBuilder(int chunkSize) {
        this(StandardAlgorithm.SHA_256, chunkSize);
    }

    /**
     * @param algorithm hash algorithm; its digest size is checked once here
     * @param chunkSize bytes per leaf, must be positive
     * @throws ConfigurationException      if chunkSize is not positive
     * @throws io.merklite.core.AlgorithmMismatchException if the algorithm's output size is inconsistent
     */
    public TreeBuilder(HashAlgorithm algorithm, int chunkSize) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunkSize must be > 0, got: " + chunkSize);
        }
        this.algorithm = HashAlgorithm.verify(algorithm);
        this.chunkSize = chunkSize;
    }

    public HashAlgorithm algorithm() { return algorithm; }

    public int chunkSize() { return chunkSize; }

    // ---------------- whole-tree entry points ----------------

    /** Build a tree over everything readable from {@code in}. The stream is not closed. */
    public MerkleTree build(InputStream in) throws IOException {
        List<TreeNode> leaves = generateLeaves(in);
        if (leaves.isEmpty()) {
            throw new EmptyInputException("input produced no leaves; a Merkle tree needs at least one byte");
        }
        List<Integer> levelSizes = new ArrayList<>();
        TreeNode root = fold(leaves, levelSizes);

        log.log(Level.FINE, () -> String.format("built %s tree: bytes=%d chunkSize=%d levels=%s root=%s",
                algorithm.algorithmName(), root.chunkSize(), chunkSize, levelSizes, root.digest().hexDigest()));
        return new MerkleTree(algorithm, chunkSize, root, levelSizes);
    }

    /** Build a tree over an in-memory buffer. */
    public MerkleTree build(byte[] contents) {
        Objects.requireNonNull(contents, "contents");
        try {
            return build(new ByteArrayInputStream(contents));
        } catch (IOException e) {
            // ByteArrayInputStream does not throw
            throw new UncheckedIOException(e);
        }
    }

    /** Build a tree over the UTF-8 bytes of {@code contents}. */
    public MerkleTree build(String contents) {
        Objects.requireNonNull(contents, "contents");
        return build(contents.getBytes(StandardCharsets.UTF_8));
    }

    /** Build a tree over the contents of a file. */
    public MerkleTree build(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return build(in);
        }
    }

    // ---------------- phase 1: chunking ----------------

    /**
     * Read {@code in} sequentially and emit one leaf per non-empty window.
     * Offsets are cumulative byte counts; the last leaf's size is whatever remained.
     * An empty stream yields an empty list.
     *
     * @throws IOException if reading fails; no partial result is returned
     */
    public List<TreeNode> generateLeaves(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        byte[] buf = new byte[chunkSize];
        List<TreeNode> leaves = new ArrayList<>();
        long offset = 0;

        while (true) {
            // readNBytes only returns short at end of stream
            int n = in.readNBytes(buf, 0, chunkSize);
            if (n == 0) break;

            Digest d = algorithm.hash(buf, 0, n);
            leaves.add(TreeNode.leaf(new TreeNode.Data(d, offset, n)));
            offset += n;

            if (n < chunkSize) break;
        }

        final long total = offset;
        log.log(Level.FINE, () -> "chunked " + total + " bytes into " + leaves.size() + " leaves");
        return leaves;
    }

    // ---------------- phase 2: folding ----------------

    /**
     * Fold an ordered, non-empty sequence of nodes into a single root.
     * The nodes must cover contiguous ranges and must not already have parents.
     *
     * @throws EmptyInputException if {@code leaves} is empty
     */
    public TreeNode buildTree(List<TreeNode> leaves) {
        Objects.requireNonNull(leaves, "leaves");
        if (leaves.isEmpty()) {
            throw new EmptyInputException("cannot build a tree from zero leaves");
        }
        return fold(leaves, new ArrayList<>());
    }

    /**
     * One folding pass: pair (0,1), (2,3), ... into new parents and append
     * the unpaired trailing node, if any, unchanged.
     * <p>
     * Children of each new parent get their parent link set. A promoted node
     * keeps its parent unset until a later level pairs it.
     * <p>
     * The whole level is validated before any link is set, so a rejected level
     * leaves every node as it was.
     *
     * @throws IllegalArgumentException if a pair does not cover adjacent ranges
     * @throws IllegalStateException    if a node to be paired already has a parent
     */
    public List<TreeNode> foldLevel(List<TreeNode> level) {
        Objects.requireNonNull(level, "level");
        if (level.isEmpty()) {
            throw new EmptyInputException("cannot fold an empty level");
        }
        for (int i = 0; i + 1 < level.size(); i += 2) {
            checkPairable(level.get(i), level.get(i + 1));
        }

        List<TreeNode> next = new ArrayList<>((level.size() + 1) / 2);
        for (int i = 0; i + 1 < level.size(); i += 2) {
            next.add(join(level.get(i), level.get(i + 1)));
        }
        if ((level.size() & 1) == 1) {
            next.add(level.get(level.size() - 1));
        }
        return next;
    }

    private TreeNode fold(List<TreeNode> leaves, List<Integer> levelSizes) {
        List<TreeNode> current = leaves;
        levelSizes.add(current.size());

        while (current.size() > 1) {
            current = foldLevel(current);
            levelSizes.add(current.size());
        }
        return current.get(0);
    }

    private static void checkPairable(TreeNode left, TreeNode right) {
        if (left.chunkOffset() + left.chunkSize() != right.chunkOffset()) {
            throw new IllegalArgumentException(String.format(
                    "nodes are not contiguous: left covers [%d, %d), right starts at %d",
                    left.chunkOffset(), left.chunkOffset() + left.chunkSize(), right.chunkOffset()));
        }
        for (TreeNode n : new TreeNode[]{left, right}) {
            if (n.isAttached()) {
                throw new IllegalStateException("node at offset " + n.chunkOffset() + " already has a parent");
            }
        }
    }

    private TreeNode join(TreeNode left, TreeNode right) {
        var data = new TreeNode.Data(
                algorithm.hash(left.digest(), right.digest()),
                left.chunkOffset(),
                left.chunkSize() + right.chunkSize()
        );
        TreeNode parent = TreeNode.internal(data, left, right);
        left.attachTo(parent);
        right.attachTo(parent);
        return parent;
    }
}
