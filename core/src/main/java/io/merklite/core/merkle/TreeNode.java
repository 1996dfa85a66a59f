package io.merklite.core.merkle;

import io.merklite.core.Digest;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.Optional;

/**
 * A node in a chunked binary Merkle tree.
 * <p>
 * Kinds:
 *  - leaf:     no children; digest = H(chunk bytes [chunkOffset, chunkOffset + chunkSize)).
 *  - internal: two children; digest = H(left.digest || right.digest),
 *              chunkOffset = left.chunkOffset, chunkSize = left.chunkSize + right.chunkSize.
 * <p>
 * The parent link is a weak back-reference, set once when a folding level pairs
 * this node with a sibling. It only answers "is this the root" and supports
 * walking upward; it never keeps a parent alive. A node whose parent is unset
 * (or was collected along with a dropped tree) reports {@link #isRoot()}.
 * <p>
 * Nodes are immutable once built apart from that single parent assignment,
 * which happens inside {@link TreeBuilder} before the tree is handed out.
 */
public final class TreeNode {

    /**
     * The committed triple of a node: its digest and the byte range it covers.
     */
    public record Data(Digest digest, long chunkOffset, long chunkSize) {
        public Data {
            Objects.requireNonNull(digest, "digest");
            if (chunkOffset < 0) throw new IllegalArgumentException("chunkOffset must be >= 0");
            if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
        }
    }

    private final Data data;
    private final TreeNode left;
    private final TreeNode right;
    private WeakReference<TreeNode> parent;

    private TreeNode(Data data, TreeNode left, TreeNode right) {
        this.data = Objects.requireNonNull(data, "data");
        this.left = left;
        this.right = right;
    }

    static TreeNode leaf(Data data) {
        return new TreeNode(data, null, null);
    }

    static TreeNode internal(Data data, TreeNode left, TreeNode right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        return new TreeNode(data, left, right);
    }

    /** True once a folding level has paired this node, even if the parent was since collected. */
    boolean isAttached() { return parent != null; }

    void attachTo(TreeNode newParent) {
        if (isAttached()) {
            throw new IllegalStateException("node at offset " + data.chunkOffset() + " already has a parent");
        }
        parent = new WeakReference<>(newParent);
    }

    public Data data() { return data; }

    public Digest digest() { return data.digest(); }

    public long chunkOffset() { return data.chunkOffset(); }

    public long chunkSize() { return data.chunkSize(); }

    /** Left child, or null for a leaf. */
    public TreeNode left() { return left; }

    /** Right child, or null for a leaf. */
    public TreeNode right() { return right; }

    /** Parent node; empty for the root. */
    public Optional<TreeNode> parent() {
        return parent == null ? Optional.empty() : Optional.ofNullable(parent.get());
    }

    public boolean isRoot() { return parent().isEmpty(); }

    public boolean isLeaf() { return left == null && right == null; }

    /**
     * Shallow metadata equality: root-ness, leaf-ness and the {@link Data} triple.
     * Children are not compared.
     * <p>
     * For two roots this is a sound proxy for whole-tree equality, because the
     * root digest commits to every digest below it. For non-root nodes it only
     * says the metadata matches, not that the subtrees are identical.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreeNode other)) return false;
        if (isRoot() != other.isRoot()) return false;
        if (isLeaf() != other.isLeaf()) return false;
        return data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(isRoot(), isLeaf(), data);
    }

    @Override
    public String toString() {
        return (isLeaf() ? "leaf" : "internal")
                + "[offset=" + data.chunkOffset()
                + ", size=" + data.chunkSize()
                + ", digest=" + data.digest().hexDigest() + "]";
    }
}
