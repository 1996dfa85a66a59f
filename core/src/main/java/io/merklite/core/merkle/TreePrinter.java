package io.merklite.core.merkle;

import java.util.Objects;

/**
 * Indented text dump of a tree, one node per line, for inspection and debugging.
 * <pre>
 * internal [0, 11) 11 bytes  3f9a...
 *   internal [0, 8) 8 bytes  ...
 * </pre>
 */
public final class TreePrinter {

    private TreePrinter() {}

    public static String render(MerkleTree tree) {
        Objects.requireNonNull(tree, "tree");
        return render(tree.root());
    }

    public static String render(TreeNode node) {
        Objects.requireNonNull(node, "node");
        StringBuilder sb = new StringBuilder();
        append(sb, node, 0);
        return sb.toString();
    }

    private static void append(StringBuilder sb, TreeNode node, int depth) {
        sb.append("  ".repeat(depth))
                .append(node.isLeaf() ? "leaf" : "internal")
                .append(" [").append(node.chunkOffset())
                .append(", ").append(node.chunkOffset() + node.chunkSize())
                .append(") ").append(node.chunkSize()).append(node.chunkSize() == 1 ? " byte  " : " bytes  ")
                .append(node.digest().hexDigest())
                .append('\n');
        if (!node.isLeaf()) {
            append(sb, node.left(), depth + 1);
            append(sb, node.right(), depth + 1);
        }
    }
}
