package io.merklite.core.merkle;

import io.merklite.core.AlgorithmMismatchException;
import io.merklite.core.ConfigurationException;
import io.merklite.core.Digest;
import io.merklite.core.EmptyInputException;
import io.merklite.core.HashAlgorithm;
import io.merklite.core.StandardAlgorithm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TreeBuilderTest {

    private static final HashAlgorithm SHA256 = StandardAlgorithm.SHA_256;

    private static InputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] randomBytes(int n, long seed) {
        byte[] b = new byte[n];
        new Random(seed).nextBytes(b);
        return b;
    }

    // ---------- configuration ----------

    @Test
    void non_positive_chunk_size_is_a_configuration_error() {
        assertThrows(ConfigurationException.class, () -> new TreeBuilder(0));
        assertThrows(ConfigurationException.class, () -> new TreeBuilder(SHA256, -4));
    }

    @Test
    void algorithm_size_is_checked_once_at_construction() {
        HashAlgorithm broken = new HashAlgorithm() {
            @Override public String algorithmName() { return "broken"; }
            @Override public int digestSize() { return 20; }
            @Override public Digest hash(byte[] data, int offset, int length) {
                return SHA256.hash(data, offset, length);
            }
        };
        assertThrows(AlgorithmMismatchException.class, () -> new TreeBuilder(broken, 4));
    }

    // ---------- chunking ----------

    @Test
    void leaves_are_contiguous_and_cover_the_whole_stream() throws IOException {
        byte[] data = randomBytes(1000, 7);
        for (int chunk : new int[]{1, 3, 7, 64, 100, 999, 1000, 4096}) {
            List<TreeNode> leaves = new TreeBuilder(chunk).generateLeaves(new ByteArrayInputStream(data));

            long expectedOffset = 0;
            for (TreeNode leaf : leaves) {
                assertTrue(leaf.isLeaf());
                assertEquals(expectedOffset, leaf.chunkOffset(), "chunk=" + chunk);
                assertTrue(leaf.chunkSize() > 0 && leaf.chunkSize() <= chunk);
                expectedOffset += leaf.chunkSize();
            }
            assertEquals(data.length, expectedOffset, "chunk=" + chunk);
            assertEquals((data.length + chunk - 1) / chunk, leaves.size(), "chunk=" + chunk);

            long remainder = data.length % chunk;
            long expectedLast = remainder == 0 ? chunk : remainder;
            assertEquals(expectedLast, leaves.get(leaves.size() - 1).chunkSize(), "chunk=" + chunk);
        }
    }

    @Test
    void leaf_digest_is_hash_of_its_chunk_bytes() throws IOException {
        List<TreeNode> leaves = new TreeBuilder(4).generateLeaves(stream("hello world"));

        assertEquals(3, leaves.size());
        assertEquals(SHA256.hash("hell".getBytes(StandardCharsets.UTF_8)), leaves.get(0).digest());
        assertEquals(SHA256.hash("o wo".getBytes(StandardCharsets.UTF_8)), leaves.get(1).digest());
        assertEquals(SHA256.hash("rld".getBytes(StandardCharsets.UTF_8)), leaves.get(2).digest());
        assertEquals(3, leaves.get(2).chunkSize());
    }

    @Test
    void exact_multiple_of_chunk_size_emits_no_empty_trailing_leaf() throws IOException {
        List<TreeNode> leaves = new TreeBuilder(4).generateLeaves(stream("abcdefgh"));
        assertEquals(2, leaves.size());
        assertEquals(4, leaves.get(1).chunkSize());
    }

    @Test
    void short_reads_from_the_source_do_not_split_chunks() throws IOException {
        // Hands out at most 2 bytes per read() call.
        InputStream trickle = new FilterInputStream(stream("abcdefghij")) {
            @Override public int read(byte[] b, int off, int len) throws IOException {
                return super.read(b, off, Math.min(len, 2));
            }
        };
        List<TreeNode> leaves = new TreeBuilder(5).generateLeaves(trickle);

        assertEquals(2, leaves.size());
        assertEquals(5, leaves.get(0).chunkSize());
        assertEquals(5, leaves.get(1).chunkOffset());
    }

    @Test
    void empty_stream_yields_no_leaves_and_build_fails_explicitly() throws IOException {
        var builder = new TreeBuilder(8);
        assertTrue(builder.generateLeaves(stream("")).isEmpty());
        assertThrows(EmptyInputException.class, () -> builder.build(stream("")));
        assertThrows(EmptyInputException.class, () -> builder.build(new byte[0]));
        assertThrows(EmptyInputException.class, () -> builder.buildTree(List.of()));
    }

    @Test
    void read_failure_fails_the_whole_build() {
        InputStream failing = new InputStream() {
            private int served;
            @Override public int read() throws IOException {
                if (served++ < 10) return 'x';
                throw new IOException("disk on fire");
            }
        };
        var e = assertThrows(IOException.class, () -> new TreeBuilder(4).build(failing));
        assertEquals("disk on fire", e.getMessage());
    }

    // ---------- folding ----------

    @Test
    void odd_leaf_count_promotes_trailing_node_unchanged() throws IOException {
        var builder = new TreeBuilder(1);
        List<TreeNode> leaves = builder.generateLeaves(stream("abc"));
        TreeNode a = leaves.get(0), b = leaves.get(1), c = leaves.get(2);

        List<TreeNode> level1 = builder.foldLevel(leaves);
        assertEquals(2, level1.size());
        TreeNode ab = level1.get(0);
        assertSame(a, ab.left());
        assertSame(b, ab.right());
        assertSame(c, level1.get(1), "promoted node must be reused, not rehashed");
        assertTrue(c.isRoot(), "promoted node has no parent until it is paired");
        assertSame(ab, a.parent().orElseThrow());

        List<TreeNode> level2 = builder.foldLevel(level1);
        assertEquals(1, level2.size());
        TreeNode root = level2.get(0);
        assertSame(ab, root.left());
        assertSame(c, root.right());
        assertSame(root, c.parent().orElseThrow());
        assertTrue(root.isRoot());
        assertEquals(SHA256.hash(ab.digest(), c.digest()), root.digest());
        assertEquals(0, root.chunkOffset());
        assertEquals(3, root.chunkSize());
    }

    @Test
    void hello_world_with_chunk_size_one_folds_11_6_3_2_1() {
        MerkleTree tree = new TreeBuilder(1).build("hello world");

        assertEquals(List.of(11, 6, 3, 2, 1), tree.levelSizes());
        assertEquals(4, tree.height());
        assertEquals(11, tree.leafCount());
        assertTrue(tree.root().isRoot());
        assertFalse(tree.root().isLeaf());
    }

    @Test
    void internal_nodes_commit_to_their_children() {
        MerkleTree tree = new TreeBuilder(SHA256, 3).build(randomBytes(100, 11));

        Deque<TreeNode> todo = new ArrayDeque<>();
        todo.push(tree.root());
        int internal = 0;
        while (!todo.isEmpty()) {
            TreeNode n = todo.pop();
            if (n.isLeaf()) continue;
            internal++;
            assertEquals(SHA256.hash(n.left().digest(), n.right().digest()), n.digest());
            assertEquals(n.left().chunkOffset(), n.chunkOffset());
            assertEquals(n.left().chunkSize() + n.right().chunkSize(), n.chunkSize());
            assertEquals(n.left().chunkOffset() + n.left().chunkSize(), n.right().chunkOffset());
            assertSame(n, n.left().parent().orElseThrow());
            assertSame(n, n.right().parent().orElseThrow());
            todo.push(n.left());
            todo.push(n.right());
        }
        // a binary tree with L leaves has L - 1 internal nodes
        assertEquals(tree.leafCount() - 1, internal);
    }

    @Test
    void number_of_levels_is_ceil_log2_of_leaf_count() {
        var builder = new TreeBuilder(1);
        for (int n = 1; n <= 70; n++) {
            MerkleTree tree = builder.build(new byte[n]);
            int expected = n == 1 ? 0 : 32 - Integer.numberOfLeadingZeros(n - 1);
            assertEquals(expected, tree.height(), "leaves=" + n);
            assertEquals(1, tree.levelSizes().get(tree.levelSizes().size() - 1));
        }
    }

    @Test
    void build_tree_returns_same_root_as_build() throws IOException {
        var builder = new TreeBuilder(2);
        TreeNode root = builder.buildTree(builder.generateLeaves(stream("merkle")));
        assertEquals(builder.build("merkle").root(), root);
    }

    @Test
    void folding_rejects_non_contiguous_nodes() throws IOException {
        var builder = new TreeBuilder(1);
        List<TreeNode> leaves = builder.generateLeaves(stream("abcd"));
        List<TreeNode> shuffled = List.of(leaves.get(1), leaves.get(0));
        assertThrows(IllegalArgumentException.class, () -> builder.foldLevel(shuffled));
    }

    @Test
    void rejected_level_leaves_nodes_untouched() throws IOException {
        var builder = new TreeBuilder(1);
        List<TreeNode> leaves = builder.generateLeaves(stream("abcd"));
        List<TreeNode> swapped = List.of(leaves.get(0), leaves.get(1), leaves.get(3), leaves.get(2));

        assertThrows(IllegalArgumentException.class, () -> builder.foldLevel(swapped));
        for (TreeNode leaf : leaves) {
            assertTrue(leaf.isRoot(), "offset " + leaf.chunkOffset());
        }

        TreeNode root = builder.buildTree(leaves);
        assertEquals(builder.build("abcd").root(), root);
        assertEquals(4, root.chunkSize());
    }

    @Test
    void already_paired_nodes_are_rejected_before_any_link_is_set() throws IOException {
        var builder = new TreeBuilder(1);
        List<TreeNode> leaves = builder.generateLeaves(stream("abcd"));
        List<TreeNode> firstPair = builder.foldLevel(leaves.subList(0, 2));

        // (a, b) already belong to firstPair's parent; c and d must stay free
        assertThrows(IllegalStateException.class, () -> builder.foldLevel(leaves));
        assertTrue(leaves.get(2).isRoot());
        assertTrue(leaves.get(3).isRoot());
        assertSame(firstPair.get(0), leaves.get(0).parent().orElseThrow());
    }

    @Test
    void single_chunk_input_is_its_own_root() {
        MerkleTree tree = new TreeBuilder(64).build("hello world");

        assertTrue(tree.root().isRoot());
        assertTrue(tree.root().isLeaf());
        assertEquals(0, tree.height());
        assertEquals(List.of(1), tree.levelSizes());
        assertEquals(SHA256.hash("hello world".getBytes(StandardCharsets.UTF_8)), tree.rootDigest());
    }

    @Test
    void file_and_stream_inputs_agree(@TempDir Path dir) throws IOException {
        byte[] data = randomBytes(5000, 3);
        Path file = dir.resolve("blob.bin");
        Files.write(file, data);

        var builder = new TreeBuilder(SHA256, 256);
        assertEquals(builder.build(data), builder.build(file));
        assertEquals(5000, builder.build(file).totalBytes());
    }
}
