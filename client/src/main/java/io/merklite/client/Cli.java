package io.merklite.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.merklite.client.config.TreeConfig;
import io.merklite.core.Digest;
import io.merklite.core.MerkleException;
import io.merklite.core.StandardAlgorithm;
import io.merklite.core.merkle.MerkleTree;
import io.merklite.core.merkle.TreeBuilder;
import io.merklite.core.merkle.TreePrinter;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line driver for building and comparing Merkle trees.
 *
 * Usage:
 *   merklite-cli [options] digest <text>
 *   merklite-cli [options] hash <file|->
 *   merklite-cli [options] compare <a> <b>
 *   merklite-cli [options] tree <file|->
 *   merklite-cli [options] verify <file|-> <hex-root>
 *   merklite-cli demo
 *
 * Examples:
 *   merklite-cli -c 4096 hash big.iso
 *   cat big.iso | merklite-cli -c 4096 --json hash -
 *   merklite-cli -a sha3-256 compare a.bin b.bin
 *
 * Exit codes: 0 ok, 1 usage/configuration/input error, 2 I/O or unexpected error,
 * 3 compare/verify mismatch.
 */
public final class Cli {
    private static final Logger log = Logger.getLogger(Cli.class.getName());

    // JUL holds loggers weakly; keep the package logger alive so --verbose sticks.
    private static final Logger PACKAGE_LOG = Logger.getLogger("io.merklite");

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;
    static final int EXIT_MISMATCH = 3;

    private static final String STDIN = "-";

    private final InputStream stdin;
    private final PrintStream out;
    private final PrintStream err;
    private final ObjectWriter json = new ObjectMapper().writerWithDefaultPrettyPrinter();

    Cli(InputStream stdin, PrintStream out, PrintStream err) {
        this.stdin = stdin;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        configureLogging();
        int code = new Cli(System.in, System.out, System.err).run(args);
        System.exit(code);
    }

    /** Run one command and return the process exit code. */
    int run(String[] args) {
        try {
            CliOptions opts = CliOptions.fromArgs(args);
            if (opts.verbose()) {
                PACKAGE_LOG.setLevel(Level.FINE);
            }
            if (opts.help()) {
                printUsage(out);
                return EXIT_OK;
            }
            if (opts.command() == null) {
                throw new CliException("missing command");
            }
            return dispatch(opts);
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        } catch (MerkleException e) {
            log.log(Level.WARNING, "command failed: " + e.getMessage());
            log.log(Level.FINE, "command failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            log.log(Level.WARNING, "I/O failure", e);
            err.println("error: " + describe(e));
            return EXIT_IO;
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "unexpected failure", e);
            err.println("error: " + e);
            return EXIT_IO;
        }
    }

    private int dispatch(CliOptions opts) throws IOException {
        List<String> a = opts.arguments();
        switch (opts.command()) {
            case "digest" -> {
                expectArgs(a, 1, "digest requires <text>");
                return digest(opts.treeConfig(), a.get(0));
            }
            case "hash" -> {
                expectArgs(a, 1, "hash requires <file|->");
                return hash(opts, a.get(0));
            }
            case "compare" -> {
                expectArgs(a, 2, "compare requires <a> <b>");
                return compare(opts, a.get(0), a.get(1));
            }
            case "tree" -> {
                expectArgs(a, 1, "tree requires <file|->");
                return tree(opts, a.get(0));
            }
            case "verify" -> {
                expectArgs(a, 2, "verify requires <file|-> <hex-root>");
                return verify(opts, a.get(0), a.get(1));
            }
            case "demo" -> {
                expectArgs(a, 0, "demo takes no arguments");
                return demo();
            }
            default -> throw new CliException("unknown command: " + opts.command());
        }
    }

    // ---------------- commands ----------------

    private int digest(TreeConfig cfg, String text) {
        Digest d = cfg.algorithm().hash(text.getBytes(StandardCharsets.UTF_8));
        out.println(d.hexDigest());
        return EXIT_OK;
    }

    private int hash(CliOptions opts, String source) throws IOException {
        MerkleTree tree = buildFrom(opts.treeConfig().newBuilder(), source);
        if (opts.json()) {
            printJson(TreeSummary.of(source, tree));
        } else {
            out.println(tree.hexDigest() + "  " + source);
        }
        return EXIT_OK;
    }

    private int compare(CliOptions opts, String left, String right) throws IOException {
        if (STDIN.equals(left) && STDIN.equals(right)) {
            throw new CliException("compare can read stdin for at most one side");
        }
        TreeBuilder builder = opts.treeConfig().newBuilder();
        MerkleTree l = buildFrom(builder, left);
        MerkleTree r = buildFrom(builder, right);
        boolean equal = l.equals(r);

        if (opts.json()) {
            printJson(new TreeSummary.Comparison(equal, TreeSummary.of(left, l), TreeSummary.of(right, r)));
        } else {
            out.println(equal ? "equal" : "different");
        }
        return equal ? EXIT_OK : EXIT_MISMATCH;
    }

    private int tree(CliOptions opts, String source) throws IOException {
        MerkleTree tree = buildFrom(opts.treeConfig().newBuilder(), source);
        out.print(TreePrinter.render(tree));
        return EXIT_OK;
    }

    private int verify(CliOptions opts, String source, String expectedHex) throws IOException {
        Digest expected;
        try {
            expected = Digest.fromHex(expectedHex);
        } catch (IllegalArgumentException e) {
            throw new CliException(e.getMessage());
        }
        MerkleTree tree = buildFrom(opts.treeConfig().newBuilder(), source);
        boolean matches = tree.rootDigest().equals(expected);

        if (opts.json()) {
            printJson(new TreeSummary.Verification(matches, expected.hexDigest(), TreeSummary.of(source, tree)));
        } else if (matches) {
            out.println("OK");
        } else {
            out.println("MISMATCH expected=" + expected.hexDigest() + " actual=" + tree.hexDigest());
        }
        return matches ? EXIT_OK : EXIT_MISMATCH;
    }

    /** Two one-byte-chunk trees over strings differing in the last byte, then a known digest. */
    private int demo() {
        String checksum = StandardAlgorithm.SHA_256.hash("hello world".getBytes(StandardCharsets.UTF_8)).hexDigest();

        MerkleTree tree1 = MerkleTree.of("hello world", 1);
        MerkleTree tree2 = MerkleTree.of("hello worlb", 1);

        // equality printed as 1/0
        out.println(tree1.equals(tree2) ? 1 : 0);
        out.println(checksum);
        return EXIT_OK;
    }

    // ---------------- helpers ----------------

    private MerkleTree buildFrom(TreeBuilder builder, String source) throws IOException {
        log.log(Level.FINE, () -> "building " + builder.algorithm().algorithmName() + " tree over " + source
                + " with chunkSize=" + builder.chunkSize());
        if (STDIN.equals(source)) {
            return builder.build(stdin);
        }
        return builder.build(Path.of(source));
    }

    private void printJson(Object value) {
        try {
            out.println(json.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render JSON for " + value.getClass().getSimpleName(), e);
        }
    }

    private static void expectArgs(List<String> args, int n, String message) {
        if (args.size() != n) {
            throw new CliException(message);
        }
    }

    private static String describe(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "no such file: " + e.getMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }

    private static void configureLogging() {
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("warning: could not load logging.properties: " + e.getMessage());
        }
    }

    private static void printUsage(PrintStream ps) {
        ps.println("""
            Usage: merklite-cli [options] <command> [args]

            Commands:
              digest <text>              Hex digest of the UTF-8 text
              hash <file|->              Root digest of a file or stdin
              compare <a> <b>            Compare two inputs by root digest (exit 3 if different)
              tree <file|->              Print the tree, one node per line
              verify <file|-> <hex>      Check an input against an expected root (exit 3 on mismatch)
              demo                       Compare "hello world" and "hello worlb" trees

            Options:
              --chunk-size, -c   Bytes per leaf (default: 1024)
              --algorithm,  -a   SHA-256, SHA-384, SHA-512, SHA3-256, SHA3-512 (default: SHA-256)
              --config           JSON file with chunkSize and algorithm; flags override it
              --json             Print JSON instead of plain text
              --verbose,    -v   Log build details
              --help,       -h   Show this help message
            """);
    }
}
