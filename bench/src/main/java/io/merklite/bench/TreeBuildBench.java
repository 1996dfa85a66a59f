package io.merklite.bench;

import io.merklite.core.HashAlgorithm;
import io.merklite.core.StandardAlgorithm;
import io.merklite.core.merkle.MerkleTree;
import io.merklite.core.merkle.TreeBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Throughput driver for tree construction over an in-memory buffer.
 *
 * Usage:
 *   java -jar bench.jar \
 *     --bytes 67108864 \
 *     --chunk-sizes 64,1024,65536 \
 *     --algorithm SHA-256 \
 *     --iterations 5 \
 *     --seed 42
 *
 * Output:
 *   - One summary line per chunk size to stderr (median over iterations).
 *   - CSV to stdout with one row per iteration:
 *       algorithm,chunk_size,bytes,leaves,height,millis,mb_per_s
 */
public final class TreeBuildBench {

    static final class Sample {
        final int chunkSize;
        final int leaves;
        final int height;
        final double millis;

        Sample(int chunkSize, int leaves, int height, double millis) {
            this.chunkSize = chunkSize;
            this.leaves = leaves;
            this.height = height;
            this.millis = millis;
        }
    }

    private TreeBuildBench() {}

    public static void main(String[] args) {
        Map<String, String> cfg = parseArgs(args);

        int bytes = Integer.parseInt(cfg.getOrDefault("bytes", String.valueOf(16 * 1024 * 1024)));
        List<Integer> chunkSizes = parseInts(cfg.getOrDefault("chunk-sizes", "64,1024,65536"));
        HashAlgorithm algorithm = StandardAlgorithm.fromName(cfg.getOrDefault("algorithm", "SHA-256"));
        int iterations = Integer.parseInt(cfg.getOrDefault("iterations", "5"));
        long seed = Long.parseLong(cfg.getOrDefault("seed", "42"));

        if (bytes <= 0) throw new IllegalArgumentException("bytes must be > 0");
        if (iterations <= 0) throw new IllegalArgumentException("iterations must be > 0");

        runBenchmark(bytes, chunkSizes, algorithm, iterations, seed);
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static List<Integer> parseInts(String csv) {
        List<Integer> out = new ArrayList<>();
        for (String part : csv.split(",")) {
            if (!part.isBlank()) out.add(Integer.parseInt(part.trim()));
        }
        if (out.isEmpty()) throw new IllegalArgumentException("chunk-sizes must not be empty");
        return out;
    }

    private static void runBenchmark(
            int bytes,
            List<Integer> chunkSizes,
            HashAlgorithm algorithm,
            int iterations,
            long seed
    ) {
        byte[] data = new byte[bytes];
        new Random(seed).nextBytes(data);

        // One untimed pass so class loading and JIT warm-up stay out of the numbers.
        new TreeBuilder(algorithm, chunkSizes.get(0)).build(data);

        List<Sample> all = new ArrayList<>();
        System.out.println("algorithm,chunk_size,bytes,leaves,height,millis,mb_per_s");

        for (int chunkSize : chunkSizes) {
            TreeBuilder builder = new TreeBuilder(algorithm, chunkSize);
            List<Double> times = new ArrayList<>(iterations);

            for (int i = 0; i < iterations; i++) {
                long start = System.nanoTime();
                MerkleTree tree = builder.build(data);
                double millis = (System.nanoTime() - start) / 1_000_000.0;

                var s = new Sample(chunkSize, tree.leafCount(), tree.height(), millis);
                all.add(s);
                times.add(millis);
                System.out.println(csvRow(algorithm.algorithmName(), s, bytes));
            }

            Collections.sort(times);
            double median = times.get(times.size() / 2);
            System.err.printf(Locale.ROOT, "%s chunk=%d leaves=%d median=%.2fms throughput=%.2f MB/s%n",
                    algorithm.algorithmName(), chunkSize, all.get(all.size() - 1).leaves, median, mbPerSecond(bytes, median));
        }
    }

    /** One CSV row; always '.' as decimal separator so the column count is fixed. */
    static String csvRow(String algorithm, Sample s, int bytes) {
        return String.format(Locale.ROOT, "%s,%d,%d,%d,%d,%.3f,%.2f",
                algorithm, s.chunkSize, bytes, s.leaves, s.height, s.millis, mbPerSecond(bytes, s.millis));
    }

    private static double mbPerSecond(int bytes, double millis) {
        if (millis <= 0) return Double.NaN;
        return (bytes / (1024.0 * 1024.0)) / (millis / 1000.0);
    }
}
