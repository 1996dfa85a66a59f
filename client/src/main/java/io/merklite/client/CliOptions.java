package io.merklite.client;

import io.merklite.client.config.TreeConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 *
 * Options come before the command:
 *   --chunk-size, -c  <bytes>
 *   --algorithm,  -a  <name>
 *   --config          <path to JSON file>
 *   --json
 *   --verbose,    -v
 *   --help,       -h
 *
 * Everything after the first non-option token is the command and its arguments.
 * A lone "-" is an argument (stdin), not an option.
 */
record CliOptions(
        Integer chunkSize,
        String algorithm,
        Path configPath,
        boolean json,
        boolean verbose,
        boolean help,
        String command,
        List<String> arguments
) {

    static CliOptions fromArgs(String[] args) {
        Integer chunkSize = null;
        String algorithm = null;
        Path configPath = null;
        boolean json = false;
        boolean verbose = false;
        boolean help = false;

        int i = 0;
        for (; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("-") || a.equals("-")) break;

            switch (a) {
                case "--help", "-h" -> help = true;

                case "--json" -> json = true;

                case "--verbose", "-v" -> verbose = true;

                case "--chunk-size", "-c" -> {
                    String v = value(args, i++);
                    try {
                        chunkSize = Integer.parseInt(v);
                    } catch (NumberFormatException e) {
                        throw new CliException("Invalid chunk-size: " + v);
                    }
                }

                case "--algorithm", "-a" -> algorithm = value(args, i++);

                case "--config" -> configPath = Path.of(value(args, i++));

                default -> throw new CliException("Unknown option: " + a);
            }
        }

        String command = i < args.length ? args[i++] : null;
        List<String> rest = new ArrayList<>();
        for (; i < args.length; i++) rest.add(args[i]);

        return new CliOptions(chunkSize, algorithm, configPath, json, verbose, help, command, List.copyOf(rest));
    }

    /** Defaults, then the config file, then flags. */
    TreeConfig treeConfig() {
        TreeConfig base = configPath != null ? TreeConfig.fromJsonFile(configPath) : TreeConfig.defaults();
        return base.withOverrides(chunkSize, algorithm);
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }
}
