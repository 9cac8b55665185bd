package com.repo.timeline;

import com.repo.timeline.core.ConfigurationException;
import com.repo.timeline.core.TimelineConfig;
import com.repo.timeline.git.GitLogSource;
import com.repo.timeline.git.RepositoryDiscovery;
import com.repo.timeline.output.GourceLogWriter;
import com.repo.timeline.output.OutputException;
import com.repo.timeline.sort.ChunkEncodingException;
import com.repo.timeline.sort.TempStorageException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Gource Timeline - turns the history of one or many git repositories into a
 * single Gource custom log.
 *
 * Usage: java -jar app.jar --path <dir> [--recursive] [--output <file>] ...
 */
public class TimelineApp {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIGURATION = 2;

    public static void main(String[] args) {
        System.exit(execute(args, System.err));
    }

    private static void printUsage(PrintStream console) {
        console.println("""
                Usage: java -jar app.jar --path <dir> [options]

                Converts git logs into a format that can be used by Gource.
                Log lines go to standard output unless --output is given.

                Arguments:
                  -p, --path <dir>              Path to the git repository/repositories (required)
                  -r, --recursive               Search <dir> recursively for repositories
                  -i, --include <name>          With --recursive, only process these repositories (repeatable)
                  -e, --exclude <name>          With --recursive, skip these repositories (repeatable)
                  -o, --output <file>           Output file (default: standard output)
                  -a, --alias <USER>::<NAME>    Show git user USER as NAME (repeatable). Pipes in user
                                                names become '#', so alias 'Some|User' as 'Some#User::Name'
                  -m, --use-merge-sort          Sort on disk, needed for very large histories
                      --sort-chunk-size <MB>    Memory hint per sorted chunk (min: 64, default: 4096)
                  -t, --temp-file-location <d>  Directory for merge sort files (default: random
                                                directory in the working directory)
                  -z, --max-changeset-size <n>  Skip commits touching more than n files (merges, tags, CI)
                  -c, --config <file>           YAML settings (default: <dir>/timeline.yaml if present)
                  -q, --quiet                   Only print warnings and errors
                  -h, --help                    Show this help

                WARNING: with --use-merge-sort you need free disk space of about 3x the size of the
                final log. Chunks and the merged output exist at the same time. If the program is
                interrupted, delete the temporary directory by hand.
                """);
    }

    record CliArgs(
            String path,
            boolean recursive,
            List<String> include,
            List<String> exclude,
            String output,
            List<String> aliases,
            boolean useMergeSort,
            Long sortChunkSizeMb,
            String tempFileLocation,
            Integer maxChangesetSize,
            String configFile,
            boolean quiet,
            boolean help) {
    }

    static CliArgs parseArgs(String[] args) {
        String path = null;
        boolean recursive = false;
        List<String> include = new ArrayList<>();
        List<String> exclude = new ArrayList<>();
        String output = null;
        List<String> aliases = new ArrayList<>();
        boolean useMergeSort = false;
        Long sortChunkSizeMb = null;
        String tempFileLocation = null;
        Integer maxChangesetSize = null;
        String configFile = null;
        boolean quiet = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-p", "--path" -> path = requireValue(args, ++i, arg);
                case "-r", "--recursive" -> recursive = true;
                case "-i", "--include" -> include.add(requireValue(args, ++i, arg));
                case "-e", "--exclude" -> exclude.add(requireValue(args, ++i, arg));
                case "-o", "--output" -> output = requireValue(args, ++i, arg);
                case "-a", "--alias" -> aliases.add(requireValue(args, ++i, arg));
                case "-m", "--use-merge-sort" -> useMergeSort = true;
                case "--sort-chunk-size" -> sortChunkSizeMb = parseNumber(requireValue(args, ++i, arg), arg);
                case "-t", "--temp-file-location" -> tempFileLocation = requireValue(args, ++i, arg);
                case "-z", "--max-changeset-size" ->
                        maxChangesetSize = (int) Math.min(Integer.MAX_VALUE,
                                parseNumber(requireValue(args, ++i, arg), arg));
                case "-c", "--config" -> configFile = requireValue(args, ++i, arg);
                case "-q", "--quiet" -> quiet = true;
                case "-h", "--help" -> help = true;
                default -> throw new ConfigurationException("Unknown argument: " + arg);
            }
        }

        return new CliArgs(path, recursive, include, exclude, output, aliases, useMergeSort,
                sortChunkSizeMb, tempFileLocation, maxChangesetSize, configFile, quiet, help);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new ConfigurationException("Missing value for " + option);
        }
        return args[index];
    }

    private static long parseNumber(String value, String option) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected a number for " + option + ", got '" + value + "'", e);
        }
    }

    /**
     * Expand a leading ~ to the user's home directory.
     */
    static Path expandHome(String path) {
        if (path.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), path.substring(2));
        }
        return Path.of(path);
    }

    /**
     * Merge the YAML settings with the command line; the command line wins.
     */
    static TimelineConfig buildConfig(CliArgs args) {
        Path root = args.path() != null ? expandHome(args.path()).toAbsolutePath().normalize() : null;

        TimelineConfig config;
        if (args.configFile() != null) {
            config = TimelineConfig.load(expandHome(args.configFile()));
        } else if (root != null) {
            config = TimelineConfig.loadFrom(root);
        } else {
            config = TimelineConfig.defaults();
        }

        config.withRoot(root)
                .withQuiet(args.quiet());
        if (args.recursive()) {
            config.withRecursive(true);
        }
        if (!args.include().isEmpty()) {
            config.withInclude(args.include());
        }
        if (!args.exclude().isEmpty()) {
            config.withExclude(args.exclude());
        }
        if (args.output() != null) {
            config.withOutput(expandHome(args.output()));
        }
        for (String alias : args.aliases()) {
            config.withAlias(alias);
        }
        if (args.useMergeSort()) {
            config.withUseMergeSort(true);
        }
        if (args.sortChunkSizeMb() != null) {
            config.withSortChunkSizeMb(args.sortChunkSizeMb());
        }
        if (args.tempFileLocation() != null) {
            config.withTempLocation(expandHome(args.tempFileLocation()));
        }
        if (args.maxChangesetSize() != null) {
            config.withMaxChangesetSize(args.maxChangesetSize());
        }
        return config.validate();
    }

    /**
     * Run the tool and return the process exit code.
     */
    static int execute(String[] args, PrintStream console) {
        try {
            CliArgs cliArgs = parseArgs(args);
            if (cliArgs.help()) {
                printUsage(console);
                return EXIT_OK;
            }

            // Everything that can be rejected is rejected before any repository is touched
            TimelineConfig config = buildConfig(cliArgs);
            RepositoryDiscovery discovery = new RepositoryDiscovery(config.repositoryFilter(), console);
            List<Path> repositories = discovery.discover(config.getRoot(), config.isRecursive());
            List<GitLogSource> sources = discovery.toSources(config.getRoot(), repositories);

            try (GourceLogWriter writer = config.getOutput().isPresent()
                    ? GourceLogWriter.toFile(config.getOutput().get())
                    : GourceLogWriter.toStdout()) {
                PipelineSummary summary = new TimelinePipeline(config, console).run(sources, writer);
                if (!config.isQuiet()) {
                    printSummary(summary, config, console);
                }
            }
            return EXIT_OK;

        } catch (ConfigurationException e) {
            console.println("Error: " + e.getMessage());
            console.println("Try --help for more information");
            return EXIT_CONFIGURATION;
        } catch (ChunkEncodingException e) {
            console.println("Error during merge sort, chunk data is corrupt: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (TempStorageException e) {
            console.println("Error during merge sort, temporary storage failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (OutputException e) {
            console.println("Error writing output: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            console.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            console.println("Error: " + e);
            e.printStackTrace(console);
            return EXIT_FAILURE;
        }
    }

    private static void printSummary(PipelineSummary summary, TimelineConfig config, PrintStream console) {
        console.println("\n=== SUMMARY ===");
        console.printf("  %-25s: %d%n", "Repositories", summary.repositoriesScanned());
        if (!summary.repositoriesFailed().isEmpty()) {
            console.printf("  %-25s: %s%n", "Incomplete repositories", String.join(", ", summary.repositoriesFailed()));
        }
        console.printf("  %-25s: %d%n", "Commits", summary.commitsRead());
        if (config.getMaxChangesetSize().isPresent()) {
            console.printf("  %-25s: %d%n", "Filtered commits", summary.commitsFiltered());
        }
        console.printf("  %-25s: %d%n", "Events", summary.eventsWritten());
        if (config.isUseMergeSort()) {
            console.printf("  %-25s: %d (%d extra passes)%n", "Sorted chunks",
                    summary.chunksSpilled(), summary.intermediateMergePasses());
        }
        console.printf("  %-25s: %s%n", "Output",
                config.getOutput().map(Path::toString).orElse("standard output"));
    }
}
