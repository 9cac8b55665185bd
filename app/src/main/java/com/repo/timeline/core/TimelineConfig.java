package com.repo.timeline.core;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Settings for one timeline run.
 * Loaded from timeline.yaml in the scan root (or an explicit file) and then
 * overridden by command line options.
 */
public class TimelineConfig {

    public static final String CONFIG_FILE_NAME = "timeline.yaml";

    public static final long MIN_CHUNK_SIZE_MB = 64;
    public static final long DEFAULT_CHUNK_SIZE_MB = 4096;
    // largest value whose byte count still fits in a long
    public static final long MAX_CHUNK_SIZE_MB = Long.MAX_VALUE >> 20;
    public static final int DEFAULT_MERGE_FAN_IN = 128;

    // Scan settings
    private Path root;
    private boolean recursive = false;
    private List<String> include = new ArrayList<>();
    private List<String> exclude = new ArrayList<>();

    // Normalization
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private Integer maxChangesetSize = null;

    // Sorting
    private boolean useMergeSort = false;
    private Long sortChunkSizeMb = null;
    private Path tempLocation = null;
    private int mergeFanIn = DEFAULT_MERGE_FAN_IN;

    // Execution
    private int threads = Runtime.getRuntime().availableProcessors();
    private Path output = null;
    private boolean quiet = false;

    /**
     * Load configuration from timeline.yaml in the given directory, or return
     * defaults when there is none.
     */
    public static TimelineConfig loadFrom(Path directory) {
        Path configFile = directory.resolve(CONFIG_FILE_NAME);
        if (Files.isRegularFile(configFile)) {
            return load(configFile);
        }
        return new TimelineConfig();
    }

    /**
     * Load configuration from an explicit YAML file.
     *
     * @throws ConfigurationException if the file is missing or malformed
     */
    public static TimelineConfig load(Path configFile) {
        TimelineConfig config = new TimelineConfig();
        try (InputStream is = Files.newInputStream(configFile)) {
            Yaml yaml = new Yaml();
            Object data = yaml.load(is);
            if (data instanceof Map<?, ?> map) {
                config.parseYaml(map);
            } else if (data != null) {
                throw new ConfigurationException("Expected a mapping at the top of " + configFile);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Could not read config file " + configFile + ": " + e.getMessage(), e);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Malformed config file " + configFile + ": " + e.getMessage(), e);
        }
        return config;
    }

    public static TimelineConfig defaults() {
        return new TimelineConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<?, ?> data) {
        if (data.containsKey("aliases")) {
            Map<Object, Object> map = (Map<Object, Object>) data.get("aliases");
            if (map != null) {
                map.forEach((raw, display) -> aliases.put(String.valueOf(raw), String.valueOf(display)));
            }
        }

        if (data.containsKey("filter")) {
            Map<String, Object> filter = (Map<String, Object>) data.get("filter");
            if (filter != null) {
                Object max = filter.get("max_changeset_size");
                if (max instanceof Number n) {
                    maxChangesetSize = n.intValue();
                }
                include = getStringList(filter, "include", include);
                exclude = getStringList(filter, "exclude", exclude);
            }
        }

        if (data.containsKey("sort")) {
            Map<String, Object> sort = (Map<String, Object>) data.get("sort");
            if (sort != null) {
                useMergeSort = getBool(sort, "use_merge_sort", useMergeSort);
                Object chunk = sort.get("chunk_size_mb");
                if (chunk instanceof Number n) {
                    sortChunkSizeMb = n.longValue();
                }
                Object temp = sort.get("temp_location");
                if (temp != null) {
                    tempLocation = Path.of(String.valueOf(temp));
                }
                mergeFanIn = getInt(sort, "merge_fan_in", mergeFanIn);
            }
        }

        threads = getInt((Map<String, Object>) data, "threads", threads);
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultVal) {
        Object val = map.get(key);
        if (val instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                result.add(String.valueOf(item));
            }
            return result;
        }
        return defaultVal;
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private boolean getBool(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    /**
     * Check every rule that can be checked without touching a repository.
     *
     * @throws ConfigurationException on the first violated rule
     */
    public TimelineConfig validate() {
        if (!include.isEmpty() && !exclude.isEmpty()) {
            throw new ConfigurationException("--include and --exclude cannot be used together");
        }
        if (root == null) {
            throw new ConfigurationException("--path is required");
        }
        if ((!include.isEmpty() || !exclude.isEmpty()) && !recursive) {
            throw new ConfigurationException("--include and --exclude can only be used with --recursive");
        }
        if (!useMergeSort && (sortChunkSizeMb != null || tempLocation != null)) {
            throw new ConfigurationException(
                    "--sort-chunk-size and --temp-file-location require --use-merge-sort");
        }
        if (getSortChunkSizeMb() < MIN_CHUNK_SIZE_MB) {
            throw new ConfigurationException(
                    "Chunk size must be at least " + MIN_CHUNK_SIZE_MB + " MB, got " + getSortChunkSizeMb());
        }
        if (getSortChunkSizeMb() > MAX_CHUNK_SIZE_MB) {
            throw new ConfigurationException(
                    "Chunk size must be at most " + MAX_CHUNK_SIZE_MB + " MB, got " + getSortChunkSizeMb());
        }
        if (tempLocation != null) {
            Path parent = tempLocation.toAbsolutePath().normalize().getParent();
            if (parent == null) {
                throw new ConfigurationException("Refusing to use the filesystem root as temporary directory");
            }
            if (!Files.isDirectory(parent)) {
                throw new ConfigurationException("Parent of the temporary directory does not exist: " + parent);
            }
        }
        if (maxChangesetSize != null && maxChangesetSize < 0) {
            throw new ConfigurationException("--max-changeset-size must not be negative");
        }
        if (mergeFanIn < 2) {
            throw new ConfigurationException("merge_fan_in must be at least 2");
        }
        if (threads < 1) {
            throw new ConfigurationException("threads must be at least 1");
        }
        // parses and rejects malformed entries
        aliasTable();
        repositoryFilter();
        return this;
    }

    // === Getters ===

    public Path getRoot() {
        return root;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public List<String> getInclude() {
        return Collections.unmodifiableList(include);
    }

    public List<String> getExclude() {
        return Collections.unmodifiableList(exclude);
    }

    public RepositoryFilter repositoryFilter() {
        return RepositoryFilter.of(include, exclude);
    }

    public Map<String, String> getAliases() {
        return Collections.unmodifiableMap(aliases);
    }

    public AliasTable aliasTable() {
        for (Map.Entry<String, String> entry : aliases.entrySet()) {
            if (entry.getKey().isEmpty() || entry.getValue().isEmpty()) {
                throw new ConfigurationException("Alias entries must not be empty: " + entry);
            }
        }
        return AliasTable.of(aliases);
    }

    public OptionalInt getMaxChangesetSize() {
        return maxChangesetSize == null ? OptionalInt.empty() : OptionalInt.of(maxChangesetSize);
    }

    public boolean isUseMergeSort() {
        return useMergeSort;
    }

    public long getSortChunkSizeMb() {
        return sortChunkSizeMb == null ? DEFAULT_CHUNK_SIZE_MB : sortChunkSizeMb;
    }

    public long getSortChunkSizeBytes() {
        return getSortChunkSizeMb() * 1024 * 1024;
    }

    public Optional<Path> getTempLocation() {
        return Optional.ofNullable(tempLocation);
    }

    public int getMergeFanIn() {
        return mergeFanIn;
    }

    public int getThreads() {
        return threads;
    }

    public Optional<Path> getOutput() {
        return Optional.ofNullable(output);
    }

    public boolean isQuiet() {
        return quiet;
    }

    // === Overrides from the command line ===

    public TimelineConfig withRoot(Path root) {
        this.root = root;
        return this;
    }

    public TimelineConfig withRecursive(boolean recursive) {
        this.recursive = recursive;
        return this;
    }

    public TimelineConfig withInclude(List<String> names) {
        this.include = new ArrayList<>(names);
        return this;
    }

    public TimelineConfig withExclude(List<String> names) {
        this.exclude = new ArrayList<>(names);
        return this;
    }

    /**
     * Add one "RAW::DISPLAY" alias, replacing any alias for the same name.
     */
    public TimelineConfig withAlias(String entry) {
        String[] pair = AliasTable.parseAlias(entry);
        aliases.put(pair[0], pair[1]);
        return this;
    }

    public TimelineConfig withMaxChangesetSize(int maxChangesetSize) {
        this.maxChangesetSize = maxChangesetSize;
        return this;
    }

    public TimelineConfig withUseMergeSort(boolean useMergeSort) {
        this.useMergeSort = useMergeSort;
        return this;
    }

    public TimelineConfig withSortChunkSizeMb(long sortChunkSizeMb) {
        this.sortChunkSizeMb = sortChunkSizeMb;
        return this;
    }

    public TimelineConfig withTempLocation(Path tempLocation) {
        this.tempLocation = tempLocation;
        return this;
    }

    public TimelineConfig withMergeFanIn(int mergeFanIn) {
        this.mergeFanIn = mergeFanIn;
        return this;
    }

    public TimelineConfig withThreads(int threads) {
        this.threads = threads;
        return this;
    }

    public TimelineConfig withOutput(Path output) {
        this.output = output;
        return this;
    }

    public TimelineConfig withQuiet(boolean quiet) {
        this.quiet = quiet;
        return this;
    }
}
