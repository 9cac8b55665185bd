package com.repo.timeline.sort;

import com.repo.timeline.core.ConfigurationException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Temporary storage for one external sort: the directory, the chunk files
 * created in it and the sizing knobs. Closing removes every chunk still on
 * disk and the directory itself when this session created it. An aborted
 * process can leave the directory behind.
 */
public class SortSession implements AutoCloseable {

    private static final String DIRECTORY_PREFIX = "timeline-sort-";
    private static final String CHUNK_PATTERN = "chunk-%05d.cbor";

    private final Path directory;
    private final boolean ownsDirectory;
    private final long chunkBytes;
    private final int fanIn;
    private final PrintStream console;
    private final AtomicInteger sequence = new AtomicInteger();
    private final Set<Path> liveChunks = ConcurrentHashMap.newKeySet();

    private SortSession(Path directory, boolean ownsDirectory, long chunkBytes, int fanIn, PrintStream console) {
        this.directory = directory;
        this.ownsDirectory = ownsDirectory;
        this.chunkBytes = chunkBytes;
        this.fanIn = fanIn;
        this.console = console;
    }

    /**
     * Create the temporary directory.
     *
     * @param location   directory to use; a randomly named one is created in
     *                   the working directory when empty
     * @param chunkBytes in-memory size hint per chunk
     * @param fanIn      maximum number of chunks merged at once
     * @throws ConfigurationException if the requested location has no existing parent
     * @throws TempStorageException   if the directory cannot be created
     */
    public static SortSession create(Optional<Path> location, long chunkBytes, int fanIn, PrintStream console)
            throws TempStorageException {
        if (chunkBytes <= 0) {
            throw new IllegalArgumentException("chunkBytes must be positive");
        }
        if (fanIn < 2) {
            throw new IllegalArgumentException("fanIn must be at least 2");
        }

        if (location.isEmpty()) {
            Path parent = Path.of(".");
            try {
                Path dir = Files.createTempDirectory(parent, DIRECTORY_PREFIX);
                return new SortSession(dir, true, chunkBytes, fanIn, console);
            } catch (IOException e) {
                throw new TempStorageException(parent, "Cannot create temporary directory", e);
            }
        }

        Path dir = location.get().toAbsolutePath().normalize();
        Path parent = dir.getParent();
        if (parent == null) {
            throw new ConfigurationException("Refusing to use the filesystem root as temporary directory");
        }
        if (!Files.isDirectory(parent)) {
            throw new ConfigurationException("Parent of the temporary directory does not exist: " + parent);
        }
        boolean existed = Files.isDirectory(dir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new TempStorageException(dir, "Cannot create temporary directory", e);
        }
        return new SortSession(dir, !existed, chunkBytes, fanIn, console);
    }

    /**
     * Reserve a fresh, uniquely named chunk file. Safe to call from any thread.
     */
    public Path newChunkFile() {
        Path file = directory.resolve(String.format(CHUNK_PATTERN, sequence.getAndIncrement()));
        liveChunks.add(file);
        return file;
    }

    /**
     * Delete a chunk that has been fully merged. A file that cannot be deleted
     * now is retried on close.
     */
    public void discard(Path chunk) {
        try {
            Files.deleteIfExists(chunk);
            liveChunks.remove(chunk);
        } catch (IOException e) {
            console.println("Warning: Could not delete " + chunk + " yet: " + e.getMessage());
        }
    }

    public Path directory() {
        return directory;
    }

    public long chunkBytes() {
        return chunkBytes;
    }

    public int fanIn() {
        return fanIn;
    }

    public int chunksCreated() {
        return sequence.get();
    }

    @Override
    public void close() {
        for (Path chunk : Set.copyOf(liveChunks)) {
            discard(chunk);
        }
        if (!liveChunks.isEmpty()) {
            console.println("Warning: Temporary files remain in " + directory.toAbsolutePath()
                    + ", please remove them manually");
            return;
        }
        if (!ownsDirectory) {
            return;
        }
        try {
            if (isEmpty(directory)) {
                Files.deleteIfExists(directory);
            } else {
                console.println("Warning: Temporary directory " + directory.toAbsolutePath()
                        + " still contains files, not removing");
            }
        } catch (IOException e) {
            console.println("Warning: Could not remove temporary directory " + directory.toAbsolutePath()
                    + ": " + e.getMessage());
        }
    }

    private static boolean isEmpty(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return true;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            return !entries.iterator().hasNext();
        }
    }
}
