package com.repo.timeline.sort;

import com.repo.timeline.core.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SortSessionTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreatesAndRemovesOwnDirectory() throws IOException {
        Path location = tempDir.resolve("sort");
        Path chunk;
        try (SortSession session = SortSession.create(Optional.of(location), 1024, 4, SortTestEvents.quietConsole())) {
            assertTrue(Files.isDirectory(location));
            chunk = session.newChunkFile();
            Files.writeString(chunk, "data");
            assertEquals(1, session.chunksCreated());
        }
        assertFalse(Files.exists(chunk));
        assertFalse(Files.exists(location));
    }

    @Test
    void testExistingDirectoryIsKept() throws IOException {
        Path location = Files.createDirectories(tempDir.resolve("existing"));
        Files.writeString(location.resolve("keep.txt"), "mine");

        try (SortSession session = SortSession.create(Optional.of(location), 1024, 4, SortTestEvents.quietConsole())) {
            Files.writeString(session.newChunkFile(), "data");
        }

        assertTrue(Files.exists(location.resolve("keep.txt")));
        try (Stream<Path> files = Files.list(location)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testChunkNamesAreUnique() throws IOException {
        try (SortSession session = SortSession.create(Optional.of(tempDir.resolve("s")), 1024, 4,
                SortTestEvents.quietConsole())) {
            assertNotEquals(session.newChunkFile(), session.newChunkFile());
        }
    }

    @Test
    void testMissingParentIsConfigurationError() {
        Path location = tempDir.resolve("no/such/parent/sort");

        assertThrows(ConfigurationException.class,
                () -> SortSession.create(Optional.of(location), 1024, 4, SortTestEvents.quietConsole()));
    }

    @Test
    void testDiscardDeletesChunk() throws IOException {
        try (SortSession session = SortSession.create(Optional.of(tempDir.resolve("s")), 1024, 4,
                SortTestEvents.quietConsole())) {
            Path chunk = session.newChunkFile();
            Files.writeString(chunk, "data");
            session.discard(chunk);
            assertFalse(Files.exists(chunk));
        }
    }
}
