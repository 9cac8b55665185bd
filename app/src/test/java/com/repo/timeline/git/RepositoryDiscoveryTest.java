package com.repo.timeline.git;

import com.repo.timeline.core.ConfigurationException;
import com.repo.timeline.core.RepositoryFilter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryDiscoveryTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream consoleBytes = new ByteArrayOutputStream();
    private final PrintStream console = new PrintStream(consoleBytes, true, StandardCharsets.UTF_8);

    private Path fakeRepository(String relative) throws IOException {
        Path dir = tempDir.resolve(relative);
        Files.createDirectories(dir.resolve(".git"));
        return dir;
    }

    @Test
    void testRecursiveFindsNestedRepositories() throws IOException {
        Path a = fakeRepository("repoA");
        Path b = fakeRepository("group/repoB");
        Files.createDirectories(tempDir.resolve("plain/dir"));

        List<Path> found = new RepositoryDiscovery(RepositoryFilter.all(), console).discover(tempDir, true);

        assertEquals(List.of(b, a), found);
    }

    @Test
    void testRepositoryIsALeaf() throws IOException {
        Path outer = fakeRepository("outer");
        fakeRepository("outer/vendor/inner");

        List<Path> found = new RepositoryDiscovery(RepositoryFilter.all(), console).discover(tempDir, true);

        assertEquals(List.of(outer), found);
    }

    @Test
    void testIncludeFilter() throws IOException {
        Path a = fakeRepository("repoA");
        fakeRepository("repoB");

        List<Path> found = new RepositoryDiscovery(RepositoryFilter.of(List.of("repoA"), List.of()), console)
                .discover(tempDir, true);

        assertEquals(List.of(a), found);
    }

    @Test
    void testExcludeFilter() throws IOException {
        fakeRepository("repoA");
        Path b = fakeRepository("repoB");

        List<Path> found = new RepositoryDiscovery(RepositoryFilter.of(List.of(), List.of("repoA")), console)
                .discover(tempDir, true);

        assertEquals(List.of(b), found);
    }

    @Test
    void testNonRecursiveRequiresRepository() throws IOException {
        fakeRepository("repoA");
        RepositoryDiscovery discovery = new RepositoryDiscovery(RepositoryFilter.all(), console);

        assertThrows(ConfigurationException.class, () -> discovery.discover(tempDir, false));
        assertEquals(List.of(tempDir.resolve("repoA")), discovery.discover(tempDir.resolve("repoA"), false));
    }

    @Test
    void testMissingRootIsConfigurationError() {
        RepositoryDiscovery discovery = new RepositoryDiscovery(RepositoryFilter.all(), console);

        assertThrows(ConfigurationException.class, () -> discovery.discover(tempDir.resolve("missing"), true));
    }

    @Test
    void testNothingFoundIsConfigurationError() throws IOException {
        Files.createDirectories(tempDir.resolve("empty"));
        RepositoryDiscovery discovery = new RepositoryDiscovery(RepositoryFilter.all(), console);

        assertThrows(ConfigurationException.class, () -> discovery.discover(tempDir, true));
    }

    @Test
    void testRepositoryId() {
        assertEquals("", RepositoryDiscovery.repositoryId(tempDir, tempDir));
        assertEquals("repoA", RepositoryDiscovery.repositoryId(tempDir, tempDir.resolve("repoA")));
        assertEquals("group/repoB", RepositoryDiscovery.repositoryId(tempDir, tempDir.resolve("group/repoB")));
    }

    @Test
    void testUnreadableRepositoriesAreSkippedWithWarning() throws IOException {
        // a bare ".git" directory is not a usable repository
        Path broken = fakeRepository("broken");
        RepositoryDiscovery discovery = new RepositoryDiscovery(RepositoryFilter.all(), console);

        assertThrows(ConfigurationException.class, () -> discovery.toSources(tempDir, List.of(broken)));
        assertTrue(consoleBytes.toString(StandardCharsets.UTF_8).contains("Warning: Skipping"));
    }
}
