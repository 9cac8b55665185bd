package com.repo.timeline.git;

import com.repo.timeline.core.ConfigurationException;
import com.repo.timeline.core.RepositoryFilter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the git repositories to scan below a root directory.
 * A directory holding a ".git" entry (directory or worktree file) is a
 * repository and is never descended into.
 */
public class RepositoryDiscovery {

    private static final String GIT_DIR = ".git";

    private final RepositoryFilter filter;
    private final PrintStream console;

    public RepositoryDiscovery(RepositoryFilter filter, PrintStream console) {
        this.filter = filter;
        this.console = console;
    }

    public static boolean isRepository(Path directory) {
        return Files.exists(directory.resolve(GIT_DIR));
    }

    /**
     * Locate repository directories.
     *
     * @param root      scan root, must exist
     * @param recursive when false the root itself must be a repository
     * @return repository directories sorted by path
     * @throws ConfigurationException if the root is missing or holds no repository
     */
    public List<Path> discover(Path root, boolean recursive) {
        if (!Files.isDirectory(root)) {
            throw new ConfigurationException("Path does not exist or is not a directory: " + root);
        }

        List<Path> repositories = new ArrayList<>();
        if (!recursive) {
            if (!isRepository(root)) {
                throw new ConfigurationException(
                        "Not a git repository: " + root + " (use --recursive to scan for repositories)");
            }
            if (filter.accepts(nameOf(root))) {
                repositories.add(root);
            }
        } else {
            walk(root, repositories);
        }

        if (repositories.isEmpty()) {
            throw new ConfigurationException("No git repositories found under " + root);
        }
        repositories.sort(Comparator.naturalOrder());
        return repositories;
    }

    private void walk(Path directory, List<Path> repositories) {
        if (isRepository(directory)) {
            if (filter.accepts(nameOf(directory))) {
                repositories.add(directory);
            }
            return;
        }

        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, Files::isDirectory)) {
            for (Path child : stream) {
                children.add(child);
            }
        } catch (IOException e) {
            console.println("Warning: Could not read directory " + directory + ": " + e.getMessage());
            return;
        }
        for (Path child : children) {
            if (!Files.isSymbolicLink(child)) {
                walk(child, repositories);
            }
        }
    }

    /**
     * Turn discovered directories into commit sources, dropping repositories
     * that cannot produce a history (bare, empty, detached HEAD).
     */
    public List<GitLogSource> toSources(Path root, List<Path> repositories) {
        List<GitLogSource> sources = new ArrayList<>();
        for (Path repository : repositories) {
            GitLogSource source = new GitLogSource(repository, repositoryId(root, repository));
            Optional<String> problem = source.findProblem();
            if (problem.isPresent()) {
                console.println("Warning: Skipping " + repository + ": " + problem.get());
                continue;
            }
            sources.add(source);
        }
        if (sources.isEmpty()) {
            throw new ConfigurationException("None of the discovered repositories can be read");
        }
        return sources;
    }

    /**
     * Repository location relative to the root with '/' separators, "" when
     * the repository is the root.
     */
    public static String repositoryId(Path root, Path repository) {
        Path relative = root.toAbsolutePath().normalize().relativize(repository.toAbsolutePath().normalize());
        if (relative.toString().isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        relative.forEach(part -> parts.add(part.toString()));
        return String.join("/", parts);
    }

    private static String nameOf(Path directory) {
        Path name = directory.toAbsolutePath().normalize().getFileName();
        return name != null ? name.toString() : directory.toString();
    }
}
