package com.repo.timeline.git;

import com.repo.timeline.core.ChangeAction;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Reads commit history by shelling out to the git command line.
 * Each commit is parsed from `git log --name-status` and handed over as soon
 * as its file list is complete, so history is never held in memory.
 * <p>
 * Renames are reported as a delete plus an add. Merge commits are compared
 * against the empty tree, so every file they contain shows up as added and
 * the changeset limit decides whether they are kept.
 */
public class GitLogSource implements CommitSource {

    static final String HEADER_PREFIX = "###";

    // ###committer timestamp###hash###parent hashes###author name
    private static final List<String> LOG_COMMAND = List.of(
            "git", "-c", "core.quotepath=off", "log", "HEAD",
            "--no-renames", "--no-color", "--name-status",
            "--format=format:" + HEADER_PREFIX + "%ct" + HEADER_PREFIX + "%H"
                    + HEADER_PREFIX + "%P" + HEADER_PREFIX + "%an");

    /**
     * Lists every file in a commit's tree.
     */
    @FunctionalInterface
    interface TreeLister {
        List<String> listFiles(String commit) throws IOException;
    }

    private final Path repositoryPath;
    private final String name;
    private final String repositoryId;

    public GitLogSource(Path repositoryPath, String repositoryId) {
        this.repositoryPath = repositoryPath;
        Path fileName = repositoryPath.toAbsolutePath().normalize().getFileName();
        this.name = fileName != null ? fileName.toString() : repositoryPath.toString();
        this.repositoryId = repositoryId;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String repositoryId() {
        return repositoryId;
    }

    public Path repositoryPath() {
        return repositoryPath;
    }

    /**
     * Check whether this repository can produce a history.
     *
     * @return the reason to skip it, or empty when it is usable
     */
    public Optional<String> findProblem() {
        try {
            GitResult bare = runGit("rev-parse", "--is-bare-repository");
            if (bare.exitCode() != 0) {
                return Optional.of("not a git repository (" + bare.output().trim() + ")");
            }
            if ("true".equals(bare.output().trim())) {
                return Optional.of("bare repository");
            }
            if (runGit("rev-parse", "--verify", "--quiet", "HEAD").exitCode() != 0) {
                return Optional.of("repository has no HEAD commit (empty repository?)");
            }
            if (runGit("symbolic-ref", "--quiet", "HEAD").exitCode() != 0) {
                return Optional.of("detached HEAD");
            }
            return Optional.empty();
        } catch (IOException e) {
            return Optional.of("failed to run git: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.of("interrupted while inspecting repository");
        }
    }

    @Override
    public void readCommits(CommitHandler handler) throws IOException {
        Process process = start(LOG_COMMAND);
        try {
            CompletableFuture<String> errors = drainErrors(process);
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                parse(reader, name, this::listFiles, handler);
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new RepositoryAccessException(name,
                        "git log exited with status " + exitCode + ": " + awaitErrors(errors));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryAccessException(name, "interrupted while reading history", e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    /**
     * All paths in the tree of a commit, via `git ls-tree -r -z`. NUL
     * separated output is never quoted.
     */
    List<String> listFiles(String commit) throws IOException {
        Process process = start(List.of("git", "ls-tree", "-r", "-z", "--name-only", commit));
        try {
            CompletableFuture<String> errors = drainErrors(process);
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new RepositoryAccessException(name,
                        "git ls-tree " + commit + " exited with status " + exitCode + ": " + awaitErrors(errors));
            }
            List<String> files = new ArrayList<>();
            for (String path : output.split("\0")) {
                if (!path.isEmpty()) {
                    files.add(path);
                }
            }
            return files;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryAccessException(name, "interrupted while listing " + commit, e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private Process start(List<String> command) throws RepositoryAccessException {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(repositoryPath.toFile());
        try {
            return builder.start();
        } catch (IOException e) {
            throw new RepositoryAccessException(name, "failed to start git: " + e.getMessage(), e);
        }
    }

    /**
     * Read stderr while stdout is being consumed, so a chatty git cannot
     * block on a full pipe.
     */
    private static CompletableFuture<String> drainErrors(Process process) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = process.getErrorStream()) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private String awaitErrors(CompletableFuture<String> errors) throws InterruptedException {
        try {
            return errors.get();
        } catch (ExecutionException e) {
            return "(stderr unreadable: " + e.getCause().getMessage() + ")";
        }
    }

    /**
     * Parse `git log --name-status` output produced with the header format
     * above, delivering each commit once its file list has been read.
     * Commits with more than one parent get their full tree from {@code trees}
     * with every file marked as added.
     *
     * @return number of commits delivered
     */
    static int parse(BufferedReader reader, String repositoryName, TreeLister trees, CommitHandler handler)
            throws IOException {
        int commits = 0;
        String author = null;
        long timestamp = 0;
        String mergeCommit = null;
        List<FileChange> changes = new ArrayList<>();

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank())
                continue;

            if (line.startsWith(HEADER_PREFIX)) {
                // Deliver previous commit
                if (author != null) {
                    handler.onCommit(finish(author, timestamp, mergeCommit, changes, trees));
                    commits++;
                    changes = new ArrayList<>();
                }
                // timestamp, hash, parents, author; the author may itself contain ###
                String[] fields = line.substring(HEADER_PREFIX.length()).split(HEADER_PREFIX, 4);
                if (fields.length != 4) {
                    throw new RepositoryAccessException(repositoryName,
                            "malformed commit header at line " + lineNumber + ": " + line);
                }
                try {
                    timestamp = Long.parseLong(fields[0]);
                } catch (NumberFormatException e) {
                    throw new RepositoryAccessException(repositoryName,
                            "malformed commit timestamp at line " + lineNumber + ": " + line, e);
                }
                String parents = fields[2].trim();
                mergeCommit = parents.indexOf(' ') > 0 ? fields[1] : null;
                author = fields[3];
            } else {
                if (author == null) {
                    throw new RepositoryAccessException(repositoryName,
                            "file status before any commit header at line " + lineNumber);
                }
                changes.addAll(parseStatusLine(line));
            }
        }

        if (author != null) {
            handler.onCommit(finish(author, timestamp, mergeCommit, changes, trees));
            commits++;
        }
        return commits;
    }

    private static CommitRecord finish(String author, long timestamp, String mergeCommit,
            List<FileChange> changes, TreeLister trees) throws IOException {
        if (mergeCommit == null) {
            return new CommitRecord(author, timestamp, changes);
        }
        List<FileChange> added = new ArrayList<>();
        for (String path : trees.listFiles(mergeCommit)) {
            added.add(new FileChange(ChangeAction.ADDED, path));
        }
        return new CommitRecord(author, timestamp, added);
    }

    /**
     * "M\tpath", "A\tpath", "D\tpath". Should a rename or copy slip through,
     * "R087\told\tnew" becomes a delete plus an add and "C100\tsource\tcopy"
     * an add of the copy.
     */
    static List<FileChange> parseStatusLine(String line) {
        String[] parts = line.split("\t");
        if (parts.length < 2 || parts[0].isEmpty()) {
            return List.of();
        }
        char status = parts[0].charAt(0);
        if ((status == 'R' || status == 'C') && parts.length >= 3) {
            FileChange copy = new FileChange(ChangeAction.ADDED, unquote(parts[2]));
            if (status == 'C') {
                return List.of(copy);
            }
            return List.of(new FileChange(ChangeAction.DELETED, unquote(parts[1])), copy);
        }
        String path = unquote(parts[parts.length - 1]);
        return ChangeAction.fromGitStatus(parts[0])
                .map(action -> List.of(new FileChange(action, path)))
                .orElse(List.of());
    }

    /**
     * git wraps paths with control characters, quotes or backslashes in
     * C-style quotes even with core.quotepath off.
     */
    static String unquote(String path) {
        if (path.length() < 2 || path.charAt(0) != '"' || path.charAt(path.length() - 1) != '"') {
            return path;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        String body = path.substring(1, path.length() - 1);
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                bytes.writeBytes(String.valueOf(c).getBytes(StandardCharsets.UTF_8));
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> bytes.write('\n');
                case 't' -> bytes.write('\t');
                case 'r' -> bytes.write('\r');
                case 'a' -> bytes.write(7);
                case 'b' -> bytes.write('\b');
                case 'f' -> bytes.write('\f');
                case 'v' -> bytes.write(11);
                case '"' -> bytes.write('"');
                case '\\' -> bytes.write('\\');
                default -> {
                    // three-digit octal byte
                    if (i + 2 < body.length() && isOctal(body, i)) {
                        bytes.write(Integer.parseInt(body.substring(i, i + 3), 8));
                        i += 2;
                    } else {
                        bytes.write('\\');
                        bytes.writeBytes(String.valueOf(next).getBytes(StandardCharsets.UTF_8));
                    }
                }
            }
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static boolean isOctal(String s, int from) {
        for (int i = from; i < from + 3; i++) {
            if (s.charAt(i) < '0' || s.charAt(i) > '7') {
                return false;
            }
        }
        return true;
    }

    private record GitResult(int exitCode, String output) {
    }

    private GitResult runGit(String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(repositoryPath.toFile());
        builder.redirectErrorStream(true);

        Process process = builder.start();
        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return new GitResult(process.waitFor(), output);
    }
}
