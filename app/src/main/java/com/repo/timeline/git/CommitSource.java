package com.repo.timeline.git;

import java.io.IOException;

/**
 * A single repository that can replay its commits.
 * The pipeline only depends on this interface, never on a concrete backend.
 */
public interface CommitSource {

    /**
     * Callback receiving commits one at a time.
     */
    @FunctionalInterface
    interface CommitHandler {
        void onCommit(CommitRecord commit) throws IOException;
    }

    /**
     * Directory name of the repository, used by include/exclude filters.
     */
    String name();

    /**
     * Repository location relative to the scan root ("" for the root itself).
     * Becomes the path prefix of every event from this repository.
     */
    String repositoryId();

    /**
     * Stream every commit to the handler, sequentially and in repository order.
     *
     * @throws RepositoryAccessException if the repository cannot be read; commits
     *                                   already delivered stay delivered
     * @throws IOException               anything the handler throws is propagated unchanged
     */
    void readCommits(CommitHandler handler) throws IOException;
}
