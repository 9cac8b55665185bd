package com.repo.timeline.git;

import java.util.List;

/**
 * Backend-neutral view of a commit: who, when and which files.
 */
public record CommitRecord(
        /** Raw author name as recorded by the version control system */
        String author,

        /** Commit time (Unix epoch seconds) */
        long timestamp,

        /** Changed files, in the order the backend reported them */
        List<FileChange> changes) {

    public CommitRecord {
        changes = List.copyOf(changes);
    }

    public int changesetSize() {
        return changes.size();
    }
}
