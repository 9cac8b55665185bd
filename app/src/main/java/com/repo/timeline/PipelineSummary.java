package com.repo.timeline;

import java.util.List;

/**
 * Counters reported at the end of a run.
 */
public record PipelineSummary(
        /** Repositories whose history was read completely */
        int repositoriesScanned,

        /** Repositories skipped or cut short by an access error */
        List<String> repositoriesFailed,

        /** Commits read across all repositories */
        long commitsRead,

        /** Commits dropped by the changeset size filter */
        long commitsFiltered,

        /** Events written to the log */
        long eventsWritten,

        /** Chunk files spilled by the accumulator, 0 for an in-memory sort */
        int chunksSpilled,

        /** Extra merge passes needed because of the fan-in limit */
        int intermediateMergePasses) {
}
