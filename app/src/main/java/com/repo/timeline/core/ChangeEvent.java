package com.repo.timeline.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single file change by one author at one point in time.
 * This is the unit that gets sorted, spilled and written to the log.
 */
public record ChangeEvent(
        /** Commit time, seconds since the epoch */
        @JsonProperty("t") long timestamp,

        /** Display identity after pipe escaping and alias substitution */
        @JsonProperty("u") String author,

        /** Repository directory relative to the scan root, empty for the root itself */
        @JsonProperty("r") String repositoryId,

        /** File path inside the repository */
        @JsonProperty("p") String path,

        @JsonProperty("a") ChangeAction action) implements Comparable<ChangeEvent> {

    /**
     * Total order: timestamp, then repository, path, action and author so
     * that equal timestamps always come out in the same order.
     */
    public static final Comparator<ChangeEvent> ORDER = Comparator
            .comparingLong(ChangeEvent::timestamp)
            .thenComparing(ChangeEvent::repositoryId)
            .thenComparing(ChangeEvent::path)
            .thenComparing(ChangeEvent::action)
            .thenComparing(ChangeEvent::author);

    // object header + long + enum ref + 3 string refs, rounded
    private static final int FIXED_OVERHEAD = 40;
    // per String instance: header, hash, coder, backing array header
    private static final int STRING_OVERHEAD = 40;

    public ChangeEvent {
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(repositoryId, "repositoryId");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(action, "action");
    }

    /**
     * Path as Gource should see it: prefixed with the repository directory so
     * each repository gets its own subtree.
     */
    public String displayPath() {
        return repositoryId.isEmpty() ? path : repositoryId + "/" + path;
    }

    /**
     * Rough heap footprint of this event, used as the chunk size hint.
     * Assumes compact (one byte per char) strings.
     */
    public long estimatedBytes() {
        return FIXED_OVERHEAD
                + 3L * STRING_OVERHEAD
                + author.length()
                + repositoryId.length()
                + path.length();
    }

    @Override
    public int compareTo(ChangeEvent other) {
        return ORDER.compare(this, other);
    }
}
