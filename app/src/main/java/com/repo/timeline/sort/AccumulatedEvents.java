package com.repo.timeline.sort;

import com.repo.timeline.core.ChangeEvent;

import java.nio.file.Path;
import java.util.List;

/**
 * What the accumulator hands to the merge engine: either everything still in
 * memory (already sorted) or the full list of sorted chunk files.
 */
public record AccumulatedEvents(
        /** Sorted events when nothing was spilled, otherwise empty */
        List<ChangeEvent> inMemory,

        /** Sorted chunk files, empty when everything stayed in memory */
        List<Path> chunks,

        /** Total number of events, across memory and chunks */
        long eventCount) {

    public static AccumulatedEvents inMemory(List<ChangeEvent> sorted) {
        return new AccumulatedEvents(sorted, List.of(), sorted.size());
    }

    public static AccumulatedEvents spilled(List<Path> chunks, long eventCount) {
        return new AccumulatedEvents(List.of(), List.copyOf(chunks), eventCount);
    }

    public boolean isSpilled() {
        return !chunks.isEmpty();
    }
}
