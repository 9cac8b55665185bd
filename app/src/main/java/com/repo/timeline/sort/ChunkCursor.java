package com.repo.timeline.sort;

import com.fasterxml.jackson.databind.MappingIterator;
import com.repo.timeline.core.ChangeEvent;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Lazy read position in one sorted chunk. Holds exactly one decoded event,
 * the head, at a time.
 */
public final class ChunkCursor implements Closeable {

    private final Path file;
    private final int index;
    private final MappingIterator<ChangeEvent> events;
    private ChangeEvent head;

    ChunkCursor(Path file, int index, MappingIterator<ChangeEvent> events) {
        this.file = file;
        this.index = index;
        this.events = events;
    }

    /**
     * Move to the next event.
     *
     * @return false once the chunk is exhausted
     */
    public boolean advance() throws IOException {
        try {
            if (events.hasNextValue()) {
                head = events.nextValue();
                return true;
            }
            head = null;
            return false;
        } catch (IOException e) {
            throw new ChunkEncodingException(file, "corrupt record", e);
        }
    }

    public ChangeEvent head() {
        return head;
    }

    public int index() {
        return index;
    }

    public Path file() {
        return file;
    }

    @Override
    public void close() throws IOException {
        events.close();
    }
}
