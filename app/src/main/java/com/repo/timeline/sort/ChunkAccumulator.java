package com.repo.timeline.sort;

import com.repo.timeline.core.ChangeEvent;
import com.repo.timeline.normalize.EventSink;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared buffer that every repository worker pushes into.
 * <p>
 * Appending and size accounting happen under a single lock. When the buffer
 * reaches the session's chunk size the full buffer is swapped out under the
 * lock and the pushing thread sorts and spills it after releasing the lock,
 * so other workers keep appending to the fresh buffer meanwhile.
 * Without a session (in-memory mode) nothing is ever spilled.
 */
public class ChunkAccumulator implements EventSink {

    private final Object lock = new Object();
    private final SortSession session;
    private final ChunkCodec codec;
    private final long thresholdBytes;

    // guarded by lock
    private List<ChangeEvent> buffer = new ArrayList<>();
    private long bufferedBytes;
    private long eventCount;
    private final List<Path> chunks = new ArrayList<>();
    private boolean finished;

    private ChunkAccumulator(SortSession session, ChunkCodec codec) {
        this.session = session;
        this.codec = codec;
        this.thresholdBytes = session == null ? Long.MAX_VALUE : session.chunkBytes();
    }

    public static ChunkAccumulator inMemory() {
        return new ChunkAccumulator(null, null);
    }

    public static ChunkAccumulator external(SortSession session, ChunkCodec codec) {
        return new ChunkAccumulator(session, codec);
    }

    @Override
    public void push(ChangeEvent event) throws IOException {
        List<ChangeEvent> full;
        synchronized (lock) {
            if (finished) {
                throw new IllegalStateException("Accumulator already finished");
            }
            buffer.add(event);
            bufferedBytes += event.estimatedBytes();
            eventCount++;
            if (bufferedBytes < thresholdBytes) {
                return;
            }
            full = buffer;
            buffer = new ArrayList<>();
            bufferedBytes = 0;
        }
        Path chunk = spill(full);
        synchronized (lock) {
            chunks.add(chunk);
        }
    }

    /**
     * Close the buffer. Returns the sorted in-memory events if nothing was ever
     * spilled, otherwise spills the remainder and returns every chunk file.
     * Must only be called once all producers have returned.
     */
    public AccumulatedEvents finish() throws IOException {
        List<ChangeEvent> rest;
        synchronized (lock) {
            if (finished) {
                throw new IllegalStateException("Accumulator already finished");
            }
            finished = true;
            rest = buffer;
            buffer = new ArrayList<>();
            bufferedBytes = 0;
            if (chunks.isEmpty()) {
                rest.sort(ChangeEvent.ORDER);
                return AccumulatedEvents.inMemory(rest);
            }
        }
        if (!rest.isEmpty()) {
            Path chunk = spill(rest);
            synchronized (lock) {
                chunks.add(chunk);
            }
        }
        synchronized (lock) {
            return AccumulatedEvents.spilled(chunks, eventCount);
        }
    }

    private Path spill(List<ChangeEvent> events) throws IOException {
        events.sort(ChangeEvent.ORDER);
        Path file = session.newChunkFile();
        codec.write(file, events);
        return file;
    }

    public long eventCount() {
        synchronized (lock) {
            return eventCount;
        }
    }

    public int spilledChunkCount() {
        synchronized (lock) {
            return chunks.size();
        }
    }

    public boolean isExternal() {
        return session != null;
    }
}
