package com.repo.timeline.sort;

import com.repo.timeline.core.ChangeEvent;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * Produces the single, globally ordered event stream.
 * <p>
 * In-memory results are streamed straight from the sorted list. Spilled
 * results are k-way merged: one lazy cursor per chunk, a priority queue
 * ordered by each cursor's head, pop the smallest head and refill from the
 * same chunk. Memory stays at one decoded event per open chunk. When there are
 * more chunks than the session fan-in, groups of chunks are first merged into
 * larger chunks until a single pass suffices.
 */
public class ExternalMergeEngine {

    private static final Comparator<ChunkCursor> HEAD_ORDER = Comparator
            .comparing(ChunkCursor::head, ChangeEvent.ORDER)
            .thenComparingInt(ChunkCursor::index);

    private final SortSession session;
    private final ChunkCodec codec;
    private int intermediatePasses;

    /**
     * @param session may be null when only in-memory results will be merged
     */
    public ExternalMergeEngine(SortSession session, ChunkCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    public static ExternalMergeEngine inMemory() {
        return new ExternalMergeEngine(null, null);
    }

    /**
     * Open the ordered stream over everything the accumulator collected.
     * The caller must close the returned stream.
     */
    public EventStream merge(AccumulatedEvents accumulated) throws IOException {
        if (!accumulated.isSpilled()) {
            return new ListStream(accumulated.inMemory());
        }
        if (session == null) {
            throw new IllegalStateException("Spilled chunks need a sort session to merge");
        }

        List<Path> chunks = new ArrayList<>(accumulated.chunks());
        while (chunks.size() > session.fanIn()) {
            chunks = mergePass(chunks);
            intermediatePasses++;
        }
        return open(chunks);
    }

    /**
     * Number of intermediate passes the last merge needed.
     */
    public int intermediatePasses() {
        return intermediatePasses;
    }

    /**
     * Merge consecutive groups of fanIn chunks into new chunk files.
     * Group order is kept so ties keep resolving by input chunk position.
     */
    private List<Path> mergePass(List<Path> chunks) throws IOException {
        List<Path> next = new ArrayList<>();
        for (int start = 0; start < chunks.size(); start += session.fanIn()) {
            List<Path> group = chunks.subList(start, Math.min(start + session.fanIn(), chunks.size()));
            if (group.size() == 1) {
                next.add(group.get(0));
                continue;
            }
            Path merged = session.newChunkFile();
            try (EventStream stream = open(group);
                    ChunkCodec.ChunkWriter writer = codec.openWriter(merged)) {
                while (stream.hasNext()) {
                    writer.write(stream.next());
                }
            }
            next.add(merged);
        }
        return next;
    }

    private EventStream open(List<Path> chunks) throws IOException {
        MergeStream stream = new MergeStream();
        try {
            for (int i = 0; i < chunks.size(); i++) {
                ChunkCursor cursor = codec.openCursor(chunks.get(i), i);
                stream.add(cursor);
            }
        } catch (IOException | RuntimeException e) {
            try {
                stream.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return stream;
    }

    /**
     * Pull-based k-way merge over open chunk cursors.
     */
    private final class MergeStream implements EventStream {

        private final PriorityQueue<ChunkCursor> heads = new PriorityQueue<>(HEAD_ORDER);
        private final List<ChunkCursor> open = new ArrayList<>();

        void add(ChunkCursor cursor) throws IOException {
            open.add(cursor);
            if (cursor.head() != null) {
                heads.add(cursor);
            } else {
                exhausted(cursor);
            }
        }

        @Override
        public boolean hasNext() {
            return !heads.isEmpty();
        }

        @Override
        public ChangeEvent next() throws IOException {
            ChunkCursor cursor = heads.poll();
            if (cursor == null) {
                throw new NoSuchElementException();
            }
            ChangeEvent event = cursor.head();
            if (cursor.advance()) {
                heads.add(cursor);
            } else {
                exhausted(cursor);
            }
            return event;
        }

        private void exhausted(ChunkCursor cursor) throws IOException {
            open.remove(cursor);
            cursor.close();
            session.discard(cursor.file());
        }

        @Override
        public void close() throws IOException {
            IOException failure = null;
            for (ChunkCursor cursor : open) {
                try {
                    cursor.close();
                } catch (IOException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            open.clear();
            heads.clear();
            if (failure != null) {
                throw failure;
            }
        }
    }

    private static final class ListStream implements EventStream {

        private final Iterator<ChangeEvent> events;

        ListStream(List<ChangeEvent> events) {
            this.events = events.iterator();
        }

        @Override
        public boolean hasNext() {
            return events.hasNext();
        }

        @Override
        public ChangeEvent next() {
            return events.next();
        }

        @Override
        public void close() {
            // nothing to release
        }
    }
}
