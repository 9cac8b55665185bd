package com.repo.timeline.sort;

import com.repo.timeline.core.ChangeEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ChunkAccumulatorTest {

    @TempDir
    Path tempDir;

    @Test
    void testInMemoryReturnsSortedEvents() throws IOException {
        List<ChangeEvent> events = SortTestEvents.random(1, 500);
        ChunkAccumulator accumulator = ChunkAccumulator.inMemory();
        for (ChangeEvent event : events) {
            accumulator.push(event);
        }

        AccumulatedEvents result = accumulator.finish();

        assertFalse(result.isSpilled());
        assertEquals(500, result.eventCount());
        assertEquals(SortTestEvents.sorted(events), result.inMemory());
    }

    @Test
    void testExternalSpillsSortedChunks() throws IOException {
        List<ChangeEvent> events = SortTestEvents.random(2, 300);
        ChunkCodec codec = new ChunkCodec();
        try (SortSession session = SortSession.create(Optional.of(tempDir.resolve("sort")), 4_000, 8,
                SortTestEvents.quietConsole())) {
            ChunkAccumulator accumulator = ChunkAccumulator.external(session, codec);
            for (ChangeEvent event : events) {
                accumulator.push(event);
            }

            AccumulatedEvents result = accumulator.finish();

            assertTrue(result.isSpilled());
            assertTrue(result.chunks().size() > 1);
            assertEquals(300, result.eventCount());

            long total = 0;
            for (int i = 0; i < result.chunks().size(); i++) {
                Path chunk = result.chunks().get(i);
                assertTrue(Files.exists(chunk));
                List<ChangeEvent> content = readChunk(codec, chunk, i);
                assertEquals(SortTestEvents.sorted(content), content, "each chunk is sorted");
                total += content.size();
            }
            assertEquals(300, total);
        }
    }

    @Test
    void testExternalWithoutSpillStaysInMemory() throws IOException {
        try (SortSession session = SortSession.create(Optional.of(tempDir.resolve("sort")), 1_000_000, 8,
                SortTestEvents.quietConsole())) {
            ChunkAccumulator accumulator = ChunkAccumulator.external(session, new ChunkCodec());
            for (ChangeEvent event : SortTestEvents.random(3, 10)) {
                accumulator.push(event);
            }

            AccumulatedEvents result = accumulator.finish();

            assertFalse(result.isSpilled());
            assertEquals(10, result.inMemory().size());
            assertEquals(0, session.chunksCreated());
        }
    }

    @Test
    void testConcurrentProducersLoseNothing() throws Exception {
        int producers = 8;
        int perProducer = 400;
        ChunkCodec codec = new ChunkCodec();
        try (SortSession session = SortSession.create(Optional.of(tempDir.resolve("sort")), 8_000, 4,
                SortTestEvents.quietConsole())) {
            ChunkAccumulator accumulator = ChunkAccumulator.external(session, codec);
            List<ChangeEvent> expected = new ArrayList<>();
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                List<ChangeEvent> events = SortTestEvents.random(100 + p, perProducer);
                expected.addAll(events);
                tasks.add(() -> {
                    for (ChangeEvent event : events) {
                        accumulator.push(event);
                    }
                    return null;
                });
            }

            ExecutorService pool = Executors.newFixedThreadPool(producers);
            try {
                for (Future<Void> future : pool.invokeAll(tasks)) {
                    future.get();
                }
            } finally {
                pool.shutdown();
            }

            AccumulatedEvents result = accumulator.finish();
            assertEquals((long) producers * perProducer, result.eventCount());

            List<ChangeEvent> merged = SortTestEvents.drain(new ExternalMergeEngine(session, codec).merge(result));
            assertEquals(SortTestEvents.sorted(expected), merged);
        }
    }

    @Test
    void testFinishTwiceFails() throws IOException {
        ChunkAccumulator accumulator = ChunkAccumulator.inMemory();
        accumulator.finish();

        assertThrows(IllegalStateException.class, accumulator::finish);
        assertThrows(IllegalStateException.class, () -> accumulator.push(SortTestEvents.random(4, 1).get(0)));
    }

    private static List<ChangeEvent> readChunk(ChunkCodec codec, Path chunk, int index) throws IOException {
        List<ChangeEvent> events = new ArrayList<>();
        try (ChunkCursor cursor = codec.openCursor(chunk, index)) {
            while (cursor.head() != null) {
                events.add(cursor.head());
                cursor.advance();
            }
        }
        return events;
    }
}
