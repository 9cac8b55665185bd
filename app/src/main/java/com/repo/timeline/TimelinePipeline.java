package com.repo.timeline;

import com.repo.timeline.core.TimelineConfig;
import com.repo.timeline.git.CommitSource;
import com.repo.timeline.git.RepositoryAccessException;
import com.repo.timeline.normalize.EventNormalizer;
import com.repo.timeline.output.GourceLogWriter;
import com.repo.timeline.sort.AccumulatedEvents;
import com.repo.timeline.sort.ChunkAccumulator;
import com.repo.timeline.sort.ChunkCodec;
import com.repo.timeline.sort.EventStream;
import com.repo.timeline.sort.ExternalMergeEngine;
import com.repo.timeline.sort.SortSession;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the whole conversion: read every repository in parallel, normalize,
 * accumulate (spilling to disk in merge-sort mode), merge and write.
 * <p>
 * The accumulator is the only state shared between workers. A repository
 * that cannot be read is reported and skipped; any other failure aborts the
 * run.
 */
public class TimelinePipeline {

    private final TimelineConfig config;
    private final PrintStream console;

    public TimelinePipeline(TimelineConfig config, PrintStream console) {
        this.config = config;
        this.console = console;
    }

    private record RepositoryOutcome(String name, long commits, long filtered, String failure) {
    }

    public PipelineSummary run(List<? extends CommitSource> sources, GourceLogWriter writer) throws IOException {
        ChunkCodec codec = new ChunkCodec();
        SortSession session = config.isUseMergeSort()
                ? SortSession.create(config.getTempLocation(), config.getSortChunkSizeBytes(),
                        config.getMergeFanIn(), console)
                : null;
        try {
            if (session != null) {
                progress("Merge sort enabled, chunk size " + config.getSortChunkSizeMb() + " MB, temporary files in "
                        + session.directory().toAbsolutePath());
            }
            ChunkAccumulator accumulator = session != null
                    ? ChunkAccumulator.external(session, codec)
                    : ChunkAccumulator.inMemory();
            ExternalMergeEngine engine = session != null
                    ? new ExternalMergeEngine(session, codec)
                    : ExternalMergeEngine.inMemory();
            return execute(sources, accumulator, engine, writer);
        } finally {
            if (session != null) {
                session.close();
            }
        }
    }

    private PipelineSummary execute(List<? extends CommitSource> sources, ChunkAccumulator accumulator,
            ExternalMergeEngine engine, GourceLogWriter writer) throws IOException {
        // Phase 1: read and normalize
        progress("Reading " + sources.size() + " repositories...");
        List<RepositoryOutcome> outcomes = scanAll(sources, accumulator);

        long commits = 0;
        long filtered = 0;
        List<String> failed = new ArrayList<>();
        for (RepositoryOutcome outcome : outcomes) {
            commits += outcome.commits();
            filtered += outcome.filtered();
            if (outcome.failure() != null) {
                failed.add(outcome.name());
            }
        }

        // Phase 2: sort / merge
        AccumulatedEvents accumulated = accumulator.finish();
        progress(accumulated.isSpilled()
                ? "Merging " + accumulated.chunks().size() + " chunks (" + accumulated.eventCount() + " events)..."
                : "Sorted " + accumulated.eventCount() + " events in memory");

        // Phase 3: write
        long written;
        try (EventStream stream = engine.merge(accumulated)) {
            written = writer.write(stream);
        }
        progress("Wrote " + written + " events from " + (outcomes.size() - failed.size()) + " repositories");

        return new PipelineSummary(
                outcomes.size() - failed.size(),
                failed,
                commits,
                filtered,
                written,
                accumulated.chunks().size(),
                engine.intermediatePasses());
    }

    private List<RepositoryOutcome> scanAll(List<? extends CommitSource> sources, ChunkAccumulator accumulator)
            throws IOException {
        EventNormalizer normalizer = new EventNormalizer(config.aliasTable(), config.getMaxChangesetSize());
        int poolSize = Math.max(1, Math.min(config.getThreads(), sources.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        AtomicInteger completed = new AtomicInteger();

        List<Future<RepositoryOutcome>> futures = new ArrayList<>();
        for (CommitSource source : sources) {
            futures.add(pool.submit(scanTask(source, normalizer, accumulator, completed, sources.size())));
        }

        boolean aborted = true;
        try {
            List<RepositoryOutcome> outcomes = new ArrayList<>();
            for (Future<RepositoryOutcome> future : futures) {
                outcomes.add(future.get());
            }
            aborted = false;
            return outcomes;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IOException("Repository scan failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading repositories");
        } finally {
            if (aborted) {
                pool.shutdownNow();
            } else {
                pool.shutdown();
            }
        }
    }

    private Callable<RepositoryOutcome> scanTask(CommitSource source, EventNormalizer normalizer,
            ChunkAccumulator accumulator, AtomicInteger completed, int total) {
        return () -> {
            long[] counts = new long[3]; // commits, filtered, events
            String failure = null;
            try {
                source.readCommits(commit -> {
                    counts[0]++;
                    if (normalizer.isFiltered(commit)) {
                        counts[1]++;
                        return;
                    }
                    counts[2] += normalizer.normalize(commit, source.repositoryId(), accumulator);
                });
            } catch (RepositoryAccessException e) {
                failure = e.getMessage();
                console.println("Warning: Skipping rest of repository " + e.getMessage());
            }
            progress("[" + completed.incrementAndGet() + "/" + total + "] " + source.name() + ": "
                    + counts[0] + " commits, " + counts[2] + " events"
                    + (counts[1] > 0 ? ", " + counts[1] + " commits over the changeset limit" : ""));
            return new RepositoryOutcome(source.name(), counts[0], counts[1], failure);
        };
    }

    private void progress(String message) {
        if (!config.isQuiet()) {
            console.println(message);
        }
    }
}
