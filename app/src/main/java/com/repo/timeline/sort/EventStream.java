package com.repo.timeline.sort;

import com.repo.timeline.core.ChangeEvent;

import java.io.Closeable;
import java.io.IOException;
import java.util.NoSuchElementException;

/**
 * Pull-based, ordered sequence of events. Reading may touch the disk, hence
 * the checked exceptions.
 */
public interface EventStream extends Closeable {

    boolean hasNext() throws IOException;

    /**
     * @throws NoSuchElementException when the stream is exhausted
     */
    ChangeEvent next() throws IOException;
}
