package com.repo.timeline.normalize;

import com.repo.timeline.core.ChangeEvent;

import java.io.IOException;

/**
 * Destination for normalized events. Implementations shared between workers
 * must be thread-safe.
 */
@FunctionalInterface
public interface EventSink {

    void push(ChangeEvent event) throws IOException;
}
