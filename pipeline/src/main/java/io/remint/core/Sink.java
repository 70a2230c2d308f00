package io.remint.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sink consumes records in the order the source produced them. {@link #close()} marks the end of input.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() throws IOException {}

    /**
     * Called instead of a completed {@link #close()} when the run fails: releases what the sink holds
     * without finalizing its output.
     */
    default void abort() throws IOException {}
}
