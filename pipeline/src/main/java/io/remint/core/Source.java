package io.remint.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A finite, pull-based producer of records in deterministic order.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next record, or empty once the source is exhausted.
     */
    Optional<Record<T>> poll();

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    /**
     * Human readable position of the last record handed out, used in error messages.
     */
    default String position() { return ""; }

    @Override
    default void close() throws IOException {}
}
