package io.remint.coin.output;

import java.io.IOException;
import java.util.List;

/**
 * Destination of assembled rows, one output stream per category. The first row of a category is
 * its header and fixes the column count. Implementations buffer as they see fit.
 */
public interface RowSink {
    /**
     * Appends one row to the output of {@code category}. {@code null} elements are undefined values.
     */
    void putRow(String category, List<String> fields) throws IOException;

    /** Flushes and finalizes every output. Called exactly once, after all input. */
    void finish() throws IOException;

    /** Releases every output without finalizing it, after a failed run. Safe to call more than once. */
    void discard() throws IOException;
}
