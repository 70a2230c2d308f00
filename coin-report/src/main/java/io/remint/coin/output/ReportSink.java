package io.remint.coin.output;

import io.remint.coin.config.ReportSpec;

import java.io.IOException;

/** Optional sink capability to render a summary report of a category's rows. */
public interface ReportSink extends RowSink {
    /**
     * Builds the report described by {@code spec} from the rows received so far for {@code category}.
     * Called before {@link #finish()}.
     */
    void applyReport(String category, ReportSpec spec) throws IOException;
}
