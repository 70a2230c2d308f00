package io.remint.coin.table;

import io.remint.coin.config.CategoryCatalog;
import io.remint.coin.config.CategoryConfig;
import io.remint.coin.config.DiffSpec;
import io.remint.coin.output.ReportSink;
import io.remint.coin.output.RowSink;
import io.remint.core.Record;
import io.remint.core.Sink;
import io.remint.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reassembles the fixed-width tables of a monitoring dump, one line at a time.
 * <p>
 * The last three lines are kept. When the middle one is a dashed separator, the line above it is the
 * header and the line below it the first sample; the sample's first column (CNAME) becomes the active
 * category. Every line is then sliced with the current layout and emitted if its CNAME is the active
 * category, its PTIME (second column) lies in the time window and the category passes the filter.
 * Configured diff columns are appended before emission.
 * <p>
 * All state (window, layout, headers, diff values) belongs to this instance.
 */
public class TableAssembler implements Sink<String> {
    private static final Logger log = LoggerFactory.getLogger(TableAssembler.class);

    static final int CNAME_INDEX = 0;
    static final int PTIME_INDEX = 1;

    private final CategoryCatalog catalog;
    private final RowSink sink;
    private final TimeFilter timeFilter;
    private final CategoryFilter categoryFilter;
    private final Metrics metrics;

    private final HeaderRegistry headers = new HeaderRegistry();
    private final DiffEngine diffEngine = new DiffEngine();
    private final String[] lines = {"", "", ""};

    private FieldLayout layout;     // null until the first separator
    private String category;        // null while no table is active
    private boolean closed = false;

    public TableAssembler(CategoryCatalog catalog, RowSink sink, TimeFilter timeFilter,
                          CategoryFilter categoryFilter, Metrics metrics) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.timeFilter = Objects.requireNonNull(timeFilter, "timeFilter");
        this.categoryFilter = Objects.requireNonNull(categoryFilter, "categoryFilter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void accept(Record<String> record) throws IOException {
        puts(record.payload());
    }

    /**
     * Consumes the next input line.
     */
    public void puts(String line) throws IOException {
        lines[0] = lines[1];
        lines[1] = lines[2];
        lines[2] = line;

        Optional<FieldLayout> separator = FieldLayout.derive(lines[1]);
        if (separator.isPresent()) {
            startTable(separator.get());
        }

        if (layout == null) return;
        List<String> row = layout.slice(lines[2]);
        if (category == null || !category.equals(row.get(CNAME_INDEX))) {
            // stray line of another table under a stale layout
            metrics.counter(Metrics.ROWS_STRAY).inc();
            return;
        }
        if (!timeFilter.accepts(field(row, PTIME_INDEX))) {
            metrics.counter(Metrics.ROWS_OUT_OF_WINDOW).inc();
            return;
        }
        Optional<DiffSpec> diff = catalog.diff(category);
        if (diff.isPresent()) {
            String current = category;
            row = diffEngine.diff(current, row, f -> headers.columnIndex(current, f), diff.get());
        }
        if (categoryFilter.accepts(category)) {
            sink.putRow(category, row);
            metrics.counter(Metrics.ROWS_EMITTED).inc();
        } else {
            metrics.counter(Metrics.ROWS_FILTERED).inc();
        }
    }

    private void startTable(FieldLayout newLayout) throws IOException {
        layout = newLayout;
        List<String> headerFields = layout.slice(lines[0]);
        String detected = layout.slice(lines[2]).get(CNAME_INDEX);
        if (detected.isEmpty()) {
            // header without samples
            category = null;
            log.debug("Table without rows under header {}", headerFields);
            return;
        }
        category = detected;
        List<String> diffColumns = catalog.diff(detected).map(DiffSpec::diffColumnNames).orElse(List.of());
        Optional<List<String>> header = headers.recordIfNew(detected, headerFields, diffColumns);
        if (header.isEmpty()) return;

        metrics.counter(Metrics.CATEGORIES_DETECTED).inc();
        log.info("Detected category {} with {} columns", detected, header.get().size());
        if (categoryFilter.accepts(detected)) {
            sink.putRow(detected, header.get());
            metrics.counter(Metrics.HEADERS_EMITTED).inc();
        }
    }

    /**
     * Renders the configured reports, when the sink supports them, and finishes the sink.
     * Further calls do nothing.
     */
    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        if (sink instanceof ReportSink reports) {
            for (CategoryConfig config : catalog.entries()) {
                if (config.pivot().isPresent() && categoryFilter.accepts(config.name())) {
                    reports.applyReport(config.name(), config.pivot().get());
                }
            }
        }
        sink.finish();
    }

    /** Discards the sink's output after a failed run. {@link #close()} does nothing afterwards. */
    @Override
    public void abort() throws IOException {
        closed = true;
        sink.discard();
    }

    public HeaderRegistry headers() { return headers; }

    /** Category of the table currently being read, if any. */
    public Optional<String> activeCategory() { return Optional.ofNullable(category); }

    private static String field(List<String> row, int index) {
        return index < row.size() ? row.get(index) : "";
    }
}
