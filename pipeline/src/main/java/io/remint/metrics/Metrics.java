package io.remint.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over a {@link MetricRegistry} with the metric names shared by the pipeline and its stages.
 */
public class Metrics {
    public static final String INPUT_RATE = "pipeline.input.rate";
    public static final String SOURCE_TIME = "pipeline.source.time";
    public static final String SINK_TIME = "pipeline.sink.time";

    public static final String HEADERS_EMITTED = "remint.headers.emitted";
    public static final String ROWS_EMITTED = "remint.rows.emitted";
    public static final String ROWS_STRAY = "remint.rows.stray";
    public static final String ROWS_OUT_OF_WINDOW = "remint.rows.outOfWindow";
    public static final String ROWS_FILTERED = "remint.rows.filtered";
    public static final String CATEGORIES_DETECTED = "remint.categories.detected";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public long count(String name) { return registry.counter(name).getCount(); }
}
