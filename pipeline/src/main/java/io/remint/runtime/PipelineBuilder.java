package io.remint.runtime;

import com.codahale.metrics.MetricRegistry;
import io.remint.core.Sink;
import io.remint.core.Source;
import io.remint.metrics.Metrics;

import java.util.Objects;

public class PipelineBuilder<T> {
    private Source<T> source;
    private Sink<T> sink;
    private MetricRegistry metricRegistry = new MetricRegistry();

    public PipelineBuilder<T> source(Source<T> s) { this.source = s; return this; }
    public PipelineBuilder<T> sink(Sink<T> s) { this.sink = s; return this; }
    public PipelineBuilder<T> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public Pipeline<T> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(metricRegistry, "metrics");
        return new Pipeline<>(source, sink, new Metrics(metricRegistry));
    }
}
