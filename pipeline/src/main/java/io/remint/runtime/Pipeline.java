package io.remint.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.remint.core.Record;
import io.remint.core.Sink;
import io.remint.core.Source;
import io.remint.metrics.Metrics;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-source -> single-sink pipeline that runs on the calling thread.
 * Records reach the sink strictly in source order; the sink is closed once the source is exhausted.
 * Any failure aborts the run, calls {@link Sink#abort()} and is rethrown as a {@link PipelineException}
 * carrying the source position.
 */
public class Pipeline<T> {
    private final Source<T> source;
    private final Sink<T> sink;

    private final Timer sourceTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;

    private long processed = 0;
    private boolean ran = false;

    public Pipeline(Source<T> source, Sink<T> sink, Metrics metrics) {
        this.source = Objects.requireNonNull(source);
        this.sink = Objects.requireNonNull(sink);
        this.sourceTimer = metrics.timer(Metrics.SOURCE_TIME);
        this.sinkTimer = metrics.timer(Metrics.SINK_TIME);
        this.inMeter = metrics.meter(Metrics.INPUT_RATE);
    }

    /**
     * Drains the source into the sink and closes both. A pipeline runs at most once.
     *
     * @return number of records delivered to the sink
     */
    public long run() {
        if (ran) throw new IllegalStateException("pipeline already ran");
        ran = true;
        try {
            while (!source.isFinished()) {
                Optional<Record<T>> next;
                try (Timer.Context ignored = sourceTimer.time()) {
                    next = source.poll();
                }
                if (next.isEmpty()) continue;
                inMeter.mark();
                try (Timer.Context ignored = sinkTimer.time()) {
                    sink.accept(next.get());
                }
                processed++;
            }
            try (Timer.Context ignored = sinkTimer.time()) {
                sink.close();
            }
        } catch (PipelineException e) {
            abortSink(e);
            throw e;
        } catch (Exception e) {
            PipelineException failure = new PipelineException(source.position(), e);
            abortSink(failure);
            throw failure;
        } finally {
            closeSource();
        }
        return processed;
    }

    public long processed() { return processed; }

    private void abortSink(PipelineException failure) {
        try {
            sink.abort();
        } catch (Exception e) {
            failure.addSuppressed(e);
        }
    }

    private void closeSource() {
        try {
            source.close();
        } catch (IOException e) {
            throw new PipelineException(source.position(), e);
        }
    }
}
