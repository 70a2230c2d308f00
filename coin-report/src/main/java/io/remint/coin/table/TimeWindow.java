package io.remint.coin.table;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Inclusive {@code [begin, end]} range of sample timestamps to keep.
 */
public record TimeWindow(Instant begin, Instant end) {
    /** Largest legacy 32-bit Unix time; the default upper bound. */
    public static final Instant MAX_UNIX_TIME = Instant.parse("2038-01-19T03:14:07Z");

    /** Everything realistic: the epoch up to {@link #MAX_UNIX_TIME}. */
    public static final TimeWindow UNBOUNDED = new TimeWindow(Instant.EPOCH, MAX_UNIX_TIME);

    public TimeWindow {
        Objects.requireNonNull(begin, "begin");
        Objects.requireNonNull(end, "end");
    }

    /**
     * Builds a window from optional textual bounds; a missing bound keeps the default.
     */
    public static TimeWindow of(String begin, String end, ZoneId zone) {
        Instant b = begin == null ? UNBOUNDED.begin() : Timestamps.parse(begin, zone);
        Instant e = end == null ? UNBOUNDED.end() : Timestamps.parse(end, zone);
        return new TimeWindow(b, e);
    }

    public boolean contains(Instant t) {
        return !t.isBefore(begin) && !t.isAfter(end);
    }

    public boolean isEmpty() { return end.isBefore(begin); }
}
