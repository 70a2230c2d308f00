package io.remint.coin.table;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Accepts rows whose timestamp field lies inside a fixed {@link TimeWindow}. A timestamp that
 * cannot be parsed raises {@link io.remint.coin.error.TimeParseException}; it is never treated as in or out.
 */
public class TimeFilter {
    private final TimeWindow window;
    private final ZoneId zone;

    public TimeFilter(TimeWindow window, ZoneId zone) {
        this.window = Objects.requireNonNull(window, "window");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static TimeFilter unbounded(ZoneId zone) {
        return new TimeFilter(TimeWindow.UNBOUNDED, zone);
    }

    public boolean accepts(String timestamp) {
        return window.contains(Timestamps.parse(timestamp, zone));
    }

    public TimeWindow window() { return window; }

    public ZoneId zone() { return zone; }
}
