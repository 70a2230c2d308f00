package io.remint.coin.table;

import io.remint.coin.error.TimeParseException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class TimeFilterTest {
    private final TimeFilter filter = new TimeFilter(
            TimeWindow.of("2009-03-20 15:30", "2009-03-20 16:30", ZoneOffset.UTC), ZoneOffset.UTC);

    @Test
    void bounds_are_inclusive() {
        assertTrue(filter.accepts("2009-03-20 15:30:00"));
        assertTrue(filter.accepts("2009-03-20 16:30:00"));
        assertTrue(filter.accepts("2009-03-20 16:00"));
    }

    @Test
    void just_outside_is_rejected() {
        assertFalse(filter.accepts("2009-03-20 15:29:59"));
        assertFalse(filter.accepts("2009-03-20 16:30:00.000001"));
    }

    @Test
    void unparseable_timestamp_is_an_error_not_a_rejection() {
        assertThrows(TimeParseException.class, () -> filter.accepts("PTIME"));
    }

    @Test
    void missing_bounds_default_to_the_unbounded_window() {
        assertEquals(TimeWindow.UNBOUNDED, TimeWindow.of(null, null, ZoneOffset.UTC));
        TimeWindow w = TimeWindow.of("2009-03-20", null, ZoneOffset.UTC);
        assertEquals(Instant.parse("2009-03-20T00:00:00Z"), w.begin());
        assertEquals(TimeWindow.MAX_UNIX_TIME, w.end());

        TimeFilter unbounded = TimeFilter.unbounded(ZoneOffset.UTC);
        assertTrue(unbounded.accepts("000000000"));
        assertTrue(unbounded.accepts("2147483647"));
        assertFalse(unbounded.accepts("2147483648"));
    }

    @Test
    void reversed_window_is_empty() {
        assertTrue(TimeWindow.of("2009-03-21", "2009-03-20", ZoneOffset.UTC).isEmpty());
        assertFalse(TimeWindow.of("2009-03-20", "2009-03-20", ZoneOffset.UTC).isEmpty());
    }
}
