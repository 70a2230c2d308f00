package io.remint.coin.table;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FieldLayoutTest {
    @Test
    void derives_one_span_per_dash_run() {
        FieldLayout layout = FieldLayout.derive("----- ---------- ---").orElseThrow();
        assertEquals(List.of(new FieldLayout.Span(0, 5), new FieldLayout.Span(6, 10), new FieldLayout.Span(17, 3)), layout.spans());
        assertEquals(20, layout.width());
        assertEquals(3, layout.fieldCount());
    }

    @Test
    void spans_and_single_gaps_cover_the_separator() {
        for (String sep : List.of("-", "-- -", "--- ---------- - ------", "- - - - -")) {
            FieldLayout layout = FieldLayout.derive(sep).orElseThrow();
            int covered = layout.spans().stream().mapToInt(FieldLayout.Span::width).sum() + layout.fieldCount() - 1;
            assertEquals(sep.length(), covered, sep);
            assertEquals(sep.length(), layout.width(), sep);
            for (String f : layout.slice(sep)) {
                assertFalse(f.isEmpty());
                assertTrue(f.chars().allMatch(c -> c == '-'), sep);
            }
        }
    }

    @Test
    void rejects_lines_that_are_not_separators() {
        assertEquals(Optional.empty(), FieldLayout.derive(""));
        assertEquals(Optional.empty(), FieldLayout.derive("     "));
        assertEquals(Optional.empty(), FieldLayout.derive("----- x---"));
        assertEquals(Optional.empty(), FieldLayout.derive("CNAME PTIME"));
        assertEquals(Optional.empty(), FieldLayout.derive("-----\t---"));
        assertEquals(Optional.empty(), FieldLayout.derive(null));
    }

    @Test
    void slices_and_trims_each_column() {
        FieldLayout layout = FieldLayout.derive("----- ---------- ---").orElseThrow();
        assertEquals(List.of("CNAME", "PTIME", "VAL"), layout.slice("CNAME PTIME      VAL"));
        assertEquals(List.of("FOO", "1000000000", "5"), layout.slice("FOO   1000000000 5"));
    }

    @Test
    void pads_short_lines_instead_of_failing() {
        FieldLayout layout = FieldLayout.derive("----- ---------- ---").orElseThrow();
        assertEquals(List.of("FOO", "12", ""), layout.slice("FOO   12"));
        assertEquals(List.of("", "", ""), layout.slice(""));
    }

    @Test
    void longer_lines_are_cut_at_the_layout() {
        FieldLayout layout = FieldLayout.derive("--- ---").orElseThrow();
        assertEquals(List.of("abc", "def"), layout.slice("abc defghi"));
    }

    @Test
    void wider_gaps_do_not_create_empty_columns() {
        FieldLayout layout = FieldLayout.derive(" ---  --- ").orElseThrow();
        assertEquals(List.of(new FieldLayout.Span(1, 3), new FieldLayout.Span(6, 3)), layout.spans());
        assertEquals(10, layout.width());
        assertEquals(List.of("ab", "cd"), layout.slice(" ab   cd"));
    }
}
