package io.remint.coin.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Column layout of a fixed-width table, derived from the dashed separator line under its header:
 * <pre>
 * CNAME PTIME     VAL
 * ----- --------- ---
 * FOO   1000000000  5
 * </pre>
 * Every maximal run of {@code -} is one column. The layout is used to slice every line that follows
 * until the next separator replaces it.
 */
public final class FieldLayout {

    /** One column: {@code width} characters starting at {@code start}. */
    public record Span(int start, int width) {
        public int end() { return start + width; }
    }

    private final List<Span> spans;
    private final int width;

    private FieldLayout(List<Span> spans, int width) {
        this.spans = Collections.unmodifiableList(spans);
        this.width = width;
    }

    /**
     * Derives a layout from {@code line} if it is a separator: non-empty, only {@code -} and spaces,
     * with at least one dash. Any other line yields empty.
     */
    public static Optional<FieldLayout> derive(String line) {
        if (line == null || line.isEmpty()) return Optional.empty();
        List<Span> spans = new ArrayList<>();
        int runStart = -1;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '-') {
                if (runStart < 0) runStart = i;
            } else if (c == ' ') {
                if (runStart >= 0) {
                    spans.add(new Span(runStart, i - runStart));
                    runStart = -1;
                }
            } else {
                return Optional.empty();
            }
        }
        if (runStart >= 0) spans.add(new Span(runStart, line.length() - runStart));
        if (spans.isEmpty()) return Optional.empty();
        return Optional.of(new FieldLayout(spans, line.length()));
    }

    /**
     * Cuts {@code line} into one trimmed value per column. Lines shorter than the layout are
     * padded with spaces first, so this never fails on short input.
     */
    public List<String> slice(String line) {
        String padded = line.length() < width ? line + " ".repeat(width - line.length()) : line;
        List<String> fields = new ArrayList<>(spans.size());
        for (Span s : spans) {
            fields.add(padded.substring(s.start(), s.end()).strip());
        }
        return fields;
    }

    public List<Span> spans() { return spans; }

    /** Total width, i.e. the length of the separator line. */
    public int width() { return width; }

    public int fieldCount() { return spans.size(); }

    @Override
    public String toString() {
        return "FieldLayout" + spans + " width=" + width;
    }
}
