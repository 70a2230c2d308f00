package io.remint.coin.table;

import io.remint.coin.config.DiffSpec;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns cumulative counters into per-sample deltas. The previous raw value is remembered per
 * category, value column and identity tuple, for the lifetime of the engine.
 */
public class DiffEngine {
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private final Map<DiffKey, String> previous = new HashMap<>();

    private record DiffKey(String category, String field, List<String> identity) {}

    /**
     * Returns {@code row} with one value appended per {@code spec.value()} column, in declaration order:
     * the difference to the previous sample of the same identity tuple, or {@code null} for the first sample.
     *
     * @param columnIndex resolves a column name to its position in the category's header
     */
    public List<String> diff(String category, List<String> row, ToIntFunction<String> columnIndex, DiffSpec spec) {
        List<String> identity = new ArrayList<>(spec.id().size());
        for (String id : spec.id()) {
            identity.add(valueAt(row, columnIndex.applyAsInt(id)));
        }
        List<String> out = new ArrayList<>(row.size() + spec.value().size());
        out.addAll(row);
        for (String field : spec.value()) {
            String current = valueAt(row, columnIndex.applyAsInt(field));
            String prev = previous.put(new DiffKey(category, field, List.copyOf(identity)), current);
            out.add(prev == null ? null : toInteger(current).subtract(toInteger(prev)).toString());
        }
        return out;
    }

    /** Number of distinct (category, column, identity) combinations seen. */
    public int trackedKeys() { return previous.size(); }

    /**
     * Leading integer of {@code text}, ignoring leading whitespace; text without one counts as zero.
     */
    static BigInteger toInteger(String text) {
        if (text == null) return BigInteger.ZERO;
        Matcher m = LEADING_INTEGER.matcher(text);
        if (!m.find()) return BigInteger.ZERO;
        String digits = m.group(1);
        return new BigInteger(digits.startsWith("+") ? digits.substring(1) : digits);
    }

    private static String valueAt(List<String> row, int index) {
        if (index < row.size()) {
            String v = row.get(index);
            return v == null ? "" : v;
        }
        return "";
    }
}
