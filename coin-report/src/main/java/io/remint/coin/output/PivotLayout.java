package io.remint.coin.output;

import io.remint.coin.config.ReportSpec;
import io.remint.coin.error.ConfigException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed reading of a pivot {@link ReportSpec}:
 * <pre>
 * RowField: PTIME
 * ColumnField: [NAME]            # string or list
 * DataField: [diff_BYTES]        # string or list
 * PageField: POOL
 * CurrentPage: shared pool
 * invisible: [{field: NAME, item: [free memory]}]
 * visible:   [{field: NAME, item: [...]}]
 * PivotFilters: {Type: xlTopCount, Value1: 15}
 * ChartType: xlAreaStacked
 * </pre>
 */
record PivotLayout(String rowField,
                   List<String> columnFields,
                   List<String> dataFields,
                   Optional<String> pageField,
                   Optional<String> currentPage,
                   Map<String, Set<String>> invisible,
                   Map<String, Set<String>> visible,
                   Optional<RankFilter> rankFilter,
                   Optional<String> chartType) {

    /** {@code CurrentPage} value that selects every page. */
    static final String ALL_PAGES = "(All)";

    /** Keep the {@code count} column keys with the highest (or lowest) total. */
    record RankFilter(boolean top, int count) {}

    /** Page value rows must carry, empty when the page field is absent or shows all pages. */
    Optional<String> pageFilter() {
        if (pageField.isEmpty()) return Optional.empty();
        return currentPage.filter(p -> !ALL_PAGES.equals(p));
    }

    static PivotLayout from(String category, ReportSpec spec) {
        String row = spec.get("RowField").map(Object::toString)
                .orElseThrow(() -> new ConfigException(category + ".pivot.RowField is required"));
        List<String> data = names(spec.get("DataField").orElse(null));
        if (data.isEmpty()) throw new ConfigException(category + ".pivot.DataField is required");
        return new PivotLayout(
                row,
                names(spec.get("ColumnField").orElse(null)),
                data,
                spec.get("PageField").map(Object::toString),
                spec.get("CurrentPage").map(Object::toString),
                items(spec.get("invisible").orElse(null), category + ".pivot.invisible"),
                items(spec.get("visible").orElse(null), category + ".pivot.visible"),
                rankFilter(spec.get("PivotFilters").orElse(null), category),
                spec.get("ChartType").map(Object::toString));
    }

    private static List<String> names(Object node) {
        if (node == null) return List.of();
        if (node instanceof List<?> l) {
            List<String> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(String.valueOf(o));
            return out;
        }
        return List.of(node.toString());
    }

    private static Map<String, Set<String>> items(Object node, String context) {
        if (node == null) return Map.of();
        if (!(node instanceof List<?> l)) throw new ConfigException(context + " must be a list");
        Map<String, Set<String>> out = new LinkedHashMap<>();
        for (Object o : l) {
            if (!(o instanceof Map<?, ?> m) || m.get("field") == null) {
                throw new ConfigException(context + " entries need a 'field'");
            }
            out.computeIfAbsent(m.get("field").toString(), k -> new LinkedHashSet<>())
                    .addAll(names(m.get("item")));
        }
        return out;
    }

    private static Optional<RankFilter> rankFilter(Object node, String category) {
        if (!(node instanceof Map<?, ?> m)) return Optional.empty();
        String type = String.valueOf(m.get("Type")).toLowerCase(Locale.ROOT);
        boolean top = type.endsWith("topcount");
        if (!top && !type.endsWith("bottomcount")) {
            throw new ConfigException(category + ".pivot.PivotFilters.Type '" + m.get("Type") + "' is not supported");
        }
        Object value = m.get("Value1");
        try {
            return Optional.of(new RankFilter(top, Integer.parseInt(String.valueOf(value).trim())));
        } catch (NumberFormatException e) {
            throw new ConfigException(category + ".pivot.PivotFilters.Value1 must be a number", e);
        }
    }
}
