package io.remint.coin.output;

import io.remint.coin.error.UnknownColumnException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Sum-aggregating pivot over a category's rows: one line per {@code RowField} value, one column per
 * distinct {@code ColumnField} tuple and data field. Text and empty cells are left out of the sums.
 */
final class PivotSummary {
    static final String GRAND_TOTAL = "Grand Total";
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private final String category;
    private final PivotLayout layout;
    private final Map<String, Integer> index = new HashMap<>();

    // row key -> column key -> one sum per data field
    private final Map<String, Map<String, BigDecimal[]>> cells = new TreeMap<>();
    private final Set<String> columnKeys = new TreeSet<>();

    PivotSummary(String category, List<String> header, PivotLayout layout) {
        this.category = category;
        this.layout = layout;
        for (int i = 0; i < header.size(); i++) index.putIfAbsent(header.get(i), i);
        column(layout.rowField());
        layout.columnFields().forEach(this::column);
        layout.dataFields().forEach(this::column);
        layout.pageField().ifPresent(this::column);
        layout.invisible().keySet().forEach(this::column);
        layout.visible().keySet().forEach(this::column);
    }

    void add(List<String> row) {
        Optional<String> page = layout.pageFilter();
        if (page.isPresent() && !page.get().equals(value(row, layout.pageField().get()))) {
            return;
        }
        for (Map.Entry<String, Set<String>> e : layout.invisible().entrySet()) {
            if (e.getValue().contains(value(row, e.getKey()))) return;
        }
        for (Map.Entry<String, Set<String>> e : layout.visible().entrySet()) {
            if (!e.getValue().contains(value(row, e.getKey()))) return;
        }

        String rowKey = value(row, layout.rowField());
        String columnKey = columnKey(row);
        columnKeys.add(columnKey);
        BigDecimal[] sums = cells.computeIfAbsent(rowKey, k -> new TreeMap<>())
                .computeIfAbsent(columnKey, k -> new BigDecimal[layout.dataFields().size()]);
        for (int d = 0; d < sums.length; d++) {
            String v = value(row, layout.dataFields().get(d));
            if (!NUMBER.matcher(v).matches()) continue;
            BigDecimal n = new BigDecimal(v);
            sums[d] = sums[d] == null ? n : sums[d].add(n);
        }
    }

    /**
     * Lines of the pivot sheet: the page selection (if any) and a blank line, the column labels,
     * one line per row key and a grand total line.
     */
    List<List<String>> render() {
        List<String> columns = selectedColumns();
        List<String> dataFields = layout.dataFields();
        List<List<String>> out = new ArrayList<>();
        if (layout.pageField().isPresent()) {
            out.add(List.of(layout.pageField().get(), layout.currentPage().orElse(PivotLayout.ALL_PAGES)));
            out.add(List.of());
        }

        List<String> head = new ArrayList<>();
        head.add(layout.rowField());
        for (String c : columns) {
            for (String d : dataFields) head.add(label(c, d));
        }
        for (String d : dataFields) head.add(dataFields.size() == 1 ? GRAND_TOTAL : GRAND_TOTAL + " | Sum / " + d);
        out.add(head);

        BigDecimal[][] columnTotals = new BigDecimal[columns.size()][dataFields.size()];
        BigDecimal[] grand = new BigDecimal[dataFields.size()];
        for (Map.Entry<String, Map<String, BigDecimal[]>> r : cells.entrySet()) {
            List<String> line = new ArrayList<>();
            line.add(r.getKey());
            BigDecimal[] rowTotal = new BigDecimal[dataFields.size()];
            for (int c = 0; c < columns.size(); c++) {
                BigDecimal[] sums = r.getValue().get(columns.get(c));
                for (int d = 0; d < dataFields.size(); d++) {
                    BigDecimal v = sums == null ? null : sums[d];
                    line.add(format(v));
                    rowTotal[d] = plus(rowTotal[d], v);
                    columnTotals[c][d] = plus(columnTotals[c][d], v);
                }
            }
            for (int d = 0; d < dataFields.size(); d++) {
                line.add(format(rowTotal[d]));
                grand[d] = plus(grand[d], rowTotal[d]);
            }
            out.add(line);
        }

        List<String> total = new ArrayList<>();
        total.add(GRAND_TOTAL);
        for (int c = 0; c < columns.size(); c++) {
            for (int d = 0; d < dataFields.size(); d++) total.add(format(columnTotals[c][d]));
        }
        for (int d = 0; d < dataFields.size(); d++) total.add(format(grand[d]));
        out.add(total);
        return out;
    }

    private List<String> selectedColumns() {
        List<String> all = new ArrayList<>(columnKeys);
        if (layout.rankFilter().isEmpty()) return all;
        PivotLayout.RankFilter filter = layout.rankFilter().get();
        Map<String, BigDecimal> totals = new HashMap<>();
        for (Map<String, BigDecimal[]> byColumn : cells.values()) {
            for (Map.Entry<String, BigDecimal[]> e : byColumn.entrySet()) {
                BigDecimal v = e.getValue()[0];
                if (v != null) totals.merge(e.getKey(), v, BigDecimal::add);
            }
        }
        Comparator<String> byTotal = Comparator.comparing(k -> totals.getOrDefault(k, BigDecimal.ZERO));
        List<String> ranked = new ArrayList<>(all);
        ranked.sort(filter.top() ? byTotal.reversed() : byTotal);
        Set<String> keep = new TreeSet<>(ranked.subList(0, Math.min(filter.count(), ranked.size())));
        return new ArrayList<>(keep);
    }

    private String label(String columnKey, String dataField) {
        if (layout.columnFields().isEmpty()) return "Sum / " + dataField;
        return layout.dataFields().size() == 1 ? columnKey : columnKey + " | Sum / " + dataField;
    }

    private String columnKey(List<String> row) {
        List<String> parts = new ArrayList<>(layout.columnFields().size());
        for (String f : layout.columnFields()) parts.add(value(row, f));
        return String.join(" / ", parts);
    }

    private String value(List<String> row, String field) {
        int i = index.get(field);
        if (i >= row.size()) return "";
        String v = row.get(i);
        return v == null ? "" : v;
    }

    private void column(String field) {
        if (!index.containsKey(field)) throw new UnknownColumnException(category, field);
    }

    private static BigDecimal plus(BigDecimal a, BigDecimal b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.add(b);
    }

    private static String format(BigDecimal v) {
        return v == null ? "" : v.stripTrailingZeros().toPlainString();
    }
}
