package io.remint.coin.table;

import io.remint.coin.config.ReportSpec;
import io.remint.coin.output.ReportSink;
import io.remint.coin.output.RowSink;

import java.util.ArrayList;
import java.util.List;

/** Collects what the assembler emits. */
class RecordingSink implements RowSink {
    record Row(String category, List<String> fields) {}

    final List<Row> rows = new ArrayList<>();
    int finishes;
    int discards;

    @Override
    public void putRow(String category, List<String> fields) {
        rows.add(new Row(category, new ArrayList<>(fields)));
    }

    @Override
    public void finish() { finishes++; }

    @Override
    public void discard() { discards++; }

    List<List<String>> fieldsOf(String category) {
        return rows.stream().filter(r -> r.category().equals(category)).map(Row::fields).toList();
    }

    static class Reporting extends RecordingSink implements ReportSink {
        final List<String> reports = new ArrayList<>();

        @Override
        public void applyReport(String category, ReportSpec spec) {
            if (finishes > 0) throw new IllegalStateException("report after finish");
            reports.add(category);
        }
    }
}
