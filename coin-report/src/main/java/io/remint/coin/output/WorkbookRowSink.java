package io.remint.coin.output;

import io.remint.coin.config.ReportSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Writes all categories into one XLSX workbook, one worksheet per category in order of first appearance.
 * Rows are buffered per sheet and spooled to a temporary file in batches; the workbook itself is
 * assembled in {@link #finish()}. Pivot reports become an extra sheet right after their category's sheet.
 */
public class WorkbookRowSink implements ReportSink {
    private static final Logger log = LoggerFactory.getLogger(WorkbookRowSink.class);

    static final int BUFFER_ROWS = 1024;
    static final int MAX_SHEET_NAME_LEN = 31;
    static final int MAX_STR_LEN = 254;
    static final int MAX_ROWS = 65536 * 16;

    private final Path file;
    private final int maxRows;
    private final Path spoolDir;
    private final Map<String, SheetSpool> sheets = new LinkedHashMap<>();
    private final Map<String, List<List<String>>> pivots = new LinkedHashMap<>();
    private final Set<String> usedNames = new HashSet<>();
    private boolean finished = false;

    public WorkbookRowSink(Path file) throws IOException {
        this(file, MAX_ROWS);
    }

    WorkbookRowSink(Path file, int maxRows) throws IOException {
        this.file = file;
        this.maxRows = maxRows;
        this.spoolDir = Files.createTempDirectory("remint-sheets");
    }

    @Override
    public void putRow(String category, List<String> fields) throws IOException {
        if (finished) throw new IllegalStateException("workbook already finished");
        SheetSpool sheet = sheets.get(category);
        if (sheet == null) {
            sheet = new SheetSpool(uniqueName(category), spoolDir.resolve("sheet" + sheets.size() + ".csv"));
            sheets.put(category, sheet);
        }
        sheet.add(fields);
    }

    @Override
    public void applyReport(String category, ReportSpec spec) throws IOException {
        SheetSpool sheet = sheets.get(category);
        if (sheet == null) {
            log.debug("No rows for {}, skipping its pivot", category);
            return;
        }
        sheet.flush();
        PivotLayout layout = PivotLayout.from(category, spec);
        PivotSummary summary;
        try (Stream<List<String>> rows = sheet.rows()) {
            Iterator<List<String>> it = rows.iterator();
            List<String> header = it.hasNext() ? it.next() : List.of();
            summary = new PivotSummary(category, header, layout);
            while (it.hasNext()) summary.add(it.next());
        }
        pivots.put(category, summary.render());
        layout.chartType().ifPresent(t -> log.debug("Chart type {} for {} is not rendered", t, category));
    }

    @Override
    public void finish() throws IOException {
        if (finished) return;
        finished = true;
        try (XlsxPackage xlsx = new XlsxPackage(file)) {
            for (Map.Entry<String, SheetSpool> e : sheets.entrySet()) {
                SheetSpool sheet = e.getValue();
                sheet.close();
                try (Stream<List<String>> rows = sheet.rows()) {
                    xlsx.addSheet(sheet.name, rows.iterator(), true);
                } catch (UncheckedIOException u) {
                    throw u.getCause();
                }
                List<List<String>> pivot = pivots.get(e.getKey());
                if (pivot != null) {
                    xlsx.addSheet(uniqueName(("Pivot " + e.getKey()).replace(" ", "")), pivot.iterator(), false);
                }
            }
        } finally {
            deleteSpool();
        }
        log.info("Wrote {} sheets and {} pivots to {}", sheets.size(), pivots.size(), file);
    }

    /** Drops the spooled rows; no workbook is written. */
    @Override
    public void discard() throws IOException {
        finished = true;
        IOException first = null;
        for (SheetSpool sheet : sheets.values()) {
            try {
                sheet.release();
            } catch (IOException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        try {
            deleteSpool();
        } catch (IOException e) {
            if (first == null) first = e; else first.addSuppressed(e);
        }
        if (first != null) throw first;
    }

    Path spoolDir() { return spoolDir; }

    private String uniqueName(String raw) {
        String base = raw.replaceAll("[\\[\\]:*?/\\\\]", "_");
        if (base.isBlank()) base = "Sheet";
        if (base.length() > MAX_SHEET_NAME_LEN) base = base.substring(0, MAX_SHEET_NAME_LEN);
        String name = base;
        for (int n = 2; !usedNames.add(name.toLowerCase(Locale.ROOT)); n++) {
            String suffix = "~" + n;
            name = base.substring(0, Math.min(base.length(), MAX_SHEET_NAME_LEN - suffix.length())) + suffix;
        }
        return name;
    }

    private void deleteSpool() throws IOException {
        if (!Files.exists(spoolDir)) return;
        try (Stream<Path> s = Files.walk(spoolDir)) {
            for (Path p : s.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    /** Buffered rows of one sheet, spooled as CSV lines. */
    private final class SheetSpool {
        private final String name;
        private final Path spool;
        private final List<List<String>> buffer = new ArrayList<>(BUFFER_ROWS);
        private BufferedWriter writer;
        private int rows = 0; // rows flushed so far

        SheetSpool(String name, Path spool) {
            this.name = name;
            this.spool = spool;
        }

        void add(List<String> fields) throws IOException {
            List<String> row = new ArrayList<>(fields.size());
            for (String f : fields) {
                row.add(f != null && f.length() > MAX_STR_LEN ? f.substring(0, MAX_STR_LEN) : f);
            }
            buffer.add(row);
            if (buffer.size() >= BUFFER_ROWS) flush();
        }

        void flush() throws IOException {
            if (buffer.isEmpty() || rows >= maxRows) {
                buffer.clear();
                return;
            }
            int room = maxRows - rows;
            if (buffer.size() > room) {
                log.warn("Sheet {} exceeded {} rows, omitting \"{}\"...", name, maxRows, String.join(", ", nonNull(buffer.get(room))));
            }
            if (writer == null) writer = Files.newBufferedWriter(spool, StandardCharsets.UTF_8);
            int n = Math.min(room, buffer.size());
            for (int i = 0; i < n; i++) {
                writer.write(CsvLines.format(buffer.get(i)));
                writer.write('\n');
            }
            writer.flush();
            rows += n;
            buffer.clear();
        }

        void close() throws IOException {
            flush();
            release();
        }

        void release() throws IOException {
            buffer.clear();
            if (writer != null) {
                writer.close();
                writer = null;
            }
        }

        Stream<List<String>> rows() throws IOException {
            if (!Files.exists(spool)) return Stream.empty();
            BufferedReader reader = Files.newBufferedReader(spool, StandardCharsets.UTF_8);
            return reader.lines().map(CsvLines::parse).onClose(() -> {
                try {
                    reader.close();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        }

        private List<String> nonNull(List<String> row) {
            return row.stream().map(v -> v == null ? "" : v).toList();
        }
    }
}
