package io.remint.coin.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes each category to its own {@code <prefix>_<category>.csv}, created on the category's first row.
 * Has no report capability.
 */
public class CsvRowSink implements RowSink {
    private static final int BUFFER_BYTES = 64 * 1024;

    private final String prefix;
    private final Map<String, BufferedWriter> outputs = new LinkedHashMap<>();
    private final Map<String, Path> files = new LinkedHashMap<>();

    /**
     * @param prefix output path prefix, e.g. {@code out/dbstat} gives {@code out/dbstat_SGASTAT.csv}
     */
    public CsvRowSink(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public void putRow(String category, List<String> fields) throws IOException {
        BufferedWriter w = outputs.get(category);
        if (w == null) {
            Path out = fileFor(category);
            if (out.getParent() != null) Files.createDirectories(out.getParent());
            w = new BufferedWriter(Files.newBufferedWriter(out, StandardCharsets.UTF_8), BUFFER_BYTES);
            outputs.put(category, w);
            files.put(category, out);
        }
        w.write(CsvLines.format(fields));
        w.write('\n');
    }

    @Override
    public void finish() throws IOException {
        closeWriters();
    }

    /** Closes the files written so far; they keep the rows received before the failure. */
    @Override
    public void discard() throws IOException {
        closeWriters();
    }

    private void closeWriters() throws IOException {
        IOException first = null;
        for (BufferedWriter w : outputs.values()) {
            try {
                w.close();
            } catch (IOException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        outputs.clear();
        if (first != null) throw first;
    }

    /** Files written so far, by category. */
    public Map<String, Path> files() { return Map.copyOf(files); }

    Path fileFor(String category) {
        return Path.of(prefix + "_" + safeName(category) + ".csv");
    }

    static String safeName(String category) {
        String s = category.replaceAll("[\\\\/:*?\"<>|\\s]", "_");
        return s.isEmpty() ? "_" : s;
    }
}
