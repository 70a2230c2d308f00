package io.remint.source;

import io.remint.core.Record;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class LogFileSourceTest {
    @TempDir
    Path dir;

    @Test
    void reads_files_in_given_order_and_numbers_lines() throws Exception {
        Path b = dir.resolve("b.log");
        Path a = dir.resolve("a.log");
        Files.writeString(b, "b1\nb2\n");
        Files.writeString(a, "a1\r\na2");
        var src = new LogFileSource(List.of(b, a));

        List<Record<String>> out = drain(src);
        assertEquals(List.of("b1", "b2", "a1", "a2"), out.stream().map(Record::payload).toList());
        assertEquals(List.of(0L, 1L, 2L, 3L), out.stream().map(Record::seq).toList());
        assertEquals(List.of(0, 0, 1, 1), out.stream().map(Record::subSeq).toList());
        assertTrue(src.isFinished());
        assertTrue(src.poll().isEmpty());
    }

    @Test
    void gzip_and_plain_yield_identical_lines() throws Exception {
        String content = "CNAME PTIME     VAL\n----- --------- ---\nFOO   1000000000  5\n";
        Path plain = dir.resolve("dbstat.log");
        Path gz = dir.resolve("dbstat.log.gz");
        Files.writeString(plain, content);
        try (OutputStream os = new GZIPOutputStream(Files.newOutputStream(gz))) {
            os.write(content.getBytes(StandardCharsets.UTF_8));
        }

        List<String> fromPlain = drain(new LogFileSource(List.of(plain))).stream().map(Record::payload).toList();
        List<String> fromGzip = drain(new LogFileSource(List.of(gz))).stream().map(Record::payload).toList();
        assertEquals(3, fromPlain.size());
        assertEquals(fromPlain, fromGzip);
    }

    @Test
    void empty_file_produces_no_lines() throws Exception {
        Path empty = dir.resolve("empty.log");
        Files.writeString(empty, "");
        Path one = dir.resolve("one.log");
        Files.writeString(one, "x");
        assertEquals(List.of("x"), drain(new LogFileSource(List.of(empty, one))).stream().map(Record::payload).toList());
    }

    @Test
    void position_names_file_and_line() throws Exception {
        Path f = dir.resolve("pos.log");
        Files.writeString(f, "l1\nl2\n");
        var src = new LogFileSource(List.of(f));
        src.poll();
        src.poll();
        assertEquals(f + ":2", src.position());
    }

    @Test
    void missing_file_is_an_error() {
        var src = new LogFileSource(List.of(dir.resolve("missing.log")));
        assertThrows(UncheckedIOException.class, src::poll);
    }

    private static List<Record<String>> drain(LogFileSource src) throws Exception {
        List<Record<String>> out = new ArrayList<>();
        try (src) {
            while (!src.isFinished()) {
                src.poll().ifPresent(out::add);
            }
        }
        return out;
    }
}
