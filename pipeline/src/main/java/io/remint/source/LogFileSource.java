package io.remint.source;

import io.remint.core.Record;
import io.remint.core.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;

/**
 * Streams the lines of a list of files, one file after another in the order given.
 * Each file is read as gzip when it decompresses and as plain text otherwise, so compressed and
 * uncompressed copies of the same log yield the same lines. Line terminators are removed.
 * <p>
 * Record seq is the global line number (0-based) and subSeq the index of the file in the list.
 */
public class LogFileSource implements Source<String> {
    private static final Logger log = LoggerFactory.getLogger(LogFileSource.class);
    private static final int PROBE_LIMIT = 8192;

    private final List<Path> files;
    private final Charset charset;
    private int fileIdx = 0;
    private BufferedReader current;
    private long lineInFile = 0;
    private long globalSeq = 0;

    public LogFileSource(List<Path> files) {
        this(files, StandardCharsets.UTF_8);
    }

    public LogFileSource(List<Path> files, Charset charset) {
        this.files = List.copyOf(files);
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public Optional<Record<String>> poll() {
        try {
            while (true) {
                if (current == null) {
                    if (fileIdx >= files.size()) return Optional.empty();
                    current = open(files.get(fileIdx));
                    lineInFile = 0;
                }
                String line = current.readLine();
                if (line == null) {
                    current.close();
                    current = null;
                    fileIdx++;
                    continue;
                }
                lineInFile++;
                return Optional.of(new Record<>(globalSeq++, fileIdx, line));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + files.get(fileIdx), e);
        }
    }

    @Override
    public boolean isFinished() {
        return fileIdx >= files.size() && current == null;
    }

    @Override
    public String position() {
        if (files.isEmpty()) return "";
        int idx = Math.min(fileIdx, files.size() - 1);
        return files.get(idx) + ":" + lineInFile;
    }

    @Override
    public void close() throws IOException {
        if (current != null) {
            current.close();
            current = null;
        }
        fileIdx = files.size();
    }

    private BufferedReader open(Path path) throws IOException {
        InputStream raw = new BufferedInputStream(Files.newInputStream(path), PROBE_LIMIT);
        raw.mark(PROBE_LIMIT);
        try {
            InputStream gz = new GZIPInputStream(raw);
            log.debug("Reading {} as gzip", path);
            return new BufferedReader(new InputStreamReader(gz, charset));
        } catch (ZipException | EOFException notGzip) {
            // not compressed: rewind to the first byte and read as text
            raw.reset();
            log.debug("Reading {} as plain text ({})", path, notGzip.getMessage());
            return new BufferedReader(new InputStreamReader(raw, charset));
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }
}
