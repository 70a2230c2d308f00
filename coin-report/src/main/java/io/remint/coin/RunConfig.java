package io.remint.coin;

import io.remint.coin.table.CategoryFilter;
import io.remint.coin.table.TimeWindow;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

/**
 * Settings of one remint run.
 *
 * @param outputPrefix output file prefix; workbook output goes to {@code <prefix>.xlsx}
 * @param begin        optional lower time bound as text, null for none
 * @param end          optional upper time bound as text, null for none
 * @param categories   categories to output, null for all
 * @param configFile   category configuration, null for the built-in default
 */
public record RunConfig(
        String outputPrefix,
        OutputFormat format,
        String begin,
        String end,
        List<String> categories,
        Path configFile,
        List<Path> inputs,
        ZoneId zone,
        Charset charset
) {
    public RunConfig {
        inputs = List.copyOf(inputs);
        categories = categories == null ? null : List.copyOf(categories);
    }

    /** Zone for timestamps without one: {@code remint.zone}, then {@code REMINT_ZONE}, then the JVM default. */
    public static ZoneId defaultZone() {
        String zone = System.getProperty("remint.zone", System.getenv("REMINT_ZONE"));
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
    }

    public TimeWindow window() {
        return TimeWindow.of(begin, end, zone);
    }

    public CategoryFilter categoryFilter() {
        return CategoryFilter.of(categories);
    }

    public Path workbookFile() {
        return Path.of(outputPrefix.endsWith(".xlsx") ? outputPrefix : outputPrefix + ".xlsx");
    }
}
