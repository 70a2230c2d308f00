package io.remint.coin;

import java.util.Locale;

/** Output backends selectable on the command line. */
public enum OutputFormat {
    XLS, XLSX, CSV;

    public static OutputFormat parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format '" + name + "' (expected xls, xlsx or csv)", e);
        }
    }

    public boolean isWorkbook() { return this != CSV; }
}
