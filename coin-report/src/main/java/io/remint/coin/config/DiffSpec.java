package io.remint.coin.config;

import java.util.List;

/**
 * Which columns of a category to difference between samples.
 *
 * @param id    identity columns; their values select the counter instance a value belongs to
 * @param value columns whose delta to the previous sample of the same instance is appended to each row
 */
public record DiffSpec(List<String> id, List<String> value) {
    public static final String DIFF_PREFIX = "diff_";

    public DiffSpec {
        id = List.copyOf(id);
        value = List.copyOf(value);
    }

    /** Names of the synthetic columns appended to the header, in declaration order. */
    public List<String> diffColumnNames() {
        return value.stream().map(v -> DIFF_PREFIX + v).toList();
    }
}
