package io.remint.coin.table;

import io.remint.coin.config.DiffSpec;
import io.remint.coin.error.UnknownColumnException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Headers of the categories seen so far, recorded the first time each category is detected.
 * Later headers of the same category are ignored; column lookups always use the first one.
 */
public class HeaderRegistry {
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final Map<String, Map<String, Integer>> indexes = new HashMap<>();

    /**
     * Records the header of {@code category} unless it is already known.
     *
     * @param headerFields column names read from the header line
     * @param diffColumns  synthetic diff columns appended after them, see {@link DiffSpec#diffColumnNames()}
     * @return the full header if the category was new, empty otherwise
     */
    public Optional<List<String>> recordIfNew(String category, List<String> headerFields, List<String> diffColumns) {
        if (headers.containsKey(category)) return Optional.empty();
        List<String> full = new ArrayList<>(headerFields.size() + diffColumns.size());
        full.addAll(headerFields);
        full.addAll(diffColumns);
        List<String> header = Collections.unmodifiableList(full);

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.size(); i++) index.putIfAbsent(header.get(i), i);
        headers.put(category, header);
        indexes.put(category, index);
        return Optional.of(header);
    }

    /** Position of {@code field} in the recorded header of {@code category}; first match wins. */
    public int columnIndex(String category, String field) {
        Map<String, Integer> index = indexes.get(category);
        Integer i = index == null ? null : index.get(field);
        if (i == null) throw new UnknownColumnException(category, field);
        return i;
    }

    public Optional<List<String>> header(String category) {
        return Optional.ofNullable(headers.get(category));
    }

    public boolean contains(String category) { return headers.containsKey(category); }

    public Set<String> categories() { return Collections.unmodifiableSet(headers.keySet()); }
}
