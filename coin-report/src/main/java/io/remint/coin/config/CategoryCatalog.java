package io.remint.coin.config;

import io.remint.coin.error.ConfigException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The configured categories in declaration order, looked up by name.
 */
public final class CategoryCatalog {
    private static final CategoryCatalog EMPTY = new CategoryCatalog(List.of());

    private final List<CategoryConfig> entries;
    private final Map<String, CategoryConfig> byName = new LinkedHashMap<>();

    public CategoryCatalog(List<CategoryConfig> entries) {
        this.entries = List.copyOf(entries);
        for (CategoryConfig c : this.entries) {
            if (byName.putIfAbsent(c.name(), c) != null) {
                throw new ConfigException("Category '" + c.name() + "' is configured more than once");
            }
        }
    }

    public static CategoryCatalog empty() { return EMPTY; }

    public Optional<CategoryConfig> find(String category) {
        return Optional.ofNullable(byName.get(category));
    }

    public Optional<DiffSpec> diff(String category) {
        return find(category).flatMap(CategoryConfig::diff);
    }

    public List<CategoryConfig> entries() { return entries; }

    public int size() { return entries.size(); }
}
