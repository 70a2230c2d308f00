package io.remint.coin.table;

import java.util.Collection;
import java.util.Set;

/**
 * Which categories reach the output. Filtering applies to emission only; headers and diff state
 * are tracked for every category.
 */
public final class CategoryFilter {
    private static final CategoryFilter ALL = new CategoryFilter(null);

    private final Set<String> names; // null means every category

    private CategoryFilter(Set<String> names) {
        this.names = names;
    }

    public static CategoryFilter all() { return ALL; }

    public static CategoryFilter only(Collection<String> names) {
        return new CategoryFilter(Set.copyOf(names));
    }

    /** {@link #all()} when {@code names} is null, otherwise {@link #only(Collection)}. */
    public static CategoryFilter of(Collection<String> names) {
        return names == null ? ALL : only(names);
    }

    public boolean accepts(String category) {
        return names == null || names.contains(category);
    }

    @Override
    public String toString() {
        return names == null ? "all" : names.toString();
    }
}
