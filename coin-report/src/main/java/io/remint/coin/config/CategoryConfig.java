package io.remint.coin.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-category declaration: an optional diff spec and an optional report spec.
 */
public record CategoryConfig(String name, Optional<DiffSpec> diff, Optional<ReportSpec> pivot) {
    public CategoryConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(diff, "diff");
        Objects.requireNonNull(pivot, "pivot");
    }

    public static CategoryConfig plain(String name) {
        return new CategoryConfig(name, Optional.empty(), Optional.empty());
    }
}
