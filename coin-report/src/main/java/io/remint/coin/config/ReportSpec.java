package io.remint.coin.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Report settings of a category, kept exactly as configured. The assembler forwards it untouched;
 * only a sink that renders reports interprets the keys.
 */
public record ReportSpec(Map<String, Object> properties) {
    public ReportSpec {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(properties.get(key));
    }
}
