package io.remint.coin.config;

import io.remint.coin.error.ConfigException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads the category configuration: a YAML list of {@code name}/{@code diff}/{@code pivot} entries.
 * The document is validated once here so that the assembler never has to re-check its shape.
 */
public final class CategoryConfigLoader {
    /** Classpath resource used when no configuration file is given. */
    public static final String DEFAULT_RESOURCE = "default-categories.yaml";

    private CategoryConfigLoader() {}

    public static CategoryCatalog load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        }
    }

    public static CategoryCatalog loadDefault() throws IOException {
        InputStream in = CategoryConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new IOException("Missing classpath resource " + DEFAULT_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, DEFAULT_RESOURCE);
        }
    }

    public static CategoryCatalog parse(Reader reader, String origin) {
        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (YAMLException ex) {
            throw new ConfigException("Failed to parse YAML config at " + origin, ex);
        }
        if (document == null) {
            return CategoryCatalog.empty();
        }
        if (!(document instanceof List<?> items)) {
            throw new ConfigException(origin + ": top level must be a list of categories");
        }
        List<CategoryConfig> entries = new ArrayList<>(items.size());
        int index = 0;
        for (Object item : items) {
            entries.add(entry(asMap(item, origin + "[" + index + "]"), origin + "[" + index + "]"));
            index++;
        }
        return new CategoryCatalog(entries);
    }

    private static CategoryConfig entry(Map<String, Object> map, String context) {
        Object name = map.get("name");
        if (name == null || name instanceof Map<?, ?> || name instanceof List<?> || name.toString().isBlank()) {
            throw new ConfigException(context + ": 'name' is required");
        }
        String category = name.toString();
        String where = context + " (" + category + ")";

        Optional<DiffSpec> diff = Optional.empty();
        if (map.get("diff") != null) {
            Map<String, Object> d = asMap(map.get("diff"), where + ".diff");
            List<String> id = stringList(d.get("id"), where + ".diff.id");
            List<String> value = stringList(d.get("value"), where + ".diff.value");
            if (value.isEmpty()) {
                throw new ConfigException(where + ".diff.value must name at least one column");
            }
            diff = Optional.of(new DiffSpec(id, value));
        }

        Optional<ReportSpec> pivot = Optional.empty();
        if (map.get("pivot") != null) {
            pivot = Optional.of(new ReportSpec(asMap(map.get("pivot"), where + ".pivot")));
        }
        return new CategoryConfig(category, diff, pivot);
    }

    private static Map<String, Object> asMap(Object node, String context) {
        if (!(node instanceof Map<?, ?> raw)) {
            throw new ConfigException(context + " must be a mapping");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new ConfigException(context + " contains non-string key " + entry.getKey());
            }
            map.put(key, entry.getValue());
        }
        return map;
    }

    private static List<String> stringList(Object node, String context) {
        if (node == null) return List.of();
        if (!(node instanceof List<?> raw)) {
            throw new ConfigException(context + " must be a list");
        }
        List<String> out = new ArrayList<>(raw.size());
        for (Object o : raw) {
            if (o == null || o instanceof Map<?, ?> || o instanceof List<?>) {
                throw new ConfigException(context + " must contain column names only");
            }
            out.add(o.toString());
        }
        return out;
    }
}
