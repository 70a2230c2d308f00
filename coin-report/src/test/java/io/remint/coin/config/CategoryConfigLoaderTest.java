package io.remint.coin.config;

import io.remint.coin.error.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CategoryConfigLoaderTest {
    private static CategoryCatalog parse(String yaml) {
        return CategoryConfigLoader.parse(new StringReader(yaml), "test.yaml");
    }

    @Test
    void reads_entries_in_order() {
        CategoryCatalog catalog = parse("""
                - name: SYSTEM_EVENT
                  diff:
                    id: [EVENT]
                    value: [TOTAL_WAITS, TIME_WAITED_MICRO]
                - name: SYSSTAT
                - name: SGASTAT
                  pivot:
                    RowField: PTIME
                    DataField: [diff_BYTES]
                """);
        assertEquals(List.of("SYSTEM_EVENT", "SYSSTAT", "SGASTAT"),
                catalog.entries().stream().map(CategoryConfig::name).toList());

        DiffSpec diff = catalog.diff("SYSTEM_EVENT").orElseThrow();
        assertEquals(List.of("EVENT"), diff.id());
        assertEquals(List.of("diff_TOTAL_WAITS", "diff_TIME_WAITED_MICRO"), diff.diffColumnNames());
        assertTrue(catalog.find("SYSSTAT").orElseThrow().diff().isEmpty());
        assertEquals("PTIME", catalog.find("SGASTAT").orElseThrow().pivot().orElseThrow().get("RowField").orElseThrow());
        assertTrue(catalog.find("UNKNOWN").isEmpty());
    }

    @Test
    void missing_id_means_a_single_instance() {
        DiffSpec diff = parse("- name: FOO\n  diff:\n    value: [VAL]\n").diff("FOO").orElseThrow();
        assertEquals(List.of(), diff.id());
        assertEquals(List.of("VAL"), diff.value());
    }

    @Test
    void empty_document_is_an_empty_catalog() {
        assertEquals(0, parse("").size());
        assertEquals(0, parse("# nothing configured\n").size());
    }

    @Test
    void malformed_documents_are_rejected() {
        assertThrows(ConfigException.class, () -> parse("name: FOO\n"));
        assertThrows(ConfigException.class, () -> parse("- diff: {value: [VAL]}\n"));
        assertThrows(ConfigException.class, () -> parse("- name: FOO\n  diff: [VAL]\n"));
        assertThrows(ConfigException.class, () -> parse("- name: FOO\n  diff: {id: EVENT, value: [VAL]}\n"));
        assertThrows(ConfigException.class, () -> parse("- name: FOO\n  diff: {id: [EVENT], value: []}\n"));
        assertThrows(ConfigException.class, () -> parse("- name: FOO\n  pivot: PTIME\n"));
        assertThrows(ConfigException.class, () -> parse("- name: FOO\n- name: FOO\n"));
        assertThrows(ConfigException.class, () -> parse("- name: [FOO\n"));
    }

    @Test
    void error_messages_name_the_entry() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> parse("- name: FOO\n- name: BAR\n  diff: {value: VAL}\n"));
        assertTrue(e.getMessage().contains("BAR"), e.getMessage());
        assertTrue(e.getMessage().contains("test.yaml"), e.getMessage());
    }

    @Test
    void loads_from_a_file(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("categories.yaml");
        Files.writeString(file, "- name: FOO\n  diff:\n    id: [NAME]\n    value: [VAL]\n");
        CategoryCatalog catalog = CategoryConfigLoader.load(file);
        assertEquals(1, catalog.size());
        assertEquals(List.of("NAME"), catalog.diff("FOO").orElseThrow().id());
    }

    @Test
    void built_in_default_covers_database_and_os_categories() throws IOException {
        CategoryCatalog catalog = CategoryConfigLoader.loadDefault();
        assertEquals(List.of("SGASTAT", "KSMSS", "SYSSTAT", "SYSTEM_EVENT", "OSSTAT", "SYS_TIME_MODEL",
                        "MEMORY_DYNAMIC_COMPONENTS", "ENQUEUE_STAT", "MPSTAT", "MEMINFO", "IOSTAT", "NETSTAT", "IPROUTE"),
                catalog.entries().stream().map(CategoryConfig::name).toList());
        for (CategoryConfig c : catalog.entries()) {
            ReportSpec pivot = c.pivot().orElseThrow(() -> new AssertionError(c.name() + " has no pivot"));
            assertEquals("CTIMESTAMP", pivot.get("RowField").orElseThrow(), c.name());
        }

        assertEquals(List.of("POOL", "NAME"), catalog.diff("SGASTAT").orElseThrow().id());
        assertEquals(List.of("SUBPOOL#", "NAME"), catalog.diff("KSMSS").orElseThrow().id());
        assertEquals(List.of("diff_TOTAL_WAITS", "diff_TIME_WAITED_MICRO"),
                catalog.diff("SYSTEM_EVENT").orElseThrow().diffColumnNames());
        assertEquals(10, catalog.diff("NETSTAT").orElseThrow().value().size());
        assertEquals(12, catalog.diff("IPROUTE").orElseThrow().value().size());
        assertTrue(catalog.diff("MPSTAT").isEmpty());
        assertEquals("(All)", catalog.find("SYSTEM_EVENT").orElseThrow().pivot().orElseThrow().get("CurrentPage").orElseThrow());
        assertEquals("1", catalog.find("SYSSTAT").orElseThrow().pivot().orElseThrow().get("CurrentPage").orElseThrow().toString());
    }
}
