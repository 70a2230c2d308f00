package io.remint.coin.table;

import io.remint.coin.config.DiffSpec;
import io.remint.coin.error.UnknownColumnException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.function.ToIntFunction;

import static org.junit.jupiter.api.Assertions.*;

public class DiffEngineTest {
    private static final List<String> HEADER = List.of("CNAME", "PTIME", "POOL", "NAME", "BYTES", "GETS");

    private static ToIntFunction<String> index() {
        return f -> {
            int i = HEADER.indexOf(f);
            if (i < 0) throw new UnknownColumnException("SGASTAT", f);
            return i;
        };
    }

    private static List<String> row(String pool, String name, String bytes, String gets) {
        return List.of("SGASTAT", "2009-03-20 15:30:00", pool, name, bytes, gets);
    }

    @Test
    void first_sample_is_undefined_then_deltas() {
        var engine = new DiffEngine();
        var spec = new DiffSpec(List.of("POOL", "NAME"), List.of("BYTES"));
        List<String> d1 = engine.diff("SGASTAT", row("shared pool", "free memory", "100", "0"), index(), spec);
        List<String> d2 = engine.diff("SGASTAT", row("shared pool", "free memory", "130", "0"), index(), spec);
        List<String> d3 = engine.diff("SGASTAT", row("shared pool", "free memory", "125", "0"), index(), spec);
        assertNull(d1.get(6));
        assertEquals("30", d2.get(6));
        assertEquals("-5", d3.get(6));
        assertEquals(7, d3.size());
    }

    @Test
    void identity_tuples_are_tracked_separately() {
        var engine = new DiffEngine();
        var spec = new DiffSpec(List.of("POOL", "NAME"), List.of("BYTES"));
        engine.diff("SGASTAT", row("shared pool", "a", "10", "0"), index(), spec);
        assertNull(engine.diff("SGASTAT", row("large pool", "a", "50", "0"), index(), spec).get(6));
        assertEquals("5", engine.diff("SGASTAT", row("shared pool", "a", "15", "0"), index(), spec).get(6));
        assertEquals("-10", engine.diff("SGASTAT", row("large pool", "a", "40", "0"), index(), spec).get(6));
        assertEquals(2, engine.trackedKeys());
    }

    @Test
    void several_value_columns_are_appended_in_declared_order() {
        var engine = new DiffEngine();
        var spec = new DiffSpec(List.of("NAME"), List.of("GETS", "BYTES"));
        engine.diff("SGASTAT", row("p", "n", "100", "7"), index(), spec);
        List<String> out = engine.diff("SGASTAT", row("p", "n", "160", "10"), index(), spec);
        assertEquals(List.of("3", "60"), out.subList(6, 8));
    }

    @Test
    void non_numeric_values_count_as_zero() {
        var engine = new DiffEngine();
        var spec = new DiffSpec(List.of(), List.of("BYTES"));
        engine.diff("SGASTAT", row("p", "n", "n/a", "0"), index(), spec);
        assertEquals("42", engine.diff("SGASTAT", row("p", "n", "42", "0"), index(), spec).get(6));
        assertEquals("-42", engine.diff("SGASTAT", row("p", "n", "", "0"), index(), spec).get(6));
    }

    @Test
    void empty_identity_keeps_one_previous_value_per_column() {
        var engine = new DiffEngine();
        var spec = new DiffSpec(List.of(), List.of("BYTES"));
        List<String> out = engine.diff("SGASTAT", Arrays.asList("SGASTAT", "t", "p", "n", "1", "0"), index(), spec);
        assertEquals(Arrays.asList("SGASTAT", "t", "p", "n", "1", "0", null), out);
    }

    @Test
    void unknown_identity_column_propagates() {
        var engine = new DiffEngine();
        var spec = new DiffSpec(List.of("SUBPOOL#"), List.of("BYTES"));
        assertThrows(UnknownColumnException.class, () -> engine.diff("SGASTAT", row("p", "n", "1", "0"), index(), spec));
    }

    @Test
    void lenient_integer_parsing() {
        assertEquals(BigInteger.valueOf(12), DiffEngine.toInteger("12abc"));
        assertEquals(BigInteger.valueOf(-5), DiffEngine.toInteger("  -5"));
        assertEquals(BigInteger.valueOf(7), DiffEngine.toInteger("+7"));
        assertEquals(BigInteger.ONE, DiffEngine.toInteger("1.9"));
        assertEquals(BigInteger.ZERO, DiffEngine.toInteger("abc"));
        assertEquals(BigInteger.ZERO, DiffEngine.toInteger(null));
        assertEquals(new BigInteger("123456789012345678901234"), DiffEngine.toInteger("123456789012345678901234"));
    }
}
