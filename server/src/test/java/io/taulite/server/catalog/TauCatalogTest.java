package io.taulite.server.catalog;

import io.taulite.core.Delta;
import io.taulite.core.Sequence;
import io.taulite.core.ValidationException;
import io.taulite.core.expr.ExpressionException;
import io.taulite.core.lens.LensException;
import io.taulite.storage.DurableRecordStore;
import io.taulite.storage.InMemoryRecordStore;
import io.taulite.storage.RecordStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Catalog behavior over an in-memory store, plus restart over a durable one.
 */
class TauCatalogTest {

    @TempDir Path dataDir;

    private static List<Delta> deltas(double... values) {
        List<Delta> out = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            out.add(Delta.create(values[i], i * 10L, (i + 1) * 10L));
        }
        return out;
    }

    private static List<Double> values(Sequence s) {
        return s.deltas().stream().map(Delta::value).toList();
    }

    /** Store whose writes can be switched to fail. */
    private static final class FlakyStore implements RecordStore {
        final InMemoryRecordStore inner = new InMemoryRecordStore();
        boolean failWrites;

        @Override public void put(String key, byte[] value) {
            if (failWrites) throw new UncheckedIOException(new IOException("disk full"));
            inner.put(key, value);
        }

        @Override public byte[] get(String key) { return inner.get(key); }

        @Override public void delete(String key) {
            if (failWrites) throw new UncheckedIOException(new IOException("disk full"));
            inner.delete(key);
        }

        @Override public List<String> keys(String prefix) { return inner.keys(prefix); }

        @Override public void close() { }
    }

    private static CatalogException.Reason reason(Runnable r) {
        return assertThrows(CatalogException.class, r::run).reason();
    }

    @Test
    void series_lifecycle() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("temperature", deltas(22.5));
        catalog.append("temperature", deltas(1, 2));

        assertEquals(3, catalog.series("temperature").size());
        assertEquals(List.of("temperature"), catalog.listSeries());

        catalog.dropSeries("temperature");
        assertEquals(CatalogException.Reason.SERIES_NOT_FOUND, reason(() -> catalog.queryPoint("temperature", 0)));
        assertEquals(CatalogException.Reason.SERIES_NOT_FOUND, reason(() -> catalog.dropSeries("temperature")));
    }

    @Test
    void duplicate_and_unknown_labels_are_rejected() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("pressure", deltas(1));

        assertEquals(CatalogException.Reason.SERIES_ALREADY_EXISTS, reason(() -> catalog.createSeries("pressure", deltas(2))));
        assertEquals(CatalogException.Reason.SERIES_NOT_FOUND, reason(() -> catalog.append("nope", deltas(1))));
    }

    @Test
    void labels_are_validated() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);

        assertEquals(CatalogException.Reason.INVALID_LABEL, reason(() -> catalog.createSeries("", deltas(1))));
        assertEquals(CatalogException.Reason.INVALID_LABEL, reason(() -> catalog.createSeries("a/b", deltas(1))));
        assertEquals(CatalogException.Reason.INVALID_LABEL, reason(() -> catalog.createSeries("x".repeat(33), deltas(1))));
        catalog.createSeries("x".repeat(32), deltas(1));
    }

    @Test
    void capacity_is_enforced() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 1);
        catalog.createSeries("a", deltas(1));

        assertEquals(CatalogException.Reason.CATALOG_FULL, reason(() -> catalog.createSeries("b", deltas(1))));
    }

    @Test
    void point_query_and_range() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("s", deltas(1, 2, 3));

        assertEquals(2.0, catalog.queryPoint("s", 15).orElseThrow().value());
        assertTrue(catalog.queryPoint("s", 30).isEmpty());
        assertEquals(2, catalog.range("s", 5, 15).size());
        assertEquals(ValidationException.Reason.INVALID_INTERVAL,
                assertThrows(ValidationException.class, () -> catalog.range("s", 15, 15)).reason());
    }

    @Test
    void builtin_lens_tracks_appends() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("celsius", deltas(0, 100));
        catalog.createLens("fahrenheit", "celsius", "celsius_to_fahrenheit");

        assertEquals(List.of(32.0, 212.0), values(catalog.applyLens("fahrenheit")));

        catalog.append("celsius", List.of(Delta.create(-40.0, 20, 30)));
        assertEquals(-40.0, catalog.queryLens("fahrenheit", 25).orElseThrow().value());
        assertTrue(catalog.queryLens("fahrenheit", 30).isEmpty());
    }

    @Test
    void unknown_transform_and_missing_source_are_rejected() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("s", deltas(1));

        assertEquals(CatalogException.Reason.UNKNOWN_TRANSFORM, reason(() -> catalog.createLens("l", "s", "squish")));
        assertEquals(CatalogException.Reason.SERIES_NOT_FOUND, reason(() -> catalog.createLens("l", "nope", "identity")));
    }

    @Test
    void returns_transform_over_prices() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("price", deltas(100, 110, 99));
        catalog.createLens("ret", "price", "returns");

        var out = values(catalog.applyLens("ret"));
        assertEquals(0.0, out.get(0), 1e-12);
        assertEquals(0.1, out.get(1), 1e-12);
        assertEquals(-0.1, out.get(2), 1e-12);
    }

    @Test
    void defined_lens_aligns_inputs_and_checks_syntax() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("a", deltas(1, 2, 3));
        catalog.createSeries("b", deltas(10, 20));
        var inputs = new LinkedHashMap<String, String>();
        inputs.put("a", "a");
        inputs.put("b", "b");

        catalog.defineLens("sum", "a plus b", "a + b", inputs);
        assertEquals(List.of(11.0, 22.0), values(catalog.applyLens("sum")));

        assertThrows(ExpressionException.class, () -> catalog.defineLens("bad", "d", "a +", inputs));
        assertEquals(CatalogException.Reason.LENS_ALREADY_EXISTS,
                reason(() -> catalog.defineLens("sum", "again", "a", Map.of("a", "a"))));
    }

    @Test
    void dropped_series_makes_lens_fail_with_missing_input() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("s", deltas(1));
        catalog.createLens("l", "s", "double");
        catalog.dropSeries("s");

        assertEquals(LensException.Reason.MISSING_INPUT,
                assertThrows(LensException.class, () -> catalog.applyLens("l")).reason());

        // a new series under the same label is a different generation
        catalog.createSeries("s", deltas(5));
        assertEquals(LensException.Reason.MISSING_INPUT,
                assertThrows(LensException.class, () -> catalog.applyLens("l")).reason());
    }

    @Test
    void compose_uses_first_inputs_and_second_expression() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("s", deltas(1, 2));
        catalog.createLens("neg", "s", "negate");
        catalog.defineLens("scale", "times ten", "x * 10", Map.of("x", "s"));

        catalog.composeLens("both", "neg", "scale");

        assertEquals("compose(neg, scale)", catalog.lensDefinition("both").description());
        assertEquals(List.of(10.0, 20.0), values(catalog.applyLens("both")));
    }

    @Test
    void groups_snapshot_members_and_apply_lenses() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("a", deltas(1));
        catalog.createSeries("b", deltas(2));
        catalog.createGroup("g", List.of("a", "b"));
        catalog.append("a", deltas(9));

        assertEquals(1, catalog.group("g").get(0).size());
        assertEquals(3, catalog.appendToGroup("g", List.of("a")));

        catalog.createLens("dbl", "a", "double");
        var out = catalog.applyLensToGroup("dbl", "g");
        assertEquals(List.of("dbl/a", "dbl/b", "dbl/a"), out.sequences().stream().map(Sequence::name).toList());
        assertEquals(List.of(4.0), values(out.get(1)));

        catalog.dropGroup("g");
        assertEquals(CatalogException.Reason.GROUP_NOT_FOUND, reason(() -> catalog.group("g")));
    }

    @Test
    void reopening_restores_series_groups_and_lenses() {
        try (var catalog = new TauCatalog(DurableRecordStore.open(dataDir, 1000), 10)) {
            catalog.createSeries("s", deltas(1, 2));
            catalog.createSeries("gone", deltas(3));
            catalog.createGroup("g", List.of("s"));
            catalog.createLens("ret", "s", "returns");
            catalog.createLens("orphan", "gone", "identity");
            catalog.dropSeries("gone");
        }

        try (var reopened = new TauCatalog(DurableRecordStore.open(dataDir, 1000), 10)) {
            assertEquals(List.of("s"), reopened.listSeries());
            assertEquals(1, reopened.group("g").size());
            assertEquals(List.of("orphan", "ret"), reopened.listLenses());
            assertEquals(List.of(0.0, 1.0), values(reopened.applyLens("ret")));
            assertEquals(LensException.Reason.MISSING_INPUT,
                    assertThrows(LensException.class, () -> reopened.applyLens("orphan")).reason());
        }
    }

    @Test
    void builtin_lens_on_group_follows_each_member() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("src", deltas(1, 1));
        catalog.createSeries("price", deltas(100, 110));
        catalog.createSeries("slow", List.of(Delta.create(7.0, 0L, 5_000_000_000L)));
        catalog.createGroup("g", List.of("price"));
        catalog.createGroup("spans", List.of("slow"));
        catalog.createLens("r", "src", "returns");
        catalog.createLens("secs", "src", "interval_seconds");

        var returns = catalog.applyLensToGroup("r", "g");
        assertEquals("r/price", returns.get(0).name());
        assertEquals(List.of(0.0, 0.1), values(returns.get(0)));

        var secs = catalog.applyLensToGroup("secs", "spans");
        assertEquals(List.of(5.0), values(secs.get(0)));
        assertEquals(5_000_000_000L, secs.get(0).get(0).validUntilNs());
    }

    @Test
    void failed_write_leaves_entries_unchanged() {
        var store = new FlakyStore();
        var catalog = new TauCatalog(store, 10);
        catalog.createSeries("s", deltas(1));
        catalog.createGroup("g", List.of("s"));

        store.failWrites = true;
        assertThrows(UncheckedIOException.class, () -> catalog.append("s", deltas(2)));
        assertThrows(UncheckedIOException.class, () -> catalog.appendToGroup("g", List.of("s")));
        assertThrows(UncheckedIOException.class, () -> catalog.dropSeries("s"));

        assertEquals(1, catalog.series("s").size());
        assertEquals(1, catalog.group("g").size());
        assertEquals(List.of("s"), catalog.listSeries());

        store.failWrites = false;
        var reopened = new TauCatalog(store, 10);
        assertEquals(1, reopened.series("s").size());
        assertEquals(1, reopened.group("g").size());
    }

    @Test
    void null_labels_are_reported_as_not_found() {
        var catalog = new TauCatalog(new InMemoryRecordStore(), 10);
        catalog.createSeries("s", deltas(1));
        catalog.createLens("l", "s", "identity");

        Map<String, String> unbound = new HashMap<>();
        unbound.put("a", null);

        assertEquals(CatalogException.Reason.LENS_NOT_FOUND, reason(() -> catalog.composeLens("c", null, "l")));
        assertEquals(CatalogException.Reason.SERIES_NOT_FOUND, reason(() -> catalog.createLens("m", null, "identity")));
        assertEquals(CatalogException.Reason.SERIES_NOT_FOUND,
                reason(() -> catalog.createGroup("g", Arrays.asList("s", null))));
        assertEquals(CatalogException.Reason.SERIES_NOT_FOUND,
                reason(() -> catalog.defineLens("d", "desc", "a", unbound)));
        assertEquals(CatalogException.Reason.SERIES_NOT_FOUND, reason(() -> catalog.series(null)));
        assertEquals(List.of("l"), catalog.listLenses());
    }
}
