package io.taulite.storage;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordStoreTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void lists_keys_by_prefix_in_order() {
        var store = new InMemoryRecordStore();
        store.put("lens:b", b("1"));
        store.put("lens:a", b("2"));
        store.put("group:x", b("3"));

        assertEquals(List.of("lens:a", "lens:b"), store.keys("lens:"));
        assertEquals(List.of("group:x", "lens:a", "lens:b"), store.keys(""));
    }

    @Test
    void delete_removes_and_absent_delete_is_noop() {
        var store = new InMemoryRecordStore();
        store.put("k", b("v"));
        store.delete("k");
        store.delete("missing");

        assertNull(store.get("k"));
        assertTrue(store.keys("").isEmpty());
    }
}
