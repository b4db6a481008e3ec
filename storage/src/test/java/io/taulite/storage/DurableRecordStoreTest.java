package io.taulite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DurableRecordStoreTest {

    @TempDir Path dataDir;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void latest_value_survives_restart() {
        try (var store = DurableRecordStore.open(dataDir, 1000)) {
            store.put("k", b("v1"));
            store.put("k", b("v2"));
        }

        try (var reopened = DurableRecordStore.open(dataDir, 1000)) {
            assertArrayEquals(b("v2"), reopened.get("k"));
        }
    }

    @Test
    void deletes_survive_restart() {
        try (var store = DurableRecordStore.open(dataDir, 1000)) {
            store.put("gone", b("x"));
            store.put("kept", b("y"));
            store.delete("gone");
        }

        try (var reopened = DurableRecordStore.open(dataDir, 1000)) {
            assertNull(reopened.get("gone"));
            assertEquals(List.of("kept"), reopened.keys(""));
        }
    }

    @Test
    void snapshot_plus_replay_restores_same_keys() throws Exception {
        try (var store = DurableRecordStore.open(dataDir, 3)) {
            for (int i = 0; i < 7; i++) {
                store.put("sequence:s" + i, b("v" + i));
            }
            store.delete("sequence:s0");
        }

        // 8 writes at every 3: two snapshots, older segments dropped
        try (var files = Files.list(dataDir.resolve("snapshots"))) {
            assertEquals(1, files.count());
        }
        try (var reopened = DurableRecordStore.open(dataDir, 3)) {
            assertEquals(List.of("sequence:s1", "sequence:s2", "sequence:s3", "sequence:s4",
                    "sequence:s5", "sequence:s6"), reopened.keys("sequence:"));
            assertArrayEquals(b("v6"), reopened.get("sequence:s6"));
        }
    }

    @Test
    void returned_bytes_are_copies() {
        try (var store = DurableRecordStore.open(dataDir, 1000)) {
            byte[] value = b("abc");
            store.put("k", value);
            value[0] = 'z';
            store.get("k")[1] = 'z';

            assertArrayEquals(b("abc"), store.get("k"));
        }
    }
}
