package io.taulite.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;

/** Volatile store; contents are lost when the process exits. */
public final class InMemoryRecordStore implements RecordStore {
    private final ConcurrentSkipListMap<String, byte[]> mem = new ConcurrentSkipListMap<>();

    @Override
    public void put(String key, byte[] value) {
        mem.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value").clone());
    }

    @Override
    public byte[] get(String key) {
        byte[] v = mem.get(key);
        return v == null ? null : v.clone();
    }

    @Override
    public void delete(String key) {
        mem.remove(key);
    }

    @Override
    public List<String> keys(String prefix) {
        return prefixScan(mem, prefix);
    }

    @Override
    public void close() {
        // nothing to release
    }

    static List<String> prefixScan(ConcurrentSkipListMap<String, byte[]> map, String prefix) {
        List<String> out = new ArrayList<>();
        for (String k : map.tailMap(prefix, true).keySet()) {
            if (!k.startsWith(prefix)) break;
            out.add(k);
        }
        return out;
    }
}
