package io.taulite.storage;

import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the store's key -> bytes map at some point in
 * time. On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records written after it.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current map.
     *
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(Map<String, byte[]> current);

    /** Load the latest snapshot, or null if none was ever written. */
    LoadedSnapshot loadLatest();

    /** Snapshot id and its data. */
    record LoadedSnapshot(String id, Map<String, byte[]> data) {}
}
