package io.taulite.storage;

import java.util.List;

/**
 * Minimal synchronous byte store used by the catalog.
 * <p>
 * Semantics:
 *  - put() and delete() are durable before returning when the implementation
 *    is durable at all.
 *  - get() returns the latest bytes stored under the key, or null if absent.
 *  - Values are copied on the way in and on the way out.
 */
public interface RecordStore extends AutoCloseable {

    /** Store {@code value} under {@code key}, replacing any previous value. */
    void put(String key, byte[] value);

    /** @return the stored bytes, or null if the key is absent */
    byte[] get(String key);

    /** Remove {@code key}; removing an absent key is a no-op. */
    void delete(String key);

    /** Keys starting with {@code prefix}, in lexicographic order. */
    List<String> keys(String prefix);

    @Override
    void close();
}
