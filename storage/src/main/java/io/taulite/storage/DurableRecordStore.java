package io.taulite.storage;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Logger;

/**
 * Durable record store.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: key -> bytes.
 *  - On write:
 *      1) Frame the mutation as a WAL record.
 *      2) Append+fsync to WAL.
 *      3) Apply it to memory.
 *      4) Rotate WAL segment if needed.
 *      5) Possibly write a full snapshot (SnapshotPolicy) and drop the WAL
 *         segments it covers.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay every remaining WAL segment in order.
 * <p>
 * Mutations are plain overwrites and removals, so replaying a record twice
 * (e.g. after a crash between snapshot and segment cleanup) yields the same map.
 */
public class DurableRecordStore implements RecordStore {
    private static final Logger LOG = Logger.getLogger(DurableRecordStore.class.getName());
    private static final long DEFAULT_SEGMENT_BYTES = 64L * 1024 * 1024;

    private final ConcurrentSkipListMap<String, byte[]> mem = new ConcurrentSkipListMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableRecordStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    /** Store laid out as {@code dataDir/wal} and {@code dataDir/snapshots}. */
    public static DurableRecordStore open(Path dataDir, int snapshotEveryOps) {
        return new DurableRecordStore(
                new FileWal(dataDir.resolve("wal"), DEFAULT_SEGMENT_BYTES),
                new FileSnapshotter(dataDir.resolve("snapshots")),
                new SnapshotPolicy(snapshotEveryOps));
    }

    @Override
    public synchronized void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        byte[] owned = Objects.requireNonNull(value, "value").clone();
        log(WalRecordCodec.Mutation.put(key, owned));
        mem.put(key, owned);
        afterWrite();
    }

    @Override
    public byte[] get(String key) {
        byte[] v = mem.get(key);
        return v == null ? null : v.clone();
    }

    @Override
    public synchronized void delete(String key) {
        if (!mem.containsKey(key)) return;
        log(WalRecordCodec.Mutation.delete(key));
        mem.remove(key);
        afterWrite();
    }

    @Override
    public List<String> keys(String prefix) {
        return InMemoryRecordStore.prefixScan(mem, prefix);
    }

    /** Write a snapshot now and drop the WAL segments it covers. */
    public synchronized String snapshot() {
        String id = snaps.writeSnapshot(new HashMap<>(mem));
        wal.truncateBeforeNewSegment();
        LOG.info(() -> "Wrote snapshot " + id + " with " + mem.size() + " records");
        return id;
    }

    @Override
    public synchronized void close() {
        wal.close();
    }

    private void log(WalRecordCodec.Mutation m) {
        wal.append(WalRecordCodec.encode(m));
    }

    private void afterWrite() {
        wal.rotateIfNeeded();
        if (snapPolicy.recordWrite()) {
            snapshot();
        }
    }

    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            mem.putAll(loaded.data());
        }
        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                WalRecordCodec.Mutation m = WalRecordCodec.decode(payload);
                if (m.isDelete()) {
                    mem.remove(m.key());
                } else {
                    mem.put(m.key(), m.value());
                }
                replayed++;
            }
        }
        final int count = replayed;
        LOG.info(() -> "Recovered " + mem.size() + " records (snapshot "
                + (loaded == null ? "none" : loaded.id()) + ", " + count + " WAL records replayed)");
    }
}
