package io.taulite.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that asks for a full snapshot after every N writes.
 * <p>
 * Bounds worst-case recovery time by limiting WAL replay length. File size
 * and elapsed time are not considered.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Count one durable write; true when a snapshot is due (the counter then restarts). */
    public boolean recordWrite() {
        if (sinceLast.incrementAndGet() >= everyOps) {
            sinceLast.set(0);
            return true;
        }
        return false;
    }

    public int everyOps() {
        return everyOps;
    }
}
