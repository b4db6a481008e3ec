package io.taulite.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 */
public interface Wal extends AutoCloseable {

    /** Append a single framed record and fsync it. */
    void append(byte[] framedRecord);

    /** Start a new segment once the current one reaches its size threshold. */
    void rotateIfNeeded();

    /**
     * Start a new segment and delete every older one. Called right after a
     * snapshot has captured everything those segments hold.
     */
    void truncateBeforeNewSegment();

    /**
     * Open a sequential reader over all segments, oldest first. The reader
     * stops at the first corrupt header, truncated record or bad CRC.
     */
    WalReader openReader();

    @Override
    void close();

    /** Reader used during recovery. */
    interface WalReader extends AutoCloseable {

        /** @return next valid payload (header excluded), or null at the end of valid data */
        byte[] next();

        @Override
        void close();
    }
}
