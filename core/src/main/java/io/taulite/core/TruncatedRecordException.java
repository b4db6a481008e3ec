package io.taulite.core;

/**
 * A binary record ended before all of its declared fields could be read.
 * <p>
 * Raised by the decoders of {@link Delta}, {@link Sequence} and {@link Group};
 * nested decoders let it propagate unchanged.
 */
public class TruncatedRecordException extends RuntimeException {

    private final int needed;
    private final int remaining;

    public TruncatedRecordException(String field, int needed, int remaining) {
        super("truncated record: %s needs %d bytes, %d remaining".formatted(field, needed, remaining));
        this.needed = needed;
        this.remaining = remaining;
    }

    public int needed() {
        return needed;
    }

    public int remaining() {
        return remaining;
    }
}
