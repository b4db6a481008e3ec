package io.taulite.core.lens;

/**
 * A lens could not gather its inputs.
 */
public class LensException extends RuntimeException {

    public enum Reason {
        /** {@code apply} was called before any input was bound. */
        NO_INPUTS,
        /** A bound handle no longer resolves to a sequence. */
        MISSING_INPUT
    }

    private final Reason reason;

    public LensException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
