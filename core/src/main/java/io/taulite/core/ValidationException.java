package io.taulite.core;

/**
 * Fail-fast precondition violation raised while constructing or decoding
 * core entities (empty names, empty collections, bad intervals, bad payloads).
 * <p>
 * Extends {@link IllegalArgumentException} so outer layers can keep treating
 * bad input as a client error, while {@link #reason()} lets callers tell the
 * individual violations apart.
 */
public class ValidationException extends IllegalArgumentException {

    /** Which precondition was violated. */
    public enum Reason {
        INVALID_INTERVAL,
        EMPTY_PAYLOAD,
        INVALID_PAYLOAD,
        EMPTY_NAME,
        EMPTY_DELTAS,
        EMPTY_SEQUENCES,
        EMPTY_INPUT,
        EMPTY_DESCRIPTION,
        EMPTY_EXPRESSION,
        EMPTY_VARIABLE,
        /** A decoded record is followed by bytes its layout does not account for. */
        TRAILING_BYTES
    }

    private final Reason reason;

    public ValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
