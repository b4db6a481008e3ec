package io.taulite.server.catalog;

/**
 * Catalog-level failure: unknown or duplicate labels, unknown transforms,
 * a full catalog or a malformed label.
 */
public class CatalogException extends RuntimeException {

    public enum Reason {
        SERIES_NOT_FOUND,
        SERIES_ALREADY_EXISTS,
        GROUP_NOT_FOUND,
        GROUP_ALREADY_EXISTS,
        LENS_NOT_FOUND,
        LENS_ALREADY_EXISTS,
        UNKNOWN_TRANSFORM,
        CATALOG_FULL,
        INVALID_LABEL
    }

    private final Reason reason;

    public CatalogException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public boolean isNotFound() {
        return reason == Reason.SERIES_NOT_FOUND || reason == Reason.GROUP_NOT_FOUND
                || reason == Reason.LENS_NOT_FOUND;
    }

    public boolean isConflict() {
        return reason == Reason.SERIES_ALREADY_EXISTS || reason == Reason.GROUP_ALREADY_EXISTS
                || reason == Reason.LENS_ALREADY_EXISTS;
    }
}
