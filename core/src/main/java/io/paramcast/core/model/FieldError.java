package io.paramcast.core.model;

import java.util.Objects;

/**
 * One validation failure, located by path.
 *
 * @param path    location of the failing field
 * @param kind    error category
 * @param message human-readable message, hook-defined for {@link ErrorKind#USER_RULE}
 */
public record FieldError(FieldPath path, ErrorKind kind, String message) {

    public FieldError {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null) {
            message = kind.defaultMessage();
        }
    }

    /** Creates an error with the kind's default message. */
    public static FieldError of(FieldPath path, ErrorKind kind) {
        return new FieldError(path, kind, kind.defaultMessage());
    }

    /** Returns the same error re-rooted under {@code prefix}. */
    public FieldError under(FieldPath prefix) {
        return new FieldError(path.under(prefix), kind, message);
    }

    @Override
    public String toString() {
        return path + ": " + message + " (" + kind + ")";
    }
}
