package io.paramcast.core.model;

/** Runtime validation error taxonomy. Compile-time schema errors are exceptions, not error kinds. */
public enum ErrorKind {
    /** A required scalar or relation is absent (or null) in the input. */
    MISSING_REQUIRED("can't be blank"),

    /** Coercion of a scalar or scalar array failed. */
    TYPE_MISMATCH("is invalid"),

    /** A relation's raw value is not an object (EmbedOne) or array of objects (EmbedMany). */
    INVALID_RELATION("is not a valid embedded value"),

    /** Rejection emitted by a validation hook. */
    USER_RULE("is invalid");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    /** Message used when an error of this kind is recorded without an explicit one. */
    public String defaultMessage() {
        return defaultMessage;
    }
}
