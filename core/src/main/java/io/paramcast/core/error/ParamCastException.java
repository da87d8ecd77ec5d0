package io.paramcast.core.error;

/**
 * Abstract base for all param-cast exceptions. Never thrown directly, use the concrete subclasses
 * under {@link SchemaLoadException} or {@link ConfigLoadException}.
 *
 * <p>Ordinary invalid input never raises one of these: casting reports it through the returned
 * {@code ValidationResult}. Exceptions are reserved for programmer errors such as a malformed
 * schema or a reference to an undefined schema.
 */
public abstract class ParamCastException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        CONFIG
    }

    private final String schemaName;
    private final Phase phase;

    protected ParamCastException(String message, String schemaName, Phase phase) {
        super(message);
        this.schemaName = schemaName;
        this.phase = phase;
    }

    protected ParamCastException(String message, Throwable cause, String schemaName, Phase phase) {
        super(message, cause);
        this.schemaName = schemaName;
        this.phase = phase;
    }

    /** The schema that triggered the error, or {@code null} if not yet identified. */
    public String schemaName() {
        return schemaName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
