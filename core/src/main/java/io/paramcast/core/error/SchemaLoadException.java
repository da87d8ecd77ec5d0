package io.paramcast.core.error;

/**
 * Abstract parent for compile-time schema errors. Thrown by {@code SchemaCompiler.compile()} and
 * {@code SchemaDocumentParser.parse()}. Carries an additional {@code source} field identifying the
 * file or resource that caused the error, {@code null} for schemas defined in code.
 */
public abstract class SchemaLoadException extends ParamCastException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaLoadException(String message, String schemaName, String source) {
        super(message, schemaName, Phase.COMPILE);
        this.source = source;
    }

    protected SchemaLoadException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, Phase.COMPILE);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}
