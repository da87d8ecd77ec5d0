package io.paramcast.core.error;

/**
 * Thrown when a schema description is structurally malformed: duplicate field name, unknown type
 * tag, or a field spec of an unrecognized shape.
 */
public final class SchemaParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String schemaName, String source) {
        super(message, schemaName, source);
    }

    public SchemaParseException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, source);
    }
}
