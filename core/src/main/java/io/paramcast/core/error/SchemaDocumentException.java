package io.paramcast.core.error;

/** Thrown when a schema document (YAML or JSON file) cannot be read or has an invalid envelope. */
public final class SchemaDocumentException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaDocumentException(String message, String schemaName, String source) {
        super(message, schemaName, source);
    }

    public SchemaDocumentException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, source);
    }
}
