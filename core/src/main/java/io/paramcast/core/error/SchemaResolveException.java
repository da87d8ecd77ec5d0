package io.paramcast.core.error;

/** Thrown when an {@code embeds_one}/{@code embeds_many} reference names a schema that is not registered. */
public final class SchemaResolveException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaResolveException(String message, String schemaName, String source) {
        super(message, schemaName, source);
    }

    public SchemaResolveException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, source);
    }
}
