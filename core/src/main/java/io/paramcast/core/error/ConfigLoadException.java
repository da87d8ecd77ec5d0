package io.paramcast.core.error;

/** Thrown when the caster configuration file is missing, unreadable, or holds an invalid value. */
public final class ConfigLoadException extends ParamCastException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message, null, Phase.CONFIG);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause, null, Phase.CONFIG);
    }
}
