package io.paramcast.core.config;

import io.paramcast.core.model.OutputMode;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Setup-time configuration of a {@link io.paramcast.core.engine.ParamCaster}.
 *
 * <p>
 * Use {@link #builder()} to construct instances; {@link #defaults()} is map mode with no schema
 * directory.
 *
 * @param defaultMode output mode used when a cast call does not choose one
 * @param schemaDir   directory of schema documents loaded at startup, or {@code null}
 */
public record CasterConfig(OutputMode defaultMode, Path schemaDir) {

    private static final CasterConfig DEFAULTS = builder().build();

    public CasterConfig {
        Objects.requireNonNull(defaultMode, "defaultMode must not be null");
    }

    public static CasterConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CasterConfig}. */
    public static final class Builder {
        private OutputMode defaultMode = OutputMode.MAP;
        private Path schemaDir;

        Builder() {}

        public Builder defaultMode(OutputMode defaultMode) {
            this.defaultMode = defaultMode;
            return this;
        }

        /** Accepts {@code map} or {@code struct}, case-insensitive. */
        public Builder defaultMode(String defaultMode) {
            this.defaultMode = OutputMode.fromString(defaultMode);
            return this;
        }

        public Builder schemaDir(Path schemaDir) {
            this.schemaDir = schemaDir;
            return this;
        }

        public Builder schemaDir(String schemaDir) {
            this.schemaDir = schemaDir != null ? Path.of(schemaDir) : null;
            return this;
        }

        public CasterConfig build() {
            return new CasterConfig(defaultMode, schemaDir);
        }
    }
}
