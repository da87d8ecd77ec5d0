package io.paramcast.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.paramcast.core.spi.ValidationHook;

/**
 * Per-call cast options. Every component is optional.
 *
 * @param mode   output projection mode, or {@code null} for the caster's configured default
 * @param hook   per-call hook overriding the schema's own, or {@code null}
 * @param target pre-existing data the input applies to, or {@code null} for the zero value
 */
public record CastOptions(OutputMode mode, ValidationHook hook, ObjectNode target) {

    private static final CastOptions DEFAULTS = new CastOptions(null, null, null);

    public CastOptions {
        if (target != null) {
            target = target.deepCopy();
        }
    }

    /** Options that defer everything to the caster's configuration. */
    public static CastOptions defaults() {
        return DEFAULTS;
    }

    public static CastOptions ofMode(OutputMode mode) {
        return new CastOptions(mode, null, null);
    }

    public static CastOptions ofHook(ValidationHook hook) {
        return new CastOptions(null, hook, null);
    }

    public CastOptions withTarget(ObjectNode newTarget) {
        return new CastOptions(mode, hook, newTarget);
    }
}
