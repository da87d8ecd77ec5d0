package io.paramcast.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.paramcast.core.model.ValidationResult;

/**
 * User-pluggable post-processing of a cast. Receives the open result of the built-in
 * required/type pass together with the raw input, and returns the result to accept. The returned
 * result is authoritative: a hook may append errors, add or drop changes, or return a fresh
 * {@link ValidationResult#open open} result for the same schema to replace the built-in pass
 * entirely.
 *
 * <p>
 * Called exactly once per cast of a schema. A hook passed for a call applies to the root schema
 * only; nested embeds run their own schema's hook.
 */
@FunctionalInterface
public interface ValidationHook {

    /**
     * Post-processes a cast.
     *
     * @param result   the open result of the built-in pass
     * @param rawInput the raw input the result was cast from
     * @return the result to accept, open
     */
    ValidationResult validate(ValidationResult result, JsonNode rawInput);

    /** The default hook: accepts whatever the built-in pass produced. */
    static ValidationHook identity() {
        return (result, rawInput) -> result;
    }
}
