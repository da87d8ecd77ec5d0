package io.paramcast.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;

/**
 * Pluggable scalar coercion SPI. Implementations turn a raw input value into the typed value of
 * one type tag (e.g. the text {@code "87.5"} into the float {@code 87.5}) and are registered with
 * the {@code CoercerRegistry}. Schemas name coercers by {@link #type()}.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface TypeCoercer {

    /**
     * Returns the type tag, e.g. {@code "integer"}. Used in schema descriptions to select the
     * coercer.
     *
     * @return a non-null, non-empty type tag (lowercase, no spaces)
     */
    String type();

    /**
     * Coerces a raw, non-null value.
     *
     * @param raw     the raw input value; never {@code null} and never a {@code NullNode}
     * @param options coercion options declared on the field, possibly empty
     * @return the typed value, or empty if {@code raw} cannot be represented as this type
     */
    Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options);
}
