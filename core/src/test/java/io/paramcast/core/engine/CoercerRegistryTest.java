package io.paramcast.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.paramcast.core.spi.TypeCoercer;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Tests for {@link CoercerRegistry}. */
class CoercerRegistryTest {

    /** Trivial coercer for testing. */
    private static TypeCoercer coercer(String type) {
        return new TypeCoercer() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options) {
                return Optional.of(TextNode.valueOf(type));
            }
        };
    }

    @Test
    void builtinsCoverEveryDocumentedType() {
        assertThat(CoercerRegistry.withBuiltins().types())
                .containsExactly(
                        "any",
                        "binary_id",
                        "boolean",
                        "date",
                        "decimal",
                        "float",
                        "id",
                        "integer",
                        "map",
                        "naive_datetime",
                        "string",
                        "time",
                        "utc_datetime");
    }

    @Test
    void registerAndRetrieveCoercer() {
        var registry = new CoercerRegistry();
        TypeCoercer slug = coercer("slug");
        registry.register(slug);

        assertThat(registry.getCoercer("slug")).containsSame(slug);
        assertThat(registry.requireCoercer("slug")).isSameAs(slug);
        assertThat(registry.hasCoercer("slug")).isTrue();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void registeringSameTypeReplaces() {
        var registry = CoercerRegistry.withBuiltins();
        int before = registry.size();
        TypeCoercer custom = coercer("string");
        registry.register(custom);

        assertThat(registry.requireCoercer("string")).isSameAs(custom);
        assertThat(registry.size()).isEqualTo(before);
    }

    @Test
    void requireCoercerThrowsForUnknownType() {
        assertThatThrownBy(() -> new CoercerRegistry().requireCoercer("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nonexistent");
    }

    @Test
    void emptyTypeIsRejected() {
        assertThatThrownBy(() -> new CoercerRegistry().register(coercer("")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
