package io.paramcast.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.paramcast.core.model.FieldDescriptor;
import io.paramcast.core.model.FieldKind;
import io.paramcast.core.model.Schema;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaRegistry}. */
class SchemaRegistryTest {

    private static Schema schema(String name) {
        return new Schema(name, List.of(new FieldDescriptor("id", false, new FieldKind.Scalar("integer"))));
    }

    @Test
    void registerAndRetrieveSchema() {
        var registry = new SchemaRegistry();
        Schema location = schema("Location");
        registry.register(location);

        assertThat(registry.getSchema("Location")).containsSame(location);
        assertThat(registry.requireSchema("Location")).isSameAs(location);
        assertThat(registry.hasSchema("Location")).isTrue();
    }

    @Test
    void unknownNameIsEmptyOrRejected() {
        var registry = new SchemaRegistry();

        assertThat(registry.getSchema("Ghost")).isEmpty();
        assertThatThrownBy(() -> registry.requireSchema("Ghost"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Ghost");
    }

    @Test
    void lastRegistrationWins() {
        var registry = new SchemaRegistry();
        registry.register(schema("Location"));
        Schema replacement = schema("Location");
        registry.register(replacement);

        assertThat(registry.requireSchema("Location")).isSameAs(replacement);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void namesAreSorted() {
        var registry = new SchemaRegistry();
        registry.register(schema("Zebra"));
        registry.register(schema("Aardvark"));

        assertThat(registry.names()).containsExactly("Aardvark", "Zebra");
    }

    @Test
    void nullSchemaIsRejected() {
        assertThatThrownBy(() -> new SchemaRegistry().register(null)).isInstanceOf(NullPointerException.class);
    }
}
