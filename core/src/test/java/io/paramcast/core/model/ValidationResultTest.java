package io.paramcast.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link ValidationResult}: open/sealed lifecycle, changes and error absorption. */
class ValidationResultTest {

    private static final Schema LOCATION = new Schema(
            "Location",
            List.of(
                    new FieldDescriptor("latitude", true, new FieldKind.Scalar("float")),
                    new FieldDescriptor("longitude", true, new FieldKind.Scalar("float"))));

    private static final Schema KITTEN = new Schema(
            "Kitten",
            List.of(
                    new FieldDescriptor("breed", true, new FieldKind.Scalar("string")),
                    new FieldDescriptor("homes", false, new FieldKind.EmbedMany(LOCATION))));

    @Test
    void openResultStartsFromTheZeroValue() {
        ValidationResult result = ValidationResult.open(KITTEN);

        assertThat(result.target()).isEqualTo(KITTEN.zeroValue());
        assertThat(result.target().get("homes").isArray()).isTrue();
        assertThat(result.isValid()).isTrue();
        assertThat(result.isSealed()).isFalse();
        assertThat(result.presence("breed")).isEqualTo(Presence.ABSENT);
    }

    @Test
    void targetIsCopied() {
        ObjectNode target = JsonNodeFactory.instance.objectNode().put("breed", "Manx");
        ValidationResult result = ValidationResult.open(KITTEN, target);

        target.put("breed", "changed");
        result.target().put("breed", "also changed");

        assertThat(result.target().get("breed").asText()).isEqualTo("Manx");
    }

    @Test
    void changesAreRecordedAndReadBack() {
        ValidationResult result = ValidationResult.open(KITTEN).putChange("breed", TextNode.valueOf("Manx"));

        assertThat(result.hasChange("breed")).isTrue();
        assertThat(result.changedValue("breed")).contains(TextNode.valueOf("Manx"));
        assertThat(result.nested("breed")).isEmpty();
        assertThat(result.nestedMany("homes")).isEmpty();

        result.removeChange("breed");
        assertThat(result.changes()).isEmpty();
    }

    @Test
    void changesForUnknownFieldsAreRejected() {
        assertThatThrownBy(() -> ValidationResult.open(KITTEN).putChange("colour", IntNode.valueOf(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("colour");
    }

    @Test
    void nestedErrorsAreAbsorbedUnderThePrefix() {
        ValidationResult nested = ValidationResult.open(LOCATION).addError("latitude", ErrorKind.TYPE_MISMATCH, null);
        ValidationResult parent = ValidationResult.open(KITTEN);

        parent.absorbErrors(FieldPath.of("homes").index(2), nested);

        assertThat(parent.errors())
                .containsExactly(new FieldError(FieldPath.of("homes", "2", "latitude"), ErrorKind.TYPE_MISMATCH, "is invalid"));
        assertThat(parent.errorsAt(FieldPath.of("homes", "2", "latitude"))).hasSize(1);
        assertThat(nested.errors()).extracting(FieldError::path).containsExactly(FieldPath.of("latitude"));
    }

    @Test
    void sealingIsRecursiveAndIdempotent() {
        ValidationResult nested = ValidationResult.open(LOCATION);
        ValidationResult parent = ValidationResult.open(KITTEN).putChange("homes", new Change.Many(List.of(nested)));

        assertThat(parent.seal()).isSameAs(parent);
        assertThat(parent.seal().isSealed()).isTrue();
        assertThat(nested.isSealed()).isTrue();
    }

    @Test
    void sealedResultRejectsEveryMutation() {
        ValidationResult result = ValidationResult.open(KITTEN).seal();

        assertThatThrownBy(() -> result.putChange("breed", TextNode.valueOf("x")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sealed");
        assertThatThrownBy(() -> result.removeChange("breed")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> result.addError("breed", ErrorKind.USER_RULE, "no"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> result.recordPresence("breed", Presence.VALUE))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void recordedValueChangesCannotBeAlteredThroughTheAccessor() {
        ObjectNode value = JsonNodeFactory.instance.objectNode().put("a", 1);
        Change.Value change = new Change.Value(value);

        value.put("a", 2);
        ((ObjectNode) change.value()).put("a", 3);

        assertThat(change.value().get("a").intValue()).isEqualTo(1);
    }
}
