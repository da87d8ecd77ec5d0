package io.paramcast.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/** Tests for {@link FieldPath} and {@link FieldError} rendering. */
class FieldPathTest {

    @Test
    void rendersDottedWithIndexSegments() {
        FieldPath path = FieldPath.of("near_locations").index(1).child("latitude");

        assertThat(path).hasToString("near_locations.1.latitude");
        assertThat(path.leaf()).isEqualTo("latitude");
    }

    @Test
    void rootRendersAsPlaceholder() {
        assertThat(FieldPath.root().isRoot()).isTrue();
        assertThat(FieldPath.root()).hasToString("<root>");
        assertThat(FieldPath.root().leaf()).isNull();
    }

    @Test
    void underPrependsPrefix() {
        assertThat(FieldPath.of("latitude").under(FieldPath.of("home"))).isEqualTo(FieldPath.of("home", "latitude"));
        assertThat(FieldPath.root().under(FieldPath.of("home"))).isEqualTo(FieldPath.of("home"));
        assertThat(FieldPath.of("a").under(FieldPath.root())).isEqualTo(FieldPath.of("a"));
    }

    @Test
    void negativeIndexIsRejected() {
        assertThatThrownBy(() -> FieldPath.root().index(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void errorDefaultsMessageToItsKind() {
        FieldError error = new FieldError(FieldPath.of("breed"), ErrorKind.MISSING_REQUIRED, null);

        assertThat(error.message()).isEqualTo("can't be blank");
        assertThat(error).hasToString("breed: can't be blank (MISSING_REQUIRED)");
        assertThat(error.under(FieldPath.of("kitten")).path()).hasToString("kitten.breed");
    }

    @Test
    void outputModeParsesConfiguredNames() {
        assertThat(OutputMode.fromString(" MAP ")).isEqualTo(OutputMode.MAP);
        assertThat(OutputMode.fromString("struct")).isEqualTo(OutputMode.STRUCT);
        assertThatThrownBy(() -> OutputMode.fromString("tree")).isInstanceOf(IllegalArgumentException.class);
    }
}
