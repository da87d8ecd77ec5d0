package io.paramcast.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.paramcast.core.engine.CoercerRegistry;
import io.paramcast.core.engine.SchemaRegistry;
import io.paramcast.core.error.SchemaDocumentException;
import io.paramcast.core.error.SchemaLoadException;
import io.paramcast.core.error.SchemaParseException;
import io.paramcast.core.model.FieldKind;
import io.paramcast.core.model.Schema;
import io.paramcast.core.spi.ValidationHook;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link SchemaDocumentParser}: YAML/JSON documents, envelope checks and error context. */
class SchemaDocumentParserTest {

    @TempDir
    Path tempDir;

    private SchemaRegistry registry;
    private SchemaDocumentParser parser;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry();
        parser = new SchemaDocumentParser(new SchemaCompiler(registry, CoercerRegistry.withBuiltins()));
    }

    private Path write(String fileName, String content) throws IOException {
        Path file = tempDir.resolve(fileName);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void parsesYamlDocument() throws IOException {
        Path file = write("kitten.yaml", """
                name: Kitten
                description: a kitten
                fields:
                  breed!: string
                  tags: [string]
                  near_location!:
                    latitude: float
                    longitude: float
                """);

        Schema schema = parser.parse(file);

        assertThat(schema.name()).isEqualTo("Kitten");
        assertThat(schema.required()).containsExactly("breed", "near_location");
        assertThat(schema.field("tags").orElseThrow().kind()).isEqualTo(new FieldKind.Array("string"));
        assertThat(registry.hasSchema("Kitten.NearLocation")).isTrue();
    }

    @Test
    void parsesJsonDocument() throws IOException {
        Path file = write("tag.json", """
                {"name": "Tag", "fields": {"label!": "string", "weight": [{"field": "integer", "default": 1}]}}
                """);

        Schema schema = parser.parse(file);

        assertThat(schema.name()).isEqualTo("Tag");
        assertThat(schema.field("weight").orElseThrow().hasDefault()).isTrue();
    }

    @Test
    void attachesHook() throws IOException {
        Path file = write("tag.yaml", "name: Tag\nfields:\n  label: string\n");
        ValidationHook hook = ValidationHook.identity();

        Schema schema = parser.parse(file, hook);

        assertThat(schema.hook()).containsSame(hook);
    }

    @Test
    void unknownTopLevelKeyIsRejected() throws IOException {
        Path file = write("tag.yaml", "name: Tag\nfeilds:\n  label: string\n");

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(SchemaDocumentException.class)
                .hasMessageContaining("feilds")
                .satisfies(e -> assertThat(((SchemaLoadException) e).source()).isEqualTo(file.toString()))
                .satisfies(e -> assertThat(((SchemaLoadException) e).schemaName()).isEqualTo("Tag"));
    }

    @Test
    void missingNameFailsEnvelopeValidation() throws IOException {
        Path file = write("nameless.yaml", "fields:\n  label: string\n");

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(SchemaDocumentException.class)
                .hasMessageContaining("Invalid schema document")
                .hasMessageContaining("name");
    }

    @Test
    void emptyFieldsFailEnvelopeValidation() throws IOException {
        Path file = write("empty.yaml", "name: Empty\nfields: {}\n");

        assertThatThrownBy(() -> parser.parse(file)).isInstanceOf(SchemaDocumentException.class);
    }

    @Test
    void nonMappingDocumentIsRejected() throws IOException {
        Path file = write("list.yaml", "- name: Tag\n");

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(SchemaDocumentException.class)
                .hasMessageContaining("mapping");
    }

    @Test
    void malformedYamlKeepsTheCause() throws IOException {
        Path file = write("broken.yaml", "name: [unclosed\n");

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(SchemaDocumentException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void missingFileIsADocumentError() {
        assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.yaml")))
                .isInstanceOf(SchemaDocumentException.class);
    }

    @Test
    void fieldErrorsCarryTheSourcePath() throws IOException {
        Path file = write("bad.yaml", "name: Bad\nfields:\n  age: no_such_type\n");

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(SchemaParseException.class)
                .satisfies(e -> assertThat(((SchemaLoadException) e).source()).isEqualTo(file.toString()));
    }
}
