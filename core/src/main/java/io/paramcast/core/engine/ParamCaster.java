package io.paramcast.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.paramcast.core.config.CasterConfig;
import io.paramcast.core.config.ConfigLoader;
import io.paramcast.core.error.SchemaDocumentException;
import io.paramcast.core.error.SchemaResolveException;
import io.paramcast.core.model.CastOptions;
import io.paramcast.core.model.CastResult;
import io.paramcast.core.model.OutputMode;
import io.paramcast.core.model.Schema;
import io.paramcast.core.model.ValidationResult;
import io.paramcast.core.spec.SchemaCompiler;
import io.paramcast.core.spec.SchemaDocumentParser;
import io.paramcast.core.spi.TypeCoercer;
import io.paramcast.core.spi.ValidationHook;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: defines schemas and casts raw input against them.
 *
 * <p>
 * Raw input and raw schema descriptions are accepted either as Jackson {@link JsonNode}s or as
 * Java {@link Map}s. Map keys may be strings, other {@link CharSequence}s or enum constants; all
 * are normalized to their names, so identifier-keyed maps cast like string-keyed ones.
 *
 * <p>
 * Thread-safe: schemas are immutable once registered and every cast allocates its own result.
 */
public final class ParamCaster {

    private static final Logger LOG = LoggerFactory.getLogger(ParamCaster.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SchemaRegistry schemaRegistry;
    private final CoercerRegistry coercerRegistry;
    private final SchemaCompiler compiler;
    private final SchemaDocumentParser documentParser;
    private final Caster caster;
    private final OutputProjector projector;
    private final OutputMode defaultMode;

    /** Map mode, built-in coercers, no schema directory. */
    public ParamCaster() {
        this(CasterConfig.defaults());
    }

    public ParamCaster(CasterConfig config) {
        this(config, new SchemaRegistry(), CoercerRegistry.withBuiltins());
    }

    /**
     * Creates a caster over the given registries. If {@code config} names a schema directory its
     * documents are loaded immediately.
     */
    public ParamCaster(CasterConfig config, SchemaRegistry schemaRegistry, CoercerRegistry coercerRegistry) {
        Objects.requireNonNull(config, "config must not be null");
        this.schemaRegistry = Objects.requireNonNull(schemaRegistry, "schemaRegistry must not be null");
        this.coercerRegistry = Objects.requireNonNull(coercerRegistry, "coercerRegistry must not be null");
        this.compiler = new SchemaCompiler(schemaRegistry, coercerRegistry);
        this.documentParser = new SchemaDocumentParser(compiler);
        this.caster = new Caster(coercerRegistry);
        this.projector = new OutputProjector();
        this.defaultMode = config.defaultMode();
        if (config.schemaDir() != null) {
            loadAll(config.schemaDir());
        }
    }

    /** Creates a caster from a YAML configuration file, with the process environment overlaid. */
    public static ParamCaster fromConfig(Path configFile) {
        return new ParamCaster(ConfigLoader.load(configFile));
    }

    // --- Schema definition ---

    /** Compiles and registers {@code rawSchema} under {@code name}. */
    public Schema define(String name, Object rawSchema) {
        return define(name, rawSchema, null);
    }

    /**
     * Compiles {@code rawSchema} with a per-schema hook and registers it under {@code name},
     * replacing any schema of that name.
     *
     * @param name      schema name
     * @param rawSchema description as a {@link JsonNode} or {@link Map}
     * @param hook      per-schema hook, or {@code null}
     * @return the registered schema
     */
    public Schema define(String name, Object rawSchema, ValidationHook hook) {
        Schema schema = compiler.compile(toJson(rawSchema), name, hook);
        schemaRegistry.register(schema);
        return schema;
    }

    /** Loads, compiles and registers one schema document. */
    public Schema load(Path document) {
        Schema schema = documentParser.parse(document);
        schemaRegistry.register(schema);
        return schema;
    }

    /** Loads one schema document with a per-schema hook. */
    public Schema load(Path document, ValidationHook hook) {
        Schema schema = documentParser.parse(document, hook);
        schemaRegistry.register(schema);
        return schema;
    }

    /**
     * Loads every {@code .yaml}, {@code .yml} and {@code .json} document in {@code directory}.
     * Documents are taken in file-name order; one that references a schema defined by a later
     * document is retried once the others have loaded.
     *
     * @return the loaded schemas, in load order
     * @throws SchemaDocumentException if the directory cannot be listed
     * @throws SchemaResolveException  if references remain unresolvable
     */
    public List<Schema> loadAll(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        List<Path> pending = listDocuments(directory);
        List<Schema> loaded = new ArrayList<>();
        while (!pending.isEmpty()) {
            List<Path> deferred = new ArrayList<>();
            SchemaResolveException lastFailure = null;
            for (Path document : pending) {
                try {
                    loaded.add(load(document));
                } catch (SchemaResolveException e) {
                    LOG.debug("Deferring {}: {}", document, e.getMessage());
                    deferred.add(document);
                    lastFailure = e;
                }
            }
            if (deferred.size() == pending.size()) {
                throw lastFailure;
            }
            pending = deferred;
        }
        LOG.info("Loaded {} schema document(s) from {}", loaded.size(), directory);
        return loaded;
    }

    private static List<Path> listDocuments(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> {
                        String file = p.getFileName().toString();
                        return file.endsWith(".yaml") || file.endsWith(".yml") || file.endsWith(".json");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SchemaDocumentException(
                    "Failed to list schema directory: " + e.getMessage(), e, null, directory.toString());
        }
    }

    /** Registers a coercer for a new (or replaced) type tag. Affects schemas compiled afterwards. */
    public void registerCoercer(TypeCoercer coercer) {
        coercerRegistry.register(coercer);
    }

    public Optional<Schema> schema(String name) {
        return schemaRegistry.getSchema(name);
    }

    public SchemaRegistry schemaRegistry() {
        return schemaRegistry;
    }

    public CoercerRegistry coercerRegistry() {
        return coercerRegistry;
    }

    public OutputMode defaultMode() {
        return defaultMode;
    }

    // --- Casting ---

    public CastResult cast(String schemaName, Object rawInput) {
        return cast(schemaRegistry.requireSchema(schemaName), rawInput, CastOptions.defaults());
    }

    public CastResult cast(String schemaName, Object rawInput, CastOptions options) {
        return cast(schemaRegistry.requireSchema(schemaName), rawInput, options);
    }

    public CastResult cast(Schema schema, Object rawInput) {
        return cast(schema, rawInput, CastOptions.defaults());
    }

    /**
     * Casts {@code rawInput} against {@code schema} and projects the result.
     *
     * @param schema   compiled schema
     * @param rawInput raw input as a {@link JsonNode} or {@link Map}
     * @param options  mode (defaulting to the configured one), hook and target
     * @return success with the projected value, or error with the accumulated errors
     */
    public CastResult cast(Schema schema, Object rawInput, CastOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        ValidationResult result = changeset(schema, rawInput, options);
        OutputMode mode = options.mode() != null ? options.mode() : defaultMode;
        CastResult cast = projector.project(result, mode);
        LOG.debug("Cast '{}' ({}): {}", schema.name(), mode, cast.type());
        return cast;
    }

    public ValidationResult changeset(Schema schema, Object rawInput) {
        return changeset(schema, rawInput, CastOptions.defaults());
    }

    /** The sealed changeset of a cast, without projecting it. The mode of {@code options} is unused. */
    public ValidationResult changeset(Schema schema, Object rawInput, CastOptions options) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return caster.cast(schema, options.target(), toJson(rawInput), options.hook());
    }

    public ValidationResult changeset(String schemaName, Object rawInput, CastOptions options) {
        return changeset(schemaRegistry.requireSchema(schemaName), rawInput, options);
    }

    /** Projects a sealed changeset, e.g. one a caller inspected before deciding on a mode. */
    public CastResult project(ValidationResult changeset, OutputMode mode) {
        return projector.project(changeset, mode);
    }

    // --- Java value conversion ---

    /**
     * Converts a Java value into a value tree: {@link JsonNode}s as-is, maps with their keys
     * normalized to names, collections and arrays element-wise, {@code java.time} values as ISO text,
     * anything else through Jackson.
     */
    static JsonNode toJson(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof TemporalAccessor temporal) {
            return TextNode.valueOf(temporal.toString());
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode out = MAPPER.createObjectNode();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.set(keyName(entry.getKey()), toJson(entry.getValue()));
            }
            return out;
        }
        if (value instanceof Collection<?> collection) {
            ArrayNode out = MAPPER.createArrayNode();
            for (Object element : collection) {
                out.add(toJson(element));
            }
            return out;
        }
        if (value instanceof Object[] array) {
            ArrayNode out = MAPPER.createArrayNode();
            for (Object element : array) {
                out.add(toJson(element));
            }
            return out;
        }
        return MAPPER.valueToTree(value);
    }

    private static String keyName(Object key) {
        if (key instanceof Enum<?> constant) {
            return constant.name();
        }
        return String.valueOf(key);
    }
}
