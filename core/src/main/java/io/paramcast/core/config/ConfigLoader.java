package io.paramcast.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.paramcast.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link CasterConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * caster:
 *   default-mode: struct
 *   schema-dir: schemas
 * </pre>
 *
 * <p>
 * Env vars take precedence over YAML values: {@code PARAMCAST_DEFAULT_MODE} and
 * {@code PARAMCAST_SCHEMA_DIR}. An env var counts as set only if it is defined and non-blank
 * after trimming. A relative {@code schema-dir} from the file resolves against the file's
 * directory; one from the environment is used as given.
 */
public final class ConfigLoader {

    static final String ENV_DEFAULT_MODE = "PARAMCAST_DEFAULT_MODE";
    static final String ENV_SCHEMA_DIR = "PARAMCAST_SCHEMA_DIR";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /** Loads {@code configPath}, overlaying {@link System#getenv}. */
    public static CasterConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads {@code configPath}, overlaying the variables {@code envLookup} returns. A {@code null}
     * return means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static CasterConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, configPath, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** The configuration from the environment alone, on top of {@link CasterConfig#defaults()}. */
    public static CasterConfig fromEnvironment(Function<String, String> envLookup) {
        CasterConfig.Builder builder = CasterConfig.builder();
        try {
            applyEnvOverrides(builder, envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in environment: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static CasterConfig mapToConfig(JsonNode root, Path configPath, Function<String, String> envLookup) {
        CasterConfig.Builder builder = CasterConfig.builder();

        JsonNode caster = root.path("caster");
        if (caster.has("default-mode")) builder.defaultMode(caster.get("default-mode").asText());
        if (caster.has("schema-dir")) {
            Path dir = Path.of(caster.get("schema-dir").asText());
            Path base = configPath.toAbsolutePath().getParent();
            builder.schemaDir(dir.isAbsolute() || base == null ? dir : base.resolve(dir));
        }

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(CasterConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, ENV_DEFAULT_MODE, builder::defaultMode);
        envString(envLookup, ENV_SCHEMA_DIR, builder::schemaDir);
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }
}
