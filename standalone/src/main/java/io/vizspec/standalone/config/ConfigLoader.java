package io.vizspec.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.vizspec.core.spec.SchemaValidationMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code vizspec-server.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Every key can be overridden by an environment variable, which takes precedence over the YAML
 * value. A variable counts as set only when it is defined and non-blank after trimming.
 *
 * <table>
 * <caption>Keys</caption>
 * <tr><th>YAML key</th><th>Env var</th></tr>
 * <tr><td>server.host</td><td>SERVER_HOST</td></tr>
 * <tr><td>server.port</td><td>SERVER_PORT</td></tr>
 * <tr><td>server.max-body-bytes</td><td>SERVER_MAX_BODY_BYTES</td></tr>
 * <tr><td>compiler.schema-validation</td><td>SCHEMA_VALIDATION</td></tr>
 * <tr><td>compiler.config-defaults</td><td>CONFIG_DEFAULTS</td></tr>
 * <tr><td>health.enabled</td><td>HEALTH_ENABLED</td></tr>
 * <tr><td>health.path</td><td>HEALTH_PATH</td></tr>
 * <tr><td>logging.format</td><td>LOG_FORMAT</td></tr>
 * <tr><td>logging.level</td><td>LOG_LEVEL</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "vizspec-server.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration at {@code configPath}, overlaid with {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration at {@code configPath}, overlaid with the variables of
     * {@code envLookup}. The lookup returns {@code null} for an undefined variable.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ServerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());
        if (server.has("max-body-bytes")) builder.maxBodyBytes(server.get("max-body-bytes").asInt());

        JsonNode compiler = root.path("compiler");
        if (compiler.has("schema-validation")) {
            builder.schemaValidation(validationMode(compiler.get("schema-validation").asText()));
        }
        builder.configDefaults(textOrNull(compiler, "config-defaults"));

        JsonNode health = root.path("health");
        builder.healthEnabled(boolOrDefault(health, "enabled", true));
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(ServerConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SERVER_HOST", builder::host);
        envString(envLookup, "CONFIG_DEFAULTS", builder::configDefaults);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "SCHEMA_VALIDATION", value -> builder.schemaValidation(validationMode(value)));

        envInt(envLookup, "SERVER_PORT", builder::port);
        envInt(envLookup, "SERVER_MAX_BODY_BYTES", builder::maxBodyBytes);

        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
    }

    private static SchemaValidationMode validationMode(String value) {
        try {
            return SchemaValidationMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Invalid schema-validation '" + value + "': expected 'strict' or 'lenient'", e);
        }
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

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Invalid integer for " + envVar + ": '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        return node.has(field) ? node.get(field).asBoolean() : defaultValue;
    }
}
