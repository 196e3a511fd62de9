package io.vizspec.standalone.config;

import static io.vizspec.standalone.config.ConfigLoaderTest.fixture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vizspec.core.spec.SchemaValidationMode;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Environment variables override YAML values. A variable counts as set only when it is defined
 * and non-blank; blank values leave the YAML value in place.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path minimalConfigPath;
    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        minimalConfigPath = fixture("minimal-config.yaml");
        fullConfigPath = fixture("full-config.yaml");
        envVars.clear();
    }

    @Nested
    @DisplayName("String overrides")
    class StringOverrides {

        @Test
        void serverHost() {
            envVars.put("SERVER_HOST", "10.0.0.1");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).host()).isEqualTo("10.0.0.1");
        }

        @Test
        void configDefaults() {
            envVars.put("CONFIG_DEFAULTS", "/srv/defaults.json");

            assertThat(ConfigLoader.load(minimalConfigPath, envLookup()).configDefaults())
                    .isEqualTo("/srv/defaults.json");
        }

        @Test
        void healthPathAndLogging() {
            envVars.put("HEALTH_PATH", "/live");
            envVars.put("LOG_FORMAT", "text");
            envVars.put("LOG_LEVEL", "WARN");

            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.healthPath()).isEqualTo("/live");
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("values are trimmed")
        void trimmed() {
            envVars.put("SERVER_HOST", "  localhost \t");

            assertThat(ConfigLoader.load(minimalConfigPath, envLookup()).host()).isEqualTo("localhost");
        }

        @Test
        void schemaValidation() {
            envVars.put("SCHEMA_VALIDATION", "lenient");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).schemaValidation())
                    .isEqualTo(SchemaValidationMode.LENIENT);
        }
    }

    @Nested
    @DisplayName("Typed overrides")
    class TypedOverrides {

        @Test
        void portAndBodyLimit() {
            envVars.put("SERVER_PORT", "7070");
            envVars.put("SERVER_MAX_BODY_BYTES", "512");

            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.port()).isEqualTo(7070);
            assertThat(config.maxBodyBytes()).isEqualTo(512);
        }

        @Test
        void healthEnabled() {
            envVars.put("HEALTH_ENABLED", "true");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).healthEnabled()).isTrue();
        }

        @Test
        void invalidInteger() {
            envVars.put("SERVER_PORT", "eighty");

            assertThatThrownBy(() -> ConfigLoader.load(minimalConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Invalid integer for SERVER_PORT: 'eighty'")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }

        @Test
        void invalidSchemaValidation() {
            envVars.put("SCHEMA_VALIDATION", "always");

            assertThatThrownBy(() -> ConfigLoader.load(minimalConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'always'");
        }
    }

    @ParameterizedTest(name = "blank value \"{0}\" keeps the YAML port")
    @ValueSource(strings = {"", " ", "\t", "  \n"})
    void blankValuesAreUnset(String blank) {
        envVars.put("SERVER_PORT", blank);
        envVars.put("SERVER_HOST", blank);

        ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.port()).isEqualTo(9191);
        assertThat(config.host()).isEqualTo("127.0.0.1");
    }
}
