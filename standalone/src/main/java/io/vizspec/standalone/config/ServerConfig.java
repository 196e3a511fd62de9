package io.vizspec.standalone.config;

import io.vizspec.core.spec.SchemaValidationMode;

/**
 * Root configuration of the standalone compile service.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param host             bind address
 * @param port             listen port; {@code 0} picks a free port
 * @param maxBodyBytes     max request body size; {@code <= 0} disables the limit
 * @param schemaValidation whether request specs are validated against the bundled schema
 * @param configDefaults   path to a YAML/JSON config overlay merged over the built-in defaults, or
 *                         {@code null}
 * @param healthEnabled    whether the liveness endpoint is registered
 * @param healthPath       liveness endpoint path
 * @param loggingFormat    {@code json} or {@code text}
 * @param loggingLevel     root log level
 */
public record ServerConfig(
        String host,
        int port,
        int maxBodyBytes,
        SchemaValidationMode schemaValidation,
        String configDefaults,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ServerConfig}, pre-populated with the defaults. */
    public static final class Builder {

        private String host = "0.0.0.0";
        private int port = 8080;
        private int maxBodyBytes = 1_048_576;
        private SchemaValidationMode schemaValidation = SchemaValidationMode.LENIENT;
        private String configDefaults;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder schemaValidation(SchemaValidationMode schemaValidation) {
            this.schemaValidation = schemaValidation;
            return this;
        }

        public Builder configDefaults(String configDefaults) {
            this.configDefaults = configDefaults;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(
                    host,
                    port,
                    maxBodyBytes,
                    schemaValidation,
                    configDefaults,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
