package io.vizspec.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.javalin.Javalin;
import io.vizspec.core.config.VizConfig;
import io.vizspec.core.engine.VizCompiler;
import io.vizspec.core.error.SpecParseException;
import io.vizspec.core.normalize.CoreNormalizer;
import io.vizspec.core.spec.SpecParser;
import io.vizspec.standalone.config.ConfigLoadException;
import io.vizspec.standalone.config.ConfigLoader;
import io.vizspec.standalone.config.ServerConfig;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the compile service.
 *
 * <ol>
 * <li>Load configuration from YAML plus the environment overlay</li>
 * <li>Configure Logback</li>
 * <li>Build the compiler: parser in the configured validation mode, default normalizer chain,
 * built-in config merged with {@code compiler.config-defaults}</li>
 * <li>Register the endpoints and start Javalin</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.vizspec.standalone.StandaloneMain} so tests can start and stop the
 * service without going through {@code main()}.
 */
public final class CompileServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(CompileServerApp.class);

    static final String COMPILE_PATH = "/compile";
    static final String NORMALIZE_PATH = "/normalize";

    private final Javalin app;
    private final VizCompiler compiler;
    private final ServerConfig config;

    private CompileServerApp(Javalin app, VizCompiler compiler, ServerConfig config) {
        this.app = app;
        this.compiler = compiler;
        this.config = config;
    }

    /**
     * Loads the configuration named by {@code args} and starts the service.
     *
     * @param args command-line arguments, e.g. {@code --config path/to/vizspec-server.yaml}
     * @throws ConfigLoadException if the configuration cannot be loaded
     */
    public static CompileServerApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config);
        LOG.info("Configuration loaded from {}", configPath);
        return start(config);
    }

    /** Starts the service with an already loaded configuration. */
    public static CompileServerApp start(ServerConfig config) {
        long startTime = System.nanoTime();

        VizCompiler compiler = new VizCompiler(
                new SpecParser(config.schemaValidation()), new CoreNormalizer(), baseConfig(config), null);

        Javalin app = Javalin.create(javalinConfig -> {
            if (config.maxBodyBytes() > 0) {
                // lets the handlers answer oversized bodies with a problem detail
                javalinConfig.http.maxRequestSize = config.maxBodyBytes() + 1L;
            }
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }
        app.post(COMPILE_PATH, new CompileHandler(compiler, config.maxBodyBytes()));
        app.post(NORMALIZE_PATH, new NormalizeHandler(compiler, config.maxBodyBytes()));

        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "vizspec-server started: host={}, port={}, schemaValidation={}, configDefaults={}, startupMs={}",
                config.host(),
                app.port(),
                config.schemaValidation(),
                config.configDefaults() != null ? config.configDefaults() : "none",
                elapsedMs);

        return new CompileServerApp(app, compiler, config);
    }

    private static VizConfig baseConfig(ServerConfig config) {
        if (config.configDefaults() == null || config.configDefaults().isBlank()) {
            return VizConfig.defaults();
        }
        Path path = Path.of(config.configDefaults());
        try {
            JsonNode overlay = SpecParser.readTree(path);
            if (overlay == null || !overlay.isObject()) {
                throw new ConfigLoadException("Config defaults must be a YAML/JSON object: " + path);
            }
            return VizConfig.fromJson(overlay);
        } catch (SpecParseException e) {
            throw new ConfigLoadException("Failed to load config defaults from: " + path, e);
        }
    }

    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public VizCompiler compiler() {
        return compiler;
    }

    public ServerConfig config() {
        return config;
    }

    public void stop() {
        if (app != null) {
            app.stop();
        }
        LOG.info("vizspec-server stopped");
    }
}
