package io.vizspec.standalone;

import io.vizspec.standalone.server.CompileServerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone compile service.
 *
 * <p>
 * Usage: {@code java -jar vizspec-standalone.jar [--config path/to/vizspec-server.yaml]}
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // entry point only
    }

    public static void main(String[] args) {
        try {
            CompileServerApp app = CompileServerApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "vizspec-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
