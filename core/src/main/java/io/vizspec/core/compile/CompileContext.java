package io.vizspec.core.compile;

import io.vizspec.core.config.VizConfig;
import io.vizspec.core.diagnostic.Diagnostics;
import java.util.Objects;

/** Per-compilation state shared by every model of one tree. Not thread-safe. */
public final class CompileContext {

    private final VizConfig config;
    private final Diagnostics diagnostics;
    private int sourceCounter;

    public CompileContext(VizConfig config, Diagnostics diagnostics) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
    }

    public VizConfig config() {
        return config;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    /** Allocates the next data source name: {@code source_0}, {@code source_1}, ... */
    String nextSourceName() {
        return "source_" + sourceCounter++;
    }
}
