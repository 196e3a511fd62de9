package io.vizspec.core.spi;

import io.vizspec.core.error.VizSpecException;

/**
 * Lifecycle hooks of the compiler facade, e.g. for metrics.
 *
 * <p>
 * All methods receive immutable event objects and default to no-ops. Exceptions thrown by a
 * listener are caught and logged by the compiler; they never affect the result.
 */
public interface CompileListener {

    /** Called after a spec tree has been normalized. */
    default void onNormalized(NormalizedEvent event) {}

    /** Called after a spec has been compiled successfully. */
    default void onCompiled(CompiledEvent event) {}

    /** Called when parsing, normalization or compilation fails. */
    default void onCompileFailed(CompileFailedEvent event) {}

    // --- Event records ---

    /** Event emitted after normalization. */
    record NormalizedEvent(String specName, int warningCount) {}

    /** Event emitted after a successful compilation. */
    record CompiledEvent(String specName, int warningCount, long durationMs) {}

    /** Event emitted when a compilation fails. */
    record CompileFailedEvent(String specName, VizSpecException.Stage stage, String errorDetail) {}
}
