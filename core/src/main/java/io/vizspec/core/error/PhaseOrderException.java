package io.vizspec.core.error;

/**
 * Thrown when a model compilation phase runs out of order, runs twice, or when an assemble step
 * is requested before every parse phase has completed.
 */
public final class PhaseOrderException extends VizSpecException {

    private static final long serialVersionUID = 1L;

    public PhaseOrderException(String message, String modelName) {
        super(message, modelName, Stage.COMPILE);
    }
}
