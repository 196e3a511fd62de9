package io.vizspec.core.error;

/**
 * Abstract base for all vizspec exceptions. Never thrown directly; use the concrete subclasses
 * {@link SpecParseException}, {@link SchemaValidationException}, {@link UnsupportedSpecException}
 * or {@link PhaseOrderException}.
 */
public abstract class VizSpecException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage in which the error occurred. */
    public enum Stage {
        PARSE,
        NORMALIZE,
        COMPILE
    }

    private final String specName;
    private final Stage stage;

    protected VizSpecException(String message, String specName, Stage stage) {
        super(message);
        this.specName = specName;
        this.stage = stage;
    }

    protected VizSpecException(String message, Throwable cause, String specName, Stage stage) {
        super(message, cause);
        this.specName = specName;
        this.stage = stage;
    }

    /** Name of the spec node that triggered the error, or {@code null} if it is unnamed. */
    public String specName() {
        return specName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The stage in which the error occurred. */
    public Stage stage() {
        return stage;
    }
}
