package io.vizspec.core.error;

/**
 * Thrown when a spec cannot be read or does not have a recognizable shape. Carries an additional
 * {@code source} field identifying the file or resource that caused the error.
 */
public final class SpecParseException extends VizSpecException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SpecParseException(String message, String specName, String source) {
        super(message, specName, Stage.PARSE);
        this.source = source;
    }

    public SpecParseException(String message, Throwable cause, String specName, String source) {
        super(message, cause, specName, Stage.PARSE);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
