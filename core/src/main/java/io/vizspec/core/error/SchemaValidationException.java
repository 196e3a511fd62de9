package io.vizspec.core.error;

/** Thrown in strict mode when a raw spec violates the bundled JSON Schema (draft 2020-12). */
public final class SchemaValidationException extends VizSpecException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SchemaValidationException(String message, String source) {
        super(message, null, Stage.PARSE);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
