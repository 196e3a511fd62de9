package io.vizspec.core.error;

/**
 * Thrown when a spec combines variants, channels or mark types that cannot be normalized or
 * compiled. Aborts the whole call; no partial tree is returned.
 */
public final class UnsupportedSpecException extends VizSpecException {

    private static final long serialVersionUID = 1L;

    public UnsupportedSpecException(String message, String specName, Stage stage) {
        super(message, specName, stage);
    }
}
