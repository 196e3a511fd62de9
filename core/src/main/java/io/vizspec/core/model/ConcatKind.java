package io.vizspec.core.model;

/** The three concatenation flavours, keyed by the JSON property that holds the children. */
public enum ConcatKind {
    CONCAT("concat"),
    HCONCAT("hconcat"),
    VCONCAT("vconcat");

    private final String key;

    ConcatKind(String key) {
        this.key = key;
    }

    /** The JSON property name, e.g. {@code "hconcat"}. */
    public String key() {
        return key;
    }
}
