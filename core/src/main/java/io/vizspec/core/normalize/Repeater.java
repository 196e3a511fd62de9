package io.vizspec.core.normalize;

/**
 * The repeat values bound for one branch of a repeat expansion. Any of the three may be {@code
 * null} when the enclosing repeats do not iterate that dimension.
 */
public record Repeater(String repeat, String row, String column) {

    /**
     * Resolves a repeat reference key.
     *
     * @param key {@code "repeat"}, {@code "row"} or {@code "column"}
     * @return the bound value, or {@code null} if unbound or the key is unknown
     */
    public String value(String key) {
        return switch (key) {
            case "repeat" -> repeat;
            case "row" -> row;
            case "column" -> column;
            default -> null;
        };
    }
}
