package io.vizspec.core.model;

import java.util.regex.Pattern;

/** Identifier sanitization for generated names. */
public final class Identifiers {

    private static final Pattern NON_WORD = Pattern.compile("\\W");

    private Identifiers() {
        // utility class
    }

    /**
     * Turns an arbitrary string into a safe identifier: every non-word character becomes {@code _}
     * and a leading digit is prefixed with {@code _}.
     */
    public static String varName(String value) {
        String sanitized = NON_WORD.matcher(value).replaceAll("_");
        if (!sanitized.isEmpty() && Character.isDigit(sanitized.charAt(0))) {
            return "_" + sanitized;
        }
        return sanitized;
    }
}
