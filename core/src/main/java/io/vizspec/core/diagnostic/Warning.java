package io.vizspec.core.diagnostic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One corrective action: its kind, a human-readable message, and the offending keys or values.
 *
 * @param kind    warning category
 * @param message rendered message
 * @param details offending keys/values, in insertion order
 */
public record Warning(WarningKind kind, String message, Map<String, Object> details) {

    public Warning {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }
}
