package com.devicesim.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a simulation: an action name and its parameters.
 *
 * @param name       action name
 * @param parameters parameter values by name
 */
public record ActionRequest(
    String name,
    Map<String, String> parameters
) implements Serializable {

    public ActionRequest {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Parses {@code name} or {@code name:key=value,key=value}.
     */
    public static ActionRequest parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Action must not be blank");
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            return new ActionRequest(text.trim(), Map.of());
        }
        var params = new LinkedHashMap<String, String>();
        for (String pair : text.substring(colon + 1).split(",")) {
            if (pair.isBlank()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed parameter '" + pair + "' in action '" + text + "'");
            }
            params.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return new ActionRequest(text.substring(0, colon).trim(), params);
    }

    public String describe() {
        if (parameters.isEmpty()) {
            return name;
        }
        var sb = new StringBuilder(name).append('(');
        parameters.forEach((k, v) -> {
            if (sb.charAt(sb.length() - 1) != '(') {
                sb.append(", ");
            }
            sb.append(k).append('=').append(v);
        });
        return sb.append(')').toString();
    }
}
