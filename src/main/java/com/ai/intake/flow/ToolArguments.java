package com.ai.intake.flow;

import java.util.Collections;
import java.util.Map;

/**
 * Arguments of a tool call after validation against its {@link ToolSchema}.
 */
public final class ToolArguments {

    private final Map<String, String> values;

    public ToolArguments(Map<String, String> values) {
        this.values = values == null ? Collections.emptyMap() : Collections.unmodifiableMap(values);
    }

    public static ToolArguments of(Map<String, String> values) {
        return new ToolArguments(values);
    }

    /**
     * Value of a required parameter. Validation guarantees presence.
     */
    public String get(String name) {
        return values.get(name);
    }

    public String getOrDefault(String name, String defaultValue) {
        String value = values.get(name);
        return value != null ? value : defaultValue;
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
