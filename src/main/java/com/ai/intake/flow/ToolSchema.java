package com.ai.intake.flow;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable declaration of a tool the model may call: its name, description
 * and typed parameters. Renders to the function definition sent to the model
 * and validates the arguments the model sends back.
 */
@Value
@Builder
public class ToolSchema {

    String name;
    String description;
    @Singular
    Map<String, ToolParameter> parameters;

    /**
     * Function definition in the chat-completions tool format.
     */
    public Map<String, Object> toFunctionDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        parameters.forEach((paramName, parameter) -> {
            properties.put(paramName, parameter.toJsonSchema());
            if (parameter.isRequired()) {
                required.add(paramName);
            }
        });

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("type", "object");
        params.put("properties", properties);
        if (!required.isEmpty()) {
            params.put("required", required);
        }

        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description);
        function.put("parameters", params);

        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("type", "function");
        definition.put("function", function);
        return definition;
    }

    /**
     * Checks raw model arguments against the declared parameters. Unknown keys
     * are dropped; scalars are normalized to strings.
     *
     * @throws ToolContractViolationException if a required parameter is missing
     *                                        or blank, or a value is not a scalar
     */
    public ToolArguments validate(Map<String, Object> rawArguments, String nodeName) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        Map<String, Object> raw = rawArguments != null ? rawArguments : Map.of();
        for (Map.Entry<String, ToolParameter> entry : parameters.entrySet()) {
            String paramName = entry.getKey();
            Object value = raw.get(paramName);
            if (value == null) {
                continue;
            }
            if (value instanceof Map || value instanceof Collection) {
                throw new ToolContractViolationException(name, nodeName,
                        "Argument " + paramName + " of " + name + " must be a " + entry.getValue().getType());
            }
            sanitized.put(paramName, value.toString().trim());
        }
        for (Map.Entry<String, ToolParameter> entry : parameters.entrySet()) {
            if (!entry.getValue().isRequired()) {
                continue;
            }
            String value = sanitized.get(entry.getKey());
            if (value == null || value.isEmpty()) {
                throw new ToolContractViolationException(name, nodeName,
                        "Required argument " + entry.getKey() + " was missing for " + name);
            }
        }
        return new ToolArguments(sanitized);
    }
}
