package com.ai.intake.flow;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-schema description of one tool parameter.
 */
@Value
@Builder
public class ToolParameter {

    public static final String TYPE_STRING = "string";

    @Builder.Default
    String type = TYPE_STRING;
    boolean required;
    String format;
    String description;

    public static ToolParameter requiredString() {
        return ToolParameter.builder().required(true).build();
    }

    public static ToolParameter optionalString() {
        return ToolParameter.builder().required(false).build();
    }

    Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type);
        if (format != null) {
            schema.put("format", format);
        }
        if (description != null) {
            schema.put("description", description);
        }
        return schema;
    }
}
