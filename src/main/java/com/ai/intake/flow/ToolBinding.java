package com.ai.intake.flow;

import lombok.Value;

/**
 * A tool schema attached to a node together with its handler.
 */
@Value
public class ToolBinding {

    ToolSchema schema;
    ToolHandler handler;

    public String getName() {
        return schema.getName();
    }
}
