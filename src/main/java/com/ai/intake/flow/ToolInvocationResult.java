package com.ai.intake.flow;

import lombok.Value;

/**
 * What a handler hands back to the engine: the result echoed to the model and
 * the node to enter next.
 */
@Value
public class ToolInvocationResult {

    FlowResult result;
    NodeConfig nextNode;

    public static ToolInvocationResult of(FlowResult result, NodeConfig nextNode) {
        return new ToolInvocationResult(result, nextNode);
    }
}
