package com.ai.intake.flow;

/**
 * Raised when the model invokes a tool that the current node does not declare,
 * omits a required argument, or calls into a flow that is no longer active.
 * The flow state and current node are left untouched.
 */
public class ToolContractViolationException extends RuntimeException {

    private final String toolName;
    private final String nodeName;

    public ToolContractViolationException(String toolName, String nodeName, String message) {
        super(message);
        this.toolName = toolName;
        this.nodeName = nodeName;
    }

    public String getToolName() {
        return toolName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
