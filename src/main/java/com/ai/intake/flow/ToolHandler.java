package com.ai.intake.flow;

/**
 * Implementation bound to a tool. Writes what it learned into the session
 * state and picks the next node.
 */
@FunctionalInterface
public interface ToolHandler {

    ToolInvocationResult handle(ToolArguments arguments, SessionState state);
}
