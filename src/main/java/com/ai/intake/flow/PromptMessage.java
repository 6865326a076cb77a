package com.ai.intake.flow;

import lombok.Value;

/**
 * A single (role, content) pair surfaced to the model when a node is entered.
 */
@Value
public class PromptMessage {

    String role;
    String content;

    public static PromptMessage system(String content) {
        return new PromptMessage("system", content);
    }
}
