package com.ai.intake.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Model reply: either text to speak or a tool call to execute.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ModelTurn {

    private final String text;
    private final ModelToolCall toolCall;

    public static ModelTurn text(String text) {
        return new ModelTurn(text != null ? text : "", null);
    }

    public static ModelTurn toolCall(ModelToolCall toolCall) {
        return new ModelTurn(null, toolCall);
    }

    public boolean isToolCall() {
        return toolCall != null;
    }
}
