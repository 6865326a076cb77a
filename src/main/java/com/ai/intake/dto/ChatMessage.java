package com.ai.intake.dto;

import lombok.Getter;

/**
 * One entry of the model context: system prompt, caller utterance, assistant
 * reply, assistant tool call or tool result.
 */
@Getter
public final class ChatMessage {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    private final String role;
    private final String content;
    private final ModelToolCall toolCall;
    private final String toolCallId;

    private ChatMessage(String role, String content, ModelToolCall toolCall, String toolCallId) {
        this.role = role;
        this.content = content;
        this.toolCall = toolCall;
        this.toolCallId = toolCallId;
    }

    public ChatMessage(String role, String content) {
        this(role, content, null, null);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content);
    }

    public static ChatMessage assistantToolCall(ModelToolCall toolCall) {
        return new ChatMessage(ASSISTANT, null, toolCall, null);
    }

    public static ChatMessage toolResult(String toolCallId, String content) {
        return new ChatMessage(TOOL, content, null, toolCallId);
    }

    @Override
    public String toString() {
        if (toolCall != null) {
            return role + ": call " + toolCall.getName() + toolCall.getArgumentsJson();
        }
        return role + ": " + content;
    }
}
