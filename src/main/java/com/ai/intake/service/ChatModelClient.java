package com.ai.intake.service;

import com.ai.intake.dto.ChatMessage;
import com.ai.intake.dto.ModelTurn;
import com.ai.intake.flow.ToolSchema;

import java.util.List;

/**
 * Sends the conversation context and the currently callable tools to a
 * language model and returns either its reply or the tool call it requested.
 */
public interface ChatModelClient {

    /**
     * @throws ChatModelException if the model could not be reached or replied with garbage
     */
    ModelTurn complete(List<ChatMessage> context, List<ToolSchema> tools);
}
