package com.ai.intake.flow;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named conversational stage: the prompt text to surface to the model and
 * the tools it may invoke while the stage is current. Immutable.
 */
@Getter
public final class NodeConfig {

    private final String name;
    private final List<PromptMessage> roleMessages;
    private final List<PromptMessage> taskMessages;
    private final List<ToolBinding> tools;
    private final List<PostAction> postActions;

    @Builder
    private NodeConfig(String name,
                       @Singular List<PromptMessage> roleMessages,
                       @Singular List<PromptMessage> taskMessages,
                       @Singular List<ToolBinding> tools,
                       @Singular List<PostAction> postActions) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Node name is required");
        }
        Set<String> seen = new HashSet<>();
        for (ToolBinding tool : tools) {
            if (!seen.add(tool.getName())) {
                throw new IllegalArgumentException("Duplicate tool " + tool.getName() + " in node " + name);
            }
        }
        if (postActions.contains(PostAction.END_CONVERSATION) && !tools.isEmpty()) {
            throw new IllegalArgumentException("Terminal node " + name + " cannot declare tools");
        }
        this.name = name;
        this.roleMessages = roleMessages;
        this.taskMessages = taskMessages;
        this.tools = tools;
        this.postActions = postActions;
    }

    public Optional<ToolBinding> findTool(String toolName) {
        return tools.stream().filter(t -> t.getName().equals(toolName)).findFirst();
    }

    public Set<String> getToolNames() {
        return tools.stream().map(ToolBinding::getName).collect(Collectors.toUnmodifiableSet());
    }

    public List<ToolSchema> getToolSchemas() {
        return tools.stream().map(ToolBinding::getSchema).collect(Collectors.toList());
    }

    public boolean isTerminal() {
        return postActions.contains(PostAction.END_CONVERSATION);
    }

    @Override
    public String toString() {
        return "NodeConfig{" + name + ", tools=" + getToolNames() + "}";
    }
}
