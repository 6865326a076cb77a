package com.ai.intake.flow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs one conversation through its node graph. Holds the current node and the
 * session state, exposes the tools the model may call right now, and applies
 * tool invocations: check the tool is declared, validate arguments, run the
 * handler, commit its state changes and move to the node it returned.
 * <p>
 * One instance per call. Not thread-safe; callers serialize turns. Only
 * {@link #requestCancel()} may be called from another thread.
 */
public class FlowManager {

    private static final Logger log = LoggerFactory.getLogger(FlowManager.class);

    private final String sessionId;
    private final SessionState state = new SessionState();
    private final List<FlowListener> listeners = new CopyOnWriteArrayList<>();
    private final List<String> visitedNodes = new ArrayList<>();

    private NodeConfig currentNode;
    private volatile boolean ended;
    private volatile boolean cancelled;
    private boolean discarded;

    public FlowManager(String sessionId) {
        this.sessionId = sessionId;
    }

    public void addListener(FlowListener listener) {
        listeners.add(listener);
    }

    public void initialize(NodeConfig entryNode) {
        if (currentNode != null) {
            throw new IllegalStateException("Flow " + sessionId + " already initialized at " + currentNode.getName());
        }
        log.info("[{}] flow initialized at node={}", sessionId, entryNode.getName());
        enter(entryNode);
    }

    /**
     * Dispatches a tool call from the model against the current node.
     *
     * @throws ToolContractViolationException if the tool is not declared by the
     *                                        current node, an argument is missing,
     *                                        or the flow is no longer active
     */
    public ToolInvocationResult invokeTool(String toolName, Map<String, Object> rawArguments) {
        if (currentNode == null) {
            throw new IllegalStateException("Flow " + sessionId + " has not been initialized");
        }
        String nodeName = currentNode.getName();
        if (cancelled || ended) {
            throw new ToolContractViolationException(toolName, nodeName,
                    "Conversation is over; no tools can be called");
        }
        ToolBinding binding = currentNode.findTool(toolName)
                .orElseThrow(() -> new ToolContractViolationException(toolName, nodeName,
                        "Tool " + toolName + " is not available in node " + nodeName
                                + "; available: " + currentNode.getToolNames()));
        ToolArguments arguments = binding.getSchema().validate(rawArguments, nodeName);

        log.debug("[{}] node={} invoking {} with {}", sessionId, nodeName, toolName, arguments);
        SessionState working = state.copy();
        ToolInvocationResult result = binding.getHandler().handle(arguments, working);
        if (result == null || result.getNextNode() == null) {
            throw new IllegalStateException("Handler for " + toolName + " returned no next node");
        }
        if (cancelled) {
            log.info("[{}] cancelled while {} was running, result dropped", sessionId, toolName);
            throw new ToolContractViolationException(toolName, nodeName, "Conversation was cancelled");
        }

        state.copyFrom(working);
        log.info("[{}] {} -> {} via {}", sessionId, nodeName, result.getNextNode().getName(), toolName);
        enter(result.getNextNode());
        return result;
    }

    /**
     * Refuses every later tool invocation, including the commit of one in
     * progress. Safe to call from any thread; the state is left for {@link #cancel()}.
     */
    public void requestCancel() {
        cancelled = true;
    }

    /**
     * Stops the flow without reaching the terminal node and discards what was collected.
     */
    public void cancel() {
        requestCancel();
        if (discarded) {
            return;
        }
        discarded = true;
        state.clear();
        log.info("[{}] flow cancelled at node={}", sessionId, currentNode != null ? currentNode.getName() : "-");
    }

    private void enter(NodeConfig node) {
        currentNode = node;
        visitedNodes.add(node.getName());
        for (FlowListener listener : listeners) {
            listener.onNodeEntered(node);
        }
        if (node.isTerminal()) {
            ended = true;
            log.info("[{}] terminal node {} reached, ending conversation", sessionId, node.getName());
            for (FlowListener listener : listeners) {
                listener.onConversationEnded(state);
            }
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public NodeConfig getCurrentNode() {
        return currentNode;
    }

    /**
     * Schemas of the tools the model may call in the current node. Empty once the
     * conversation is over.
     */
    public List<ToolSchema> getAvailableTools() {
        if (currentNode == null || ended || cancelled) {
            return Collections.emptyList();
        }
        return currentNode.getToolSchemas();
    }

    public SessionState getState() {
        return state;
    }

    public List<String> getVisitedNodes() {
        return Collections.unmodifiableList(visitedNodes);
    }

    public boolean isEnded() {
        return ended;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
