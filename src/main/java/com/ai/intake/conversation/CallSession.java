package com.ai.intake.conversation;

import com.ai.intake.dto.ChatMessage;
import com.ai.intake.flow.FlowListener;
import com.ai.intake.flow.FlowManager;
import com.ai.intake.flow.NodeConfig;
import com.ai.intake.flow.PromptMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-call conversation: the flow, the model context built up so far and the
 * caller's number. Turns are serialized on the instance monitor; cancellation
 * is visible to a turn in progress.
 */
public class CallSession implements FlowListener {

    private final String callSid;
    private final String fromNumber;
    private final FlowManager flow;
    private final List<ChatMessage> context = new ArrayList<>();

    private volatile boolean cancelled;

    public CallSession(String callSid, String fromNumber) {
        this.callSid = callSid;
        this.fromNumber = fromNumber != null ? fromNumber : "";
        this.flow = new FlowManager(callSid);
        this.flow.addListener(this);
    }

    /**
     * The first node contributes its role messages; every node entered adds its task messages.
     */
    @Override
    public void onNodeEntered(NodeConfig node) {
        if (context.isEmpty()) {
            for (PromptMessage m : node.getRoleMessages()) {
                context.add(new ChatMessage(m.getRole(), m.getContent()));
            }
        }
        for (PromptMessage m : node.getTaskMessages()) {
            context.add(new ChatMessage(m.getRole(), m.getContent()));
        }
    }

    public void append(ChatMessage message) {
        context.add(message);
    }

    public List<ChatMessage> getContext() {
        return Collections.unmodifiableList(context);
    }

    public FlowManager getFlow() {
        return flow;
    }

    public String getCallSid() {
        return callSid;
    }

    public String getFromNumber() {
        return fromNumber;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Marks the session dead right away so a turn in progress stops at its next
     * step, then waits for that turn to let go before discarding the flow state.
     *
     * @return true if the intake had already been completed and is kept
     */
    public boolean cancel() {
        cancelled = true;
        flow.requestCancel();
        synchronized (this) {
            if (flow.isEnded()) {
                return true;
            }
            flow.cancel();
            return false;
        }
    }
}
