package com.ai.intake.flow;

/**
 * Callbacks from the {@link FlowManager} to the surrounding session.
 */
public interface FlowListener {

    /**
     * Called after the current node has been replaced.
     */
    default void onNodeEntered(NodeConfig node) {
    }

    /**
     * Called once when a node carrying {@link PostAction#END_CONVERSATION} is entered.
     */
    default void onConversationEnded(SessionState finalState) {
    }
}
