package com.ai.intake.flow;

/**
 * Actions fired by the engine once a node has been entered.
 */
public enum PostAction {
    END_CONVERSATION
}
