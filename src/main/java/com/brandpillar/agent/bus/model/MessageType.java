package com.brandpillar.agent.bus.model;

/**
 * Standard message types exchanged between agents.
 *
 * <p>{@link AgentMessage#getType()} is free-form; these are the values the platform's
 * own agents use.
 */
public enum MessageType {
    TASK_REQUEST,
    TASK_RESULT,
    STATUS_UPDATE,
    ERROR_REPORT,
    COORDINATION,
    LEARNING_UPDATE
}
