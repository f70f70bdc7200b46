package com.agrigrid.core.model;

/**
 * Lifecycle state of a worker agent.
 */
public enum AgentStatus {
    IDLE,
    MOVING,
    WORKING,
    COMPLETED
}
