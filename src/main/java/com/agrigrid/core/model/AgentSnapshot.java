package com.agrigrid.core.model;

/**
 * Read-only view of one worker for telemetry consumers.
 */
public record AgentSnapshot(
    String id,
    AgentType type,
    AgentStatus status,
    Position position,
    String currentTaskId
) {}
