package com.agrigrid.core.model;

/**
 * Role of a worker agent. Each role executes exactly one {@link TaskType}.
 */
public enum AgentType {
    PLOUGHING,
    SOWING,
    WATERING,
    HARVESTING,
    MONITORING
}
