package com.agrigrid.core.model;

/**
 * Kinds of work the planner can hand out.
 */
public enum TaskType {
    PLOUGH,
    SOW,
    WATER,
    HARVEST,
    MONITOR;

    /**
     * The worker type able to execute this task.
     */
    public AgentType workerType() {
        return switch (this) {
            case PLOUGH -> AgentType.PLOUGHING;
            case SOW -> AgentType.SOWING;
            case WATER -> AgentType.WATERING;
            case HARVEST -> AgentType.HARVESTING;
            case MONITOR -> AgentType.MONITORING;
        };
    }
}
