package com.agrigrid.core.events;

import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.FarmTask;

/**
 * Task offer from the planner.
 *
 * @param task       the offered task
 * @param workerType type of worker expected to take it
 * @param workerId   intended worker, or null for any worker of the type
 */
public record AssignmentPayload(FarmTask task, AgentType workerType, String workerId) implements MessagePayload {}
