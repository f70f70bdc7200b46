package com.agrigrid.dispatch.api;

import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TaskType;
import com.agrigrid.core.scheduler.ResourceType;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/schedule.
 *
 * @param horizon slots to schedule over; nullable, defaults to the configured horizon
 * @param tasks   tasks to place
 * @param roster  agent ids per agent type; nullable, defaults to the configured roster
 */
public record ScheduleBody(
    Integer horizon,
    List<TaskBody> tasks,
    Map<AgentType, List<String>> roster
) {

    public record TaskBody(
        String id,
        TaskType type,
        Position cell,
        int priority,
        int duration,
        Map<ResourceType, Double> resources
    ) {}
}
