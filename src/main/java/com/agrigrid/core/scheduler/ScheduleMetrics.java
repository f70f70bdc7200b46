package com.agrigrid.core.scheduler;

import java.util.Map;

/**
 * @param totalTasks          number of placed tasks
 * @param makespan            latest end slot over all assignments
 * @param resourceUtilisation consumed / capacity per pool
 * @param agentUtilisation    reserved slots / horizon per agent that holds a reservation
 */
public record ScheduleMetrics(
    int totalTasks,
    int makespan,
    Map<ResourceType, Double> resourceUtilisation,
    Map<String, Double> agentUtilisation
) {
}
