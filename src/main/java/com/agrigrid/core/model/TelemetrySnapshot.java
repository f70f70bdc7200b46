package com.agrigrid.core.model;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time telemetry of the simulation. Consumers never need to read it for
 * the loop to stay correct.
 *
 * @param tick          ticks executed so far
 * @param cellCounts    number of cells per state (sums to width * height)
 * @param harvested     total harvests
 * @param activeTasks   tasks currently assigned to a worker
 * @param queuedTasks   tasks waiting in the planner queue
 * @param agents        per-agent status
 * @param weather       current weather
 */
public record TelemetrySnapshot(
    long tick,
    Map<CellState, Integer> cellCounts,
    int harvested,
    int activeTasks,
    int queuedTasks,
    List<AgentSnapshot> agents,
    WeatherState weather
) {}
