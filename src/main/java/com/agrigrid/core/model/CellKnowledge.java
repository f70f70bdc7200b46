package com.agrigrid.core.model;

import java.util.List;

/**
 * The planner's cached belief about one cell, rebuilt from the world once per tick.
 *
 * @param position     the cell
 * @param state        state observed at {@code lastUpdated}
 * @param attributes   attributes observed at {@code lastUpdated}
 * @param lastUpdated  tick of the refresh
 * @param pendingTasks ids of open tasks targeting this cell
 */
public record CellKnowledge(
    Position position,
    CellState state,
    CellAttributes attributes,
    long lastUpdated,
    List<String> pendingTasks
) {

    public CellKnowledge {
        pendingTasks = List.copyOf(pendingTasks);
    }

    public boolean hasPendingTasks() {
        return !pendingTasks.isEmpty();
    }
}
