package com.agrigrid.core.engine;

import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.Position;

import java.util.List;

/**
 * One cell as seen from outside: world state plus the planner's open task ids for it.
 */
public record CellReport(
    Position position,
    CellState state,
    CellAttributes attributes,
    List<String> pendingTasks
) {}
