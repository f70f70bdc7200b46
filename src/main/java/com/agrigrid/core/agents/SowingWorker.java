package com.agrigrid.core.agents;

import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.CellAttribute;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.FarmTask;
import com.agrigrid.core.model.Position;

import java.util.Map;

/**
 * Sows ploughed cells and resets their growth attributes.
 */
public class SowingWorker extends WorkerAgent {

    static final double INITIAL_WATER = 0.5;

    public SowingWorker(String id, Position start, WorkerContext context) {
        super(id, AgentType.SOWING, start, context);
    }

    @Override
    protected ExecutionOutcome execute(FarmTask task) {
        Position cell = task.targetCell();
        if (world.getCellState(cell) != CellState.PLOUGHED) {
            return ExecutionOutcome.skipped();
        }
        world.setCellState(cell, CellState.SOWN);
        world.updateCellAttributes(cell, Map.of(
                CellAttribute.GROWTH_PROGRESS, 0,
                CellAttribute.WATER_LEVEL, INITIAL_WATER,
                CellAttribute.DISEASE_PROBABILITY, 0.0));
        return ExecutionOutcome.applied("sown");
    }
}
