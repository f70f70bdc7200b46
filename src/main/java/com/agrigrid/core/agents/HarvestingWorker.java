package com.agrigrid.core.agents;

import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.CellAttribute;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.FarmTask;
import com.agrigrid.core.model.Position;

import java.util.Map;

/**
 * Collects mature crops and returns the cell to {@link CellState#INITIAL}.
 */
public class HarvestingWorker extends WorkerAgent {

    public HarvestingWorker(String id, Position start, WorkerContext context) {
        super(id, AgentType.HARVESTING, start, context);
    }

    @Override
    protected ExecutionOutcome execute(FarmTask task) {
        Position cell = task.targetCell();
        if (world.getCellState(cell) != CellState.READY_TO_HARVEST) {
            return ExecutionOutcome.skipped();
        }
        world.setCellState(cell, CellState.INITIAL);
        world.updateCellAttributes(cell, Map.of(
                CellAttribute.WATER_LEVEL, 0.0,
                CellAttribute.GROWTH_PROGRESS, 0,
                CellAttribute.DISEASE_PROBABILITY, 0.0,
                CellAttribute.LAST_WATERED, 0L));
        world.recordHarvest();
        return ExecutionOutcome.harvested(1);
    }
}
