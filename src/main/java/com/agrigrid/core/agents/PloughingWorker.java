package com.agrigrid.core.agents;

import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.FarmTask;
import com.agrigrid.core.model.Position;

/**
 * Turns {@link CellState#INITIAL} soil into {@link CellState#PLOUGHED}.
 */
public class PloughingWorker extends WorkerAgent {

    public PloughingWorker(String id, Position start, WorkerContext context) {
        super(id, AgentType.PLOUGHING, start, context);
    }

    @Override
    protected ExecutionOutcome execute(FarmTask task) {
        Position cell = task.targetCell();
        if (world.getCellState(cell) != CellState.INITIAL) {
            return ExecutionOutcome.skipped();
        }
        world.setCellState(cell, CellState.PLOUGHED);
        return ExecutionOutcome.applied("ploughed");
    }
}
