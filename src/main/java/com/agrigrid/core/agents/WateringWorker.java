package com.agrigrid.core.agents;

import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.CellAttribute;
import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.FarmTask;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.world.WeatherStation;

import java.util.Map;

/**
 * Irrigates sown, thirsty and diseased cells. Holds off entirely while rain is forecast.
 */
public class WateringWorker extends WorkerAgent {

    static final double WATER_PER_VISIT = 0.3;
    static final double DISEASE_RELIEF = 0.2;

    private final WeatherStation weather;

    public WateringWorker(String id, Position start, WorkerContext context, WeatherStation weather) {
        super(id, AgentType.WATERING, start, context);
        this.weather = weather;
    }

    @Override
    protected ExecutionOutcome execute(FarmTask task) {
        if (weather.current().rainForecast24h()) {
            return ExecutionOutcome.delayed("watering_delayed");
        }

        Position cell = task.targetCell();
        CellState state = world.getCellState(cell);
        CellAttributes attrs = world.getCellAttributes(cell);
        double water = Math.min(1.0, attrs.waterLevel() + WATER_PER_VISIT);
        long tick = clock.current();

        switch (state) {
            case SOWN -> {
                world.setCellState(cell, CellState.GROWING);
                world.updateCellAttributes(cell, Map.of(
                        CellAttribute.WATER_LEVEL, water,
                        CellAttribute.LAST_WATERED, tick));
            }
            case NEED_WATER -> {
                boolean thriving = attrs.growthProgress() > 50 && water > 0.5;
                world.setCellState(cell, thriving ? CellState.HEALTHY : CellState.GROWING);
                world.updateCellAttributes(cell, Map.of(
                        CellAttribute.WATER_LEVEL, water,
                        CellAttribute.LAST_WATERED, tick));
            }
            case DISEASED -> {
                world.updateCellAttributes(cell, Map.of(
                        CellAttribute.WATER_LEVEL, water,
                        CellAttribute.LAST_WATERED, tick,
                        CellAttribute.DISEASE_PROBABILITY, Math.max(0.0, attrs.diseaseProbability() - DISEASE_RELIEF)));
                if (water > 0.6) {
                    world.setCellState(cell, CellState.GROWING);
                }
            }
            default -> {
                // nothing to irrigate, the visit still counts as done
            }
        }
        return ExecutionOutcome.applied("watered");
    }
}
