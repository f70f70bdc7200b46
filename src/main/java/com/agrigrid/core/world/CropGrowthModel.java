package com.agrigrid.core.world;

import com.agrigrid.core.model.CellAttribute;
import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.Position;

import java.util.Map;

/**
 * Automatic per-tick crop progression for growing and healthy cells.
 * <p>
 * Water evaporates by {@value #EVAPORATION} per tick; crops grow by {@value #GROWTH_PER_TICK}
 * while water stays above {@value #DRY_THRESHOLD}. Growing cells become thirsty below the
 * dry threshold or healthy once past half growth with water above 0.5; healthy cells become
 * thirsty or, at full growth, ready to harvest.
 */
public class CropGrowthModel {

    static final double EVAPORATION = 0.05;
    static final int GROWTH_PER_TICK = 2;
    static final double DRY_THRESHOLD = 0.3;

    public void advance(FarmWorld world) {
        for (Position pos : world.positions()) {
            CellState state = world.getCellState(pos);
            if (state != CellState.GROWING && state != CellState.HEALTHY) continue;

            CellAttributes attrs = world.getCellAttributes(pos);
            double water = Math.max(0.0, attrs.waterLevel() - EVAPORATION);
            int growth = attrs.growthProgress();
            if (water > DRY_THRESHOLD) {
                growth = Math.min(100, growth + GROWTH_PER_TICK);
            }
            world.updateCellAttributes(pos, Map.of(
                    CellAttribute.WATER_LEVEL, water,
                    CellAttribute.GROWTH_PROGRESS, growth));

            if (water < DRY_THRESHOLD) {
                world.setCellState(pos, CellState.NEED_WATER);
            } else if (state == CellState.GROWING && growth > 50 && water > 0.5) {
                world.setCellState(pos, CellState.HEALTHY);
            } else if (state == CellState.HEALTHY && growth >= 100) {
                world.setCellState(pos, CellState.READY_TO_HARVEST);
            }
        }
    }
}
