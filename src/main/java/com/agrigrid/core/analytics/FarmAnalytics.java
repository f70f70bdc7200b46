package com.agrigrid.core.analytics;

import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.WeatherState;
import com.agrigrid.core.world.FarmWorld;

import java.util.EnumSet;
import java.util.Set;

/**
 * Read-only forecasts over a {@link FarmWorld}. Never mutates the world.
 */
public final class FarmAnalytics {

    static final double YIELD_HEALTHY = 1.0;
    static final double YIELD_GROWING = 0.7;
    static final double YIELD_DISEASED = 0.3;
    static final double GROWTH_PER_TICK = 2.0;
    static final double WATER_STRESS_LEVEL = 0.3;
    static final double HEAT_STRESS_WATER_LEVEL = 0.5;

    private static final Set<CellState> MATURING =
            EnumSet.of(CellState.GROWING, CellState.HEALTHY, CellState.NEED_WATER);
    private static final Set<CellState> STANDING =
            EnumSet.of(CellState.SOWN, CellState.GROWING, CellState.HEALTHY, CellState.NEED_WATER);

    private FarmAnalytics() {
    }

    public static YieldForecast forecastYield(FarmWorld world, long currentTick) {
        int growing = world.countCellsByState(CellState.GROWING);
        int healthy = world.countCellsByState(CellState.HEALTHY);
        int ready = world.countCellsByState(CellState.READY_TO_HARVEST);
        int diseased = world.countCellsByState(CellState.DISEASED);

        double totalGrowth = 0;
        int maturing = 0;
        for (Position pos : world.positions()) {
            if (MATURING.contains(world.getCellState(pos))) {
                totalGrowth += world.getCellAttributes(pos).growthProgress();
                maturing++;
            }
        }
        double averageGrowth = maturing > 0 ? totalGrowth / maturing : 0.0;

        double estimated = healthy * YIELD_HEALTHY
                + growing * YIELD_GROWING
                + diseased * YIELD_DISEASED
                + ready * YIELD_HEALTHY;
        int ticksToHarvest = averageGrowth > 0 ? (int) ((100 - averageGrowth) / GROWTH_PER_TICK) : 0;
        int harvested = world.harvestedCount();

        return new YieldForecast(round(estimated, 2), harvested, round(estimated + harvested, 2),
                ticksToHarvest, currentTick + ticksToHarvest, round(averageGrowth, 1), healthy, diseased);
    }

    public static StressIndicators stressIndicators(FarmWorld world, WeatherState weather) {
        int waterStressed = 0;
        int heatStressed = 0;
        int crops = 0;

        for (Position pos : world.positions()) {
            if (!STANDING.contains(world.getCellState(pos))) continue;
            crops++;
            CellAttributes attrs = world.getCellAttributes(pos);
            if (attrs.waterLevel() < WATER_STRESS_LEVEL) {
                waterStressed++;
            }
            if (weather.heatStress() && attrs.waterLevel() < HEAT_STRESS_WATER_LEVEL) {
                heatStressed++;
            }
        }

        if (crops == 0) {
            return new StressIndicators(0, 0, 0, 0.0, 0.0, 100.0);
        }
        double healthScore = Math.max(0.0, (crops - waterStressed - heatStressed) * 100.0 / crops);
        return new StressIndicators(waterStressed, heatStressed, crops,
                round(waterStressed * 100.0 / crops, 1),
                round(heatStressed * 100.0 / crops, 1),
                round(healthScore, 1));
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
