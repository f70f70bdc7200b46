package com.agrigrid.core.analytics;

/**
 * Expected output of the crops currently in the ground.
 *
 * @param estimatedYield        weighted count of standing crops
 * @param currentHarvest        crops harvested so far
 * @param potentialYield        {@code estimatedYield + currentHarvest}
 * @param ticksToHarvest        ticks until the average crop is ripe, 0 when nothing is growing
 * @param estimatedHarvestTick  current tick plus {@code ticksToHarvest}
 * @param averageGrowthProgress mean growth over growing, healthy and thirsty cells
 */
public record YieldForecast(
    double estimatedYield,
    int currentHarvest,
    double potentialYield,
    int ticksToHarvest,
    long estimatedHarvestTick,
    double averageGrowthProgress,
    int healthyCrops,
    int atRiskCrops
) {
}
