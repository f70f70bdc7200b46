package com.agrigrid.core.analytics;

/**
 * Water and heat stress across standing crops. Percentages are of {@code totalCrops};
 * the health score is 100 on a farm with no crops.
 */
public record StressIndicators(
    int waterStressedCount,
    int temperatureStressedCount,
    int totalCrops,
    double waterStressPercentage,
    double temperatureStressPercentage,
    double overallHealthScore
) {
}
