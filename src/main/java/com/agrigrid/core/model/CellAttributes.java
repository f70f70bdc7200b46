package com.agrigrid.core.model;

import java.util.Map;

/**
 * Numeric attributes of a cell.
 *
 * @param waterLevel         soil water, 0.0 to 1.0
 * @param growthProgress     crop growth, 0 to 100
 * @param diseaseProbability estimated disease probability, 0.0 to 1.0
 * @param lastWatered        tick of the last irrigation
 */
public record CellAttributes(
    double waterLevel,
    int growthProgress,
    double diseaseProbability,
    long lastWatered
) {

    public static final CellAttributes EMPTY = new CellAttributes(0.0, 0, 0.0, 0);

    /**
     * Returns a copy with the given partial update merged in. Keys absent from
     * {@code update} keep their current value.
     */
    public CellAttributes merge(Map<CellAttribute, ? extends Number> update) {
        double water = waterLevel;
        int growth = growthProgress;
        double disease = diseaseProbability;
        long watered = lastWatered;
        for (var entry : update.entrySet()) {
            Number value = entry.getValue();
            if (value == null) continue;
            switch (entry.getKey()) {
                case WATER_LEVEL -> water = value.doubleValue();
                case GROWTH_PROGRESS -> growth = value.intValue();
                case DISEASE_PROBABILITY -> disease = value.doubleValue();
                case LAST_WATERED -> watered = value.longValue();
            }
        }
        return new CellAttributes(water, growth, disease, watered);
    }

    public Map<CellAttribute, Number> asMap() {
        return Map.of(
                CellAttribute.WATER_LEVEL, waterLevel,
                CellAttribute.GROWTH_PROGRESS, growthProgress,
                CellAttribute.DISEASE_PROBABILITY, diseaseProbability,
                CellAttribute.LAST_WATERED, lastWatered);
    }
}
