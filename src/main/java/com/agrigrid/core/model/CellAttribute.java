package com.agrigrid.core.model;

/**
 * Keys of the numeric attribute bag carried by every cell.
 */
public enum CellAttribute {
    WATER_LEVEL,
    GROWTH_PROGRESS,
    DISEASE_PROBABILITY,
    LAST_WATERED
}
