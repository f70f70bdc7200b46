package com.agrigrid.core.scheduler;

/**
 * Depletable resources a scheduled task may draw on. {@code TIME} has no default pool.
 */
public enum ResourceType {
    WATER,
    FUEL,
    TOOLS,
    TIME
}
