package com.agrigrid.core.model;

/**
 * Agricultural state of a single grid cell.
 */
public enum CellState {
    INITIAL,
    PLOUGHED,
    SOWN,
    GROWING,
    NEED_WATER,
    HEALTHY,
    DISEASED,
    READY_TO_HARVEST
}
