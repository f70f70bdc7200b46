package com.agrigrid.core.model;

/**
 * Immutable grid coordinate. {@code (0,0)} is the first cell of the grid.
 *
 * @param x column index
 * @param y row index
 */
public record Position(int x, int y) {

    public static Position of(int x, int y) {
        return new Position(x, y);
    }

    /**
     * Manhattan distance {@code |x1 - x2| + |y1 - y2|}.
     */
    public int manhattanDistance(Position other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    public Position offset(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
