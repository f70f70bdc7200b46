package com.agrigrid.core.world;

import com.agrigrid.core.model.CellAttribute;
import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Array-backed {@link FarmWorld}. Every in-bounds coordinate holds exactly one cell
 * from construction on.
 */
public class GridFarmWorld implements FarmWorld {

    private final int width;
    private final int height;
    private final CellState[][] states;
    private final CellAttributes[][] attributes;
    private final List<Position> positions;
    // CAS-safe so several workers of one type may harvest in the same tick
    private final AtomicInteger harvested = new AtomicInteger();

    public GridFarmWorld(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.states = new CellState[width][height];
        this.attributes = new CellAttributes[width][height];
        var all = new ArrayList<Position>(width * height);
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                states[x][y] = CellState.INITIAL;
                attributes[x][y] = CellAttributes.EMPTY;
                all.add(new Position(x, y));
            }
        }
        this.positions = Collections.unmodifiableList(all);
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public boolean contains(Position pos) {
        return pos != null && pos.x() >= 0 && pos.x() < width && pos.y() >= 0 && pos.y() < height;
    }

    @Override
    public List<Position> positions() {
        return positions;
    }

    @Override
    public CellState getCellState(Position pos) {
        return contains(pos) ? states[pos.x()][pos.y()] : CellState.INITIAL;
    }

    @Override
    public void setCellState(Position pos, CellState state) {
        requireInBounds(pos);
        states[pos.x()][pos.y()] = state;
    }

    @Override
    public CellAttributes getCellAttributes(Position pos) {
        return contains(pos) ? attributes[pos.x()][pos.y()] : CellAttributes.EMPTY;
    }

    @Override
    public void updateCellAttributes(Position pos, Map<CellAttribute, ? extends Number> update) {
        requireInBounds(pos);
        attributes[pos.x()][pos.y()] = attributes[pos.x()][pos.y()].merge(update);
    }

    @Override
    public int countCellsByState(CellState state) {
        int count = 0;
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                if (states[x][y] == state) count++;
            }
        }
        return count;
    }

    @Override
    public Map<CellState, Integer> countsByState() {
        var counts = new EnumMap<CellState, Integer>(CellState.class);
        for (CellState state : CellState.values()) {
            counts.put(state, 0);
        }
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                counts.merge(states[x][y], 1, Integer::sum);
            }
        }
        return counts;
    }

    @Override
    public int harvestedCount() {
        return harvested.get();
    }

    @Override
    public int recordHarvest() {
        return harvested.incrementAndGet();
    }

    private void requireInBounds(Position pos) {
        if (!contains(pos)) {
            throw new IllegalArgumentException("Position " + pos + " is outside the " + width + "x" + height + " grid");
        }
    }
}
