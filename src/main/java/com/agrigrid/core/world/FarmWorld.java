package com.agrigrid.core.world;

import com.agrigrid.core.model.CellAttribute;
import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.Position;

import java.util.List;
import java.util.Map;

/**
 * Authoritative store of per-cell state and attributes.
 * <p>
 * Reads outside the grid return neutral defaults ({@link CellState#INITIAL},
 * {@link CellAttributes#EMPTY}). Writes outside the grid are a programming error
 * and throw {@link IllegalArgumentException}.
 */
public interface FarmWorld {

    int width();

    int height();

    boolean contains(Position pos);

    /**
     * All in-bounds positions, column-major ({@code x} outer, {@code y} inner).
     */
    List<Position> positions();

    CellState getCellState(Position pos);

    void setCellState(Position pos, CellState state);

    CellAttributes getCellAttributes(Position pos);

    /**
     * Merges {@code update} into the cell's attributes; keys not present keep their value.
     */
    void updateCellAttributes(Position pos, Map<CellAttribute, ? extends Number> update);

    int countCellsByState(CellState state);

    Map<CellState, Integer> countsByState();

    int harvestedCount();

    /**
     * Increments the global harvest counter and returns the new total.
     */
    int recordHarvest();
}
