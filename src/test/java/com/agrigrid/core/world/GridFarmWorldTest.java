package com.agrigrid.core.world;

import com.agrigrid.core.model.CellAttribute;
import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GridFarmWorldTest {

    private GridFarmWorld world;

    @BeforeEach
    void setUp() {
        world = new GridFarmWorld(4, 3);
    }

    @Test
    @DisplayName("new grid has one INITIAL cell per coordinate")
    void initialGrid() {
        assertEquals(12, world.positions().size());
        assertEquals(12, world.countCellsByState(CellState.INITIAL));
        assertEquals(CellAttributes.EMPTY, world.getCellAttributes(Position.of(3, 2)));
    }

    @Test
    @DisplayName("non-positive dimensions are rejected")
    void rejectsBadDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new GridFarmWorld(0, 5));
        assertThrows(IllegalArgumentException.class, () -> new GridFarmWorld(5, -1));
    }

    @Test
    @DisplayName("per-state counts always sum to width * height")
    void countsSumToGridSize() {
        world.setCellState(Position.of(0, 0), CellState.PLOUGHED);
        world.setCellState(Position.of(1, 0), CellState.SOWN);
        world.setCellState(Position.of(2, 2), CellState.DISEASED);

        Map<CellState, Integer> counts = world.countsByState();
        assertEquals(12, counts.values().stream().mapToInt(Integer::intValue).sum());
        assertEquals(1, counts.get(CellState.DISEASED));
        assertEquals(0, counts.get(CellState.HEALTHY));
        assertEquals(9, world.countCellsByState(CellState.INITIAL));
    }

    @Nested
    @DisplayName("attributes")
    class AttributeTests {

        @Test
        @DisplayName("update merges into existing attributes")
        void updateMerges() {
            Position p = Position.of(1, 1);
            world.updateCellAttributes(p, Map.of(CellAttribute.WATER_LEVEL, 0.4, CellAttribute.GROWTH_PROGRESS, 12));
            world.updateCellAttributes(p, Map.of(CellAttribute.DISEASE_PROBABILITY, 0.1));

            CellAttributes attrs = world.getCellAttributes(p);
            assertEquals(0.4, attrs.waterLevel());
            assertEquals(12, attrs.growthProgress());
            assertEquals(0.1, attrs.diseaseProbability());
            assertEquals(0, attrs.lastWatered());
        }
    }

    @Nested
    @DisplayName("out of bounds")
    class OutOfBoundsTests {

        @Test
        @DisplayName("reads return neutral defaults")
        void readsAreNeutral() {
            Position outside = Position.of(4, 0);
            assertFalse(world.contains(outside));
            assertEquals(CellState.INITIAL, world.getCellState(outside));
            assertEquals(CellAttributes.EMPTY, world.getCellAttributes(Position.of(-1, -1)));
        }

        @Test
        @DisplayName("writes throw IllegalArgumentException")
        void writesThrow() {
            assertThrows(IllegalArgumentException.class,
                    () -> world.setCellState(Position.of(0, 3), CellState.SOWN));
            assertThrows(IllegalArgumentException.class,
                    () -> world.updateCellAttributes(Position.of(9, 9), Map.of(CellAttribute.WATER_LEVEL, 1.0)));
        }
    }

    @Test
    @DisplayName("recordHarvest increments the harvest counter")
    void harvestCounter() {
        assertEquals(0, world.harvestedCount());
        world.recordHarvest();
        assertEquals(2, world.recordHarvest());
        assertEquals(2, world.harvestedCount());
    }
}
