package com.agrigrid.core.scheduler;

import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellKnowledge;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TaskType;
import com.agrigrid.core.model.WeatherState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchPlanBuilderTest {

    private static CellKnowledge cell(int x, int y, CellState state) {
        return new CellKnowledge(Position.of(x, y), state, CellAttributes.EMPTY, 0, List.of());
    }

    @Test
    void buildsOneRequestPerActionableCell() {
        var snapshot = List.of(
                cell(0, 0, CellState.INITIAL),
                cell(0, 1, CellState.GROWING),
                cell(0, 2, CellState.READY_TO_HARVEST),
                cell(0, 3, CellState.SOWN));

        List<ScheduleRequest> requests = new BatchPlanBuilder().build(snapshot, WeatherState.defaults());

        assertEquals(3, requests.size());
        ScheduleRequest plough = requests.get(0);
        assertEquals("plan-1", plough.taskId());
        assertEquals(TaskType.PLOUGH, plough.taskType());
        assertEquals(50, plough.priority());
        assertEquals(2, plough.duration());
        assertEquals(Map.of(ResourceType.FUEL, 10.0), plough.resources());

        assertEquals(TaskType.HARVEST, requests.get(1).taskType());
        assertEquals(80, requests.get(1).priority());
        assertEquals(Position.of(0, 3), requests.get(2).targetCell());
        assertEquals(Map.of(ResourceType.WATER, 50.0), requests.get(2).resources());
        assertEquals("plan-3", requests.get(2).taskId());
    }

    @Test
    void rainForecastSuppressesThirstyCells() {
        var rainy = new WeatherState(20.0, 80.0, true, 5.0);

        var requests = new BatchPlanBuilder().build(List.of(cell(1, 1, CellState.NEED_WATER)), rainy);

        assertTrue(requests.isEmpty());
    }

    @Test
    void typesWithoutAProfileAreSkipped() {
        var builder = new BatchPlanBuilder(Map.of(TaskType.SOW, new BatchPlanBuilder.TaskProfile(3, ResourceType.TOOLS, 1.0)));

        var requests = builder.build(List.of(cell(0, 0, CellState.INITIAL), cell(1, 0, CellState.PLOUGHED)),
                WeatherState.defaults());

        assertEquals(1, requests.size());
        assertEquals(TaskType.SOW, requests.get(0).taskType());
        assertEquals(3, requests.get(0).duration());
        assertEquals(2, BatchPlanBuilder.defaultProfile(TaskType.HARVEST).duration());
    }
}
