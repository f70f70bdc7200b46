package com.agrigrid.core.scheduler;

import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TaskType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleExporterTest {

    private final ScheduleExporter exporter = new ScheduleExporter();
    private FirstFitConstraintScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new FirstFitConstraintScheduler(6);
        scheduler.scheduleTasks(List.of(
                new ScheduleRequest("p1", TaskType.PLOUGH, Position.of(0, 0), 90, 2, Map.of(ResourceType.FUEL, 10.0)),
                new ScheduleRequest("p2", TaskType.PLOUGH, Position.of(1, 0), 80, 2, Map.of(ResourceType.FUEL, 10.0)),
                new ScheduleRequest("w1", TaskType.WATER, Position.of(2, 2), 70, 1, Map.of(ResourceType.WATER, 50.0))),
                Map.of(AgentType.PLOUGHING, List.of("plough-1"), AgentType.WATERING, List.of("water-1")));
    }

    @Test
    void snapshotOrdersBySlotThenAgent() {
        var snapshot = exporter.snapshot(scheduler);

        assertEquals(6, snapshot.horizon());
        assertEquals(List.of("p1", "w1", "p2"),
                snapshot.assignments().stream().map(TaskAssignment::taskId).toList());
        assertEquals(3, snapshot.metrics().totalTasks());
    }

    @Test
    void jsonCarriesAssignmentsAndMetrics() throws Exception {
        JsonNode root = new ObjectMapper().readTree(exporter.toJson(scheduler));

        assertEquals(6, root.get("horizon").asInt());
        assertEquals(3, root.get("assignments").size());
        assertEquals("plough-1", root.get("assignments").get(0).get("agentId").asText());
        assertEquals(4, root.get("metrics").get("makespan").asInt());
        assertTrue(root.get("metrics").get("resourceUtilisation").has("FUEL"));
    }

    @Test
    void exportCreatesMissingDirectories(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("plans/today/schedule.json");

        exporter.export(scheduler, file);

        assertTrue(Files.exists(file));
        JsonNode root = new ObjectMapper().readTree(Files.readString(file));
        assertEquals(3, root.get("assignments").size());
    }
}
