package com.agrigrid.core.engine;

import com.agrigrid.core.agents.WorkerAgent;
import com.agrigrid.core.config.SimulationProperties;
import com.agrigrid.core.metrics.FarmMetrics;
import com.agrigrid.core.model.AgentStatus;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TelemetrySnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FarmSimulationTest {

    private SimulationProperties properties;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new SimulationProperties();
        registry = new SimpleMeterRegistry();
    }

    private FarmSimulation create() {
        return FarmSimulation.create(properties, new FarmMetrics(registry));
    }

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("starts at tick zero with one worker per type and a drone")
        void defaultFarm() {
            FarmSimulation sim = create();
            TelemetrySnapshot telemetry = sim.telemetry();

            assertEquals(0, telemetry.tick());
            assertEquals(400, telemetry.cellCounts().get(CellState.INITIAL));
            assertEquals(5, telemetry.agents().size());
            assertTrue(sim.drone().isPresent());
            assertEquals(Position.of(2, 2), sim.workers().get(0).position());
            assertEquals(Position.of(17, 17), sim.workers().get(3).position());
        }

        @Test
        @DisplayName("worker start positions are clamped into small grids")
        void smallGrid() {
            properties.getGrid().setWidth(3);
            properties.getGrid().setHeight(2);

            FarmSimulation sim = create();

            for (WorkerAgent worker : sim.workers()) {
                assertTrue(sim.world().contains(worker.position()), worker.id());
            }
        }

        @Test
        @DisplayName("rejects a non-positive weather interval")
        void invalidWeatherInterval() {
            properties.getWeather().setUpdateInterval(0);

            assertThrows(IllegalArgumentException.class, FarmSimulationTest.this::create);
        }
    }

    @Nested
    @DisplayName("step")
    class StepTests {

        @Test
        @DisplayName("cell counts always cover the whole grid")
        void countsCoverGrid() {
            FarmSimulation sim = create();
            for (int i = 0; i < 300; i++) {
                TelemetrySnapshot telemetry = sim.step();
                int total = telemetry.cellCounts().values().stream().mapToInt(Integer::intValue).sum();
                assertEquals(400, total, "tick " + telemetry.tick());
            }
        }

        @Test
        @DisplayName("a worker holds a task exactly when it is not idle")
        void taskIffBusy() {
            FarmSimulation sim = create();
            for (int i = 0; i < 150; i++) {
                sim.step();
                for (WorkerAgent worker : sim.workers()) {
                    assertEquals(worker.status() != AgentStatus.IDLE, worker.currentTask() != null,
                            worker.id() + " at tick " + sim.clock().current());
                }
            }
        }

        @Test
        @DisplayName("the same seed replays the same farm")
        void deterministic() {
            FarmSimulation first = create();
            FarmSimulation second = create();

            TelemetrySnapshot a = first.run(200);
            TelemetrySnapshot b = second.run(200);

            assertEquals(a, b);
            assertEquals(first.planner().completedCount(), second.planner().completedCount());
        }

        @Test
        @DisplayName("workers make progress on the field")
        void progress() {
            FarmSimulation sim = create();

            TelemetrySnapshot telemetry = sim.run(100);

            assertTrue(telemetry.cellCounts().get(CellState.INITIAL) < 400);
            assertTrue(sim.planner().completedCount() > 0);
            assertTrue(sim.planner().createdCount() > 0);
            assertEquals(100, registry.get("agrigrid.tick.duration").timer().count());
        }

        @Test
        @DisplayName("run rejects negative counts and treats zero as a read")
        void runBounds() {
            FarmSimulation sim = create();

            assertThrows(IllegalArgumentException.class, () -> sim.run(-1));
            assertEquals(0, sim.run(0).tick());
            assertEquals(3, sim.run(3).tick());
        }
    }

    @Test
    void describeCellReportsStateAndPendingTasks() {
        FarmSimulation sim = create();
        sim.step();

        assertTrue(sim.describeCell(Position.of(20, 0)).isEmpty());
        CellReport report = sim.describeCell(Position.of(0, 0)).orElseThrow();
        assertEquals(Position.of(0, 0), report.position());
        assertNotNull(report.state());
        assertNotNull(report.pendingTasks());
    }

    @Test
    void forecastUsesCurrentTick() {
        FarmSimulation sim = create();
        sim.run(4);

        FarmForecast forecast = sim.forecast();

        assertEquals(4, forecast.tick());
        assertTrue(forecast.yield().estimatedHarvestTick() >= 4);
        assertTrue(forecast.stress().overallHealthScore() <= 100.0);
    }
}
