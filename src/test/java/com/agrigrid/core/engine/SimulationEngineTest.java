package com.agrigrid.core.engine;

import com.agrigrid.core.config.SimulationProperties;
import com.agrigrid.core.metrics.FarmMetrics;
import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TaskType;
import com.agrigrid.core.scheduler.ResourceType;
import com.agrigrid.core.scheduler.ScheduleRequest;
import com.agrigrid.core.scheduler.ScheduleResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SimulationEngineTest {

    private SimulationProperties properties;
    private SimpleMeterRegistry registry;
    private SimulationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new SimulationProperties();
        registry = new SimpleMeterRegistry();
        engine = new SimulationEngine(properties, new FarmMetrics(registry));
    }

    @Nested
    @DisplayName("advance")
    class AdvanceTests {

        @Test
        void rejectsOutOfRangeTickCounts() {
            assertThrows(IllegalArgumentException.class, () -> engine.advance(0));
            assertThrows(IllegalArgumentException.class, () -> engine.advance(SimulationEngine.MAX_TICKS_PER_CALL + 1));
            assertEquals(0, engine.telemetry().tick());
        }

        @Test
        void advancesTheSharedFarm() {
            engine.advance(5);
            assertEquals(8, engine.advance(3).tick());
        }

        @Test
        @DisplayName("concurrent callers never interleave ticks")
        void serialisesCallers() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<?>> futures = List.of(
                        pool.submit(() -> engine.advance(25)),
                        pool.submit(() -> engine.advance(25)),
                        pool.submit(() -> engine.advance(25)),
                        pool.submit(() -> engine.advance(25)));
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(100, engine.telemetry().tick());
        }
    }

    @Test
    void resetStartsOver() {
        engine.advance(20);

        var telemetry = engine.reset();

        assertEquals(0, telemetry.tick());
        assertEquals(1, engine.resets());
        assertEquals(400, telemetry.cellCounts().values().stream().mapToInt(Integer::intValue).sum());
        assertEquals(1, engine.advance(1).tick());
    }

    @Test
    void cellLookup() {
        assertTrue(engine.cell(-1, 0).isEmpty());
        assertTrue(engine.cell(0, 20).isEmpty());
        assertEquals(Position.of(3, 4), engine.cell(3, 4).orElseThrow().position());
    }

    @Nested
    @DisplayName("what-if scheduling")
    class ScheduleTests {

        @Test
        @DisplayName("plans from farm knowledge within fuel and horizon limits")
        void planFromFarm() {
            ScheduleResult result = engine.planFromFarm(100);

            // 400 fresh cells, each a 2-slot plough drawing 10 fuel from a pool of 500
            assertEquals(50, result.assignments().size());
            assertEquals(350, result.rejected().size());
            assertEquals(100, result.metrics().makespan());
            assertEquals(1.0, result.metrics().resourceUtilisation().get(ResourceType.FUEL), 1e-9);
            assertEquals(50.0, registry.get("agrigrid.schedule.tasks").tag("result", "scheduled").counter().count());
        }

        @Test
        @DisplayName("leaves the live simulation untouched")
        void isolated() {
            engine.advance(3);
            var before = engine.telemetry();

            engine.planFromFarm(20);

            assertEquals(before, engine.telemetry());
        }

        @Test
        void schedulesSuppliedRequests() {
            var requests = List.of(
                    new ScheduleRequest("a", TaskType.HARVEST, Position.of(1, 1), 80, 2, Map.of(ResourceType.FUEL, 8.0)),
                    new ScheduleRequest("b", TaskType.SOW, Position.of(2, 1), 60, 1, Map.of()));

            ScheduleResult result = engine.schedule(requests, Map.of(AgentType.HARVESTING, List.of("h1")), 10);

            assertEquals(1, result.assignments().size());
            assertEquals("h1", result.assignments().get(0).agentId());
            assertEquals(List.of("b"), result.rejected());
        }

        @Test
        void rosterFollowsConfiguredAgentsPerType() {
            properties.getScheduler().setAgentsPerType(2);

            var roster = engine.defaultRoster();

            assertEquals(List.of("plough-1", "plough-2"), roster.get(AgentType.PLOUGHING));
            assertEquals(List.of("harvest-1", "harvest-2"), roster.get(AgentType.HARVESTING));
            assertFalse(roster.containsKey(AgentType.MONITORING));
        }

        @Test
        void schedulerUsesConfiguredPools() {
            properties.getScheduler().setWaterCapacity(42.0);

            var scheduler = engine.newScheduler(7);

            assertEquals(7, scheduler.horizon());
            assertEquals(42.0, scheduler.resource(ResourceType.WATER).capacity());
            assertEquals(100, engine.defaultHorizon());
        }
    }
}
