package com.agrigrid.dispatch.cli;

import com.agrigrid.core.config.SimulationProperties;
import com.agrigrid.core.engine.SimulationEngine;
import com.agrigrid.core.health.HealthCheckService;
import com.agrigrid.core.health.HealthStatus;
import com.agrigrid.core.metrics.FarmMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Agrigrid CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * using a small real engine for run and schedule and a mock for health.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private SimulationEngine engine;
    private HealthCheckService healthService;

    @BeforeEach
    void setUp() {
        var properties = new SimulationProperties();
        properties.getGrid().setWidth(8);
        properties.getGrid().setHeight(8);
        properties.getScheduler().setHorizon(20);
        engine = new SimulationEngine(properties, new FarmMetrics(new SimpleMeterRegistry()));
        healthService = mock(HealthCheckService.class);
        when(healthService.checkAll()).thenReturn(List.of(
                HealthStatus.up("engine", "Simulation at tick 0", Map.of("tick", "0", "resets", "0")),
                HealthStatus.up("workers", "5 worker(s) registered",
                        Map.of("plough-1", "MOVING", "sow-1", "IDLE")),
                HealthStatus.up("planner", "3 queued, 2 active",
                        Map.of("queued", "3", "active", "2", "backlogLimit", "50"))));
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(engine);
                }
                if (cls == ScheduleCommand.class) {
                    return (K) new ScheduleCommand(engine);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthService);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AgrigridCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("schedule"));
            assertTrue(result.output().contains("health"));
            assertTrue(result.output().contains("serve"));
        }

        @Test
        @DisplayName("--version prints the version string")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Agrigrid 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("AGRIGRID"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("unknown option fails with a usage error")
        void unknownOption() {
            CliResult result = execute("run", "--bogus");

            assertNotEquals(0, result.exitCode());
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("prints a progress line per report interval and the forecast")
        void runPrintsProgress() {
            CliResult result = execute("run", "--ticks", "6", "--report-every", "3");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TICK 3"));
            assertTrue(result.output().contains("TICK 6"));
            assertTrue(result.output().contains("Forecast"));
            assertTrue(result.output().contains("plough-1"));
            assertEquals(6, engine.telemetry().tick());
        }

        @Test
        @DisplayName("rejects a non-positive tick count")
        void runRejectsZeroTicks() {
            CliResult result = execute("run", "-t", "0");

            assertTrue(result.output().contains("--ticks must be at least 1"));
            assertEquals(0, engine.telemetry().tick());
        }
    }

    @Nested
    @DisplayName("schedule")
    class ScheduleTests {

        @Test
        @DisplayName("prints assignments and metrics")
        void schedulePrintsMetrics() {
            CliResult result = execute("schedule");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Schedule Metrics"));
            assertTrue(result.output().contains("Makespan"));
            assertTrue(result.output().contains("over 20 slot(s)"));
        }

        @Test
        @DisplayName("warm-up advances the live farm before planning")
        void warmup() {
            execute("schedule", "--warmup", "4", "-H", "10");

            assertEquals(4, engine.telemetry().tick());
        }

        @Test
        @DisplayName("--export writes the schedule as JSON")
        void export(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("out/schedule.json");

            CliResult result = execute("schedule", "--export", file.toString());

            assertTrue(result.output().contains("Exported schedule"));
            assertTrue(Files.readString(file).contains("\"assignments\""));
        }

        @Test
        @DisplayName("rejects a non-positive horizon")
        void invalidHorizon() {
            CliResult result = execute("schedule", "--horizon", "0");

            assertTrue(result.output().contains("--horizon must be at least 1"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("all components UP exits 0 and prints each component's figures")
        void allUp() {
            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("engine: Simulation at tick 0"));
            assertTrue(result.output().matches("(?s).*plough-1\\s+MOVING.*"));
            assertTrue(result.output().matches("(?s).*queued\\s+3.*"));
            assertTrue(result.output().matches("(?s).*backlogLimit\\s+50.*"));
            assertTrue(result.output().contains("Farm UP"));
        }

        @Test
        @DisplayName("--brief prints status lines without figures")
        void brief() {
            CliResult result = execute("health", "--brief");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("planner: 3 queued, 2 active"));
            assertFalse(result.output().contains("backlogLimit"));
            assertFalse(result.output().contains("plough-1"));
        }

        @Test
        @DisplayName("a degraded component is reported but exits 0")
        void degraded() {
            when(healthService.checkAll()).thenReturn(List.of(
                    HealthStatus.up("engine", "Simulation at tick 0", Map.of()),
                    HealthStatus.degraded("workers", "No worker for [MONITORING]", Map.of("plough-1", "IDLE"))));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No worker for [MONITORING]"));
            assertTrue(result.output().contains("Farm DEGRADED: 1 component(s) need attention"));
        }

        @Test
        @DisplayName("a DOWN component exits 1")
        void down() {
            when(healthService.checkAll()).thenReturn(List.of(
                    HealthStatus.up("engine", "Simulation at tick 0", Map.of()),
                    HealthStatus.down("workers", "No workers registered")));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Farm DOWN: 1 component(s) down"));
        }

        @Test
        @DisplayName("missing service prints an error and exits 1")
        void missingService() {
            healthService = null;

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Health check service not available"));
        }
    }
}
