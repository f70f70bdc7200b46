package com.agrigrid.dispatch.cli;

import com.agrigrid.core.engine.SimulationEngine;
import com.agrigrid.core.scheduler.ScheduleExporter;
import com.agrigrid.core.scheduler.ScheduleResult;
import com.agrigrid.core.scheduler.TaskAssignment;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;

/**
 * CLI command: agrigrid schedule [--horizon H] [--warmup N] [--export FILE]
 * <p>
 * Builds a what-if batch plan from what the planner currently knows about the farm
 * and places it with the first-fit constraint scheduler. The live simulation is only
 * touched by the optional warm-up ticks.
 */
@Command(name = "schedule", mixinStandardHelpOptions = true,
        description = "Build a what-if batch schedule from the current farm")
@Component
public class ScheduleCommand implements Runnable {

    @Option(names = {"--horizon", "-H"}, description = "Slots in the scheduling horizon (default: configured)")
    private Integer horizon;

    @Option(names = {"--warmup", "-w"}, description = "Ticks to simulate before planning (default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    private int warmup;

    @Option(names = {"--export", "-o"}, description = "Write assignments and metrics as JSON to this file")
    private Path export;

    private final SimulationEngine engine;
    private final ScheduleExporter exporter = new ScheduleExporter();

    public ScheduleCommand(SimulationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        int slots = horizon != null ? horizon : engine.defaultHorizon();
        if (slots < 1) {
            ConsoleOutput.error("--horizon must be at least 1, got " + slots);
            return;
        }
        if (warmup > 0) {
            ConsoleOutput.info("Warming up for " + warmup + " tick(s)...");
            int remaining = warmup;
            while (remaining > 0) {
                int chunk = Math.min(remaining, SimulationEngine.MAX_TICKS_PER_CALL);
                engine.advance(chunk);
                remaining -= chunk;
            }
        }

        var scheduler = engine.newScheduler(slots);
        ScheduleResult result = engine.planFromFarm(scheduler);

        ConsoleOutput.info("Placed " + result.assignments().size() + " task(s) over " + slots + " slot(s)");
        result.assignments().stream()
                .sorted(Comparator.comparingInt(TaskAssignment::startSlot).thenComparing(TaskAssignment::agentId))
                .forEach(ConsoleOutput::assignment);
        if (!result.rejected().isEmpty()) {
            ConsoleOutput.warn("No slot or resources for: " + String.join(", ", result.rejected()));
        }
        ConsoleOutput.scheduleMetrics(result.metrics(), result.rejected().size());

        if (export != null) {
            try {
                exporter.export(scheduler, export);
                ConsoleOutput.success("Exported schedule to " + export);
            } catch (IOException e) {
                ConsoleOutput.error("Export failed: " + e.getMessage());
            }
        }
    }
}
