package com.agrigrid.dispatch.cli;

import com.agrigrid.core.engine.FarmForecast;
import com.agrigrid.core.engine.SimulationEngine;
import com.agrigrid.core.model.TelemetrySnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: agrigrid run [--ticks N] [--report-every K]
 * <p>
 * Advances the shared simulation and prints cell-state counts every K ticks,
 * then the agents, the weather and the yield forecast.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Advance the farm simulation")
@Component
public class RunCommand implements Runnable {

    @Option(names = {"--ticks", "-t"}, description = "Ticks to simulate (default: ${DEFAULT-VALUE})",
            defaultValue = "100")
    private int ticks;

    @Option(names = {"--report-every", "-r"}, description = "Print a progress line every K ticks (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int reportEvery;

    private final SimulationEngine engine;

    public RunCommand(SimulationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (ticks < 1) {
            ConsoleOutput.error("--ticks must be at least 1, got " + ticks);
            return;
        }
        int every = Math.max(1, reportEvery);
        ConsoleOutput.info("Simulating " + ticks + " tick(s)...");

        TelemetrySnapshot snapshot = engine.telemetry();
        int remaining = ticks;
        try {
            while (remaining > 0) {
                int chunk = Math.min(Math.min(every, remaining), SimulationEngine.MAX_TICKS_PER_CALL);
                snapshot = engine.advance(chunk);
                remaining -= chunk;
                ConsoleOutput.tick(snapshot);
            }
        } catch (RuntimeException e) {
            ConsoleOutput.error("Simulation failed at tick " + snapshot.tick() + ": " + e.getMessage());
            return;
        }

        System.out.println();
        snapshot.agents().forEach(ConsoleOutput::agent);
        ConsoleOutput.weather(snapshot);

        FarmForecast forecast = engine.forecast();
        ConsoleOutput.forecast(forecast.yield(), forecast.stress());
    }
}
