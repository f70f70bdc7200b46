package com.agrigrid.dispatch.cli;

import com.agrigrid.core.analytics.StressIndicators;
import com.agrigrid.core.analytics.YieldForecast;
import com.agrigrid.core.health.HealthStatus;
import com.agrigrid.core.model.AgentSnapshot;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.TelemetrySnapshot;
import com.agrigrid.core.scheduler.ScheduleMetrics;
import com.agrigrid.core.scheduler.TaskAssignment;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for Agrigrid CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) AGRIGRID v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGRIGRID]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void tick(TelemetrySnapshot snapshot) {
        StringBuilder counts = new StringBuilder();
        for (Map.Entry<CellState, Integer> entry : snapshot.cellCounts().entrySet()) {
            if (entry.getValue() == 0) continue;
            if (counts.length() > 0) counts.append(", ");
            counts.append(entry.getKey().name().toLowerCase()).append('=').append(entry.getValue());
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [TICK " + snapshot.tick() + "]|@ " + counts
                + " | harvested " + snapshot.harvested()
                + " | queued " + snapshot.queuedTasks() + ", active " + snapshot.activeTasks()));
    }

    public static void agent(AgentSnapshot agent) {
        String task = agent.currentTaskId() != null ? " on " + agent.currentTaskId() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + agent.type() + "]|@ " + agent.id() + " " + agent.status()
                + " at " + agent.position() + task));
    }

    public static void weather(TelemetrySnapshot snapshot) {
        var w = snapshot.weather();
        String rain = w.rainForecast24h() ? ", rain forecast" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [WEATHER]|@ " + String.format("%.1f°C, humidity %.0f%%, wind %.0f km/h%s",
                        w.temperature(), w.humidity(), w.windSpeed(), rain)));
    }

    public static void forecast(YieldForecast yield, StressIndicators stress) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Forecast|@"));
        System.out.println(String.format("  Yield: %.2f estimated, %d harvested, %.2f potential",
                yield.estimatedYield(), yield.currentHarvest(), yield.potentialYield()));
        System.out.println(String.format("  Growth: %.1f%% average, ~%d tick(s) to harvest",
                yield.averageGrowthProgress(), yield.ticksToHarvest()));
        String scoreColor = stress.overallHealthScore() >= 70 ? "fg(green)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Health: @|" + scoreColor + " " + stress.overallHealthScore() + "%|@"
                + " (water stress " + stress.waterStressPercentage() + "%, heat stress "
                + stress.temperatureStressPercentage() + "%)"));
    }

    public static void assignment(TaskAssignment a) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) " + String.format("%3d-%-3d", a.startSlot(), a.endSlot()) + "|@ "
                + a.agentId() + " " + a.taskType() + " " + a.targetCell() + " (" + a.taskId()
                + ", priority " + a.priority() + ")"));
    }

    public static void scheduleMetrics(ScheduleMetrics m, int rejected) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Schedule Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + m.totalTasks() + " placed|@"
                + (rejected > 0 ? ", @|fg(red) " + rejected + " rejected|@" : "")));
        System.out.println("  Makespan: " + m.makespan() + " slot(s)");
        m.resourceUtilisation().forEach((type, use) ->
                System.out.println(String.format("  %-6s %5.1f%% used", type, use * 100)));
        m.agentUtilisation().forEach((agent, use) ->
                System.out.println(String.format("  %-10s %5.1f%% busy", agent, use * 100)));
    }

    /**
     * One status line per component, followed by its figures when {@code withFigures} is set.
     */
    public static void healthCheck(HealthStatus check, boolean withFigures) {
        String color = switch (check.status()) {
            case UP -> "fg(green)";
            case DEGRADED -> "fg(yellow)";
            case DOWN -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " " + String.format("%-8s", "[" + check.status() + "]") + "|@ "
                + check.component() + ": " + check.detail()));
        if (withFigures) {
            check.metadata().forEach((key, value) ->
                    System.out.println(String.format("           %-12s %s", key, value)));
        }
    }
}
