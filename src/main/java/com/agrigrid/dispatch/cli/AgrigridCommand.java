package com.agrigrid.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Agrigrid.
 * Routes to subcommands: run, schedule, health, serve.
 */
@Command(
        name = "agrigrid",
        mixinStandardHelpOptions = true,
        version = "Agrigrid 0.1.0",
        description = "Grid farm simulation with a master planner and autonomous workers",
        subcommands = {
                RunCommand.class,
                ScheduleCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgrigridCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
