package com.darkwatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Darkwatch.
 * Routes to subcommands: health, search, watch.
 */
@Command(
        name = "darkwatch",
        mixinStandardHelpOptions = true,
        version = "Darkwatch 0.1.0",
        description = "Aggregates dark web threat intelligence across providers",
        subcommands = {
                HealthCommand.class,
                SearchCommand.class,
                WatchCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DarkwatchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
