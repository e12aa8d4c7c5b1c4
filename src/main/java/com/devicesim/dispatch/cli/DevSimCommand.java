package com.devicesim.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for devsim.
 * Routes to subcommands: validate, show, apply, simulate, inspect.
 */
@Command(
        name = "devsim",
        mixinStandardHelpOptions = true,
        version = "devsim 0.1.0",
        description = "Branching state simulator for devices with partially observed attributes",
        subcommands = {
                ValidateCommand.class,
                ShowCommand.class,
                ApplyCommand.class,
                SimulateCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DevSimCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // no subcommand: show usage
        new CommandLine(this).usage(System.out);
    }
}
