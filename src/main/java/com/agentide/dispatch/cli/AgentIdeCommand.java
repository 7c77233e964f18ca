package com.agentide.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.Arrays;

/**
 * Top-level command. Subcommands: run, status, history, health, serve.
 */
@Command(
        name = "agentide",
        mixinStandardHelpOptions = true,
        version = "AgentIDE 0.1.0",
        description = "Plan-and-execute coding assistant with human review",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentIdeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }

    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains("serve");
    }
}
