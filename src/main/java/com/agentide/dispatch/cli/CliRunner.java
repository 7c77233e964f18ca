package com.agentide.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands the command line to picocli once the Spring context is up.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AgentIdeCommand agentIdeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AgentIdeCommand agentIdeCommand, IFactory factory) {
        this.agentIdeCommand = agentIdeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // The embedded server owns the process in serve mode.
        if (AgentIdeCommand.isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(agentIdeCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
