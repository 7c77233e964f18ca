package com.agentide.dispatch.cli;

import com.agentide.core.engine.SessionEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: agentide history
 * <p>
 * Lists known sessions as a table: Session ID | Status | Artifacts | Request (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List sessions")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final SessionEngine sessionEngine;

    public HistoryCommand(SessionEngine sessionEngine) {
        this.sessionEngine = sessionEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> sessionIds = sessionEngine.listSessions();
        if (sessionIds.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return;
        }

        List<String> display = sessionIds.size() > limit
                ? sessionIds.subList(sessionIds.size() - limit, sessionIds.size())
                : sessionIds;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessionIds.size() + "):");
        System.out.println();
        System.out.printf("  %-16s %-16s %-10s %s%n", "SESSION ID", "STATUS", "ARTIFACTS", "REQUEST");
        System.out.println("  " + "-".repeat(72));

        for (String sessionId : display) {
            var stateOpt = sessionEngine.getState(sessionId);
            if (stateOpt.isPresent()) {
                var snapshot = stateOpt.get();
                System.out.printf("  %-16s %-16s %-10d %s%n", sessionId, sessionEngine.status(sessionId),
                        snapshot.generatedArtifacts().size(), StatusCommand.truncate(snapshot.originalRequest(), 30));
            } else {
                System.out.printf("  %-16s %-16s %-10s %s%n", sessionId, "UNKNOWN", "-", "-");
            }
        }
    }
}
