package com.agentide.dispatch.cli;

import com.agentide.core.engine.SessionEngine;
import com.agentide.core.model.SessionSnapshot;
import com.agentide.core.model.SessionStatus;
import com.agentide.core.model.Step;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: agentide status &lt;session-id&gt;
 * <p>
 * Shows the latest checkpointed state of a session with its plan progress.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check session status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    private final SessionEngine sessionEngine;

    public StatusCommand(SessionEngine sessionEngine) {
        this.sessionEngine = sessionEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var stateOpt = sessionEngine.getState(sessionId);
        if (stateOpt.isEmpty()) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return;
        }
        SessionSnapshot snapshot = stateOpt.get();

        System.out.println();
        System.out.println("SESSION " + snapshot.sessionId());
        System.out.println("Request: " + snapshot.originalRequest());
        System.out.println("Root: " + snapshot.workingRoot());

        SessionStatus status = sessionEngine.status(sessionId);
        switch (status) {
            case COMPLETED -> ConsoleOutput.success("Status: " + status);
            case FAILED -> ConsoleOutput.error("Status: " + status);
            default -> ConsoleOutput.info("Status: " + status);
        }

        var plan = snapshot.plan();
        if (!plan.isEmpty()) {
            System.out.println();
            System.out.printf("  %-5s %-12s %-8s %-20s %s%n", "STEP", "WORKER", "STATE", "TARGET", "INSTRUCTION");
            System.out.println("  " + "-".repeat(72));
            for (int i = 0; i < plan.size(); i++) {
                Step step = plan.get(i);
                String state = i < snapshot.stepIndex() ? "done" : i == snapshot.stepIndex() ? "current" : "pending";
                System.out.printf("  %-5d %-12s %-8s %-20s %s%n", i + 1, step.workerKind(), state,
                        truncate(step.targetArtifact(), 20), truncate(step.instruction(), 30));
            }
        }

        if (!snapshot.generatedArtifacts().isEmpty()) {
            System.out.println();
            snapshot.generatedArtifacts().forEach(ConsoleOutput::fileChange);
        }
        if (!snapshot.finalSummary().isEmpty()) {
            System.out.println();
            ConsoleOutput.info(snapshot.finalSummary());
        }
        sessionEngine.failure(sessionId).ifPresent(error -> ConsoleOutput.error("Error: " + error));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
