package com.agentide.dispatch.cli;

import com.agentide.core.engine.SessionEngine;
import com.agentide.core.events.EventBus;
import com.agentide.core.events.SessionEvent;
import com.agentide.core.model.SessionSnapshot;
import com.agentide.core.model.Step;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Supplier;

/**
 * CLI command: agentide run "&lt;request&gt;"
 * <p>
 * Runs a session in the foreground. Whenever the session stops for review the summary is
 * printed and a line of feedback is read from standard input; an empty line approves.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a coding session")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language task")
    private String request;

    @Option(names = {"--root", "-r"}, description = "Project directory the agents work in (default: current directory)")
    private String root;

    @Option(names = "--skip-review", description = "Finish without asking for review")
    private boolean skipReview;

    private final SessionEngine sessionEngine;
    private final EventBus eventBus;
    private final Supplier<BufferedReader> input;

    @Autowired
    public RunCommand(SessionEngine sessionEngine, EventBus eventBus) {
        this(sessionEngine, eventBus,
                () -> new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    RunCommand(SessionEngine sessionEngine, EventBus eventBus, Supplier<BufferedReader> input) {
        this.sessionEngine = sessionEngine;
        this.eventBus = eventBus;
        this.input = input;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        String sessionId;
        try {
            sessionId = sessionEngine.startSession(request, root, skipReview);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        ConsoleOutput.info("Session " + sessionId + " started");

        var subscription = eventBus.subscribe(sessionId, RunCommand::printStep);
        try {
            BufferedReader reader = input.get();
            SessionSnapshot snapshot = sessionEngine.run(sessionId);
            while (!snapshot.done()) {
                if (!snapshot.suspended()) {
                    ConsoleOutput.error("Session stopped before review: next component " + snapshot.nextComponent());
                    return;
                }
                printReview(snapshot);
                String feedback = readFeedback(reader);
                if (feedback == null) {
                    ConsoleOutput.info("No input. Session " + sessionId + " is waiting for review.");
                    return;
                }
                snapshot = sessionEngine.resume(sessionId, feedback, null);
            }
            System.out.println();
            for (String artifact : snapshot.generatedArtifacts()) {
                ConsoleOutput.fileChange(artifact);
            }
            ConsoleOutput.success(snapshot.finalSummary());
        } catch (RuntimeException e) {
            ConsoleOutput.error("Session failed: " + rootCauseMessage(e));
        } finally {
            subscription.unsubscribe();
        }
    }

    private static void printStep(SessionEvent event) {
        if (SessionEvent.STEP.equals(event.eventType())) {
            Object stepIndex = event.payload().get("stepIndex");
            Object plan = event.payload().get("plan");
            int planSize = plan instanceof List<?> list ? list.size() : 0;
            ConsoleOutput.component(event.component(),
                    planSize == 0 ? "planning" : "step " + stepIndex + "/" + planSize);
        }
    }

    private static void printReview(SessionSnapshot snapshot) {
        System.out.println();
        ConsoleOutput.review("Work is ready for review");
        List<Step> plan = snapshot.plan();
        for (int i = 0; i < plan.size(); i++) {
            Step step = plan.get(i);
            System.out.printf("  %d. [%-10s] %s%s%n", i + 1, step.workerKind(), step.instruction(),
                    step.hasTarget() ? " -> " + step.targetArtifact() : "");
        }
        for (String artifact : snapshot.generatedArtifacts()) {
            ConsoleOutput.fileChange(artifact);
        }
        System.out.println();
        System.out.print("Feedback (Enter or 'approve' to accept, otherwise describe changes): ");
        System.out.flush();
    }

    private static String readFeedback(BufferedReader reader) {
        try {
            String line = reader.readLine();
            return line == null ? null : line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read review feedback", e);
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
