package com.agentide.core.worker;

import com.agentide.core.model.ToolAction;
import com.agentide.core.model.WorkerReply;

import java.util.ArrayList;
import java.util.List;

/**
 * Running record of one worker execution: the task it was given and every tool round trip.
 */
public class WorkerTranscript {

    private final String task;
    private final List<String> rounds = new ArrayList<>();

    public WorkerTranscript(String task) {
        this.task = task;
    }

    /**
     * Appends one round: what the worker asked for and what each tool returned.
     */
    public void addRound(WorkerReply reply, List<String> toolResults) {
        var sb = new StringBuilder();
        int round = rounds.size() + 1;
        sb.append("--- Round ").append(round).append(" ---\n");
        if (!reply.message().isBlank()) {
            sb.append("You said: ").append(reply.message()).append('\n');
        }
        List<ToolAction> actions = reply.actions();
        for (int i = 0; i < actions.size(); i++) {
            ToolAction action = actions.get(i);
            sb.append("Tool ").append(action.tool()).append('(').append(action.path() == null ? "" : action.path())
              .append(") -> ").append(i < toolResults.size() ? toolResults.get(i) : "").append('\n');
        }
        rounds.add(sb.toString());
    }

    public int rounds() {
        return rounds.size();
    }

    public String task() {
        return task;
    }

    public String render() {
        if (rounds.isEmpty()) {
            return task;
        }
        return task + "\n\n=== TOOL RESULTS SO FAR ===\n" + String.join("\n", rounds)
                + "\nContinue. Reply with no actions when the task is complete.";
    }
}
