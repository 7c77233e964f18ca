package com.agentide.core.state;

import com.agentide.core.model.ComponentId;
import com.agentide.core.model.ReviewAction;
import com.agentide.core.model.SessionMemory;
import com.agentide.core.model.SessionSnapshot;
import com.agentide.core.model.Step;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one plan-execution session.
 * <p>
 * Every channel is a plain overwrite channel: each component returns the full new value of the
 * fields it touches. Optional text fields are stored as empty strings rather than nulls, and
 * pending feedback is tracked by a separate {@code feedbackPending} flag so that empty feedback
 * (an approval) can be told apart from no feedback at all.
 */
public class SessionState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Identity and request ─────────────────────────────────────
        Map.entry("sessionId",          Channels.base(() -> "")),
        Map.entry("request",            Channels.base(() -> "")),
        Map.entry("originalRequest",    Channels.base(() -> "")),
        Map.entry("workingRoot",        Channels.base(() -> "")),
        Map.entry("skipReview",         Channels.base(() -> false)),

        // ── Plan cursor ──────────────────────────────────────────────
        Map.entry("plan",               Channels.base((Supplier<List<Step>>) List::of)),
        Map.entry("stepIndex",          Channels.base(() -> 0)),
        Map.entry("currentInstruction", Channels.base(() -> "")),
        Map.entry("currentTarget",      Channels.base(() -> "")),
        Map.entry("workerCompleted",    Channels.base(() -> false)),
        Map.entry("stepFinished",       Channels.base(() -> false)),
        Map.entry("lastDiagnostic",     Channels.base(() -> "")),

        // ── Artifacts ────────────────────────────────────────────────
        Map.entry("generatedArtifacts", Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("artifactContents",   Channels.base((Supplier<Map<String, String>>) Map::of)),

        // ── Review ───────────────────────────────────────────────────
        Map.entry("needsReview",        Channels.base(() -> false)),
        Map.entry("suspended",          Channels.base(() -> false)),
        Map.entry("feedback",           Channels.base(() -> "")),
        Map.entry("feedbackPending",    Channels.base(() -> false)),
        Map.entry("feedbackAction",     Channels.base(() -> "")),
        Map.entry("done",               Channels.base(() -> false)),
        Map.entry("finalSummary",       Channels.base(() -> "")),

        // ── Routing ──────────────────────────────────────────────────
        Map.entry("nextComponent",      Channels.base(() -> ComponentId.PLAN_CONTROLLER.name())),
        Map.entry("activeComponent",    Channels.base(() -> "")),
        Map.entry("invocationCount",    Channels.base(() -> 0)),

        // ── Memory ───────────────────────────────────────────────────
        Map.entry("memory",             Channels.base(SessionMemory::empty))
    );

    public SessionState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Identity and request ─────────────────────────────────────────

    public String sessionId() {
        return this.<String>value("sessionId").orElse("");
    }

    public String request() {
        return this.<String>value("request").orElse("");
    }

    public String originalRequest() {
        return this.<String>value("originalRequest").orElse("");
    }

    public String workingRoot() {
        return this.<String>value("workingRoot").orElse("");
    }

    public boolean skipReview() {
        return this.<Boolean>value("skipReview").orElse(false);
    }

    // ── Plan cursor ──────────────────────────────────────────────────

    public List<Step> plan() {
        return this.<List<Step>>value("plan").orElse(List.of());
    }

    public int stepIndex() {
        return this.<Integer>value("stepIndex").orElse(0);
    }

    /** The step under the cursor, empty once the plan is exhausted. */
    public Optional<Step> currentStep() {
        List<Step> plan = plan();
        int index = stepIndex();
        return index >= 0 && index < plan.size() ? Optional.of(plan.get(index)) : Optional.empty();
    }

    public String currentInstruction() {
        return this.<String>value("currentInstruction").orElse("");
    }

    public String currentTarget() {
        return this.<String>value("currentTarget").orElse("");
    }

    public boolean workerCompleted() {
        return this.<Boolean>value("workerCompleted").orElse(false);
    }

    public boolean stepFinished() {
        return this.<Boolean>value("stepFinished").orElse(false);
    }

    public Optional<String> lastDiagnostic() {
        return this.<String>value("lastDiagnostic").filter(s -> !s.isEmpty());
    }

    // ── Artifacts ────────────────────────────────────────────────────

    public List<String> generatedArtifacts() {
        return this.<List<String>>value("generatedArtifacts").orElse(List.of());
    }

    public Map<String, String> artifactContents() {
        return this.<Map<String, String>>value("artifactContents").orElse(Map.of());
    }

    // ── Review ───────────────────────────────────────────────────────

    public boolean needsReview() {
        return this.<Boolean>value("needsReview").orElse(false);
    }

    public boolean suspended() {
        return this.<Boolean>value("suspended").orElse(false);
    }

    /** Pending reviewer feedback; present (possibly empty) only while resuming. */
    public Optional<String> feedback() {
        if (!this.<Boolean>value("feedbackPending").orElse(false)) {
            return Optional.empty();
        }
        return Optional.of(this.<String>value("feedback").orElse(""));
    }

    public Optional<ReviewAction> feedbackAction() {
        return this.<String>value("feedbackAction")
                .filter(s -> !s.isEmpty())
                .map(ReviewAction::valueOf);
    }

    public boolean done() {
        return this.<Boolean>value("done").orElse(false);
    }

    public String finalSummary() {
        return this.<String>value("finalSummary").orElse("");
    }

    // ── Routing ──────────────────────────────────────────────────────

    /** Raw routing value; interpretation is left to the router. */
    public String nextComponent() {
        return this.<String>value("nextComponent").orElse(ComponentId.PLAN_CONTROLLER.name());
    }

    public String activeComponent() {
        return this.<String>value("activeComponent").orElse("");
    }

    public int invocationCount() {
        return this.<Integer>value("invocationCount").orElse(0);
    }

    // ── Memory ───────────────────────────────────────────────────────

    public SessionMemory memory() {
        return this.<SessionMemory>value("memory").orElse(SessionMemory.empty());
    }

    // ── Snapshot conversion ──────────────────────────────────────────

    /**
     * Copies every field into a checkpoint snapshot.
     */
    public SessionSnapshot toSnapshot() {
        return new SessionSnapshot(
                sessionId(),
                request(),
                originalRequest(),
                workingRoot(),
                plan(),
                stepIndex(),
                currentInstruction(),
                currentTarget(),
                workerCompleted(),
                stepFinished(),
                generatedArtifacts(),
                artifactContents(),
                needsReview(),
                suspended(),
                feedback().orElse(null),
                feedbackAction().orElse(null),
                skipReview(),
                done(),
                nextComponent(),
                activeComponent(),
                lastDiagnostic().orElse(null),
                finalSummary(),
                invocationCount(),
                memory());
    }

    /**
     * Converts a snapshot into the map form the graph is invoked with.
     */
    public static Map<String, Object> toStateMap(SessionSnapshot snapshot) {
        var map = new HashMap<String, Object>();
        map.put("sessionId", snapshot.sessionId());
        map.put("request", nonNull(snapshot.request()));
        map.put("originalRequest", nonNull(snapshot.originalRequest()));
        map.put("workingRoot", nonNull(snapshot.workingRoot()));
        map.put("skipReview", snapshot.skipReview());
        map.put("plan", snapshot.plan());
        map.put("stepIndex", snapshot.stepIndex());
        map.put("currentInstruction", nonNull(snapshot.currentInstruction()));
        map.put("currentTarget", nonNull(snapshot.currentTarget()));
        map.put("workerCompleted", snapshot.workerCompleted());
        map.put("stepFinished", snapshot.stepFinished());
        map.put("lastDiagnostic", nonNull(snapshot.lastDiagnostic()));
        map.put("generatedArtifacts", snapshot.generatedArtifacts());
        map.put("artifactContents", Collections.unmodifiableMap(new LinkedHashMap<>(snapshot.artifactContents())));
        map.put("needsReview", snapshot.needsReview());
        map.put("suspended", snapshot.suspended());
        map.put("feedback", nonNull(snapshot.feedback()));
        map.put("feedbackPending", snapshot.hasFeedback());
        map.put("feedbackAction", snapshot.feedbackAction() == null ? "" : snapshot.feedbackAction().name());
        map.put("done", snapshot.done());
        map.put("finalSummary", nonNull(snapshot.finalSummary()));
        map.put("nextComponent", nonNull(snapshot.nextComponent()));
        map.put("activeComponent", nonNull(snapshot.activeComponent()));
        map.put("invocationCount", snapshot.invocationCount());
        map.put("memory", snapshot.memory());
        return map;
    }

    public static SessionState fromSnapshot(SessionSnapshot snapshot) {
        return new SessionState(toStateMap(snapshot));
    }

    private static String nonNull(String value) {
        return value == null ? "" : value;
    }
}
