package com.agentide.core.memory;

import com.agentide.core.model.ArtifactOperation;
import com.agentide.core.model.ArtifactRecord;
import com.agentide.core.model.ConversationTurn;
import com.agentide.core.model.SessionMemory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Short-term memory of one session: a bounded conversation log, a bounded most-recent-first
 * artifact log and the artifact currently in focus.
 * <p>
 * Instances are mutable working copies. A component loads one from the session's
 * {@link SessionMemory}, records into it, and returns {@link #snapshot()} as its state update.
 */
public class MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryStore.class);

    public static final int MAX_TURNS = 10;
    public static final int MAX_ARTIFACTS = 20;

    /** Number of turns/artifacts rendered into worker and planner prompts. */
    static final int CONTEXT_WINDOW = 5;
    static final int TURN_PREVIEW_CHARS = 100;

    private static final List<String> REFERENCE_CUES = List.of(
            "it", "that", "this", "the file", "the script",
            "that file", "this file", "the code", "that code");

    private final List<ConversationTurn> turns;
    private final List<ArtifactRecord> artifacts;
    private String currentFocus;
    private final Clock clock;

    public MemoryStore() {
        this(SessionMemory.empty(), Clock.systemUTC());
    }

    public MemoryStore(SessionMemory memory) {
        this(memory, Clock.systemUTC());
    }

    public MemoryStore(SessionMemory memory, Clock clock) {
        this.turns = new ArrayList<>(memory.conversationHistory());
        this.artifacts = new ArrayList<>(memory.recentArtifacts());
        this.currentFocus = memory.currentFocus();
        this.clock = clock;
    }

    /**
     * Appends a conversation turn and keeps only the last {@value #MAX_TURNS}.
     */
    public void recordTurn(String role, String content, List<String> artifactsMentioned) {
        turns.add(new ConversationTurn(role, content == null ? "" : content, artifactsMentioned, clock.instant()));
        while (turns.size() > MAX_TURNS) {
            turns.remove(0);
        }
    }

    public void recordTurn(String role, String content) {
        recordTurn(role, content, List.of());
    }

    /**
     * Records an operation on an artifact. An artifact appears at most once, at its most recent
     * position; the log keeps the {@value #MAX_ARTIFACTS} most recent. Writes move the focus.
     */
    public void recordArtifactOperation(String artifactId, ArtifactOperation operation, String actor) {
        artifacts.removeIf(a -> a.artifactId().equals(artifactId));
        artifacts.add(0, new ArtifactRecord(artifactId, operation, actor, clock.instant()));
        while (artifacts.size() > MAX_ARTIFACTS) {
            artifacts.remove(artifacts.size() - 1);
        }
        if (operation.isWrite()) {
            currentFocus = artifactId;
        }
    }

    /**
     * Best-effort guess at the artifact a piece of text refers to.
     * <ol>
     *   <li>an already generated artifact whose id appears in the text (case-insensitive)</li>
     *   <li>if the text contains a reference cue: the current focus, else the most recent
     *       created/modified artifact, else the last generated artifact</li>
     *   <li>otherwise nothing</li>
     * </ol>
     *
     * @param text               free text, typically the user's request
     * @param generatedArtifacts the session's generated artifacts in insertion order
     */
    public Optional<String> resolveReference(String text, List<String> generatedArtifacts) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);

        for (String artifact : generatedArtifacts) {
            if (lower.contains(artifact.toLowerCase(Locale.ROOT))) {
                return Optional.of(artifact);
            }
        }

        boolean hasCue = REFERENCE_CUES.stream().anyMatch(lower::contains);
        if (!hasCue) {
            return Optional.empty();
        }
        if (!currentFocus.isEmpty()) {
            log.debug("Resolved reference to current focus: {}", currentFocus);
            return Optional.of(currentFocus);
        }
        Optional<String> recentWrite = artifacts.stream()
                .filter(a -> a.operation().isWrite())
                .map(ArtifactRecord::artifactId)
                .findFirst();
        if (recentWrite.isPresent()) {
            log.debug("Resolved reference to most recent write: {}", recentWrite.get());
            return recentWrite;
        }
        if (!generatedArtifacts.isEmpty()) {
            String last = generatedArtifacts.get(generatedArtifacts.size() - 1);
            log.debug("Resolved reference to last generated artifact: {}", last);
            return Optional.of(last);
        }
        return Optional.empty();
    }

    /**
     * Renders the last {@code lastN} turns, each truncated to {@value #TURN_PREVIEW_CHARS} chars.
     */
    public String conversationContext(int lastN) {
        if (turns.isEmpty()) {
            return "No previous conversation.";
        }
        var sb = new StringBuilder("Recent conversation:\n");
        for (ConversationTurn turn : turns.subList(Math.max(0, turns.size() - lastN), turns.size())) {
            String content = turn.content();
            if (content.length() > TURN_PREVIEW_CHARS) {
                content = content.substring(0, TURN_PREVIEW_CHARS);
            }
            sb.append(capitalize(turn.role())).append(": ").append(content).append('\n');
            if (!turn.artifactsMentioned().isEmpty()) {
                sb.append("  (Files: ").append(String.join(", ", turn.artifactsMentioned())).append(")\n");
            }
        }
        return sb.toString();
    }

    /**
     * Renders the {@value #CONTEXT_WINDOW} most recent artifact operations and the current focus.
     */
    public String artifactContext() {
        if (artifacts.isEmpty()) {
            return "No files worked on yet.";
        }
        var sb = new StringBuilder("Recently worked files:\n");
        for (ArtifactRecord record : artifacts.subList(0, Math.min(CONTEXT_WINDOW, artifacts.size()))) {
            sb.append("- ").append(record.artifactId())
              .append(" (").append(record.operation().name().toLowerCase(Locale.ROOT))
              .append(" by ").append(record.actor()).append(")\n");
        }
        if (!currentFocus.isEmpty()) {
            sb.append("\nCurrent focus: ").append(currentFocus).append('\n');
        }
        return sb.toString();
    }

    /**
     * Full memory block prepended to planner and worker prompts.
     */
    public String contextBlock() {
        return """
                === CONTEXT FROM MEMORY ===

                %s
                %s
                If the request says "it", "that file" or similar, it refers to the current focus or the recent files above.
                ===========================
                """.formatted(conversationContext(CONTEXT_WINDOW), artifactContext());
    }

    public Optional<String> currentFocus() {
        return currentFocus.isEmpty() ? Optional.empty() : Optional.of(currentFocus);
    }

    public List<ConversationTurn> turns() {
        return List.copyOf(turns);
    }

    public List<ArtifactRecord> recentArtifacts() {
        return List.copyOf(artifacts);
    }

    public SessionMemory snapshot() {
        return new SessionMemory(turns, artifacts, currentFocus);
    }

    private static String capitalize(String role) {
        if (role == null || role.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(role.charAt(0)) + role.substring(1);
    }
}
