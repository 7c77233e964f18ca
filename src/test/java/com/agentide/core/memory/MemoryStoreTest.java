package com.agentide.core.memory;

import com.agentide.core.model.ArtifactOperation;
import com.agentide.core.model.SessionMemory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStoreTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC);

    @Nested
    @DisplayName("Reference resolution")
    class ResolveReference {

        @Test
        @DisplayName("cue word resolves to the current focus")
        void cueResolvesToFocus() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);
            memory.recordArtifactOperation("a.py", ArtifactOperation.CREATED, "code_agent");
            memory.recordArtifactOperation("b.py", ArtifactOperation.MODIFIED, "code_agent");

            assertEquals(Optional.of("b.py"), memory.resolveReference("fix that file", List.of("a.py", "b.py")));
        }

        @Test
        @DisplayName("a literal artifact id wins over the focus")
        void literalIdWins() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);
            memory.recordArtifactOperation("a.py", ArtifactOperation.CREATED, "code_agent");
            memory.recordArtifactOperation("b.py", ArtifactOperation.MODIFIED, "code_agent");

            assertEquals(Optional.of("a.py"), memory.resolveReference("add tests to A.py", List.of("a.py", "b.py")));
        }

        @Test
        @DisplayName("without focus, the most recent write is used")
        void fallsBackToMostRecentWrite() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);
            memory.recordArtifactOperation("lib.py", ArtifactOperation.CREATED, "code_agent");
            var restored = new MemoryStore(new SessionMemory(List.of(), memory.recentArtifacts(), ""), FIXED);
            restored.recordArtifactOperation("notes.txt", ArtifactOperation.READ, "debug_agent");

            assertEquals(Optional.of("lib.py"), restored.resolveReference("run it again", List.of()));
        }

        @Test
        @DisplayName("without any artifact history, the last generated artifact is used")
        void fallsBackToLastGenerated() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);

            assertEquals(Optional.of("z.py"), memory.resolveReference("clean up the code", List.of("y.py", "z.py")));
        }

        @Test
        @DisplayName("text without cues or ids resolves to nothing")
        void noCueNoMatch() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);
            memory.recordArtifactOperation("a.py", ArtifactOperation.CREATED, "code_agent");

            assertTrue(memory.resolveReference("create a fibonacci function", List.of("a.py")).isEmpty());
            assertTrue(memory.resolveReference("", List.of("a.py")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Bounded logs")
    class Bounds {

        @Test
        @DisplayName("artifact log keeps the 20 most recent, most recent first, without duplicates")
        void artifactLogIsBounded() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);
            for (int i = 0; i < 25; i++) {
                memory.recordArtifactOperation("f" + i + ".py", ArtifactOperation.CREATED, "code_agent");
            }
            memory.recordArtifactOperation("f10.py", ArtifactOperation.MODIFIED, "code_agent");

            var artifacts = memory.recentArtifacts();
            assertEquals(MemoryStore.MAX_ARTIFACTS, artifacts.size());
            assertEquals("f10.py", artifacts.get(0).artifactId());
            assertEquals(ArtifactOperation.MODIFIED, artifacts.get(0).operation());
            assertEquals(1, artifacts.stream().filter(a -> a.artifactId().equals("f10.py")).count());
            assertTrue(artifacts.stream().noneMatch(a -> a.artifactId().equals("f0.py")));
        }

        @Test
        @DisplayName("conversation keeps the last 10 turns")
        void conversationIsBounded() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);
            for (int i = 0; i < 12; i++) {
                memory.recordTurn("user", "message " + i);
            }

            var turns = memory.turns();
            assertEquals(MemoryStore.MAX_TURNS, turns.size());
            assertEquals("message 2", turns.get(0).content());
            assertEquals(Instant.parse("2026-01-01T10:00:00Z"), turns.get(0).timestamp());
        }

        @Test
        @DisplayName("reads do not move the focus")
        void readsKeepFocus() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);
            memory.recordArtifactOperation("main.py", ArtifactOperation.CREATED, "code_agent");
            memory.recordArtifactOperation("util.py", ArtifactOperation.READ, "debug_agent");

            assertEquals(Optional.of("main.py"), memory.currentFocus());
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("empty memory renders placeholders")
        void emptyMemory() {
            var memory = new MemoryStore();

            assertEquals("No previous conversation.", memory.conversationContext(5));
            assertEquals("No files worked on yet.", memory.artifactContext());
            assertTrue(memory.contextBlock().startsWith("=== CONTEXT FROM MEMORY ==="));
        }

        @Test
        @DisplayName("turns are truncated and list mentioned files")
        void conversationRendering() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);
            memory.recordTurn("user", "x".repeat(150), List.of("app.py"));

            String rendered = memory.conversationContext(5);
            assertTrue(rendered.startsWith("Recent conversation:\n"));
            assertTrue(rendered.contains("User: " + "x".repeat(100) + "\n"));
            assertFalse(rendered.contains("x".repeat(101)));
            assertTrue(rendered.contains("  (Files: app.py)"));
        }

        @Test
        @DisplayName("artifact context shows operation, actor and focus")
        void artifactRendering() {
            var memory = new MemoryStore(SessionMemory.empty(), FIXED);
            memory.recordArtifactOperation("app.py", ArtifactOperation.CREATED, "code_agent");

            String rendered = memory.artifactContext();
            assertTrue(rendered.contains("- app.py (created by code_agent)"));
            assertTrue(rendered.contains("Current focus: app.py"));
        }
    }

    @Test
    @DisplayName("snapshot round-trips through a new store")
    void snapshotRestores() {
        var memory = new MemoryStore(SessionMemory.empty(), FIXED);
        memory.recordTurn("user", "build a parser");
        memory.recordArtifactOperation("parser.py", ArtifactOperation.CREATED, "code_agent");

        var restored = new MemoryStore(memory.snapshot(), FIXED);
        assertEquals(memory.turns(), restored.turns());
        assertEquals(memory.recentArtifacts(), restored.recentArtifacts());
        assertEquals(Optional.of("parser.py"), restored.currentFocus());
    }
}
