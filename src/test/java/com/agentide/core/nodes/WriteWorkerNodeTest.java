package com.agentide.core.nodes;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.metrics.AgentIdeMetrics;
import com.agentide.core.model.ArtifactOperation;
import com.agentide.core.model.ComponentId;
import com.agentide.core.model.SessionMemory;
import com.agentide.core.model.ToolAction;
import com.agentide.core.model.WorkerKind;
import com.agentide.core.model.WorkerReply;
import com.agentide.core.state.SessionState;
import com.agentide.core.worker.ReasoningWorker;
import com.agentide.core.worker.WorkerTranscript;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WriteWorkerNodeTest {

    @TempDir
    Path root;

    private ReasoningWorker worker;
    private AgentIdeProperties properties;
    private WriteWorkerNode node;

    @BeforeEach
    void setUp() {
        worker = mock(ReasoningWorker.class);
        properties = new AgentIdeProperties();
        node = new WriteWorkerNode(worker, properties, new AgentIdeMetrics(new SimpleMeterRegistry()));
    }

    private SessionState state(Map<String, Object> values) {
        var data = new HashMap<String, Object>();
        data.put("sessionId", "AIDE-TEST");
        data.put("workingRoot", root.toString());
        data.put("currentInstruction", "create a calculator");
        data.put("currentTarget", "calc.py");
        data.putAll(values);
        return new SessionState(data);
    }

    @Nested
    @DisplayName("Successful steps")
    class Success {

        @Test
        @DisplayName("a new file is recorded as created, captured and focused")
        void createsFile() throws IOException {
            when(worker.nextReply(eq(WorkerKind.WRITE), anyString(), any(WorkerTranscript.class)))
                    .thenReturn(new WorkerReply(List.of(ToolAction.write("calc.py", "def add(a, b):\n    return a + b\n")), ""))
                    .thenReturn(WorkerReply.done("Created calc.py"));

            var result = node.apply(state(Map.of("lastDiagnostic", "old diagnosis")));

            assertEquals(true, result.get("workerCompleted"));
            assertEquals(true, result.get("stepFinished"));
            assertEquals(ComponentId.PLAN_CONTROLLER.name(), result.get("nextComponent"));
            assertEquals(List.of("calc.py"), result.get("generatedArtifacts"));
            assertEquals("", result.get("lastDiagnostic"));
            @SuppressWarnings("unchecked")
            var contents = (Map<String, String>) result.get("artifactContents");
            assertEquals("def add(a, b):\n    return a + b\n", contents.get("calc.py"));
            assertEquals("def add(a, b):\n    return a + b\n", Files.readString(root.resolve("calc.py")));

            var memory = (SessionMemory) result.get("memory");
            assertEquals("calc.py", memory.currentFocus());
            assertEquals(ArtifactOperation.CREATED, memory.recentArtifacts().get(0).operation());
            assertEquals("Code agent created 1 file(s)",
                    memory.conversationHistory().get(memory.conversationHistory().size() - 1).content());
        }

        @Test
        @DisplayName("patching a known artifact counts as a modification and keeps insertion order")
        void modifiesKnownArtifact() throws IOException {
            Files.writeString(root.resolve("calc.py"), "x = 1\n");
            when(worker.nextReply(any(), anyString(), any()))
                    .thenReturn(new WorkerReply(List.of(
                            ToolAction.patch("calc.py", "x = 1", "x = 2"),
                            ToolAction.write("test_calc.py", "assert True\n")), ""))
                    .thenReturn(WorkerReply.done(""));

            var result = node.apply(state(Map.of("generatedArtifacts", List.of("calc.py"))));

            assertEquals(List.of("calc.py", "test_calc.py"), result.get("generatedArtifacts"));
            assertEquals("x = 2\n", Files.readString(root.resolve("calc.py")));
            var memory = (SessionMemory) result.get("memory");
            assertTrue(memory.conversationHistory().get(memory.conversationHistory().size() - 1).content()
                    .contains("created 1 file(s) and modified 1 file(s)"));
        }

        @Test
        @DisplayName("tool results are fed back to the worker on the next attempt")
        void feedsBackToolResults() throws IOException {
            Files.writeString(root.resolve("calc.py"), "print('hello')\n");
            when(worker.nextReply(any(), anyString(), any()))
                    .thenReturn(new WorkerReply(List.of(ToolAction.read("calc.py"), ToolAction.read("../etc/passwd")), ""))
                    .thenReturn(new WorkerReply(List.of(ToolAction.write("calc.py", "print('bye')\n")), ""))
                    .thenReturn(WorkerReply.done(""));

            node.apply(state(Map.of()));

            var transcripts = ArgumentCaptor.forClass(WorkerTranscript.class);
            verify(worker, times(3)).nextReply(any(), anyString(), transcripts.capture());
            String rendered = transcripts.getValue().render();
            assertTrue(rendered.contains("=== TOOL RESULTS SO FAR ==="));
            assertTrue(rendered.contains("print('hello')"));
            assertTrue(rendered.contains("ERROR: Access outside project root is not allowed: ../etc/passwd"));
            assertTrue(rendered.contains("Target file: calc.py"));
        }
    }

    @Nested
    @DisplayName("Unsuccessful steps")
    class Failure {

        @Test
        @DisplayName("a step that writes nothing is not completed but still finishes")
        void nothingWritten() {
            when(worker.nextReply(any(), anyString(), any())).thenReturn(WorkerReply.done("nothing to do"));

            var result = node.apply(state(Map.of("lastDiagnostic", "keep me")));

            assertEquals(false, result.get("workerCompleted"));
            assertEquals(true, result.get("stepFinished"));
            assertFalse(result.containsKey("lastDiagnostic"));
            var memory = (SessionMemory) result.get("memory");
            assertEquals("Code agent attempted task but no files were created or modified",
                    memory.conversationHistory().get(0).content());
        }

        @Test
        @DisplayName("the attempt cap stops a worker that never finishes")
        void attemptCap() {
            properties.getWorker().setMaxAttempts(2);
            when(worker.nextReply(any(), anyString(), any()))
                    .thenReturn(new WorkerReply(List.of(ToolAction.list(".")), ""));

            var result = node.apply(state(Map.of()));

            verify(worker, times(2)).nextReply(any(), anyString(), any());
            assertEquals(false, result.get("workerCompleted"));
        }

        @Test
        @DisplayName("an exhausted time budget skips the reasoning service")
        void timeBudget() {
            properties.getWorker().setTimeBudget(Duration.ZERO);
            var fixed = Clock.fixed(Instant.parse("2026-05-01T08:00:00Z"), ZoneOffset.UTC);
            var timed = new WriteWorkerNode(worker, properties, new AgentIdeMetrics(new SimpleMeterRegistry()), fixed);

            var result = timed.apply(state(Map.of()));

            verifyNoInteractions(worker);
            assertEquals(true, result.get("stepFinished"));
        }

        @Test
        @DisplayName("a failing reasoning service ends the loop without escaping")
        void reasoningFailure() {
            when(worker.nextReply(any(), anyString(), any())).thenThrow(new IllegalStateException("503"));

            var result = node.apply(state(Map.of()));

            assertEquals(false, result.get("workerCompleted"));
            assertEquals(ComponentId.PLAN_CONTROLLER.name(), result.get("nextComponent"));
        }

        @Test
        @DisplayName("unknown tools are reported back as errors")
        void unknownTool() {
            when(worker.nextReply(any(), anyString(), any()))
                    .thenReturn(new WorkerReply(List.of(new ToolAction("rm_rf", "/", null, null, null, null)), ""))
                    .thenReturn(WorkerReply.done(""));

            node.apply(state(Map.of()));

            var transcripts = ArgumentCaptor.forClass(WorkerTranscript.class);
            verify(worker, times(2)).nextReply(any(), anyString(), transcripts.capture());
            assertTrue(transcripts.getValue().render().contains("ERROR: unknown tool: rm_rf"));
        }
    }
}
