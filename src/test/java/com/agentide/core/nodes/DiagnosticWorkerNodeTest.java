package com.agentide.core.nodes;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.metrics.AgentIdeMetrics;
import com.agentide.core.model.ToolAction;
import com.agentide.core.model.WorkerKind;
import com.agentide.core.model.WorkerReply;
import com.agentide.core.state.SessionState;
import com.agentide.core.worker.ReasoningWorker;
import com.agentide.core.worker.WorkerTranscript;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DiagnosticWorkerNodeTest {

    @TempDir
    Path root;

    private ReasoningWorker worker;
    private DiagnosticWorkerNode node;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("calc.py"), "def div(a, b):\n    return a / b\n");
        worker = mock(ReasoningWorker.class);
        node = new DiagnosticWorkerNode(worker, new AgentIdeProperties(), new AgentIdeMetrics(new SimpleMeterRegistry()));
    }

    private SessionState state() {
        return new SessionState(Map.of(
                "sessionId", "AIDE-TEST",
                "workingRoot", root.toString(),
                "currentInstruction", "find the division bug",
                "currentTarget", "calc.py",
                "generatedArtifacts", List.of("calc.py")));
    }

    @Test
    @DisplayName("the analysis becomes the diagnosis for the next write step")
    void producesDiagnosis() {
        when(worker.nextReply(eq(WorkerKind.DIAGNOSTIC), anyString(), any(WorkerTranscript.class)))
                .thenReturn(new WorkerReply(List.of(ToolAction.read("calc.py")), "reading"))
                .thenReturn(WorkerReply.done("div does not guard against b == 0"));

        var result = node.apply(state());

        assertEquals(true, result.get("workerCompleted"));
        assertEquals("=== DEBUG ANALYSIS ===\n\ndiv does not guard against b == 0", result.get("lastDiagnostic"));
        assertEquals(List.of("calc.py"), result.get("generatedArtifacts"));
    }

    @Test
    @DisplayName("write tools are refused and nothing changes on disk")
    void readOnly() throws IOException {
        when(worker.nextReply(any(), anyString(), any()))
                .thenReturn(new WorkerReply(List.of(ToolAction.write("calc.py", "oops")), ""))
                .thenReturn(WorkerReply.done("done"));

        node.apply(state());

        assertEquals("def div(a, b):\n    return a / b\n", Files.readString(root.resolve("calc.py")));
        var transcripts = ArgumentCaptor.forClass(WorkerTranscript.class);
        verify(worker, times(2)).nextReply(any(), anyString(), transcripts.capture());
        assertTrue(transcripts.getValue().render().contains("ERROR: write_file is not available to debug_agent (read-only)"));
    }

    @Test
    @DisplayName("an empty analysis still completes, with a placeholder diagnosis")
    void noAnalysis() {
        when(worker.nextReply(any(), anyString(), any())).thenReturn(WorkerReply.done(""));

        var result = node.apply(state());

        assertEquals(true, result.get("workerCompleted"));
        assertEquals(DiagnosticWorkerNode.NO_DIAGNOSIS, result.get("lastDiagnostic"));
    }
}
