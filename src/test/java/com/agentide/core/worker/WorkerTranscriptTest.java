package com.agentide.core.worker;

import com.agentide.core.llm.LlmService;
import com.agentide.core.model.ToolAction;
import com.agentide.core.model.WorkerKind;
import com.agentide.core.model.WorkerReply;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorkerTranscriptTest {

    @Test
    @DisplayName("a fresh transcript renders only the task")
    void freshTranscript() {
        var transcript = new WorkerTranscript("=== CURRENT TASK ===\nInstruction: write a.py");

        assertEquals("=== CURRENT TASK ===\nInstruction: write a.py", transcript.render());
        assertEquals(0, transcript.rounds());
    }

    @Test
    @DisplayName("rounds list each tool call with its result")
    void rendersRounds() {
        var transcript = new WorkerTranscript("task");
        transcript.addRound(new WorkerReply(List.of(ToolAction.read("a.py"), ToolAction.list(".")), "looking"),
                List.of("x = 1", "a.py"));

        String rendered = transcript.render();
        assertTrue(rendered.contains("=== TOOL RESULTS SO FAR ==="));
        assertTrue(rendered.contains("--- Round 1 ---"));
        assertTrue(rendered.contains("You said: looking"));
        assertTrue(rendered.contains("Tool read_file(a.py) -> x = 1"));
        assertTrue(rendered.contains("Tool list_files(.) -> a.py"));
    }

    @Test
    @DisplayName("the LLM-backed worker sends the rendered transcript")
    void llmWorkerSendsTranscript() {
        var llm = mock(LlmService.class);
        when(llm.structuredCall(anyString(), anyString(), eq(WorkerReply.class))).thenReturn(WorkerReply.done("ok"));
        var transcript = new WorkerTranscript("task text");

        var reply = new LlmReasoningWorker(llm).nextReply(WorkerKind.WRITE, "system", transcript);

        assertTrue(reply.finished());
        verify(llm).structuredCall("system", "task text", WorkerReply.class);
    }
}
