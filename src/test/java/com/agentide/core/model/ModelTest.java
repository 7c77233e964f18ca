package com.agentide.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("WorkerKind")
    class WorkerKindTests {

        @Test
        @DisplayName("maps planner labels onto worker kinds")
        void mapsLabels() {
            assertEquals(WorkerKind.WRITE, WorkerKind.fromLabel("code_agent"));
            assertEquals(WorkerKind.DIAGNOSTIC, WorkerKind.fromLabel("debug_agent"));
            assertEquals(WorkerKind.DIAGNOSTIC, WorkerKind.fromLabel("Diagnostic"));
            assertEquals(WorkerKind.REVIEW, WorkerKind.fromLabel("reviewer_agent"));
        }

        @Test
        @DisplayName("unknown and missing labels become WRITE")
        void unknownIsWrite() {
            assertEquals(WorkerKind.WRITE, WorkerKind.fromLabel("context_agent"));
            assertEquals(WorkerKind.WRITE, WorkerKind.fromLabel(null));
            assertEquals(WorkerKind.WRITE, WorkerKind.fromLabel(""));
        }
    }

    @Nested
    @DisplayName("ComponentId")
    class ComponentIdTests {

        @Test
        @DisplayName("parses enum names and node ids")
        void parses() {
            assertEquals(Optional.of(ComponentId.REVIEW_GATE), ComponentId.parse("REVIEW_GATE"));
            assertEquals(Optional.of(ComponentId.WRITE_WORKER), ComponentId.parse("write_worker"));
            assertTrue(ComponentId.parse("code_agent").isEmpty());
            assertTrue(ComponentId.parse(null).isEmpty());
        }

        @Test
        @DisplayName("diagnostic steps go to the diagnostic worker, everything else to the write worker")
        void forWorker() {
            assertEquals(ComponentId.DIAGNOSTIC_WORKER, ComponentId.forWorker(WorkerKind.DIAGNOSTIC));
            assertEquals(ComponentId.WRITE_WORKER, ComponentId.forWorker(WorkerKind.WRITE));
        }
    }

    @Test
    @DisplayName("blank step targets are treated as absent")
    void blankTarget() {
        var step = new Step(null, null, "  ");

        assertEquals(WorkerKind.WRITE, step.workerKind());
        assertEquals("", step.instruction());
        assertFalse(step.hasTarget());
    }

    @Test
    @DisplayName("worker replies without actions are finished")
    void workerReplyFinished() {
        assertTrue(WorkerReply.done("all good").finished());
        assertFalse(new WorkerReply(List.of(ToolAction.read("a.py")), null).finished());
        assertEquals("", new WorkerReply(null, null).message());
    }

    @Test
    @DisplayName("withFeedback stages feedback and routes to the review gate")
    void withFeedback() {
        var snapshot = new SessionSnapshot("S-1", "r", "r", "/tmp", List.of(), 0, "", "", false, false,
                List.of(), null, true, true, null, null, false, false, "REVIEW_GATE", "", null, "", 3, null);

        var staged = snapshot.withFeedback(null, ReviewAction.APPROVE);

        assertTrue(staged.hasFeedback());
        assertEquals("", staged.feedback());
        assertEquals(ReviewAction.APPROVE, staged.feedbackAction());
        assertEquals(ComponentId.REVIEW_GATE.name(), staged.nextComponent());
        assertFalse(snapshot.hasFeedback());
    }

    @Test
    @DisplayName("status reflects running, done, failed and suspended flags")
    void sessionStatus() {
        var suspended = new SessionSnapshot("S-1", "r", "r", "/tmp", List.of(), 0, "", "", false, false,
                List.of(), null, true, true, null, null, false, false, "REVIEW_GATE", "", null, "", 3, null);

        assertEquals(SessionStatus.AWAITING_REVIEW, SessionStatus.of(suspended, false, false));
        assertEquals(SessionStatus.RUNNING, SessionStatus.of(suspended, true, false));
        assertEquals(SessionStatus.PENDING, SessionStatus.of(suspended.withFeedback("ok", null), false, false));
        assertEquals(SessionStatus.FAILED, SessionStatus.of(suspended.withFeedback("ok", null), false, true));
    }

    @Test
    @DisplayName("artifact contents are a read-only copy of the caller's map")
    void artifactContentsReadOnly() {
        var contents = new HashMap<String, String>();
        contents.put("calc.py", "x = 1\n");
        var snapshot = new SessionSnapshot("S-1", "r", "r", "/tmp", List.of(), 0, "", "", false, false,
                List.of("calc.py"), contents, true, true, null, null, false, false, "REVIEW_GATE", "", null, "", 3, null);

        contents.put("other.py", "y = 2\n");

        assertEquals(1, snapshot.artifactContents().size());
        assertThrows(UnsupportedOperationException.class,
                () -> snapshot.artifactContents().put("calc.py", "tampered"));
        assertThrows(UnsupportedOperationException.class,
                () -> snapshot.withFeedback("ok", null).artifactContents().clear());
    }
}
