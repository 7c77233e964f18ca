package com.agentide.dispatch.api;

import com.agentide.core.events.EventBus;
import com.agentide.core.events.SessionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a distinct emitter per client")
        void distinctEmitters() {
            SseEmitter first = service.createEmitter("S-1");
            SseEmitter second = service.createEmitter("S-1");

            assertNotNull(first);
            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("uses the configured timeout")
        void timeout() {
            var shortLived = new SseStreamingService(eventBus, 1234L);

            assertEquals(1234L, shortLived.createEmitter("S-1").getTimeout());
        }
    }

    @Nested
    @DisplayName("event forwarding")
    class EventForwardingTests {

        @Test
        @DisplayName("publishing to the session does not fail before the client attaches")
        void publishBeforeAttach() {
            service.createEmitter("S-1");

            assertDoesNotThrow(() -> eventBus.publish(new SessionEvent(SessionEvent.STEP, "S-1", "write_worker",
                    Map.of("stepIndex", 0, "needsReview", false), Instant.now())));
        }

        @Test
        @DisplayName("events for other sessions are ignored")
        void otherSessions() {
            service.createEmitter("S-1");

            assertDoesNotThrow(() -> eventBus.publish(new SessionEvent(SessionEvent.COMPLETED, "S-2", null,
                    Map.of(), Instant.now())));
            assertEquals(1, service.activeEmitterCount());
        }
    }
}
