package com.agentide.dispatch.api;

import com.agentide.core.engine.SessionConflictException;
import com.agentide.core.engine.SessionEngine;
import com.agentide.core.engine.SessionNotFoundException;
import com.agentide.core.model.ReviewAction;
import com.agentide.core.model.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for the session lifecycle.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionEngine sessionEngine;
    private final SseStreamingService sseStreamingService;

    public SessionController(SessionEngine sessionEngine, SseStreamingService sseStreamingService) {
        this.sessionEngine = sessionEngine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/sessions: start a session. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startSession(@RequestBody StartSessionRequest request) {
        if (request.request() == null || request.request().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request text is required"));
        }
        boolean skipReview = Boolean.TRUE.equals(request.skipReview());
        String sessionId = sessionEngine.startSession(request.request(), request.projectPath(), skipReview);
        log.info("Accepted session {}, launching async execution", sessionId);
        sessionEngine.submit(sessionId);
        return ResponseEntity.accepted().body(Map.of(
                "session_id", sessionId,
                "status", "RUNNING"));
    }

    /**
     * GET /api/v1/sessions: all known sessions.
     */
    @GetMapping
    public ResponseEntity<List<SessionResponse>> listSessions() {
        List<SessionResponse> sessions = sessionEngine.listSessions().stream()
                .map(this::toResponse)
                .flatMap(Optional::stream)
                .toList();
        return ResponseEntity.ok(sessions);
    }

    /**
     * GET /api/v1/sessions/{id}: current state of one session.
     */
    @GetMapping("/{id}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String id) {
        return toResponse(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/sessions/{id}/events: SSE stream of step, review and completion events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (sessionEngine.getState(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    /**
     * POST /api/v1/sessions/{id}/feedback: review a suspended session and resume it.
     */
    @PostMapping("/{id}/feedback")
    public ResponseEntity<Map<String, String>> submitFeedback(@PathVariable String id,
                                                              @RequestBody FeedbackRequest request) {
        ReviewAction action;
        try {
            action = request.action() == null || request.action().isBlank()
                    ? null
                    : ReviewAction.valueOf(request.action().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid action: " + request.action()));
        }

        try {
            sessionEngine.submitFeedback(id, request.feedback(), action);
        } catch (SessionNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (SessionConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
        log.info("Resuming session {} with feedback", id);
        sessionEngine.submit(id);
        return ResponseEntity.accepted().body(Map.of(
                "session_id", id,
                "status", "RUNNING"));
    }

    /**
     * DELETE /api/v1/sessions/{id}: forget a session and its checkpoint.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteSession(@PathVariable String id) {
        try {
            sessionEngine.deleteSession(id);
        } catch (SessionNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (SessionConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.noContent().build();
    }

    private Optional<SessionResponse> toResponse(String id) {
        Optional<SessionSnapshot> snapshot = sessionEngine.getState(id);
        return snapshot.map(s -> SessionResponse.from(s, sessionEngine.status(id),
                sessionEngine.failure(id).orElse(null)));
    }
}
