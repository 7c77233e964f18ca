package com.agentide.core.graph;

import com.agentide.core.metrics.AgentIdeMetrics;
import com.agentide.core.model.ComponentId;
import com.agentide.core.state.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides which component runs next. Pure apart from logging and a fallback counter.
 */
@Component
public class SessionRouter {

    private static final Logger log = LoggerFactory.getLogger(SessionRouter.class);

    private final AgentIdeMetrics metrics;

    public SessionRouter(AgentIdeMetrics metrics) {
        this.metrics = metrics;
    }

    public ComponentId route(SessionState state) {
        if (state.done()) {
            return ComponentId.TERMINAL;
        }
        if (state.suspended() && state.feedback().isEmpty()) {
            return ComponentId.TERMINAL;
        }
        Optional<ComponentId> next = ComponentId.parse(state.nextComponent());
        if (next.isEmpty() || next.get() == ComponentId.TERMINAL) {
            log.warn("Unroutable next component '{}' for session {} (done=false); defaulting to {}",
                    state.nextComponent(), state.sessionId(), ComponentId.WRITE_WORKER.nodeId());
            metrics.recordRoutingFallback();
            return ComponentId.WRITE_WORKER;
        }
        return next.get();
    }
}
