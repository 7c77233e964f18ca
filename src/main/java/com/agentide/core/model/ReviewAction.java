package com.agentide.core.model;

/**
 * Explicit action a reviewer can submit alongside free-text feedback.
 */
public enum ReviewAction {
    APPROVE,
    REVISE
}
