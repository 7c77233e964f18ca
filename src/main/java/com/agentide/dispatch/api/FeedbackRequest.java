package com.agentide.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/feedback.
 *
 * @param feedback reviewer text; empty approves
 * @param action   "approve" or "revise"; nullable, in which case the text decides
 */
public record FeedbackRequest(
    String feedback,
    String action
) {}
