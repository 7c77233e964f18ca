package com.agentide.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions.
 *
 * @param request     the task description
 * @param projectPath directory the workers may touch; nullable, defaults to the server's working directory
 * @param skipReview  finish without waiting for review; nullable, defaults to false
 */
public record StartSessionRequest(
    String request,
    @JsonProperty("project_path") String projectPath,
    @JsonProperty("skip_review") Boolean skipReview
) {}
