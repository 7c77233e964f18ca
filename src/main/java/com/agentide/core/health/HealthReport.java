package com.agentide.core.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time health of the engine: the overall status and every component check behind it.
 */
public record HealthReport(
    HealthStatus.Status status,
    @JsonProperty("checked_at") Instant checkedAt,
    List<HealthStatus> components
) {
    public HealthReport {
        components = components == null ? List.of() : List.copyOf(components);
    }

    public static HealthReport of(List<HealthStatus> components) {
        return new HealthReport(HealthStatus.overall(components), Instant.now(), components);
    }

    /** Sessions can still be started and resumed; only a DOWN component rules that out. */
    @JsonIgnore
    public boolean serving() {
        return status != HealthStatus.Status.DOWN;
    }
}
