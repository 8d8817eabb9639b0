package io.agentmesh.model;

import java.util.Locale;

/**
 * Coarse agent category used for indexing and queries. Tiers never influence
 * start order; only declared dependencies do.
 */
public enum AgentTier {
    FOUNDATION,
    SENSING,
    DECISION,
    EXECUTION,
    LEARNING,
    ORCHESTRATION,
    SPECIALIZED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AgentTier fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("agent tier cannot be empty");
        }
        for (AgentTier value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent tier: " + raw);
    }
}
