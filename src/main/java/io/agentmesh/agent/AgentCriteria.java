package io.agentmesh.agent;

import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.AgentTier;

import java.util.regex.Pattern;

/**
 * Conjunctive filter for {@link AgentRegistry#find}. Null fields match everything;
 * {@code namePattern} is a case-insensitive regular expression searched within the
 * agent name.
 */
public record AgentCriteria(AgentTier tier, AgentStatus status, String namePattern) {
    public static AgentCriteria any() {
        return new AgentCriteria(null, null, null);
    }

    public AgentCriteria withTier(AgentTier value) {
        return new AgentCriteria(value, status, namePattern);
    }

    public AgentCriteria withStatus(AgentStatus value) {
        return new AgentCriteria(tier, value, namePattern);
    }

    public AgentCriteria withName(String value) {
        return new AgentCriteria(tier, status, value);
    }

    Pattern compiledName() {
        return namePattern == null ? null : Pattern.compile(namePattern, Pattern.CASE_INSENSITIVE);
    }
}
