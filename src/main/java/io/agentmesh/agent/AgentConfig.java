package io.agentmesh.agent;

import io.agentmesh.model.AgentTier;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public record AgentConfig(
        String id,
        String name,
        AgentTier tier,
        String description,
        String version,
        List<String> dependencies,
        boolean enabled,
        Map<String, Object> settings
) {
    public AgentConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (tier == null) {
            throw new IllegalArgumentException("agent tier cannot be null: " + id);
        }
        name = name == null || name.isBlank() ? id : name;
        description = description == null ? "" : description;
        version = version == null || version.isBlank() ? "0.0.0" : version;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static AgentConfig of(String id, String name, AgentTier tier) {
        return new AgentConfig(id, name, tier, "", "1.0.0", List.of(), true, Map.of());
    }

    public AgentConfig withDescription(String value) {
        return new AgentConfig(id, name, tier, value, version, dependencies, enabled, settings);
    }

    public AgentConfig withVersion(String value) {
        return new AgentConfig(id, name, tier, description, value, dependencies, enabled, settings);
    }

    public AgentConfig withDependencies(String... ids) {
        return new AgentConfig(id, name, tier, description, version, Arrays.asList(ids), enabled, settings);
    }

    public AgentConfig withEnabled(boolean value) {
        return new AgentConfig(id, name, tier, description, version, dependencies, value, settings);
    }

    public AgentConfig withSettings(Map<String, Object> value) {
        return new AgentConfig(id, name, tier, description, version, dependencies, enabled, value);
    }
}
