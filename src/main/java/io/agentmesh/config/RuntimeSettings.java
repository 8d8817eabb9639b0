package io.agentmesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.agentmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables for one runtime instance. Values come from
 * {@value AgentMeshConfig#SETTINGS_FILE_NAME} under the runtime root; anything
 * missing or out of range falls back to the defaults.
 */
public record RuntimeSettings(
        int maxHistory,
        int deadLetterCapacity,
        int maxDeadLetterRetries,
        long requestTimeoutMs,
        int tickThreads,
        long shutdownGraceMs,
        boolean deadLetterEvents
) {
    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                AgentMeshConfig.DEFAULT_MAX_HISTORY,
                AgentMeshConfig.DEFAULT_DEAD_LETTER_CAPACITY,
                AgentMeshConfig.DEFAULT_MAX_DEAD_LETTER_RETRIES,
                AgentMeshConfig.DEFAULT_REQUEST_TIMEOUT_MS,
                AgentMeshConfig.DEFAULT_TICK_THREADS,
                AgentMeshConfig.DEFAULT_SHUTDOWN_GRACE_MS,
                true
        );
    }

    public static RuntimeSettings load(Path file) {
        RuntimeSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read runtime settings: " + file, e);
        }
    }

    static RuntimeSettings fromFile(SettingsFile file, RuntimeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        // History is halved on overflow, so it needs room for at least two events.
        int maxHistory = sanitizeInt(file.maxHistory(), defaults.maxHistory(), 2);
        int deadLetterCapacity = sanitizeInt(file.deadLetterCapacity(), defaults.deadLetterCapacity(), 1);
        int maxRetries = sanitizeInt(file.maxDeadLetterRetries(), defaults.maxDeadLetterRetries(), 0);
        long requestTimeout = sanitizeLong(file.requestTimeoutMs(), defaults.requestTimeoutMs(), 1L);
        int tickThreads = sanitizeInt(file.tickThreads(), defaults.tickThreads(), 1);
        long shutdownGrace = sanitizeLong(file.shutdownGraceMs(), defaults.shutdownGraceMs(), 0L);
        boolean deadLetterEvents = file.deadLetterEvents() == null
                ? defaults.deadLetterEvents()
                : file.deadLetterEvents();
        return new RuntimeSettings(
                maxHistory,
                deadLetterCapacity,
                maxRetries,
                requestTimeout,
                tickThreads,
                shutdownGrace,
                deadLetterEvents
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer maxHistory,
            Integer deadLetterCapacity,
            Integer maxDeadLetterRetries,
            Long requestTimeoutMs,
            Integer tickThreads,
            Long shutdownGraceMs,
            Boolean deadLetterEvents
    ) {
    }
}
