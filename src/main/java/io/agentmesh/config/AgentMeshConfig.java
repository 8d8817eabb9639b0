package io.agentmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AgentMeshConfig {
    public static final String SETTINGS_FILE_NAME = "agentmesh-settings.json";
    public static final int DEFAULT_MAX_HISTORY = 1_000;
    public static final int DEFAULT_DEAD_LETTER_CAPACITY = 1_000;
    public static final int DEFAULT_MAX_DEAD_LETTER_RETRIES = 3;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_TICK_THREADS = 4;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 5_000L;

    private final Path rootDir;

    public AgentMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AgentMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new AgentMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
