package io.agentmesh.cli;

import io.agentmesh.agent.ClockAgent;
import io.agentmesh.agent.EchoAgent;
import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.config.RuntimeSettings;
import io.agentmesh.runtime.AgentMeshRuntime;
import io.agentmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "agentmesh",
        mixinStandardHelpOptions = true,
        description = "AgentMesh in-process agent runtime CLI",
        subcommands = {
                AgentMeshCommand.RunCommand.class,
                AgentMeshCommand.SettingsCommand.class
        }
)
public final class AgentMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime root directory holding " + AgentMeshConfig.SETTINGS_FILE_NAME,
            defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | settings");
    }

    AgentMeshConfig config() {
        return AgentMeshConfig.fromRoot(root);
    }

    @Command(name = "run", description = "Run the built-in clock and echo agents, then print runtime stats")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--duration-ms"}, description = "How long agents run before shutdown", defaultValue = "3000")
        long durationMs;

        @Option(names = {"--tick-ms"}, description = "Clock agent tick interval", defaultValue = "1000")
        long tickMs;

        @Option(names = {"--message"}, description = "Payload sent in the echo request", defaultValue = "ping")
        String message;

        @Override
        public Integer call() throws Exception {
            if (durationMs < 0 || tickMs <= 0) {
                System.err.println("--duration-ms must be >= 0 and --tick-ms must be > 0");
                return 2;
            }
            try (AgentMeshRuntime runtime = new AgentMeshRuntime(parent.config())) {
                runtime.register(new ClockAgent(runtime.context(), tickMs));
                runtime.register(new EchoAgent(runtime.context()));
                runtime.start();

                long timeoutMs = runtime.settings().requestTimeoutMs();
                Object reply;
                int code = 0;
                try {
                    reply = runtime.bus().request(EchoAgent.REQUEST_EVENT, Map.of("message", message), timeoutMs)
                            .get(timeoutMs + 1_000L, TimeUnit.MILLISECONDS);
                } catch (ExecutionException | TimeoutException e) {
                    Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                    reply = Map.of("error", String.valueOf(cause.getMessage()));
                    code = 1;
                }

                Thread.sleep(durationMs);
                runtime.stop();

                Map<String, Object> out = new LinkedHashMap<>();
                out.put("root", runtime.config().rootDir().toString());
                out.put("echo", reply);
                out.put("stats", runtime.stats());
                System.out.println(Jsons.toJson(out));
                return code;
            }
        }
    }

    @Command(name = "settings", description = "Print resolved runtime settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() {
            AgentMeshConfig config = parent.config();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("settingsFile", config.settingsFile().toString());
            out.put("settings", RuntimeSettings.load(config.settingsFile()));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }
}
