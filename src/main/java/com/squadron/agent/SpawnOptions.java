package com.squadron.agent;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to launch one worker process.
 *
 * @param agentId          owning agent identifier
 * @param sessionId        worker session to resume (nullable)
 * @param task             task prompt, passed as the final positional argument
 * @param workingDirectory worktree the worker runs in
 * @param model            model shortname or full id (nullable: configured default applies)
 * @param maxTurns         conversation turn limit (nullable or 0: configured default applies)
 * @param allowedTools     tool whitelist (may be empty)
 * @param disallowedTools  tool blacklist (may be empty)
 * @param permissionMode   worker permission mode (nullable)
 * @param verbose          whether to request verbose output
 * @param extraArgs        additional arguments inserted before the task
 * @param environment      extra environment variables for the child
 * @param priority         queue order for {@link AgentOrchestrator#spawnQueued}; higher runs first
 */
public record SpawnOptions(
    String agentId,
    String sessionId,
    String task,
    Path workingDirectory,
    String model,
    Integer maxTurns,
    List<String> allowedTools,
    List<String> disallowedTools,
    String permissionMode,
    boolean verbose,
    List<String> extraArgs,
    Map<String, String> environment,
    int priority
) {

    public SpawnOptions {
        allowedTools = allowedTools != null ? List.copyOf(allowedTools) : List.of();
        disallowedTools = disallowedTools != null ? List.copyOf(disallowedTools) : List.of();
        extraArgs = extraArgs != null ? List.copyOf(extraArgs) : List.of();
        environment = environment != null ? Map.copyOf(environment) : Map.of();
    }

    public static Builder builder(String agentId, String task, Path workingDirectory) {
        return new Builder(agentId, task, workingDirectory);
    }

    public static class Builder {
        private final String agentId;
        private final String task;
        private final Path workingDirectory;
        private String sessionId;
        private String model;
        private Integer maxTurns;
        private List<String> allowedTools;
        private List<String> disallowedTools;
        private String permissionMode;
        private boolean verbose;
        private List<String> extraArgs;
        private Map<String, String> environment;
        private int priority;

        private Builder(String agentId, String task, Path workingDirectory) {
            this.agentId = agentId;
            this.task = task;
            this.workingDirectory = workingDirectory;
        }

        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder model(String model) { this.model = model; return this; }
        public Builder maxTurns(Integer maxTurns) { this.maxTurns = maxTurns; return this; }
        public Builder allowedTools(List<String> allowedTools) { this.allowedTools = allowedTools; return this; }
        public Builder disallowedTools(List<String> disallowedTools) { this.disallowedTools = disallowedTools; return this; }
        public Builder permissionMode(String permissionMode) { this.permissionMode = permissionMode; return this; }
        public Builder verbose(boolean verbose) { this.verbose = verbose; return this; }
        public Builder extraArgs(List<String> extraArgs) { this.extraArgs = extraArgs; return this; }
        public Builder environment(Map<String, String> environment) { this.environment = environment; return this; }
        public Builder priority(int priority) { this.priority = priority; return this; }

        public SpawnOptions build() {
            return new SpawnOptions(agentId, sessionId, task, workingDirectory, model, maxTurns,
                    allowedTools, disallowedTools, permissionMode, verbose, extraArgs, environment, priority);
        }
    }
}
