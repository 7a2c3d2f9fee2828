package com.squadron.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the worker command line from {@link SpawnOptions}.
 *
 * <p>Argument order: {@code -p}, {@code --output-format stream-json}, model, allowed tools,
 * disallowed tools, max turns, resume, verbose, permission mode, extra args, task.
 */
public final class AgentArgsBuilder {

    /** Model shortnames accepted in place of full model identifiers. */
    static final Map<String, String> MODEL_SHORTNAMES = Map.of(
            "sonnet", "claude-sonnet-4-20250514",
            "opus", "claude-opus-4-20250514",
            "haiku", "claude-haiku-3-5-20250620"
    );

    private AgentArgsBuilder() {
    }

    /**
     * Resolves a model shortname to its full identifier; other names pass through.
     */
    public static String resolveModel(String model) {
        return MODEL_SHORTNAMES.getOrDefault(model.toLowerCase(Locale.ROOT), model);
    }

    /**
     * Builds the full command: binary followed by arguments.
     *
     * @param binary          worker executable
     * @param options         spawn options
     * @param defaultModel    model used when options carry none (blank for no flag)
     * @param defaultMaxTurns turn limit used when options carry none (0 for no flag)
     */
    public static List<String> buildCommand(String binary, SpawnOptions options,
                                            String defaultModel, int defaultMaxTurns) {
        var command = new ArrayList<String>();
        command.add(binary);
        command.add("-p");
        command.add("--output-format");
        command.add("stream-json");

        String model = isBlank(options.model()) ? defaultModel : options.model();
        if (!isBlank(model)) {
            command.add("--model");
            command.add(resolveModel(model));
        }

        if (!options.allowedTools().isEmpty()) {
            command.add("--allowedTools");
            command.add(String.join(",", options.allowedTools()));
        }
        if (!options.disallowedTools().isEmpty()) {
            command.add("--disallowedTools");
            command.add(String.join(",", options.disallowedTools()));
        }

        int maxTurns = options.maxTurns() != null && options.maxTurns() > 0 ? options.maxTurns() : defaultMaxTurns;
        if (maxTurns > 0) {
            command.add("--max-turns");
            command.add(String.valueOf(maxTurns));
        }

        if (!isBlank(options.sessionId())) {
            command.add("--resume");
            command.add(options.sessionId());
        }
        if (options.verbose()) {
            command.add("--verbose");
        }
        if (!isBlank(options.permissionMode()) && !"default".equals(options.permissionMode())) {
            command.add("--permission-mode");
            command.add(options.permissionMode());
        }

        command.addAll(options.extraArgs());
        command.add(options.task());
        return command;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
