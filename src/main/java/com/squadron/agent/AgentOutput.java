package com.squadron.agent;

import java.io.Serializable;
import java.time.Instant;

/**
 * One chunk of worker output, as stored in the replay buffer and delivered to subscribers.
 *
 * @param type      chunk kind
 * @param content   display text (may be empty, never null)
 * @param toolName  tool name for {@link AgentOutputType#TOOL_USE} chunks, otherwise null
 * @param costUsd   reported cost for {@link AgentOutputType#COST} chunks, otherwise null
 * @param timestamp when the chunk was captured
 */
public record AgentOutput(
    AgentOutputType type,
    String content,
    String toolName,
    Double costUsd,
    Instant timestamp
) implements Serializable {

    public AgentOutput {
        content = content != null ? content : "";
    }

    public static AgentOutput text(String content) {
        return new AgentOutput(AgentOutputType.TEXT, content, null, null, Instant.now());
    }

    public static AgentOutput system(String content) {
        return new AgentOutput(AgentOutputType.SYSTEM, content, null, null, Instant.now());
    }

    public static AgentOutput error(String content) {
        return new AgentOutput(AgentOutputType.ERROR, content, null, null, Instant.now());
    }

    public static AgentOutput toolUse(String toolName) {
        return new AgentOutput(AgentOutputType.TOOL_USE, "Using tool: " + toolName, toolName, null, Instant.now());
    }

    public static AgentOutput toolResult(String content) {
        return new AgentOutput(AgentOutputType.TOOL_RESULT, content, null, null, Instant.now());
    }

    public static AgentOutput cost(double costUsd) {
        return new AgentOutput(AgentOutputType.COST, "Cost: $%.4f".formatted(costUsd), null, costUsd, Instant.now());
    }
}
