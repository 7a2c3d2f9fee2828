package com.squadron.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentArgsBuilderTest {

    private static final Path DIR = Path.of("/tmp/work");

    @Test
    @DisplayName("minimal command is print mode with stream-json and the task last")
    void minimalCommand() {
        var options = SpawnOptions.builder("agent-1", "Fix the bug", DIR).build();

        var command = AgentArgsBuilder.buildCommand("claude", options, "", 0);

        assertEquals(List.of("claude", "-p", "--output-format", "stream-json", "Fix the bug"), command);
    }

    @Test
    @DisplayName("full option set keeps the documented order")
    void fullOptionOrder() {
        var options = SpawnOptions.builder("agent-1", "Do it", DIR)
                .model("opus")
                .allowedTools(List.of("Read", "Edit"))
                .disallowedTools(List.of("Bash"))
                .maxTurns(5)
                .sessionId("sess-9")
                .verbose(true)
                .permissionMode("acceptEdits")
                .extraArgs(List.of("--foo", "bar"))
                .build();

        var command = AgentArgsBuilder.buildCommand("claude", options, "", 0);

        assertEquals(List.of("claude", "-p", "--output-format", "stream-json",
                "--model", "claude-opus-4-20250514",
                "--allowedTools", "Read,Edit",
                "--disallowedTools", "Bash",
                "--max-turns", "5",
                "--resume", "sess-9",
                "--verbose",
                "--permission-mode", "acceptEdits",
                "--foo", "bar",
                "Do it"), command);
    }

    @Test
    @DisplayName("configured defaults apply when options omit model and turns")
    void defaultsApply() {
        var options = SpawnOptions.builder("agent-1", "task", DIR).build();

        var command = AgentArgsBuilder.buildCommand("claude", options, "sonnet", 12);

        assertTrue(command.containsAll(List.of("--model", "claude-sonnet-4-20250514", "--max-turns", "12")));
    }

    @Test
    @DisplayName("default permission mode adds no flag")
    void defaultPermissionModeOmitted() {
        var options = SpawnOptions.builder("agent-1", "task", DIR).permissionMode("default").build();

        assertFalse(AgentArgsBuilder.buildCommand("claude", options, "", 0).contains("--permission-mode"));
    }

    @Test
    void resolveModelMapsShortnamesAndPassesOthersThrough() {
        assertEquals("claude-haiku-3-5-20250620", AgentArgsBuilder.resolveModel("haiku"));
        assertEquals("claude-sonnet-4-20250514", AgentArgsBuilder.resolveModel("Sonnet"));
        assertEquals("my-custom-model", AgentArgsBuilder.resolveModel("my-custom-model"));
    }
}
