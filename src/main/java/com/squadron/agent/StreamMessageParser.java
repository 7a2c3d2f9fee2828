package com.squadron.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Parses the worker's newline-delimited JSON output stream.
 *
 * <p>Each line is one JSON object with a {@code type} field. {@code result} lines may carry
 * an incremental {@code cost_usd}; {@code total_cost_usd} is a session running total and is
 * not read. Any line may carry {@code session_id}.
 * Lines that are not JSON objects are opaque display output.
 */
public class StreamMessageParser {

    private static final Logger log = LoggerFactory.getLogger(StreamMessageParser.class);

    private final ObjectMapper objectMapper;

    public StreamMessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * A parsed stream line.
     *
     * @param type    message type ("assistant", "result", "system", ...)
     * @param subtype optional subtype
     * @param node    the full JSON object
     */
    public record StreamMessage(String type, String subtype, JsonNode node) {

        public Optional<String> sessionId() {
            JsonNode id = node.get("session_id");
            return id != null && id.isTextual() && !id.asText().isBlank()
                    ? Optional.of(id.asText()) : Optional.empty();
        }

        public Optional<Double> costUsd() {
            JsonNode cost = node.get("cost_usd");
            return cost != null && cost.isNumber() ? Optional.of(cost.asDouble()) : Optional.empty();
        }
    }

    /**
     * @return the parsed message, or empty for blank lines and lines that are not JSON objects
     */
    public Optional<StreamMessage> parseLine(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            if (node == null || !node.isObject() || !node.path("type").isTextual()) {
                return Optional.empty();
            }
            String subtype = node.path("subtype").isTextual() ? node.get("subtype").asText() : null;
            return Optional.of(new StreamMessage(node.get("type").asText(), subtype, node));
        } catch (JsonProcessingException e) {
            log.debug("Malformed stream line: {}", preview(trimmed));
            return Optional.empty();
        }
    }

    /**
     * Converts one raw output line into an output chunk.
     */
    public AgentOutput toOutput(String line) {
        return parseLine(line).map(this::toOutput).orElseGet(() -> AgentOutput.text(line.trim()));
    }

    public AgentOutput toOutput(StreamMessage message) {
        JsonNode node = message.node();
        switch (message.type()) {
            case "error":
                return AgentOutput.error(textOr(node.get("content"), "Unknown error"));
            case "result": {
                Optional<Double> cost = message.costUsd();
                if (cost.isPresent()) {
                    return AgentOutput.cost(cost.get());
                }
                return AgentOutput.system("success".equals(message.subtype())
                        ? "Task completed successfully" : "Task completed");
            }
            case "system":
                return AgentOutput.system(textOr(node.get("content"),
                        message.subtype() != null ? message.subtype() : "System message"));
            case "tool_result":
                return AgentOutput.toolResult(textOr(node.get("content"), ""));
            case "tool_use":
                return AgentOutput.toolUse(textOr(node.get("name"), textOr(node.get("content"), "unknown")));
            case "assistant": {
                String toolName = findToolUse(node);
                if (toolName != null) {
                    return AgentOutput.toolUse(toolName);
                }
                return AgentOutput.text(extractText(node));
            }
            case "user":
                return AgentOutput.text(extractText(node));
            default:
                return AgentOutput.system("Unknown message type: " + message.type());
        }
    }

    /**
     * Concatenates the text of a message: a string {@code content} field, or the
     * {@code text} blocks of {@code message.content}.
     */
    static String extractText(JsonNode node) {
        JsonNode content = node.get("content");
        if (content != null && content.isTextual()) {
            return content.asText();
        }
        JsonNode blocks = node.path("message").path("content");
        if (!blocks.isArray()) {
            return "";
        }
        var sb = new StringBuilder();
        for (JsonNode block : blocks) {
            if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
                sb.append(block.get("text").asText());
            }
        }
        return sb.toString();
    }

    private static String findToolUse(JsonNode node) {
        JsonNode blocks = node.path("message").path("content");
        if (!blocks.isArray()) {
            return null;
        }
        for (JsonNode block : blocks) {
            if ("tool_use".equals(block.path("type").asText()) && block.path("name").isTextual()) {
                return block.get("name").asText();
            }
        }
        return null;
    }

    private static String textOr(JsonNode node, String fallback) {
        return node != null && node.isTextual() ? node.asText() : fallback;
    }

    private static String preview(String line) {
        return line.length() > 100 ? line.substring(0, 100) + "..." : line;
    }
}
