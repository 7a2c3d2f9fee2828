package com.squadron.agent;

/**
 * Kind of an output chunk captured from a worker process.
 */
public enum AgentOutputType {
    TEXT,
    TOOL_USE,
    TOOL_RESULT,
    ERROR,
    COST,
    SYSTEM
}
