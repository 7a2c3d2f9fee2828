package com.squadron.agent;

/**
 * Lifecycle state of an {@link AgentProcess}.
 */
public enum AgentState {
    STARTING,
    WORKING,
    WAITING,   // blocked on interactive input
    PAUSED,
    COMPLETED,
    ERROR,
    KILLED;

    /** True while the OS process id is valid and live. */
    public boolean isActive() {
        return !isTerminal();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == KILLED;
    }

    /** True when the child is expected to read from its standard input. */
    public boolean acceptsInput() {
        return this == WORKING || this == WAITING;
    }
}
