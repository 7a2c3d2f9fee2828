package com.squadron.agent;

/**
 * Termination signal for {@link AgentOrchestrator#kill(String, KillSignal)}.
 */
public enum KillSignal {
    /** Graceful termination (SIGTERM). */
    TERM,
    /** Forced termination (SIGKILL). */
    KILL
}
