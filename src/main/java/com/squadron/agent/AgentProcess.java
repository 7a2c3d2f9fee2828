package com.squadron.agent;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * One supervised worker invocation.
 *
 * <p>Exactly one instance exists per spawned OS process and it is shared by every caller:
 * {@link AgentOrchestrator} is the only writer, all other access is read-only. The OS
 * process id is live only while {@link #getState()} is active.
 */
public class AgentProcess {

    private final String id;
    private final String agentId;
    private final long pid;
    private final Path workingDirectory;
    private final Instant startedAt;
    private final OutputRingBuffer<AgentOutput> output;
    private final CompletableFuture<AgentProcess> termination = new CompletableFuture<>();

    private final Process process;

    private volatile AgentState state = AgentState.STARTING;
    private volatile String sessionId;
    private volatile Instant endedAt;
    private volatile Integer exitCode;
    private volatile Instant lastActivity;
    private volatile String lastError;
    private volatile boolean killRequested;
    private BigDecimal cost = BigDecimal.ZERO;

    AgentProcess(String id, String agentId, String sessionId, Process process, Path workingDirectory,
                 Instant startedAt, int bufferCapacity) {
        this.id = id;
        this.agentId = agentId;
        this.sessionId = sessionId;
        this.process = process;
        this.pid = process.pid();
        this.workingDirectory = workingDirectory;
        this.startedAt = startedAt;
        this.lastActivity = startedAt;
        this.output = new OutputRingBuffer<>(bufferCapacity);
    }

    public String getId() { return id; }
    public String getAgentId() { return agentId; }
    public String getSessionId() { return sessionId; }
    public long getPid() { return pid; }
    public AgentState getState() { return state; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getEndedAt() { return endedAt; }
    public Integer getExitCode() { return exitCode; }
    public Instant getLastActivity() { return lastActivity; }
    public Path getWorkingDirectory() { return workingDirectory; }
    public String getLastError() { return lastError; }

    public synchronized BigDecimal getCost() {
        return cost;
    }

    /** Replay log of recent output; subscribe to receive the backlog and then live chunks. */
    public OutputRingBuffer<AgentOutput> getOutput() {
        return output;
    }

    /** Completes with this process once it reaches a terminal state. */
    public CompletableFuture<AgentProcess> onTermination() {
        return termination;
    }

    public boolean isActive() {
        return state.isActive();
    }

    // --- mutators, orchestrator only ---

    Process process() {
        return process;
    }

    /**
     * Moves from {@code expected} to {@code next}. Terminal states are final.
     *
     * @return true if the transition happened
     */
    synchronized boolean transition(AgentState expected, AgentState next) {
        if (state != expected) {
            return false;
        }
        state = next;
        return true;
    }

    /**
     * Records the terminal outcome. Only the first call has effect.
     */
    synchronized boolean terminate(AgentState finalState, Integer exitCode, String error, Instant at) {
        if (state.isTerminal()) {
            return false;
        }
        this.state = finalState;
        this.exitCode = exitCode;
        this.endedAt = at;
        if (error != null) {
            this.lastError = error;
        }
        output.close();
        return true;
    }

    /** Releases waiters once the terminal outcome has been fully reported. */
    void completeTermination() {
        termination.complete(this);
    }

    synchronized void addCost(double amount) {
        cost = cost.add(BigDecimal.valueOf(amount));
    }

    void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    void recordActivity(Instant at) {
        this.lastActivity = at;
    }

    void recordError(String error) {
        this.lastError = error;
    }

    void markKillRequested() {
        this.killRequested = true;
    }

    boolean isKillRequested() {
        return killRequested;
    }

    /**
     * Writes a line to the child's standard input.
     */
    synchronized void writeInput(String text) throws IOException {
        OutputStream stdin = process.getOutputStream();
        stdin.write((text + "\n").getBytes(StandardCharsets.UTF_8));
        stdin.flush();
    }

    @Override
    public String toString() {
        return "AgentProcess{id=%s, agentId=%s, pid=%d, state=%s}".formatted(id, agentId, pid, state);
    }
}
