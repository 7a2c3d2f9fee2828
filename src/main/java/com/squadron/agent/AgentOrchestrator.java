package com.squadron.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.squadron.core.config.SquadronProperties;
import com.squadron.core.credentials.CredentialStore;
import com.squadron.core.error.SpawnException;
import com.squadron.core.events.EventBus;
import com.squadron.core.events.SquadronEvent;
import com.squadron.core.events.SquadronEventType;
import com.squadron.core.logging.MdcContext;
import com.squadron.core.metrics.SquadronMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Spawns and supervises worker processes.
 *
 * <p>Each spawn launches one OS child with piped standard streams. Two background threads
 * drain stdout and stderr into the process's {@link OutputRingBuffer}; the terminal state is
 * recorded once both streams are exhausted and the OS reports exit. No public method blocks
 * on a child's lifetime except {@link #waitForProcess(String, Long)}.
 *
 * <p>Every live worker holds one slot of an {@link AgentSlotPool}; the slot returns to the
 * pool when the worker's terminal state has been recorded.
 */
@Service
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private static final long SIGNAL_TIMEOUT_SECONDS = 5;

    private final SquadronProperties.Agent config;
    private final CredentialStore credentialStore;
    private final EventBus eventBus;
    private final SquadronMetrics metrics;
    private final ProcessLauncher launcher;
    private final StreamMessageParser parser;
    private final InterventionDetector interventionDetector = new InterventionDetector();
    private final Clock clock;

    private final ConcurrentHashMap<String, AgentProcess> processes = new ConcurrentHashMap<>();
    private final AgentSlotPool slots;
    private final ExecutorService drainExecutor;

    public AgentOrchestrator(SquadronProperties properties,
                             CredentialStore credentialStore,
                             EventBus eventBus,
                             SquadronMetrics metrics,
                             ProcessLauncher launcher,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.config = properties.getAgent();
        this.credentialStore = credentialStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.launcher = launcher;
        this.parser = new StreamMessageParser(objectMapper);
        this.clock = clock;
        this.slots = new AgentSlotPool(config.getMaxConcurrent(), config.getQueueStrategy());
        var threadCount = new AtomicInteger();
        this.drainExecutor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "agent-drain-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Launches a worker and registers it in state {@link AgentState#STARTING}.
     *
     * @throws SpawnException if the options are invalid, every concurrency slot is taken, or the
     *                        binary cannot be started
     */
    public AgentProcess spawn(SpawnOptions options) {
        validate(options);
        if (!slots.tryAcquire()) {
            throw new SpawnException("Concurrency limit of %d agents reached"
                    .formatted(slots.getStats().maxConcurrent()));
        }
        return startHoldingSlot(options);
    }

    /**
     * Launches a worker once a concurrency slot is free. Invalid options fail synchronously;
     * launch failures and a cleared queue complete the future exceptionally with
     * {@link SpawnException}.
     */
    public CompletableFuture<AgentProcess> spawnQueued(SpawnOptions options) {
        validate(options);
        return slots.acquire(options.priority())
                .thenApplyAsync(v -> startHoldingSlot(options), drainExecutor);
    }

    public AgentSlotPool.Stats getPoolStats() {
        return slots.getStats();
    }

    /**
     * Changes the concurrency limit. Queued spawns start if the limit grows; running workers
     * are never stopped when it shrinks.
     */
    public void setMaxConcurrent(int max) {
        slots.setLimit(max);
    }

    private static void validate(SpawnOptions options) {
        if (options.agentId() == null || options.agentId().isBlank()) {
            throw new SpawnException("Agent id is required");
        }
        if (options.task() == null || options.task().isBlank()) {
            throw new SpawnException("Task is required");
        }
        if (options.workingDirectory() == null || !Files.isDirectory(options.workingDirectory())) {
            throw new SpawnException("Working directory does not exist: " + options.workingDirectory());
        }
    }

    private AgentProcess startHoldingSlot(SpawnOptions options) {
        try {
            return start(options);
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }
    }

    private AgentProcess start(SpawnOptions options) {
        List<String> command = AgentArgsBuilder.buildCommand(
                config.getBinary(), options, config.getDefaultModel(), config.getDefaultMaxTurns());

        Map<String, String> env = new HashMap<>(options.environment());
        env.put("NO_COLOR", "1");
        env.put("FORCE_COLOR", "0");
        credentialStore.getCredential(config.getCredentialKey())
                .ifPresent(token -> env.put(config.getTokenEnvVar(), token));

        Process process;
        try {
            process = launcher.launch(command, options.workingDirectory(), env);
        } catch (IOException e) {
            throw new SpawnException("Failed to launch worker '%s': %s".formatted(config.getBinary(), e.getMessage()), e);
        }

        String id = "proc_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        var agentProcess = new AgentProcess(id, options.agentId(), options.sessionId(), process,
                options.workingDirectory(), clock.instant(), config.getReplayBufferSize());
        processes.put(id, agentProcess);

        MdcContext.setProcess(id, options.agentId());
        try {
            log.info("Spawned worker {} (pid {}) for agent {} in {}",
                    id, agentProcess.getPid(), options.agentId(), options.workingDirectory());
        } finally {
            MdcContext.clear();
        }
        metrics.recordAgentSpawned();
        publish(SquadronEventType.AGENT_STARTED, agentProcess, payload(
                "pid", agentProcess.getPid(),
                "workingDirectory", options.workingDirectory().toString()));

        var drainError = new AtomicReference<String>();
        CompletableFuture<Void> stdout = CompletableFuture.runAsync(
                () -> drain(agentProcess, process.getInputStream(), line -> handleStdoutLine(agentProcess, line), drainError),
                drainExecutor);
        CompletableFuture<Void> stderr = CompletableFuture.runAsync(
                () -> drain(agentProcess, process.getErrorStream(), line -> handleStderrLine(agentProcess, line), drainError),
                drainExecutor);

        CompletableFuture.allOf(stdout, stderr)
                .thenCompose(v -> process.onExit())
                .whenComplete((p, failure) -> {
                    if (failure != null) {
                        drainError.compareAndSet(null, failure.getMessage());
                        process.destroyForcibly();
                    }
                    try {
                        finish(agentProcess, drainError.get());
                    } finally {
                        slots.release();
                        agentProcess.completeTermination();
                    }
                });

        return agentProcess;
    }

    public Optional<AgentProcess> getProcess(String id) {
        return Optional.ofNullable(id).map(processes::get);
    }

    public List<AgentProcess> getAllProcesses() {
        return List.copyOf(processes.values());
    }

    public List<AgentProcess> getProcessesByAgent(String agentId) {
        return processes.values().stream()
                .filter(p -> p.getAgentId().equals(agentId))
                .toList();
    }

    /**
     * Writes {@code text} and a newline to the child's stdin. Only a working or waiting
     * process accepts input; a waiting process returns to working.
     *
     * @return false, with no side effect, for unknown ids and processes not accepting input
     */
    public boolean sendInput(String id, String text) {
        AgentProcess agentProcess = processes.get(id);
        if (agentProcess == null || !agentProcess.getState().acceptsInput()) {
            return false;
        }
        try {
            agentProcess.writeInput(text);
        } catch (IOException e) {
            log.warn("Failed to write input to {}: {}", id, e.getMessage());
            agentProcess.recordError("Failed to write input: " + e.getMessage());
            return false;
        }
        agentProcess.recordActivity(clock.instant());
        agentProcess.transition(AgentState.WAITING, AgentState.WORKING);
        return true;
    }

    public boolean kill(String id) {
        return kill(id, KillSignal.TERM);
    }

    /**
     * Signals the child to terminate. The process becomes {@link AgentState#KILLED} once
     * the OS confirms exit.
     *
     * @return false for unknown ids, already-terminal processes, and children that already
     *         exited while their terminal state is still being recorded
     */
    public boolean kill(String id, KillSignal signal) {
        AgentProcess agentProcess = processes.get(id);
        if (agentProcess == null || agentProcess.getState().isTerminal() || !agentProcess.process().isAlive()) {
            return false;
        }
        agentProcess.markKillRequested();
        log.info("Killing worker {} (pid {}) with {}", id, agentProcess.getPid(), signal);
        // children of the worker hold the output pipes open; collect them before the parent exits
        List<ProcessHandle> descendants = agentProcess.process().descendants().toList();
        if (signal == KillSignal.KILL) {
            agentProcess.process().destroyForcibly();
            descendants.forEach(ProcessHandle::destroyForcibly);
        } else {
            agentProcess.process().destroy();
            descendants.forEach(ProcessHandle::destroy);
        }
        // a stopped child only sees TERM once continued
        if (agentProcess.getState() == AgentState.PAUSED) {
            sendSignal(agentProcess, "CONT");
        }
        return true;
    }

    /**
     * Suspends a working or waiting process with SIGSTOP.
     */
    public boolean pause(String id) {
        AgentProcess agentProcess = processes.get(id);
        if (agentProcess == null || !agentProcess.getState().acceptsInput()) {
            return false;
        }
        AgentState previous = agentProcess.getState();
        if (!sendSignal(agentProcess, "STOP")) {
            return false;
        }
        if (!agentProcess.transition(previous, AgentState.PAUSED)) {
            return false;
        }
        publish(SquadronEventType.AGENT_PAUSED, agentProcess, payload());
        return true;
    }

    /**
     * Continues a paused process with SIGCONT; it returns to working.
     */
    public boolean resume(String id) {
        AgentProcess agentProcess = processes.get(id);
        if (agentProcess == null || agentProcess.getState() != AgentState.PAUSED) {
            return false;
        }
        if (!sendSignal(agentProcess, "CONT")) {
            return false;
        }
        if (!agentProcess.transition(AgentState.PAUSED, AgentState.WORKING)) {
            return false;
        }
        publish(SquadronEventType.AGENT_RESUMED, agentProcess, payload());
        return true;
    }

    /**
     * Blocks the caller until the process is terminal.
     *
     * @param timeoutMs maximum wait, or null to wait indefinitely
     * @return the terminated process, or null for unknown ids and on timeout
     */
    public AgentProcess waitForProcess(String id, Long timeoutMs) {
        AgentProcess agentProcess = processes.get(id);
        if (agentProcess == null) {
            return null;
        }
        try {
            if (timeoutMs == null) {
                return agentProcess.onTermination().get();
            }
            return agentProcess.onTermination().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            log.warn("Waiting on {} failed: {}", id, e.getMessage());
            return null;
        }
    }

    public Optional<String> getSessionId(String id) {
        return getProcess(id).map(AgentProcess::getSessionId);
    }

    /** Accumulated reported cost in USD; 0 for unknown ids. */
    public double getTotalCost(String id) {
        return getProcess(id).map(p -> p.getCost().doubleValue()).orElse(0.0);
    }

    /**
     * Removes a terminated record.
     *
     * @return false for unknown ids and active processes
     */
    public boolean removeProcess(String id) {
        AgentProcess agentProcess = processes.get(id);
        if (agentProcess == null || agentProcess.isActive()) {
            return false;
        }
        return processes.remove(id, agentProcess);
    }

    /** Removes every terminated record and returns how many were removed. */
    public int clearCompleted() {
        int removed = 0;
        for (var entry : processes.entrySet()) {
            if (entry.getValue().getState().isTerminal() && processes.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Cleared {} terminated processes", removed);
        }
        return removed;
    }

    @PreDestroy
    public void shutdown() {
        int cleared = slots.clearQueue();
        if (cleared > 0) {
            log.info("Dropped {} queued spawns on shutdown", cleared);
        }
        for (AgentProcess agentProcess : processes.values()) {
            if (agentProcess.isActive()) {
                kill(agentProcess.getId(), KillSignal.KILL);
            }
        }
        drainExecutor.shutdown();
    }

    // --- draining ---

    private void drain(AgentProcess agentProcess, InputStream stream, Consumer<String> lineHandler,
                       AtomicReference<String> drainError) {
        MdcContext.setProcess(agentProcess.getId(), agentProcess.getAgentId());
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineHandler.accept(line);
            }
        } catch (IOException e) {
            if (!agentProcess.isKillRequested()) {
                log.error("Output stream of {} failed: {}", agentProcess.getId(), e.getMessage());
                drainError.compareAndSet(null, "Output stream failed: " + e.getMessage());
                agentProcess.process().destroyForcibly();
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void handleStdoutLine(AgentProcess agentProcess, String line) {
        agentProcess.recordActivity(clock.instant());
        if (agentProcess.transition(AgentState.STARTING, AgentState.WORKING)) {
            log.debug("Worker {} is working", agentProcess.getId());
        }
        if (line.isBlank()) {
            return;
        }

        AgentOutput chunk;
        var message = parser.parseLine(line);
        if (message.isPresent()) {
            message.get().sessionId().ifPresent(agentProcess::setSessionId);
            message.get().costUsd().ifPresent(cost -> {
                agentProcess.addCost(cost);
                metrics.recordAgentCost(cost);
            });
            chunk = parser.toOutput(message.get());
        } else {
            chunk = AgentOutput.text(line);
        }
        emit(agentProcess, chunk);

        if (config.isDetectInterventions()
                && interventionDetector.requiresInput(chunk)
                && agentProcess.transition(AgentState.WORKING, AgentState.WAITING)) {
            log.info("Worker {} is waiting for input", agentProcess.getId());
            publish(SquadronEventType.AGENT_WAITING, agentProcess, payload("prompt", chunk.content()));
        }
    }

    private void handleStderrLine(AgentProcess agentProcess, String line) {
        agentProcess.recordActivity(clock.instant());
        if (!line.isBlank()) {
            emit(agentProcess, AgentOutput.error(line));
        }
    }

    private void emit(AgentProcess agentProcess, AgentOutput chunk) {
        agentProcess.getOutput().append(chunk);
        publish(SquadronEventType.AGENT_OUTPUT, agentProcess, payload(
                "type", chunk.type().name(),
                "content", chunk.content()));
    }

    private void finish(AgentProcess agentProcess, String drainError) {
        Process process = agentProcess.process();
        Integer exitCode = process.isAlive() ? null : process.exitValue();

        AgentState finalState;
        String error = null;
        if (agentProcess.isKillRequested()) {
            finalState = AgentState.KILLED;
        } else if (drainError != null) {
            finalState = AgentState.ERROR;
            error = drainError;
        } else if (exitCode != null && exitCode == 0) {
            finalState = AgentState.COMPLETED;
        } else {
            finalState = AgentState.ERROR;
            error = "Process exited with code " + exitCode;
        }

        if (!agentProcess.terminate(finalState, exitCode, error, clock.instant())) {
            return;
        }

        MdcContext.setProcess(agentProcess.getId(), agentProcess.getAgentId());
        try {
            log.info("Worker {} finished: state={}, exitCode={}, cost=${}",
                    agentProcess.getId(), finalState, exitCode, agentProcess.getCost());
        } finally {
            MdcContext.clear();
        }

        long runtimeMs = Duration.between(agentProcess.getStartedAt(), agentProcess.getEndedAt()).toMillis();
        metrics.recordAgentFinished(finalState.name().toLowerCase(Locale.ROOT), Math.max(0, runtimeMs));

        SquadronEventType eventType = switch (finalState) {
            case COMPLETED -> SquadronEventType.AGENT_COMPLETED;
            case KILLED -> SquadronEventType.AGENT_KILLED;
            default -> SquadronEventType.AGENT_ERROR;
        };
        publish(eventType, agentProcess, payload(
                "exitCode", exitCode,
                "costUsd", agentProcess.getCost().doubleValue(),
                "error", error));
    }

    private boolean sendSignal(AgentProcess agentProcess, String signal) {
        try {
            Process kill = launcher.launch(
                    List.of("kill", "-" + signal, String.valueOf(agentProcess.getPid())),
                    agentProcess.getWorkingDirectory(), Map.of());
            if (!kill.waitFor(SIGNAL_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                kill.destroyForcibly();
                log.warn("Timed out sending SIG{} to {}", signal, agentProcess.getId());
                return false;
            }
            if (kill.exitValue() != 0) {
                log.warn("kill -{} {} exited with code {}", signal, agentProcess.getPid(), kill.exitValue());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to send SIG{} to {}: {}", signal, agentProcess.getId(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void publish(SquadronEventType type, AgentProcess agentProcess, Map<String, Object> payload) {
        payload.putIfAbsent("processId", agentProcess.getId());
        eventBus.publish(SquadronEvent.of(type, agentProcess.getAgentId(), agentProcess.getId(), payload));
    }

    /** Builds a mutable payload from key/value pairs, skipping null values. */
    private static Map<String, Object> payload(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }
}
