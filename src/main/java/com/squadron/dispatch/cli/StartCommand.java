package com.squadron.dispatch.cli;

import com.squadron.agent.AgentOrchestrator;
import com.squadron.agent.AgentProcess;
import com.squadron.agent.AgentState;
import com.squadron.agent.KillSignal;
import com.squadron.agent.SpawnOptions;
import com.squadron.core.error.AllocationException;
import com.squadron.core.error.SpawnException;
import com.squadron.core.error.WorktreeDirtyException;
import com.squadron.core.events.EventBus;
import com.squadron.core.events.SquadronEventType;
import com.squadron.workspace.multirepo.FeatureRef;
import com.squadron.workspace.multirepo.MultiRepoConfig;
import com.squadron.workspace.multirepo.MultiRepoCoordinator;
import com.squadron.workspace.multirepo.MultiRepoWorktree;
import com.squadron.workspace.multirepo.PullRequestOutcome;
import com.squadron.workspace.multirepo.RepoCommitResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: squadron start &lt;featureBranch&gt; --primary PATH --task TEXT
 * <p>
 * Allocates the feature branch in every repository, runs one agent in the primary worktree
 * while streaming its output, commits the result everywhere and optionally opens pull requests.
 */
@Command(name = "start", mixinStandardHelpOptions = true,
        description = "Run an agent on a feature branch across repositories")
@Component
public class StartCommand implements Callable<Integer> {

    private static final long KILL_GRACE_MS = 10_000;

    @Parameters(index = "0", description = "Feature branch, created in every repository")
    String featureBranch;

    @Mixin
    WorkspaceOptions workspace = new WorkspaceOptions();

    @Option(names = {"--task", "-t"}, required = true, description = "Task for the agent")
    String task;

    @Option(names = "--agent", description = "Agent id (default: agent-<feature>)")
    String agentId;

    @Option(names = {"--model", "-m"}, description = "Model name or shortname (sonnet, opus, haiku)")
    String model;

    @Option(names = "--max-turns", description = "Conversation turn limit")
    Integer maxTurns;

    @Option(names = "--timeout", description = "Seconds to wait for the agent before killing it")
    Long timeoutSeconds;

    @Option(names = "--commit-message", description = "Commit message (default: the task)")
    String commitMessage;

    @Option(names = "--pr", description = "Push and open pull requests after committing")
    boolean openPullRequests;

    @Option(names = "--keep-worktrees", description = "Leave the worktrees in place when done")
    boolean keepWorktrees;

    private final MultiRepoCoordinator coordinator;
    private final AgentOrchestrator orchestrator;
    private final EventBus eventBus;

    public StartCommand(MultiRepoCoordinator coordinator, AgentOrchestrator orchestrator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        MultiRepoConfig config;
        try {
            config = workspace.toConfig();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        MultiRepoWorktree worktree;
        try {
            coordinator.initializeWorkspace(config);
            worktree = coordinator.createMultiRepoWorktree(featureBranch);
        } catch (AllocationException e) {
            ConsoleOutput.error(e.getMessage());
            for (Throwable suppressed : e.getSuppressed()) {
                ConsoleOutput.error("  " + suppressed.getMessage());
            }
            return 1;
        }
        ConsoleOutput.info("Allocated '%s' in %d repositories".formatted(featureBranch, worktree.allocations().size()));
        worktree.allocations().forEach((repo, allocation) ->
                ConsoleOutput.repo(repo, allocation.getWorktreePath().toString()));

        try {
            return runAgent(config, worktree);
        } finally {
            release();
        }
    }

    private int runAgent(MultiRepoConfig config, MultiRepoWorktree worktree) {
        Path primaryWorktree = worktree.allocations().get(config.primary().name()).getWorktreePath();
        String agent = agentId != null ? agentId : "agent-" + featureBranch.replace('/', '-');

        AgentProcess process;
        try {
            process = orchestrator.spawn(SpawnOptions.builder(agent, task, primaryWorktree)
                    .model(model)
                    .maxTurns(maxTurns)
                    .build());
        } catch (SpawnException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.info("Agent %s started (pid %d)".formatted(agent, process.getPid()));
        process.getOutput().subscribe(ConsoleOutput::agentOutput);
        EventBus.Subscription waiting = eventBus.subscribe(agent, Set.of(SquadronEventType.AGENT_WAITING),
                event -> ConsoleOutput.warn("Agent is waiting for input, which start does not provide"));

        AgentProcess finished;
        try {
            finished = awaitOrKill(process);
        } finally {
            waiting.unsubscribe();
        }

        AgentState state = finished != null ? finished.getState() : process.getState();
        ConsoleOutput.info("Agent finished: %s (cost $%.4f)".formatted(state, orchestrator.getTotalCost(process.getId())));
        if (state != AgentState.COMPLETED) {
            if (process.getLastError() != null) {
                ConsoleOutput.error(process.getLastError());
            }
            return 1;
        }

        String message = commitMessage != null ? commitMessage : task;
        List<RepoCommitResult> commits = coordinator.commitAll(message, featureBranch);
        commits.forEach(ConsoleOutput::commitResult);

        if (openPullRequests) {
            List<PullRequestOutcome> outcomes = coordinator.createMultiRepoPRs(
                    new FeatureRef(featureBranch, task, featureBranch));
            if (outcomes.isEmpty()) {
                ConsoleOutput.info("No repository has new commits; no pull requests opened");
            }
            outcomes.forEach(ConsoleOutput::pullRequest);
        }
        ConsoleOutput.success("Done.");
        return 0;
    }

    private AgentProcess awaitOrKill(AgentProcess process) {
        Long timeoutMs = timeoutSeconds != null ? timeoutSeconds * 1000 : null;
        AgentProcess finished = orchestrator.waitForProcess(process.getId(), timeoutMs);
        if (finished == null) {
            ConsoleOutput.warn("Agent timed out after %ds, killing it".formatted(timeoutSeconds));
            orchestrator.kill(process.getId(), KillSignal.TERM);
            finished = orchestrator.waitForProcess(process.getId(), KILL_GRACE_MS);
            if (finished == null) {
                orchestrator.kill(process.getId(), KillSignal.KILL);
                finished = orchestrator.waitForProcess(process.getId(), KILL_GRACE_MS);
            }
        }
        return finished;
    }

    private void release() {
        if (keepWorktrees) {
            ConsoleOutput.info("Keeping worktrees for '%s'".formatted(featureBranch));
            return;
        }
        try {
            coordinator.cleanupMultiRepoWorktree(featureBranch, false);
        } catch (WorktreeDirtyException e) {
            ConsoleOutput.warn(e.getMessage());
            ConsoleOutput.warn("Worktrees kept so uncommitted work is not lost");
        } catch (AllocationException e) {
            ConsoleOutput.error("Failed to release worktrees: " + e.getMessage());
        }
    }
}
