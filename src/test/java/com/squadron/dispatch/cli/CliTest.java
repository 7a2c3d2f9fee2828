package com.squadron.dispatch.cli;

import com.squadron.agent.AgentOrchestrator;
import com.squadron.agent.AgentOutput;
import com.squadron.agent.AgentProcess;
import com.squadron.agent.AgentState;
import com.squadron.agent.KillSignal;
import com.squadron.agent.OutputRingBuffer;
import com.squadron.agent.SpawnOptions;
import com.squadron.core.error.AllocationException;
import com.squadron.core.error.CommitException;
import com.squadron.core.events.EventBus;
import com.squadron.core.events.SquadronEvent;
import com.squadron.core.events.SquadronEventType;
import com.squadron.workspace.WorktreeAllocation;
import com.squadron.workspace.multirepo.FeatureRef;
import com.squadron.workspace.multirepo.MultiRepoConfig;
import com.squadron.workspace.multirepo.MultiRepoCoordinator;
import com.squadron.workspace.multirepo.MultiRepoWorktree;
import com.squadron.workspace.multirepo.PullRequest;
import com.squadron.workspace.multirepo.PullRequestOutcome;
import com.squadron.workspace.multirepo.RepoCommitResult;
import com.squadron.workspace.multirepo.RepoConfig;
import com.squadron.workspace.multirepo.RepoRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Tests for the Squadron CLI command structure.
 * These tests exercise picocli directly without a Spring context, with mocked services.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private MultiRepoCoordinator coordinator;
    private AgentOrchestrator orchestrator;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        coordinator = mock(MultiRepoCoordinator.class);
        orchestrator = mock(AgentOrchestrator.class);
        eventBus = new EventBus();
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == StartCommand.class) {
                    return (K) new StartCommand(coordinator, orchestrator, eventBus);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(coordinator);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        try {
            System.setOut(capturePrintStream);
            var cmd = new CommandLine(new SquadronCommand(), createFactory());
            cmd.setOut(new java.io.PrintWriter(capturePrintStream, true));
            cmd.setErr(new java.io.PrintWriter(capturePrintStream, true));
            int exitCode = cmd.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
        }
    }

    @Nested
    @DisplayName("command structure")
    class CommandStructure {

        @Test
        void noArgumentsPrintsUsage() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("start"));
            assertTrue(result.output().contains("validate"));
        }

        @Test
        void versionOption() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Squadron 0.1.0"));
        }

        @Test
        void startHelpListsOptions() {
            CliResult result = execute("start", "--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--task"));
            assertTrue(result.output().contains("--dependency"));
            assertTrue(result.output().contains("--keep-worktrees"));
        }

        @Test
        void startWithoutTaskIsUsageError() {
            CliResult result = execute("start", "feature/x", "--primary", "/tmp/api");

            assertEquals(2, result.exitCode());
            verifyNoInteractions(coordinator, orchestrator);
        }
    }

    @Nested
    @DisplayName("dependency parsing")
    class DependencyParsing {

        @Test
        void parsesNamePathAndBranch() {
            RepoConfig repo = WorkspaceOptions.parseDependency("shared=/srv/shared@develop");

            assertEquals("shared", repo.name());
            assertEquals(Path.of("/srv/shared"), repo.path());
            assertEquals("develop", repo.defaultBranch());
            assertEquals(RepoRole.DEPENDENCY, repo.role());
        }

        @Test
        void branchDefaultsToMain() {
            assertEquals("main", WorkspaceOptions.parseDependency("shared=/srv/shared").defaultBranch());
        }

        @Test
        void rejectsMalformedValues() {
            assertThrows(IllegalArgumentException.class, () -> WorkspaceOptions.parseDependency("shared"));
            assertThrows(IllegalArgumentException.class, () -> WorkspaceOptions.parseDependency("=/srv/shared"));
            assertThrows(IllegalArgumentException.class, () -> WorkspaceOptions.parseDependency("shared="));
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        void listsConfiguredRepositories() {
            when(coordinator.getConfiguredRepos()).thenReturn(List.of(
                    RepoConfig.primary("api", Path.of("/srv/api"), "main"),
                    RepoConfig.dependency("shared", Path.of("/srv/shared"), "develop")));

            CliResult result = execute("validate", "--primary", "/srv/api", "-d", "shared=/srv/shared@develop");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("api"));
            assertTrue(result.output().contains("shared"));
            assertTrue(result.output().contains("Workspace is valid"));

            var captor = ArgumentCaptor.forClass(MultiRepoConfig.class);
            verify(coordinator).initializeWorkspace(captor.capture());
            assertEquals("api", captor.getValue().primary().name());
            assertEquals(1, captor.getValue().dependencies().size());
        }

        @Test
        void invalidRepositoryExitsWithOne() {
            doThrow(new AllocationException("shared", "Repository 'shared' is not a git repository: /srv/shared"))
                    .when(coordinator).initializeWorkspace(any());

            CliResult result = execute("validate", "--primary", "/srv/api", "-d", "shared=/srv/shared");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("not a git repository"));
        }

        @Test
        void malformedDependencyExitsWithTwo() {
            CliResult result = execute("validate", "--primary", "/srv/api", "-d", "shared");

            assertEquals(2, result.exitCode());
            verify(coordinator, never()).initializeWorkspace(any());
        }
    }

    @Nested
    @DisplayName("start")
    class Start {

        private final Path apiWorktree = Path.of("/worktrees/api/feature-x");
        private AgentProcess process;

        @BeforeEach
        void stubWorkspace() {
            var allocations = new LinkedHashMap<String, WorktreeAllocation>();
            allocations.put("api", new WorktreeAllocation("wt_api", "api", Path.of("/srv/api"), apiWorktree,
                    "feature/x", "feature-x", null, Instant.EPOCH, true));
            allocations.put("shared", new WorktreeAllocation("wt_shared", "shared", Path.of("/srv/shared"),
                    Path.of("/worktrees/shared/feature-x"), "feature/x", "feature-x", null, Instant.EPOCH, true));
            var worktree = new MultiRepoWorktree("feature/x", allocations,
                    Map.of("api", "wt_api", "shared", "wt_shared"), Instant.EPOCH);
            when(coordinator.createMultiRepoWorktree("feature/x")).thenReturn(worktree);

            process = mock(AgentProcess.class);
            var output = new OutputRingBuffer<AgentOutput>(10);
            output.append(AgentOutput.text("Working on it"));
            when(process.getId()).thenReturn("proc_1");
            when(process.getPid()).thenReturn(4242L);
            when(process.getOutput()).thenReturn(output);
            when(orchestrator.spawn(any())).thenReturn(process);
        }

        private CliResult start(String... extra) {
            var args = new java.util.ArrayList<>(List.of("start", "feature/x", "--primary", "/srv/api",
                    "-d", "shared=/srv/shared", "--task", "Add login"));
            args.addAll(List.of(extra));
            return execute(args.toArray(String[]::new));
        }

        @Test
        void runsAgentInPrimaryWorktreeThenCommitsAndReleases() {
            when(orchestrator.waitForProcess("proc_1", null)).thenReturn(process);
            when(process.getState()).thenReturn(AgentState.COMPLETED);
            when(coordinator.commitAll("Add login", "feature/x")).thenReturn(List.of(
                    RepoCommitResult.committed("api", "feature/x", "abc123"),
                    RepoCommitResult.failed("shared", "feature/x",
                            new CommitException("shared", "Nothing to commit in repository 'shared'"))));

            CliResult result = start();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Working on it"));
            assertTrue(result.output().contains("committed abc123"));

            var captor = ArgumentCaptor.forClass(SpawnOptions.class);
            verify(orchestrator).spawn(captor.capture());
            assertEquals(apiWorktree, captor.getValue().workingDirectory());
            assertEquals("Add login", captor.getValue().task());
            assertEquals("agent-feature-x", captor.getValue().agentId());

            verify(coordinator, never()).createMultiRepoPRs(any());
            verify(coordinator).cleanupMultiRepoWorktree("feature/x", false);
        }

        @Test
        void opensPullRequestsWhenAsked() {
            when(orchestrator.waitForProcess("proc_1", null)).thenReturn(process);
            when(process.getState()).thenReturn(AgentState.COMPLETED);
            when(coordinator.commitAll(anyString(), eq("feature/x"))).thenReturn(List.of());
            when(coordinator.createMultiRepoPRs(any())).thenReturn(List.of(new PullRequestOutcome("api",
                    new PullRequest("api", 7, "https://github.com/acme/api/pull/7", "[feature/x] Add login",
                            PullRequest.State.OPEN, "feature/x", "main"), null)));

            CliResult result = start("--pr", "--commit-message", "feat: login");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("PR #7"));
            verify(coordinator).commitAll("feat: login", "feature/x");
            verify(coordinator).createMultiRepoPRs(new FeatureRef("feature/x", "Add login", "feature/x"));
        }

        @Test
        void timedOutAgentIsKilledAndNothingIsCommitted() {
            when(orchestrator.waitForProcess("proc_1", 5_000L)).thenReturn(null);
            when(orchestrator.waitForProcess(eq("proc_1"), eq(10_000L))).thenReturn(process);
            when(process.getState()).thenReturn(AgentState.KILLED);

            CliResult result = start("--timeout", "5");

            assertEquals(1, result.exitCode());
            verify(orchestrator).kill("proc_1", KillSignal.TERM);
            verify(orchestrator, never()).kill("proc_1", KillSignal.KILL);
            verify(coordinator, never()).commitAll(anyString(), anyString());
            verify(coordinator).cleanupMultiRepoWorktree("feature/x", false);
        }

        @Test
        void warnsWhileAgentWaitsForInput() {
            when(orchestrator.waitForProcess("proc_1", null)).thenAnswer(invocation -> {
                eventBus.publish(SquadronEvent.of(SquadronEventType.AGENT_WAITING, "agent-feature-x", "proc_1",
                        Map.of("prompt", "Should I proceed?")));
                return process;
            });
            when(process.getState()).thenReturn(AgentState.COMPLETED);
            when(coordinator.commitAll(anyString(), anyString())).thenReturn(List.of());

            CliResult result = start();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("waiting for input"));
            assertEquals(0, eventBus.subscriberCount());
        }

        @Test
        void keepWorktreesSkipsRelease() {
            when(orchestrator.waitForProcess(eq("proc_1"), isNull())).thenReturn(process);
            when(process.getState()).thenReturn(AgentState.ERROR);
            when(process.getLastError()).thenReturn("Process exited with code 1");

            CliResult result = start("--keep-worktrees");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Process exited with code 1"));
            verify(coordinator, never()).cleanupMultiRepoWorktree(anyString(), anyBoolean());
        }

        @Test
        void allocationFailureStopsBeforeSpawning() {
            when(coordinator.createMultiRepoWorktree("feature/x"))
                    .thenThrow(new AllocationException("shared", "Branch 'feature/x' is already allocated"));

            CliResult result = start();

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("already allocated"));
            verify(orchestrator, never()).spawn(any());
            verify(orchestrator, never()).waitForProcess(anyString(), anyLong());
        }
    }
}
