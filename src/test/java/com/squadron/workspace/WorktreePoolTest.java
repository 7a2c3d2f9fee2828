package com.squadron.workspace;

import com.squadron.core.config.SquadronProperties;
import com.squadron.core.error.AllocationException;
import com.squadron.core.error.NotInitializedException;
import com.squadron.core.error.WorktreeDirtyException;
import com.squadron.core.events.EventBus;
import com.squadron.core.events.SquadronEvent;
import com.squadron.core.events.SquadronEventType;
import com.squadron.core.metrics.SquadronMetrics;
import com.squadron.workspace.git.GitService;
import com.squadron.workspace.git.TestRepositories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs {@link WorktreePool} against a real repository in a temporary directory.
 */
class WorktreePoolTest {

    @TempDir
    Path tmp;

    private Path repo;
    private SquadronProperties.Worktree config;
    private EventBus eventBus;
    private List<SquadronEvent> events;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private GitService git;
    private WorktreePool pool;

    @BeforeEach
    void setUp() throws Exception {
        repo = TestRepositories.createRepo(tmp.resolve("api"));
        config = new SquadronProperties.Worktree();
        config.setBaseDir(tmp.resolve("worktrees").toString());
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        git = new GitService();
        pool = newPool();
    }

    private WorktreePool newPool() {
        return new WorktreePool("api", repo, "main", git, config, eventBus, new SquadronMetrics(registry), clock);
    }

    @Test
    void allocateRequiresInitialization() {
        assertThrows(NotInitializedException.class, () -> pool.allocate("feature/x", "feature-x", null));
    }

    @Test
    void validateRejectsNonRepositories() throws IOException {
        Path plain = Files.createDirectories(tmp.resolve("plain"));
        var notRepo = new WorktreePool("plain", plain, "main", git, config, eventBus,
                new SquadronMetrics(registry), clock);
        var missing = new WorktreePool("missing", tmp.resolve("missing"), "main", git, config, eventBus,
                new SquadronMetrics(registry), clock);

        var error = assertThrows(AllocationException.class, notRepo::validate);
        assertEquals("plain", error.getRepoName());
        assertThrows(AllocationException.class, missing::initialize);
        assertFalse(missing.isInitialized());
    }

    @Test
    void sanitizesBranchNamesIntoDirectoryNames() {
        assertEquals("feature-auth-v2", WorktreePool.sanitize("feature/auth v2"));
        assertEquals(tmp.resolve("worktrees").resolve("api").resolve("feature-x").toAbsolutePath().normalize(),
                pool.worktreePathFor("feature/x"));
    }

    @Nested
    @DisplayName("once initialized")
    class Initialized {

        @BeforeEach
        void init() {
            pool.initialize();
        }

        @Test
        void allocatesWorktreeOnNewBranch() throws Exception {
            var allocation = pool.allocate("feature/x", "feature-x", "agent-1");

            assertTrue(Files.isDirectory(allocation.getWorktreePath()));
            assertEquals("feature/x", git.currentBranch(allocation.getWorktreePath()));
            assertTrue(allocation.isAllocated());
            assertFalse(allocation.isDirty());
            assertEquals(clock.instant(), allocation.getCreatedAt());
            assertEquals(allocation, pool.getAllocation(allocation.getId()).orElseThrow());
            assertEquals(allocation, pool.findByBranch("feature/x").orElseThrow());
            assertEquals(allocation, pool.findByPath(allocation.getWorktreePath().resolve("src/Main.java")).orElseThrow());
            assertEquals(List.of(allocation), pool.getAllocationsByAgent("agent-1"));

            assertTrue(events.stream().anyMatch(e -> e.eventType() == SquadronEventType.GIT_WORKTREE_CREATED
                    && "api".equals(e.scopeId())));
            assertEquals(1.0, registry.get("squadron.worktrees.allocated").tag("repo", "api").counter().count());
        }

        @Test
        void sameBranchCannotBeAllocatedTwice() {
            pool.allocate("feature/x", "feature-x", null);

            var error = assertThrows(AllocationException.class, () -> pool.allocate("feature/x", "feature-x", null));
            assertTrue(error.getMessage().contains("feature/x"));
            assertEquals(1, pool.getAllAllocations().size());
            assertEquals(1.0, registry.get("squadron.worktrees.conflicts").counter().count());
        }

        @Test
        void concurrentAllocationsOfOneBranchHaveExactlyOneWinner() throws Exception {
            int threads = 4;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            var start = new CountDownLatch(1);
            try {
                var futures = new java.util.ArrayList<Future<WorktreeAllocation>>();
                for (int i = 0; i < threads; i++) {
                    String agent = "agent-" + i;
                    futures.add(executor.submit(() -> {
                        start.await();
                        return pool.allocate("feature/race", "feature-race", agent);
                    }));
                }
                start.countDown();

                int successes = 0;
                int conflicts = 0;
                for (Future<WorktreeAllocation> future : futures) {
                    try {
                        future.get(60, TimeUnit.SECONDS);
                        successes++;
                    } catch (java.util.concurrent.ExecutionException e) {
                        assertInstanceOf(AllocationException.class, e.getCause());
                        conflicts++;
                    }
                }
                assertEquals(1, successes);
                assertEquals(threads - 1, conflicts);
                assertEquals(1, pool.getAllAllocations().size());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        void dirtyWorktreeIsNotReleasedWithoutForce() throws Exception {
            var allocation = pool.allocate("feature/x", "feature-x", null);
            Files.writeString(allocation.getWorktreePath().resolve("wip.txt"), "work in progress\n");

            var error = assertThrows(WorktreeDirtyException.class, () -> pool.release(allocation.getId(), false));

            assertEquals(allocation.getWorktreePath(), error.getWorktreePath());
            assertTrue(allocation.isAllocated());
            assertTrue(allocation.isDirty());
            assertTrue(pool.getAllocation(allocation.getId()).isPresent());
            assertTrue(Files.exists(allocation.getWorktreePath().resolve("wip.txt")));

            pool.release(allocation.getId(), true);

            assertFalse(allocation.isAllocated());
            assertFalse(Files.exists(allocation.getWorktreePath()));
            assertTrue(pool.getAllocation(allocation.getId()).isEmpty());
            assertEquals(1.0, registry.get("squadron.worktrees.released").tag("forced", "true").counter().count());
        }

        @Test
        void dirtyFlagBlocksReleaseUntilMarkedClean() {
            config.setVerifyCleanOnRelease(false);
            var allocation = pool.allocate("feature/x", "feature-x", null);

            pool.markDirty(allocation.getId());
            assertTrue(pool.hasUncommittedChanges(allocation.getId()));
            assertThrows(WorktreeDirtyException.class, () -> pool.release(allocation.getId(), false));

            pool.markClean(allocation.getId());
            pool.release(allocation.getId(), false);
            assertTrue(pool.getAllAllocations().isEmpty());
        }

        @Test
        void releasedBranchCanBeAllocatedAgain() throws Exception {
            var first = pool.allocate("feature/x", "feature-x", null);
            Files.writeString(first.getWorktreePath().resolve("kept.txt"), "kept\n");
            git.commitAll(first.getWorktreePath(), "keep");
            pool.release(first.getId(), false);

            var second = pool.allocate("feature/x", "feature-x", null);

            assertNotEquals(first.getId(), second.getId());
            assertTrue(Files.exists(second.getWorktreePath().resolve("kept.txt")));
        }

        @Test
        void branchIsDeletedOnReleaseWhenConfigured() {
            config.setDeleteBranchOnRelease(true);
            var allocation = pool.allocate("feature/x", "feature-x", null);

            pool.release(allocation.getId(), false);

            assertFalse(git.branchExists(repo, "feature/x"));
        }

        @Test
        void discardCreatedBranchDeletesOnlyBranchesTheAllocationCreated() throws Exception {
            TestRepositories.git(repo, "branch", "feature/existing");
            var created = pool.allocate("feature/x", "feature-x", null);
            var existing = pool.allocate("feature/existing", "existing", null);
            assertTrue(created.isBranchCreated());
            assertFalse(existing.isBranchCreated());

            assertThrows(AllocationException.class, () -> pool.discardCreatedBranch(created));

            pool.release(created.getId(), true);
            pool.release(existing.getId(), true);

            assertTrue(pool.discardCreatedBranch(created));
            assertFalse(pool.discardCreatedBranch(existing));
            assertFalse(git.branchExists(repo, "feature/x"));
            assertTrue(git.branchExists(repo, "feature/existing"));
        }

        @Test
        void discardCreatedBranchSkipsBranchHeldByNewerAllocation() {
            var first = pool.allocate("feature/x", "feature-x", null);
            pool.release(first.getId(), true);
            var second = pool.allocate("feature/x", "feature-x", null);

            assertFalse(pool.discardCreatedBranch(first));
            assertTrue(git.branchExists(repo, "feature/x"));
            assertTrue(pool.getAllocation(second.getId()).isPresent());
        }

        @Test
        void queriesAcceptNullOwners() {
            var unowned = pool.allocate("feature/x", null, null);
            pool.allocate("feature/y", "feature-y", "agent-1");

            assertEquals(List.of(unowned), pool.getAllocationsByFeature(null));
            assertEquals(List.of(unowned), pool.getAllocationsByAgent(null));
            assertEquals(0, pool.cleanupFeature(null));
            assertEquals(0, pool.cleanupAgent(null));
            assertEquals(2, pool.getAllAllocations().size());
        }

        @Test
        void releasingUnknownAllocationFails() {
            assertThrows(AllocationException.class, () -> pool.release("wt_missing", true));
        }

        @Test
        void enforcesMaximumWorktreesPerRepository() {
            config.setMaxPerRepo(1);
            var first = pool.allocate("feature/a", "a", null);

            assertThrows(AllocationException.class, () -> pool.allocate("feature/b", "b", null));
            assertTrue(pool.findByBranch("feature/b").isEmpty());

            pool.release(first.getId(), true);
            assertNotNull(pool.allocate("feature/b", "b", null));
        }

        @Test
        void cleanupStaleReleasesOnlyIdleAllocations() {
            var old = pool.allocate("feature/old", "old", null);
            clock.advance(Duration.ofHours(20));
            var touched = pool.allocate("feature/touched", "touched", null);
            clock.advance(Duration.ofHours(5));
            pool.touch(touched.getId());
            var fresh = pool.allocate("feature/fresh", "fresh", null);

            int released = pool.cleanupStale(24);

            assertEquals(1, released);
            assertTrue(pool.getAllocation(old.getId()).isEmpty());
            assertTrue(pool.getAllocation(touched.getId()).isPresent());
            assertTrue(pool.getAllocation(fresh.getId()).isPresent());
        }

        @Test
        void cleanupByFeatureAndAgent() {
            pool.allocate("feature/a1", "a", "agent-1");
            pool.allocate("feature/a2", "a", "agent-2");
            pool.allocate("feature/b1", "b", "agent-1");

            assertEquals(2, pool.cleanupFeature("a"));
            assertEquals(1, pool.cleanupAgent("agent-1"));
            assertTrue(pool.getAllAllocations().isEmpty());
        }

        @Test
        void syncDropsAllocationsWhoseDirectoryVanished() throws Exception {
            var allocation = pool.allocate("feature/x", "feature-x", null);
            deleteRecursively(allocation.getWorktreePath());

            SyncResult result = pool.syncWithDisk();

            assertEquals(List.of(allocation.getId()), result.removedAllocations());
            assertTrue(result.orphanedWorktrees().isEmpty());
            assertFalse(allocation.isAllocated());
            assertNotNull(pool.allocate("feature/x", "feature-x", null));
        }

        @Test
        void syncReportsWorktreesNoAllocationOwns() throws Exception {
            Path orphan = pool.getPoolRoot().resolve("orphan");
            TestRepositories.git(repo, "worktree", "add", "-b", "orphan", orphan.toString(), "main");

            SyncResult result = pool.syncWithDisk();

            assertTrue(result.removedAllocations().isEmpty());
            assertEquals(1, result.orphanedWorktrees().size());
            assertEquals(orphan.getFileName(), result.orphanedWorktrees().get(0).getFileName());
        }

        @Test
        void statsCountAllocationsPerFeature() {
            config.setVerifyCleanOnRelease(false);
            var a = pool.allocate("feature/a1", "a", null);
            pool.allocate("feature/a2", "a", null);
            pool.allocate("feature/b1", "b", null);
            pool.markDirty(a.getId());

            PoolStats stats = pool.getStats();

            assertEquals("api", stats.repoName());
            assertEquals(3, stats.total());
            assertEquals(3, stats.active());
            assertEquals(1, stats.dirty());
            assertEquals(Map.of("a", 2, "b", 1), stats.byFeature());
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}
