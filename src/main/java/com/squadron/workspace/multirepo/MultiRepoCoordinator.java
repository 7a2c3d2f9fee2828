package com.squadron.workspace.multirepo;

import com.squadron.core.error.AllocationException;
import com.squadron.core.error.CommitException;
import com.squadron.core.error.GitException;
import com.squadron.core.error.NotInitializedException;
import com.squadron.core.error.PullRequestException;
import com.squadron.core.error.RollbackException;
import com.squadron.core.error.WorktreeDirtyException;
import com.squadron.core.events.EventBus;
import com.squadron.core.events.SquadronEvent;
import com.squadron.core.events.SquadronEventType;
import com.squadron.core.logging.MdcContext;
import com.squadron.core.metrics.SquadronMetrics;
import com.squadron.workspace.PoolStats;
import com.squadron.workspace.WorktreeAllocation;
import com.squadron.workspace.WorktreePool;
import com.squadron.workspace.WorktreePoolFactory;
import com.squadron.workspace.git.GitService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one feature branch allocated across a primary repository and its dependencies.
 *
 * <p>{@link #createMultiRepoWorktree} is all-or-nothing: each successful allocation pushes a
 * release onto an undo stack, and any failure unwinds the stack before the error surfaces.
 * Unwinding also deletes branches the failed call created.
 * Commit and pull-request operations isolate failures per repository.
 *
 * <p>Every mutating operation, and {@link #getMultiRepoStatus}, requires a successful
 * {@link #initializeWorkspace}; the remaining queries return empty results before that.
 */
@Service
public class MultiRepoCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MultiRepoCoordinator.class);

    private final WorktreePoolFactory poolFactory;
    private final GitService git;
    private final PullRequestClient pullRequestClient;
    private final EventBus eventBus;
    private final SquadronMetrics metrics;
    private final Clock clock;

    /** insertion order: primary first */
    private volatile Map<String, WorktreePool> pools = Map.of();
    private volatile Map<String, RepoConfig> repoConfigs = Map.of();
    private volatile boolean initialized;

    private final ConcurrentHashMap<String, MultiRepoWorktree> worktrees = new ConcurrentHashMap<>();

    public MultiRepoCoordinator(WorktreePoolFactory poolFactory, GitService git, PullRequestClient pullRequestClient,
                                EventBus eventBus, SquadronMetrics metrics, Clock clock) {
        this.poolFactory = poolFactory;
        this.git = git;
        this.pullRequestClient = pullRequestClient;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Validates every repository before touching any of them, then initializes one pool per
     * repository.
     *
     * @throws AllocationException naming the first invalid or duplicate repository
     */
    public synchronized void initializeWorkspace(MultiRepoConfig config) {
        if (!worktrees.isEmpty()) {
            throw new AllocationException(null,
                    "Cannot reinitialize while %d feature worktree sets are live".formatted(worktrees.size()));
        }

        var newPools = new LinkedHashMap<String, WorktreePool>();
        var newConfigs = new LinkedHashMap<String, RepoConfig>();
        for (RepoConfig repo : config.all()) {
            if (newConfigs.putIfAbsent(repo.name(), repo) != null) {
                throw new AllocationException(repo.name(), "Duplicate repository name: " + repo.name());
            }
            newPools.put(repo.name(), poolFactory.create(repo.name(), repo.path(), repo.defaultBranch()));
        }

        for (WorktreePool pool : newPools.values()) {
            pool.validate();
        }
        for (WorktreePool pool : newPools.values()) {
            pool.initialize();
        }

        this.pools = Collections.unmodifiableMap(newPools);
        this.repoConfigs = Collections.unmodifiableMap(newConfigs);
        this.initialized = true;
        log.info("Multi-repo workspace initialized: primary '{}', {} dependencies",
                config.primary().name(), config.dependencies().size());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Allocates {@code featureBranch} in every configured repository.
     *
     * @throws AllocationException if any allocation fails; every allocation made by this call has
     *                             then been released, and release failures are attached as
     *                             suppressed {@link RollbackException}s
     */
    public MultiRepoWorktree createMultiRepoWorktree(String featureBranch) {
        ensureInitialized();
        MdcContext.setFeature(featureBranch);
        try {
            if (worktrees.containsKey(featureBranch)) {
                throw new AllocationException(null,
                        "Feature branch '%s' already has a multi-repo worktree".formatted(featureBranch));
            }

            String featureId = featureIdFor(featureBranch);
            var allocations = new LinkedHashMap<String, WorktreeAllocation>();
            Deque<Runnable> undo = new ArrayDeque<>();
            var rolledBack = new ArrayList<String>();

            for (var entry : pools.entrySet()) {
                String repoName = entry.getKey();
                WorktreePool pool = entry.getValue();
                try {
                    WorktreeAllocation allocation = pool.allocate(featureBranch, featureId, null);
                    allocations.put(repoName, allocation);
                    undo.push(() -> {
                        pool.release(allocation.getId(), true);
                        rolledBack.add(repoName);
                        pool.discardCreatedBranch(allocation);
                    });
                } catch (RuntimeException e) {
                    log.error("Allocation of '{}' failed in '{}', rolling back {} allocations",
                            featureBranch, repoName, undo.size());
                    AllocationException failure = e instanceof AllocationException ae ? ae
                            : new AllocationException(repoName, "Failed to allocate worktree in '%s': %s"
                                    .formatted(repoName, e.getMessage()), e);
                    rollback(featureBranch, undo, failure);
                    metrics.recordRollback(featureBranch, rolledBack.size());
                    throw failure;
                }
            }

            var ids = new LinkedHashMap<String, String>();
            allocations.forEach((repo, allocation) -> ids.put(repo, allocation.getId()));
            var created = new MultiRepoWorktree(featureBranch, allocations, ids, clock.instant());
            worktrees.put(featureBranch, created);
            log.info("Created multi-repo worktree for '{}' across {} repositories", featureBranch, allocations.size());
            return created;
        } finally {
            MdcContext.clear();
        }
    }

    private void rollback(String featureBranch, Deque<Runnable> undo, AllocationException failure) {
        while (!undo.isEmpty()) {
            try {
                undo.pop().run();
            } catch (AllocationException e) {
                var rollbackError = new RollbackException(e.getRepoName(),
                        "Failed to release '%s' in '%s' during rollback".formatted(featureBranch, e.getRepoName()), e);
                log.error(rollbackError.getMessage(), e);
                failure.addSuppressed(rollbackError);
            } catch (RuntimeException e) {
                var rollbackError = new RollbackException(null,
                        "Failed to release '%s' during rollback".formatted(featureBranch), e);
                log.error(rollbackError.getMessage(), e);
                failure.addSuppressed(rollbackError);
            }
        }
    }

    /**
     * Releases a feature's worktrees in every repository. Without {@code force}, nothing is
     * released if any worktree has uncommitted changes.
     *
     * @return number of worktrees released
     * @throws WorktreeDirtyException naming the first dirty worktree when not forced
     */
    public int cleanupMultiRepoWorktree(String featureBranch, boolean force) {
        ensureInitialized();
        MultiRepoWorktree worktree = worktrees.get(featureBranch);
        if (worktree == null) {
            return 0;
        }
        MdcContext.setFeature(featureBranch);
        try {
            if (!force) {
                for (var entry : worktree.allocationIds().entrySet()) {
                    WorktreePool pool = pools.get(entry.getKey());
                    if (pool.hasUncommittedChanges(entry.getValue())) {
                        WorktreeAllocation allocation = worktree.allocations().get(entry.getKey());
                        throw new WorktreeDirtyException(entry.getKey(), allocation.getWorktreePath());
                    }
                }
            }

            int released = 0;
            var failures = new ArrayList<AllocationException>();
            for (var entry : worktree.allocationIds().entrySet()) {
                WorktreePool pool = pools.get(entry.getKey());
                if (pool.getAllocation(entry.getValue()).isEmpty()) {
                    continue;
                }
                try {
                    pool.release(entry.getValue(), force);
                    released++;
                } catch (AllocationException e) {
                    log.warn("Failed to release '{}' in '{}': {}", featureBranch, entry.getKey(), e.getMessage());
                    failures.add(e);
                }
            }
            worktrees.remove(featureBranch, worktree);

            if (!failures.isEmpty()) {
                var error = new AllocationException(null,
                        "Failed to release %d worktrees of '%s'".formatted(failures.size(), featureBranch));
                failures.forEach(error::addSuppressed);
                throw error;
            }
            log.info("Released multi-repo worktree for '{}' ({} worktrees)", featureBranch, released);
            return released;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Commits all changes on every live feature in every repository.
     *
     * @return one result per repository and feature; never throws for per-repository failures
     */
    public List<RepoCommitResult> commitAll(String message) {
        ensureInitialized();
        var results = new ArrayList<RepoCommitResult>();
        for (String featureBranch : List.copyOf(worktrees.keySet())) {
            results.addAll(commitAll(message, featureBranch));
        }
        return results;
    }

    /**
     * Commits all changes of one feature in every repository.
     */
    public List<RepoCommitResult> commitAll(String message, String featureBranch) {
        ensureInitialized();
        MultiRepoWorktree worktree = worktrees.get(featureBranch);
        if (worktree == null) {
            return List.of();
        }
        var results = new ArrayList<RepoCommitResult>();
        for (String repoName : worktree.allocations().keySet()) {
            try {
                results.add(commitInRepo(repoName, message, featureBranch));
            } catch (CommitException e) {
                log.warn("Commit failed in '{}': {}", repoName, e.getMessage());
                results.add(RepoCommitResult.failed(repoName, featureBranch, e));
            }
        }
        return results;
    }

    /**
     * Stages and commits everything in one repository's worktree for a feature.
     *
     * @throws CommitException if the feature or repository is unknown, there is nothing to commit,
     *                         or git fails
     */
    public RepoCommitResult commitInRepo(String repoName, String message, String featureBranch) {
        ensureInitialized();
        MultiRepoWorktree worktree = worktrees.get(featureBranch);
        if (worktree == null) {
            throw new CommitException(repoName, "No multi-repo worktree for branch '%s'".formatted(featureBranch));
        }
        WorktreeAllocation allocation = worktree.allocations().get(repoName);
        if (allocation == null) {
            throw new CommitException(repoName,
                    "Repository '%s' is not part of the worktree for '%s'".formatted(repoName, featureBranch));
        }

        MdcContext.setRepo(featureBranch, repoName);
        try {
            String hash = git.commitAll(allocation.getWorktreePath(), message)
                    .orElseThrow(() -> new CommitException(repoName,
                            "Nothing to commit in repository '%s'".formatted(repoName)));
            WorktreePool pool = pools.get(repoName);
            pool.markClean(allocation.getId());
            pool.touch(allocation.getId());

            log.info("Committed {} in '{}' on '{}'", shortHash(hash), repoName, featureBranch);
            eventBus.publish(SquadronEvent.of(SquadronEventType.GIT_COMMIT_CREATED, repoName, allocation.getId(),
                    Map.of("branch", featureBranch, "commit", hash, "message", message)));
            return RepoCommitResult.committed(repoName, featureBranch, hash);
        } catch (GitException e) {
            throw new CommitException(repoName,
                    "Commit failed in repository '%s': %s".formatted(repoName, e.getMessage()), e);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Pushes and opens a pull request for every repository whose feature branch has commits
     * ahead of its default branch. Repositories without new commits are skipped.
     *
     * @return one outcome per repository attempted
     */
    public List<PullRequestOutcome> createMultiRepoPRs(FeatureRef feature) {
        ensureInitialized();
        MultiRepoWorktree worktree = worktrees.get(feature.branchName());
        if (worktree == null) {
            log.warn("No multi-repo worktree for '{}', no pull requests created", feature.branchName());
            return List.of();
        }

        String title = feature.pullRequestTitle();
        String body = pullRequestBody(feature, worktree);
        var outcomes = new ArrayList<PullRequestOutcome>();

        for (var entry : worktree.allocations().entrySet()) {
            String repoName = entry.getKey();
            WorktreeAllocation allocation = entry.getValue();
            RepoConfig repo = repoConfigs.get(repoName);
            MdcContext.setRepo(feature.branchName(), repoName);
            try {
                var aheadBehind = git.aheadBehind(allocation.getWorktreePath(), repo.defaultBranch());
                if (aheadBehind.ahead() == 0) {
                    log.info("No commits ahead of '{}' in '{}', skipping pull request", repo.defaultBranch(), repoName);
                    continue;
                }
                git.push(allocation.getWorktreePath(), feature.branchName());
                String remote = repo.url() != null ? repo.url()
                        : git.remoteUrl(repo.path()).orElseThrow(() ->
                                new PullRequestException("Repository '%s' has no origin remote".formatted(repoName)));

                PullRequest pr = pullRequestClient.createPullRequest(repoName, remote, title, body,
                        feature.branchName(), repo.defaultBranch());
                outcomes.add(new PullRequestOutcome(repoName, pr, null));
                eventBus.publish(SquadronEvent.of(SquadronEventType.GIT_PR_CREATED, repoName, allocation.getId(),
                        Map.of("number", pr.number(), "url", pr.url(), "head", pr.head(), "base", pr.base())));
            } catch (GitException | PullRequestException e) {
                log.warn("Pull request for '{}' failed: {}", repoName, e.getMessage());
                outcomes.add(new PullRequestOutcome(repoName, null, e.getMessage()));
            } finally {
                MdcContext.clear();
            }
        }
        return outcomes;
    }

    private static String pullRequestBody(FeatureRef feature, MultiRepoWorktree worktree) {
        var sb = new StringBuilder();
        if (feature.description() != null && !feature.description().isBlank()) {
            sb.append(feature.description()).append("\n\n");
        }
        sb.append("Branch `").append(feature.branchName()).append("` spans ")
                .append(worktree.allocations().size()).append(" repositories: ")
                .append(String.join(", ", worktree.allocations().keySet())).append('.');
        return sb.toString();
    }

    /**
     * Working-copy state of every repository for a feature; empty for unknown features.
     */
    public Map<String, RepoStatusSummary> getMultiRepoStatus(String featureBranch) {
        ensureInitialized();
        MultiRepoWorktree worktree = worktrees.get(featureBranch);
        if (worktree == null) {
            return Map.of();
        }
        var status = new LinkedHashMap<String, RepoStatusSummary>();
        for (var entry : worktree.allocations().entrySet()) {
            String repoName = entry.getKey();
            Path path = entry.getValue().getWorktreePath();
            try {
                List<String> changed = git.changedFiles(path);
                var aheadBehind = git.aheadBehind(path, repoConfigs.get(repoName).defaultBranch());
                status.put(repoName, new RepoStatusSummary(repoName, featureBranch, changed.isEmpty(),
                        aheadBehind.ahead(), aheadBehind.behind(), changed, null));
            } catch (GitException e) {
                status.put(repoName, new RepoStatusSummary(repoName, featureBranch, false, 0, 0, List.of(),
                        e.getMessage()));
            }
        }
        return status;
    }

    /** Refreshes last activity of a feature's worktrees in every repository. */
    public void touch(String featureBranch) {
        MultiRepoWorktree worktree = worktrees.get(featureBranch);
        if (worktree == null) {
            return;
        }
        worktree.allocationIds().forEach((repoName, id) -> pools.get(repoName).touch(id));
    }

    /**
     * Force-releases every allocation in every pool.
     *
     * @return total released
     */
    public int cleanupAll() {
        ensureInitialized();
        int released = 0;
        for (WorktreePool pool : pools.values()) {
            released += pool.cleanupAll();
        }
        worktrees.clear();
        log.info("Released all {} worktrees", released);
        return released;
    }

    /**
     * Runs stale cleanup in every pool. A feature that lost any allocation this way has its
     * remaining allocations released too, keeping feature sets whole.
     *
     * @return total released
     */
    public int cleanupStale(long maxIdleHours) {
        ensureInitialized();
        int released = 0;
        for (WorktreePool pool : pools.values()) {
            released += pool.cleanupStale(maxIdleHours);
        }

        for (MultiRepoWorktree worktree : List.copyOf(worktrees.values())) {
            var live = new HashSet<String>();
            worktree.allocationIds().forEach((repoName, id) -> {
                if (pools.get(repoName).getAllocation(id).isPresent()) {
                    live.add(repoName);
                }
            });
            if (live.size() == worktree.allocationIds().size()) {
                continue;
            }
            for (String repoName : live) {
                try {
                    pools.get(repoName).release(worktree.allocationIds().get(repoName), true);
                    released++;
                } catch (AllocationException e) {
                    log.warn("Failed to release remainder of '{}' in '{}': {}",
                            worktree.featureBranch(), repoName, e.getMessage());
                }
            }
            worktrees.remove(worktree.featureBranch(), worktree);
            log.info("Dropped stale multi-repo worktree for '{}'", worktree.featureBranch());
        }
        return released;
    }

    public CoordinatorStats getStats() {
        Map<String, WorktreePool> current = pools;
        var byRepo = new LinkedHashMap<String, Integer>();
        int active = 0;
        for (var entry : current.entrySet()) {
            PoolStats stats = entry.getValue().getStats();
            byRepo.put(entry.getKey(), stats.active());
            active += stats.active();
        }
        return new CoordinatorStats(current.size(), active, worktrees.size(), byRepo);
    }

    public Optional<MultiRepoWorktree> getMultiRepoWorktree(String featureBranch) {
        return Optional.ofNullable(featureBranch).map(worktrees::get);
    }

    public List<MultiRepoWorktree> listMultiRepoWorktrees() {
        return List.copyOf(worktrees.values());
    }

    /** Primary first, then dependencies. */
    public List<RepoConfig> getConfiguredRepos() {
        return List.copyOf(repoConfigs.values());
    }

    /** Worktree directory of {@code branch} in a repository, if allocated. */
    public Optional<Path> getWorktreePath(String repoName, String branch) {
        WorktreePool pool = pools.get(repoName);
        if (pool == null) {
            return Optional.empty();
        }
        return pool.findByBranch(branch).map(WorktreeAllocation::getWorktreePath);
    }

    static String featureIdFor(String featureBranch) {
        return featureBranch.replace('/', '-');
    }

    private static String shortHash(String hash) {
        return hash.length() > 8 ? hash.substring(0, 8) : hash;
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new NotInitializedException(
                    "Multi-repo workspace is not initialized; call initializeWorkspace first");
        }
    }
}
