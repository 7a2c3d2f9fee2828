package com.squadron.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent processes and worktree allocation.
 */
@Service
public class SquadronMetrics {

    private final MeterRegistry registry;

    public SquadronMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAgentSpawned() {
        Counter.builder("squadron.agents.spawned")
                .register(registry)
                .increment();
    }

    public void recordAgentFinished(String state, long runtimeMs) {
        Counter.builder("squadron.agents.finished")
                .tag("state", state)
                .register(registry)
                .increment();
        Timer.builder("squadron.agents.runtime")
                .tag("state", state)
                .register(registry)
                .record(Duration.ofMillis(runtimeMs));
    }

    public void recordAgentCost(double costUsd) {
        DistributionSummary.builder("squadron.agents.cost")
                .baseUnit("usd")
                .register(registry)
                .record(costUsd);
    }

    public void recordWorktreeAllocated(String repo) {
        Counter.builder("squadron.worktrees.allocated")
                .tag("repo", repo)
                .register(registry)
                .increment();
    }

    public void recordWorktreeReleased(String repo, boolean forced) {
        Counter.builder("squadron.worktrees.released")
                .tag("repo", repo)
                .tag("forced", String.valueOf(forced))
                .register(registry)
                .increment();
    }

    /**
     * Records an allocate call rejected because the branch is already allocated.
     */
    public void recordAllocationConflict(String repo) {
        Counter.builder("squadron.worktrees.conflicts")
                .description("Allocations rejected because the branch was already allocated")
                .tag("repo", repo)
                .register(registry)
                .increment();
    }

    public void recordRollback(String featureBranch, int releasedCount) {
        Counter.builder("squadron.multirepo.rollbacks")
                .register(registry)
                .increment();
        DistributionSummary.builder("squadron.multirepo.rollback.size")
                .register(registry)
                .record(releasedCount);
    }
}
