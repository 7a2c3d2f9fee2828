package com.squadron.workspace;

import com.squadron.core.config.SquadronProperties;
import com.squadron.core.events.EventBus;
import com.squadron.core.metrics.SquadronMetrics;
import com.squadron.workspace.git.GitService;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Creates {@link WorktreePool}s sharing the application's git adapter, configuration and
 * cross-cutting services.
 */
@Component
public class WorktreePoolFactory {

    private final GitService git;
    private final SquadronProperties properties;
    private final EventBus eventBus;
    private final SquadronMetrics metrics;
    private final Clock clock;

    public WorktreePoolFactory(GitService git, SquadronProperties properties, EventBus eventBus,
                               SquadronMetrics metrics, Clock clock) {
        this.git = git;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public WorktreePool create(String repoName, Path repoPath, String baseBranch) {
        return new WorktreePool(repoName, repoPath, baseBranch, git, properties.getWorktree(),
                eventBus, metrics, clock);
    }
}
