package com.squadron.dispatch.cli;

import com.squadron.core.error.AllocationException;
import com.squadron.workspace.multirepo.MultiRepoCoordinator;
import com.squadron.workspace.multirepo.RepoConfig;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: squadron validate --primary PATH [--dependency NAME=PATH[@BRANCH]]...
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Check that every repository exists and is a git repository")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Mixin
    WorkspaceOptions workspace = new WorkspaceOptions();

    private final MultiRepoCoordinator coordinator;

    public ValidateCommand(MultiRepoCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            coordinator.initializeWorkspace(workspace.toConfig());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (AllocationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        for (RepoConfig repo : coordinator.getConfiguredRepos()) {
            ConsoleOutput.repo(repo.name(), "%s (%s, base %s)".formatted(
                    repo.path(), repo.role().name().toLowerCase(), repo.defaultBranch()));
        }
        ConsoleOutput.success("Workspace is valid.");
        return 0;
    }
}
