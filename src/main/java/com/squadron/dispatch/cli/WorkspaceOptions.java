package com.squadron.dispatch.cli;

import com.squadron.workspace.multirepo.MultiRepoConfig;
import com.squadron.workspace.multirepo.RepoConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Repository options shared by commands that initialize a workspace.
 */
public class WorkspaceOptions {

    @Option(names = "--primary", required = true, description = "Path to the primary repository")
    Path primary;

    @Option(names = "--primary-name", description = "Name of the primary repository (default: directory name)")
    String primaryName;

    @Option(names = "--primary-branch", defaultValue = RepoConfig.DEFAULT_BRANCH,
            description = "Default branch of the primary repository (default: ${DEFAULT-VALUE})")
    String primaryBranch;

    @Option(names = {"--dependency", "-d"}, paramLabel = "NAME=PATH[@BRANCH]",
            description = "Dependency repository, repeatable")
    List<String> dependencies = new ArrayList<>();

    public MultiRepoConfig toConfig() {
        Path primaryPath = primary.toAbsolutePath().normalize();
        String name = primaryName != null && !primaryName.isBlank()
                ? primaryName : String.valueOf(primaryPath.getFileName());
        var deps = new ArrayList<RepoConfig>();
        for (String value : dependencies) {
            deps.add(parseDependency(value));
        }
        return new MultiRepoConfig(RepoConfig.primary(name, primaryPath, primaryBranch), deps);
    }

    /**
     * Parses {@code name=path[@branch]}.
     *
     * @throws IllegalArgumentException for a malformed value
     */
    static RepoConfig parseDependency(String value) {
        int eq = value.indexOf('=');
        if (eq <= 0 || eq == value.length() - 1) {
            throw new IllegalArgumentException("Invalid dependency '%s', expected NAME=PATH[@BRANCH]".formatted(value));
        }
        String name = value.substring(0, eq).trim();
        String location = value.substring(eq + 1).trim();
        String branch = null;
        int at = location.lastIndexOf('@');
        if (at > 0) {
            branch = location.substring(at + 1).trim();
            location = location.substring(0, at).trim();
        }
        return RepoConfig.dependency(name, Path.of(location).toAbsolutePath().normalize(), branch);
    }
}
