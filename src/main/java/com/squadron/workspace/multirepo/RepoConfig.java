package com.squadron.workspace.multirepo;

import java.nio.file.Path;

/**
 * One repository taking part in a multi-repository workspace.
 *
 * @param name          unique repository name
 * @param url           remote URL (nullable: the local {@code origin} remote is used)
 * @param path          local clone
 * @param defaultBranch base branch for new feature branches and pull requests
 * @param role          primary or dependency
 */
public record RepoConfig(String name, String url, Path path, String defaultBranch, RepoRole role) {

    public static final String DEFAULT_BRANCH = "main";

    public RepoConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Repository name is required");
        }
        if (path == null) {
            throw new IllegalArgumentException("Repository path is required for '" + name + "'");
        }
        defaultBranch = defaultBranch == null || defaultBranch.isBlank() ? DEFAULT_BRANCH : defaultBranch;
        role = role == null ? RepoRole.DEPENDENCY : role;
    }

    public static RepoConfig primary(String name, Path path, String defaultBranch) {
        return new RepoConfig(name, null, path, defaultBranch, RepoRole.PRIMARY);
    }

    public static RepoConfig dependency(String name, Path path, String defaultBranch) {
        return new RepoConfig(name, null, path, defaultBranch, RepoRole.DEPENDENCY);
    }
}
