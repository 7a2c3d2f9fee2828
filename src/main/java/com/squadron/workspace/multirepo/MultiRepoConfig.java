package com.squadron.workspace.multirepo;

import java.util.ArrayList;
import java.util.List;

/**
 * The primary repository and its dependencies.
 */
public record MultiRepoConfig(RepoConfig primary, List<RepoConfig> dependencies) {

    public MultiRepoConfig {
        if (primary == null) {
            throw new IllegalArgumentException("A primary repository is required");
        }
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    /** Primary first, then dependencies in declaration order. */
    public List<RepoConfig> all() {
        var all = new ArrayList<RepoConfig>(dependencies.size() + 1);
        all.add(primary);
        all.addAll(dependencies);
        return all;
    }
}
