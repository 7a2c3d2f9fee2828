package com.squadron.workspace.multirepo;

public enum RepoRole {
    PRIMARY,
    DEPENDENCY
}
