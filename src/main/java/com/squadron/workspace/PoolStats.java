package com.squadron.workspace;

import java.util.Map;

/**
 * Snapshot of one pool's allocations.
 *
 * @param repoName  repository the pool serves
 * @param total     registered allocations
 * @param active    allocations with allocated=true
 * @param dirty     allocations flagged dirty
 * @param byFeature allocation count per feature id
 */
public record PoolStats(String repoName, int total, int active, int dirty, Map<String, Integer> byFeature) {
}
