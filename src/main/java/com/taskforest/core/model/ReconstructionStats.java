package com.taskforest.core.model;

import java.util.Map;

/**
 * Counters collected over one reconstruction run.
 * <p>
 * {@code resolvedEdges + unresolved == phase3Candidates}; {@code ambiguous}
 * counts the subset of {@code unresolved} that ended on an ambiguous match.
 */
public record ReconstructionStats(
    int totalRecords,
    int malformedRecords,
    int totalSkeletons,
    int filteredOut,
    int indexedPrefixes,
    int declaredEdges,
    int declaredEdgesRetained,
    int declaredEdgesInvalidated,
    Map<String, Integer> invalidatedByReason,
    int phase3Candidates,
    int resolvedEdges,
    int unresolved,
    int ambiguous,
    Map<Integer, Integer> resolvedByPrefixLength,
    int rootCount,
    int maxDepth,
    long durationMs
) {}
