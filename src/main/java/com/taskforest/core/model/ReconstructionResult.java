package com.taskforest.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Output of one reconstruction run: the finalized forest in input order.
 *
 * @param runId            identifier used in logs and events for this run
 * @param skeletons        every skeleton that survived extraction, in input order
 * @param stats            run counters
 * @param malformedRecords records skipped during extraction
 */
public record ReconstructionResult(
    String runId,
    List<Skeleton> skeletons,
    ReconstructionStats stats,
    List<MalformedRecord> malformedRecords
) {

    public Optional<Skeleton> find(String taskId) {
        return skeletons.stream().filter(s -> s.getTaskId().equals(taskId)).findFirst();
    }

    public List<Skeleton> roots() {
        return skeletons.stream().filter(Skeleton::isRootTask).toList();
    }

    public List<Skeleton> childrenOf(String taskId) {
        return skeletons.stream().filter(s -> taskId.equals(s.getParentTaskId())).toList();
    }
}
