package com.taskforest.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * In-memory representation of one task record during reconstruction.
 * <p>
 * Identity, timing, workspace and instruction prefixes are fixed at
 * extraction. The parent pointers, depth, root flag and resolution outcome
 * are the only mutable state, and are written only by the validation engine
 * and the reconstruction orchestrator.
 */
public class Skeleton {

    private final String taskId;
    private final Instant createdAt;
    private final Instant lastActivity;
    private final String workspace;
    private final String truncatedInstruction;
    private final List<String> childInstructionPrefixes;
    private final String declaredParentId;

    private String parentTaskId;
    private String reconstructedParentId;
    private int depth;
    private boolean rootTask;
    private Resolution resolution = Resolution.PENDING;
    private int resolvedPrefixLength;

    public Skeleton(String taskId, Instant createdAt, Instant lastActivity, String workspace,
                    String truncatedInstruction, List<String> childInstructionPrefixes,
                    String declaredParentId) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActivity = lastActivity != null ? lastActivity : createdAt;
        this.workspace = blankToNull(workspace);
        this.truncatedInstruction = truncatedInstruction != null ? truncatedInstruction : "";
        var prefixes = new LinkedHashSet<String>();
        if (childInstructionPrefixes != null) {
            for (String prefix : childInstructionPrefixes) {
                if (prefix != null && !prefix.isEmpty()) {
                    prefixes.add(prefix);
                }
            }
        }
        this.childInstructionPrefixes = List.copyOf(new ArrayList<>(prefixes));
        this.declaredParentId = blankToNull(declaredParentId);
        this.parentTaskId = this.declaredParentId;
    }

    public String getTaskId() {
        return taskId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    /** Isolation label, or {@code null} when unset. */
    public String getWorkspace() {
        return workspace;
    }

    public boolean hasWorkspace() {
        return workspace != null;
    }

    public String getTruncatedInstruction() {
        return truncatedInstruction;
    }

    public List<String> getChildInstructionPrefixes() {
        return childInstructionPrefixes;
    }

    public String getDeclaredParentId() {
        return declaredParentId;
    }

    public String getParentTaskId() {
        return parentTaskId;
    }

    public boolean hasParent() {
        return parentTaskId != null;
    }

    public void setParentTaskId(String parentTaskId) {
        this.parentTaskId = blankToNull(parentTaskId);
    }

    public String getReconstructedParentId() {
        return reconstructedParentId;
    }

    public void setReconstructedParentId(String reconstructedParentId) {
        this.reconstructedParentId = blankToNull(reconstructedParentId);
    }

    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public boolean isRootTask() {
        return rootTask;
    }

    public void setRootTask(boolean rootTask) {
        this.rootTask = rootTask;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public void setResolution(Resolution resolution) {
        this.resolution = resolution;
    }

    public int getResolvedPrefixLength() {
        return resolvedPrefixLength;
    }

    public void setResolvedPrefixLength(int resolvedPrefixLength) {
        this.resolvedPrefixLength = resolvedPrefixLength;
    }

    @Override
    public String toString() {
        return "Skeleton[" + taskId + " parent=" + parentTaskId + " depth=" + depth
                + " resolution=" + resolution + "]";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
