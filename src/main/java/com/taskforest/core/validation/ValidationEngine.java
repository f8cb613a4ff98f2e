package com.taskforest.core.validation;

import com.taskforest.core.engine.ReconstructionProperties;
import com.taskforest.core.model.Resolution;
import com.taskforest.core.model.Skeleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;

/**
 * Decides whether a parent/child edge is admissible in the forest.
 * <p>
 * Checks run in a fixed order and the first failure wins:
 * <ol>
 *   <li>cycle: the child may not be the parent, nor appear in the parent's ancestor chain</li>
 *   <li>temporal: the parent may not be created after the child, beyond the tolerance</li>
 *   <li>workspace: two set workspaces must be equal</li>
 * </ol>
 * Ancestor chains are walked along the current {@code parentTaskId} pointers,
 * so the result depends on every edge committed so far in the run.
 */
public class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    private final long temporalToleranceMs;
    private final Duration tolerance;
    private final boolean strictWorkspaceIsolation;

    public ValidationEngine(ReconstructionProperties properties) {
        this(properties.getTemporalToleranceMs(), properties.isStrictWorkspaceIsolation());
    }

    public ValidationEngine(long temporalToleranceMs, boolean strictWorkspaceIsolation) {
        this.temporalToleranceMs = Math.max(0, temporalToleranceMs);
        this.tolerance = Duration.ofMillis(this.temporalToleranceMs);
        this.strictWorkspaceIsolation = strictWorkspaceIsolation;
    }

    /**
     * Checks a candidate edge without mutating anything.
     *
     * @param candidateParent proposed parent, {@code null} if it is not among the loaded skeletons
     * @param child           the skeleton looking for a parent
     * @param skeletonsById   every skeleton of the run, for the ancestor walk
     */
    public ValidationOutcome validate(Skeleton candidateParent, Skeleton child, Map<String, Skeleton> skeletonsById) {
        ValidationOutcome outcome = check(candidateParent, child, skeletonsById);
        if (!outcome.admissible()) {
            log.debug("Rejected edge {} -> {}: {} ({})",
                    child.getTaskId(), candidateParent != null ? candidateParent.getTaskId() : "?",
                    outcome.reason(), outcome.detail());
        }
        return outcome;
    }

    /**
     * Re-confirms the parent the child's raw record declared. A failing edge
     * is cleared from the child, which becomes parentless; no replacement is
     * attempted here.
     *
     * @return the validation outcome; {@link RejectionReason#NONE} also when there is nothing to check
     */
    public ValidationOutcome revalidateDeclaredEdge(Skeleton child, Map<String, Skeleton> skeletonsById) {
        String parentId = child.getParentTaskId();
        if (parentId == null) {
            return ValidationOutcome.accepted();
        }
        Skeleton parent = skeletonsById.get(parentId);
        ValidationOutcome outcome = parent == null
                ? ValidationOutcome.rejected(RejectionReason.MISSING_PARENT,
                        "declared parent " + parentId + " is not in the corpus")
                : validate(parent, child, skeletonsById);

        if (outcome.admissible()) {
            child.setResolution(Resolution.DECLARED);
        } else {
            log.debug("Invalidating declared edge {} -> {}: {}", child.getTaskId(), parentId, outcome.detail());
            child.setParentTaskId(null);
            child.setResolution(Resolution.INVALIDATED);
        }
        return outcome;
    }

    /**
     * Parent time may exceed child time by at most the tolerance. Compared as
     * a {@link Duration} so that instants near the ends of the range cannot overflow.
     */
    public boolean isTemporallyOrdered(Skeleton parent, Skeleton child) {
        Duration lead = Duration.between(child.getCreatedAt(), parent.getCreatedAt());
        return lead.compareTo(tolerance) <= 0;
    }

    public boolean wouldCreateCycle(Skeleton candidateParent, Skeleton child, Map<String, Skeleton> skeletonsById) {
        var visited = new HashSet<String>();
        String current = candidateParent.getTaskId();
        while (current != null) {
            if (current.equals(child.getTaskId()) || !visited.add(current)) {
                return true;
            }
            Skeleton node = skeletonsById.get(current);
            current = node != null ? node.getParentTaskId() : null;
        }
        return false;
    }

    public long getTemporalToleranceMs() {
        return temporalToleranceMs;
    }

    public boolean isStrictWorkspaceIsolation() {
        return strictWorkspaceIsolation;
    }

    private ValidationOutcome check(Skeleton parent, Skeleton child, Map<String, Skeleton> skeletonsById) {
        if (parent == null) {
            return ValidationOutcome.rejected(RejectionReason.MISSING_PARENT, "parent not found");
        }
        if (parent.getTaskId().equals(child.getTaskId())) {
            return ValidationOutcome.rejected(RejectionReason.SELF_REFERENCE, "task cannot be its own parent");
        }
        if (wouldCreateCycle(parent, child, skeletonsById)) {
            return ValidationOutcome.rejected(RejectionReason.CYCLE,
                    child.getTaskId() + " already appears in the ancestry of " + parent.getTaskId());
        }
        if (!isTemporallyOrdered(parent, child)) {
            return ValidationOutcome.rejected(RejectionReason.TEMPORAL,
                    "parent created at " + parent.getCreatedAt() + " after child created at "
                            + child.getCreatedAt() + " (tolerance " + temporalToleranceMs + "ms)");
        }
        if (parent.hasWorkspace() && child.hasWorkspace()
                && !parent.getWorkspace().equals(child.getWorkspace())) {
            if (strictWorkspaceIsolation) {
                return ValidationOutcome.rejected(RejectionReason.WORKSPACE,
                        "workspace " + parent.getWorkspace() + " differs from " + child.getWorkspace());
            }
            log.warn("Admitting cross-workspace edge {} -> {} ({} vs {}): strict isolation is off",
                    child.getTaskId(), parent.getTaskId(), child.getWorkspace(), parent.getWorkspace());
        }
        return ValidationOutcome.accepted();
    }
}
