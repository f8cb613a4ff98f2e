package com.taskforest.core.engine;

import com.taskforest.core.model.Skeleton;
import com.taskforest.core.validation.ValidationEngine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic tie-break between several index owners that declared the same prefix.
 * <ol>
 *   <li>candidates sharing the child's workspace win over those that don't. Under
 *       strict isolation a candidate with no workspace still beats one from a
 *       different workspace, since only the latter would fail validation;</li>
 *   <li>candidates failing the temporal check are dropped;</li>
 *   <li>candidates created no later than the child win over those that are
 *       only admitted by the tolerance;</li>
 *   <li>the candidate created closest to the child wins.</li>
 * </ol>
 * Two candidates at exactly the same distance leave the match ambiguous.
 */
public class ParentCandidateSelector {

    /**
     * @param winner    the single chosen candidate, or {@code null}
     * @param ambiguous true when more than one candidate competed and none could be chosen
     */
    public record Selection(Skeleton winner, boolean ambiguous) {

        static Selection none(boolean ambiguous) {
            return new Selection(null, ambiguous);
        }
    }

    private final ValidationEngine validationEngine;

    public ParentCandidateSelector(ValidationEngine validationEngine) {
        this.validationEngine = validationEngine;
    }

    public Selection select(Skeleton child, List<Skeleton> candidates) {
        if (candidates.isEmpty()) {
            return Selection.none(false);
        }
        if (candidates.size() == 1) {
            return new Selection(candidates.get(0), false);
        }

        List<Skeleton> pool = workspacePool(child, candidates);

        var ordered = pool.stream()
                .filter(c -> validationEngine.isTemporallyOrdered(c, child))
                .toList();
        if (ordered.isEmpty()) {
            return Selection.none(true);
        }
        var notLater = ordered.stream()
                .filter(c -> !c.getCreatedAt().isAfter(child.getCreatedAt()))
                .toList();

        var closest = new ArrayList<Skeleton>();
        Duration best = null;
        for (Skeleton candidate : notLater.isEmpty() ? ordered : notLater) {
            Duration gap = Duration.between(candidate.getCreatedAt(), child.getCreatedAt()).abs();
            int cmp = best == null ? -1 : gap.compareTo(best);
            if (cmp < 0) {
                best = gap;
                closest.clear();
                closest.add(candidate);
            } else if (cmp == 0) {
                closest.add(candidate);
            }
        }
        return closest.size() == 1 ? new Selection(closest.get(0), false) : Selection.none(true);
    }

    private List<Skeleton> workspacePool(Skeleton child, List<Skeleton> candidates) {
        var sameWorkspace = candidates.stream()
                .filter(c -> Objects.equals(c.getWorkspace(), child.getWorkspace()))
                .toList();
        if (!sameWorkspace.isEmpty()) {
            return sameWorkspace;
        }
        if (validationEngine.isStrictWorkspaceIsolation() && child.hasWorkspace()) {
            var compatible = candidates.stream().filter(c -> !c.hasWorkspace()).toList();
            if (!compatible.isEmpty()) {
                return compatible;
            }
        }
        return candidates;
    }
}
