package com.taskforest.core.engine;

import com.taskforest.core.model.Resolution;
import com.taskforest.core.model.Skeleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Computes depth and root status once every edge of a run is settled.
 * <p>
 * Walks are iterative and memoized, so deep chains cannot overflow the stack
 * and each skeleton is visited a bounded number of times.
 */
public class ForestFinalizer {

    private static final Logger log = LoggerFactory.getLogger(ForestFinalizer.class);

    /**
     * @param rootCount skeletons without a parent
     * @param maxDepth  deepest level in the forest (0 when every skeleton is a root)
     */
    public record Summary(int rootCount, int maxDepth) {}

    /**
     * @throws CycleDetectedException if following parent pointers ever revisits a skeleton
     * @throws IllegalStateException  if a parent pointer names a skeleton that is not loaded
     */
    public Summary finalizeForest(List<Skeleton> skeletons, Map<String, Skeleton> skeletonsById) {
        var depths = new HashMap<String, Integer>();
        int roots = 0;
        int maxDepth = 0;

        for (Skeleton skeleton : skeletons) {
            int depth = resolveDepth(skeleton, skeletonsById, depths);
            maxDepth = Math.max(maxDepth, depth);
        }

        for (Skeleton skeleton : skeletons) {
            int depth = depths.get(skeleton.getTaskId());
            boolean root = !skeleton.hasParent();
            skeleton.setDepth(depth);
            skeleton.setRootTask(root);
            if (root) {
                roots++;
                if (skeleton.getResolution() == Resolution.PENDING) {
                    skeleton.setResolution(Resolution.ROOT);
                }
            }
        }

        log.debug("Finalized forest: {} skeletons, {} roots, max depth {}", skeletons.size(), roots, maxDepth);
        return new Summary(roots, maxDepth);
    }

    private int resolveDepth(Skeleton start, Map<String, Skeleton> skeletonsById, Map<String, Integer> depths) {
        Integer known = depths.get(start.getTaskId());
        if (known != null) {
            return known;
        }

        var path = new ArrayList<Skeleton>();
        var onPath = new HashSet<String>();
        Skeleton current = start;
        int base = -1;

        while (current != null) {
            Integer memo = depths.get(current.getTaskId());
            if (memo != null) {
                base = memo;
                break;
            }
            if (!onPath.add(current.getTaskId())) {
                throw new CycleDetectedException(cycleFrom(path, current.getTaskId()));
            }
            path.add(current);
            String parentId = current.getParentTaskId();
            if (parentId == null) {
                break;
            }
            Skeleton parent = skeletonsById.get(parentId);
            if (parent == null) {
                throw new IllegalStateException("Skeleton " + current.getTaskId()
                        + " points at unknown parent " + parentId + " after reconstruction");
            }
            current = parent;
        }

        // path runs child -> ancestor; assign from the top down
        int depth = base;
        for (int i = path.size() - 1; i >= 0; i--) {
            depth++;
            depths.put(path.get(i).getTaskId(), depth);
        }
        return depths.get(start.getTaskId());
    }

    private static List<String> cycleFrom(List<Skeleton> path, String repeatedId) {
        var cycle = new ArrayList<String>();
        boolean inCycle = false;
        for (Skeleton s : path) {
            if (s.getTaskId().equals(repeatedId)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(s.getTaskId());
            }
        }
        cycle.add(repeatedId);
        return cycle;
    }
}
