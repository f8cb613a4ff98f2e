package com.taskforest.core.engine;

import com.taskforest.core.model.Resolution;
import com.taskforest.core.model.Skeleton;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ForestFinalizerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private final ForestFinalizer finalizer = new ForestFinalizer();

    private static Skeleton node(String id, String parent) {
        return new Skeleton(id, T0, null, null, id, List.of(), parent);
    }

    private static Map<String, Skeleton> index(List<Skeleton> skeletons) {
        var map = new LinkedHashMap<String, Skeleton>();
        skeletons.forEach(s -> map.put(s.getTaskId(), s));
        return map;
    }

    @Test
    @DisplayName("computes depths and roots regardless of input order")
    void depths() {
        var skeletons = List.of(node("GRANDCHILD", "CHILD"), node("CHILD", "ROOT"), node("ROOT", null), node("LONE", null));

        var summary = finalizer.finalizeForest(skeletons, index(skeletons));

        assertEquals(2, summary.rootCount());
        assertEquals(2, summary.maxDepth());
        assertEquals(2, skeletons.get(0).getDepth());
        assertEquals(1, skeletons.get(1).getDepth());
        assertEquals(0, skeletons.get(2).getDepth());
        assertTrue(skeletons.get(2).isRootTask());
        assertFalse(skeletons.get(1).isRootTask());
        assertEquals(Resolution.ROOT, skeletons.get(3).getResolution());
    }

    @Test
    @DisplayName("a root that lost its declared edge keeps the INVALIDATED tag")
    void keepsInvalidated() {
        var s = node("A", null);
        s.setResolution(Resolution.INVALIDATED);
        finalizer.finalizeForest(List.of(s), index(List.of(s)));
        assertTrue(s.isRootTask());
        assertEquals(Resolution.INVALIDATED, s.getResolution());
    }

    @Test
    @DisplayName("a cycle aborts with the ids along the loop")
    void cycle() {
        var skeletons = List.of(node("X", null), node("A", "C"), node("B", "A"), node("C", "B"));
        var e = assertThrows(CycleDetectedException.class,
                () -> finalizer.finalizeForest(skeletons, index(skeletons)));
        assertEquals(List.of("A", "C", "B", "A"), e.getCycle());
        assertTrue(e.getMessage().contains("A -> C -> B -> A"));
    }

    @Test
    @DisplayName("a dangling parent pointer is a defect")
    void dangling() {
        var skeletons = List.of(node("A", "NOWHERE"));
        assertThrows(IllegalStateException.class, () -> finalizer.finalizeForest(skeletons, index(skeletons)));
    }

    @Test
    @DisplayName("a very deep chain does not overflow the stack")
    void deepChain() {
        var skeletons = new ArrayList<Skeleton>();
        skeletons.add(node("N0", null));
        for (int i = 1; i < 50_000; i++) {
            skeletons.add(node("N" + i, "N" + (i - 1)));
        }
        var summary = finalizer.finalizeForest(skeletons, index(skeletons));
        assertEquals(49_999, summary.maxDepth());
        assertEquals(1, summary.rootCount());
    }
}
