package com.taskforest.core.engine;

import java.util.List;

/**
 * Thrown when finalization finds a parent-pointer cycle in the forest.
 * <p>
 * Every committed edge passed the cycle check, so this signals a defect in
 * the validation logic itself. The run is aborted; its forest must not be used.
 */
public class CycleDetectedException extends RuntimeException {

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super("Parent-pointer cycle detected at finalize: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Task ids along the cycle, starting and ending with the same id. */
    public List<String> getCycle() {
        return cycle;
    }
}
