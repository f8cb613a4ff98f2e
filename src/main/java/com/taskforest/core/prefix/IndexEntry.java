package com.taskforest.core.prefix;

/**
 * One hit in the {@link PrefixIndex}.
 *
 * @param ownerTaskId    the task whose transcript declared the sub-task instruction
 * @param declaredPrefix the full-length normalized prefix the owner declared; identical
 *                       to the looked-up key except in a shorter fallback layer
 */
public record IndexEntry(String ownerTaskId, String declaredPrefix) {}
