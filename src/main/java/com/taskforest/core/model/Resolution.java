package com.taskforest.core.model;

/**
 * How a skeleton's parent pointer was settled by a reconstruction run.
 */
public enum Resolution {
    /** Not yet processed. */
    PENDING,
    /** Declared parent re-validated and kept. */
    DECLARED,
    /** Parent inferred from the prefix index. */
    RECONSTRUCTED,
    /** Declared parent failed validation and was cleared; no replacement found. */
    INVALIDATED,
    /** Several index owners matched and the tie-break picked none. */
    AMBIGUOUS,
    /** No admissible parent found. */
    UNRESOLVED,
    /** No parent and nothing to look for. */
    ROOT
}
