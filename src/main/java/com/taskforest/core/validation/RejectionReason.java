package com.taskforest.core.validation;

import java.util.Locale;

/**
 * Reason code attached to every validation decision.
 */
public enum RejectionReason {
    NONE,
    MISSING_PARENT,
    SELF_REFERENCE,
    CYCLE,
    TEMPORAL,
    WORKSPACE;

    /** Lowercase tag used in events and metrics. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
