package com.taskforest.core.validation;

/**
 * Result of checking one candidate parent/child pair.
 *
 * @param admissible whether the edge may exist in the forest
 * @param reason     {@link RejectionReason#NONE} when admissible, otherwise the first failed check
 * @param detail     human-readable explanation for logs and events
 */
public record ValidationOutcome(boolean admissible, RejectionReason reason, String detail) {

    private static final ValidationOutcome ADMISSIBLE = new ValidationOutcome(true, RejectionReason.NONE, "ok");

    public static ValidationOutcome accepted() {
        return ADMISSIBLE;
    }

    public static ValidationOutcome rejected(RejectionReason reason, String detail) {
        return new ValidationOutcome(false, reason, detail);
    }
}
