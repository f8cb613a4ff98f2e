package com.taskforest.core.model;

import java.util.List;

/**
 * Storage-boundary view of one raw task record.
 * <p>
 * Implementations adapt whatever the on-disk format is; the reconstruction
 * core only ever sees this interface. Optional values are returned as
 * {@code null} or blank.
 */
public interface TaskRecord {

    /** Unique, stable task id. Required. */
    String id();

    /** Creation time as ISO-8601 instant or epoch milliseconds. Required. */
    String createdAt();

    default String lastActivity() {
        return null;
    }

    default String workspace() {
        return null;
    }

    /** Raw text of the task's own opening instruction. */
    String ownInstruction();

    /** Raw instruction texts of every sub-task this record declares it spawned. */
    List<String> declaredChildInstructions();

    /** Parent id the record already claims, if any. */
    default String declaredParentId() {
        return null;
    }
}
