package com.taskforest.core.extract;

/**
 * Thrown when a raw record cannot produce a minimally valid skeleton.
 */
public class MalformedRecordException extends RuntimeException {

    private final String recordId;

    public MalformedRecordException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public MalformedRecordException(String recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }

    /** Id of the offending record, or {@code null} when it had none. */
    public String getRecordId() {
        return recordId;
    }
}
