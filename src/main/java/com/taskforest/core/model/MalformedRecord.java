package com.taskforest.core.model;

/**
 * A raw record that could not produce a skeleton.
 *
 * @param recordId the record's id when one was readable, otherwise {@code null}
 * @param reason   why the record was rejected
 */
public record MalformedRecord(String recordId, String reason) {}
