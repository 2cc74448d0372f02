package com.pm.logorganizer.batch;

/**
 * Pipeline stage at which a record was dropped from further processing.
 */
public enum FailureReason {

    /**
     * Message body is not valid JSON, or its queue identifier cannot be resolved.
     */
    DECODE_ERROR,

    /**
     * Decoded record lacks one or more mandatory fields.
     */
    VALIDATION_ERROR,

    /**
     * The record's partition group could not be written to storage.
     */
    WRITE_ERROR,

    /**
     * The group was written but this record's queue message could not be deleted.
     */
    ACKNOWLEDGE_ERROR
}
