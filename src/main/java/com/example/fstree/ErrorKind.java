package com.example.fstree;

/**
 * Classifies the first unrecoverable cause of a failed tree operation.
 */
public enum ErrorKind {
    NOT_FOUND,
    ACCESS_DENIED,
    IO_ERROR,
    /** An existing ancestor of a requested directory is not a directory. */
    INVALID_PATH,
    /** A bulk operation stopped part way through its sequence. */
    PARTIAL_FAILURE
}
