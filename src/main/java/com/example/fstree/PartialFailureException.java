package com.example.fstree;

import java.nio.file.Path;

/**
 * Raised when a bulk removal stops at its first failing node. Nodes processed before the failure
 * stay removed; nothing is rolled back, so callers should inspect the tree and retry.
 */
public class PartialFailureException extends FileTreeException {
    private final int completed;
    private final int remaining;

    public PartialFailureException(Path failedPath, int completed, int remaining, FileTreeException cause) {
        super(ErrorKind.PARTIAL_FAILURE,
                failedPath,
                String.format("Removal stopped at %s after %d of %d nodes: %s",
                        failedPath, completed, completed + remaining, cause.getMessage()),
                cause);
        this.completed = completed;
        this.remaining = remaining;
    }

    /**
     * Number of nodes removed before the failure.
     */
    public int completed() {
        return completed;
    }

    /**
     * Number of nodes left untouched, including the one that failed.
     */
    public int remaining() {
        return remaining;
    }

    /**
     * The typed failure of the node that stopped the sequence.
     */
    public FileTreeException failure() {
        return (FileTreeException) getCause();
    }
}
