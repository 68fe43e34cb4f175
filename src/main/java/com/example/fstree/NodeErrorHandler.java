package com.example.fstree;

import com.example.fstree.metadata.NodeRecord;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Decides what a walk does when a node cannot be probed or a directory cannot be enumerated.
 * Returning any value (including an empty one) lets the walk continue; throwing ends it.
 */
@FunctionalInterface
public interface NodeErrorHandler {
    Optional<NodeRecord> handle(Path path, FileTreeException failure) throws FileTreeException;

    /**
     * Aborts the walk with the failure.
     */
    static NodeErrorHandler propagate() {
        return (path, failure) -> {
            throw failure;
        };
    }

    /**
     * Continues without a record for the failed node.
     */
    static NodeErrorHandler skip() {
        return (path, failure) -> Optional.empty();
    }

    static NodeErrorHandler substituteMissing() {
        return (path, failure) -> Optional.of(NodeRecord.missing(path));
    }
}
