package com.example.fstree;

import com.example.fstree.metadata.NodeRecord;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface NodeVisitor {
    /**
     * Called once per discovered node.
     *
     * @param record  the probed record, or the error handler's substitute; null when the handler
     *                recovered without one
     * @param failure the probe failure the handler recovered from, or null
     * @throws IOException to abort the walk
     */
    void visit(Path path, NodeRecord record, FileTreeException failure) throws IOException;
}
