package com.example.fstree;

import com.example.fstree.metadata.NodeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Breadth-first traversal of a directory tree. Pending directories live in a FIFO queue owned by
 * the walk, so tree depth never grows the call stack.
 *
 * <p>Ordering guarantees for one walk: the root is visited first; every node is visited at most
 * once and after its parent directory; all direct entries of a directory are visited before any
 * of their own children; siblings follow the directory listing order, which is not sorted.
 */
public final class TreeWalker {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeWalker.class);

    private final FileSystemPrimitives primitives;
    private final NodeProbe probe;
    private final PathResolver resolver;

    public TreeWalker(FileSystemPrimitives primitives, NodeProbe probe, PathResolver resolver) {
        this.primitives = primitives;
        this.probe = probe;
        this.resolver = resolver;
    }

    /**
     * Walks the tree under {@code root}, calling {@code visitor} once per node.
     *
     * @throws FileTreeException when the error handler rethrows a probe or enumeration failure
     * @throws IOException       whatever the visitor throws to stop the walk
     */
    public void walk(Path root, NodeVisitor visitor, WalkOptions options) throws IOException {
        Path start = resolver.resolve(root);
        NodeErrorHandler handler = options.errorHandler();

        NodeRecord rootRecord = visitOne(start, visitor, options);
        if (rootRecord == null || !rootRecord.isDirectory()) {
            return;
        }

        Deque<Path> pending = new ArrayDeque<>();
        pending.addLast(start);
        long visited = 1;

        while (!pending.isEmpty()) {
            Path current = pending.removeFirst();
            List<String> names;
            try {
                names = primitives.list(current);
            } catch (IOException ex) {
                FileTreeException failure = FileTreeException.from(current, ex);
                handler.handle(current, failure);
                LOGGER.warn("Skipping expansion of {}: {}", current, failure.getMessage());
                continue;
            }
            LOGGER.debug("Expanding {} ({} entries, {} directories queued)", current, names.size(), pending.size());

            for (String name : names) {
                Path entry = resolver.resolve(current, name);
                NodeRecord record = visitOne(entry, visitor, options);
                visited++;
                if (options.recursive() && record != null && record.isDirectory()) {
                    pending.addLast(entry);
                }
            }
        }
        LOGGER.debug("Walk of {} visited {} nodes", start, visited);
    }

    private NodeRecord visitOne(Path path, NodeVisitor visitor, WalkOptions options) throws IOException {
        NodeRecord record;
        FileTreeException failure = null;
        try {
            record = probe.probe(path, options.followLinks());
        } catch (FileTreeException ex) {
            Optional<NodeRecord> substitute = options.errorHandler().handle(path, ex);
            LOGGER.warn("Recovered from {} on {}", ex.kind(), path);
            failure = ex;
            record = substitute.orElse(null);
        }
        visitor.visit(path, record, failure);
        return record;
    }
}
