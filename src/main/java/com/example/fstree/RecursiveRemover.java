package com.example.fstree;

import com.example.fstree.metadata.NodeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Deletes a subtree bottom-up. The subtree is listed first; deletions then run sequentially in
 * reverse visitation order, which places every child ahead of its parent directory.
 *
 * <p>There is no rollback: when a deletion fails the nodes already removed stay removed and the
 * failure is raised as a {@link PartialFailureException}.
 */
public class RecursiveRemover {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecursiveRemover.class);

    private final Lister lister;
    private final NodeProbe probe;
    private final FileSystemPrimitives primitives;
    private final PathResolver resolver;

    public RecursiveRemover(Lister lister, NodeProbe probe, FileSystemPrimitives primitives, PathResolver resolver) {
        this.lister = lister;
        this.probe = probe;
        this.primitives = primitives;
        this.resolver = resolver;
    }

    /**
     * Removes {@code root} and, when it is a directory, its contents.
     *
     * @param recursive when false only the direct entries are listed, so a non-empty
     *                  subdirectory makes the removal fail part way
     * @return the number of nodes removed
     * @throws FileTreeException        when the subtree cannot be listed; nothing is deleted
     * @throws PartialFailureException  when a deletion fails
     */
    public int removeTree(Path root, boolean recursive) throws IOException {
        Path start = resolver.resolve(root);
        // Never follow links here: a link to a directory is unlinked, its target left alone.
        NodeRecord rootRecord = probe.probe(start, false);
        Listing listing = lister.list(start, ListOptions.of(recursive, true));

        List<NodeRecord> order = listing.reversed();
        if (rootRecord.isDirectory()) {
            order.add(rootRecord);
        }

        int removed = 0;
        for (NodeRecord record : order) {
            try {
                if (record.isDirectory()) {
                    primitives.deleteDirectory(record.path());
                } else {
                    primitives.deleteFile(record.path());
                }
            } catch (IOException ex) {
                FileTreeException failure = FileTreeException.from(record.path(), ex);
                LOGGER.warn("Removal of {} stopped at {} after {} nodes", start, record.path(), removed);
                throw new PartialFailureException(record.path(), removed, order.size() - removed, failure);
            }
            removed++;
        }
        LOGGER.info("Removed {} nodes under {}", removed, start);
        return removed;
    }
}
