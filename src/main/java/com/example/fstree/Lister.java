package com.example.fstree;

import com.example.fstree.metadata.NodeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the nodes of a walk into an ordered {@link Listing}. A directory root is not part of
 * its own listing.
 */
public class Lister {
    private static final Logger LOGGER = LoggerFactory.getLogger(Lister.class);

    private final TreeWalker walker;
    private final PathResolver resolver;
    private final ContentTypeDetector contentTypes;

    public Lister(TreeWalker walker, PathResolver resolver, ContentTypeDetector contentTypes) {
        this.walker = walker;
        this.resolver = resolver;
        this.contentTypes = contentTypes;
    }

    public Listing list(Path root, boolean recursive, boolean details) throws IOException {
        return list(root, ListOptions.of(recursive, details));
    }

    public Listing list(Path root, ListOptions options) throws IOException {
        Path start = resolver.resolve(root);
        List<NodeRecord> collected = new ArrayList<>();
        walker.walk(start, (path, record, failure) -> {
            if (record == null) {
                // Recovered without metadata; nothing to list.
                return;
            }
            if (path.equals(start) && record.isDirectory()) {
                return;
            }
            if (options.detectContentTypes() && record.isFile() && contentTypes != null) {
                record = record.withContentType(contentTypes.detect(path));
            }
            collected.add(record);
        }, options.toWalkOptions());
        LOGGER.debug("Listed {} entries under {}", collected.size(), start);
        return new Listing(start, options.details(), collected);
    }
}
