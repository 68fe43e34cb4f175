package com.example.fstree;

import com.example.fstree.metadata.NodeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Creates every missing directory on the way to a target path, shallowest first.
 */
public class RecursiveCreator {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecursiveCreator.class);

    private final NodeProbe probe;
    private final FileSystemPrimitives primitives;
    private final PathResolver resolver;
    private final Set<PosixFilePermission> defaultMode;

    public RecursiveCreator(NodeProbe probe,
                            FileSystemPrimitives primitives,
                            PathResolver resolver,
                            Set<PosixFilePermission> defaultMode) {
        this.probe = probe;
        this.primitives = primitives;
        this.resolver = resolver;
        this.defaultMode = defaultMode;
    }

    public List<Path> makeTreePath(Path path) throws FileTreeException {
        return makeTreePath(path, defaultMode);
    }

    /**
     * Ensures {@code path} and all of its ancestors exist as directories.
     *
     * @param mode permissions for directories created here, or null for the platform default
     * @return the directories created, shallowest first; empty when everything already existed
     * @throws FileTreeException INVALID_PATH when an existing ancestor is not a directory, in
     *                           which case nothing deeper is attempted
     */
    public List<Path> makeTreePath(Path path, Set<PosixFilePermission> mode) throws FileTreeException {
        Path target = resolver.resolve(path);
        List<Path> created = new ArrayList<>();
        for (Path directory : ancestorChain(target)) {
            if (ensureDirectory(directory, mode)) {
                created.add(directory);
            }
        }
        if (!created.isEmpty()) {
            LOGGER.info("Created {} directories up to {}", created.size(), target);
        }
        return created;
    }

    /**
     * Ancestors of {@code path} from just below the filesystem root down to the path itself.
     */
    static List<Path> ancestorChain(Path path) {
        Deque<Path> chain = new ArrayDeque<>();
        Path current = path;
        while (current != null && current.getParent() != null) {
            chain.addFirst(current);
            current = current.getParent();
        }
        return new ArrayList<>(chain);
    }

    private boolean ensureDirectory(Path directory, Set<PosixFilePermission> mode) throws FileTreeException {
        NodeRecord record;
        try {
            record = probe.probe(directory, true);
        } catch (FileTreeException ex) {
            if (ex.kind() != ErrorKind.NOT_FOUND) {
                throw ex;
            }
            return create(directory, mode);
        }
        if (!record.isDirectory()) {
            throw FileTreeException.invalidPath(directory);
        }
        return false;
    }

    private boolean create(Path directory, Set<PosixFilePermission> mode) throws FileTreeException {
        try {
            primitives.createDirectory(directory, mode);
            LOGGER.debug("Created {}", directory);
            return true;
        } catch (FileAlreadyExistsException ex) {
            // Lost a race with another creator; accept it if a directory is there now.
            // A dangling link also lands here and re-probes as missing.
            NodeRecord existing;
            try {
                existing = probe.probe(directory, true);
            } catch (FileTreeException reprobe) {
                if (reprobe.kind() == ErrorKind.NOT_FOUND) {
                    throw FileTreeException.invalidPath(directory);
                }
                throw reprobe;
            }
            if (existing.isDirectory()) {
                return false;
            }
            throw FileTreeException.invalidPath(directory);
        } catch (IOException ex) {
            throw FileTreeException.from(directory, ex);
        }
    }
}
