package com.example.fstree;

import com.example.fstree.metadata.NodeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Copies files by streaming bytes, and whole trees by recreating directories and copying each
 * file. On the first error from either side both streams are closed before the error is raised.
 */
public class TreeCopier {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeCopier.class);

    private final FileSystemPrimitives primitives;
    private final ByteStreamCopier streamCopier;
    private final Lister lister;
    private final RecursiveCreator creator;
    private final PathResolver resolver;

    public TreeCopier(FileSystemPrimitives primitives,
                      ByteStreamCopier streamCopier,
                      Lister lister,
                      RecursiveCreator creator,
                      PathResolver resolver) {
        this.primitives = primitives;
        this.streamCopier = streamCopier;
        this.lister = lister;
        this.creator = creator;
        this.resolver = resolver;
    }

    public long copyFile(Path source, Path destination) throws FileTreeException {
        return copyFile(source, destination, TransferListener.NONE);
    }

    /**
     * Streams {@code source} into {@code destination}, creating or truncating the destination.
     * The parent of the destination must already exist.
     *
     * @return bytes copied
     */
    public long copyFile(Path source, Path destination, TransferListener listener) throws FileTreeException {
        Path from = resolver.resolve(source);
        Path to = resolver.resolve(destination);
        if (from.equals(to) || isAlias(from, to)) {
            throw new FileTreeException(ErrorKind.INVALID_PATH, to, "Source and destination are the same file: " + to);
        }
        try (InputStream in = openSource(from); OutputStream out = openTarget(to)) {
            long bytes = streamCopier.copy(in, from, out, to, listener);
            LOGGER.debug("Copied {} bytes from {} to {}", bytes, from, to);
            return bytes;
        } catch (FileTreeException ex) {
            throw ex;
        } catch (IOException ex) {
            // Only close() can get here.
            throw FileTreeException.from(to, ex);
        }
    }

    /**
     * Copies the tree under {@code source} to {@code destination}. Directories are recreated
     * with {@link RecursiveCreator}, regular files are streamed, other node kinds are skipped.
     * The source is listed completely before anything is written.
     *
     * @return number of files copied
     * @throws FileTreeException INVALID_PATH when the destination lies inside the source
     */
    public int copyTree(Path source, Path destination) throws IOException {
        Path from = resolver.resolve(source);
        Path to = resolver.resolve(destination);
        if (to.startsWith(from)) {
            throw new FileTreeException(ErrorKind.INVALID_PATH, to,
                    "Destination " + to + " is inside source " + from);
        }
        Listing listing = lister.list(from, ListOptions.defaults());
        boolean singleFile = listing.size() == 1 && listing.records().get(0).path().equals(from);
        if (singleFile) {
            copyFile(from, to);
            return 1;
        }

        creator.makeTreePath(to);
        int files = 0;
        for (NodeRecord record : listing.records()) {
            Path target = to.resolve(from.relativize(record.path()).toString());
            switch (record.kind()) {
                case DIRECTORY -> creator.makeTreePath(target);
                case FILE -> {
                    copyFile(record.path(), target);
                    files++;
                }
                default -> LOGGER.warn("Not copying {} node {}", record.kind(), record.path());
            }
        }
        LOGGER.info("Copied {} files from {} to {}", files, from, to);
        return files;
    }

    // Opening the destination truncates it, so a link or hard link to the source must be caught first.
    private boolean isAlias(Path from, Path to) throws FileTreeException {
        try {
            return primitives.isSameFile(from, to);
        } catch (NoSuchFileException ex) {
            return false;
        } catch (IOException ex) {
            throw FileTreeException.from(to, ex);
        }
    }

    private InputStream openSource(Path path) throws FileTreeException {
        try {
            return primitives.openRead(path);
        } catch (IOException ex) {
            throw FileTreeException.from(path, ex);
        }
    }

    private OutputStream openTarget(Path path) throws FileTreeException {
        try {
            return primitives.openWrite(path);
        } catch (IOException ex) {
            throw FileTreeException.from(path, ex);
        }
    }
}
