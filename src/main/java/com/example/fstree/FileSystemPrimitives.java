package com.example.fstree;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-node filesystem calls the tree operations are built from. Each method touches exactly
 * one node and reports failure with the raw {@link IOException} of the underlying call.
 */
public interface FileSystemPrimitives {
    /**
     * Reads the metadata of one node as a name to value map, using the attribute names of
     * {@link java.nio.file.Files#readAttributes(Path, String, java.nio.file.LinkOption...)}.
     */
    Map<String, Object> readAttributes(Path path, boolean followLinks) throws IOException;

    /**
     * Returns the entry names of a directory in the order the directory listing yields them.
     */
    List<String> list(Path directory) throws IOException;

    /**
     * Creates one directory level; fails when the parent is missing.
     *
     * @param permissions permissions for the new directory, or null for the platform default
     */
    void createDirectory(Path path, Set<PosixFilePermission> permissions) throws IOException;

    /**
     * Removes an empty directory.
     */
    void deleteDirectory(Path path) throws IOException;

    void deleteFile(Path path) throws IOException;

    /**
     * Tells whether two paths name the same node, following links. Fails when either is missing.
     */
    boolean isSameFile(Path first, Path second) throws IOException;

    InputStream openRead(Path path) throws IOException;

    /**
     * Opens a stream that creates or truncates the file.
     */
    OutputStream openWrite(Path path) throws IOException;
}
