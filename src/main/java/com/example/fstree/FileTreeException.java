package com.example.fstree;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Typed failure raised by every tree operation. The {@link #kind()} tells callers whether the
 * node was missing, unreadable or conflicting, and {@link #path()} names the node involved.
 */
public class FileTreeException extends IOException {
    private final ErrorKind kind;
    private final Path path;

    public FileTreeException(ErrorKind kind, Path path, String message) {
        this(kind, path, message, null);
    }

    public FileTreeException(ErrorKind kind, Path path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    public static FileTreeException notFound(Path path, Throwable cause) {
        return new FileTreeException(ErrorKind.NOT_FOUND, path, "Path " + path + " does not exist", cause);
    }

    public static FileTreeException accessDenied(Path path, Throwable cause) {
        return new FileTreeException(ErrorKind.ACCESS_DENIED, path, "Access denied to " + path, cause);
    }

    public static FileTreeException invalidPath(Path path) {
        return new FileTreeException(ErrorKind.INVALID_PATH, path, "Invalid Path: " + path + " is not a directory");
    }

    /**
     * Maps a raw I/O failure from a filesystem primitive onto the matching error kind.
     * Exceptions that are already typed pass through unchanged.
     */
    public static FileTreeException from(Path path, IOException ex) {
        if (ex instanceof FileTreeException typed) {
            return typed;
        }
        if (ex instanceof NoSuchFileException) {
            return notFound(path, ex);
        }
        if (ex instanceof AccessDeniedException) {
            return accessDenied(path, ex);
        }
        String detail = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return new FileTreeException(ErrorKind.IO_ERROR, path, "I/O error on " + path + ": " + detail, ex);
    }

    public ErrorKind kind() {
        return kind;
    }

    public Path path() {
        return path;
    }
}
