package com.example.fstree;

import java.nio.file.Path;

/**
 * Turns caller supplied path strings into absolute, normalized paths. Resolution is purely
 * syntactic and never touches the filesystem.
 */
public final class PathResolver {
    private final Path workingDirectory;

    public PathResolver(Path workingDirectory) {
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    /**
     * Resolver anchored at the JVM's current working directory.
     */
    public static PathResolver forCurrentDirectory() {
        return new PathResolver(Path.of(System.getProperty("user.dir")));
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public Path resolve(String candidate) {
        return resolve(workingDirectory, candidate);
    }

    /**
     * Resolves {@code candidate} against {@code base}. Absolute candidates ignore the base and a
     * blank candidate yields the base itself.
     */
    public Path resolve(Path base, String candidate) {
        Path anchor = base.isAbsolute() ? base : workingDirectory.resolve(base);
        if (candidate == null || candidate.isBlank()) {
            return anchor.normalize();
        }
        return anchor.resolve(candidate).toAbsolutePath().normalize();
    }

    public Path resolve(Path candidate) {
        return candidate.isAbsolute() ? candidate.normalize() : workingDirectory.resolve(candidate).normalize();
    }
}
