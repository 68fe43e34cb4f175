package com.example.fstree;

import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable runtime settings for the tree operations.
 */
public record FileTreeConfig(
        Path workingDirectory,
        boolean followLinks,
        int copyBufferSize,
        Optional<Set<PosixFilePermission>> directoryMode,
        int threadCount,
        boolean detectContentTypes
) {
    public static FileTreeConfig defaults() {
        return new FileTreeConfig(
                Path.of(System.getProperty("user.dir")),
                false,
                ByteStreamCopier.DEFAULT_BUFFER_SIZE,
                Optional.empty(),
                Math.max(1, Runtime.getRuntime().availableProcessors()),
                false
        );
    }

    public FileTreeConfig withWorkingDirectory(Path directory) {
        return new FileTreeConfig(directory, followLinks, copyBufferSize, directoryMode, threadCount, detectContentTypes);
    }
}
