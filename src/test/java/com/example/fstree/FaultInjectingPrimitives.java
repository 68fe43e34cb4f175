package com.example.fstree;

import java.io.FilterInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wraps the real primitives and fails chosen calls, so tests can simulate permission problems
 * regardless of the user running them.
 */
class FaultInjectingPrimitives implements FileSystemPrimitives {
    private final FileSystemPrimitives delegate = new NioFileSystemPrimitives();
    private final Set<Path> deniedProbes = new HashSet<>();
    private final Set<Path> failingListings = new HashSet<>();
    private final Set<Path> deniedDeletes = new HashSet<>();
    private final Set<Path> failingWrites = new HashSet<>();
    final List<Path> deleted = new ArrayList<>();
    final List<Path> created = new ArrayList<>();
    final List<Path> probed = new ArrayList<>();
    int openStreams;

    FaultInjectingPrimitives denyProbe(Path path) {
        deniedProbes.add(path);
        return this;
    }

    FaultInjectingPrimitives failListing(Path path) {
        failingListings.add(path);
        return this;
    }

    FaultInjectingPrimitives denyDelete(Path path) {
        deniedDeletes.add(path);
        return this;
    }

    FaultInjectingPrimitives failWrites(Path path) {
        failingWrites.add(path);
        return this;
    }

    @Override
    public Map<String, Object> readAttributes(Path path, boolean followLinks) throws IOException {
        probed.add(path);
        if (deniedProbes.contains(path)) {
            throw new AccessDeniedException(path.toString());
        }
        return delegate.readAttributes(path, followLinks);
    }

    @Override
    public List<String> list(Path directory) throws IOException {
        if (failingListings.contains(directory)) {
            throw new NoSuchFileException(directory.toString());
        }
        return delegate.list(directory);
    }

    @Override
    public void createDirectory(Path path, Set<PosixFilePermission> permissions) throws IOException {
        delegate.createDirectory(path, permissions);
        created.add(path);
    }

    @Override
    public void deleteDirectory(Path path) throws IOException {
        if (deniedDeletes.contains(path)) {
            throw new AccessDeniedException(path.toString());
        }
        delegate.deleteDirectory(path);
        deleted.add(path);
    }

    @Override
    public void deleteFile(Path path) throws IOException {
        if (deniedDeletes.contains(path)) {
            throw new AccessDeniedException(path.toString());
        }
        delegate.deleteFile(path);
        deleted.add(path);
    }

    @Override
    public boolean isSameFile(Path first, Path second) throws IOException {
        return delegate.isSameFile(first, second);
    }

    @Override
    public InputStream openRead(Path path) throws IOException {
        InputStream in = delegate.openRead(path);
        openStreams++;
        return new FilterInputStream(in) {
            @Override
            public void close() throws IOException {
                openStreams--;
                super.close();
            }
        };
    }

    @Override
    public OutputStream openWrite(Path path) throws IOException {
        OutputStream out = delegate.openWrite(path);
        openStreams++;
        boolean failing = failingWrites.contains(path);
        return new FilterOutputStream(out) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                if (failing) {
                    throw new IOException("No space left on device");
                }
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                openStreams--;
                super.close();
            }
        };
    }
}
