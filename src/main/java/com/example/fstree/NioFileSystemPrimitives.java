package com.example.fstree;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link FileSystemPrimitives} backed by {@link Files} on the default filesystem.
 */
public final class NioFileSystemPrimitives implements FileSystemPrimitives {
    private static final LinkOption[] FOLLOW = new LinkOption[0];
    private static final LinkOption[] NOFOLLOW = new LinkOption[]{LinkOption.NOFOLLOW_LINKS};

    @Override
    public Map<String, Object> readAttributes(Path path, boolean followLinks) throws IOException {
        LinkOption[] linkOptions = followLinks ? FOLLOW : NOFOLLOW;
        Set<String> views = path.getFileSystem().supportedFileAttributeViews();
        if (views.contains("unix")) {
            return Files.readAttributes(path, "unix:*", linkOptions);
        }
        if (views.contains("posix")) {
            return Files.readAttributes(path, "posix:*", linkOptions);
        }
        return Files.readAttributes(path, "*", linkOptions);
    }

    @Override
    public List<String> list(Path directory) throws IOException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                names.add(entry.getFileName().toString());
            }
        }
        return names;
    }

    @Override
    public void createDirectory(Path path, Set<PosixFilePermission> permissions) throws IOException {
        boolean posix = Files.getFileAttributeView(path.getParent() == null ? path : path.getParent(),
                PosixFileAttributeView.class) != null;
        if (permissions == null || !posix) {
            Files.createDirectory(path);
        } else {
            Files.createDirectory(path, PosixFilePermissions.asFileAttribute(permissions));
        }
    }

    @Override
    public void deleteDirectory(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, NOFOLLOW);
        if (!attrs.isDirectory()) {
            throw new NotDirectoryException(path.toString());
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(path)) {
            if (stream.iterator().hasNext()) {
                throw new DirectoryNotEmptyException(path.toString());
            }
        }
        Files.delete(path);
    }

    @Override
    public void deleteFile(Path path) throws IOException {
        if (Files.isDirectory(path, NOFOLLOW)) {
            throw new IOException("Is a directory: " + path);
        }
        Files.delete(path);
    }

    @Override
    public boolean isSameFile(Path first, Path second) throws IOException {
        return Files.isSameFile(first, second);
    }

    @Override
    public InputStream openRead(Path path) throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public OutputStream openWrite(Path path) throws IOException {
        return Files.newOutputStream(path);
    }
}
