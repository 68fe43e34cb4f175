package com.example.fstree;

import com.example.fstree.metadata.NodeKind;
import com.example.fstree.metadata.NodeRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads the metadata of one node and classifies it. Each call issues exactly one metadata query.
 */
public final class NodeProbe {
    private final FileSystemPrimitives primitives;

    public NodeProbe(FileSystemPrimitives primitives) {
        this.primitives = primitives;
    }

    /**
     * Probes {@code path}.
     *
     * @param followLinks false to describe a symbolic link itself rather than its target
     * @throws FileTreeException with kind NOT_FOUND, ACCESS_DENIED or IO_ERROR
     */
    public NodeRecord probe(Path path, boolean followLinks) throws FileTreeException {
        Map<String, Object> attributes;
        try {
            attributes = primitives.readAttributes(path, followLinks);
        } catch (IOException ex) {
            throw FileTreeException.from(path, ex);
        }
        return toRecord(path, attributes);
    }

    /**
     * Returns false only when the node is known not to exist; any other probe failure counts
     * as existing.
     */
    public boolean exists(Path path) {
        try {
            probe(path, true);
            return true;
        } catch (FileTreeException ex) {
            return ex.kind() != ErrorKind.NOT_FOUND;
        }
    }

    static NodeRecord toRecord(Path path, Map<String, Object> attributes) {
        return new NodeRecord(
                path,
                classify(attributes),
                mode(attributes),
                asInteger(attributes.get("uid")),
                asInteger(attributes.get("gid")),
                attributes.get("size") instanceof Long size ? size : 0L,
                instant(attributes.get("lastAccessTime")),
                instant(attributes.get("lastModifiedTime")),
                instant(attributes.get("ctime")),
                instant(attributes.get("creationTime")),
                null
        );
    }

    private static NodeKind classify(Map<String, Object> attributes) {
        if (Boolean.TRUE.equals(attributes.get("isDirectory"))) {
            return NodeKind.DIRECTORY;
        }
        if (Boolean.TRUE.equals(attributes.get("isRegularFile"))) {
            return NodeKind.FILE;
        }
        return NodeKind.OTHER;
    }

    private static Integer mode(Map<String, Object> attributes) {
        Integer mode = asInteger(attributes.get("mode"));
        if (mode != null) {
            return mode;
        }
        Object permissions = attributes.get("permissions");
        if (permissions instanceof Set<?> set) {
            Set<PosixFilePermission> typed = EnumSet.noneOf(PosixFilePermission.class);
            for (Object permission : set) {
                typed.add((PosixFilePermission) permission);
            }
            return permissionBits(typed);
        }
        return null;
    }

    // Bit 8 is OWNER_READ, down to bit 0 for OTHERS_EXECUTE, matching the enum declaration order.
    static int permissionBits(Set<PosixFilePermission> permissions) {
        int bits = 0;
        for (PosixFilePermission permission : permissions) {
            bits |= 1 << (8 - permission.ordinal());
        }
        return bits;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    private static Instant instant(Object value) {
        return value instanceof FileTime time ? time.toInstant() : null;
    }
}
