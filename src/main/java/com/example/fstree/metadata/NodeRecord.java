package com.example.fstree.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Metadata captured for a single node during one operation. Owner, group, mode and change time
 * are only populated on platforms exposing the unix attribute view.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeRecord(
        @JsonSerialize(using = ToStringSerializer.class) Path path,
        NodeKind kind,
        Integer mode,
        Integer ownerId,
        Integer groupId,
        long sizeBytes,
        Instant accessTime,
        Instant modifyTime,
        Instant changeTime,
        Instant birthTime,
        String contentType
) {
    /**
     * Placeholder an error handler can hand back for a node it could not read.
     */
    public static NodeRecord missing(Path path) {
        return new NodeRecord(path, NodeKind.MISSING, null, null, null, 0L, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isDirectory() {
        return kind == NodeKind.DIRECTORY;
    }

    @JsonIgnore
    public boolean isFile() {
        return kind == NodeKind.FILE;
    }

    public NodeRecord withContentType(String type) {
        return new NodeRecord(path, kind, mode, ownerId, groupId, sizeBytes,
                accessTime, modifyTime, changeTime, birthTime, type);
    }
}
