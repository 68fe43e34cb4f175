package com.example.fstree;

import com.example.fstree.metadata.NodeRecord;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered result of one listing, in visitation order. Renders as a JSON array of path strings
 * when the listing was requested without details, otherwise as an array of records.
 */
public record Listing(
        Path root,
        boolean detailed,
        List<NodeRecord> records
) {
    public Listing {
        records = List.copyOf(records);
    }

    public List<Path> paths() {
        return records.stream().map(NodeRecord::path).toList();
    }

    public int size() {
        return records.size();
    }

    /**
     * Records in reverse visitation order, so every child precedes its parent directory.
     */
    public List<NodeRecord> reversed() {
        List<NodeRecord> copy = new ArrayList<>(records);
        Collections.reverse(copy);
        return copy;
    }

    @JsonValue
    public Object toJson() {
        if (detailed) {
            return records;
        }
        return records.stream().map(record -> record.path().toString()).toList();
    }
}
