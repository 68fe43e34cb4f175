package com.example.fstree.metadata;

/**
 * Classification of a probed node. Traversal recurses only into {@link #DIRECTORY}.
 */
public enum NodeKind {
    FILE,
    DIRECTORY,
    /** Substitute for a node whose metadata could not be read. */
    MISSING,
    /** Sockets, devices, fifos and links queried without following them. */
    OTHER
}
