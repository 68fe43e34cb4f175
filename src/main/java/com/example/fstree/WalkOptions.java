package com.example.fstree;

/**
 * Settings for one {@link TreeWalker#walk} call.
 *
 * @param recursive    when false only the root and its direct entries are visited
 * @param errorHandler consulted for every probe or enumeration failure
 * @param followLinks  when false links are reported as {@code OTHER} and never expanded
 */
public record WalkOptions(
        boolean recursive,
        NodeErrorHandler errorHandler,
        boolean followLinks
) {
    public WalkOptions {
        if (errorHandler == null) {
            errorHandler = NodeErrorHandler.propagate();
        }
    }

    public static WalkOptions defaults() {
        return new WalkOptions(true, NodeErrorHandler.propagate(), false);
    }

    public WalkOptions withRecursive(boolean value) {
        return new WalkOptions(value, errorHandler, followLinks);
    }

    public WalkOptions withErrorHandler(NodeErrorHandler value) {
        return new WalkOptions(recursive, value, followLinks);
    }

    public WalkOptions withFollowLinks(boolean value) {
        return new WalkOptions(recursive, errorHandler, value);
    }
}
