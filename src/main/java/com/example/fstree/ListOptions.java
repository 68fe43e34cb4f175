package com.example.fstree;

/**
 * Settings for {@link Lister#list}.
 *
 * @param details            full records when true, bare paths when false
 * @param detectContentTypes attach a detected MIME type to file records
 */
public record ListOptions(
        boolean recursive,
        boolean details,
        boolean followLinks,
        NodeErrorHandler errorHandler,
        boolean detectContentTypes
) {
    public ListOptions {
        if (errorHandler == null) {
            errorHandler = NodeErrorHandler.propagate();
        }
    }

    public static ListOptions defaults() {
        return new ListOptions(true, true, false, NodeErrorHandler.propagate(), false);
    }

    public static ListOptions of(boolean recursive, boolean details) {
        return defaults().withRecursive(recursive).withDetails(details);
    }

    public ListOptions withRecursive(boolean value) {
        return new ListOptions(value, details, followLinks, errorHandler, detectContentTypes);
    }

    public ListOptions withDetails(boolean value) {
        return new ListOptions(recursive, value, followLinks, errorHandler, detectContentTypes);
    }

    public ListOptions withFollowLinks(boolean value) {
        return new ListOptions(recursive, details, value, errorHandler, detectContentTypes);
    }

    public ListOptions withErrorHandler(NodeErrorHandler value) {
        return new ListOptions(recursive, details, followLinks, value, detectContentTypes);
    }

    public ListOptions withDetectContentTypes(boolean value) {
        return new ListOptions(recursive, details, followLinks, errorHandler, value);
    }

    WalkOptions toWalkOptions() {
        return new WalkOptions(recursive, errorHandler, followLinks);
    }
}
