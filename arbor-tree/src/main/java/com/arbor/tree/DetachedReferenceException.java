package com.arbor.tree;

/**
 * Thrown when a parent, sibling, source or target node is not attached to the tree: it was neither
 * added through the tree nor materialized by one of its queries. Raised before any shift runs, so the
 * tree is unchanged.
 */
public final class DetachedReferenceException extends IllegalStateException {

    private final String role;

    public DetachedReferenceException(String role) {
        super(String.format("%s node has not been added to the tree yet", role));
        this.role = role;
    }

    /** Argument role of the offending node (e.g. "parent", "sibling", "source", "target"). */
    public String getRole() {
        return role;
    }
}
