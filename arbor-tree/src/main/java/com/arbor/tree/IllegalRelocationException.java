package com.arbor.tree;

/**
 * Thrown when a move would place a subtree beneath itself or one of its own descendants.
 * Detected by interval containment before any shift runs.
 */
public final class IllegalRelocationException extends IllegalStateException {

    private final long sourceLeft;
    private final long sourceRight;
    private final long destinationLeft;
    private final long destinationRight;

    public IllegalRelocationException(TreeNode source, TreeNode destination) {
        super(String.format("Can not move node [%d, %d] to a position inside its own subtree, at node [%d, %d]",
                source.getLeft(), source.getRight(), destination.getLeft(), destination.getRight()));
        this.sourceLeft = source.getLeft();
        this.sourceRight = source.getRight();
        this.destinationLeft = destination.getLeft();
        this.destinationRight = destination.getRight();
    }

    public long getSourceLeft() {
        return sourceLeft;
    }

    public long getSourceRight() {
        return sourceRight;
    }

    public long getDestinationLeft() {
        return destinationLeft;
    }

    public long getDestinationRight() {
        return destinationRight;
    }
}
