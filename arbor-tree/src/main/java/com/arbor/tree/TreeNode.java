package com.arbor.tree;

/**
 * Contract a payload type implements to be placed in a nested-set tree.
 * <p>
 * The node's interval is {@code [left, right]}. Descendants are exactly the nodes whose interval is
 * strictly contained in this one. Only {@link NestedSetTree} assigns or shifts these values; callers
 * must treat the setters as internal.
 * <p>
 * Identity (primary key, name, ...) belongs to the payload type and is not part of this contract.
 */
public interface TreeNode {

    long getLeft();

    void setLeft(long left);

    long getRight();

    void setRight(long right);

    /** True when at least one node sits inside this node's interval. */
    default boolean hasChildren() {
        return getRight() - getLeft() > 1;
    }

    /** Strict containment: {@code ancestor.left < left && right < ancestor.right}. A node is not its own descendant. */
    default boolean isDescendantOf(TreeNode ancestor) {
        return ancestor.getLeft() < getLeft() && getRight() < ancestor.getRight();
    }

    default boolean contains(TreeNode other) {
        return other.isDescendantOf(this);
    }

    /** Number of interval positions used by this node and its subtree ({@code 2 * subtreeSize}). */
    default long width() {
        return getRight() - getLeft() + 1;
    }
}
