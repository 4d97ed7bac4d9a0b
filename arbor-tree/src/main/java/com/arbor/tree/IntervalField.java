package com.arbor.tree;

/**
 * The two interval endpoints a shift can target. Shifts always run one field at a time.
 */
public enum IntervalField {
    LEFT {
        @Override
        public long get(TreeNode node) {
            return node.getLeft();
        }

        @Override
        public void add(TreeNode node, long delta) {
            node.setLeft(node.getLeft() + delta);
        }
    },
    RIGHT {
        @Override
        public long get(TreeNode node) {
            return node.getRight();
        }

        @Override
        public void add(TreeNode node, long delta) {
            node.setRight(node.getRight() + delta);
        }
    };

    public abstract long get(TreeNode node);

    public abstract void add(TreeNode node, long delta);
}
