package com.arbor.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for a complete set of nested-set nodes:
 * <ol>
 *   <li>intervals are well formed ({@code right > left}) and either disjoint or strictly nested;</li>
 *   <li>children fill their parent contiguously, from {@code parent.left + 1} to {@code parent.right - 1};</li>
 *   <li>a childless node has {@code right = left + 1};</li>
 *   <li>roots form a contiguous chain from the minimum left;</li>
 *   <li>all endpoints are pairwise distinct.</li>
 * </ol>
 */
public final class NestedSetInvariants {

    private NestedSetInvariants() {
    }

    /**
     * @return one message per violation; empty when the nodes form a valid nested-set forest
     */
    public static List<String> check(Collection<? extends TreeNode> nodes) {
        List<String> violations = new ArrayList<>();
        if (nodes.isEmpty()) {
            return violations;
        }
        Set<Long> endpoints = new HashSet<>();
        for (TreeNode node : nodes) {
            if (node.getRight() <= node.getLeft()) {
                violations.add("Malformed interval " + format(node));
            }
            if (!endpoints.add(node.getLeft())) {
                violations.add("Duplicate endpoint " + node.getLeft() + " at " + format(node));
            }
            if (!endpoints.add(node.getRight())) {
                violations.add("Duplicate endpoint " + node.getRight() + " at " + format(node));
            }
        }
        if (!violations.isEmpty()) {
            return violations;
        }

        List<TreeNode> sorted = new ArrayList<>(nodes);
        sorted.sort(Comparator.comparingLong(TreeNode::getLeft));
        Deque<Frame> open = new ArrayDeque<>();
        long[] nextRoot = {sorted.get(0).getLeft()};
        for (TreeNode node : sorted) {
            while (!open.isEmpty() && open.peek().node.getRight() < node.getLeft()) {
                close(open.pop(), open, nextRoot, violations);
            }
            if (open.isEmpty()) {
                if (node.getLeft() != nextRoot[0]) {
                    violations.add("Gap before root " + format(node) + ": expected left " + nextRoot[0]);
                }
            } else {
                Frame parent = open.peek();
                if (parent.node.getRight() < node.getRight()) {
                    violations.add("Partial overlap between " + format(parent.node) + " and " + format(node));
                }
                if (node.getLeft() != parent.next) {
                    violations.add("Gap before child " + format(node) + " of " + format(parent.node)
                            + ": expected left " + parent.next);
                }
            }
            open.push(new Frame(node));
        }
        while (!open.isEmpty()) {
            close(open.pop(), open, nextRoot, violations);
        }
        return violations;
    }

    /**
     * @throws IllegalStateException listing every violation, if any
     */
    public static void verify(Collection<? extends TreeNode> nodes) {
        List<String> violations = check(nodes);
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Nested-set invariants violated: " + String.join("; ", violations));
        }
    }

    private static void close(Frame frame, Deque<Frame> open, long[] nextRoot, List<String> violations) {
        if (frame.next != frame.node.getRight()) {
            violations.add("Gap before end of " + format(frame.node) + ": last position used is " + (frame.next - 1));
        }
        long following = frame.node.getRight() + 1;
        if (open.isEmpty()) {
            nextRoot[0] = following;
        } else {
            open.peek().next = following;
        }
    }

    private static String format(TreeNode node) {
        return "[" + node.getLeft() + ", " + node.getRight() + "]";
    }

    private static final class Frame {
        private final TreeNode node;
        private long next;

        private Frame(TreeNode node) {
            this.node = node;
            this.next = node.getLeft() + 1;
        }
    }
}
