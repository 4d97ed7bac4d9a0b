package com.arbor.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory tier of a tree: the nodes staged for insertion plus every persisted node the tree has
 * handed out. Each persisted node is represented by exactly one instance (identity map keyed by the
 * store key), so a shift applied here keeps every instance a caller holds consistent with the store.
 */
final class TrackedNodes<T extends TreeNode> {

    private static final Comparator<TreeNode> BY_LEFT = Comparator.comparingLong(TreeNode::getLeft);

    private final Function<T, Object> keyOf;
    private final Map<Object, T> materialized = new HashMap<>();
    private final Set<T> staged = Collections.newSetFromMap(new IdentityHashMap<>());

    TrackedNodes(Function<T, Object> keyOf) {
        this.keyOf = keyOf;
    }

    /**
     * Returns the tracked instance for a row read from the store, registering the row if its key is new.
     */
    T materialize(T row) {
        Object key = keyOf.apply(row);
        if (key == null) {
            throw new IllegalStateException("Store returned a node without a key");
        }
        T existing = materialized.putIfAbsent(key, row);
        return existing != null ? existing : row;
    }

    List<T> materializeAll(Collection<T> rows) {
        List<T> result = new ArrayList<>(rows.size());
        for (T row : rows) {
            result.add(materialize(row));
        }
        return result;
    }

    void stage(T node) {
        staged.add(node);
    }

    boolean isStaged(T node) {
        return staged.contains(node);
    }

    boolean isAttached(T node) {
        if (staged.contains(node)) {
            return true;
        }
        Object key = keyOf.apply(node);
        return key != null && materialized.get(key) == node;
    }

    /** Staged nodes, ordered by left. */
    List<T> staged() {
        List<T> result = new ArrayList<>(staged);
        result.sort(BY_LEFT);
        return result;
    }

    List<T> stagedMatching(Predicate<T> predicate) {
        List<T> result = new ArrayList<>();
        for (T node : staged) {
            if (predicate.test(node)) {
                result.add(node);
            }
        }
        result.sort(BY_LEFT);
        return result;
    }

    int stagedCount() {
        return staged.size();
    }

    /** Moves inserted nodes from the staged set into the identity map. */
    void promote(Collection<T> inserted) {
        for (T node : inserted) {
            staged.remove(node);
            Object key = keyOf.apply(node);
            if (key == null) {
                throw new IllegalStateException("Inserted node has no key");
            }
            materialized.put(key, node);
        }
    }

    /** @return number of nodes released */
    int clearMaterialized() {
        int released = materialized.size();
        materialized.clear();
        return released;
    }

    /**
     * Adds {@code delta} to {@code field} of every tracked node whose value lies in {@code range}.
     *
     * @return number of tracked nodes changed
     */
    int shift(IntervalField field, IntervalRange range, long delta) {
        int changed = 0;
        for (T node : staged) {
            if (range.contains(field.get(node))) {
                field.add(node, delta);
                changed++;
            }
        }
        for (T node : materialized.values()) {
            if (range.contains(field.get(node))) {
                field.add(node, delta);
                changed++;
            }
        }
        return changed;
    }

    OptionalLong minStaged(IntervalField field) {
        return staged.stream().mapToLong(field::get).min();
    }

    OptionalLong maxStaged(IntervalField field) {
        return staged.stream().mapToLong(field::get).max();
    }

    /** Captures the interval of every tracked node. */
    Map<T, long[]> snapshot() {
        Map<T, long[]> saved = new IdentityHashMap<>();
        for (T node : staged) {
            saved.put(node, new long[]{node.getLeft(), node.getRight()});
        }
        for (T node : materialized.values()) {
            saved.put(node, new long[]{node.getLeft(), node.getRight()});
        }
        return saved;
    }

    void restore(Map<T, long[]> saved) {
        saved.forEach((node, interval) -> {
            node.setLeft(interval[0]);
            node.setRight(interval[1]);
        });
    }
}
