package com.arbor.tree.store;

import com.arbor.tree.IntervalField;
import com.arbor.tree.IntervalRange;
import com.arbor.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Durable tier of a nested-set tree: an ordered store that can read rows, run range queries and apply
 * bulk range-predicated updates to the interval columns.
 * <p>
 * Implementations return value copies: a node returned by a query is never the instance the store
 * keeps internally, and later shifts applied through {@link #shift} do not reach previously returned
 * instances. Keeping those instances current is the job of the tree's tracking tier.
 */
public interface TreeStore<T extends TreeNode> {

    /** All persisted nodes, ordered by left. */
    List<T> readAll();

    Optional<T> findByLeft(long left);

    /** Nodes strictly inside {@code (left, right)}: {@code left < x.left && x.right < right}, ordered by left. */
    List<T> findContainedIn(long left, long right);

    /** Nodes strictly containing {@code [left, right]}: {@code x.left < left && right < x.right}, ordered by left. */
    List<T> findContaining(long left, long right);

    /**
     * Direct children of the node spanning {@code [parentLeft, parentRight]}: the contiguous chain starting
     * at {@code parentLeft + 1}, following {@code left = previous.right + 1}. Ordered by left.
     * The default walks the chain with point lookups.
     */
    default List<T> findChildren(long parentLeft, long parentRight) {
        List<T> children = new ArrayList<>();
        long next = parentLeft + 1;
        while (next < parentRight) {
            Optional<T> child = findByLeft(next);
            if (child.isEmpty()) {
                break;
            }
            children.add(child.get());
            next = child.get().getRight() + 1;
        }
        return children;
    }

    /**
     * Adds {@code delta} to {@code field} of every persisted node whose {@code field} value lies in {@code range}.
     *
     * @return number of rows updated
     */
    int shift(IntervalField field, IntervalRange range, long delta);

    /** Persists a new node with its current interval; assigns its key. */
    void insert(T node);

    /** Persistent identity of the node, or {@code null} if it has not been inserted. */
    Object keyOf(T node);

    OptionalLong min(IntervalField field);

    OptionalLong max(IntervalField field);

    /**
     * Runs {@code work} as one atomic unit: all of its shifts and inserts commit together or not at all.
     * Nested calls join the outer unit. The default runs {@code work} directly (no atomicity).
     */
    default <R> R inTransaction(Supplier<R> work) {
        return work.get();
    }
}
