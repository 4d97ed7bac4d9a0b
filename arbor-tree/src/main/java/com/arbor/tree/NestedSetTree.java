package com.arbor.tree;

import com.arbor.config.ArborConfig;
import com.arbor.config.ArborConfig.ShiftStrategy;
import com.arbor.tree.store.TreeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Maintains a nested-set tree on top of a {@link TreeStore}.
 * <p>
 * Mutations ({@link #addChild}, {@link #insertBeforeSibling}, {@link #move} and its variants) validate
 * every precondition first, then open or close gaps with range shifts, all inside one
 * {@link TreeStore#inTransaction store transaction}. Each shift is applied to the store and to every
 * node this tree tracks in memory, so nodes added but not yet {@link #flush() flushed}, and nodes
 * previously returned by queries, stay consistent with the persisted rows.
 * <p>
 * Every persisted node a query returns stays tracked, and every later shift walks all tracked nodes.
 * Long-lived trees that read large parts of the table should call {@link #detachMaterialized()} between
 * units of work.
 * <p>
 * Single writer; not thread-safe.
 */
public final class NestedSetTree<T extends TreeNode> {

    private static final Logger log = LoggerFactory.getLogger(NestedSetTree.class);
    private static final Comparator<TreeNode> BY_LEFT = Comparator.comparingLong(TreeNode::getLeft);
    private static final long NEW_NODE_WIDTH = 2;

    private final TreeStore<T> store;
    private final ShiftStrategy shiftStrategy;
    private final TrackedNodes<T> tracked;

    public NestedSetTree(TreeStore<T> store) {
        this(store, ShiftStrategy.COST_AWARE);
    }

    public NestedSetTree(TreeStore<T> store, ShiftStrategy shiftStrategy) {
        this.store = Objects.requireNonNull(store, "store");
        this.shiftStrategy = Objects.requireNonNull(shiftStrategy, "shiftStrategy");
        this.tracked = new TrackedNodes<>(store::keyOf);
    }

    public static <T extends TreeNode> NestedSetTree<T> fromConfig(TreeStore<T> store, ArborConfig config) {
        return new NestedSetTree<>(store, config.getShiftStrategy());
    }

    public ShiftStrategy getShiftStrategy() {
        return shiftStrategy;
    }

    /**
     * Adds {@code entity} as the last child of {@code parent}, or as the last root when {@code parent} is null.
     * The entity is staged; it is persisted by {@link #flush()}.
     *
     * @throws DetachedReferenceException if {@code parent} is not attached to this tree
     */
    public void addChild(T entity, T parent) {
        requireNew(entity);
        long position;
        if (parent != null) {
            requireAttached(parent, "parent");
            long parentRight = parent.getRight();
            position = mutate("addChild", () -> shiftFromPosition(parentRight, NEW_NODE_WIDTH));
        } else {
            position = maxRight() + 1;
        }
        place(entity, position);
        log.debug("addChild: staged node [{}, {}] under {}", entity.getLeft(), entity.getRight(),
                parent != null ? "[" + parent.getLeft() + ", " + parent.getRight() + "]" : "root");
    }

    /**
     * Inserts {@code entity} immediately before {@code sibling}, under the same parent.
     *
     * @throws DetachedReferenceException if {@code sibling} is not attached to this tree
     */
    public void insertBeforeSibling(T entity, T sibling) {
        requireNew(entity);
        Objects.requireNonNull(sibling, "sibling");
        requireAttached(sibling, "sibling");
        long siblingLeft = sibling.getLeft();
        long position = mutate("insertBeforeSibling", () -> shiftFromPosition(siblingLeft, NEW_NODE_WIDTH));
        place(entity, position);
        log.debug("insertBeforeSibling: staged node [{}, {}] before [{}, {}]",
                entity.getLeft(), entity.getRight(), sibling.getLeft(), sibling.getRight());
    }

    /**
     * Moves the subtree rooted at {@code source} to become the last child of {@code target}.
     * A null {@code target} moves it to the end of the root level.
     *
     * @throws DetachedReferenceException if either node is not attached
     * @throws IllegalRelocationException if {@code target} is {@code source} or one of its descendants
     */
    public void move(T source, T target) {
        Objects.requireNonNull(source, "source");
        if (target == null) {
            moveToRoot(source);
            return;
        }
        requireAttached(source, "source");
        requireAttached(target, "target");
        if (target == source || target.isDescendantOf(source)) {
            throw new IllegalRelocationException(source, target);
        }
        long boundary = target.getRight();
        mutate("move", () -> relocate(source, boundary));
    }

    /**
     * Moves the subtree rooted at {@code source} so that it immediately precedes {@code sibling}.
     *
     * @throws IllegalRelocationException if {@code sibling} is {@code source} or one of its descendants
     */
    public void moveBeforeSibling(T source, T sibling) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sibling, "sibling");
        requireAttached(source, "source");
        requireAttached(sibling, "sibling");
        if (sibling == source || sibling.isDescendantOf(source)) {
            throw new IllegalRelocationException(source, sibling);
        }
        long boundary = sibling.getLeft();
        mutate("moveBeforeSibling", () -> relocate(source, boundary));
    }

    /** Moves the subtree rooted at {@code source} to the end of the root level. */
    public void moveToRoot(T source) {
        Objects.requireNonNull(source, "source");
        requireAttached(source, "source");
        mutate("moveToRoot", () -> relocate(source, maxRight() + 1));
    }

    /** Immediate children of {@code node}, in sibling order. */
    public List<T> directChildren(T node) {
        Objects.requireNonNull(node, "node");
        long left = node.getLeft();
        long right = node.getRight();
        boolean stagedInside = !tracked.stagedMatching(n -> left < n.getLeft() && n.getRight() < right).isEmpty();
        if (!stagedInside) {
            return tracked.materializeAll(store.findChildren(left, right));
        }
        List<T> children = new ArrayList<>();
        long next = left + 1;
        while (next < right) {
            Optional<T> child = lookupByLeft(next);
            if (child.isEmpty()) {
                break;
            }
            children.add(child.get());
            next = child.get().getRight() + 1;
        }
        return children;
    }

    /** Every node strictly inside {@code node}'s interval, ordered by left. */
    public List<T> allDescendants(T node) {
        Objects.requireNonNull(node, "node");
        long left = node.getLeft();
        long right = node.getRight();
        List<T> result = tracked.materializeAll(store.findContainedIn(left, right));
        result.addAll(tracked.stagedMatching(n -> left < n.getLeft() && n.getRight() < right));
        result.sort(BY_LEFT);
        return result;
    }

    /** Every node strictly containing {@code node}, outermost first. */
    public List<T> ancestors(T node) {
        Objects.requireNonNull(node, "node");
        long left = node.getLeft();
        long right = node.getRight();
        List<T> result = tracked.materializeAll(store.findContaining(left, right));
        result.addAll(tracked.stagedMatching(n -> n.getLeft() < left && right < n.getRight()));
        result.sort(BY_LEFT);
        return result;
    }

    /** Innermost ancestor of {@code node}; empty for a root. */
    public Optional<T> parentOf(T node) {
        List<T> ancestors = ancestors(node);
        return ancestors.isEmpty() ? Optional.empty() : Optional.of(ancestors.get(ancestors.size() - 1));
    }

    /** Top-level nodes, in order. */
    public List<T> roots() {
        List<T> roots = new ArrayList<>();
        if (isEmpty()) {
            return roots;
        }
        long next = minLeft();
        while (true) {
            Optional<T> root = lookupByLeft(next);
            if (root.isEmpty()) {
                return roots;
            }
            roots.add(root.get());
            next = root.get().getRight() + 1;
        }
    }

    /** Persisted and staged nodes, ordered by left. */
    public List<T> readAll() {
        List<T> result = tracked.materializeAll(store.readAll());
        result.addAll(tracked.staged());
        result.sort(BY_LEFT);
        return result;
    }

    /** True once {@code node} was added through this tree or returned by one of its queries. */
    public boolean isAttached(T node) {
        return node != null && tracked.isAttached(node);
    }

    /**
     * Stops tracking every persisted node handed out so far. Those instances become detached and no longer
     * follow shifts; query again to get current ones. Staged nodes are kept.
     */
    public void detachMaterialized() {
        int released = tracked.clearMaterialized();
        log.debug("Detached {} materialized tree node(s)", released);
    }

    /** Number of staged nodes waiting for {@link #flush()}. */
    public int pendingCount() {
        return tracked.stagedCount();
    }

    /**
     * Persists every staged node in one store transaction. On failure the nodes stay staged.
     */
    public void flush() {
        List<T> pending = tracked.staged();
        if (pending.isEmpty()) {
            return;
        }
        store.inTransaction(() -> {
            for (T node : pending) {
                store.insert(node);
            }
            return null;
        });
        tracked.promote(pending);
        log.info("Flushed {} staged tree node(s)", pending.size());
    }

    /**
     * Checks the nested-set invariants over every node of the tree.
     *
     * @throws IllegalStateException listing the violations, if any
     */
    public void verify() {
        NestedSetInvariants.verify(readAll());
    }

    long minLeft() {
        OptionalLong stored = store.min(IntervalField.LEFT);
        OptionalLong staged = tracked.minStaged(IntervalField.LEFT);
        if (stored.isPresent() && staged.isPresent()) {
            return Math.min(stored.getAsLong(), staged.getAsLong());
        }
        return stored.isPresent() ? stored.getAsLong() : staged.orElse(0);
    }

    long maxRight() {
        OptionalLong stored = store.max(IntervalField.RIGHT);
        OptionalLong staged = tracked.maxStaged(IntervalField.RIGHT);
        if (stored.isPresent() && staged.isPresent()) {
            return Math.max(stored.getAsLong(), staged.getAsLong());
        }
        return stored.isPresent() ? stored.getAsLong() : staged.orElse(0);
    }

    /**
     * Adds {@code offset} to every left in {@code [from, to)} and, independently, to every right in
     * {@code [from, to)}, in the store and in the tracked nodes. A null bound is unbounded.
     *
     * @throws MalformedShiftRequestException if both bounds are null
     */
    void shift(long offset, Long from, Long to) {
        IntervalRange range = IntervalRange.of(from, to);
        if (offset == 0 || range.isEmpty()) {
            return;
        }
        for (IntervalField field : IntervalField.values()) {
            int rows = store.shift(field, range, offset);
            int local = tracked.shift(field, range, offset);
            log.debug("shift {} {} by {}: {} row(s), {} tracked node(s)", field, range, offset, rows, local);
        }
    }

    /**
     * Opens a gap of {@code gapSize} at {@code position}, shifting the cheaper side of the tree under
     * {@link ShiftStrategy#COST_AWARE}, or always the upper side under {@link ShiftStrategy#FORWARD}.
     *
     * @return first position of the opened gap
     */
    long shiftFromPosition(long position, long gapSize) {
        if (shiftStrategy == ShiftStrategy.COST_AWARE && position - minLeft() <= maxRight() - position) {
            shift(-gapSize, null, position);
            return position - gapSize;
        }
        shift(gapSize, position, null);
        return position;
    }

    /**
     * Moves the subtree of {@code source} so that it ends right before {@code boundary} (when the boundary
     * lies after the subtree) or starts at {@code boundary} (when it lies before). The boundary must not be
     * inside the subtree.
     * <p>
     * Phase A parks the subtree below the tree's minimum, phase B closes the hole it left and opens the
     * gap at the boundary, phase C shifts the parked subtree into the gap.
     */
    private Void relocate(T source, long boundary) {
        long left = source.getLeft();
        long right = source.getRight();
        long width = right - left + 1;
        long min = minLeft();
        long after = right + 1;
        long parked = min - width;

        shift(-(after - min), left, after);
        long gapStart;
        if (boundary > right) {
            shift(-width, after, boundary);
            gapStart = boundary - width;
        } else {
            shift(width, boundary, left);
            gapStart = boundary;
        }
        shift(gapStart - parked, parked, min);
        log.debug("relocate: subtree [{}, {}] moved to [{}, {}]", left, right, gapStart, gapStart + width - 1);
        return null;
    }

    private <R> R mutate(String operation, Supplier<R> work) {
        Map<T, long[]> saved = tracked.snapshot();
        try {
            return store.inTransaction(work);
        } catch (RuntimeException e) {
            tracked.restore(saved);
            log.warn("{} failed; tracked intervals restored. Error: {}", operation, e.getMessage());
            throw e;
        }
    }

    private Optional<T> lookupByLeft(long left) {
        List<T> staged = tracked.stagedMatching(n -> n.getLeft() == left);
        if (!staged.isEmpty()) {
            return Optional.of(staged.get(0));
        }
        return store.findByLeft(left).map(tracked::materialize);
    }

    private boolean isEmpty() {
        return tracked.stagedCount() == 0 && store.min(IntervalField.LEFT).isEmpty();
    }

    private void place(T entity, long position) {
        entity.setLeft(position);
        entity.setRight(position + 1);
        tracked.stage(entity);
    }

    private void requireNew(T entity) {
        Objects.requireNonNull(entity, "entity");
        if (tracked.isAttached(entity)) {
            throw new IllegalArgumentException("entity is already part of the tree");
        }
        if (store.keyOf(entity) != null) {
            throw new IllegalArgumentException("entity is already persisted with key " + store.keyOf(entity));
        }
    }

    private void requireAttached(T node, String role) {
        if (!tracked.isAttached(node)) {
            throw new DetachedReferenceException(role);
        }
    }
}
