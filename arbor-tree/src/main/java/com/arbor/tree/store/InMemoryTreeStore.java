package com.arbor.tree.store;

import com.arbor.tree.IntervalField;
import com.arbor.tree.IntervalRange;
import com.arbor.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Heap-backed {@link TreeStore}. Rows are private copies made with the supplied copier, so the store
 * behaves like a database: callers only ever see snapshots. Keys are generated sequentially from 1.
 * {@link #inTransaction} restores the rows it saw on entry when the work throws.
 * Not thread-safe.
 */
public final class InMemoryTreeStore<T extends TreeNode> implements TreeStore<T> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTreeStore.class);
    private static final Comparator<TreeNode> BY_LEFT = Comparator.comparingLong(TreeNode::getLeft);

    private final UnaryOperator<T> copier;
    private final NodeIdentity<T> identity;
    private final Map<Long, T> rows = new LinkedHashMap<>();
    private long nextId = 1;
    private boolean inTransaction;

    public InMemoryTreeStore(UnaryOperator<T> copier, NodeIdentity<T> identity) {
        this.copier = Objects.requireNonNull(copier, "copier");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    @Override
    public List<T> readAll() {
        return select(row -> true);
    }

    @Override
    public Optional<T> findByLeft(long left) {
        return rows.values().stream()
                .filter(row -> row.getLeft() == left)
                .findFirst()
                .map(copier);
    }

    @Override
    public List<T> findContainedIn(long left, long right) {
        return select(row -> left < row.getLeft() && row.getRight() < right);
    }

    @Override
    public List<T> findContaining(long left, long right) {
        return select(row -> row.getLeft() < left && right < row.getRight());
    }

    @Override
    public int shift(IntervalField field, IntervalRange range, long delta) {
        int updated = 0;
        for (T row : rows.values()) {
            if (range.contains(field.get(row))) {
                field.add(row, delta);
                updated++;
            }
        }
        return updated;
    }

    @Override
    public void insert(T node) {
        long id = nextId++;
        identity.setId(node, id);
        rows.put(id, copier.apply(node));
    }

    @Override
    public Object keyOf(T node) {
        return identity.getId(node);
    }

    @Override
    public OptionalLong min(IntervalField field) {
        return rows.values().stream().mapToLong(field::get).min();
    }

    @Override
    public OptionalLong max(IntervalField field) {
        return rows.values().stream().mapToLong(field::get).max();
    }

    @Override
    public <R> R inTransaction(Supplier<R> work) {
        if (inTransaction) {
            return work.get();
        }
        Map<Long, long[]> saved = new HashMap<>();
        rows.forEach((id, row) -> saved.put(id, new long[]{row.getLeft(), row.getRight()}));
        long savedNextId = nextId;
        inTransaction = true;
        try {
            return work.get();
        } catch (RuntimeException e) {
            rows.keySet().retainAll(saved.keySet());
            rows.forEach((id, row) -> {
                long[] interval = saved.get(id);
                row.setLeft(interval[0]);
                row.setRight(interval[1]);
            });
            nextId = savedNextId;
            log.debug("In-memory tree store rolled back to {} row(s): {}", rows.size(), e.getMessage());
            throw e;
        } finally {
            inTransaction = false;
        }
    }

    /** Number of persisted rows. */
    public int size() {
        return rows.size();
    }

    private List<T> select(Predicate<T> predicate) {
        List<T> result = new ArrayList<>();
        for (T row : rows.values()) {
            if (predicate.test(row)) {
                result.add(copier.apply(row));
            }
        }
        result.sort(BY_LEFT);
        return result;
    }
}
