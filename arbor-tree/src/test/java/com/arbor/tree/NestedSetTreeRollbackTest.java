package com.arbor.tree;

import com.arbor.config.ArborConfig.ShiftStrategy;
import com.arbor.tree.store.InMemoryTreeStore;
import com.arbor.tree.store.TreeStore;
import com.arbor.tree.store.TreeStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * A store failure in the middle of a mutation must leave both the store rows and the tracked
 * intervals as they were before the call.
 */
class NestedSetTreeRollbackTest {

    private FailingStore store;
    private NestedSetTree<Category> tree;
    private Catalogue catalogue;

    @BeforeEach
    void setUp() {
        store = new FailingStore(Category.newStore());
        tree = new NestedSetTree<>(store, ShiftStrategy.FORWARD);
        catalogue = new Catalogue(tree).build();
        tree.flush();
    }

    @Test
    void move_failingOnThirdShift_restoresEverything() {
        Map<String, String> before = intervals();
        store.failOnShift(3);

        assertThrows(TreeStoreException.class,
                () -> tree.move(catalogue.get("Laptops"), catalogue.get("Computers")));

        assertEquals(before, intervals());
        NestedSetInvariants.verify(store.delegate.readAll());
        catalogue.assertShape();
    }

    @Test
    void move_failingOnLastShift_restoresEverything() {
        Map<String, String> before = intervals();
        store.failOnShift(6);

        assertThrows(TreeStoreException.class,
                () -> tree.moveBeforeSibling(catalogue.get("Computers"), catalogue.get("SmartPhones")));

        assertEquals(before, intervals());
        catalogue.assertShape();
    }

    @Test
    void addChild_failingShift_leavesEntityDetached() {
        Map<String, String> before = intervals();
        store.failOnShift(2);
        Category tablets = new Category("Tablets");

        assertThrows(TreeStoreException.class, () -> tree.addChild(tablets, catalogue.get("Electronics")));

        assertEquals(before, intervals());
        assertFalse(tree.isAttached(tablets));
        assertEquals(0, tree.pendingCount());
    }

    @Test
    void treeStillUsableAfterFailure() {
        store.failOnShift(1);
        assertThrows(TreeStoreException.class,
                () -> tree.move(catalogue.get("Laptops"), catalogue.get("Computers")));

        tree.move(catalogue.get("Laptops"), catalogue.get("Computers"));

        catalogue.assertInterval("Laptops", 19, 24);
        catalogue.assertChildren("Computers", "Desktops", "Laptops");
    }

    private Map<String, String> intervals() {
        Map<String, String> result = new LinkedHashMap<>();
        for (String name : Catalogue.NAMES) {
            Category c = catalogue.get(name);
            result.put(name, c.getLeft() + ":" + c.getRight());
        }
        return result;
    }

    /** Delegating store that throws on the n-th shift after being armed. */
    private static final class FailingStore implements TreeStore<Category> {

        private final InMemoryTreeStore<Category> delegate;
        private int failAt;
        private int shifts;

        FailingStore(InMemoryTreeStore<Category> delegate) {
            this.delegate = delegate;
        }

        void failOnShift(int n) {
            failAt = n;
            shifts = 0;
        }

        @Override
        public int shift(IntervalField field, IntervalRange range, long delta) {
            if (failAt > 0 && ++shifts == failAt) {
                failAt = 0;
                throw new TreeStoreException("simulated failure on shift " + shifts, null);
            }
            return delegate.shift(field, range, delta);
        }

        @Override
        public <R> R inTransaction(Supplier<R> work) {
            return delegate.inTransaction(work);
        }

        @Override
        public List<Category> readAll() {
            return delegate.readAll();
        }

        @Override
        public Optional<Category> findByLeft(long left) {
            return delegate.findByLeft(left);
        }

        @Override
        public List<Category> findContainedIn(long left, long right) {
            return delegate.findContainedIn(left, right);
        }

        @Override
        public List<Category> findContaining(long left, long right) {
            return delegate.findContaining(left, right);
        }

        @Override
        public void insert(Category node) {
            delegate.insert(node);
        }

        @Override
        public Object keyOf(Category node) {
            return delegate.keyOf(node);
        }

        @Override
        public OptionalLong min(IntervalField field) {
            return delegate.min(field);
        }

        @Override
        public OptionalLong max(IntervalField field) {
            return delegate.max(field);
        }
    }
}
