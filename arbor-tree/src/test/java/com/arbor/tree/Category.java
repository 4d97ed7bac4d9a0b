package com.arbor.tree;

import com.arbor.tree.store.InMemoryTreeStore;
import com.arbor.tree.store.NodeIdentity;

/** Test payload: a named catalogue category. */
public final class Category implements TreeNode {

    public static final NodeIdentity<Category> IDENTITY = new NodeIdentity<>() {
        @Override
        public Long getId(Category node) {
            return node.id;
        }

        @Override
        public void setId(Category node, long id) {
            node.id = id;
        }
    };

    private Long id;
    private final String name;
    private long left;
    private long right;

    public Category(String name) {
        this.name = name;
    }

    public static InMemoryTreeStore<Category> newStore() {
        return new InMemoryTreeStore<>(Category::copy, IDENTITY);
    }

    /** Row that already exists in the store, bypassing the tree (data inserted by other means). */
    public static Category seed(InMemoryTreeStore<Category> store, String name, long left, long right) {
        Category row = new Category(name);
        row.left = left;
        row.right = right;
        store.insert(row);
        return row;
    }

    public Category copy() {
        Category c = new Category(name);
        c.id = id;
        c.left = left;
        c.right = right;
        return c;
    }

    public String getName() {
        return name;
    }

    @Override
    public long getLeft() {
        return left;
    }

    @Override
    public void setLeft(long left) {
        this.left = left;
    }

    @Override
    public long getRight() {
        return right;
    }

    @Override
    public void setRight(long right) {
        this.right = right;
    }

    @Override
    public String toString() {
        return name + "[" + left + ", " + right + "]";
    }
}
