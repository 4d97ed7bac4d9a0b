package com.arbor.store.jdbc;

import com.arbor.tree.TreeNode;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/** Test payload persisted with a single {@code name} column. */
final class Product implements TreeNode {

    static final TreeRowMapper<Product> MAPPER = new TreeRowMapper<>() {
        @Override
        public List<String> payloadColumns() {
            return List.of("name");
        }

        @Override
        public List<String> payloadColumnDefinitions() {
            return List.of("name VARCHAR(255) NOT NULL");
        }

        @Override
        public Product newNode(ResultSet rs) throws SQLException {
            return new Product(rs.getString("name"));
        }

        @Override
        public int bindPayload(PreparedStatement ps, int startIndex, Product node) throws SQLException {
            ps.setString(startIndex, node.name);
            return startIndex + 1;
        }

        @Override
        public Long getId(Product node) {
            return node.id;
        }

        @Override
        public void setId(Product node, long id) {
            node.id = id;
        }
    };

    private Long id;
    private final String name;
    private long left;
    private long right;

    Product(String name) {
        this.name = name;
    }

    Long getId() {
        return id;
    }

    String getName() {
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
