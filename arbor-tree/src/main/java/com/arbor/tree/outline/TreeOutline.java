package com.arbor.tree.outline;

import com.arbor.tree.NestedSetTree;
import com.arbor.tree.TreeNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Converts between a nested JSON outline ({@code [{"label": "...", "children": [...]}]}) and a
 * {@link NestedSetTree}. Export derives the hierarchy from intervals only.
 */
public final class TreeOutline {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<List<OutlineNode>> OUTLINE_TYPE = new TypeReference<>() {};

    private TreeOutline() {
    }

    /**
     * Parses an outline (top-level JSON array of entries).
     *
     * @throws UncheckedIOException on parse failure
     */
    public static List<OutlineNode> fromJson(String json) {
        try {
            return MAPPER.readValue(json, OUTLINE_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes an outline to pretty-printed JSON. Empty child lists are omitted.
     */
    public static String toJson(List<OutlineNode> outline) {
        try {
            return MAPPER.writeValueAsString(outline);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Adds every outline entry to {@code tree} in document order: top-level entries as new roots, nested
     * entries as last children of their enclosing entry. Nodes are staged; the caller flushes.
     *
     * @return the created nodes keyed by label, in document order
     * @throws IllegalArgumentException if a label appears twice; nothing is added in that case
     */
    public static <T extends TreeNode> Map<String, T> importInto(NestedSetTree<T> tree, List<OutlineNode> outline,
                                                                 Function<String, T> factory) {
        Set<String> labels = new HashSet<>();
        for (OutlineNode entry : outline) {
            requireUniqueLabels(entry, labels);
        }
        Map<String, T> created = new LinkedHashMap<>();
        for (OutlineNode entry : outline) {
            add(tree, entry, null, factory, created);
        }
        return created;
    }

    public static <T extends TreeNode> Map<String, T> importInto(NestedSetTree<T> tree, String json,
                                                                 Function<String, T> factory) {
        return importInto(tree, fromJson(json), factory);
    }

    /**
     * Renders the current hierarchy of {@code tree} as an outline.
     */
    public static <T extends TreeNode> List<OutlineNode> export(NestedSetTree<T> tree, Function<T, String> labeler) {
        List<T> nodes = tree.readAll();
        int[] cursor = {0};
        return collect(nodes, cursor, Long.MAX_VALUE, labeler);
    }

    private static <T extends TreeNode> void add(NestedSetTree<T> tree, OutlineNode entry, T parent,
                                                 Function<String, T> factory, Map<String, T> created) {
        T node = factory.apply(entry.getLabel());
        tree.addChild(node, parent);
        created.put(entry.getLabel(), node);
        for (OutlineNode child : entry.getChildren()) {
            add(tree, child, node, factory, created);
        }
    }

    private static void requireUniqueLabels(OutlineNode entry, Set<String> labels) {
        if (!labels.add(entry.getLabel())) {
            throw new IllegalArgumentException("Duplicate outline label: " + entry.getLabel());
        }
        for (OutlineNode child : entry.getChildren()) {
            requireUniqueLabels(child, labels);
        }
    }

    // nodes are sorted by left: every node following n with right < n.right is inside n
    private static <T extends TreeNode> List<OutlineNode> collect(List<T> nodes, int[] cursor, long limitRight,
                                                                  Function<T, String> labeler) {
        List<OutlineNode> entries = new ArrayList<>();
        while (cursor[0] < nodes.size() && nodes.get(cursor[0]).getRight() < limitRight) {
            T node = nodes.get(cursor[0]++);
            List<OutlineNode> children = collect(nodes, cursor, node.getRight(), labeler);
            entries.add(new OutlineNode(labeler.apply(node), children));
        }
        return entries;
    }
}
