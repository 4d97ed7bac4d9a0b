package com.arbor.tree.outline;

import com.arbor.config.ArborConfig.ShiftStrategy;
import com.arbor.tree.Category;
import com.arbor.tree.NestedSetTree;
import com.arbor.tree.store.InMemoryTreeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeOutlineTest {

    private InMemoryTreeStore<Category> store;
    private NestedSetTree<Category> tree;

    @BeforeEach
    void setUp() {
        store = Category.newStore();
        tree = new NestedSetTree<>(store, ShiftStrategy.FORWARD);
    }

    @Test
    void importInto_buildsCatalogue() throws IOException {
        Map<String, Category> created = TreeOutline.importInto(tree, loadResource("outline/catalogue.json"), Category::new);
        tree.flush();

        assertEquals(14, created.size());
        assertEquals(14, store.size());
        assertInterval(created.get("Electronics"), 1, 26);
        assertInterval(created.get("iPhones"), 5, 10);
        assertInterval(created.get("Laptops"), 12, 17);
        assertInterval(created.get("Dell"), 22, 23);
        assertInterval(created.get("Clothing"), 27, 28);
        tree.verify();
    }

    @Test
    void export_roundTripsImportedOutline() throws IOException {
        List<OutlineNode> outline = TreeOutline.fromJson(loadResource("outline/catalogue.json"));
        TreeOutline.importInto(tree, outline, Category::new);

        assertEquals(outline, TreeOutline.export(tree, Category::getName));
    }

    @Test
    void export_reflectsMoves() {
        Map<String, Category> created = TreeOutline.importInto(tree,
                "[{\"label\":\"E\",\"children\":[{\"label\":\"A\"},{\"label\":\"B\"}]}]", Category::new);
        tree.flush();

        tree.move(created.get("A"), created.get("B"));

        List<OutlineNode> expected = List.of(new OutlineNode("E",
                List.of(new OutlineNode("B", List.of(OutlineNode.leaf("A"))))));
        assertEquals(expected, TreeOutline.export(tree, Category::getName));
    }

    @Test
    void export_emptyTree() {
        assertTrue(TreeOutline.export(tree, Category::getName).isEmpty());
        assertEquals("[ ]", TreeOutline.toJson(List.of()));
    }

    @Test
    void toJson_omitsEmptyChildren() {
        String json = TreeOutline.toJson(List.of(new OutlineNode("E", List.of(OutlineNode.leaf("A")))));

        assertTrue(json.contains("\"label\" : \"E\""), json);
        assertTrue(json.contains("\"label\" : \"A\""), json);
        assertEquals(1, json.split("children", -1).length - 1, json);
        assertEquals(List.of(new OutlineNode("E", List.of(OutlineNode.leaf("A")))), TreeOutline.fromJson(json));
    }

    @Test
    void importInto_duplicateLabel_addsNothing() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> TreeOutline.importInto(tree,
                "[{\"label\":\"E\",\"children\":[{\"label\":\"A\"}]},{\"label\":\"A\"}]", Category::new));

        assertTrue(ex.getMessage().contains("A"));
        assertEquals(0, tree.pendingCount());
    }

    @Test
    void fromJson_malformed() {
        assertThrows(UncheckedIOException.class, () -> TreeOutline.fromJson("{not json"));
        assertThrows(UncheckedIOException.class, () -> TreeOutline.fromJson("[{\"children\":[]}]"));
    }

    @Test
    void importInto_underExistingRoots() {
        Category existing = new Category("Existing");
        tree.addChild(existing, null);

        Map<String, Category> created = TreeOutline.importInto(tree, "[{\"label\":\"New\"}]", Category::new);

        assertFalse(created.containsKey("Existing"));
        assertInterval(created.get("New"), 3, 4);
    }

    private static void assertInterval(Category node, long left, long right) {
        assertNotNull(node);
        assertEquals(left + ":" + right, node.getLeft() + ":" + node.getRight(), node.getName());
    }

    private static String loadResource(String path) throws IOException {
        try (InputStream in = TreeOutlineTest.class.getClassLoader().getResourceAsStream(path)) {
            assertNotNull(in, path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
