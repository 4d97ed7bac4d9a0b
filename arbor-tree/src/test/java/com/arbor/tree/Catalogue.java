package com.arbor.tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Catalogue fixture shared by the tree tests.
 * <pre>
 *                                 1 Electronics 26                                27 Clothing 28
 *          2 SmartPhones 11        12 Laptops 17          18 Computers 25
 *   3 Android 4  5 iPhones 10   13 Windows 14  15 MacBooks 16   19 Desktops 24
 *        6 iPhone SE 7  8 iPhone Pro 9                      20 HP 21  22 Dell 23
 * </pre>
 */
final class Catalogue {

    static final List<String> NAMES = List.of("Electronics", "SmartPhones", "Android", "iPhones", "iPhone SE",
            "iPhone Pro", "Laptops", "Windows", "MacBooks", "Computers", "Desktops", "HP", "Dell", "Clothing");

    final NestedSetTree<Category> tree;
    final Map<String, Category> items = new LinkedHashMap<>();

    Catalogue(NestedSetTree<Category> tree) {
        this.tree = tree;
        for (String name : NAMES) {
            items.put(name, new Category(name));
        }
    }

    Category get(String name) {
        return items.get(name);
    }

    /** Builds the catalogue depth-first, adding Clothing last. */
    Catalogue build() {
        add("Electronics", null);
        add("SmartPhones", "Electronics");
        add("Android", "SmartPhones");
        add("iPhones", "SmartPhones");
        add("iPhone SE", "iPhones");
        add("iPhone Pro", "iPhones");
        add("Laptops", "Electronics");
        add("Windows", "Laptops");
        add("MacBooks", "Laptops");
        add("Computers", "Electronics");
        add("Desktops", "Computers");
        add("HP", "Desktops");
        add("Dell", "Desktops");
        add("Clothing", null);
        return this;
    }

    void add(String name, String parent) {
        tree.addChild(get(name), parent != null ? get(parent) : null);
    }

    void insertBefore(String name, String sibling) {
        tree.insertBeforeSibling(get(name), get(sibling));
    }

    /** Asserts the full catalogue shape using tree queries and the invariant checker. */
    void assertShape() {
        tree.verify();
        assertChildren(null, "Electronics", "Clothing");
        assertChildren("Electronics", "SmartPhones", "Laptops", "Computers");
        assertChildren("SmartPhones", "Android", "iPhones");
        assertChildren("Laptops", "Windows", "MacBooks");
        assertChildren("Computers", "Desktops");
        assertChildren("iPhones", "iPhone SE", "iPhone Pro");
        assertChildren("Desktops", "HP", "Dell");
    }

    void assertChildren(String parent, String... children) {
        List<Category> actual = parent != null ? tree.directChildren(get(parent)) : tree.roots();
        assertEquals(List.of(children), names(actual), "children of " + (parent != null ? parent : "root"));
    }

    void assertInterval(String name, long left, long right) {
        Category c = get(name);
        assertEquals(left + ":" + right, c.getLeft() + ":" + c.getRight(), "interval of " + name);
    }

    static List<String> names(List<Category> nodes) {
        return nodes.stream().map(Category::getName).collect(Collectors.toList());
    }
}
