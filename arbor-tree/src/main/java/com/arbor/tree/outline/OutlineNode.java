package com.arbor.tree.outline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a tree outline: a label and the ordered child entries beneath it.
 */
public final class OutlineNode {

    private final String label;
    private final List<OutlineNode> children;

    @JsonCreator
    public OutlineNode(
            @JsonProperty("label") String label,
            @JsonProperty("children") List<OutlineNode> children) {
        this.label = Objects.requireNonNull(label, "label");
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    public static OutlineNode leaf(String label) {
        return new OutlineNode(label, List.of());
    }

    public String getLabel() {
        return label;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<OutlineNode> getChildren() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutlineNode that = (OutlineNode) o;
        return label.equals(that.label) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, children);
    }

    @Override
    public String toString() {
        return children.isEmpty() ? label : label + children;
    }
}
