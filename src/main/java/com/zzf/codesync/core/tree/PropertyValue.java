package com.zzf.codesync.core.tree;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Value of a named node argument: either the raw source text of the value, or the node the value consists of.
 */
public abstract class PropertyValue {

    private PropertyValue() {
    }

    public static Raw raw(String text) {
        return new Raw(text);
    }

    public static ChildNode child(UiTreeNode node) {
        return new ChildNode(node);
    }

    public abstract boolean isChildNode();

    /**
     * Raw source text of the value, as written.
     */
    public abstract String getSource();

    /**
     * Display form: the raw text, or {@code <Name>} for a nested node.
     */
    @JsonValue
    public abstract String display();

    @Override
    public String toString() {
        return display();
    }

    public static final class Raw extends PropertyValue {
        private final String text;

        private Raw(String text) {
            this.text = text == null ? "" : text;
        }

        @Override
        public boolean isChildNode() {
            return false;
        }

        @Override
        public String getSource() {
            return text;
        }

        @Override
        public String display() {
            return text;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Raw && ((Raw) o).text.equals(text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }
    }

    public static final class ChildNode extends PropertyValue {
        private final UiTreeNode node;

        private ChildNode(UiTreeNode node) {
            this.node = Objects.requireNonNull(node, "node");
        }

        public UiTreeNode getNode() {
            return node;
        }

        @Override
        public boolean isChildNode() {
            return true;
        }

        @Override
        public String getSource() {
            return node.getSource();
        }

        @Override
        public String display() {
            return "<" + node.getName() + ">";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ChildNode && ((ChildNode) o).node == node;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(node);
        }
    }
}
