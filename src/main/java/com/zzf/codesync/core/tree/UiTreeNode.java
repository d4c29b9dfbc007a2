package com.zzf.codesync.core.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One UI call-expression found in source, e.g. {@code Column(children: [...])}.
 *
 * <p>Trees are immutable and rebuilt from scratch by every parse; nodes are never edited in place.
 * Lines are 1-based, offsets are 0-based with {@code endOffset} exclusive.
 */
@Getter
@JsonPropertyOrder({"name", "kind", "startLine", "endLine", "nestingLevel", "properties", "children"})
public final class UiTreeNode {

    public static final String ROOT_NAME = "Root";

    private final String name;
    private final NodeKind kind;
    private final int startLine;
    private final int endLine;
    private final int nestingLevel;
    private final Map<String, PropertyValue> properties;
    private final List<UiTreeNode> children;

    @JsonIgnore
    private final List<NodeArgument> arguments;
    @JsonIgnore
    private final int startOffset;
    @JsonIgnore
    private final int openParenOffset;
    @JsonIgnore
    private final int endOffset;
    @JsonIgnore
    private final String source;

    @Builder
    private UiTreeNode(
            String name,
            NodeKind kind,
            int startLine,
            int endLine,
            int nestingLevel,
            Map<String, PropertyValue> properties,
            List<UiTreeNode> children,
            List<NodeArgument> arguments,
            int startOffset,
            int openParenOffset,
            int endOffset,
            String source
    ) {
        this.name = name;
        this.kind = kind == null ? NodeKind.COMPONENT : kind;
        this.startLine = startLine;
        this.endLine = endLine;
        this.nestingLevel = nestingLevel;
        this.properties = properties == null
                ? Collections.<String, PropertyValue>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<String, PropertyValue>(properties));
        this.children = children == null
                ? Collections.<UiTreeNode>emptyList()
                : Collections.unmodifiableList(new ArrayList<UiTreeNode>(children));
        this.arguments = arguments == null
                ? Collections.<NodeArgument>emptyList()
                : Collections.unmodifiableList(new ArrayList<NodeArgument>(arguments));
        this.startOffset = startOffset;
        this.openParenOffset = openParenOffset;
        this.endOffset = endOffset;
        this.source = source == null ? "" : source;
    }

    @JsonIgnore
    public boolean isRoot() {
        return kind == NodeKind.ROOT;
    }

    public Optional<NodeArgument> getArgument(String argumentName) {
        for (NodeArgument argument : arguments) {
            if (argument.getName().equals(argumentName)) {
                return Optional.of(argument);
            }
        }
        return Optional.empty();
    }

    /**
     * This node and all descendants in pre-order (source order).
     */
    public List<UiTreeNode> flatten() {
        List<UiTreeNode> out = new ArrayList<UiTreeNode>();
        collect(this, out);
        return out;
    }

    private static void collect(UiTreeNode node, List<UiTreeNode> out) {
        out.add(node);
        for (UiTreeNode child : node.children) {
            collect(child, out);
        }
    }

    /**
     * Outermost non-root node whose call starts on {@code line}.
     */
    public Optional<UiTreeNode> findByStartLine(int line) {
        for (UiTreeNode node : flatten()) {
            if (!node.isRoot() && node.startLine == line) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Innermost non-root node whose line span contains {@code line}; on ties the earliest in source order.
     */
    public Optional<UiTreeNode> findAtLine(int line) {
        for (UiTreeNode child : children) {
            if (line >= child.startLine && line <= child.endLine) {
                Optional<UiTreeNode> deeper = child.findAtLine(line);
                return deeper.isPresent() ? deeper : Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Direct parent of {@code target} within this subtree, compared by identity.
     */
    public Optional<UiTreeNode> findParentOf(UiTreeNode target) {
        for (UiTreeNode child : children) {
            if (child == target) {
                return Optional.of(this);
            }
            Optional<UiTreeNode> found = child.findParentOf(target);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "UiTreeNode(" + name + " at line " + startLine + ")";
    }
}
