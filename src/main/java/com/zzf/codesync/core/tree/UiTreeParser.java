package com.zzf.codesync.core.tree;

import com.zzf.codesync.core.scan.CharClass;
import com.zzf.codesync.core.scan.LineIndex;
import com.zzf.codesync.core.scan.TextScanner;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link UiTreeNode} tree from UI-description source.
 *
 * <p>A node is an upper-case identifier (optionally qualified, {@code EdgeInsets.all}) immediately followed
 * by {@code (}. Every bracket is tracked on one stack, so a node always closes back to the frame that
 * enclosed it and following list elements stay siblings. Parsing never fails: nodes left open at end of
 * input are dropped and their closed descendants move up to the nearest surviving ancestor.
 */
@Slf4j
public final class UiTreeParser {

    private final NodeCatalog catalog;

    public UiTreeParser() {
        this(NodeCatalog.defaults());
    }

    public UiTreeParser(NodeCatalog catalog) {
        this.catalog = catalog;
    }

    public NodeCatalog getCatalog() {
        return catalog;
    }

    public UiTreeNode parse(String text) {
        return new ParseRun(text == null ? "" : text).run();
    }

    private static final class Frame {
        final char open;
        final NodeBuilder node;
        int argumentStart;

        Frame(char open, int offset, NodeBuilder node) {
            this.open = open;
            this.node = node;
            this.argumentStart = offset + 1;
        }
    }

    private static final class NodeBuilder {
        final String name;
        final int startOffset;
        final int openParenOffset;
        final int nestingLevel;
        final List<UiTreeNode> children = new ArrayList<UiTreeNode>();
        final List<NodeArgument> arguments = new ArrayList<NodeArgument>();

        NodeBuilder(String name, int startOffset, int openParenOffset, int nestingLevel) {
            this.name = name;
            this.startOffset = startOffset;
            this.openParenOffset = openParenOffset;
            this.nestingLevel = nestingLevel;
        }
    }

    private final class ParseRun {
        private final String text;
        private final LineIndex lines;
        private final Deque<Frame> stack = new ArrayDeque<Frame>();
        private final List<UiTreeNode> topLevel = new ArrayList<UiTreeNode>();
        private int closed;
        private int dropped;

        ParseRun(String text) {
            this.text = text;
            this.lines = new LineIndex(text);
        }

        UiTreeNode run() {
            TextScanner scanner = new TextScanner(text);
            while (scanner.hasNext()) {
                int at = scanner.position();
                if (scanner.advance() != CharClass.CODE) {
                    continue;
                }
                char c = text.charAt(at);
                if (c == '(') {
                    openParen(at);
                } else if (c == '[' || c == '{') {
                    stack.push(new Frame(c, at, null));
                } else if (c == ',') {
                    separator(at);
                } else if (TextScanner.isCloseBracket(c)) {
                    close(c, at);
                }
            }
            while (!stack.isEmpty()) {
                abandon(stack.pop());
            }
            if (dropped > 0) {
                log.debug("parser.unbalanced closed={} dropped={}", closed, dropped);
            }
            return UiTreeNode.builder()
                    .name(UiTreeNode.ROOT_NAME)
                    .kind(NodeKind.ROOT)
                    .startLine(1)
                    .endLine(lines.lineCount())
                    .children(topLevel)
                    .startOffset(0)
                    .openParenOffset(-1)
                    .endOffset(text.length())
                    .build();
        }

        private void openParen(int at) {
            NodeBuilder node = null;
            int nameEnd = at;
            if (nameEnd > 0 && text.charAt(nameEnd - 1) == '>') {
                nameEnd = typeArgumentsStart(nameEnd - 1);
            }
            if (nameEnd > 0) {
                int nameStart = nameEnd;
                while (nameStart > 0 && (TextScanner.isIdentifierPart(text.charAt(nameStart - 1))
                        || text.charAt(nameStart - 1) == '.')) {
                    nameStart--;
                }
                String name = text.substring(nameStart, nameEnd);
                if (isNodeName(name)) {
                    node = new NodeBuilder(name, keywordStart(nameStart), at, nestingLevel());
                }
            }
            stack.push(new Frame('(', at, node));
        }

        private boolean isNodeName(String name) {
            if (name.isEmpty() || !Character.isUpperCase(name.charAt(0))) {
                return false;
            }
            for (String segment : name.split("\\.", -1)) {
                if (segment.isEmpty() || !TextScanner.isIdentifierStart(segment.charAt(0))) {
                    return false;
                }
            }
            return true;
        }

        /**
         * Offset of the {@code <} opening type arguments that end at {@code gtOffset}, or -1.
         */
        private int typeArgumentsStart(int gtOffset) {
            int depth = 0;
            for (int i = gtOffset; i >= 0; i--) {
                char c = text.charAt(i);
                if (c == '>') {
                    depth++;
                } else if (c == '<') {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                } else if (!(TextScanner.isIdentifierPart(c) || c == '.' || c == ',' || c == '?' || c == ' ')) {
                    return -1;
                }
            }
            return -1;
        }

        /**
         * Start of a {@code const} or {@code new} keyword directly preceding the name, else the name start.
         */
        private int keywordStart(int nameStart) {
            int i = nameStart;
            while (i > 0 && Character.isWhitespace(text.charAt(i - 1))) {
                i--;
            }
            int wordEnd = i;
            while (i > 0 && TextScanner.isIdentifierPart(text.charAt(i - 1))) {
                i--;
            }
            String word = text.substring(i, wordEnd);
            if (wordEnd < nameStart && ("const".equals(word) || "new".equals(word))) {
                return i;
            }
            return nameStart;
        }

        private int nestingLevel() {
            int level = 0;
            for (Frame frame : stack) {
                level++;
                if (frame.open == '[') {
                    return level;
                }
            }
            return level;
        }

        private void separator(int at) {
            Frame top = stack.peek();
            if (top != null && top.node != null) {
                finishArgument(top.node, top.argumentStart, at);
                top.argumentStart = at + 1;
            }
        }

        private void close(char c, int at) {
            char opener = TextScanner.openerOf(c);
            boolean known = false;
            for (Frame frame : stack) {
                if (frame.open == opener) {
                    known = true;
                    break;
                }
            }
            if (!known) {
                return;
            }
            while (!stack.isEmpty()) {
                Frame frame = stack.pop();
                if (frame.open == opener) {
                    complete(frame, at);
                    return;
                }
                abandon(frame);
            }
        }

        private void complete(Frame frame, int closeOffset) {
            if (frame.node == null) {
                return;
            }
            finishArgument(frame.node, frame.argumentStart, closeOffset);
            UiTreeNode node = build(frame.node, closeOffset + 1);
            closed++;
            log.trace("parser.node name={} lines={}-{}", node.getName(), node.getStartLine(), node.getEndLine());
            attach(node);
        }

        private void abandon(Frame frame) {
            if (frame.node == null) {
                return;
            }
            dropped++;
            for (UiTreeNode orphan : frame.node.children) {
                attach(orphan);
            }
        }

        private void attach(UiTreeNode node) {
            for (Frame frame : stack) {
                if (frame.node != null) {
                    frame.node.children.add(node);
                    return;
                }
            }
            topLevel.add(node);
        }

        private void finishArgument(NodeBuilder node, int from, int to) {
            int nameStart = TextScanner.skipTrivia(text, from, to);
            if (nameStart >= to || !TextScanner.isIdentifierStart(text.charAt(nameStart))) {
                return;
            }
            int nameEnd = nameStart + 1;
            while (nameEnd < to && TextScanner.isIdentifierPart(text.charAt(nameEnd))) {
                nameEnd++;
            }
            int colon = nameEnd;
            while (colon < to && Character.isWhitespace(text.charAt(colon))) {
                colon++;
            }
            if (colon >= to || text.charAt(colon) != ':' || (colon + 1 < to && text.charAt(colon + 1) == ':')) {
                return;
            }
            int valueStart = TextScanner.skipTrivia(text, colon + 1, to);
            int valueEnd = Math.max(valueStart, TextScanner.trimTrivia(text, valueStart, to));
            node.arguments.add(new NodeArgument(text.substring(nameStart, nameEnd), nameStart, valueStart, valueEnd,
                    text.substring(valueStart, valueEnd)));
        }

        private UiTreeNode build(NodeBuilder node, int endOffset) {
            Map<String, PropertyValue> properties = new LinkedHashMap<String, PropertyValue>();
            for (NodeArgument argument : node.arguments) {
                PropertyValue value = PropertyValue.raw(argument.getRawValue());
                for (UiTreeNode child : node.children) {
                    if (child.getStartOffset() == argument.getValueStart() && child.getEndOffset() == argument.getValueEnd()) {
                        value = PropertyValue.child(child);
                        break;
                    }
                }
                properties.put(argument.getName(), value);
            }
            return UiTreeNode.builder()
                    .name(node.name)
                    .kind(catalog.classify(node.name))
                    .startLine(lines.lineOf(node.startOffset))
                    .endLine(lines.lineOf(endOffset - 1))
                    .nestingLevel(node.nestingLevel)
                    .properties(properties)
                    .children(node.children)
                    .arguments(node.arguments)
                    .startOffset(node.startOffset)
                    .openParenOffset(node.openParenOffset)
                    .endOffset(endOffset)
                    .source(text.substring(node.startOffset, endOffset))
                    .build();
        }
    }
}
