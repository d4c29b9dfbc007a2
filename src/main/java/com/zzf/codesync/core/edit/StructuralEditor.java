package com.zzf.codesync.core.edit;

import com.zzf.codesync.core.scan.LineIndex;
import com.zzf.codesync.core.scan.TextScanner;
import com.zzf.codesync.core.tree.NodeArgument;
import com.zzf.codesync.core.tree.NodeCatalog;
import com.zzf.codesync.core.tree.UiTreeNode;
import com.zzf.codesync.core.tree.UiTreeParser;
import com.zzf.codesync.core.util.StringUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutates UI-description source relative to a node while keeping every byte outside the edited span.
 *
 * <p>The target is always re-located by parsing the given text: the outermost node starting on the
 * requested line. Span ends come from the parser, which only counts brackets in code, so brackets inside
 * strings and comments never end a span early. Inserted line breaks follow the text's own, {@code \n} or
 * {@code \r\n}.
 */
@Slf4j
public final class StructuralEditor {

    public static final String DEFAULT_INDENT_UNIT = "  ";
    public static final String DEFAULT_MULTI_CHILD_SLOT = "children";
    public static final String DEFAULT_SINGLE_CHILD_SLOT = "child";

    private final UiTreeParser parser;
    private final NodeCatalog catalog;
    private final String indentUnit;
    private final String multiChildSlot;
    private final String singleChildSlot;

    public StructuralEditor() {
        this(new UiTreeParser(), DEFAULT_INDENT_UNIT, DEFAULT_MULTI_CHILD_SLOT, DEFAULT_SINGLE_CHILD_SLOT);
    }

    public StructuralEditor(UiTreeParser parser, String indentUnit, String multiChildSlot, String singleChildSlot) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.catalog = parser.getCatalog();
        this.indentUnit = indentUnit == null ? DEFAULT_INDENT_UNIT : indentUnit;
        this.multiChildSlot = StringUtils.isBlank(multiChildSlot) ? DEFAULT_MULTI_CHILD_SLOT : multiChildSlot;
        this.singleChildSlot = StringUtils.isBlank(singleChildSlot) ? DEFAULT_SINGLE_CHILD_SLOT : singleChildSlot;
    }

    /**
     * Inserts or replaces relative to the node starting on {@code targetLine}.
     * A blank {@code insertedCode} is only accepted for {@link InsertPosition#REPLACE}, where it deletes.
     */
    public EditResult apply(String text, int targetLine, String insertedCode, InsertPosition position) {
        Objects.requireNonNull(position, "position");
        if (StringUtils.isBlank(insertedCode)) {
            if (position == InsertPosition.REPLACE) {
                return delete(text, targetLine);
            }
            throw new IllegalArgumentException("insertedCode must not be blank for " + position);
        }
        String source = text == null ? "" : text;
        Target target = locate(source, targetLine);
        if (target == null) {
            return notFound(source, targetLine);
        }
        String code = insertedCode.strip();
        log.debug("editor.apply op={} line={} node={} code={}", position, targetLine, target.node.getName(),
                StringUtils.preview(code, 80));
        if ((position == InsertPosition.BEFORE || position == InsertPosition.AFTER) && target.named) {
            return rejected(source, position.name(), target, EditFailure.NO_SIBLING_SLOT);
        }
        List<TextSplice> splices;
        switch (position) {
            case AS_CHILD:
                splices = insertAsChild(target, code);
                break;
            case BEFORE:
                splices = insertBefore(target, code);
                break;
            case AFTER:
                splices = insertAfter(target, code);
                break;
            default:
                splices = Collections.singletonList(new TextSplice(target.node.getStartOffset(),
                        target.node.getEndOffset(), target.reindent(code, target.indent)));
                break;
        }
        if (splices == null) {
            return rejected(source, position.name(), target, EditFailure.NO_CHILD_SLOT);
        }
        return commit(source, target.lines, splices, position.name());
    }

    /**
     * Removes the node starting on {@code targetLine} with its trailing comma. A node that is the value of a
     * named argument takes the whole argument with it; lines left blank are removed entirely.
     */
    public EditResult delete(String text, int targetLine) {
        String source = text == null ? "" : text;
        Target target = locate(source, targetLine);
        if (target == null) {
            return notFound(source, targetLine);
        }
        LineIndex lines = target.lines;
        int start = target.spanStart;
        int end = target.spanEnd;
        int i = skipBlanks(source, end);
        boolean hadComma = i < source.length() && source.charAt(i) == ',';
        if (hadComma) {
            end = i + 1;
        }
        int endLine = lines.lineOf(Math.max(start, end - 1));
        int eol = lines.lineEnd(endLine);
        if (lines.startsLine(start) && source.substring(end, eol).trim().isEmpty()) {
            int startLine = lines.lineOf(start);
            int from = lines.lineStart(startLine);
            int to = lines.nextLineStart(endLine);
            if (endLine >= lines.lineCount() && startLine > 1) {
                from = lines.lineEnd(startLine - 1);
            }
            return commit(source, lines, Collections.singletonList(TextSplice.remove(from, to)), "DELETE");
        }
        if (!hadComma && target.inList()) {
            int j = start;
            while (j > 0 && (source.charAt(j - 1) == ' ' || source.charAt(j - 1) == '\t')) {
                j--;
            }
            if (j > 0 && source.charAt(j - 1) == ',') {
                return commit(source, lines, Collections.singletonList(TextSplice.remove(j - 1, end)), "DELETE");
            }
        }
        if (hadComma) {
            end = skipBlanks(source, end);
        }
        return commit(source, lines, Collections.singletonList(TextSplice.remove(start, end)), "DELETE");
    }

    /**
     * Replaces the node with {@code Wrapper(props..., child: <node>)}, the node re-indented one unit deeper.
     * Every wrapper property needs an identifier name and a non-blank value.
     */
    public EditResult wrap(String text, int targetLine, String wrapperName, Map<String, String> wrapperProperties) {
        if (StringUtils.isBlank(wrapperName) || !Character.isUpperCase(wrapperName.trim().charAt(0))) {
            throw new IllegalArgumentException("wrapper must be a node name, got: " + wrapperName);
        }
        if (wrapperProperties != null) {
            for (Map.Entry<String, String> entry : wrapperProperties.entrySet()) {
                requireIdentifier(entry.getKey(), "wrapper property name");
                if (StringUtils.isBlank(entry.getValue())) {
                    throw new IllegalArgumentException("wrapper property '" + entry.getKey() + "' has no value");
                }
            }
        }
        String source = text == null ? "" : text;
        Target target = locate(source, targetLine);
        if (target == null) {
            return notFound(source, targetLine);
        }
        String indent = target.indent;
        String nl = target.lines.lineSeparator();
        StringBuilder sb = new StringBuilder(wrapperName.trim()).append('(').append(nl);
        if (wrapperProperties != null) {
            for (Map.Entry<String, String> entry : wrapperProperties.entrySet()) {
                sb.append(indent).append(indentUnit).append(entry.getKey().trim()).append(": ")
                        .append(target.reindent(entry.getValue().strip(), indent + indentUnit))
                        .append(',').append(nl);
            }
        }
        sb.append(indent).append(indentUnit).append(singleChildSlot).append(": ")
                .append(target.reindent(target.node.getSource(), indentUnit))
                .append(',').append(nl)
                .append(indent).append(')');
        TextSplice splice = new TextSplice(target.node.getStartOffset(), target.node.getEndOffset(), sb.toString());
        return commit(source, target.lines, Collections.singletonList(splice), "WRAP");
    }

    /**
     * Sets a named argument of the node to {@code valueCode}, appending the argument when it is not written yet.
     */
    public EditResult updateProperty(String text, int targetLine, String name, String valueCode) {
        requireIdentifier(name, "property name");
        if (StringUtils.isBlank(valueCode)) {
            throw new IllegalArgumentException("property value must not be blank");
        }
        String source = text == null ? "" : text;
        Target target = locate(source, targetLine);
        if (target == null) {
            return notFound(source, targetLine);
        }
        String value = valueCode.strip();
        Optional<NodeArgument> existing = target.node.getArgument(name.trim());
        List<TextSplice> splices;
        if (existing.isPresent()) {
            splices = Collections.singletonList(new TextSplice(existing.get().getValueStart(),
                    existing.get().getValueEnd(), target.reindent(value, target.indent)));
        } else {
            splices = addArgument(target, name.trim() + ": " + value);
        }
        return commit(source, target.lines, splices, "PROPERTY");
    }

    /**
     * Swaps the nodes starting on {@code firstLine} and {@code secondLine}. Both must be positional elements
     * of the same list or argument list; each node's text moves verbatim, separators and comments between
     * them stay where they are.
     */
    public EditResult reorder(String text, int firstLine, int secondLine) {
        String source = text == null ? "" : text;
        Target first = locate(source, firstLine);
        if (first == null) {
            return notFound(source, firstLine);
        }
        Target second = locate(source, secondLine);
        if (second == null) {
            return notFound(source, secondLine);
        }
        if (first.named || second.named || first.enclosing != second.enclosing
                || first.node.getStartOffset() == second.node.getStartOffset()) {
            return rejected(source, "REORDER", first, EditFailure.NOT_SIBLINGS);
        }
        UiTreeNode a = first.node;
        UiTreeNode b = second.node;
        List<TextSplice> splices = Arrays.asList(
                new TextSplice(a.getStartOffset(), a.getEndOffset(), b.getSource()),
                new TextSplice(b.getStartOffset(), b.getEndOffset(), a.getSource()));
        return commit(source, first.lines, splices, "REORDER");
    }

    private List<TextSplice> insertAsChild(Target t, String code) {
        UiTreeNode node = t.node;
        Optional<NodeArgument> many = node.getArgument(multiChildSlot);
        if (many.isPresent()) {
            return insertIntoList(t, many.get(), code);
        }
        Optional<NodeArgument> one = node.getArgument(singleChildSlot);
        if (one.isPresent()) {
            String raw = one.get().getRawValue().trim();
            if (raw.isEmpty() || "null".equals(raw)) {
                return Collections.singletonList(new TextSplice(one.get().getValueStart(), one.get().getValueEnd(),
                        t.reindent(code, t.indent)));
            }
            return null;
        }
        if (catalog.acceptsChildren(node.getName())) {
            return addArgument(t, multiChildSlot + ": [" + code + "]");
        }
        if (catalog.acceptsChild(node.getName())) {
            return addArgument(t, singleChildSlot + ": " + code);
        }
        return null;
    }

    private List<TextSplice> insertIntoList(Target t, NodeArgument slot, String code) {
        String text = t.text;
        LineIndex lines = t.lines;
        int bracket = slot.getValueStart();
        if (bracket < slot.getValueEnd() && text.charAt(bracket) == '<') {
            bracket = skipBlanks(text, afterTypeArguments(text, bracket));
        }
        if (bracket >= slot.getValueEnd() || text.charAt(bracket) != '[') {
            return null;
        }
        int close = TextScanner.findMatchingClose(text, bracket);
        if (close < 0 || close >= slot.getValueEnd()) {
            return null;
        }
        int first = TextScanner.skipTrivia(text, bracket + 1, close);
        boolean empty = first >= close;
        int bracketLine = lines.lineOf(bracket);
        int closeLine = lines.lineOf(close);
        String lineIndent = lines.indentationOf(bracketLine);
        if (bracketLine == closeLine) {
            String body = t.reindent(code, lineIndent);
            return Collections.singletonList(empty
                    ? new TextSplice(bracket + 1, close, body)
                    : TextSplice.insert(first, body + ", "));
        }
        if (!empty && lines.lineOf(first) == bracketLine) {
            return Collections.singletonList(TextSplice.insert(first, t.reindent(code, lineIndent) + ", "));
        }
        String indent = empty ? lines.indentationOf(closeLine) + indentUnit : lines.indentationOf(lines.lineOf(first));
        return Collections.singletonList(TextSplice.insert(lines.lineEnd(bracketLine),
                lines.lineSeparator() + indent + t.reindent(code, indent) + ","));
    }

    private List<TextSplice> insertBefore(Target t, String code) {
        LineIndex lines = t.lines;
        int line = lines.lineOf(t.spanStart);
        String indent = lines.indentationOf(line);
        String body = t.reindent(code, indent);
        if (lines.startsLine(t.spanStart)) {
            return Collections.singletonList(TextSplice.insert(lines.lineStart(line),
                    indent + body + (t.inList() ? "," : "") + lines.lineSeparator()));
        }
        return Collections.singletonList(TextSplice.insert(t.spanStart, body + (t.inList() ? ", " : " ")));
    }

    private List<TextSplice> insertAfter(Target t, String code) {
        String text = t.text;
        LineIndex lines = t.lines;
        int end = t.spanEnd;
        int i = skipBlanks(text, end);
        boolean hasComma = t.inList() && i < text.length() && text.charAt(i) == ',';
        int after = hasComma ? i + 1 : end;
        int eol = lines.lineEnd(lines.lineOf(after));
        boolean endsLine = TextScanner.skipTrivia(text, after, eol) >= eol;
        String indent = lines.indentationOf(lines.lineOf(t.spanStart));
        String body = t.reindent(code, indent);

        List<TextSplice> out = new ArrayList<TextSplice>();
        if (endsLine) {
            if (t.inList() && !hasComma) {
                out.add(TextSplice.insert(end, ","));
            }
            out.add(TextSplice.insert(eol, lines.lineSeparator() + indent + body + (hasComma ? "," : "")));
        } else if (t.inList()) {
            out.add(hasComma ? TextSplice.insert(after, " " + body + ",") : TextSplice.insert(end, ", " + body));
        } else {
            out.add(TextSplice.insert(end, " " + body));
        }
        return out;
    }

    /**
     * Appends a named argument before the node's closing parenthesis, following its one-line or
     * one-argument-per-line layout.
     */
    private List<TextSplice> addArgument(Target t, String argument) {
        String text = t.text;
        LineIndex lines = t.lines;
        int open = t.node.getOpenParenOffset();
        int close = t.node.getEndOffset() - 1;
        int last = TextScanner.trimTrivia(text, open + 1, close);
        boolean noArguments = last <= open + 1;
        int openLine = lines.lineOf(open);
        int closeLine = lines.lineOf(close);
        boolean closeOwnsLine = closeLine != openLine && lines.startsLine(close);

        if (noArguments) {
            if (!closeOwnsLine) {
                return Collections.singletonList(new TextSplice(open + 1, close,
                        t.reindent(argument, lines.indentationOf(openLine))));
            }
            String indent = lines.indentationOf(closeLine) + indentUnit;
            return Collections.singletonList(TextSplice.insert(lines.lineStart(closeLine),
                    indent + t.reindent(argument, indent) + "," + lines.lineSeparator()));
        }
        boolean trailingComma = text.charAt(last - 1) == ',';
        if (closeOwnsLine) {
            int lastLine = lines.lineOf(last - 1);
            String indent = lastLine == openLine
                    ? lines.indentationOf(closeLine) + indentUnit
                    : lines.indentationOf(lastLine);
            List<TextSplice> out = new ArrayList<TextSplice>();
            if (!trailingComma) {
                out.add(TextSplice.insert(last, ","));
            }
            out.add(TextSplice.insert(lines.lineStart(closeLine),
                    indent + t.reindent(argument, indent) + "," + lines.lineSeparator()));
            return out;
        }
        String body = t.reindent(argument, lines.indentationOf(openLine));
        return Collections.singletonList(TextSplice.insert(last, (trailingComma ? " " : ", ") + body));
    }

    private Target locate(String text, int targetLine) {
        if (targetLine < 1) {
            return null;
        }
        UiTreeNode root = parser.parse(text);
        Optional<UiTreeNode> found = root.findByStartLine(targetLine);
        if (!found.isPresent()) {
            return null;
        }
        UiTreeNode node = found.get();
        UiTreeNode parent = root.findParentOf(node).orElse(root);
        int spanStart = node.getStartOffset();
        for (NodeArgument argument : parent.getArguments()) {
            if (argument.getValueStart() == node.getStartOffset() && argument.getValueEnd() == node.getEndOffset()) {
                spanStart = argument.getStart();
                break;
            }
        }
        int enclosing = TextScanner.enclosingOpen(text, spanStart);
        LineIndex lines = new LineIndex(text);
        return new Target(text, lines, node, spanStart, node.getEndOffset(), enclosing,
                lines.indentationOf(node.getStartLine()));
    }

    private EditResult commit(String text, LineIndex lines, List<TextSplice> splices, String operation) {
        TextSplice primary = null;
        int primaryChange = 0;
        for (TextSplice splice : splices) {
            int change = StringUtils.countNewlines(splice.replacement)
                    - StringUtils.countNewlines(text, splice.start, splice.end);
            if (primary == null || Math.abs(change) > Math.abs(primaryChange)) {
                primary = splice;
                primaryChange = change;
            }
        }
        // descending by offset; at equal offsets the later splice goes in first so it ends up behind
        List<TextSplice> ordered = new ArrayList<TextSplice>(splices);
        Collections.reverse(ordered);
        ordered.sort(Comparator.comparingInt((TextSplice s) -> s.start).reversed());
        StringBuilder sb = new StringBuilder(text);
        for (TextSplice splice : ordered) {
            sb.replace(splice.start, splice.end, splice.replacement);
        }
        String newText = sb.toString();
        int delta = StringUtils.countNewlines(newText) - StringUtils.countNewlines(text);
        int changeLine = 0;
        if (primary != null) {
            int line = lines.lineOf(primary.start);
            boolean atLineStart = primary.start == lines.lineStart(line)
                    && !primary.replacement.startsWith(lines.lineSeparator());
            changeLine = atLineStart ? line : line + 1;
        }
        log.debug("editor.applied op={} delta={} changeLine={}", operation, delta, changeLine);
        return EditResult.applied(newText, delta, changeLine);
    }

    private static EditResult rejected(String text, String operation, Target target, EditFailure failure) {
        log.debug("editor.rejected op={} line={} node={} reason={}", operation, target.node.getStartLine(),
                target.node.getName(), failure);
        return EditResult.failed(text, failure);
    }

    private static void requireIdentifier(String name, String what) {
        if (StringUtils.isBlank(name) || !TextScanner.isIdentifierStart(name.trim().charAt(0))) {
            throw new IllegalArgumentException(what + " must be an identifier, got: " + name);
        }
    }

    private static EditResult notFound(String text, int targetLine) {
        log.debug("editor.rejected line={} reason={}", targetLine, EditFailure.TARGET_NOT_FOUND);
        return EditResult.failed(text, EditFailure.TARGET_NOT_FOUND);
    }

    private static int skipBlanks(String text, int from) {
        int i = from;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static int afterTypeArguments(String text, int lt) {
        int depth = 0;
        for (int i = lt; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return text.length();
    }

    private static final class Target {
        final String text;
        final LineIndex lines;
        final UiTreeNode node;
        final int spanStart;
        final int spanEnd;
        // innermost open bracket around the span, -1 at top level
        final int enclosing;
        final char context;
        // the node is the value of a named argument; spanStart is the argument name
        final boolean named;
        final String indent;

        Target(String text, LineIndex lines, UiTreeNode node, int spanStart, int spanEnd, int enclosing, String indent) {
            this.text = text;
            this.lines = lines;
            this.node = node;
            this.spanStart = spanStart;
            this.spanEnd = spanEnd;
            this.enclosing = enclosing;
            this.context = enclosing < 0 ? '\0' : text.charAt(enclosing);
            this.named = spanStart != node.getStartOffset();
            this.indent = indent;
        }

        boolean inList() {
            return context == '[' || context == '(';
        }

        String reindent(String code, String continuationIndent) {
            return StringUtils.indentContinuation(code, continuationIndent, lines.lineSeparator());
        }
    }
}
