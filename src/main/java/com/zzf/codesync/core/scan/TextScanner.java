package com.zzf.codesync.core.scan;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Forward cursor over UI-description source that classifies every character as code, string or comment
 * and keeps running bracket counts for code characters only.
 *
 * <p>Single/double quoted strings honor {@code \'}, {@code \"} and {@code \\}; triple-quoted and raw
 * ({@code r'...'}) strings are recognized as well. Unterminated strings and comments run to end of input.
 * A {@code ${...}} interpolation in a non-raw string is scanned as code, so quotes inside it open nested
 * strings, but all of its characters are reported as part of the enclosing string literal.
 * A scanner instance is cheap and holds nothing but its cursor, so every caller creates its own.
 */
public final class TextScanner {

    private final String text;
    private int pos;
    private CharClass mode = CharClass.CODE;

    private char quote;
    private boolean tripleQuoted;
    private boolean rawString;
    private boolean escapePending;
    // delimiter characters (''' or */ tails) still to be consumed in the current mode
    private int pendingDelimiterChars;
    private boolean leaveAfterDelimiter;

    private int parenDepth;
    private int bracketDepth;
    private int braceDepth;

    // innermost first; empty outside of any ${...}
    private final Deque<Interpolation> interpolations = new ArrayDeque<Interpolation>();

    public TextScanner(String text) {
        this(text, 0);
    }

    /**
     * @param startOffset offset to start from; the character there is assumed to be normal code
     */
    public TextScanner(String text, int startOffset) {
        this.text = text == null ? "" : text;
        this.pos = Math.max(0, Math.min(startOffset, this.text.length()));
    }

    public boolean hasNext() {
        return pos < text.length();
    }

    /**
     * Offset of the next character {@link #advance()} will consume.
     */
    public int position() {
        return pos;
    }

    /**
     * Class the next character will be consumed in, before any delimiter it may start.
     */
    public CharClass mode() {
        return interpolations.isEmpty() ? mode : CharClass.STRING;
    }

    public int depth() {
        return parenDepth + bracketDepth + braceDepth;
    }

    /**
     * Consumes one character and returns its class.
     */
    public CharClass advance() {
        char c = text.charAt(pos);
        boolean embedded = !interpolations.isEmpty();
        CharClass cls;
        switch (mode) {
            case STRING:
                cls = advanceString(c);
                break;
            case LINE_COMMENT:
                cls = advanceLineComment(c);
                break;
            case BLOCK_COMMENT:
                cls = advanceBlockComment(c);
                break;
            default:
                cls = advanceCode(c);
                break;
        }
        pos++;
        return embedded ? CharClass.STRING : cls;
    }

    private CharClass advanceCode(char c) {
        if (c == '/' && peek(1) == '/') {
            mode = CharClass.LINE_COMMENT;
            return CharClass.LINE_COMMENT;
        }
        if (c == '/' && peek(1) == '*') {
            mode = CharClass.BLOCK_COMMENT;
            pendingDelimiterChars = 1;
            leaveAfterDelimiter = false;
            return CharClass.BLOCK_COMMENT;
        }
        if (c == '\'' || c == '"') {
            openString(c);
            return CharClass.STRING;
        }
        Interpolation interpolation = interpolations.peek();
        if (interpolation != null) {
            if (c == '{') {
                interpolation.braces++;
            } else if (c == '}' && --interpolation.braces == 0) {
                interpolations.pop();
                interpolation.resume();
            }
            return CharClass.CODE;
        }
        switch (c) {
            case '(':
                parenDepth++;
                break;
            case ')':
                parenDepth = Math.max(0, parenDepth - 1);
                break;
            case '[':
                bracketDepth++;
                break;
            case ']':
                bracketDepth = Math.max(0, bracketDepth - 1);
                break;
            case '{':
                braceDepth++;
                break;
            case '}':
                braceDepth = Math.max(0, braceDepth - 1);
                break;
            default:
                break;
        }
        return CharClass.CODE;
    }

    private void openString(char c) {
        mode = CharClass.STRING;
        quote = c;
        escapePending = false;
        rawString = pos > 0 && text.charAt(pos - 1) == 'r'
                && (pos < 2 || !isIdentifierPart(text.charAt(pos - 2)));
        tripleQuoted = peek(1) == c && peek(2) == c;
        pendingDelimiterChars = tripleQuoted ? 2 : 0;
        leaveAfterDelimiter = false;
    }

    private CharClass advanceString(char c) {
        if (pendingDelimiterChars > 0) {
            consumeDelimiterChar();
            return CharClass.STRING;
        }
        if (escapePending) {
            escapePending = false;
            return CharClass.STRING;
        }
        if (c == '\\' && !rawString) {
            escapePending = true;
            return CharClass.STRING;
        }
        if (c == '$' && !rawString && peek(1) == '{') {
            interpolations.push(new Interpolation(quote, tripleQuoted));
            mode = CharClass.CODE;
            return CharClass.STRING;
        }
        if (c == quote) {
            if (!tripleQuoted) {
                mode = CharClass.CODE;
            } else if (peek(1) == quote && peek(2) == quote) {
                pendingDelimiterChars = 2;
                leaveAfterDelimiter = true;
            }
        }
        return CharClass.STRING;
    }

    private CharClass advanceLineComment(char c) {
        if (c == '\n') {
            mode = CharClass.CODE;
            return CharClass.CODE;
        }
        return CharClass.LINE_COMMENT;
    }

    private CharClass advanceBlockComment(char c) {
        if (pendingDelimiterChars > 0) {
            consumeDelimiterChar();
            return CharClass.BLOCK_COMMENT;
        }
        if (c == '*' && peek(1) == '/') {
            pendingDelimiterChars = 1;
            leaveAfterDelimiter = true;
        }
        return CharClass.BLOCK_COMMENT;
    }

    private void consumeDelimiterChar() {
        pendingDelimiterChars--;
        if (pendingDelimiterChars == 0 && leaveAfterDelimiter) {
            leaveAfterDelimiter = false;
            mode = CharClass.CODE;
        }
    }

    /**
     * The string an interpolation returns to once its closing brace is consumed.
     */
    private final class Interpolation {
        final char quote;
        final boolean tripleQuoted;
        int braces;

        Interpolation(char quote, boolean tripleQuoted) {
            this.quote = quote;
            this.tripleQuoted = tripleQuoted;
        }

        void resume() {
            TextScanner.this.mode = CharClass.STRING;
            TextScanner.this.quote = quote;
            TextScanner.this.tripleQuoted = tripleQuoted;
            TextScanner.this.rawString = false;
            TextScanner.this.escapePending = false;
            TextScanner.this.pendingDelimiterChars = 0;
            TextScanner.this.leaveAfterDelimiter = false;
        }
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    public static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    public static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    public static boolean isOpenBracket(char c) {
        return c == '(' || c == '[' || c == '{';
    }

    public static boolean isCloseBracket(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    public static char closerOf(char open) {
        switch (open) {
            case '(':
                return ')';
            case '[':
                return ']';
            case '{':
                return '}';
            default:
                return '\0';
        }
    }

    public static char openerOf(char close) {
        switch (close) {
            case ')':
                return '(';
            case ']':
                return '[';
            case '}':
                return '{';
            default:
                return '\0';
        }
    }

    /**
     * Classifies every character of {@code text}.
     */
    public static CharClass[] classify(String text) {
        TextScanner scanner = new TextScanner(text);
        CharClass[] out = new CharClass[scanner.text.length()];
        while (scanner.hasNext()) {
            int at = scanner.position();
            out[at] = scanner.advance();
        }
        return out;
    }

    /**
     * Offset of the bracket closing the one at {@code openOffset}, or -1 when it is never closed.
     */
    public static int findMatchingClose(String text, int openOffset) {
        if (text == null || openOffset < 0 || openOffset >= text.length()) {
            return -1;
        }
        char open = text.charAt(openOffset);
        char close = closerOf(open);
        if (close == '\0') {
            return -1;
        }
        TextScanner scanner = new TextScanner(text, openOffset);
        int depth = 0;
        while (scanner.hasNext()) {
            int at = scanner.position();
            if (scanner.advance() != CharClass.CODE) {
                continue;
            }
            char c = text.charAt(at);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return at;
                }
            }
        }
        return -1;
    }

    /**
     * Total bracket depth of code just before {@code offset}.
     */
    public static int depthAt(String text, int offset) {
        TextScanner scanner = new TextScanner(text);
        while (scanner.hasNext() && scanner.position() < offset) {
            scanner.advance();
        }
        return scanner.depth();
    }

    /**
     * Offset of the innermost bracket that is still open just before {@code offset}, or -1 at top level.
     * A closing bracket pops back to its nearest matching opener; one without an opener is ignored.
     */
    public static int enclosingOpen(String text, int offset) {
        Deque<Integer> open = new ArrayDeque<Integer>();
        TextScanner scanner = new TextScanner(text);
        while (scanner.hasNext() && scanner.position() < offset) {
            int at = scanner.position();
            if (scanner.advance() != CharClass.CODE) {
                continue;
            }
            char c = text.charAt(at);
            if (isOpenBracket(c)) {
                open.push(at);
            } else if (isCloseBracket(c)) {
                popTo(text, open, openerOf(c));
            }
        }
        return open.isEmpty() ? -1 : open.peek();
    }

    private static void popTo(String text, Deque<Integer> open, char opener) {
        for (Integer candidate : open) {
            if (text.charAt(candidate) == opener) {
                while (!open.isEmpty()) {
                    if (open.pop().equals(candidate)) {
                        return;
                    }
                }
            }
        }
    }

    /**
     * First offset in {@code [from, to)} that holds a non-blank code character, skipping whitespace and
     * comments; {@code to} when there is none.
     */
    public static int skipTrivia(String text, int from, int to) {
        TextScanner scanner = new TextScanner(text, from);
        while (scanner.hasNext() && scanner.position() < to) {
            int at = scanner.position();
            CharClass cls = scanner.advance();
            if (cls == CharClass.STRING) {
                return at;
            }
            if (cls == CharClass.CODE && !Character.isWhitespace(text.charAt(at))) {
                return at;
            }
        }
        return to;
    }

    /**
     * End (exclusive) of the last non-blank code or string character in {@code [from, to)}; {@code from}
     * when the range holds only whitespace and comments.
     */
    public static int trimTrivia(String text, int from, int to) {
        TextScanner scanner = new TextScanner(text, from);
        int end = from;
        while (scanner.hasNext() && scanner.position() < to) {
            int at = scanner.position();
            CharClass cls = scanner.advance();
            if (cls == CharClass.STRING || (cls == CharClass.CODE && !Character.isWhitespace(text.charAt(at)))) {
                end = at + 1;
            }
        }
        return end;
    }
}
