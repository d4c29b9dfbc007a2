package com.zzf.codesync.core.edit;

import com.zzf.codesync.core.tree.UiTreeParser;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StructuralEditorTest {

    private final StructuralEditor editor = new StructuralEditor();

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    private static final String COLUMN = lines(
            "Column(",
            "  children: [",
            "    Text('A'),",
            "    Text('B'),",
            "  ],",
            ")");

    private static final String INLINE_ROW = lines(
            "Row(",
            "  children: [Text('a'), Text('b')],",
            ")");

    @Test
    public void testInsertChildIntoEmptyList() {
        EditResult result = editor.apply("Column(children: [])", 1, "Text('New')", InsertPosition.AS_CHILD);
        assertTrue(result.isApplied());
        assertEquals("Column(children: [Text('New')])", result.getNewText());
        assertEquals(0, result.getLinesDelta());
    }

    @Test
    public void testInsertChildIntoTypedList() {
        EditResult result = editor.apply("Column(children: <Widget>[])", 1, "Text('New')", InsertPosition.AS_CHILD);
        assertEquals("Column(children: <Widget>[Text('New')])", result.getNewText());
    }

    @Test
    public void testInsertChildIntoMultiLineList() {
        EditResult result = editor.apply(COLUMN, 1, "Text('New')", InsertPosition.AS_CHILD);
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Text('New'),",
                "    Text('A'),",
                "    Text('B'),",
                "  ],",
                ")"), result.getNewText());
        assertEquals(1, result.getLinesDelta());
        assertEquals(3, result.getChangeLine());
    }

    @Test
    public void testInsertChildIntoEmptyMultiLineList() {
        String code = lines(
                "Column(",
                "  children: <Widget>[",
                "  ],",
                ")");
        EditResult result = editor.apply(code, 1, "Text('x')", InsertPosition.AS_CHILD);
        assertEquals(lines(
                "Column(",
                "  children: <Widget>[",
                "    Text('x'),",
                "  ],",
                ")"), result.getNewText());
    }

    @Test
    public void testInsertChildIntoInlineList() {
        EditResult result = editor.apply(INLINE_ROW, 1, "Icon(Icons.add)", InsertPosition.AS_CHILD);
        assertEquals(lines(
                "Row(",
                "  children: [Icon(Icons.add), Text('a'), Text('b')],",
                ")"), result.getNewText());
    }

    @Test
    public void testMultiLineCodeIsIndentedAtTarget() {
        String inserted = "Padding(\n  padding: EdgeInsets.zero,\n  child: Text('p'),\n)";
        EditResult result = editor.apply(COLUMN, 1, inserted, InsertPosition.AS_CHILD);
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Padding(",
                "      padding: EdgeInsets.zero,",
                "      child: Text('p'),",
                "    ),",
                "    Text('A'),",
                "    Text('B'),",
                "  ],",
                ")"), result.getNewText());
        assertEquals(4, result.getLinesDelta());
    }

    @Test
    public void testNullChildSlotIsFilled() {
        EditResult result = editor.apply("Container(child: null)", 1, "Text('x')", InsertPosition.AS_CHILD);
        assertEquals("Container(child: Text('x'))", result.getNewText());
    }

    @Test
    public void testMissingSlotIsAddedForKnownContainers() {
        assertEquals("Center(child: Text('x'))",
                editor.apply("Center()", 1, "Text('x')", InsertPosition.AS_CHILD).getNewText());
        assertEquals("Row(mainAxisAlignment: MainAxisAlignment.center, children: [Text('x')])",
                editor.apply("Row(mainAxisAlignment: MainAxisAlignment.center)", 1, "Text('x')",
                        InsertPosition.AS_CHILD).getNewText());

        String multiLine = lines(
                "Column(",
                "  mainAxisSize: MainAxisSize.min,",
                ")");
        EditResult result = editor.apply(multiLine, 1, "Text('x')", InsertPosition.AS_CHILD);
        assertEquals(lines(
                "Column(",
                "  mainAxisSize: MainAxisSize.min,",
                "  children: [Text('x')],",
                ")"), result.getNewText());
        assertEquals(1, result.getLinesDelta());
        assertEquals(3, result.getChangeLine());
    }

    @Test
    public void testNoChildSlot() {
        String occupied = "Container(child: Text('a'))";
        EditResult result = editor.apply(occupied, 1, "Text('x')", InsertPosition.AS_CHILD);
        assertFalse(result.isApplied());
        assertEquals(EditFailure.NO_CHILD_SLOT, result.getFailure().get());
        assertSame(occupied, result.getNewText());

        EditResult leaf = editor.apply("Text('a')", 1, "Text('x')", InsertPosition.AS_CHILD);
        assertEquals(EditFailure.NO_CHILD_SLOT, leaf.getFailure().get());
        assertEquals(0, leaf.getLinesDelta());
    }

    @Test
    public void testTargetNotFoundLeavesTextUntouched() {
        for (int line : new int[]{0, 5, 99}) {
            EditResult result = editor.apply(COLUMN, line, "Text('x')", InsertPosition.AFTER);
            assertEquals(EditFailure.TARGET_NOT_FOUND, result.getFailure().get());
            assertEquals(COLUMN, result.getNewText());
        }
        assertEquals(EditFailure.TARGET_NOT_FOUND, editor.delete("", 1).getFailure().get());
    }

    @Test
    public void testInsertBeforeOnOwnLine() {
        EditResult result = editor.apply(COLUMN, 4, "Text('X')", InsertPosition.BEFORE);
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Text('A'),",
                "    Text('X'),",
                "    Text('B'),",
                "  ],",
                ")"), result.getNewText());
        assertEquals(4, result.getChangeLine());
    }

    @Test
    public void testInsertAfterOnOwnLine() {
        EditResult result = editor.apply(COLUMN, 3, "Text('X')", InsertPosition.AFTER);
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Text('A'),",
                "    Text('X'),",
                "    Text('B'),",
                "  ],",
                ")"), result.getNewText());
        assertEquals(1, result.getLinesDelta());
        assertEquals(4, result.getChangeLine());
    }

    @Test
    public void testInsertAfterLastElementWithoutComma() {
        String code = lines(
                "Column(",
                "  children: [",
                "    Text('A'),",
                "    Text('B')",
                "  ],",
                ")");
        EditResult result = editor.apply(code, 4, "Text('X')", InsertPosition.AFTER);
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Text('A'),",
                "    Text('B'),",
                "    Text('X')",
                "  ],",
                ")"), result.getNewText());
    }

    @Test
    public void testInlineSiblings() {
        assertEquals(lines(
                "Row(",
                "  children: [Text('x'), Text('a'), Text('b')],",
                ")"), editor.apply(INLINE_ROW, 2, "Text('x')", InsertPosition.BEFORE).getNewText());
        assertEquals(lines(
                "Row(",
                "  children: [Text('a'), Text('x'), Text('b')],",
                ")"), editor.apply(INLINE_ROW, 2, "Text('x')", InsertPosition.AFTER).getNewText());
    }

    @Test
    public void testTopLevelSiblingsAreLineSeparated() {
        EditResult result = editor.apply("Text('a')\n", 1, "Text('b')", InsertPosition.BEFORE);
        assertEquals("Text('b')\nText('a')\n", result.getNewText());
        assertEquals(1, result.getChangeLine());
    }

    @Test
    public void testReplace() {
        assertEquals(lines(
                "Row(",
                "  children: [Icon(Icons.star), Text('b')],",
                ")"), editor.apply(INLINE_ROW, 2, "Icon(Icons.star)", InsertPosition.REPLACE).getNewText());
    }

    @Test
    public void testBlankReplacementDeletes() {
        assertEquals(editor.delete(COLUMN, 3).getNewText(),
                editor.apply(COLUMN, 3, "  ", InsertPosition.REPLACE).getNewText());
        assertThrows(IllegalArgumentException.class, () -> editor.apply(COLUMN, 3, null, InsertPosition.AFTER));
    }

    @Test
    public void testDeleteWholeLine() {
        EditResult result = editor.delete(COLUMN, 4);
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Text('A'),",
                "  ],",
                ")"), result.getNewText());
        assertEquals(-1, result.getLinesDelta());
        assertEquals(4, result.getChangeLine());
    }

    @Test
    public void testDeleteInlineElement() {
        assertEquals(lines(
                "Row(",
                "  children: [Text('b')],",
                ")"), editor.delete(INLINE_ROW, 2).getNewText());
    }

    @Test
    public void testDeleteRemovesNamedArgument() {
        String code = lines(
                "Center(",
                "  child: Text('Hi'),",
                ")");
        assertEquals("Center(\n)\n", editor.delete(code, 2).getNewText());
    }

    @Test
    public void testDeleteMultiLineNode() {
        String code = lines(
                "Column(",
                "  children: [",
                "    const Padding(",
                "      padding: EdgeInsets.all(8),",
                "      child: Text('A'),",
                "    ),",
                "    Text('B'),",
                "  ],",
                ")");
        EditResult result = editor.delete(code, 3);
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Text('B'),",
                "  ],",
                ")"), result.getNewText());
        assertEquals(-4, result.getLinesDelta());
        assertEquals(3, result.getChangeLine());
    }

    @Test
    public void testStringsAndCommentsSurviveEdits() {
        String code = lines(
                "Column(",
                "  children: [",
                "    Text('List with \")\" item'),",
                "    // Container( commented out",
                "    /* Row( [ */",
                "    Text('B'),",
                "  ],",
                ")");
        EditResult deleted = editor.delete(code, 3);
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    // Container( commented out",
                "    /* Row( [ */",
                "    Text('B'),",
                "  ],",
                ")"), deleted.getNewText());

        EditResult after = editor.apply(code, 3, "Text('C')", InsertPosition.AFTER);
        assertTrue(after.getNewText().contains("    Text('List with \")\" item'),\n    Text('C'),\n    // Container("));
        assertTrue(after.getNewText().endsWith("    /* Row( [ */\n    Text('B'),\n  ],\n)\n"));
    }

    @Test
    public void testWrap() {
        String code = lines(
                "Center(",
                "  child: Text('Hi'),",
                ")");
        Map<String, String> props = new LinkedHashMap<>();
        props.put("padding", "EdgeInsets.all(8)");
        EditResult result = editor.wrap(code, 2, "Padding", props);
        assertEquals(lines(
                "Center(",
                "  child: Padding(",
                "    padding: EdgeInsets.all(8),",
                "    child: Text('Hi'),",
                "  ),",
                ")"), result.getNewText());
        assertEquals(3, result.getLinesDelta());
        assertEquals(3, result.getChangeLine());
    }

    @Test
    public void testWrapReindentsMultiLineNode() {
        String code = lines(
                "Column(",
                "  children: [",
                "    Container(",
                "      color: Colors.red,",
                "    ),",
                "  ],",
                ")");
        EditResult result = editor.wrap(code, 3, "Center", Collections.<String, String>emptyMap());
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Center(",
                "      child: Container(",
                "        color: Colors.red,",
                "      ),",
                "    ),",
                "  ],",
                ")"), result.getNewText());
        assertThrows(IllegalArgumentException.class, () -> editor.wrap(code, 3, "center", null));
    }

    @Test
    public void testUpdateProperty() {
        assertEquals("Container(color: Colors.blue, width: 10)",
                editor.updateProperty("Container(color: Colors.red, width: 10)", 1, "color", "Colors.blue")
                        .getNewText());
        assertEquals("Container(width: 10, height: 20)",
                editor.updateProperty("Container(width: 10)", 1, "height", "20").getNewText());
        assertEquals("Container(height: 20)",
                editor.updateProperty("Container()", 1, "height", "20").getNewText());

        String multiLine = lines(
                "Container(",
                "  width: 10,",
                ")");
        assertEquals(lines(
                "Container(",
                "  width: 10,",
                "  height: 20,",
                ")"), editor.updateProperty(multiLine, 1, "height", "20").getNewText());
        assertEquals(EditFailure.TARGET_NOT_FOUND,
                editor.updateProperty(multiLine, 2, "height", "20").getFailure().get());
    }

    @Test
    public void testCustomSlotNamesAndIndent() {
        StructuralEditor custom = new StructuralEditor(new UiTreeParser(), "\t", "items", "body");
        String code = "Column(\n\titems: [\n\t],\n)\n";
        assertEquals("Column(\n\titems: [\n\t\tText('x'),\n\t],\n)\n",
                custom.apply(code, 1, "Text('x')", InsertPosition.AS_CHILD).getNewText());
    }

    @Test
    public void testCrlfLineBreaksArePreserved() {
        String code = "Column(\r\n  children: [\r\n    Text('A'),\r\n  ],\r\n)\r\n";

        EditResult after = editor.apply(code, 3, "Text('B')", InsertPosition.AFTER);
        assertEquals("Column(\r\n  children: [\r\n    Text('A'),\r\n    Text('B'),\r\n  ],\r\n)\r\n",
                after.getNewText());
        assertEquals(1, after.getLinesDelta());

        EditResult asChild = editor.apply(code, 1, "Text('B')", InsertPosition.AS_CHILD);
        assertEquals("Column(\r\n  children: [\r\n    Text('B'),\r\n    Text('A'),\r\n  ],\r\n)\r\n",
                asChild.getNewText());
        assertEquals(3, asChild.getChangeLine());

        EditResult multiLine = editor.apply(code, 3, "Padding(\n  child: Text('p'),\n)", InsertPosition.BEFORE);
        assertFalse(multiLine.getNewText().replace("\r\n", "").contains("\n"), multiLine.getNewText());
        assertTrue(multiLine.getNewText().contains("    Padding(\r\n      child: Text('p'),\r\n    ),\r\n"));

        assertEquals("Column(\r\n  children: [\r\n  ],\r\n)\r\n", editor.delete(code, 3).getNewText());
        String wrapped = editor.wrap(code, 3, "Center", null).getNewText();
        assertFalse(wrapped.replace("\r\n", "").contains("\n"), wrapped);
    }

    @Test
    public void testDeleteLastLineWithoutTrailingBreak() {
        assertEquals("Text('a')", editor.delete("Text('a')\r\nText('b')", 2).getNewText());
        assertEquals("Text('a')", editor.delete("Text('a')\nText('b')", 2).getNewText());
    }

    @Test
    public void testWrapperPropertiesNeedValues() {
        Map<String, String> nullValue = new HashMap<>();
        nullValue.put("padding", null);
        assertThrows(IllegalArgumentException.class, () -> editor.wrap("Text('a')", 1, "Padding", nullValue));
        assertThrows(IllegalArgumentException.class,
                () -> editor.wrap("Text('a')", 1, "Padding", Collections.singletonMap("padding", " ")));
        assertThrows(IllegalArgumentException.class,
                () -> editor.wrap("Text('a')", 1, "Padding", Collections.singletonMap("1x", "2")));
    }

    @Test
    public void testNamedChildHasNoSiblingSlot() {
        String code = lines(
                "Container(",
                "  child: Text('a'),",
                ")");
        for (InsertPosition position : new InsertPosition[]{InsertPosition.BEFORE, InsertPosition.AFTER}) {
            EditResult result = editor.apply(code, 2, "Text('b')", position);
            assertEquals(EditFailure.NO_SIBLING_SLOT, result.getFailure().get());
            assertSame(code, result.getNewText());
        }
        assertEquals(lines(
                "Container(",
                "  child: Text('b'),",
                ")"), editor.apply(code, 2, "Text('b')", InsertPosition.REPLACE).getNewText());
    }

    @Test
    public void testInterpolatedStringsKeepSiblings() {
        String code = lines(
                "Column(",
                "  children: [",
                "    Text('${items.map((e) => '(').join()}'),",
                "    Text('b'),",
                "  ],",
                ")");
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Text('b'),",
                "  ],",
                ")"), editor.delete(code, 3).getNewText());
        assertEquals(lines(
                "Column(",
                "  children: [",
                "    Text('${items.map((e) => '(').join()}'),",
                "    Text('b'),",
                "    Text('c'),",
                "  ],",
                ")"), editor.apply(code, 4, "Text('c')", InsertPosition.AFTER).getNewText());
    }

    @Test
    public void testReorderSwapsMultiLineSiblings() {
        String code = lines(
                "Column(",
                "  children: [",
                "    Padding(",
                "      padding: EdgeInsets.all(8),",
                "      child: Text('A'),",
                "    ),",
                "    Text('B'),",
                "  ],",
                ")");
        String swapped = lines(
                "Column(",
                "  children: [",
                "    Text('B'),",
                "    Padding(",
                "      padding: EdgeInsets.all(8),",
                "      child: Text('A'),",
                "    ),",
                "  ],",
                ")");
        EditResult result = editor.reorder(code, 3, 7);
        assertTrue(result.isApplied());
        assertEquals(swapped, result.getNewText());
        assertEquals(0, result.getLinesDelta());
        assertEquals(swapped, editor.reorder(code, 7, 3).getNewText());
    }

    @Test
    public void testReorderRejectsNonSiblings() {
        String code = lines(
                "Column(",
                "  children: [",
                "    Padding(",
                "      padding: EdgeInsets.all(8),",
                "      child: Text('A'),",
                "    ),",
                "    Text('B'),",
                "  ],",
                ")");
        assertEquals(EditFailure.NOT_SIBLINGS, editor.reorder(code, 5, 7).getFailure().get());
        assertEquals(EditFailure.NOT_SIBLINGS, editor.reorder(code, 1, 7).getFailure().get());
        assertEquals(EditFailure.NOT_SIBLINGS, editor.reorder(code, 3, 3).getFailure().get());
        EditResult missing = editor.reorder(code, 3, 8);
        assertEquals(EditFailure.TARGET_NOT_FOUND, missing.getFailure().get());
        assertSame(code, missing.getNewText());
    }
}
