package com.tyron.padj.core.editor;

import com.tyron.padj.core.editor.document.InMemoryDocument;
import com.tyron.padj.core.history.DefaultGroupingPolicy;
import com.tyron.padj.core.history.HistoryConfig;
import com.tyron.padj.core.history.UndoManagerImpl;
import com.tyron.padj.testFramework.BaseHistoryTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextEditorModelTest extends BaseHistoryTest {

    private InMemoryDocument document;
    private UndoManagerImpl history;
    private TextEditorModel editor;

    @Override
    protected void beforeEach() {
        createEditor("");
    }

    private void createEditor(String text) {
        document = new InMemoryDocument(text);
        history = new UndoManagerImpl("unsaved-0", HistoryConfig.defaults(dataDir), null, DefaultGroupingPolicy.INSTANCE, clock);
        editor = new TextEditorModel(document, history);
    }

    private void typeChars(String text) {
        for (char c : text.toCharArray()) {
            editor.type(String.valueOf(c));
            clock.advanceMillis(50);
        }
    }

    @Test
    public void typedWordUndoesAtOnce() {
        typeChars("hello");
        assertEquals("hello", document.getText());
        assertEquals(5, editor.getCaret());

        assertTrue(editor.undo());

        assertEquals("", document.getText());
        assertEquals(0, editor.getCaret());
        assertFalse(editor.undo());
    }

    @Test
    public void pauseSplitsTyping() {
        typeChars("ab");
        clock.advanceMillis(1_000);
        typeChars("cd");

        editor.undo();
        assertEquals("ab", document.getText());
        editor.undo();
        assertEquals("", document.getText());
    }

    @Test
    public void redoReappliesAndRestoresCaret() {
        typeChars("one");
        editor.undo();

        assertTrue(editor.redo());

        assertEquals("one", document.getText());
        assertEquals(3, editor.getCaret());
        assertFalse(editor.redo());
    }

    @Test
    public void backspaceRunIsOneStep() {
        createEditor("abcdef");
        editor.moveCaret(6);

        for (int i = 0; i < 3; i++) {
            assertTrue(editor.backspace());
            clock.advanceMillis(50);
        }
        assertEquals("abc", document.getText());

        editor.undo();
        assertEquals("abcdef", document.getText());
        assertEquals(6, editor.getCaret());
    }

    @Test
    public void forwardDeleteRunIsOneStep() {
        createEditor("abc");

        assertTrue(editor.deleteForward());
        assertTrue(editor.deleteForward());
        assertEquals("c", document.getText());
        assertEquals(0, editor.getCaret());

        editor.undo();
        assertEquals("abc", document.getText());
        assertEquals(0, editor.getCaret());
    }

    @Test
    public void deletesAtDocumentEdges() {
        createEditor("x");

        assertFalse(editor.backspace());
        editor.moveCaret(1);
        assertFalse(editor.deleteForward());
        assertFalse(history.canUndo());
    }

    @Test
    public void surrogatePairIsDeletedWhole() {
        typeChars("a");
        editor.type("😀");
        clock.advanceMillis(50);

        assertTrue(editor.backspace());

        assertEquals("a", document.getText());
        editor.undo();
        assertEquals("a😀", document.getText());
    }

    @Test
    public void pasteIsSeparateFromTyping() {
        typeChars("ab");
        editor.paste("X");
        typeChars("cd");
        assertEquals("abXcd", document.getText());

        editor.undo();
        assertEquals("abX", document.getText());
        editor.undo();
        assertEquals("ab", document.getText());
        editor.undo();
        assertEquals("", document.getText());
    }

    @Test
    public void caretJumpEndsStep() {
        typeChars("ab");
        editor.moveCaret(0);
        typeChars("x");
        assertEquals("xab", document.getText());

        editor.undo();
        assertEquals("ab", document.getText());
        assertEquals(0, editor.getCaret());
        editor.undo();
        assertEquals("", document.getText());
    }

    @Test
    public void replaceAcrossLines() {
        createEditor("first\nsecond\nthird");

        editor.replace(6, 12, "2nd");
        assertEquals("first\n2nd\nthird", document.getText());
        assertEquals(9, editor.getCaret());
        assertEquals(1, editor.getCaretPosition().line());

        editor.undo();
        assertEquals("first\nsecond\nthird", document.getText());
        assertEquals(0, editor.getCaret());
    }

    @Test
    public void modifiedFlagFollowsEdits() {
        assertFalse(editor.isModified());

        typeChars("a");
        assertTrue(editor.isModified());

        editor.markSaved();
        assertFalse(editor.isModified());

        editor.undo();
        assertTrue(editor.isModified());
        assertEquals(0, document.getTextLength());
    }
}
