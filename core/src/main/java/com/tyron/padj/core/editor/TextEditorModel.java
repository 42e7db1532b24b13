package com.tyron.padj.core.editor;

import com.tyron.padj.api.editor.DocumentListener;
import com.tyron.padj.api.editor.ObservableDocument;
import com.tyron.padj.api.history.CursorSnapshot;
import com.tyron.padj.api.history.EditOperation;
import com.tyron.padj.api.history.HistoryStep;
import com.tyron.padj.api.history.HistoryStorageException;
import com.tyron.padj.api.history.UndoManager;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Editing operations of one text tab: a document, its caret and its undo history.
 * <p>
 * Every mutation is recorded as an {@link EditOperation}. History write failures are logged and
 * never interrupt editing; the text change has already happened by then.
 */
public final class TextEditorModel {

    private static final Logger LOG = Logger.getLogger(TextEditorModel.class.getName());

    private final ObservableDocument document;
    private final UndoManager history;

    private int caret;
    private boolean modified;

    private final DocumentListener modificationListener = event -> modified = true;

    public TextEditorModel(@NotNull ObservableDocument document, @NotNull UndoManager history) {
        this.document = Objects.requireNonNull(document, "document");
        this.history = Objects.requireNonNull(history, "history");
        document.addDocumentListener(modificationListener);
    }

    public ObservableDocument getDocument() {
        return document;
    }

    public UndoManager getHistory() {
        return history;
    }

    public int getCaret() {
        return caret;
    }

    public CursorSnapshot getCaretPosition() {
        return TextPositions.toCursor(document.getText(), caret);
    }

    /**
     * Moves the caret without editing. A jump ends the current undo step.
     */
    public void moveCaret(int offset) {
        checkOffset(offset);
        if (offset != caret) {
            caret = offset;
            breakGroup();
        }
    }

    public void type(String text) {
        edit(caret, caret, text);
    }

    /**
     * Inserts {@code text} at the caret as an undo step of its own.
     */
    public void paste(String text) {
        breakGroup();
        edit(caret, caret, text);
        breakGroup();
    }

    /**
     * Deletes the character before the caret; a surrogate pair is deleted whole.
     *
     * @return false if the caret is at the start of the document
     */
    public boolean backspace() {
        if (caret == 0) {
            return false;
        }
        String text = document.getText();
        int start = caret - 1;
        if (start > 0 && Character.isLowSurrogate(text.charAt(start)) && Character.isHighSurrogate(text.charAt(start - 1))) {
            start--;
        }
        edit(start, caret, "");
        return true;
    }

    /**
     * Deletes the character after the caret; a surrogate pair is deleted whole.
     *
     * @return false if the caret is at the end of the document
     */
    public boolean deleteForward() {
        String text = document.getText();
        if (caret >= text.length()) {
            return false;
        }
        int end = caret + 1;
        if (end < text.length() && Character.isHighSurrogate(text.charAt(caret)) && Character.isLowSurrogate(text.charAt(end))) {
            end++;
        }
        edit(caret, end, "");
        return true;
    }

    /**
     * Replaces {@code [start, end)} with {@code text} as an undo step of its own, leaving the caret
     * after the inserted text.
     */
    public void replace(int start, int end, String text) {
        breakGroup();
        edit(start, end, text);
        breakGroup();
    }

    /**
     * @return true if a step was undone
     */
    public boolean undo() {
        return apply(history.undo());
    }

    /**
     * @return true if a step was redone
     */
    public boolean redo() {
        return apply(history.redo());
    }

    public boolean isModified() {
        return modified;
    }

    /**
     * Clears the modified flag after the document was written out, and ends the current undo step.
     */
    public void markSaved() {
        modified = false;
        breakGroup();
    }

    public void dispose() {
        document.removeDocumentListener(modificationListener);
    }

    private void edit(int start, int end, String text) {
        Objects.requireNonNull(text, "text");
        checkOffset(start);
        checkOffset(end);
        if (start > end) {
            throw new IllegalArgumentException("start=" + start + " > end=" + end);
        }
        if (start == end && text.isEmpty()) {
            return;
        }

        String before = document.getText();
        String deleted = before.substring(start, end);
        CursorSnapshot cursorBefore = TextPositions.toCursor(before, caret);

        document.replace(start, end, text);
        caret = start + text.length();

        CursorSnapshot cursorAfter = TextPositions.toCursor(document.getText(), caret);

        EditOperation op = new EditOperation(start, text, deleted, cursorBefore, cursorAfter);
        try {
            history.record(op);
        } catch (HistoryStorageException e) {
            LOG.log(Level.WARNING, "editor history write failed docId=" + history.docId(), e);
        }
    }

    private boolean apply(Optional<HistoryStep> step) {
        if (step.isEmpty()) {
            return false;
        }
        HistoryStep historyStep = step.get();
        historyStep.applyTo(document);
        caret = TextPositions.toOffset(document.getText(), historyStep.cursor());
        return true;
    }

    private void breakGroup() {
        try {
            history.forceGroupBreak();
        } catch (HistoryStorageException e) {
            LOG.log(Level.WARNING, "editor history write failed docId=" + history.docId(), e);
        }
    }

    private void checkOffset(int offset) {
        int length = document.getTextLength();
        if (offset < 0 || offset > length) {
            throw new IndexOutOfBoundsException("offset=" + offset + " length=" + length);
        }
    }
}
