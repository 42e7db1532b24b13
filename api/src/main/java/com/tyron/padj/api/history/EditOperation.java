package com.tyron.padj.api.history;

import com.tyron.padj.api.editor.Document;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A single atomic change to a document's character sequence.
 * <p>
 * {@code deleted} is the text removed at {@code position} (empty for a pure insertion) and
 * {@code inserted} is the text added there (empty for a pure deletion). Instances are never
 * mutated after the editing layer creates them.
 */
public record EditOperation(int position,
                            @NotNull String inserted,
                            @NotNull String deleted,
                            @NotNull CursorSnapshot cursorBefore,
                            @NotNull CursorSnapshot cursorAfter) {

    public EditOperation {
        if (position < 0) {
            throw new IllegalArgumentException("position=" + position + " must be >= 0");
        }
        Objects.requireNonNull(inserted, "inserted");
        Objects.requireNonNull(deleted, "deleted");
        Objects.requireNonNull(cursorBefore, "cursorBefore");
        Objects.requireNonNull(cursorAfter, "cursorAfter");
    }

    public static EditOperation insert(int position, String text, CursorSnapshot before, CursorSnapshot after) {
        return new EditOperation(position, text, "", before, after);
    }

    public static EditOperation delete(int position, String text, CursorSnapshot before, CursorSnapshot after) {
        return new EditOperation(position, "", text, before, after);
    }

    public boolean isInsertion() {
        return !inserted.isEmpty() && deleted.isEmpty();
    }

    public boolean isDeletion() {
        return inserted.isEmpty() && !deleted.isEmpty();
    }

    /**
     * @return the operation that reverts this one: texts and cursors swapped, same position.
     */
    public EditOperation inverse() {
        return new EditOperation(position, deleted, inserted, cursorAfter, cursorBefore);
    }

    /**
     * Replaces {@code deleted} at {@code position} with {@code inserted}.
     *
     * @throws IllegalStateException if the document does not contain {@code deleted} at {@code position}
     */
    public void applyTo(Document document) {
        int end = position + deleted.length();
        if (end > document.getTextLength()) {
            throw new IllegalStateException("Operation range [" + position + ", " + end
                    + ") exceeds document length=" + document.getTextLength());
        }
        if (!deleted.equals(document.getText(position, deleted.length()))) {
            throw new IllegalStateException("Document text at " + position + " does not match the recorded deletion");
        }
        document.replace(position, end, inserted);
    }
}
