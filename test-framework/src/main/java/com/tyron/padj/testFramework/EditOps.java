package com.tyron.padj.testFramework;

import com.tyron.padj.api.history.CursorSnapshot;
import com.tyron.padj.api.history.EditGroup;
import com.tyron.padj.api.history.EditOperation;

import java.util.List;

/**
 * Builders for single-line edit operations, where the column equals the offset.
 */
public final class EditOps {

    private EditOps() {
    }

    public static CursorSnapshot col(int col) {
        return new CursorSnapshot(0, col);
    }

    /**
     * Typing {@code text} at {@code position}; the caret ends after it.
     */
    public static EditOperation insert(int position, String text) {
        return EditOperation.insert(position, text, col(position), col(position + text.length()));
    }

    /**
     * Backspace of {@code text}, which ended at the caret; the caret moves to {@code position}.
     */
    public static EditOperation backspace(int position, String text) {
        return EditOperation.delete(position, text, col(position + text.length()), col(position));
    }

    /**
     * Forward delete of {@code text} at {@code position}; the caret stays.
     */
    public static EditOperation deleteForward(int position, String text) {
        return EditOperation.delete(position, text, col(position), col(position));
    }

    public static EditOperation replace(int position, String deleted, String inserted) {
        return new EditOperation(position, inserted, deleted, col(position + deleted.length()), col(position + inserted.length()));
    }

    public static EditGroup group(long seq, EditOperation... ops) {
        return new EditGroup(seq, List.of(ops));
    }
}
