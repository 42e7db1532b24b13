package com.tyron.padj.api.history;

import com.tyron.padj.api.editor.Document;

import java.util.List;

/**
 * Result of an undo or redo: operations to apply in list order, and the caret to restore afterwards.
 */
public record HistoryStep(List<EditOperation> operations, CursorSnapshot cursor) {

    public HistoryStep {
        operations = List.copyOf(operations);
    }

    public void applyTo(Document document) {
        for (EditOperation op : operations) {
            op.applyTo(document);
        }
    }
}
