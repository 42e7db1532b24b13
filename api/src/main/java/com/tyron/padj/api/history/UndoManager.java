package com.tyron.padj.api.history;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-document undo/redo history as seen by the editing layer.
 * <p>
 * The history is a linear stack of {@link EditGroup}s with an undo cursor separating applied
 * steps from redoable ones. Recording a new edit while redo steps exist discards them.
 * <p>
 * History is best-effort relative to the document text: an edit passed to {@link #record}
 * is always kept, even when persisting older groups fails.
 */
public interface UndoManager {

    /**
     * @return the stable identifier this history is stored under.
     */
    String docId();

    /**
     * Records an edit at the current time.
     *
     * @throws HistoryStorageException if spilling or evicting on disk failed; the edit itself was recorded.
     */
    void record(EditOperation op) throws HistoryStorageException;

    /**
     * Records an edit that happened at {@code now}. Grouping decisions compare {@code now}
     * with the time of the previous edit.
     */
    void record(EditOperation op, Instant now) throws HistoryStorageException;

    /**
     * Closes the group being built, so the next edit starts a new undo step.
     */
    void forceGroupBreak() throws HistoryStorageException;

    /**
     * @return inverted operations of the most recent applied group, in application order, and
     * the caret before that group; empty if there is nothing to undo.
     */
    Optional<HistoryStep> undo();

    /**
     * @return the operations of the next undone group and the caret after it; empty if there
     * is nothing to redo.
     */
    Optional<HistoryStep> redo();

    boolean canUndo();

    boolean canRedo();

    /**
     * Commits buffered history to disk. No-op for memory-only histories.
     */
    void flush() throws HistoryStorageException;

    /**
     * Removes all history for this document, in memory and on disk.
     */
    void deleteHistory() throws HistoryStorageException;
}
