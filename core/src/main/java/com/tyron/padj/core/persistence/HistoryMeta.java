package com.tyron.padj.core.persistence;

/**
 * Per-document metadata stored next to the edit groups.
 *
 * @param nextSeq   seq the next sealed group will get
 * @param cursorSeq seq of the first group that is not applied (redoable), or {@code nextSeq}
 *                  when the undo cursor is at the end
 */
public record HistoryMeta(long nextSeq, long cursorSeq) {
}
