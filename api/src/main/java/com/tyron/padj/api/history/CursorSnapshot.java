package com.tyron.padj.api.history;

/**
 * Caret position captured before or after an edit.
 *
 * @param line 0-indexed line number
 * @param col  0-indexed column, counted in UTF-16 code units within the line
 */
public record CursorSnapshot(int line, int col) {

    public static final CursorSnapshot ORIGIN = new CursorSnapshot(0, 0);

    public CursorSnapshot {
        if (line < 0 || col < 0) {
            throw new IllegalArgumentException("line=" + line + " col=" + col + " must be >= 0");
        }
    }
}
