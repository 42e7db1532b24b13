package com.tyron.padj.core.editor;

import com.tyron.padj.api.history.CursorSnapshot;

/**
 * Converts between document offsets and line/column carets.
 * <p>
 * Lines end at {@code '\n'}; a preceding {@code '\r'} counts as a character of the line.
 */
public final class TextPositions {

    private TextPositions() {
    }

    public static CursorSnapshot toCursor(CharSequence text, int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("offset=" + offset + " length=" + text.length());
        }
        int line = 0;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new CursorSnapshot(line, offset - lineStart);
    }

    /**
     * Offset of {@code cursor} in {@code text}. Lines past the end clamp to the end of the text,
     * columns past the end of their line clamp to the line end.
     */
    public static int toOffset(CharSequence text, CursorSnapshot cursor) {
        int lineStart = 0;
        for (int line = 0; line < cursor.line(); line++) {
            int newline = indexOf(text, '\n', lineStart);
            if (newline < 0) {
                return text.length();
            }
            lineStart = newline + 1;
        }

        int lineEnd = indexOf(text, '\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        return Math.min(lineStart + cursor.col(), lineEnd);
    }

    private static int indexOf(CharSequence text, char c, int from) {
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                return i;
            }
        }
        return -1;
    }
}
