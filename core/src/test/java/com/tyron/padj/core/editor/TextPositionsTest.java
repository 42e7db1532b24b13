package com.tyron.padj.core.editor;

import com.tyron.padj.api.history.CursorSnapshot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextPositionsTest {

    private static final String TEXT = "ab\ncde\n\nf";

    @Test
    public void offsetToCursor() {
        assertEquals(new CursorSnapshot(0, 0), TextPositions.toCursor(TEXT, 0));
        assertEquals(new CursorSnapshot(0, 2), TextPositions.toCursor(TEXT, 2));
        assertEquals(new CursorSnapshot(1, 0), TextPositions.toCursor(TEXT, 3));
        assertEquals(new CursorSnapshot(2, 0), TextPositions.toCursor(TEXT, 7));
        assertEquals(new CursorSnapshot(3, 1), TextPositions.toCursor(TEXT, TEXT.length()));
    }

    @Test
    public void cursorToOffset() {
        for (int offset = 0; offset <= TEXT.length(); offset++) {
            assertEquals(offset, TextPositions.toOffset(TEXT, TextPositions.toCursor(TEXT, offset)));
        }
    }

    @Test
    public void outOfRangeCursorIsClamped() {
        assertEquals(2, TextPositions.toOffset(TEXT, new CursorSnapshot(0, 99)));
        assertEquals(TEXT.length(), TextPositions.toOffset(TEXT, new CursorSnapshot(40, 0)));
        assertThrows(IndexOutOfBoundsException.class, () -> TextPositions.toCursor(TEXT, TEXT.length() + 1));
    }
}
