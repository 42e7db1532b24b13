package com.tyron.padj.api.editor;

/**
 * Abstract view of the text content.
 * <p>
 * Offsets are UTF-16 code unit indices, the same unit used by
 * {@link com.tyron.padj.api.history.EditOperation#position()}.
 */
public interface Document {
    String getText();
    int getTextLength();

    /**
     * Replaces text in the range [start, end).
     */
    void replace(int start, int end, String text);

    void insertString(int offset, String text);

    void deleteString(int start, int end);

    /**
     * @return The text in the given range.
     */
    String getText(int start, int length);
}
