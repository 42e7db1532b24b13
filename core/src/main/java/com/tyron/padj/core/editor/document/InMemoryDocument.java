package com.tyron.padj.core.editor.document;

import com.tyron.padj.api.editor.DocumentEvent;
import com.tyron.padj.api.editor.DocumentListener;
import com.tyron.padj.api.editor.ObservableDocument;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ObservableDocument} backed by a {@link StringBuilder}.
 * <p>
 * Events carry the replaced text, so listeners can record reversible edits.
 * Text operations are synchronized on an internal lock; listeners run outside it.
 */
public final class InMemoryDocument implements ObservableDocument {

    private final Object lock = new Object();
    private final StringBuilder text;
    private final CopyOnWriteArrayList<DocumentListener> listeners = new CopyOnWriteArrayList<>();

    private volatile long modificationStamp;

    public InMemoryDocument() {
        this("");
    }

    public InMemoryDocument(String initialText) {
        this.text = new StringBuilder(initialText != null ? initialText : "");
    }

    @Override
    public String getText() {
        synchronized (lock) {
            return text.toString();
        }
    }

    @Override
    public int getTextLength() {
        synchronized (lock) {
            return text.length();
        }
    }

    @Override
    public void replace(int start, int end, String newText) {
        Objects.requireNonNull(newText, "text");

        DocumentEvent event;
        synchronized (lock) {
            int len = text.length();
            if (start < 0 || end < start || end > len) {
                throw new IndexOutOfBoundsException("replace range [" + start + ", " + end + ") is out of bounds for length=" + len);
            }
            if (start == end && newText.isEmpty()) {
                return;
            }

            String oldText = text.substring(start, end);
            text.replace(start, end, newText);
            modificationStamp++;
            event = new DocumentEvent(this, start, end, oldText, newText);
        }

        for (DocumentListener listener : listeners) {
            listener.documentChanged(event);
        }
    }

    @Override
    public void insertString(int offset, String insertedText) {
        replace(offset, offset, insertedText);
    }

    @Override
    public void deleteString(int start, int end) {
        replace(start, end, "");
    }

    @Override
    public String getText(int start, int length) {
        synchronized (lock) {
            int len = text.length();
            if (start < 0 || length < 0 || start + length > len) {
                throw new IndexOutOfBoundsException("getText start=" + start + " length=" + length + " is out of bounds for length=" + len);
            }
            return text.substring(start, start + length);
        }
    }

    @Override
    public void addDocumentListener(DocumentListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeDocumentListener(DocumentListener listener) {
        listeners.remove(listener);
    }

    @Override
    public long getModificationStamp() {
        return modificationStamp;
    }
}
