package com.tyron.padj.api.history;

import java.io.IOException;

/**
 * Thrown when the persistent history or session store cannot be opened, read or written.
 */
public class HistoryStorageException extends IOException {

    public HistoryStorageException(String message) {
        super(message);
    }

    public HistoryStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
