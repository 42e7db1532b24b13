package com.tyron.padj.core.persistence;

import com.tyron.padj.api.history.HistoryStorageException;

/**
 * A stored value could not be decoded (truncated write, format drift, foreign data).
 */
public class CorruptedEntryException extends HistoryStorageException {

    public CorruptedEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
