package com.tyron.padj.api.session;

import com.tyron.padj.api.history.HistoryStorageException;

import java.util.Optional;

/**
 * Persists the open tabs and the content of unsaved tabs across application restarts.
 * <p>
 * Session metadata and tab content are independent: clearing content never touches the
 * saved {@link SessionData}. Deleting an absent key succeeds.
 */
public interface SessionStore {

    /**
     * Replaces the saved session (last write wins).
     */
    void saveSession(SessionData data) throws HistoryStorageException;

    Optional<SessionData> loadSession() throws HistoryStorageException;

    void saveContent(String sessionId, String content) throws HistoryStorageException;

    Optional<String> loadContent(String sessionId) throws HistoryStorageException;

    void deleteContent(String sessionId) throws HistoryStorageException;

    /**
     * Removes every stored content entry; session metadata is left untouched.
     */
    void clearAllContent() throws HistoryStorageException;
}
