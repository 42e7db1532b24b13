package com.tyron.padj.core.session;

import com.tyron.padj.api.history.HistoryStorageException;
import com.tyron.padj.api.session.SessionData;
import com.tyron.padj.api.session.SessionStore;
import com.tyron.padj.core.persistence.CorruptedEntryException;
import com.tyron.padj.core.persistence.PersistenceLayer;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SessionStore} kept in the history database.
 * <p>
 * Uses two reserved namespaces, {@value #META_NAMESPACE} and {@value #CONTENT_NAMESPACE}. Document
 * ids never start with {@code '@'}, so session entries cannot collide with document history.
 */
public final class SessionStoreImpl implements SessionStore {

    private static final Logger LOG = Logger.getLogger(SessionStoreImpl.class.getName());

    public static final String META_NAMESPACE = "@session/meta";
    public static final String CONTENT_NAMESPACE = "@session/content";

    static final String SESSION_KEY = "data";

    private final PersistenceLayer persistence;

    public SessionStoreImpl(@NotNull PersistenceLayer persistence) {
        this.persistence = Objects.requireNonNull(persistence, "persistence");
    }

    @Override
    public void saveSession(@NotNull SessionData data) throws HistoryStorageException {
        Objects.requireNonNull(data, "data");
        persistence.put(META_NAMESPACE, SESSION_KEY, SessionCodec.encode(data));
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("session saved tabs=" + data.tabs().size() + " active=" + data.activeTabIndex());
        }
    }

    /**
     * @return the saved session; empty if none was saved or the stored value cannot be decoded.
     */
    @Override
    public Optional<SessionData> loadSession() throws HistoryStorageException {
        byte[] bytes = persistence.get(META_NAMESPACE, SESSION_KEY);
        if (bytes == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(SessionCodec.decode(bytes));
        } catch (CorruptedEntryException e) {
            LOG.log(Level.WARNING, "session ignored reason=undecodable", e);
            return Optional.empty();
        }
    }

    @Override
    public void saveContent(@NotNull String sessionId, @NotNull String content) throws HistoryStorageException {
        Objects.requireNonNull(content, "content");
        persistence.put(CONTENT_NAMESPACE, checkId(sessionId), content.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Optional<String> loadContent(@NotNull String sessionId) throws HistoryStorageException {
        byte[] bytes = persistence.get(CONTENT_NAMESPACE, checkId(sessionId));
        return bytes != null ? Optional.of(new String(bytes, StandardCharsets.UTF_8)) : Optional.empty();
    }

    @Override
    public void deleteContent(@NotNull String sessionId) throws HistoryStorageException {
        persistence.delete(CONTENT_NAMESPACE, checkId(sessionId));
    }

    @Override
    public void clearAllContent() throws HistoryStorageException {
        int removed = persistence.deleteAll(CONTENT_NAMESPACE);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("session content cleared entries=" + removed);
        }
    }

    private static String checkId(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        if (sessionId.isEmpty()) {
            throw new IllegalArgumentException("sessionId must not be empty");
        }
        return sessionId;
    }
}
