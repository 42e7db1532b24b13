package com.tyron.padj.core.history;

import com.tyron.padj.api.history.HistoryStorageException;
import com.tyron.padj.api.history.UndoManager;
import com.tyron.padj.api.session.SessionStore;
import com.tyron.padj.core.identity.DocumentIdentity;
import com.tyron.padj.core.persistence.PersistenceLayer;
import com.tyron.padj.core.session.SessionStoreImpl;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application-wide owner of document histories.
 * <p>
 * Holds the shared {@link PersistenceLayer} and hands out one {@link UndoManager} per open
 * document. If the store cannot be opened (another instance holds it, disk error) histories are
 * memory-only and no session store is available; editing works either way.
 */
public final class DocumentHistoryManager implements Closeable {

    private static final Logger LOG = Logger.getLogger(DocumentHistoryManager.class.getName());

    private final HistoryConfig config;
    private final DocumentIdentity identity = new DocumentIdentity();
    private final @Nullable PersistenceLayer persistence;
    private final @Nullable SessionStore sessionStore;

    private final Map<String, UndoManagerImpl> open = new LinkedHashMap<>();

    private boolean closed;

    public DocumentHistoryManager(@NotNull HistoryConfig config) {
        this.config = Objects.requireNonNull(config, "config");

        PersistenceLayer layer;
        try {
            layer = PersistenceLayer.open(config.dataDir());
        } catch (HistoryStorageException e) {
            LOG.log(Level.WARNING, "history store unavailable dir=" + config.dataDir() + ", history is memory-only", e);
            layer = null;
        }
        this.persistence = layer;
        this.sessionStore = layer != null ? new SessionStoreImpl(layer) : null;
    }

    /**
     * Opens the manager for the resolved data directory, reading {@code history.yaml} and
     * system property overrides.
     */
    public static DocumentHistoryManager create() {
        return create(DocumentIdentity.resolveDataDir());
    }

    public static DocumentHistoryManager create(Path dataDir) {
        return new DocumentHistoryManager(HistoryConfigLoader.load(dataDir));
    }

    public HistoryConfig getConfig() {
        return config;
    }

    public boolean isPersistent() {
        return persistence != null;
    }

    /**
     * @return the session store, or empty when the history store could not be opened.
     */
    public Optional<SessionStore> getSessionStore() {
        return Optional.ofNullable(sessionStore);
    }

    /**
     * History of the file at {@code path}, restored from disk if a previous run left some.
     */
    public synchronized UndoManager openFile(@NotNull Path path) {
        return open(DocumentIdentity.docIdForPath(path));
    }

    /**
     * History of a new untitled document. The id is fresh: never open and never stored before.
     */
    public synchronized UndoManager openUnsaved() {
        ensureOpen();
        String docId;
        do {
            docId = identity.generateUnsavedId();
        } while (open.containsKey(docId) || hasStoredHistory(docId));
        return open(docId);
    }

    /**
     * History of an untitled document restored from a previous session.
     */
    public synchronized UndoManager openUnsaved(@NotNull String docId) {
        if (!DocumentIdentity.isUnsavedId(docId)) {
            throw new IllegalArgumentException("Not an unsaved document id: " + docId);
        }
        return open(docId);
    }

    /**
     * Releases a document's history when its tab closes. An explicit close discards the
     * history; otherwise (the application is shutting down, the tab is hidden) it is flushed for
     * the next run. Storage errors are logged so the tab close always completes.
     */
    public synchronized void close(@NotNull UndoManager manager, boolean explicitClose) {
        Objects.requireNonNull(manager, "manager");
        open.remove(manager.docId());
        try {
            if (explicitClose) {
                manager.deleteHistory();
            } else {
                manager.flush();
            }
        } catch (HistoryStorageException e) {
            LOG.log(Level.WARNING, "history close failed docId=" + manager.docId() + " explicit=" + explicitClose, e);
        }
    }

    /**
     * Flushes every open history. Failures are logged per document.
     *
     * @return number of documents that failed to flush
     */
    public synchronized int flushAll() {
        int failed = 0;
        for (UndoManagerImpl manager : new ArrayList<>(open.values())) {
            try {
                manager.flush();
            } catch (HistoryStorageException e) {
                failed++;
                LOG.log(Level.WARNING, "history flush failed docId=" + manager.docId(), e);
            }
        }
        if (persistence != null && !persistence.isClosed()) {
            try {
                persistence.flush();
            } catch (HistoryStorageException e) {
                LOG.log(Level.WARNING, "history store flush failed dir=" + config.dataDir(), e);
            }
        }
        return failed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        int failed = flushAll();
        open.clear();
        closed = true;
        if (persistence != null) {
            persistence.close();
        }
        if (LOG.isLoggable(Level.INFO)) {
            LOG.info("history manager closed dir=" + config.dataDir() + " flushFailures=" + failed);
        }
    }

    private UndoManager open(String docId) {
        ensureOpen();
        return open.computeIfAbsent(docId, id -> UndoManagerImpl.loadOrNew(id, config, persistence));
    }

    private boolean hasStoredHistory(String docId) {
        if (persistence == null) {
            return false;
        }
        try {
            return persistence.loadMeta(docId) != null || persistence.countGroups(docId) > 0;
        } catch (HistoryStorageException e) {
            LOG.log(Level.WARNING, "history lookup failed docId=" + docId, e);
            return false;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("DocumentHistoryManager is closed");
        }
    }
}
