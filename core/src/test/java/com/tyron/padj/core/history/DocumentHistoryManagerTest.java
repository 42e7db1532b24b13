package com.tyron.padj.core.history;

import com.tyron.padj.api.history.UndoManager;
import com.tyron.padj.api.session.SessionData;
import com.tyron.padj.api.session.SessionStore;
import com.tyron.padj.api.session.TabEntry;
import com.tyron.padj.core.identity.DocumentIdentity;
import com.tyron.padj.testFramework.BaseHistoryTest;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.tyron.padj.testFramework.EditOps.insert;
import static org.junit.jupiter.api.Assertions.*;

public class DocumentHistoryManagerTest extends BaseHistoryTest {

    private DocumentHistoryManager manager;
    private Path file;

    @Override
    protected void beforeEach() throws Exception {
        file = Files.writeString(temporaryFolder.resolve("notes.txt"), "");
        manager = DocumentHistoryManager.create(dataDir);
    }

    @Override
    protected void afterEach() {
        manager.close();
    }

    private void restart() {
        manager.close();
        manager = DocumentHistoryManager.create(dataDir);
    }

    @Test
    public void fileHistorySurvivesRestart() throws Exception {
        UndoManager history = manager.openFile(file);
        assertEquals(DocumentIdentity.docIdForPath(file), history.docId());
        assertSame(history, manager.openFile(file));
        history.record(insert(0, "a"));
        history.forceGroupBreak();
        history.record(insert(1, "b"));

        restart();

        UndoManager restored = manager.openFile(file);
        assertEquals(List.of(insert(1, "b").inverse()), restored.undo().orElseThrow().operations());
        assertEquals(List.of(insert(0, "a").inverse()), restored.undo().orElseThrow().operations());
        assertFalse(restored.canUndo());
    }

    @Test
    public void explicitCloseDiscardsHistory() throws Exception {
        UndoManager history = manager.openFile(file);
        history.record(insert(0, "a"));
        history.flush();

        manager.close(history, true);

        assertFalse(manager.openFile(file).canUndo());
        restart();
        assertFalse(manager.openFile(file).canUndo());
    }

    @Test
    public void hiddenCloseKeepsHistory() throws Exception {
        UndoManager history = manager.openFile(file);
        history.record(insert(0, "a"));

        manager.close(history, false);

        UndoManager reopened = manager.openFile(file);
        assertNotSame(history, reopened);
        assertTrue(reopened.canUndo());
    }

    @Test
    public void unsavedIdsDoNotCollideWithStoredHistory() throws Exception {
        UndoManager first = manager.openUnsaved();
        assertEquals("unsaved-0", first.docId());
        first.record(insert(0, "draft"));

        restart();

        UndoManager fresh = manager.openUnsaved();
        assertNotEquals("unsaved-0", fresh.docId());
        assertFalse(fresh.canUndo());

        UndoManager restored = manager.openUnsaved("unsaved-0");
        assertEquals(List.of(insert(0, "draft").inverse()), restored.undo().orElseThrow().operations());
    }

    @Test
    public void openUnsavedRejectsFileIds() {
        assertThrows(IllegalArgumentException.class, () -> manager.openUnsaved("file-0000000000000001"));
    }

    @Test
    public void sessionStoreSharesTheDatabase() throws Exception {
        SessionStore sessions = manager.getSessionStore().orElseThrow();
        SessionData session = new SessionData(List.of(new TabEntry.File(file.toString()), new TabEntry.Unsaved("unsaved-0", "Untitled")), 1);
        sessions.saveSession(session);
        sessions.saveContent("unsaved-0", "draft");

        restart();

        SessionStore restored = manager.getSessionStore().orElseThrow();
        assertEquals(session, restored.loadSession().orElseThrow());
        assertEquals("draft", restored.loadContent("unsaved-0").orElseThrow());
    }

    @Test
    public void lockedStoreFallsBackToMemoryOnly() throws Exception {
        DocumentHistoryManager second = DocumentHistoryManager.create(dataDir);
        try {
            assertTrue(manager.isPersistent());
            assertFalse(second.isPersistent());
            assertTrue(second.getSessionStore().isEmpty());

            UndoManager history = second.openFile(file);
            history.record(insert(0, "a"));
            history.flush();
            assertTrue(history.undo().isPresent());
        } finally {
            second.close();
        }
    }

    @Test
    public void configComesFromDataDir() throws Exception {
        manager.close();
        Files.writeString(dataDir.resolve(HistoryConfigLoader.CONFIG_FILE_NAME), "hotCapacity: 3\n");

        manager = DocumentHistoryManager.create(dataDir);

        assertEquals(3, manager.getConfig().hotCapacity());
    }

    @Test
    public void closedManagerRejectsOpens() {
        manager.close();

        assertThrows(IllegalStateException.class, () -> manager.openFile(file));
        assertEquals(0, manager.flushAll());
    }
}
