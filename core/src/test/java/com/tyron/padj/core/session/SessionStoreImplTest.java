package com.tyron.padj.core.session;

import com.tyron.padj.api.session.SessionData;
import com.tyron.padj.api.session.TabEntry;
import com.tyron.padj.core.persistence.PersistenceLayer;
import com.tyron.padj.testFramework.BaseHistoryTest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.google.common.truth.Truth.assertThat;

public class SessionStoreImplTest extends BaseHistoryTest {

    private PersistenceLayer layer;
    private SessionStoreImpl store;

    @Override
    protected void beforeEach() throws Exception {
        layer = PersistenceLayer.open(dataDir);
        store = new SessionStoreImpl(layer);
    }

    @Override
    protected void afterEach() {
        layer.close();
    }

    private void reopen() throws Exception {
        layer.close();
        layer = PersistenceLayer.open(dataDir);
        store = new SessionStoreImpl(layer);
    }

    @Test
    public void nothingSavedYet() throws Exception {
        assertThat(store.loadSession()).isEmpty();
        assertThat(store.loadContent("unsaved-0")).isEmpty();
    }

    @Test
    public void sessionSurvivesRestart() throws Exception {
        SessionData session = new SessionData(List.of(
                new TabEntry.File("/home/user/notes.txt"),
                new TabEntry.Unsaved("unsaved-3", "Untitled 1"),
                new TabEntry.File("C:\\work\\日本語.txt")), 1);

        store.saveSession(session);
        reopen();

        assertThat(store.loadSession()).hasValue(session);
    }

    @Test
    public void lastSessionWins() throws Exception {
        store.saveSession(new SessionData(List.of(new TabEntry.File("/a")), 0));
        SessionData latest = new SessionData(List.of(), 0);
        store.saveSession(latest);

        assertThat(store.loadSession()).hasValue(latest);
    }

    @Test
    public void contentSurvivesRestart() throws Exception {
        store.saveContent("unsaved-0", "first line\nsecond ✓ 😀");
        store.saveContent("unsaved-1", "");
        reopen();

        assertThat(store.loadContent("unsaved-0")).hasValue("first line\nsecond ✓ 😀");
        assertThat(store.loadContent("unsaved-1")).hasValue("");
    }

    @Test
    public void deleteContentRemovesOneEntry() throws Exception {
        store.saveContent("a", "1");
        store.saveContent("b", "2");

        store.deleteContent("a");
        store.deleteContent("missing");

        assertThat(store.loadContent("a")).isEmpty();
        assertThat(store.loadContent("b")).hasValue("2");
    }

    @Test
    public void clearAllContentKeepsSession() throws Exception {
        SessionData session = new SessionData(List.of(new TabEntry.Unsaved("a", "Untitled")), 0);
        store.saveSession(session);
        store.saveContent("a", "text");
        store.saveContent("b", "more");

        store.clearAllContent();

        assertThat(store.loadContent("a")).isEmpty();
        assertThat(store.loadContent("b")).isEmpty();
        assertThat(store.loadSession()).hasValue(session);
    }

    @Test
    public void undecodableSessionIsTreatedAsAbsent() throws Exception {
        layer.put(SessionStoreImpl.META_NAMESPACE, SessionStoreImpl.SESSION_KEY, new byte[]{42, 0, 1});

        assertThat(store.loadSession()).isEqualTo(Optional.empty());
    }

    @Test
    public void sessionEntriesAreNotDocuments() throws Exception {
        store.saveSession(new SessionData(List.of(new TabEntry.File("/a")), 0));
        store.saveContent("unsaved-0", "x");

        assertThat(layer.listDocuments()).isEmpty();
        assertThat(layer.countGroups("unsaved-0")).isEqualTo(0);
    }
}
