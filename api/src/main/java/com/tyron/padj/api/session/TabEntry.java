package com.tyron.padj.api.session;

import java.util.Objects;

/**
 * One tab of a saved session.
 */
public interface TabEntry {

    /**
     * A tab backed by a file on disk; reopened from its path.
     */
    record File(String path) implements TabEntry {
        public File {
            Objects.requireNonNull(path, "path");
        }
    }

    /**
     * An untitled tab whose text lives in the session store under {@code sessionId}.
     */
    record Unsaved(String sessionId, String title) implements TabEntry {
        public Unsaved {
            Objects.requireNonNull(sessionId, "sessionId");
            Objects.requireNonNull(title, "title");
        }
    }
}
