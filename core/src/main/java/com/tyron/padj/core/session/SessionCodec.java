package com.tyron.padj.core.session;

import com.tyron.padj.api.session.SessionData;
import com.tyron.padj.api.session.TabEntry;
import com.tyron.padj.core.persistence.CorruptedEntryException;
import com.tyron.padj.core.persistence.EditGroupCodec;
import org.mapdb.DataInput2;
import org.mapdb.DataOutput2;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary format of {@link SessionData}: {@code version:byte, activeTab:packed int, count:packed int},
 * then per tab a kind byte followed by its strings (packed UTF-8 length + bytes).
 */
final class SessionCodec {

    static final byte VERSION = 1;

    private static final byte KIND_FILE = 0;
    private static final byte KIND_UNSAVED = 1;

    private SessionCodec() {
    }

    static byte[] encode(SessionData data) {
        DataOutput2 out = new DataOutput2();
        try {
            out.writeByte(VERSION);
            out.packInt(data.activeTabIndex());
            out.packInt(data.tabs().size());
            for (TabEntry tab : data.tabs()) {
                if (tab instanceof TabEntry.File file) {
                    out.writeByte(KIND_FILE);
                    EditGroupCodec.writeString(out, file.path());
                } else if (tab instanceof TabEntry.Unsaved unsaved) {
                    out.writeByte(KIND_UNSAVED);
                    EditGroupCodec.writeString(out, unsaved.sessionId());
                    EditGroupCodec.writeString(out, unsaved.title());
                } else {
                    throw new IllegalArgumentException("Unknown tab entry: " + tab.getClass().getName());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return out.copyBytes();
    }

    static SessionData decode(byte[] bytes) throws CorruptedEntryException {
        try {
            DataInput2 in = new DataInput2.ByteArray(bytes);
            byte version = in.readByte();
            if (version != VERSION) {
                throw new IOException("Unsupported session format version=" + version);
            }

            int active = in.unpackInt();
            int count = in.unpackInt();
            if (count < 0 || count > bytes.length) {
                throw new IOException("Invalid tab count=" + count);
            }

            List<TabEntry> tabs = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                byte kind = in.readByte();
                switch (kind) {
                    case KIND_FILE -> tabs.add(new TabEntry.File(EditGroupCodec.readString(in, bytes.length)));
                    case KIND_UNSAVED -> {
                        String sessionId = EditGroupCodec.readString(in, bytes.length);
                        String title = EditGroupCodec.readString(in, bytes.length);
                        tabs.add(new TabEntry.Unsaved(sessionId, title));
                    }
                    default -> throw new IOException("Unknown tab kind=" + kind);
                }
            }
            return new SessionData(tabs, active);
        } catch (IOException | RuntimeException e) {
            throw new CorruptedEntryException("Failed to decode session (" + bytes.length + " bytes)", e);
        }
    }
}
