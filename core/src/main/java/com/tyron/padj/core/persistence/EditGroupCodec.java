package com.tyron.padj.core.persistence;

import com.tyron.padj.api.history.CursorSnapshot;
import com.tyron.padj.api.history.EditGroup;
import com.tyron.padj.api.history.EditOperation;
import org.mapdb.DataInput2;
import org.mapdb.DataOutput2;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary format of stored {@link EditGroup}s and metadata values.
 * <p>
 * Layout (version 1): {@code version:byte, seq:packed long, count:packed int}, then per operation
 * {@code position, inserted, deleted, before.line, before.col, after.line, after.col}. Strings are
 * a packed UTF-8 byte length followed by the bytes, so there is no size limit per operation.
 */
public final class EditGroupCodec {

    static final byte VERSION = 1;

    private EditGroupCodec() {
    }

    public static byte[] encode(EditGroup group) {
        DataOutput2 out = new DataOutput2();
        try {
            out.writeByte(VERSION);
            out.packLong(group.seq());
            out.packInt(group.operations().size());
            for (EditOperation op : group.operations()) {
                out.packInt(op.position());
                writeString(out, op.inserted());
                writeString(out, op.deleted());
                writeCursor(out, op.cursorBefore());
                writeCursor(out, op.cursorAfter());
            }
        } catch (IOException e) {
            // DataOutput2 grows an in-memory buffer.
            throw new IllegalStateException(e);
        }
        return out.copyBytes();
    }

    public static EditGroup decode(byte[] bytes) throws CorruptedEntryException {
        try {
            DataInput2 in = new DataInput2.ByteArray(bytes);
            byte version = in.readByte();
            if (version != VERSION) {
                throw new IOException("Unsupported edit group format version=" + version);
            }

            long seq = in.unpackLong();
            int count = in.unpackInt();
            if (count <= 0 || count > bytes.length) {
                throw new IOException("Invalid operation count=" + count);
            }

            List<EditOperation> ops = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                int position = in.unpackInt();
                String inserted = readString(in, bytes.length);
                String deleted = readString(in, bytes.length);
                CursorSnapshot before = readCursor(in);
                CursorSnapshot after = readCursor(in);
                ops.add(new EditOperation(position, inserted, deleted, before, after));
            }
            return new EditGroup(seq, ops);
        } catch (IOException | RuntimeException e) {
            throw new CorruptedEntryException("Failed to decode edit group (" + bytes.length + " bytes)", e);
        }
    }

    public static byte[] encodeLong(long value) {
        DataOutput2 out = new DataOutput2();
        try {
            out.writeLong(value);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return out.copyBytes();
    }

    public static long decodeLong(byte[] bytes) throws CorruptedEntryException {
        if (bytes.length != Long.BYTES) {
            throw new CorruptedEntryException("Expected " + Long.BYTES + " bytes, got " + bytes.length, null);
        }
        try {
            return new DataInput2.ByteArray(bytes).readLong();
        } catch (IOException e) {
            throw new CorruptedEntryException("Failed to decode long value", e);
        }
    }

    public static void writeString(DataOutput2 out, String s) throws IOException {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        out.packInt(utf8.length);
        out.write(utf8);
    }

    public static String readString(DataInput2 in, int limit) throws IOException {
        int len = in.unpackInt();
        if (len < 0 || len > limit) {
            throw new IOException("Invalid string length=" + len);
        }
        byte[] utf8 = new byte[len];
        in.readFully(utf8);
        return new String(utf8, StandardCharsets.UTF_8);
    }

    private static void writeCursor(DataOutput2 out, CursorSnapshot cursor) throws IOException {
        out.packInt(cursor.line());
        out.packInt(cursor.col());
    }

    private static CursorSnapshot readCursor(DataInput2 in) throws IOException {
        return new CursorSnapshot(in.unpackInt(), in.unpackInt());
    }
}
