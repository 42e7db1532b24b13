package com.tyron.padj.core.persistence;

import com.tyron.padj.api.history.CursorSnapshot;
import com.tyron.padj.api.history.EditGroup;
import com.tyron.padj.api.history.EditOperation;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EditGroupCodecTest {

    @Test
    public void groupSurvivesEncoding() throws Exception {
        EditGroup group = new EditGroup(42, List.of(
                new EditOperation(0, "héllo\n", "", new CursorSnapshot(0, 0), new CursorSnapshot(1, 0)),
                new EditOperation(6, "", "😀", new CursorSnapshot(1, 2), new CursorSnapshot(1, 0)),
                new EditOperation(3, "日本", "lo", new CursorSnapshot(0, 5), new CursorSnapshot(0, 5))));

        EditGroup decoded = EditGroupCodec.decode(EditGroupCodec.encode(group));

        assertThat(decoded).isEqualTo(group);
    }

    @Test
    public void largeTextIsNotTruncated() throws Exception {
        String big = "x".repeat(200_000);
        EditGroup group = new EditGroup(1, List.of(EditOperation.insert(0, big, CursorSnapshot.ORIGIN, new CursorSnapshot(0, big.length()))));

        assertThat(EditGroupCodec.decode(EditGroupCodec.encode(group)).first().inserted()).hasLength(big.length());
    }

    @Test
    public void garbageIsReportedAsCorrupt() {
        assertThrows(CorruptedEntryException.class, () -> EditGroupCodec.decode(new byte[]{1, 2}));
        assertThrows(CorruptedEntryException.class, () -> EditGroupCodec.decode(new byte[0]));
    }

    @Test
    public void unknownVersionIsRejected() {
        byte[] bytes = EditGroupCodec.encode(new EditGroup(0, List.of(EditOperation.insert(0, "a", CursorSnapshot.ORIGIN, new CursorSnapshot(0, 1)))));
        bytes[0] = 7;

        assertThrows(CorruptedEntryException.class, () -> EditGroupCodec.decode(bytes));
    }

    @Test
    public void truncatedGroupIsRejected() {
        byte[] bytes = EditGroupCodec.encode(new EditGroup(0, List.of(EditOperation.insert(0, "abcdef", CursorSnapshot.ORIGIN, new CursorSnapshot(0, 6)))));

        assertThrows(CorruptedEntryException.class, () -> EditGroupCodec.decode(Arrays.copyOf(bytes, bytes.length - 3)));
    }

    @Test
    public void longValues() throws Exception {
        assertThat(EditGroupCodec.decodeLong(EditGroupCodec.encodeLong(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE);
        assertThrows(CorruptedEntryException.class, () -> EditGroupCodec.decodeLong(new byte[3]));
    }
}
