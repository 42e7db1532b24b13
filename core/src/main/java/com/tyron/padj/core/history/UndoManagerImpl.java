package com.tyron.padj.core.history;

import com.tyron.padj.api.history.EditGroup;
import com.tyron.padj.api.history.EditOperation;
import com.tyron.padj.api.history.HistoryStep;
import com.tyron.padj.api.history.HistoryStorageException;
import com.tyron.padj.api.history.UndoManager;
import com.tyron.padj.core.persistence.CorruptedEntryException;
import com.tyron.padj.core.persistence.HistoryMeta;
import com.tyron.padj.core.persistence.PersistenceLayer;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Two-tier undo history of one document.
 * <p>
 * Sealed groups live in {@code cold} (on disk only, oldest) followed by {@code hot} (in memory,
 * newest). The undo cursor indexes that combined sequence: groups before it are applied, groups
 * at or after it can be redone. Edits accumulate in an open group until the timeout elapses or
 * the {@link GroupingPolicy} refuses a merge.
 * <p>
 * Without a {@link PersistenceLayer} nothing spills and {@link HistoryConfig#maxHistoryDepth()}
 * bounds the memory tier alone.
 * <p>
 * Not thread-safe; owned by the thread that edits the document.
 */
public final class UndoManagerImpl implements UndoManager {

    private static final Logger LOG = Logger.getLogger(UndoManagerImpl.class.getName());

    private final String docId;
    private final HistoryConfig config;
    private final @Nullable PersistenceLayer persistence;
    private final GroupingPolicy groupingPolicy;
    private final Clock clock;

    private final LongArrayList cold = new LongArrayList();
    private final List<EditGroup> hot = new ArrayList<>();
    private final List<EditOperation> current = new ArrayList<>();

    /**
     * Seqs removed from memory whose disk deletion failed; retried on flush.
     */
    private final LongArrayList pendingDeletes = new LongArrayList();

    private int undoCursor;
    private long nextSeq;
    private long highestPersistedSeq = -1;
    private @Nullable Instant lastEditTime;
    private boolean dirty;

    public UndoManagerImpl(@NotNull String docId, @NotNull HistoryConfig config, @Nullable PersistenceLayer persistence) {
        this(docId, config, persistence, DefaultGroupingPolicy.INSTANCE, Clock.systemUTC());
    }

    public UndoManagerImpl(@NotNull String docId,
                           @NotNull HistoryConfig config,
                           @Nullable PersistenceLayer persistence,
                           @NotNull GroupingPolicy groupingPolicy,
                           @NotNull Clock clock) {
        this.docId = Objects.requireNonNull(docId, "docId");
        this.config = Objects.requireNonNull(config, "config");
        this.persistence = persistence;
        this.groupingPolicy = Objects.requireNonNull(groupingPolicy, "groupingPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static UndoManagerImpl loadOrNew(String docId, HistoryConfig config, @Nullable PersistenceLayer persistence) {
        return loadOrNew(docId, config, persistence, DefaultGroupingPolicy.INSTANCE, Clock.systemUTC());
    }

    /**
     * Rebuilds the history stored for {@code docId}: the newest {@code hotCapacity} groups are
     * decoded into memory, older ones stay on disk until undo reaches them.
     * <p>
     * Never fails. Unreadable groups are skipped; an unreadable store yields an empty history.
     */
    public static UndoManagerImpl loadOrNew(String docId,
                                            HistoryConfig config,
                                            @Nullable PersistenceLayer persistence,
                                            GroupingPolicy groupingPolicy,
                                            Clock clock) {
        UndoManagerImpl manager = new UndoManagerImpl(docId, config, persistence, groupingPolicy, clock);
        if (persistence == null) {
            return manager;
        }

        try {
            manager.restore();
        } catch (HistoryStorageException | RuntimeException e) {
            LOG.log(Level.WARNING, "history load failed docId=" + docId + ", starting empty", e);
            UndoManagerImpl empty = new UndoManagerImpl(docId, config, persistence, groupingPolicy, clock);
            empty.discardStored();
            return empty;
        }
        return manager;
    }

    @Override
    public String docId() {
        return docId;
    }

    @Override
    public void record(EditOperation op) throws HistoryStorageException {
        record(op, clock.instant());
    }

    @Override
    public void record(@NotNull EditOperation op, @NotNull Instant now) throws HistoryStorageException {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(now, "now");

        HistoryStorageException failure = null;
        if (undoCursor < totalGroups()) {
            failure = truncateFrom(undoCursor, failure);
        }

        if (!current.isEmpty() && !canMerge(op, now)) {
            failure = seal(failure);
        }

        current.add(op);
        lastEditTime = now;
        dirty = true;

        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void forceGroupBreak() throws HistoryStorageException {
        HistoryStorageException failure = seal(null);
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public Optional<HistoryStep> undo() {
        sealLogging();
        if (undoCursor == 0) {
            return Optional.empty();
        }

        int index = undoCursor - 1;
        EditGroup group = groupAt(index);
        if (group == null) {
            discardOlderThan(index + 1);
            return Optional.empty();
        }

        undoCursor = index;
        dirty = true;

        List<EditOperation> ops = group.operations();
        List<EditOperation> inverted = new ArrayList<>(ops.size());
        for (int i = ops.size() - 1; i >= 0; i--) {
            inverted.add(ops.get(i).inverse());
        }
        return Optional.of(new HistoryStep(inverted, group.first().cursorBefore()));
    }

    @Override
    public Optional<HistoryStep> redo() {
        sealLogging();
        if (undoCursor >= totalGroups()) {
            return Optional.empty();
        }

        EditGroup group = groupAt(undoCursor);
        if (group == null) {
            HistoryStorageException failure = truncateFrom(undoCursor, null);
            if (failure != null) {
                LOG.log(Level.WARNING, "history redo cleanup failed docId=" + docId, failure);
            }
            return Optional.empty();
        }

        undoCursor++;
        dirty = true;
        return Optional.of(new HistoryStep(group.operations(), group.last().cursorAfter()));
    }

    @Override
    public boolean canUndo() {
        return undoCursor > 0 || !current.isEmpty();
    }

    @Override
    public boolean canRedo() {
        return current.isEmpty() && undoCursor < totalGroups();
    }

    /**
     * @return number of undo steps available, counting the open group.
     */
    public int undoDepth() {
        return undoCursor + (current.isEmpty() ? 0 : 1);
    }

    public int redoDepth() {
        return current.isEmpty() ? totalGroups() - undoCursor : 0;
    }

    /**
     * @return sealed groups across both tiers; the open group is not counted.
     */
    public int totalGroups() {
        return cold.size() + hot.size();
    }

    @Override
    public void flush() throws HistoryStorageException {
        if (persistence == null) {
            return;
        }

        HistoryStorageException failure = seal(null);
        if (dirty) {
            List<EditGroup> unsaved = new ArrayList<>();
            for (EditGroup group : hot) {
                if (group.seq() > highestPersistedSeq) {
                    unsaved.add(group);
                }
            }
            try {
                persistence.writeGroups(docId, unsaved, currentMeta());
                if (!unsaved.isEmpty()) {
                    highestPersistedSeq = unsaved.get(unsaved.size() - 1).seq();
                }
                dirty = false;
            } catch (HistoryStorageException e) {
                failure = combine(failure, e);
            }
        }

        if (!pendingDeletes.isEmpty()) {
            try {
                persistence.deleteGroups(docId, pendingDeletes);
                pendingDeletes.clear();
            } catch (HistoryStorageException e) {
                failure = combine(failure, e);
            }
        }

        if (failure != null) {
            throw failure;
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("history flushed docId=" + docId + " groups=" + totalGroups() + " cursor=" + undoCursor);
        }
    }

    /**
     * Removes stored history first; memory is only reset once the store agrees.
     */
    @Override
    public void deleteHistory() throws HistoryStorageException {
        if (persistence != null) {
            persistence.deleteAll(docId);
        }

        hot.clear();
        cold.clear();
        current.clear();
        pendingDeletes.clear();
        undoCursor = 0;
        highestPersistedSeq = -1;
        lastEditTime = null;
        dirty = false;
    }

    int hotCount() {
        return hot.size();
    }

    int coldCount() {
        return cold.size();
    }

    long nextSeq() {
        return nextSeq;
    }

    // ---------------------------------------------------------------------------------------

    private boolean canMerge(EditOperation op, Instant now) {
        if (lastEditTime == null) {
            return false;
        }
        Duration gap = Duration.between(lastEditTime, now);
        return gap.compareTo(config.groupTimeout()) <= 0
                && groupingPolicy.canMerge(current.get(current.size() - 1), op);
    }

    /**
     * Closes the open group: assigns its seq, then evicts and spills. The group stays in memory
     * whatever the store does; store failures are returned, chained onto {@code failure}.
     */
    private @Nullable HistoryStorageException seal(@Nullable HistoryStorageException failure) {
        if (current.isEmpty()) {
            return failure;
        }

        hot.add(new EditGroup(nextSeq++, current));
        current.clear();
        undoCursor = totalGroups();
        dirty = true;

        failure = evict(failure);
        return spill(failure);
    }

    private void sealLogging() {
        HistoryStorageException failure = seal(null);
        if (failure != null) {
            LOG.log(Level.WARNING, "history seal failed docId=" + docId, failure);
        }
    }

    private @Nullable HistoryStorageException evict(@Nullable HistoryStorageException failure) {
        if (totalGroups() <= config.maxHistoryDepth()) {
            return failure;
        }

        LongArrayList evicted = new LongArrayList();
        while (totalGroups() > config.maxHistoryDepth()) {
            if (!cold.isEmpty()) {
                evicted.add(cold.removeLong(0));
            } else {
                EditGroup oldest = hot.remove(0);
                if (oldest.seq() <= highestPersistedSeq) {
                    evicted.add(oldest.seq());
                }
            }
            if (undoCursor > 0) {
                undoCursor--;
            }
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("history evicted docId=" + docId + " stored=" + evicted.size());
        }
        return deleteStored(evicted, failure);
    }

    /**
     * Writes the groups beyond {@code hotCapacity} to disk and moves them to the cold tier.
     * On failure they stay in memory, over capacity, and are retried on the next seal.
     */
    private @Nullable HistoryStorageException spill(@Nullable HistoryStorageException failure) {
        if (persistence == null || hot.size() <= config.hotCapacity()) {
            return failure;
        }

        List<EditGroup> excess = hot.subList(0, hot.size() - config.hotCapacity());
        List<EditGroup> unsaved = new ArrayList<>(excess.size());
        for (EditGroup group : excess) {
            if (group.seq() > highestPersistedSeq) {
                unsaved.add(group);
            }
        }

        try {
            persistence.writeGroups(docId, unsaved, currentMeta());
        } catch (HistoryStorageException e) {
            if (LOG.isLoggable(Level.WARNING)) {
                LOG.warning("history spill failed docId=" + docId + " hot=" + hot.size() + ": " + e.getMessage());
            }
            return combine(failure, e);
        }

        long lastSpilled = excess.get(excess.size() - 1).seq();
        highestPersistedSeq = Math.max(highestPersistedSeq, lastSpilled);
        for (EditGroup group : excess) {
            cold.add(group.seq());
        }
        excess.clear();
        return failure;
    }

    /**
     * Drops every sealed group from {@code index} on (memory and disk).
     */
    private @Nullable HistoryStorageException truncateFrom(int index, @Nullable HistoryStorageException failure) {
        LongArrayList removed = new LongArrayList();
        while (totalGroups() > index) {
            if (!hot.isEmpty()) {
                removed.add(hot.remove(hot.size() - 1).seq());
            } else {
                removed.add(cold.removeLong(cold.size() - 1));
            }
        }
        undoCursor = Math.min(undoCursor, totalGroups());
        dirty = true;
        return deleteStored(removed, failure);
    }

    /**
     * Drops the {@code count} oldest groups after one of them turned out to be unreadable.
     */
    private void discardOlderThan(int count) {
        LongArrayList removed = new LongArrayList();
        for (int i = 0; i < count && totalGroups() > 0; i++) {
            removed.add(cold.isEmpty() ? hot.remove(0).seq() : cold.removeLong(0));
        }
        undoCursor = Math.max(0, undoCursor - count);
        dirty = true;

        if (LOG.isLoggable(Level.WARNING)) {
            LOG.warning("history unreadable group docId=" + docId + ", dropped " + removed.size() + " older groups");
        }
        HistoryStorageException failure = deleteStored(removed, null);
        if (failure != null) {
            LOG.log(Level.WARNING, "history cleanup failed docId=" + docId, failure);
        }
    }

    private @Nullable HistoryStorageException deleteStored(LongList seqs, @Nullable HistoryStorageException failure) {
        if (persistence == null || seqs.isEmpty()) {
            return failure;
        }
        try {
            persistence.deleteGroups(docId, seqs);
            return failure;
        } catch (HistoryStorageException e) {
            pendingDeletes.addAll(seqs);
            return combine(failure, e);
        }
    }

    /**
     * @return the group at {@code index} of cold+hot, or null if it is on disk and cannot be read.
     */
    private @Nullable EditGroup groupAt(int index) {
        if (index >= cold.size()) {
            return hot.get(index - cold.size());
        }

        long seq = cold.getLong(index);
        try {
            EditGroup group = Objects.requireNonNull(persistence).readGroup(docId, seq);
            if (group == null && LOG.isLoggable(Level.WARNING)) {
                LOG.warning("history missing group docId=" + docId + " seq=" + seq);
            }
            return group;
        } catch (HistoryStorageException e) {
            LOG.log(Level.WARNING, "history read failed docId=" + docId + " seq=" + seq, e);
            return null;
        }
    }

    private long seqAt(int index) {
        return index < cold.size() ? cold.getLong(index) : hot.get(index - cold.size()).seq();
    }

    /**
     * Cursor position as the seq of the first redoable group, so it survives eviction of older ones.
     */
    private HistoryMeta currentMeta() {
        long cursorSeq = undoCursor < totalGroups() ? seqAt(undoCursor) : nextSeq;
        return new HistoryMeta(nextSeq, cursorSeq);
    }

    private void restore() throws HistoryStorageException {
        PersistenceLayer store = Objects.requireNonNull(persistence);

        HistoryMeta meta = store.loadMeta(docId);
        LongList stored = store.groupSeqs(docId);
        if (meta == null && stored.isEmpty()) {
            return;
        }

        long maxSeq = stored.isEmpty() ? -1 : stored.getLong(stored.size() - 1);
        int hotStart = Math.max(0, stored.size() - config.hotCapacity());

        for (int i = 0; i < hotStart; i++) {
            cold.add(stored.getLong(i));
        }
        for (int i = hotStart; i < stored.size(); i++) {
            long seq = stored.getLong(i);
            try {
                EditGroup group = store.readGroup(docId, seq);
                if (group != null) {
                    hot.add(group);
                }
            } catch (CorruptedEntryException e) {
                LOG.log(Level.WARNING, "history skip corruptGroup docId=" + docId + " seq=" + seq, e);
                pendingDeletes.add(seq);
            }
        }

        nextSeq = Math.max(meta != null ? meta.nextSeq() : 0, maxSeq + 1);
        highestPersistedSeq = maxSeq;

        long cursorSeq = meta != null ? meta.cursorSeq() : nextSeq;
        int cursor = 0;
        while (cursor < totalGroups() && seqAt(cursor) < cursorSeq) {
            cursor++;
        }
        undoCursor = cursor;

        HistoryStorageException failure = evict(null);
        if (failure != null) {
            LOG.log(Level.WARNING, "history evict on load failed docId=" + docId, failure);
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("history loaded docId=" + docId + " hot=" + hot.size() + " cold=" + cold.size()
                    + " cursor=" + undoCursor + " nextSeq=" + nextSeq);
        }
    }

    private void discardStored() {
        try {
            Objects.requireNonNull(persistence).deleteAll(docId);
        } catch (HistoryStorageException e) {
            LOG.log(Level.WARNING, "history discard failed docId=" + docId, e);
        }
    }

    private static HistoryStorageException combine(@Nullable HistoryStorageException first, HistoryStorageException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    @Override
    public String toString() {
        return "UndoManagerImpl{docId=" + docId + ", hot=" + hot.size() + ", cold=" + cold.size()
                + ", cursor=" + undoCursor + ", open=" + current.size() + "}";
    }
}
