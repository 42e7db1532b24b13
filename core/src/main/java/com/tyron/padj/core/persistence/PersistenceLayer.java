package com.tyron.padj.core.persistence;

import com.tyron.padj.api.history.EditGroup;
import com.tyron.padj.api.history.HistoryStorageException;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongCollection;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.mapdb.BTreeMap;
import org.mapdb.DB;
import org.mapdb.DBException;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MapDB-backed store for per-document history (edit groups + metadata) and session data.
 * <p>
 * All values live in one ordered map under {@code namespace + '\0' + key}, so a namespace
 * (normally a document id) is a contiguous key range. Group keys are {@value #GROUP_PREFIX}
 * followed by the zero-padded seq, which keeps them in seq order.
 * <p>
 * Every mutating call runs as one MapDB transaction: committed on success, rolled back on
 * failure. One writer per data directory: a second {@link #open} of the same directory fails.
 */
public final class PersistenceLayer implements Closeable {

    private static final Logger LOG = Logger.getLogger(PersistenceLayer.class.getName());

    public static final String DB_FILE_NAME = "history.db";
    public static final String LOCK_FILE_NAME = "history.lock";

    public static final String GROUP_PREFIX = "group/";
    public static final String META_NEXT_SEQ = "meta/next_seq";
    public static final String META_CURSOR_SEQ = "meta/cursor_seq";

    private static final char SEPARATOR = '\u0000';

    @FunctionalInterface
    private interface StoreAction<T> {
        T run() throws HistoryStorageException;
    }

    private final Path dataDir;
    private final FileChannel lockChannel;
    private final FileLock lock;
    private final DB db;
    private final BTreeMap<String, byte[]> entries;

    private boolean closed;

    private PersistenceLayer(Path dataDir, FileChannel lockChannel, FileLock lock, DB db) {
        this.dataDir = dataDir;
        this.lockChannel = lockChannel;
        this.lock = lock;
        this.db = db;
        this.entries = db.treeMap("history.entries", Serializer.STRING, Serializer.BYTE_ARRAY).createOrOpen();
    }

    /**
     * Opens (creating if needed) the store in {@code dataDir}.
     *
     * @throws HistoryStorageException if the directory cannot be created, the store is corrupt,
     *                                 or another handle already holds it
     */
    public static PersistenceLayer open(@NotNull Path dataDir) throws HistoryStorageException {
        Objects.requireNonNull(dataDir, "dataDir");
        Path dir = dataDir.toAbsolutePath().normalize();

        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new HistoryStorageException("Failed to create data directory: " + dir, e);
        }

        FileChannel channel;
        try {
            channel = FileChannel.open(dir.resolve(LOCK_FILE_NAME), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new HistoryStorageException("Failed to open lock file in " + dir, e);
        }

        FileLock fileLock;
        try {
            fileLock = channel.tryLock();
        } catch (OverlappingFileLockException | IOException e) {
            fileLock = null;
        }
        if (fileLock == null) {
            closeQuietly(channel);
            throw new HistoryStorageException("History store is already open: " + dir);
        }

        DB db;
        try {
            db = DBMaker
                    .fileDB(dir.resolve(DB_FILE_NAME).toFile())
                    .transactionEnable()
                    .closeOnJvmShutdown()
                    .make();
        } catch (DBException.FileLocked locked) {
            releaseQuietly(fileLock, channel);
            throw new HistoryStorageException("History store is locked by another process: " + dir, locked);
        } catch (RuntimeException e) {
            releaseQuietly(fileLock, channel);
            throw new HistoryStorageException("Failed to open history store: " + dir, e);
        }

        try {
            PersistenceLayer layer = new PersistenceLayer(dir, channel, fileLock, db);
            db.commit();
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("historyStore opened dir=" + dir);
            }
            return layer;
        } catch (RuntimeException e) {
            db.close();
            releaseQuietly(fileLock, channel);
            throw new HistoryStorageException("Failed to initialize history store: " + dir, e);
        }
    }

    public Path getDataDir() {
        return dataDir;
    }

    // ---------------------------------------------------------------------------------------
    // Generic namespaced key/value access
    // ---------------------------------------------------------------------------------------

    public synchronized void put(String namespace, String key, byte[] value) throws HistoryStorageException {
        Objects.requireNonNull(value, "value");
        write("put " + key, () -> entries.put(compositeKey(namespace, key), value));
    }

    /**
     * @return the stored bytes, or null if the key is absent.
     */
    public synchronized byte[] get(String namespace, String key) throws HistoryStorageException {
        return read("get " + key, () -> entries.get(compositeKey(namespace, key)));
    }

    /**
     * Removes one key. Removing an absent key succeeds.
     */
    public synchronized void delete(String namespace, String key) throws HistoryStorageException {
        write("delete " + key, () -> entries.remove(compositeKey(namespace, key)));
    }

    /**
     * Removes every key of {@code namespace}.
     *
     * @return number of removed entries
     */
    public synchronized int deleteAll(String namespace) throws HistoryStorageException {
        return write("delete namespace", () -> removeAll(keysWithPrefix(namespacePrefix(namespace))));
    }

    /**
     * @return all keys of {@code namespace}, without the namespace prefix, in key order.
     */
    public synchronized List<String> keys(String namespace) throws HistoryStorageException {
        return read("list keys", () -> {
            String prefix = namespacePrefix(namespace);
            List<String> result = new ArrayList<>();
            for (String composite : keysWithPrefix(prefix)) {
                result.add(composite.substring(prefix.length()));
            }
            return result;
        });
    }

    /**
     * Durability barrier: commits anything still pending in the write-ahead log.
     */
    public synchronized void flush() throws HistoryStorageException {
        write("flush", () -> null);
    }

    // ---------------------------------------------------------------------------------------
    // Edit groups and metadata
    // ---------------------------------------------------------------------------------------

    public static String groupKey(long seq) {
        return GROUP_PREFIX + String.format(Locale.ROOT, "%020d", seq);
    }

    /**
     * Writes (upserts) {@code groups} and, when given, {@code meta} in a single transaction.
     */
    public synchronized void writeGroups(String docId, Collection<EditGroup> groups, @Nullable HistoryMeta meta)
            throws HistoryStorageException {
        if (groups.isEmpty() && meta == null) {
            return;
        }
        write("write groups", () -> {
            for (EditGroup group : groups) {
                entries.put(compositeKey(docId, groupKey(group.seq())), EditGroupCodec.encode(group));
            }
            if (meta != null) {
                putMeta(docId, meta);
            }
            return null;
        });
    }

    /**
     * @return the group, or null if no group with {@code seq} is stored.
     * @throws CorruptedEntryException if the stored bytes cannot be decoded
     */
    public synchronized @Nullable EditGroup readGroup(String docId, long seq) throws HistoryStorageException {
        byte[] bytes = read("read group", () -> entries.get(compositeKey(docId, groupKey(seq))));
        return bytes != null ? EditGroupCodec.decode(bytes) : null;
    }

    /**
     * Reads every group of {@code docId} in seq order. Groups that fail to decode are skipped.
     */
    public synchronized List<EditGroup> readGroups(String docId) throws HistoryStorageException {
        List<byte[]> raw = read("read groups",
                () -> new ArrayList<>(range(namespacePrefix(docId) + GROUP_PREFIX).values()));

        List<EditGroup> groups = new ArrayList<>(raw.size());
        for (byte[] bytes : raw) {
            try {
                groups.add(EditGroupCodec.decode(bytes));
            } catch (CorruptedEntryException e) {
                if (LOG.isLoggable(Level.WARNING)) {
                    LOG.log(Level.WARNING, "historyStore skip corruptGroup docId=" + docId, e);
                }
            }
        }
        return groups;
    }

    /**
     * @return seqs of the stored groups, ascending, without decoding them.
     */
    public synchronized LongList groupSeqs(String docId) throws HistoryStorageException {
        return read("list group seqs", () -> {
            String prefix = namespacePrefix(docId) + GROUP_PREFIX;
            LongArrayList seqs = new LongArrayList();
            for (String key : keysWithPrefix(prefix)) {
                try {
                    seqs.add(Long.parseLong(key.substring(prefix.length())));
                } catch (NumberFormatException e) {
                    if (LOG.isLoggable(Level.WARNING)) {
                        LOG.warning("historyStore skip malformedGroupKey docId=" + docId + " key=" + key);
                    }
                }
            }
            return seqs;
        });
    }

    public synchronized int countGroups(String docId) throws HistoryStorageException {
        return read("count groups", () -> range(namespacePrefix(docId) + GROUP_PREFIX).size());
    }

    public synchronized void deleteGroups(String docId, LongCollection seqs) throws HistoryStorageException {
        if (seqs.isEmpty()) {
            return;
        }
        write("delete groups", () -> {
            for (LongIterator it = seqs.iterator(); it.hasNext(); ) {
                entries.remove(compositeKey(docId, groupKey(it.nextLong())));
            }
            return null;
        });
    }

    /**
     * Removes the {@code count} lowest-seq groups of {@code docId}.
     *
     * @return number of groups actually removed
     */
    public synchronized int evictOldest(String docId, int count) throws HistoryStorageException {
        if (count <= 0) {
            return 0;
        }
        return write("evict groups", () -> {
            List<String> keys = keysWithPrefix(namespacePrefix(docId) + GROUP_PREFIX);
            return removeAll(keys.subList(0, Math.min(count, keys.size())));
        });
    }

    public synchronized void saveMeta(String docId, HistoryMeta meta) throws HistoryStorageException {
        write("save meta", () -> {
            putMeta(docId, meta);
            return null;
        });
    }

    /**
     * @return stored metadata, or null if the document has no history.
     */
    public synchronized @Nullable HistoryMeta loadMeta(String docId) throws HistoryStorageException {
        byte[] nextSeq = get(docId, META_NEXT_SEQ);
        if (nextSeq == null) {
            return null;
        }
        long next = EditGroupCodec.decodeLong(nextSeq);

        byte[] cursorSeq = get(docId, META_CURSOR_SEQ);
        long cursor = cursorSeq != null ? EditGroupCodec.decodeLong(cursorSeq) : next;
        return new HistoryMeta(next, cursor);
    }

    /**
     * @return ids of all documents that have history metadata.
     */
    public synchronized List<String> listDocuments() throws HistoryStorageException {
        return read("list documents", () -> {
            String suffix = SEPARATOR + META_NEXT_SEQ;
            List<String> ids = new ArrayList<>();
            for (String key : entries.keySet()) {
                if (key.endsWith(suffix)) {
                    ids.add(key.substring(0, key.length() - suffix.length()));
                }
            }
            return ids;
        });
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            db.close();
        } finally {
            releaseQuietly(lock, lockChannel);
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("historyStore closed dir=" + dataDir);
        }
    }

    // ---------------------------------------------------------------------------------------

    private void putMeta(String docId, HistoryMeta meta) {
        entries.put(compositeKey(docId, META_NEXT_SEQ), EditGroupCodec.encodeLong(meta.nextSeq()));
        entries.put(compositeKey(docId, META_CURSOR_SEQ), EditGroupCodec.encodeLong(meta.cursorSeq()));
    }

    private <T> T write(String what, StoreAction<T> action) throws HistoryStorageException {
        ensureOpen();
        try {
            T result = action.run();
            db.commit();
            return result;
        } catch (HistoryStorageException e) {
            rollbackQuietly();
            throw e;
        } catch (RuntimeException e) {
            rollbackQuietly();
            throw new HistoryStorageException("Failed to " + what + " in " + dataDir, e);
        }
    }

    private <T> T read(String what, StoreAction<T> action) throws HistoryStorageException {
        ensureOpen();
        try {
            return action.run();
        } catch (RuntimeException e) {
            throw new HistoryStorageException("Failed to " + what + " in " + dataDir, e);
        }
    }

    private void ensureOpen() throws HistoryStorageException {
        if (closed) {
            throw new HistoryStorageException("History store is closed: " + dataDir);
        }
    }

    private void rollbackQuietly() {
        try {
            db.rollback();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "historyStore rollback failed dir=" + dataDir, e);
        }
    }

    private NavigableMap<String, byte[]> range(String prefix) {
        return entries.subMap(prefix, true, prefixEnd(prefix), false);
    }

    private List<String> keysWithPrefix(String prefix) {
        return new ArrayList<>(range(prefix).keySet());
    }

    private int removeAll(List<String> keys) {
        int removed = 0;
        for (String key : keys) {
            if (entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    private static String compositeKey(String namespace, String key) {
        return namespacePrefix(namespace) + key;
    }

    private static String namespacePrefix(String namespace) {
        Objects.requireNonNull(namespace, "namespace");
        if (namespace.isEmpty() || namespace.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Invalid namespace: '" + namespace + "'");
        }
        return namespace + SEPARATOR;
    }

    /**
     * Smallest string greater than every string starting with {@code prefix}.
     */
    private static String prefixEnd(String prefix) {
        char last = prefix.charAt(prefix.length() - 1);
        return prefix.substring(0, prefix.length() - 1) + (char) (last + 1);
    }

    private static void releaseQuietly(FileLock lock, FileChannel channel) {
        try {
            lock.release();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "historyStore lock release failed", e);
        } finally {
            closeQuietly(channel);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "historyStore lock channel close failed", e);
        }
    }
}
