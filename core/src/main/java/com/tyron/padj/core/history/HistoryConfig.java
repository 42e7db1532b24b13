package com.tyron.padj.core.history;

import com.tyron.padj.core.identity.DocumentIdentity;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Limits and locations for the history engine.
 *
 * @param hotCapacity     max sealed groups kept in memory per document before spilling to disk
 * @param maxHistoryDepth max groups per document across memory and disk; oldest are evicted
 * @param groupTimeout    max gap between two edits for them to share an undo step
 * @param dataDir         directory of the persistent store
 */
public record HistoryConfig(int hotCapacity, int maxHistoryDepth, Duration groupTimeout, Path dataDir) {

    public static final int DEFAULT_HOT_CAPACITY = 500;
    public static final int DEFAULT_MAX_HISTORY_DEPTH = 10_000;
    public static final Duration DEFAULT_GROUP_TIMEOUT = Duration.ofMillis(500);

    public HistoryConfig {
        if (hotCapacity < 1) {
            throw new IllegalArgumentException("hotCapacity=" + hotCapacity + " must be >= 1");
        }
        if (maxHistoryDepth < 1) {
            throw new IllegalArgumentException("maxHistoryDepth=" + maxHistoryDepth + " must be >= 1");
        }
        Objects.requireNonNull(groupTimeout, "groupTimeout");
        if (groupTimeout.isNegative()) {
            throw new IllegalArgumentException("groupTimeout=" + groupTimeout + " must not be negative");
        }
        Objects.requireNonNull(dataDir, "dataDir");
    }

    public static HistoryConfig defaults() {
        return defaults(DocumentIdentity.resolveDataDir());
    }

    public static HistoryConfig defaults(Path dataDir) {
        return new HistoryConfig(DEFAULT_HOT_CAPACITY, DEFAULT_MAX_HISTORY_DEPTH, DEFAULT_GROUP_TIMEOUT, dataDir);
    }

    public HistoryConfig withHotCapacity(int hotCapacity) {
        return new HistoryConfig(hotCapacity, maxHistoryDepth, groupTimeout, dataDir);
    }

    public HistoryConfig withMaxHistoryDepth(int maxHistoryDepth) {
        return new HistoryConfig(hotCapacity, maxHistoryDepth, groupTimeout, dataDir);
    }

    public HistoryConfig withGroupTimeout(Duration groupTimeout) {
        return new HistoryConfig(hotCapacity, maxHistoryDepth, groupTimeout, dataDir);
    }
}
