package com.tyron.padj.core.history;

import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a {@link HistoryConfig} for a data directory.
 * <p>
 * Sources, later ones winning: built-in defaults, {@value #CONFIG_FILE_NAME} in the data
 * directory, then system properties ({@value #HOT_CAPACITY_PROP}, {@value #MAX_DEPTH_PROP},
 * {@value #GROUP_TIMEOUT_PROP}). Invalid values are logged and ignored.
 */
public final class HistoryConfigLoader {

    private static final Logger LOG = Logger.getLogger(HistoryConfigLoader.class.getName());

    public static final String CONFIG_FILE_NAME = "history.yaml";

    public static final String HOT_CAPACITY_PROP = "padj.history.hotCapacity";
    public static final String MAX_DEPTH_PROP = "padj.history.maxHistoryDepth";
    public static final String GROUP_TIMEOUT_PROP = "padj.history.groupTimeoutMs";

    private HistoryConfigLoader() {
    }

    public static HistoryConfig load(Path dataDir) {
        return load(dataDir, System.getProperties());
    }

    static HistoryConfig load(Path dataDir, Properties overrides) {
        int hotCapacity = HistoryConfig.DEFAULT_HOT_CAPACITY;
        int maxDepth = HistoryConfig.DEFAULT_MAX_HISTORY_DEPTH;
        long timeoutMs = HistoryConfig.DEFAULT_GROUP_TIMEOUT.toMillis();

        Map<?, ?> yaml = readYaml(dataDir.resolve(CONFIG_FILE_NAME));
        hotCapacity = positive("hotCapacity", yaml.get("hotCapacity"), hotCapacity);
        maxDepth = positive("maxHistoryDepth", yaml.get("maxHistoryDepth"), maxDepth);
        timeoutMs = nonNegative("groupTimeoutMs", yaml.get("groupTimeoutMs"), timeoutMs);

        hotCapacity = positive(HOT_CAPACITY_PROP, overrides.getProperty(HOT_CAPACITY_PROP), hotCapacity);
        maxDepth = positive(MAX_DEPTH_PROP, overrides.getProperty(MAX_DEPTH_PROP), maxDepth);
        timeoutMs = nonNegative(GROUP_TIMEOUT_PROP, overrides.getProperty(GROUP_TIMEOUT_PROP), timeoutMs);

        if (hotCapacity > maxDepth) {
            if (LOG.isLoggable(Level.WARNING)) {
                LOG.warning("historyConfig hotCapacity=" + hotCapacity + " exceeds maxHistoryDepth=" + maxDepth
                        + ", clamping");
            }
            hotCapacity = maxDepth;
        }

        return new HistoryConfig(hotCapacity, maxDepth, Duration.ofMillis(timeoutMs), dataDir);
    }

    private static Map<?, ?> readYaml(Path file) {
        if (!Files.isRegularFile(file)) {
            return Map.of();
        }
        try (InputStream in = Files.newInputStream(file)) {
            Object doc = new Yaml().load(in);
            if (doc instanceof Map<?, ?> map) {
                return map;
            }
            if (doc != null && LOG.isLoggable(Level.WARNING)) {
                LOG.warning("historyConfig ignored file=" + file + " reason=notAMapping");
            }
        } catch (Exception e) {
            LOG.log(Level.WARNING, "historyConfig ignored file=" + file + " reason=unreadable", e);
        }
        return Map.of();
    }

    private static int positive(String name, Object raw, int fallback) {
        long value = nonNegative(name, raw, fallback);
        if (value < 1 || value > Integer.MAX_VALUE) {
            warnInvalid(name, raw);
            return fallback;
        }
        return (int) value;
    }

    private static long nonNegative(String name, Object raw, long fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            long value = raw instanceof Number n ? n.longValue() : Long.parseLong(String.valueOf(raw).trim());
            if (value < 0) {
                warnInvalid(name, raw);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            warnInvalid(name, raw);
            return fallback;
        }
    }

    private static void warnInvalid(String name, Object raw) {
        if (LOG.isLoggable(Level.WARNING)) {
            LOG.warning("historyConfig invalid key=" + name + " value=" + raw + ", using default");
        }
    }
}
