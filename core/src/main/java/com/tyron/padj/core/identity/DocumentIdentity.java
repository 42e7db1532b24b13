package com.tyron.padj.core.identity;

import com.google.common.hash.Hashing;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Derives the identifiers history and session data are stored under.
 * <p>
 * File-backed documents get {@code file-<16 hex digits>}, a fingerprint of the canonical path that
 * stays the same across runs. Unsaved documents get {@code unsaved-<n>} from a counter owned by
 * this instance; those ids are unique only within the process, so callers that need them after a
 * restart persist them (the session store does).
 */
public final class DocumentIdentity {

    public static final String FILE_PREFIX = "file-";
    public static final String UNSAVED_PREFIX = "unsaved-";

    public static final String DATA_DIR_PROPERTY = "padj.dataDir";
    public static final String DATA_DIR_ENV = "PADJ_DATA_DIR";
    public static final String DEFAULT_DATA_DIR_NAME = ".data";

    private final AtomicLong unsavedCounter = new AtomicLong();

    /**
     * Identifier for a document backed by {@code path}. Symlinks and relative segments are resolved
     * when the file exists; otherwise the path is used as given.
     */
    public static String docIdForPath(@NotNull Path path) {
        Objects.requireNonNull(path, "path");

        Path canonical;
        try {
            canonical = path.toRealPath();
        } catch (IOException | SecurityException e) {
            // Not created yet.
            canonical = path;
        }

        long hash = Hashing.farmHashFingerprint64()
                .hashString(canonical.toString(), StandardCharsets.UTF_8)
                .asLong();
        return FILE_PREFIX + String.format(Locale.ROOT, "%016x", hash);
    }

    public String generateUnsavedId() {
        return UNSAVED_PREFIX + unsavedCounter.getAndIncrement();
    }

    public static boolean isUnsavedId(@Nullable String docId) {
        return docId != null && docId.startsWith(UNSAVED_PREFIX);
    }

    /**
     * Resolves where persistent history lives:
     * system property {@value #DATA_DIR_PROPERTY}, then env {@value #DATA_DIR_ENV},
     * then a {@value #DEFAULT_DATA_DIR_NAME} directory next to the running code.
     * <p>
     * Does not create the directory.
     */
    public static Path resolveDataDir() {
        return resolveDataDir(System.getProperty(DATA_DIR_PROPERTY), System.getenv());
    }

    static Path resolveDataDir(@Nullable String propertyOverride, Map<String, String> env) {
        if (propertyOverride != null && !propertyOverride.isBlank()) {
            return Path.of(propertyOverride.trim());
        }

        String envOverride = env.get(DATA_DIR_ENV);
        if (envOverride != null && !envOverride.isBlank()) {
            return Path.of(envOverride.trim());
        }

        Path base = codeLocationDir();
        return (base != null ? base : Path.of(".")).resolve(DEFAULT_DATA_DIR_NAME);
    }

    private static @Nullable Path codeLocationDir() {
        try {
            CodeSource source = DocumentIdentity.class.getProtectionDomain().getCodeSource();
            if (source == null) return null;

            URL location = source.getLocation();
            if (location == null) return null;

            Path p = Path.of(location.toURI());
            // A jar resolves to its directory, an exploded classes dir to itself.
            return Files.isRegularFile(p) ? p.getParent() : p;
        } catch (URISyntaxException | RuntimeException e) {
            return null;
        }
    }
}
