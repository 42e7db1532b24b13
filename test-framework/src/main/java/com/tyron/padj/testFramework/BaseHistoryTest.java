package com.tyron.padj.testFramework;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Base class for history and session tests.
 * <p>
 * Provides a fresh data directory and a manual clock per test.
 */
public abstract class BaseHistoryTest {

    protected static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    public Path temporaryFolder;

    protected Path dataDir;
    protected ManualClock clock;

    @BeforeEach
    public final void baseSetUp() throws Exception {
        TestLogging.configureOnce();
        dataDir = temporaryFolder.resolve("data");
        clock = new ManualClock(T0);
        beforeEach();
    }

    @AfterEach
    public final void baseTearDown() throws Exception {
        afterEach();
    }

    protected void beforeEach() throws Exception {
    }

    protected void afterEach() throws Exception {
    }
}
