package com.tyron.padj.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only java.util.logging setup.
 *
 * Level comes from system property {@value #LEVEL_PROPERTY} (INFO|FINE|FINER|FINEST|WARNING|SEVERE),
 * default WARNING so expected storage failures stay readable.
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "padj.test.logLevel";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY, "WARNING"));
        Formatter formatter = new CompactFormatter();

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(formatter);
            }
        }

        root.log(Level.CONFIG, "testLogging configured level=" + level.getName());
    }

    static Level parseLevel(String raw) {
        if (raw == null) return Level.WARNING;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return Level.WARNING;
        }
    }

    private static final class CompactFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ')
                    .append(simpleName(record.getLoggerName())).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }
}
