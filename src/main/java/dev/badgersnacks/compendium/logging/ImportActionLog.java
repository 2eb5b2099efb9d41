package dev.badgersnacks.compendium.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Append-only audit file for one import session: one {@code timestamp [action] message} line per ingest or
 * expansion step, followed by any warnings the step produced.
 */
public final class ImportActionLog implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImportActionLog.class);
    private static final DateTimeFormatter FILE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneId.systemDefault());
    private static final DateTimeFormatter ENTRY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private final Path logFile;
    private final BufferedWriter writer;

    public ImportActionLog() {
        this(Path.of(System.getProperty("user.home"), ".compendium-variants", "logs"));
    }

    public ImportActionLog(Path logsDir) {
        Objects.requireNonNull(logsDir, "logsDir");
        try {
            Files.createDirectories(logsDir);
            this.logFile = logsDir.resolve("import-" + FILE_FORMAT.format(Instant.now()) + ".log").toAbsolutePath();
            this.writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log("session:start", "Import session logging to " + logFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to initialize import action log in " + logsDir, e);
        }
    }

    public Path logFile() {
        return logFile;
    }

    public void log(String action, String message) {
        log(action, message, null);
    }

    public void logWarnings(String action, List<String> warnings) {
        for (String warning : warnings) {
            log(action + ":warning", warning);
        }
    }

    public synchronized void log(String action, String message, Throwable error) {
        StringBuilder entry = new StringBuilder(128)
                .append(ENTRY_FORMAT.format(Instant.now()))
                .append(" [").append(action).append("] ")
                .append(Objects.toString(message, ""))
                .append(System.lineSeparator());
        if (error != null) {
            entry.append(stackTraceOf(error));
        }
        try {
            writer.write(entry.toString());
            writer.flush();
        } catch (IOException e) {
            LOGGER.warn("Failed to append {} entry to import log {}", action, logFile, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            log("session:end", "Closing import session log.");
            writer.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close import action log {}", logFile, e);
        }
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter trace = new StringWriter();
        try (PrintWriter printer = new PrintWriter(trace)) {
            error.printStackTrace(printer);
        }
        return trace.toString();
    }
}
