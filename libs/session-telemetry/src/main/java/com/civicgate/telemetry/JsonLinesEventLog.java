package com.civicgate.telemetry;

import com.civicgate.eventmodel.EventSerializer;
import com.civicgate.eventmodel.SessionSnapshot;
import com.civicgate.eventmodel.TelemetryEvent;
import com.civicgate.eventmodel.EventWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only telemetry files: {@code events.jsonl} with one event per line and
 * {@code sessions.jsonl} with a session snapshot per line.
 * <p>
 * Lines are flushed as they are written. Appends are serialized on this object, so lines
 * from concurrent sessions never interleave.
 */
public final class JsonLinesEventLog implements EventWriter, Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesEventLog.class);

    public static final String EVENTS_FILE = "events.jsonl";
    public static final String SESSIONS_FILE = "sessions.jsonl";

    private final Path eventsFile;
    private final Path sessionsFile;
    private final BufferedWriter events;
    private final BufferedWriter sessions;

    /**
     * Opens (creating if needed) both files under {@code dataDir}.
     *
     * @throws UncheckedIOException if the directory or the files cannot be opened
     */
    public JsonLinesEventLog(Path dataDir) {
        try {
            Files.createDirectories(dataDir);
            this.eventsFile = dataDir.resolve(EVENTS_FILE);
            this.sessionsFile = dataDir.resolve(SESSIONS_FILE);
            this.events = open(eventsFile);
            this.sessions = open(sessionsFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open telemetry log in " + dataDir, e);
        }
        log.info("Session telemetry log at {}", dataDir.toAbsolutePath());
    }

    public Path eventsFile() {
        return eventsFile;
    }

    public Path sessionsFile() {
        return sessionsFile;
    }

    @Override
    public synchronized void append(TelemetryEvent event) {
        writeLine(events, EventSerializer.toJsonLine(event), EVENTS_FILE);
    }

    @Override
    public void sessionStarted(SessionSnapshot snapshot) {
        sessionUpdated(snapshot);
    }

    @Override
    public synchronized void sessionUpdated(SessionSnapshot snapshot) {
        writeLine(sessions, EventSerializer.toJsonLine(snapshot), SESSIONS_FILE);
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            events.close();
        } finally {
            sessions.close();
        }
    }

    private static void writeLine(BufferedWriter writer, String line, String file) {
        try {
            writer.write(line);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            log.warn("Append to {} failed: {}", file, e.getMessage());
        }
    }

    private static BufferedWriter open(Path file) throws IOException {
        return Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }
}
