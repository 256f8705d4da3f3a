package in.ticktrader.infrastructure.feed;

import in.ticktrader.config.FeedSourceConfig.ReplaySpeed;
import in.ticktrader.domain.data.RawMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Deterministic CSV replay behind the same contract as the live relay.
 *
 * The first line is a header naming the columns ({@code timestamp,price,volume}
 * and optionally {@code symbol}); every further line becomes one raw message
 * keyed by those names. Empty cells are left out of the message so that the
 * normalizer sees them as absent. Lines are paced by the configured
 * {@link ReplaySpeed}.
 */
public final class FileReplayFeedSource implements FeedSource {
    private static final Logger log = LoggerFactory.getLogger(FileReplayFeedSource.class);

    private final Path file;
    private final ReplaySpeed speed;
    private final Clock clock;

    private BufferedReader reader;
    private String[] header;
    private volatile boolean connected = false;
    private volatile boolean exhausted = false;
    private long linesRead = 0;
    private long lastEmitNanos = 0;

    public FileReplayFeedSource(Path file, ReplaySpeed speed, Clock clock) {
        this.file = file;
        this.speed = speed;
        this.clock = clock;
    }

    @Override
    public String id() {
        return "FILE";
    }

    @Override
    public synchronized void connect() {
        if (connected) {
            return;
        }
        if (exhausted) {
            // A replay is not restartable mid-session; reconnecting after the end is a no-op.
            connected = true;
            return;
        }
        try {
            reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                closeReader();
                throw new FeedConnectionException(id(), "replay file has no header: " + file);
            }
            header = splitLine(headerLine);
            for (int i = 0; i < header.length; i++) {
                header[i] = header[i].trim();
            }
            connected = true;
            log.info("[FEED] Replaying {} at {} speed (columns: {})", file, speed, String.join(",", header));
        } catch (IOException e) {
            throw new FeedConnectionException(id(), "cannot open replay file " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized Optional<RawMessage> nextRawMessage() throws InterruptedException {
        if (!connected || exhausted) {
            return Optional.empty();
        }
        try {
            String line;
            do {
                line = reader.readLine();
            } while (line != null && line.isBlank());

            if (line == null) {
                exhausted = true;
                closeReader();
                log.info("[FEED] Replay complete: {} lines from {}", linesRead, file);
                return Optional.empty();
            }
            pace();
            linesRead++;
            return Optional.of(new RawMessage(toFields(splitLine(line)), clock.instant()));
        } catch (IOException e) {
            connected = false;
            closeReader();
            throw new FeedConnectionException(id(), "replay read failed at line " + (linesRead + 2) + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void disconnect() {
        connected = false;
        closeReader();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean isExhausted() {
        return exhausted;
    }

    public long linesRead() {
        return linesRead;
    }

    private Map<String, String> toFields(String[] cells) {
        Map<String, String> fields = new HashMap<>();
        for (int i = 0; i < header.length && i < cells.length; i++) {
            String value = cells[i].trim();
            if (!value.isEmpty()) {
                fields.put(header[i], value);
            }
        }
        return fields;
    }

    private void pace() throws InterruptedException {
        long delay = speed.delayNanos();
        if (delay <= 0) {
            return;
        }
        long now = System.nanoTime();
        if (lastEmitNanos != 0) {
            long wait = lastEmitNanos + delay - now;
            if (wait > 0) {
                TimeUnit.NANOSECONDS.sleep(wait);
            }
        }
        lastEmitNanos = System.nanoTime();
    }

    private void closeReader() {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (IOException e) {
            log.debug("[FEED] Failed to close replay file: {}", e.getMessage());
        }
        reader = null;
    }

    private static String[] splitLine(String line) {
        return line.split(",", -1);
    }
}
