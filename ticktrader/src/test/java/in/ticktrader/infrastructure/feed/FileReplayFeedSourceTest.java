package in.ticktrader.infrastructure.feed;

import in.ticktrader.MutableClock;
import in.ticktrader.TestConfigs;
import in.ticktrader.config.FeedSourceConfig.ReplaySpeed;
import in.ticktrader.domain.data.RawMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileReplayFeedSourceTest {

    @TempDir
    Path dir;

    @Test
    void testReplaysRowsThenExhausts() throws Exception {
        Path csv = dir.resolve("ticks.csv");
        Files.writeString(csv, "timestamp,price,volume\n"
            + "2024-01-02T04:00:00Z,100,10\n"
            + "\n"
            + "2024-01-02T04:00:01Z,101,\n");

        FileReplayFeedSource source = new FileReplayFeedSource(csv, ReplaySpeed.INSTANT, new MutableClock(TestConfigs.T0));
        source.connect();
        assertTrue(source.isConnected());

        List<RawMessage> messages = new ArrayList<>();
        Optional<RawMessage> next;
        while ((next = source.nextRawMessage()).isPresent()) {
            messages.add(next.get());
        }

        assertEquals(2, messages.size());
        assertEquals("100", messages.get(0).field("price"));
        assertEquals("10", messages.get(0).field("volume"));
        assertNull(messages.get(1).field("volume"), "empty cell omitted");
        assertTrue(source.isExhausted());
        assertEquals(2, source.linesRead());
    }

    @Test
    void testMissingFileFailsConnect() {
        FileReplayFeedSource source = new FileReplayFeedSource(dir.resolve("absent.csv"), ReplaySpeed.INSTANT,
            new MutableClock(TestConfigs.T0));

        FeedConnectionException e = assertThrows(FeedConnectionException.class, source::connect);
        assertEquals("FILE", e.getFeedId());
        assertFalse(source.isConnected());
    }

    @Test
    void testEmptyFileFailsConnect() throws Exception {
        Path csv = dir.resolve("empty.csv");
        Files.writeString(csv, "");

        FileReplayFeedSource source = new FileReplayFeedSource(csv, ReplaySpeed.INSTANT, new MutableClock(TestConfigs.T0));
        assertThrows(FeedConnectionException.class, source::connect);
    }

    @Test
    void testDisconnectedSourceReturnsNothing() throws Exception {
        Path csv = dir.resolve("ticks.csv");
        Files.writeString(csv, "timestamp,price\n2024-01-02T04:00:00Z,100\n");

        FileReplayFeedSource source = new FileReplayFeedSource(csv, ReplaySpeed.INSTANT, new MutableClock(TestConfigs.T0));
        assertTrue(source.nextRawMessage().isEmpty());
        assertFalse(source.isExhausted());
    }
}
