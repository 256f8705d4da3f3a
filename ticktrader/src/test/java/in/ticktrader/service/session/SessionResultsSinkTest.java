package in.ticktrader.service.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.ticktrader.TestConfigs;
import in.ticktrader.domain.feed.ConsumptionMode;
import in.ticktrader.domain.feed.FeedConnectionState;
import in.ticktrader.domain.feed.FeedStatus;
import in.ticktrader.domain.trade.Direction;
import in.ticktrader.domain.trade.ExitReason;
import in.ticktrader.domain.trade.PartialExit;
import in.ticktrader.domain.trade.PositionSnapshot;
import in.ticktrader.domain.trade.PositionStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static in.ticktrader.TestConfigs.at;
import static in.ticktrader.TestConfigs.bd;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SessionResultsSinkTest {

    @TempDir
    Path tempDir;

    private static SessionReport report() {
        PartialExit leg = new PartialExit(bd("99"), 100, ExitReason.STRATEGY_SIGNAL, at(4), bd("-400"));
        PositionSnapshot trade = new PositionSnapshot("NIFTY-1", TestConfigs.INSTRUMENT, Direction.LONG,
            bd("103"), 100, 0, bd("93"), null, false, List.of(), at(3),
            PositionStatus.CLOSED, ExitReason.STRATEGY_SIGNAL, at(4), bd("99"), bd("-400"), List.of(leg));
        return new SessionReport("NIFTY-1704168000000", TestConfigs.INSTRUMENT, ConsumptionMode.POLL,
            at(0), at(5), StopReason.FEED_COMPLETED, "stopped: feed completed", List.of(trade),
            new FeedConnectionState(FeedStatus.DISCONNECTED, at(4), 0, Duration.ofMillis(10), false),
            bd("100000"), bd("-400"), bd("99600"), 4, 0, 4, 0, 0, 0, 0, 0);
    }

    @Test
    void testJsonFileSinkWritesReport() throws Exception {
        Path dir = tempDir.resolve("reports");
        JsonFileSessionResultsSink sink = new JsonFileSessionResultsSink(dir);
        SessionReport report = report();

        sink.publish(report);

        Path file = sink.fileFor(report);
        assertTrue(Files.exists(file), "report file created along with its directory");
        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertEquals("FEED_COMPLETED", json.get("stopReason").asText());
        assertEquals("2024-01-02T04:00:03Z", json.get("closedPositions").get(0).get("openedAt").asText());
        assertEquals(new BigDecimal("-400"), json.get("realizedPnl").decimalValue());
        assertEquals(1, json.get("closedPositions").get(0).get("exits").size());
    }

    @Test
    void testCompositeSinkIsolatesFailures() {
        SessionResultsSink failing = mock(SessionResultsSink.class);
        SessionResultsSink working = mock(SessionResultsSink.class);
        SessionReport report = report();
        doThrow(new IllegalStateException("boom")).when(failing).publish(report);

        new CompositeSessionResultsSink(List.of(failing, working)).publish(report);

        verify(failing).publish(report);
        verify(working).publish(report);
    }

    @Test
    void testLoggingSinkAcceptsReport() {
        assertDoesNotThrow(() -> new LoggingSessionResultsSink().publish(report()));
    }
}
