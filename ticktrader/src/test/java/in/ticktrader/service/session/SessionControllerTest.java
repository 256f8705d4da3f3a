package in.ticktrader.service.session;

import in.ticktrader.Await;
import in.ticktrader.MutableClock;
import in.ticktrader.TestConfigs;
import in.ticktrader.config.InstrumentConfig;
import in.ticktrader.config.SessionConfig;
import in.ticktrader.config.StrategyConfig;
import in.ticktrader.domain.common.DiagnosticEvent;
import in.ticktrader.domain.common.EventType;
import in.ticktrader.domain.data.Tick;
import in.ticktrader.domain.feed.ConsumptionMode;
import in.ticktrader.domain.trade.ExitReason;
import in.ticktrader.domain.trade.PositionSnapshot;
import in.ticktrader.infrastructure.feed.ScriptedFeedSource;
import in.ticktrader.infrastructure.feed.TickNormalizer;
import in.ticktrader.infrastructure.feed.common.ReconnectionPolicy;
import in.ticktrader.infrastructure.feed.metrics.FeedMetrics;
import in.ticktrader.service.core.CountRateLimiter;
import in.ticktrader.service.core.DiagnosticEmitter;
import in.ticktrader.service.feed.FeedAdapter;
import in.ticktrader.service.risk.RiskManager;
import in.ticktrader.service.signal.IndicatorDecisionEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static in.ticktrader.TestConfigs.at;
import static in.ticktrader.TestConfigs.bd;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * End-to-end session runs over a scripted feed.
 *
 * Tests:
 * - Consecutive-tick entry and adverse exit produce the same ledger in both modes
 * - Malformed ticks accumulate into an error-streak stop
 * - Operator stop, session-end flatten and connect failure stops
 * - Invalid config is refused before the session is built
 * - Results sink receives exactly one report, and its failure does not block the stop
 */
@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock
    private SessionResultsSink resultsSink;

    private final MutableClock clock = new MutableClock(TestConfigs.T0);
    private final List<DiagnosticEvent> events = new CopyOnWriteArrayList<>();
    private ScriptedFeedSource source;
    private RiskManager risk;
    private SessionController controller;

    @AfterEach
    void tearDown() throws Exception {
        if (controller != null) {
            controller.stop().get(5, TimeUnit.SECONDS);
        }
    }

    private SessionController controller(ConsumptionMode mode, StrategyConfig strategy) {
        return controller(TestConfigs.session(mode, TestConfigs.risk(), strategy,
            TestConfigs.feed(TestConfigs.fileSource("unused.csv"), 1000)));
    }

    private SessionController controller(SessionConfig config) {
        source = new ScriptedFeedSource();
        DiagnosticEmitter diagnostics = new DiagnosticEmitter(events::add, new CountRateLimiter(1));
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(10))
            .maxDelay(Duration.ofMillis(100))
            .multiplier(2.0)
            .maxAttempts(3)
            .clock(clock)
            .build();
        FeedAdapter feed = new FeedAdapter(source,
            new TickNormalizer(TestConfigs.csvMapping(), TestConfigs.INSTRUMENT),
            TestConfigs.INSTRUMENT,
            new FeedAdapter.Settings(1000, Duration.ofSeconds(60), Duration.ofHours(1)),
            policy, FeedMetrics.noop(), clock);
        risk = RiskManager.fromConfig(config, diagnostics, clock);
        controller = new SessionController(config, feed,
            IndicatorDecisionEngine.fromConfig(config, diagnostics), risk,
            FeedMetrics.noop(), resultsSink, diagnostics, clock);
        return controller;
    }

    private static SessionReport await(SessionController controller) throws Exception {
        return controller.completion().get(5, TimeUnit.SECONDS);
    }

    private List<PositionSnapshot> runScenarioOne(ConsumptionMode mode) throws Exception {
        SessionController session = controller(mode, TestConfigs.strategy().build());
        source.push("100", at(1)).push("101", at(2)).push("103", at(3)).push("99", at(4)).finite();

        SessionReport report = session.start().get(5, TimeUnit.SECONDS);

        assertEquals(StopReason.FEED_COMPLETED, report.stopReason());
        assertEquals(4, report.ticksProcessed());
        assertEquals(mode, report.consumptionMode());
        return report.closedPositions();
    }

    // ═══════════════════════════════════════════════════════════════
    // END TO END
    // ═══════════════════════════════════════════════════════════════

    @ParameterizedTest
    @EnumSource(ConsumptionMode.class)
    @DisplayName("100, 101, 103, 99: long at 103, closed at 99 by the adverse tick")
    void testConsecutiveEntryAdverseExit(ConsumptionMode mode) throws Exception {
        List<PositionSnapshot> ledger = runScenarioOne(mode);

        assertEquals(1, ledger.size());
        PositionSnapshot trade = ledger.get(0);
        assertEquals(0, bd("103").compareTo(trade.entryPrice()));
        assertEquals(0, bd("99").compareTo(trade.exitPrice()));
        assertEquals(ExitReason.STRATEGY_SIGNAL, trade.closeReason());
        assertEquals(at(3), trade.openedAt());
        assertEquals(at(4), trade.closedAt());
        assertEquals(0, bd("-400").compareTo(trade.realizedPnl()), "100 x (99 - 103)");
    }

    @Test
    void testBothModesProduceIdenticalLedgers() throws Exception {
        List<PositionSnapshot> polled = runScenarioOne(ConsumptionMode.POLL);
        List<PositionSnapshot> callback = runScenarioOne(ConsumptionMode.CALLBACK);

        assertEquals(polled, callback);
    }

    @Test
    void testReportPublishedOnceWithTotals() throws Exception {
        runScenarioOne(ConsumptionMode.POLL);

        verify(resultsSink, times(1)).publish(any(SessionReport.class));
        SessionReport report = controller.completion().get();
        assertEquals(0, bd("100000").compareTo(report.initialCapital()));
        assertEquals(0, bd("99600").compareTo(report.finalCapital()));
        assertEquals(4, report.ticksReceived());
        assertFalse(report.finalFeedState().terminal());

        DiagnosticEvent stopped = events.stream()
            .filter(e -> e.type() == EventType.SESSION_STOPPED)
            .findFirst().orElseThrow();
        assertEquals("FEED_COMPLETED", stopped.payload().get("reason"));
    }

    // ═══════════════════════════════════════════════════════════════
    // ERROR STREAK
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testStreakIncrementsOncePerMalformedTick() {
        SessionController session = controller(ConsumptionMode.POLL,
            TestConfigs.strategy().errorStreakThreshold(3).build());
        Tick malformed = Tick.of(TestConfigs.INSTRUMENT, null, at(1));

        session.processTick(malformed);
        assertEquals(1, session.currentErrorStreak());
        session.processTick(malformed);
        assertEquals(2, session.currentErrorStreak());
        session.processTick(TestConfigs.tick("100", 2));
        assertEquals(0, session.currentErrorStreak(), "a processed tick resets the streak");
        assertFalse(session.isStopRequested());

        session.processTick(malformed);
        session.processTick(malformed);
        session.processTick(malformed);
        assertTrue(session.isStopRequested());
    }

    @ParameterizedTest
    @EnumSource(ConsumptionMode.class)
    void testMalformedTicksStopSession(ConsumptionMode mode) throws Exception {
        SessionController session = controller(mode, TestConfigs.strategy().errorStreakThreshold(3).build());
        source.push("100", at(1));
        for (int i = 2; i <= 4; i++) {
            source.pushFields(Map.of("timestamp", at(i).toString()), at(i));
        }

        session.start();
        SessionReport report = await(session);

        assertEquals(StopReason.ERROR_STREAK_EXCEEDED, report.stopReason());
        assertTrue(report.stopReason().isFault());
        assertTrue(report.terminalMessage().startsWith("stopped: error streak exceeded"),
            report.terminalMessage());
        assertEquals(3, report.malformedTicks());
        assertEquals(3, report.maxErrorStreak());
        assertEquals(1, report.ticksProcessed());
    }

    @Test
    void testInterleavedFailuresNeverReachThreshold() throws Exception {
        SessionController session = controller(ConsumptionMode.POLL,
            TestConfigs.strategy().errorStreakThreshold(2).build());
        for (int i = 1; i <= 6; i += 2) {
            source.pushFields(Map.of("timestamp", at(i).toString()), at(i));
            source.push("100", at(i + 1));
        }
        source.finite();

        SessionReport report = session.start().get(5, TimeUnit.SECONDS);

        assertEquals(StopReason.FEED_COMPLETED, report.stopReason());
        assertEquals(3, report.malformedTicks());
        assertEquals(1, report.maxErrorStreak());
    }

    // ═══════════════════════════════════════════════════════════════
    // STOPS
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testOperatorStopClosesOpenPosition() throws Exception {
        SessionController session = controller(ConsumptionMode.CALLBACK, TestConfigs.strategy().build());
        source.push("100", at(1)).push("101", at(2)).push("103", at(3));

        session.start();
        Await.until(risk::hasOpenPosition, "position opened");
        SessionReport report = session.stop().get(5, TimeUnit.SECONDS);

        assertEquals(StopReason.OPERATOR_STOP, report.stopReason());
        assertFalse(report.stopReason().isFault());
        assertEquals("stopped: operator request", report.terminalMessage());
        assertEquals(1, report.closedPositions().size());
        PositionSnapshot closed = report.closedPositions().get(0);
        assertEquals(ExitReason.SESSION_STOP, closed.closeReason());
        assertEquals(0, bd("103").compareTo(closed.exitPrice()), "closed at the last observed price");
        assertFalse(risk.hasOpenPosition());
    }

    @Test
    void testFirstStopReasonWins() throws Exception {
        SessionController session = controller(ConsumptionMode.POLL, TestConfigs.strategy().build());
        session.start();

        SessionReport report = session.stop(StopReason.FEED_UNRECOVERABLE, "after 3 attempts").get(5, TimeUnit.SECONDS);
        session.stop().get(5, TimeUnit.SECONDS);

        assertEquals(StopReason.FEED_UNRECOVERABLE, report.stopReason());
        assertEquals("stopped: feed unrecoverable after 3 attempts", report.terminalMessage());
        verify(resultsSink, times(1)).publish(any(SessionReport.class));
    }

    @Test
    void testSessionEndFlattensPosition() throws Exception {
        SessionController session = controller(ConsumptionMode.POLL, TestConfigs.strategy().build());
        // 15:25 and 15:30 IST
        Instant beforeEnd = Instant.parse("2024-01-02T09:55:00Z");
        Instant end = Instant.parse("2024-01-02T10:00:00Z");
        source.push("100", at(1)).push("101", at(2)).push("103", at(3))
            .push("104", beforeEnd).push("105", end);

        session.start();
        SessionReport report = await(session);

        assertEquals(StopReason.SESSION_WINDOW_ENDED, report.stopReason());
        PositionSnapshot closed = report.closedPositions().get(0);
        assertEquals(ExitReason.SESSION_END, closed.closeReason());
        assertEquals(0, bd("105").compareTo(closed.exitPrice()));
        assertEquals(end, closed.closedAt());
    }

    @Test
    void testConnectFailureStopsSession() throws Exception {
        SessionController session = controller(ConsumptionMode.POLL, TestConfigs.strategy().build());
        source.failNextConnects(1);

        session.start();
        SessionReport report = await(session);

        assertEquals(StopReason.FEED_CONNECT_FAILED, report.stopReason());
        assertTrue(report.closedPositions().isEmpty());
    }

    @Test
    void testMissingLotSizeRefusesToBuildSession() {
        SessionConfig base = TestConfigs.session(ConsumptionMode.POLL, TestConfigs.risk(),
            TestConfigs.strategy().build(), TestConfigs.feed(TestConfigs.fileSource("unused.csv"), 1000));
        SessionConfig noLot = new SessionConfig(
            new InstrumentConfig(TestConfigs.INSTRUMENT, "NSE", null, new BigDecimal("0.05")),
            base.consumptionMode(), base.capital(), base.risk(), base.strategy(), base.session(),
            base.feed(), base.diagnostics());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> controller(noLot));

        assertTrue(e.getMessage().contains("instrument.lotSize"), e.getMessage());
        assertNull(controller, "no session should exist after a refused config");
        assertEquals(0, source.connects(), "feed must not be touched");
        verifyNoInteractions(resultsSink);
    }

    @Test
    void testStopBeforeStartFinishesImmediately() throws Exception {
        SessionController session = controller(ConsumptionMode.POLL, TestConfigs.strategy().build());

        SessionReport report = session.stop().get(1, TimeUnit.SECONDS);

        assertEquals(StopReason.OPERATOR_STOP, report.stopReason());
        assertThrows(IllegalStateException.class, session::start);
    }

    @Test
    void testResultsSinkFailureDoesNotBlockStop() throws Exception {
        doThrow(new IllegalStateException("disk full")).when(resultsSink).publish(any());
        SessionController session = controller(ConsumptionMode.POLL, TestConfigs.strategy().build());

        SessionReport report = session.stop().get(1, TimeUnit.SECONDS);

        assertNotNull(report);
        assertTrue(events.stream().anyMatch(e -> e.type() == EventType.SESSION_STOPPED));
    }
}
