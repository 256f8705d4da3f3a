package in.ticktrader.service.risk;

import in.ticktrader.MutableClock;
import in.ticktrader.TestConfigs;
import in.ticktrader.config.RiskConfig;
import in.ticktrader.config.TakeProfitConfig;
import in.ticktrader.domain.common.DiagnosticEvent;
import in.ticktrader.domain.common.EventType;
import in.ticktrader.domain.signal.Signal;
import in.ticktrader.domain.trade.ExitReason;
import in.ticktrader.domain.trade.ExitTrigger;
import in.ticktrader.domain.trade.OpenFailure;
import in.ticktrader.domain.trade.OpenResult;
import in.ticktrader.domain.trade.PartialExit;
import in.ticktrader.domain.trade.PositionSnapshot;
import in.ticktrader.domain.trade.PositionStatus;
import in.ticktrader.service.core.CountRateLimiter;
import in.ticktrader.service.core.DiagnosticEmitter;
import in.ticktrader.service.core.DiagnosticEventSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static in.ticktrader.TestConfigs.bd;
import static in.ticktrader.TestConfigs.tick;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for RiskManager.
 *
 * Tests:
 * - Stop-loss, trailing stop and laddered take-profit exits
 * - Take-profit levels fire at most once
 * - Exit precedence when several triggers match one tick
 * - Open refusals (missing instrument params, capital, exclusivity, halt)
 * - At most one open position under concurrent opens
 */
@ExtendWith(MockitoExtension.class)
class RiskManagerTest {

    private static final SizingInputs SIZING = SizingInputs.fromConfig(TestConfigs.instrument());

    @Mock
    private DiagnosticEventSink sink;

    private final MutableClock clock = new MutableClock(TestConfigs.T0);

    private RiskManager riskManager(RiskConfig risk) {
        return riskManager(risk, bd("100000"));
    }

    private RiskManager riskManager(RiskConfig risk, BigDecimal capital) {
        return new RiskManager(TestConfigs.INSTRUMENT, risk, capital,
            new DiagnosticEmitter(sink, new CountRateLimiter(1)), clock);
    }

    private static Signal enterLong(String price, int s) {
        return Signal.enterLong(bd(price), "test", TestConfigs.at(s));
    }

    private static RiskConfig withPrecedence(List<ExitTrigger> precedence) {
        RiskConfig base = TestConfigs.risk();
        return new RiskConfig(base.stopLossPoints(), base.takeProfitLevels(), false, null, null,
            base.riskPerTradePercent(), base.maxPositionValuePercent(), base.commissionPercent(), precedence);
    }

    // ═══════════════════════════════════════════════════════════════
    // EXITS
    // ═══════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Entry 200, stop 10 points: 205 and 195 hold, 189 stops out the whole position")
    void testStopLoss() {
        RiskManager risk = riskManager(TestConfigs.risk());
        OpenResult result = risk.open(enterLong("200", 1), SIZING);
        assertTrue(result.success());

        assertTrue(risk.onTick(tick("205", 2), Optional.empty()).isEmpty());
        assertTrue(risk.onTick(tick("195", 3), Optional.empty()).isEmpty());
        List<PartialExit> legs = risk.onTick(tick("189", 4), Optional.empty());

        assertEquals(1, legs.size());
        assertEquals(ExitReason.STOP_LOSS, legs.get(0).reason());
        assertEquals(0, bd("189").compareTo(legs.get(0).price()));

        assertFalse(risk.hasOpenPosition());
        PositionSnapshot closed = risk.closedPositions().get(0);
        assertEquals(PositionStatus.CLOSED, closed.status());
        assertEquals(ExitReason.STOP_LOSS, closed.closeReason());
        assertEquals(100, closed.initialQuantity(), "1% of 100000 over a 10 point stop");
        assertEquals(0, bd("-1100").compareTo(closed.realizedPnl()));
        assertEquals(0, bd("98900").compareTo(risk.availableCapital()));
    }

    @Test
    @DisplayName("Two 50% take-profit levels close the position in two legs")
    void testTakeProfitLadder() {
        RiskConfig config = TestConfigs.risk(bd("10"), List.of(
            new TakeProfitConfig(bd("10"), bd("0.5")),
            new TakeProfitConfig(bd("20"), bd("0.5"))), false);
        RiskManager risk = riskManager(config);
        risk.open(enterLong("200", 1), SIZING);

        List<PartialExit> first = risk.onTick(tick("211", 2), Optional.empty());
        assertEquals(1, first.size());
        assertEquals(50, first.get(0).quantity());
        PositionSnapshot half = risk.activePosition().orElseThrow();
        assertEquals(50, half.quantity());
        assertTrue(half.takeProfitLevels().get(0).fired());
        assertFalse(half.takeProfitLevels().get(1).fired());

        // Back through the first level: already fired, nothing happens
        assertTrue(risk.onTick(tick("209", 3), Optional.empty()).isEmpty());
        assertTrue(risk.onTick(tick("212", 4), Optional.empty()).isEmpty());

        List<PartialExit> second = risk.onTick(tick("221", 5), Optional.empty());
        assertEquals(1, second.size());
        assertEquals(50, second.get(0).quantity());

        PositionSnapshot closed = risk.closedPositions().get(0);
        assertEquals(PositionStatus.CLOSED, closed.status());
        assertEquals(ExitReason.TAKE_PROFIT, closed.closeReason());
        assertEquals(2, closed.exits().size());
        // 50 x 11 + 50 x 21
        assertEquals(0, bd("1600").compareTo(closed.realizedPnl()));
    }

    @Test
    void testGapThroughBothLevelsFiresBothOnOneTick() {
        RiskConfig config = TestConfigs.risk(bd("10"), List.of(
            new TakeProfitConfig(bd("10"), bd("0.5")),
            new TakeProfitConfig(bd("20"), bd("0.5"))), false);
        RiskManager risk = riskManager(config);
        risk.open(enterLong("200", 1), SIZING);

        List<PartialExit> legs = risk.onTick(tick("230", 2), Optional.empty());
        assertEquals(2, legs.size());
        assertEquals(100, legs.stream().mapToInt(PartialExit::quantity).sum());
        assertFalse(risk.hasOpenPosition());
    }

    @Test
    @DisplayName("A single 30% level takes 30 of 100 and leaves the rest running")
    void testPartialLadderLeavesRemainderOpen() {
        RiskConfig config = TestConfigs.risk(bd("10"), List.of(
            new TakeProfitConfig(bd("10"), bd("0.3"))), false);
        RiskManager risk = riskManager(config);
        risk.open(enterLong("200", 1), SIZING);

        List<PartialExit> legs = risk.onTick(tick("211", 2), Optional.empty());

        assertEquals(1, legs.size());
        assertEquals(ExitReason.TAKE_PROFIT, legs.get(0).reason());
        assertEquals(30, legs.get(0).quantity(), "30% of 100, not the whole remainder");
        assertTrue(risk.hasOpenPosition());
        PositionSnapshot rest = risk.activePosition().orElseThrow();
        assertEquals(70, rest.quantity());
        assertEquals(PositionStatus.OPEN, rest.status());
        assertTrue(rest.takeProfitLevels().get(0).fired());

        // Ladder exhausted: further gains do nothing, the stop still guards the rest
        assertTrue(risk.onTick(tick("240", 3), Optional.empty()).isEmpty());
        List<PartialExit> stop = risk.onTick(tick("189", 4), Optional.empty());
        assertEquals(1, stop.size());
        assertEquals(ExitReason.STOP_LOSS, stop.get(0).reason());
        assertEquals(70, stop.get(0).quantity());
        assertFalse(risk.hasOpenPosition());
    }

    @Test
    void testTrailingStopRatchetsAndExits() {
        RiskManager risk = riskManager(TestConfigs.risk(bd("10"),
            List.of(new TakeProfitConfig(bd("50"), BigDecimal.ONE)), true));
        risk.open(enterLong("200", 1), SIZING);

        risk.onTick(tick("204", 2), Optional.empty());
        assertFalse(risk.activePosition().orElseThrow().trailingArmed(), "not armed before +5");

        risk.onTick(tick("206", 3), Optional.empty());
        assertEquals(0, bd("203").compareTo(risk.activePosition().orElseThrow().trailingStopPrice()));

        risk.onTick(tick("208", 4), Optional.empty());
        assertEquals(0, bd("205").compareTo(risk.activePosition().orElseThrow().trailingStopPrice()));

        risk.onTick(tick("206", 5), Optional.empty());
        assertEquals(0, bd("205").compareTo(risk.activePosition().orElseThrow().trailingStopPrice()),
            "trail never moves against the position");

        List<PartialExit> legs = risk.onTick(tick("204.5", 6), Optional.empty());
        assertEquals(ExitReason.TRAILING_STOP, legs.get(0).reason());
        assertFalse(risk.hasOpenPosition());
    }

    @Test
    void testStrategyCloseRequest() {
        RiskManager risk = riskManager(TestConfigs.risk());
        risk.open(enterLong("200", 1), SIZING);

        List<PartialExit> legs = risk.onTick(tick("199", 2),
            Optional.of(Signal.close(bd("199"), "adverse tick", TestConfigs.at(2))));

        assertEquals(ExitReason.STRATEGY_SIGNAL, legs.get(0).reason());
        assertEquals(0, bd("-100").compareTo(risk.realizedPnl()));
    }

    @Test
    void testPrecedenceStopLossBeforeStrategy() {
        Signal close = Signal.close(bd("189"), "adverse tick", TestConfigs.at(2));

        RiskManager defaultOrder = riskManager(TestConfigs.risk());
        defaultOrder.open(enterLong("200", 1), SIZING);
        assertEquals(ExitReason.STOP_LOSS,
            defaultOrder.onTick(tick("189", 2), Optional.of(close)).get(0).reason());

        RiskManager strategyFirst = riskManager(withPrecedence(List.of(
            ExitTrigger.STRATEGY_SIGNAL, ExitTrigger.STOP_LOSS, ExitTrigger.TRAILING_STOP, ExitTrigger.TAKE_PROFIT)));
        strategyFirst.open(enterLong("200", 1), SIZING);
        assertEquals(ExitReason.STRATEGY_SIGNAL,
            strategyFirst.onTick(tick("189", 2), Optional.of(close)).get(0).reason());
    }

    @Test
    void testCommissionReducesPnl() {
        RiskConfig base = TestConfigs.risk();
        RiskConfig withCommission = new RiskConfig(base.stopLossPoints(), base.takeProfitLevels(), false, null, null,
            base.riskPerTradePercent(), base.maxPositionValuePercent(), bd("0.1"), base.exitPrecedence());
        RiskManager risk = riskManager(withCommission);
        risk.open(enterLong("200", 1), SIZING);
        risk.onTick(tick("189", 2), Optional.empty());

        // gross -1100, turnover (200 + 189) x 100 = 38900, commission 38.9
        assertEquals(0, bd("-1138.9").compareTo(risk.realizedPnl()));
    }

    // ═══════════════════════════════════════════════════════════════
    // OPEN REFUSALS
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testMissingLotSizeIsFatalAndCreatesNothing() {
        RiskManager risk = riskManager(TestConfigs.risk());

        OpenResult result = risk.open(enterLong("200", 1),
            new SizingInputs(TestConfigs.INSTRUMENT, null, bd("0.05")));

        assertFalse(result.success());
        assertEquals(OpenFailure.INVALID_INSTRUMENT_PARAMS, result.failure());
        assertTrue(result.failure().isFatal());
        assertFalse(risk.hasOpenPosition());
        assertTrue(risk.closedPositions().isEmpty());

        ArgumentCaptor<DiagnosticEvent> captor = ArgumentCaptor.forClass(DiagnosticEvent.class);
        verify(sink).publish(captor.capture());
        assertEquals(EventType.POSITION_OPEN_FAILED, captor.getValue().type());
    }

    @Test
    void testZeroTickSizeIsFatal() {
        RiskManager risk = riskManager(TestConfigs.risk());
        OpenResult result = risk.open(enterLong("200", 1),
            new SizingInputs(TestConfigs.INSTRUMENT, 1, BigDecimal.ZERO));
        assertEquals(OpenFailure.INVALID_INSTRUMENT_PARAMS, result.failure());
    }

    @Test
    void testInsufficientCapital() {
        RiskManager risk = riskManager(TestConfigs.risk(), bd("100"));
        OpenResult result = risk.open(enterLong("200", 1), SIZING);

        assertEquals(OpenFailure.INSUFFICIENT_CAPITAL, result.failure());
        assertFalse(result.failure().isFatal());
        assertFalse(risk.hasOpenPosition());
    }

    @Test
    void testSecondOpenRefused() {
        RiskManager risk = riskManager(TestConfigs.risk());
        assertTrue(risk.open(enterLong("200", 1), SIZING).success());

        OpenResult second = risk.open(enterLong("201", 2), SIZING);
        assertEquals(OpenFailure.POSITION_ALREADY_OPEN, second.failure());
    }

    @Test
    void testNonEntrySignalRejected() {
        RiskManager risk = riskManager(TestConfigs.risk());
        assertThrows(IllegalArgumentException.class,
            () -> risk.open(Signal.close(bd("200"), "x", TestConfigs.at(1)), SIZING));
    }

    @Test
    void testHaltRefusesNewPositions() {
        RiskManager risk = riskManager(TestConfigs.risk());
        risk.halt();
        assertEquals(OpenFailure.SESSION_STOPPED, risk.open(enterLong("200", 1), SIZING).failure());
    }

    @Test
    void testConcurrentOpensYieldOnePosition() throws Exception {
        RiskManager risk = riskManager(TestConfigs.risk());
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<OpenResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    return risk.open(enterLong("200", 1), SIZING);
                }));
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            go.countDown();

            List<OpenResult> results = Collections.synchronizedList(new ArrayList<>());
            for (Future<OpenResult> f : futures) {
                results.add(f.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, results.stream().filter(OpenResult::success).count());
            assertTrue(results.stream().filter(r -> !r.success())
                .allMatch(r -> r.failure() == OpenFailure.POSITION_ALREADY_OPEN));
            assertTrue(risk.hasOpenPosition());
        } finally {
            pool.shutdownNow();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // CLOSE
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testCloseIsIdempotent() {
        RiskManager risk = riskManager(TestConfigs.risk());
        String id = risk.open(enterLong("200", 1), SIZING).positionId();
        risk.onTick(tick("202", 2), Optional.empty());

        assertTrue(risk.close(id, ExitReason.SESSION_STOP));
        assertFalse(risk.close(id, ExitReason.SESSION_STOP));
        assertFalse(risk.close("unknown", ExitReason.SESSION_STOP));

        assertEquals(1, risk.closedPositions().size());
        PositionSnapshot closed = risk.closedPositions().get(0);
        assertEquals(0, bd("202").compareTo(closed.exitPrice()), "closed at the last observed price");
        assertEquals(TestConfigs.T0, closed.closedAt(), "closed at the clock's time");
    }

    @Test
    void testSlotFreesAfterClose() {
        RiskManager risk = riskManager(TestConfigs.risk());
        String id = risk.open(enterLong("200", 1), SIZING).positionId();
        risk.close(id, ExitReason.SESSION_STOP, bd("201"), TestConfigs.at(2));

        OpenResult next = risk.open(enterLong("201", 3), SIZING);
        assertTrue(next.success());
        assertNotEquals(id, next.positionId());
    }

    @Test
    void testListenersNotifiedAfterLockRelease() {
        RiskManager risk = riskManager(TestConfigs.risk());
        List<String> seen = new ArrayList<>();
        risk.addListener(new PositionListener() {
            @Override
            public void onPositionOpened(PositionSnapshot position) {
                seen.add("opened " + position.id() + " " + risk.hasOpenPosition());
            }

            @Override
            public void onPositionClosed(PositionSnapshot position) {
                seen.add("closed " + position.closeReason() + " " + risk.hasOpenPosition());
            }
        });

        String id = risk.open(enterLong("200", 1), SIZING).positionId();
        risk.onTick(tick("189", 2), Optional.empty());

        assertEquals(List.of("opened " + id + " true", "closed STOP_LOSS false"), seen);
    }
}
