package in.ticktrader.service.core;

import in.ticktrader.TestConfigs;
import in.ticktrader.domain.common.DiagnosticEvent;
import in.ticktrader.domain.common.EventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DiagnosticEmitterTest {

    @Mock
    private DiagnosticEventSink sink;

    private DiagnosticEmitter emitter;

    @BeforeEach
    void setUp() {
        emitter = new DiagnosticEmitter(sink, new CountRateLimiter(3));
    }

    @Test
    void testRateLimitedTypesCarrySuppressedCount() {
        for (int i = 0; i < 4; i++) {
            emitter.emit(EventType.ENTRY_BLOCKED, "NIFTY", TestConfigs.at(i), "ENGINE", Map.of("i", i));
        }

        ArgumentCaptor<DiagnosticEvent> captor = ArgumentCaptor.forClass(DiagnosticEvent.class);
        verify(sink, times(2)).publish(captor.capture());
        List<DiagnosticEvent> events = captor.getAllValues();
        assertFalse(events.get(0).payload().containsKey("suppressed"));
        assertEquals(2L, events.get(1).payload().get("suppressed"));
        assertEquals(3, events.get(1).payload().get("i"));
    }

    @Test
    void testLifecycleTypesAlwaysEmitted() {
        for (int i = 0; i < 5; i++) {
            assertTrue(emitter.emit(EventType.EXIT_TRIGGERED, "NIFTY", TestConfigs.at(i), "RISK", Map.of()));
        }
        verify(sink, times(5)).publish(any());
    }

    @Test
    void testNullPayloadValuesDropped() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("cause", null);
        payload.put("attempt", 1);

        emitter.emit(EventType.FEED_RECONNECTING, "NIFTY", TestConfigs.T0, "feed", payload);

        ArgumentCaptor<DiagnosticEvent> captor = ArgumentCaptor.forClass(DiagnosticEvent.class);
        verify(sink).publish(captor.capture());
        assertEquals(Map.of("attempt", 1), captor.getValue().payload());
    }

    @Test
    void testFailingSinkDoesNotPropagate() {
        doThrow(new IllegalStateException("sink down")).when(sink).publish(any());

        assertFalse(emitter.emit(EventType.SESSION_STOPPED, "NIFTY", TestConfigs.T0, "session", Map.of()));
    }
}
