package in.ticktrader.infrastructure.feed;

import in.ticktrader.domain.data.RawMessage;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Relay WebSocket source - receives JSON ticks from a feed relay.
 *
 * The relay holds the broker session; this source only reads. Each text frame
 * is a JSON object (or an array of objects) whose top-level scalar fields are
 * copied into a {@link RawMessage}. Field names and units are interpreted later
 * by {@link TickNormalizer}.
 *
 * Frames are handed from the socket's listener thread to the adapter's receive
 * thread through an internal queue; {@link #nextRawMessage()} waits on it for
 * at most {@link #POLL_WAIT}.
 *
 * Usage:
 *   feed.source.type = RELAY
 *   feed.source.relayUrl = ws://RELAY_HOST:7071/ticks?token=SECRET
 */
public final class RelayWebSocketFeedSource implements FeedSource {
    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketFeedSource.class);

    static final Duration POLL_WAIT = Duration.ofMillis(50);
    private static final int INBOX_CAPACITY = 10_000;

    private final String relayUrl;
    private final Duration connectTimeout;
    private final Clock clock;
    private final HttpClient httpClient;

    private final AtomicReference<WebSocket> wsRef = new AtomicReference<>(null);
    private final BlockingQueue<RawMessage> inbox = new LinkedBlockingQueue<>(INBOX_CAPACITY);
    private final AtomicLong framesDropped = new AtomicLong();
    private final AtomicLong framesMalformed = new AtomicLong();

    private volatile boolean connected = false;

    public RelayWebSocketFeedSource(String relayUrl, Duration connectTimeout, Clock clock) {
        this.relayUrl = relayUrl;
        this.connectTimeout = connectTimeout;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();

        log.info("[FEED] Relay source created (relay: {})", maskUrl(relayUrl));
    }

    @Override
    public String id() {
        return "RELAY";
    }

    @Override
    public void connect() {
        log.info("[FEED] Connecting to relay {}", maskUrl(relayUrl));
        inbox.clear();

        CompletableFuture<WebSocket> handshake = httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(URI.create(relayUrl), new RelayListener());
        try {
            WebSocket ws = handshake.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            wsRef.set(ws);
            connected = true;
            log.info("[FEED] ✅ Connected to relay");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handshake.cancel(true);
            throw new FeedConnectionException(id(), "interrupted while connecting", e);
        } catch (ExecutionException e) {
            throw new FeedConnectionException(id(), "handshake failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            handshake.cancel(true);
            throw new FeedConnectionException(id(), "handshake timed out after " + connectTimeout.toMillis() + "ms", e);
        }
    }

    @Override
    public Optional<RawMessage> nextRawMessage() throws InterruptedException {
        return Optional.ofNullable(inbox.poll(POLL_WAIT.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void disconnect() {
        WebSocket ws = wsRef.getAndSet(null);
        connected = false;
        if (ws != null) {
            try {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
            } catch (RuntimeException e) {
                log.debug("[FEED] Close frame not sent: {}", e.getMessage());
                ws.abort();
            }
        }
        log.info("[FEED] Relay disconnected (frames dropped={}, malformed={})",
            framesDropped.get(), framesMalformed.get());
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    /**
     * Parse one text frame into zero or more raw messages.
     */
    void handleFrame(String text) {
        try {
            String trimmed = text.trim();
            if (trimmed.startsWith("[")) {
                JSONArray batch = new JSONArray(trimmed);
                for (int i = 0; i < batch.length(); i++) {
                    JSONObject o = batch.optJSONObject(i);
                    if (o != null) {
                        offer(toRawMessage(o));
                    }
                }
            } else {
                offer(toRawMessage(new JSONObject(trimmed)));
            }
        } catch (JSONException e) {
            framesMalformed.incrementAndGet();
            log.debug("[FEED] Unparseable relay frame: {}", e.getMessage());
        }
    }

    int pendingMessages() {
        return inbox.size();
    }

    private RawMessage toRawMessage(JSONObject o) {
        Map<String, String> fields = new HashMap<>();
        for (String key : o.keySet()) {
            Object value = o.opt(key);
            if (value == null || JSONObject.NULL.equals(value)
                || value instanceof JSONObject || value instanceof JSONArray) {
                continue;
            }
            fields.put(key, String.valueOf(value));
        }
        return new RawMessage(fields, clock.instant());
    }

    private void offer(RawMessage message) {
        while (!inbox.offer(message)) {
            // Adapter fell behind; the oldest frame is the least useful one.
            inbox.poll();
            framesDropped.incrementAndGet();
        }
    }

    /**
     * Mask token in URL for logging.
     */
    static String maskUrl(String url) {
        if (url == null) return "null";
        int tokenIdx = url.indexOf("token=");
        if (tokenIdx < 0) return url;
        int endIdx = url.indexOf('&', tokenIdx);
        if (endIdx < 0) endIdx = url.length();
        return url.substring(0, tokenIdx + 6) + "***" + url.substring(endIdx);
    }

    private final class RelayListener implements WebSocket.Listener {
        private final StringBuilder buf = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String frame = buf.toString();
                buf.setLength(0);
                handleFrame(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            connected = false;
            wsRef.compareAndSet(webSocket, null);
            log.warn("[FEED] Relay closed the connection: {} {}", statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            connected = false;
            wsRef.compareAndSet(webSocket, null);
            log.error("[FEED] Relay WebSocket error", error);
        }
    }
}
