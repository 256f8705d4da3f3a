package in.ticktrader.infrastructure.feed;

import in.ticktrader.config.FeedConfig;
import in.ticktrader.config.FeedSourceConfig;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds the configured {@link FeedSource}.
 */
public final class FeedSources {

    public static FeedSource create(FeedConfig feed, Clock clock) {
        FeedSourceConfig source = feed.source();
        return switch (source.type()) {
            case RELAY -> new RelayWebSocketFeedSource(source.relayUrl(), feed.connectTimeout(), clock);
            case FILE -> new FileReplayFeedSource(Path.of(source.filePath()), source.replaySpeed(), clock);
        };
    }

    private FeedSources() {}
}
