package in.ticktrader.service.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes each session report as a JSON file named after the session id.
 */
public final class JsonFileSessionResultsSink implements SessionResultsSink {
    private static final Logger log = LoggerFactory.getLogger(JsonFileSessionResultsSink.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonFileSessionResultsSink(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void publish(SessionReport report) {
        Path file = fileFor(report);
        try {
            Files.createDirectories(directory);
            mapper.writeValue(file.toFile(), report);
            log.info("[SESSION] Report written to {}", file.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write session report " + file, e);
        }
    }

    public Path fileFor(SessionReport report) {
        return directory.resolve("session-" + report.sessionId() + ".json");
    }
}
