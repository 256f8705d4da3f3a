package in.ticktrader.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.ticktrader.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link SessionConfig} from JSON.
 *
 * Unknown properties are rejected: a misspelled risk key must not silently
 * fall through to "absent". Binding does not validate; call
 * {@link SessionConfigValidator#validate(SessionConfig)} afterwards.
 */
public final class SessionConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SessionConfigLoader.class);

    public static final String CONFIG_PATH_KEY = "TICKTRADER_CONFIG";
    public static final String DEFAULT_CONFIG_PATH = "ticktrader.json";

    private final ObjectMapper mapper;

    public SessionConfigLoader() {
        this.mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    }

    /**
     * Resolve the config path from {@code TICKTRADER_CONFIG} and load it.
     */
    public SessionConfig loadDefault() {
        return load(Path.of(Env.get(CONFIG_PATH_KEY, DEFAULT_CONFIG_PATH)));
    }

    public SessionConfig load(Path path) {
        log.info("[CONFIG] Loading session config from {}", path.toAbsolutePath());
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: session config not found: " + path.toAbsolutePath() + "\n" +
                "Set " + CONFIG_PATH_KEY + " to the session JSON file."
            );
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    public SessionConfig load(InputStream in) {
        try {
            SessionConfig config = mapper.readValue(in, SessionConfig.class);
            if (config == null) {
                throw new IllegalStateException("❌ INVALID CONFIG: session config is empty");
            }
            return config;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: malformed session JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: cannot read session JSON: " + e.getMessage(), e);
        }
    }
}
