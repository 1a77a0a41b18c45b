package io.notify4j.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.notify4j.core.PersistenceException;
import io.notify4j.core.ScheduledNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Schedule store persisted as a single pretty-printed JSON array.
 *
 * <p>The whole file is rewritten on every change (write to a sibling temp file, then move),
 * which is fine for the few hundred schedules a chat bot deals with.
 */
public class JsonFileScheduleStore extends InMemoryScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileScheduleStore.class);

    private static final TypeReference<List<ScheduledNotification>> LIST_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileScheduleStore(Path file, Clock clock) {
        this(file, clock, defaultObjectMapper());
    }

    public JsonFileScheduleStore(Path file, Clock clock, ObjectMapper objectMapper) {
        super(clock);
        this.file = Objects.requireNonNull(file, "file must not be null").toAbsolutePath();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        loadFromFile();
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path file() {
        return file;
    }

    private void loadFromFile() {
        if (!Files.exists(file)) {
            log.info("Schedule file {} does not exist yet; starting empty", file);
            return;
        }
        try {
            List<ScheduledNotification> loaded = objectMapper.readValue(file.toFile(), LIST_TYPE);
            load(loaded == null ? List.of() : loaded);
            log.info("Loaded {} schedules from {}", loaded == null ? 0 : loaded.size(), file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read schedules from " + file, e);
        }
    }

    @Override
    protected void persist(List<ScheduledNotification> snapshot) {
        try {
            Path dir = file.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to write schedules to " + file, e);
        }
    }
}
