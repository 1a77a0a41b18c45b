package io.notify4j.config;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Runtime configuration for the notification engine.
 *
 * <p>Bound from {@code notifier.*} by the Spring Boot starter; plain setters otherwise.
 */
public class NotifierProperties {
    private boolean enabled = true;
    private String defaultChatId;
    private String zone = "+09:00"; // all "today" and day-boundary math
    private int timerThreads = 2;
    private boolean skipOverlappingTicks = true;
    private String store; // mongo | json-file | memory; null = auto
    private boolean ensureIndexesOnStartup = false;

    private final DailySummary dailySummary = new DailySummary();
    private final JsonFile jsonFile = new JsonFile();
    private final Telegram telegram = new Telegram();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDefaultChatId() {
        return defaultChatId;
    }

    public void setDefaultChatId(String defaultChatId) {
        this.defaultChatId = defaultChatId;
    }

    /**
     * Trimmed default destination.
     *
     * @throws IllegalArgumentException when it is not configured
     */
    public String requireDefaultChatId() {
        if (defaultChatId == null || defaultChatId.isBlank()) {
            throw new IllegalArgumentException("notifier.defaultChatId must not be blank");
        }
        return defaultChatId.trim();
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    /**
     * Zone used for local-day computations. Accepts fixed offsets ("+09:00") and region ids.
     */
    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public int getTimerThreads() {
        return timerThreads;
    }

    public void setTimerThreads(int timerThreads) {
        this.timerThreads = timerThreads;
    }

    public boolean isSkipOverlappingTicks() {
        return skipOverlappingTicks;
    }

    public void setSkipOverlappingTicks(boolean skipOverlappingTicks) {
        this.skipOverlappingTicks = skipOverlappingTicks;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public DailySummary getDailySummary() {
        return dailySummary;
    }

    public JsonFile getJsonFile() {
        return jsonFile;
    }

    public Telegram getTelegram() {
        return telegram;
    }

    public static class DailySummary {
        private boolean enabled = true;
        private String time = "08:00"; // HH:mm, local to zone

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTime() {
            return time;
        }

        public void setTime(String time) {
            this.time = time;
        }

        public LocalTime localTime() {
            return LocalTime.parse(time.trim());
        }
    }

    public static class JsonFile {
        private String path = "data/schedules.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Telegram {
        private String botToken;

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }
    }
}
