package io.notify4j.internal;

import io.notify4j.NotificationDispatcher;
import io.notify4j.NotificationScheduler;
import io.notify4j.ScheduleStore;
import io.notify4j.config.NotifierProperties;
import io.notify4j.core.Digest;
import io.notify4j.core.DispatchException;
import io.notify4j.core.ScheduledNotification;
import io.notify4j.utils.CronMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Once a day, sends every destination a digest of what fires on that local day.
 */
public class DailySummaryAggregator {
    private static final Logger log = LoggerFactory.getLogger(DailySummaryAggregator.class);

    public static final String TASK_NAME = "daily-summary";

    private final NotifierProperties props;
    private final ScheduleStore store;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;
    private final ZoneId zone;
    private final String defaultChatId;

    public DailySummaryAggregator(NotifierProperties props,
                                  ScheduleStore store,
                                  NotificationDispatcher dispatcher,
                                  Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = props.zoneId();
        this.defaultChatId = props.requireDefaultChatId();
    }

    /**
     * Registers the summary as the {@value #TASK_NAME} recurring task, at {@code notifier.daily-summary.time}.
     */
    public void register(NotificationScheduler scheduler) {
        if (!props.getDailySummary().isEnabled()) {
            log.info("Daily summary disabled");
            return;
        }
        LocalTime at = props.getDailySummary().localTime();
        scheduler.registerRecurringTask(TASK_NAME, CronMatcher.dailyAt(at), this::sendDailySummary);
        log.info("Daily summary registered at {} zone={}", at, zone);
    }

    /**
     * Builds and sends today's digests.
     *
     * @return number of digests delivered
     */
    public int sendDailySummary() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        List<Digest> digests = buildDigests(today);

        int sent = 0;
        for (Digest digest : digests) {
            try {
                dispatcher.send(digest.chatId(), DigestFormatter.format(digest));
                sent++;
                log.info("Daily summary sent chatId={} alarms={} events={}",
                        digest.chatId(), digest.alarms().size(), digest.events().size());
            } catch (DispatchException | RuntimeException e) {
                log.error("Daily summary failed chatId={} msg={}", digest.chatId(), e.getMessage(), e);
            }
        }
        log.info("Daily summary done date={} digests={} sent={}", today, digests.size(), sent);
        return sent;
    }

    /**
     * One digest per destination with at least one item on {@code date}, in order of first appearance.
     */
    public List<Digest> buildDigests(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");

        Map<String, List<ScheduledNotification>> byChat = new LinkedHashMap<>();
        for (ScheduledNotification n : store.findAll()) {
            if (!n.enabled()) {
                continue;
            }
            byChat.computeIfAbsent(effectiveChatId(n.chatId()), k -> new ArrayList<>()).add(n);
        }

        List<Digest> digests = new ArrayList<>();
        for (Map.Entry<String, List<ScheduledNotification>> group : byChat.entrySet()) {
            List<Digest.Item> events = new ArrayList<>();
            List<Digest.Item> alarms = new ArrayList<>();

            for (ScheduledNotification n : group.getValue()) {
                switch (n.type()) {
                    case FIXED -> CronMatcher.firstFireOn(n.cron(), date)
                            .ifPresent(t -> alarms.add(item(n, t)));
                    case MANUAL -> localTimeOn(n, date).ifPresent(t -> alarms.add(item(n, t)));
                    case EVENT -> localTimeOn(n, date).ifPresent(t -> events.add(item(n, null)));
                }
            }

            if (events.isEmpty() && alarms.isEmpty()) {
                log.debug("No items today for chatId={}", group.getKey());
                continue;
            }
            // List.sort is stable: equal times keep creation order
            alarms.sort(Comparator.comparing(Digest.Item::time));
            digests.add(new Digest(group.getKey(), date, events, alarms));
        }
        return digests;
    }

    /* ================= helper ================= */

    private Optional<LocalTime> localTimeOn(ScheduledNotification n, LocalDate date) {
        if (n.scheduledAt() == null) {
            return Optional.empty();
        }
        ZonedDateTime local = n.scheduledAt().atZone(zone);
        return local.toLocalDate().equals(date) ? Optional.of(local.toLocalTime()) : Optional.empty();
    }

    private static Digest.Item item(ScheduledNotification n, LocalTime time) {
        return new Digest.Item(n.id(), n.name(), n.type(), time, n.eventTime(), n.displayText());
    }

    private String effectiveChatId(String chatId) {
        return chatId == null || chatId.isBlank() ? defaultChatId : chatId;
    }
}
