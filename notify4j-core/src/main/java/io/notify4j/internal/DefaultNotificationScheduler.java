package io.notify4j.internal;

import io.notify4j.NotificationDispatcher;
import io.notify4j.NotificationScheduler;
import io.notify4j.ScheduleStore;
import io.notify4j.config.NotifierProperties;
import io.notify4j.core.CreateNotificationRequest;
import io.notify4j.core.DispatchException;
import io.notify4j.core.NotificationDraft;
import io.notify4j.core.NotificationPatch;
import io.notify4j.core.NotificationType;
import io.notify4j.core.PersistenceException;
import io.notify4j.core.RestoreResult;
import io.notify4j.core.ScheduleNotFoundException;
import io.notify4j.core.ScheduleValidationException;
import io.notify4j.core.ScheduledNotification;
import io.notify4j.core.ValidationFailure;
import io.notify4j.timer.TaskTimer;
import io.notify4j.utils.CronMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-process notification scheduler.
 *
 * <p>Keeps a registry {@code scheduleId -> LiveEntry} next to the {@link ScheduleStore}:
 * <ul>
 *   <li>FIXED: a recurring entry that re-arms itself from {@link CronMatcher#nextFireAfter}</li>
 *   <li>MANUAL: a one-shot entry; after firing the schedule is disabled whatever the send outcome</li>
 *   <li>EVENT: never live</li>
 * </ul>
 *
 * <p>Every mutation (store write plus registry change) runs while holding {@code registryLock},
 * so "cancel existing, then maybe register" is one step and an id never has two live entries.
 * Sending happens outside the lock on timer threads.
 */
public class DefaultNotificationScheduler implements NotificationScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultNotificationScheduler.class);

    static final String MDC_KEY = "scheduleId";

    private final NotifierProperties props;
    private final ScheduleStore store;
    private final NotificationDispatcher dispatcher;
    private final TaskTimer timer;
    private final Clock clock;
    private final ZoneId zone;
    private final String defaultChatId;
    private final ScheduleValidator validator = new ScheduleValidator();

    private final Object registryLock = new Object();
    private final Map<String, LiveEntry> registry = new HashMap<>();
    private final Map<String, LiveEntry> systemTasks = new HashMap<>();

    private final AtomicBoolean restored = new AtomicBoolean(false);
    private volatile RestoreResult lastRestore = RestoreResult.empty();
    private boolean shutdown;

    public DefaultNotificationScheduler(NotifierProperties props,
                                        ScheduleStore store,
                                        NotificationDispatcher dispatcher,
                                        TaskTimer timer) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.timer = Objects.requireNonNull(timer, "timer must not be null");
        this.clock = timer.clock();
        this.zone = props.zoneId();

        this.defaultChatId = props.requireDefaultChatId();

        log.info("Notification scheduler created with zone={}, defaultChatId={}, skipOverlappingTicks={}",
                zone, defaultChatId, props.isSkipOverlappingTicks());
    }

    /* ================= lifecycle ================= */

    @Override
    public RestoreResult restoreOnStart() {
        if (!restored.compareAndSet(false, true)) {
            log.warn("restoreOnStart called more than once; keeping the live registry as is");
            return lastRestore;
        }

        synchronized (registryLock) {
            List<ScheduledNotification> all = store.findAll();
            log.info("Found {} schedules in store", all.size());

            Instant now = clock.instant();
            int active = 0;
            int skipped = 0;
            int expired = 0;

            for (ScheduledNotification n : all) {
                if (!n.enabled() || !n.type().isLiveScheduled()) {
                    log.debug("Skip schedule name={} id={} enabled={} type={}", n.name(), n.id(), n.enabled(), n.type());
                    skipped++;
                    continue;
                }

                if (n.type() == NotificationType.MANUAL && !n.isDueAfter(now)) {
                    store.update(n.id(), NotificationPatch.enabled(false));
                    log.warn("Expired manual schedule disabled name={} id={} scheduledAt={}",
                            n.name(), n.id(), n.scheduledAt());
                    expired++;
                    continue;
                }

                cancelLiveLocked(n.id());
                if (registerLocked(n)) {
                    active++;
                } else {
                    skipped++;
                }
            }

            lastRestore = new RestoreResult(active, skipped, expired);
            log.info("Restore complete: {} active, {} skipped, {} expired", active, skipped, expired);
            return lastRestore;
        }
    }

    @Override
    public void shutdown() {
        synchronized (registryLock) {
            int scheduleCount = registry.size();
            int taskCount = systemTasks.size();
            registry.values().forEach(LiveEntry::cancel);
            systemTasks.values().forEach(LiveEntry::cancel);
            registry.clear();
            systemTasks.clear();
            shutdown = true;
            log.info("Cleared all live timers: {} schedules, {} system tasks", scheduleCount, taskCount);
        }
    }

    /* ================= CRUD ================= */

    @Override
    public ScheduledNotification create(CreateNotificationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        log.info("Creating schedule type={} name={} chatId={}",
                request.type(), request.name(), effectiveChatId(request.chatId()));

        validator.validateCreate(request, clock.instant());

        NotificationDraft draft = new NotificationDraft(
                request.type(),
                request.name(),
                request.message(),
                request.description(),
                effectiveChatId(request.chatId()),
                true,
                request.cron(),
                request.scheduledAt(),
                request.eventTime()
        );

        synchronized (registryLock) {
            ScheduledNotification created = store.create(draft);
            replaceLiveLocked(created.id(), created);
            log.info("Schedule created name={} id={}", created.name(), created.id());
            return created;
        }
    }

    @Override
    public void sendNow(String chatId, String message) throws DispatchException {
        Objects.requireNonNull(message, "message must not be null");
        String target = effectiveChatId(chatId);
        try {
            dispatcher.send(target, message);
            log.info("Message sent chatId={}", target);
        } catch (DispatchException e) {
            log.error("Send failed chatId={} msg={}", target, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public List<ScheduledNotification> findAll(NotificationType typeFilter, String chatFilter) {
        Instant now = clock.instant();
        LocalDate today = now.atZone(zone).toLocalDate();

        List<ScheduledNotification> all = store.findAll();
        List<ScheduledNotification> filtered = all.stream()
                .filter(n -> chatFilter == null || chatFilter.equals(n.chatId()))
                .filter(n -> typeFilter == null || typeFilter == n.type())
                .filter(n -> isVisible(n, now, today))
                .collect(Collectors.toList());

        log.debug("findAll total={} filtered={} type={} chatId={}",
                all.size(), filtered.size(), typeFilter, chatFilter);
        return filtered;
    }

    @Override
    public ScheduledNotification findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return store.findById(id).orElseThrow(() -> {
            log.warn("Schedule not found id={}", id);
            return new ScheduleNotFoundException(id);
        });
    }

    @Override
    public ScheduledNotification update(String id, NotificationPatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");

        synchronized (registryLock) {
            ScheduledNotification existing = findById(id);
            Instant now = clock.instant();
            validator.validatePatch(existing, patch, now);
            log.info("Updating schedule name={} id={} {}", existing.name(), id, patch);

            cancelLiveLocked(id);
            ScheduledNotification updated = store.update(id, patch)
                    .orElseThrow(() -> new ScheduleNotFoundException(id));

            if (updated.enabled()) {
                if (updated.type() == NotificationType.MANUAL && !updated.isDueAfter(now)) {
                    updated = store.update(id, NotificationPatch.enabled(false))
                            .orElse(updated.withEnabled(false));
                    log.warn("Schedule auto-disabled, scheduledAt already passed name={} id={}", updated.name(), id);
                } else {
                    registerLocked(updated);
                }
            }

            log.info("Schedule updated name={} id={} enabled={}", updated.name(), id, updated.enabled());
            return updated;
        }
    }

    @Override
    public void delete(String id) {
        synchronized (registryLock) {
            ScheduledNotification existing = findById(id);
            cancelLiveLocked(id);
            if (!store.delete(id)) {
                throw new ScheduleNotFoundException(id);
            }
            log.info("Schedule deleted name={} id={}", existing.name(), id);
        }
    }

    @Override
    public ScheduledNotification toggleEnabled(String id) {
        synchronized (registryLock) {
            ScheduledNotification existing = findById(id);
            boolean enable = !existing.enabled();

            if (enable && existing.type() == NotificationType.MANUAL && !existing.isDueAfter(clock.instant())) {
                log.warn("Cannot re-enable elapsed manual schedule name={} id={} scheduledAt={}",
                        existing.name(), id, existing.scheduledAt());
                throw new ScheduleValidationException(ValidationFailure.PAST_SCHEDULED_TIME,
                        "Manual schedule " + id + " already passed and cannot be re-enabled");
            }

            log.info("Toggling schedule name={} id={} {} -> {}", existing.name(), id, existing.enabled(), enable);
            cancelLiveLocked(id);
            ScheduledNotification updated = store.update(id, NotificationPatch.enabled(enable))
                    .orElseThrow(() -> new ScheduleNotFoundException(id));
            if (updated.enabled()) {
                registerLocked(updated);
            }
            return updated;
        }
    }

    /* ================= system tasks & introspection ================= */

    @Override
    public void registerRecurringTask(String name, String cron, Runnable task) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(task, "task must not be null");
        CronMatcher.validate(cron);

        synchronized (registryLock) {
            LiveEntry previous = systemTasks.remove(name);
            if (previous != null) {
                previous.cancel();
            }
            if (shutdown) {
                log.warn("Scheduler is shut down; not registering task name={}", name);
                return;
            }

            LiveEntry entry = LiveEntry.recurring("task:" + name, name, cron, task);
            if (armNextTickLocked(entry, nowZoned())) {
                systemTasks.put(name, entry);
                log.info("Recurring task registered name={} cron={} zone={} next={}",
                        name, cron, zone, entry.nextFireAt());
            }
        }
    }

    @Override
    public boolean isLive(String id) {
        synchronized (registryLock) {
            return registry.containsKey(id);
        }
    }

    @Override
    public Optional<Instant> nextFireTime(String id) {
        synchronized (registryLock) {
            LiveEntry entry = registry.get(id);
            return entry == null ? Optional.empty() : Optional.ofNullable(entry.nextFireAt());
        }
    }

    @Override
    public int liveEntryCount() {
        synchronized (registryLock) {
            return registry.size();
        }
    }

    /* ================= registry ================= */

    private void replaceLiveLocked(String id, ScheduledNotification next) {
        cancelLiveLocked(id);
        if (next != null && next.enabled()) {
            registerLocked(next);
        }
    }

    private void cancelLiveLocked(String id) {
        LiveEntry entry = registry.remove(id);
        if (entry != null) {
            entry.cancel();
            log.debug("Live entry cancelled kind={} id={}", entry.kind(), id);
        }
    }

    /**
     * @return true when a live timer was armed for {@code n}
     */
    private boolean registerLocked(ScheduledNotification n) {
        if (shutdown) {
            log.warn("Scheduler is shut down; schedule name={} id={} stays without a live timer", n.name(), n.id());
            return false;
        }

        switch (n.type()) {
            case FIXED -> {
                LiveEntry entry = LiveEntry.recurring(n.id(), n.name(), n.cron(), () -> send(n));
                if (!armNextTickLocked(entry, nowZoned())) {
                    log.error("Cron failed to start name={} id={} cron={}: no future fire time",
                            n.name(), n.id(), n.cron());
                    return false;
                }
                registry.put(n.id(), entry);
                log.info("Cron started name={} cron={} chatId={} next={}",
                        n.name(), n.cron(), n.chatId(), entry.nextFireAt());
                return true;
            }
            case MANUAL -> {
                LiveEntry entry = LiveEntry.oneShot(n.id(), n.name(), () -> send(n));
                entry.arm(timer.schedule(n.scheduledAt(), () -> onOneShotFire(entry, n)), n.scheduledAt());
                registry.put(n.id(), entry);
                log.info("Timer started name={} fires at {} chatId={}", n.name(), n.scheduledAt(), n.chatId());
                return true;
            }
            default -> {
                log.debug("Event schedule name={} id={} has no live timer", n.name(), n.id());
                return false;
            }
        }
    }

    private boolean armNextTickLocked(LiveEntry entry, ZonedDateTime after) {
        Optional<ZonedDateTime> next = CronMatcher.nextFireAfter(entry.cron(), after);
        if (next.isEmpty()) {
            return false;
        }
        ZonedDateTime slot = next.get();
        entry.arm(timer.schedule(slot.toInstant(), () -> onRecurringTick(entry, slot)), slot.toInstant());
        return true;
    }

    /* ================= firing ================= */

    private void onRecurringTick(LiveEntry entry, ZonedDateTime slot) {
        synchronized (registryLock) {
            if (entry.isCancelled()) {
                return;
            }
            ZonedDateTime now = nowZoned();
            armNextTickLocked(entry, now.isAfter(slot) ? now : slot);
        }

        boolean guarded = props.isSkipOverlappingTicks();
        if (guarded && !entry.tryBeginRun()) {
            log.warn("Skipping tick of {} at {}: previous run still in flight", entry.label(), slot);
            return;
        }

        MDC.put(MDC_KEY, entry.key());
        try {
            log.info("Cron fire name={} slot={}", entry.label(), slot);
            entry.action().run();
        } catch (RuntimeException e) {
            log.error("Recurring run failed name={} msg={}", entry.label(), e.getMessage(), e);
        } finally {
            if (guarded) {
                entry.endRun();
            }
            MDC.remove(MDC_KEY);
        }
    }

    private void onOneShotFire(LiveEntry entry, ScheduledNotification n) {
        synchronized (registryLock) {
            if (entry.isCancelled()) {
                return;
            }
        }

        MDC.put(MDC_KEY, n.id());
        try {
            log.info("Timer fire name={} chatId={}", n.name(), n.chatId());
            entry.action().run();

            synchronized (registryLock) {
                if (registry.get(n.id()) != entry) {
                    log.debug("Timer of {} was replaced while sending; leaving the schedule as is", n.id());
                    return;
                }
                registry.remove(n.id());
                try {
                    store.update(n.id(), NotificationPatch.enabled(false));
                    log.info("Timer done name={} fired and disabled", n.name());
                } catch (PersistenceException e) {
                    log.error("Failed to disable fired schedule name={} id={} msg={}",
                            n.name(), n.id(), e.getMessage(), e);
                }
            }
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private void send(ScheduledNotification n) {
        String chatId = effectiveChatId(n.chatId());
        try {
            dispatcher.send(chatId, n.message());
            log.info("Send ok name={} chatId={}", n.name(), chatId);
        } catch (DispatchException e) {
            log.error("Send failed name={} chatId={} msg={}", n.name(), chatId, e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Send failed unexpectedly name={} chatId={} msg={}", n.name(), chatId, e.getMessage(), e);
        }
    }

    /* ================= helper ================= */

    private boolean isVisible(ScheduledNotification n, Instant now, LocalDate today) {
        if (n.scheduledAt() == null) {
            return true;
        }
        if (n.type() == NotificationType.MANUAL) {
            return n.scheduledAt().isAfter(now);
        }
        if (n.type() == NotificationType.EVENT) {
            return n.scheduledAt().atZone(zone).toLocalDate().equals(today);
        }
        return true;
    }

    private String effectiveChatId(String chatId) {
        return chatId == null || chatId.isBlank() ? defaultChatId : chatId;
    }

    private ZonedDateTime nowZoned() {
        return clock.instant().atZone(zone);
    }
}
