package io.notify4j.config;

import io.notify4j.NotificationDispatcher;
import io.notify4j.NotificationScheduler;
import io.notify4j.ScheduleStore;
import io.notify4j.internal.DailySummaryAggregator;
import io.notify4j.internal.DefaultNotificationScheduler;
import io.notify4j.internal.mongo.MongoScheduleStore;
import io.notify4j.store.InMemoryScheduleStore;
import io.notify4j.store.JsonFileScheduleStore;
import io.notify4j.telegram.TelegramNotificationDispatcher;
import io.notify4j.timer.ExecutorTaskTimer;
import io.notify4j.timer.TaskTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.telegram.telegrambots.bots.DefaultAbsSender;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

/**
 * Spring Boot auto-configuration entrypoint for the notification engine.
 *
 * <p>Store selection ({@code notifier.store}): {@code mongo} when a {@link MongoTemplate} bean exists and the
 * property is unset, otherwise {@code json-file}; {@code memory} keeps schedules in process only.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(NotificationScheduler.class)
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "notifier", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NotifierAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(NotifierAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "notifier")
    public NotifierProperties notifierProperties() {
        return new NotifierProperties();
    }

    @Bean
    @ConditionalOnMissingBean(TaskTimer.class)
    public ExecutorTaskTimer notifierTaskTimer(NotifierProperties props) {
        return new ExecutorTaskTimer(Clock.systemUTC(), props.getTimerThreads());
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleStore.class)
    public ScheduleStore scheduleStore(NotifierProperties props, TaskTimer timer) {
        String kind = props.getStore() == null ? "json-file" : props.getStore().trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "memory" -> {
                log.warn("Using in-memory schedule store; schedules are lost on restart");
                yield new InMemoryScheduleStore(timer.clock());
            }
            case "json-file" -> {
                Path file = Path.of(props.getJsonFile().getPath());
                log.info("Using JSON file schedule store at {}", file.toAbsolutePath());
                yield new JsonFileScheduleStore(file, timer.clock());
            }
            case "mongo" -> throw new IllegalStateException(
                    "notifier.store=mongo requires a MongoTemplate bean (spring-boot-starter-data-mongodb)");
            default -> throw new IllegalStateException("Unknown notifier.store: " + props.getStore());
        };
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(NotificationDispatcher.class)
    public NotificationScheduler notificationScheduler(NotifierProperties props,
                                                       ScheduleStore store,
                                                       NotificationDispatcher dispatcher,
                                                       TaskTimer timer) {
        return new DefaultNotificationScheduler(props, store, dispatcher, timer);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(NotificationDispatcher.class)
    public DailySummaryAggregator dailySummaryAggregator(NotifierProperties props,
                                                         ScheduleStore store,
                                                         NotificationDispatcher dispatcher,
                                                         TaskTimer timer) {
        return new DailySummaryAggregator(props, store, dispatcher, timer.clock());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({NotificationScheduler.class, DailySummaryAggregator.class})
    public NotifierLifecycle notifierLifecycle(NotificationScheduler scheduler, DailySummaryAggregator dailySummary) {
        return new NotifierLifecycle(scheduler, dailySummary);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnBean(MongoTemplate.class)
    protected static class MongoStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(ScheduleStore.class)
        @ConditionalOnProperty(prefix = "notifier", name = "store", havingValue = "mongo", matchIfMissing = true)
        public MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate, TaskTimer timer) {
            log.info("Using MongoDB schedule store");
            return new MongoScheduleStore(mongoTemplate, timer.clock());
        }

        @Bean
        @ConditionalOnMissingBean
        public NotifierMongoIndexConfig notifierMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new NotifierMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "notifier", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton notifierIndexesInitializer(NotifierMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(DefaultAbsSender.class)
    @ConditionalOnProperty(prefix = "notifier.telegram", name = "bot-token")
    protected static class TelegramConfiguration {

        @Bean
        @ConditionalOnMissingBean(NotificationDispatcher.class)
        public TelegramNotificationDispatcher telegramNotificationDispatcher(NotifierProperties props) {
            return new TelegramNotificationDispatcher(props.getTelegram().getBotToken());
        }
    }
}
