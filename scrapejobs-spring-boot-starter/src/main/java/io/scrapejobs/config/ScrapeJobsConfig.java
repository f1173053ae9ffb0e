package io.scrapejobs.config;

import io.scrapejobs.CallbackRunner;
import io.scrapejobs.JobScheduler;
import io.scrapejobs.JobStore;
import io.scrapejobs.RunOperation;
import io.scrapejobs.command.JobCommands;
import io.scrapejobs.core.RunResult;
import io.scrapejobs.internal.DefaultJobScheduler;
import io.scrapejobs.internal.ProcessCallbackRunner;
import io.scrapejobs.internal.file.FileJobStore;
import io.scrapejobs.internal.mongo.MongoJobStore;
import io.scrapejobs.internal.mongo.ScrapeJobDocument;
import io.scrapejobs.service.JobService;
import io.scrapejobs.utils.JobJson;
import io.scrapejobs.utils.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Spring Boot auto-configuration entrypoint for scrape job scheduling.
 *
 * <p>{@code scrapejobs.store=file} (default) keeps jobs as JSON files under
 * {@code scrapejobs.storage-dir}; {@code scrapejobs.store=mongo} uses the application's
 * {@link MongoTemplate}. Provide a {@link RunOperation} bean to actually run scrapes.
 */
@AutoConfiguration
@ConditionalOnClass(JobScheduler.class)
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "scrapejobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScrapeJobsConfig {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJobsConfig.class);

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "scrapejobs")
    public ScrapeJobsProperties scrapeJobsProperties() {
        return new ScrapeJobsProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock scrapeJobsClock() {
        // millisecond ticks: the Mongo store keeps milliseconds
        return Clock.tick(Clock.systemUTC(), Duration.ofMillis(1));
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleCalculator scheduleCalculator() {
        return new ScheduleCalculator();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    @ConditionalOnProperty(prefix = "scrapejobs", name = "store", havingValue = "file", matchIfMissing = true)
    public JobStore fileJobStore(ScrapeJobsProperties props, Clock clock) {
        log.info("Using file job store dir={}", props.getStorageDir());
        return new FileJobStore(props.getStorageDir(), JobJson.objectMapper(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RunOperation runOperation() {
        log.warn("No RunOperation bean configured; every job run will fail");
        return request -> RunResult.failed("no RunOperation bean configured");
    }

    @Bean
    @ConditionalOnMissingBean
    public CallbackRunner callbackRunner() {
        return new ProcessCallbackRunner();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(
            ScrapeJobsProperties props,
            JobStore store,
            RunOperation runOperation,
            CallbackRunner callbackRunner,
            ScheduleCalculator calculator,
            Clock clock
    ) {
        return new DefaultJobScheduler(props, store, runOperation, callbackRunner, calculator, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobService jobService(JobStore store, ScheduleCalculator calculator, ScrapeJobsProperties props, Clock clock) {
        return new JobService(store, calculator, props, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobCommands jobCommands(JobService jobService, JobScheduler scheduler) {
        return new JobCommands(jobService, scheduler, System.out, System.err);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScrapeJobsLifecycle scrapeJobsLifecycle(JobScheduler scheduler, ScrapeJobsProperties props) {
        return new ScrapeJobsLifecycle(scheduler, props.isAutoStart());
    }

    @Bean
    @ConditionalOnProperty(prefix = "scrapejobs", name = "command-line.enabled", havingValue = "true")
    public ScrapeJobsCommandLineRunner scrapeJobsCommandLineRunner(JobCommands commands, JobScheduler scheduler) {
        return new ScrapeJobsCommandLineRunner(commands, scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "scrapejobs", name = "verbose", havingValue = "true")
    public SmartInitializingSingleton scrapeJobsVerboseLogging() {
        return () -> LoggingSystem.get(ScrapeJobsConfig.class.getClassLoader())
                .setLogLevel("io.scrapejobs", LogLevel.DEBUG);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "scrapejobs", name = "store", havingValue = "mongo")
    static class MongoStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(JobStore.class)
        public JobStore mongoJobStore(MongoTemplate mongoTemplate, Clock clock) {
            log.info("Using mongo job store collection={}", ScrapeJobDocument.COLLECTION);
            return new MongoJobStore(mongoTemplate, JobJson.objectMapper(), clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public ScrapeJobsMongoIndexConfig scrapeJobsMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new ScrapeJobsMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "scrapejobs", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton scrapeJobsIndexesInitializer(ScrapeJobsMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }
}
