package io.scrapejobs.config;

import io.scrapejobs.JobScheduler;
import io.scrapejobs.JobStore;
import io.scrapejobs.RunOperation;
import io.scrapejobs.command.JobCommands;
import io.scrapejobs.core.RunResult;
import io.scrapejobs.internal.file.FileJobStore;
import io.scrapejobs.internal.mongo.MongoJobStore;
import io.scrapejobs.service.JobService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ScrapeJobsAutoConfigurationTest {

    @TempDir
    Path storageDir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ScrapeJobsConfig.class))
                .withPropertyValues(
                        "scrapejobs.storage-dir=" + storageDir,
                        "scrapejobs.process-every=500ms"
                );
    }

    @Test
    void shouldAutoConfigureFileStoreByDefault() {
        contextRunner().run(context -> {
            assertThat(context).hasSingleBean(JobStore.class);
            assertThat(context.getBean(JobStore.class)).isInstanceOf(FileJobStore.class);
            assertThat(((FileJobStore) context.getBean(JobStore.class)).getDirectory()).isEqualTo(storageDir);
            assertThat(context).hasSingleBean(JobScheduler.class);
            assertThat(context).hasSingleBean(JobService.class);
            assertThat(context).hasSingleBean(JobCommands.class);
            assertThat(context).hasSingleBean(ScrapeJobsLifecycle.class);
            assertThat(context).doesNotHaveBean(ScrapeJobsCommandLineRunner.class);
            assertThat(context).doesNotHaveBean(ScrapeJobsMongoIndexConfig.class);
            assertThat(context.getBean(JobScheduler.class).isRunning()).isFalse();
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner()
                .withPropertyValues(
                        "scrapejobs.max-concurrency=7",
                        "scrapejobs.default-retry-delay=2m",
                        "scrapejobs.default-max-retries=5",
                        "scrapejobs.command-line.enabled=true"
                )
                .run(context -> {
                    ScrapeJobsProperties props = context.getBean(ScrapeJobsProperties.class);
                    assertThat(props.getMaxConcurrency()).isEqualTo(7);
                    assertThat(props.getDefaultRetryDelay()).isEqualTo(Duration.ofMinutes(2));
                    assertThat(props.getDefaultMaxRetries()).isEqualTo(5);
                    assertThat(props.getProcessEvery()).isEqualTo(Duration.ofMillis(500));
                    assertThat(context).hasSingleBean(ScrapeJobsCommandLineRunner.class);
                });
    }

    @Test
    void shouldUseMongoStoreWhenSelected() {
        contextRunner()
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withPropertyValues("scrapejobs.store=mongo")
                .run(context -> {
                    assertThat(context).hasSingleBean(JobStore.class);
                    assertThat(context.getBean(JobStore.class)).isInstanceOf(MongoJobStore.class);
                    assertThat(context).hasSingleBean(ScrapeJobsMongoIndexConfig.class);
                    assertThat(context).hasSingleBean(JobScheduler.class);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner()
                .withPropertyValues("scrapejobs.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(JobScheduler.class);
                    assertThat(context).doesNotHaveBean(JobStore.class);
                });
    }

    @Test
    void shouldKeepUserRunOperation() {
        RunOperation custom = request -> RunResult.succeeded();
        contextRunner()
                .withBean(RunOperation.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(RunOperation.class);
                    assertThat(context.getBean(RunOperation.class)).isSameAs(custom);
                });
    }

    @Test
    void autoStartShouldStartSchedulerWithContext() {
        contextRunner()
                .withPropertyValues("scrapejobs.auto-start=true")
                .run(context -> {
                    assertThat(context.getBean(JobScheduler.class).isRunning()).isTrue();
                    assertThat(context.getBean(ScrapeJobsLifecycle.class).isRunning()).isTrue();
                });
    }

    @Test
    void invalidPropertiesShouldFailStartup() {
        contextRunner()
                .withPropertyValues("scrapejobs.max-concurrency=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
