package io.scrapejobs.internal.mongo;

import com.mongodb.client.MongoClients;
import io.scrapejobs.core.JobNotFoundException;
import io.scrapejobs.core.JobStatus;
import io.scrapejobs.core.RepairReport;
import io.scrapejobs.core.RunHistoryEntry;
import io.scrapejobs.core.RunOutcome;
import io.scrapejobs.core.ScheduleSpec;
import io.scrapejobs.core.ScrapeJob;
import io.scrapejobs.utils.JobJson;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    // Mongo stores millisecond precision
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00.123Z");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "scrapejobs_test");
        mongoTemplate.dropCollection(ScrapeJobDocument.COLLECTION);
        mongoTemplate.dropCollection(MongoJobStore.QUARANTINE_COLLECTION);
        jobStore = new MongoJobStore(mongoTemplate, JobJson.objectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(ScrapeJobDocument.COLLECTION);
        mongoTemplate.dropCollection(MongoJobStore.QUARANTINE_COLLECTION);
    }

    @Test
    void createAndGetShouldRoundTripJob() {
        ScrapeJob job = newJob("weekly-shop", new ScheduleSpec.Weekly(3, LocalTime.of(6, 15)), NOW.plusSeconds(60));
        job.setName("weekly shop");
        job.setMaxRuns(4);
        job.setOnFailure("notify");
        job.setOutputPathOverride("/data/{date}.json");
        job.setLastOutcome(RunOutcome.FAILURE);
        job.setLastError("HTTP 500");
        job.appendHistory(RunHistoryEntry.failure(1, NOW.minusSeconds(10), NOW.minusSeconds(5), "HTTP 500"));
        job.appendHistory(RunHistoryEntry.success(2, NOW.minusSeconds(4), NOW.minusSeconds(1)));

        jobStore.create(job);
        ScrapeJob loaded = jobStore.get("weekly-shop").orElseThrow();

        assertEquals("weekly shop", loaded.getName());
        assertEquals(new ScheduleSpec.Weekly(3, LocalTime.of(6, 15)), loaded.getSchedule());
        assertEquals(4, loaded.getMaxRuns());
        assertEquals("notify", loaded.getOnFailure());
        assertEquals("/data/{date}.json", loaded.getOutputPathOverride());
        assertEquals(RunOutcome.FAILURE, loaded.getLastOutcome());
        assertEquals(NOW.plusSeconds(60), loaded.getNextRun());
        assertEquals(NOW, loaded.getCreatedAt());
        assertEquals(job.getHistory(), loaded.getHistory());
    }

    @Test
    void subMillisecondInstantsShouldReadBackAsWritten() {
        Instant micros = NOW.plusNanos(456_789);
        ScrapeJob job = newJob("micros", new ScheduleSpec.Hourly(15), micros.plusSeconds(3600));
        job.setLastRun(micros);
        job.appendHistory(RunHistoryEntry.success(1, micros.minusSeconds(2), micros));

        ScrapeJob created = jobStore.create(job);
        ScrapeJob loaded = jobStore.get("micros").orElseThrow();

        assertEquals(NOW, loaded.getLastRun());
        assertEquals(created.getLastRun(), loaded.getLastRun());
        assertEquals(created.getNextRun(), loaded.getNextRun());
        assertEquals(created.getHistory(), loaded.getHistory());

        ScrapeJob modified = jobStore.modify("micros", j -> {
            j.setNextRun(micros.plusSeconds(7200));
            return true;
        }).orElseThrow();
        assertEquals(modified.getNextRun(), jobStore.get("micros").orElseThrow().getNextRun());
    }

    @Test
    void everyScheduleVariantShouldSurviveStorage() {
        List<ScheduleSpec> specs = List.of(
                new ScheduleSpec.Once(LocalDate.of(2024, 5, 1), LocalTime.of(8, 0)),
                new ScheduleSpec.Hourly(5),
                new ScheduleSpec.Daily(LocalTime.of(23, 30)),
                new ScheduleSpec.Monthly(31, LocalTime.NOON),
                new ScheduleSpec.Custom("0 9 * * 1-5")
        );
        for (int i = 0; i < specs.size(); i++) {
            jobStore.create(newJob("job-" + i, specs.get(i), null));
        }

        for (int i = 0; i < specs.size(); i++) {
            assertEquals(specs.get(i), jobStore.get("job-" + i).orElseThrow().getSchedule());
        }
    }

    @Test
    void createShouldRejectDuplicateIdAndUpdateShouldRejectMissing() {
        jobStore.create(newJob("dup", new ScheduleSpec.Hourly(0), null));

        assertThrows(IllegalArgumentException.class, () -> jobStore.create(newJob("dup", new ScheduleSpec.Hourly(0), null)));
        assertThrows(JobNotFoundException.class, () -> jobStore.update(newJob("ghost", new ScheduleSpec.Hourly(0), null)));
    }

    @Test
    void modifyShouldPersistOnlyAcceptedMutations() {
        jobStore.create(newJob("m", new ScheduleSpec.Hourly(0), NOW.minusSeconds(1)));

        assertTrue(jobStore.modify("m", j -> false).isEmpty());
        Optional<ScrapeJob> claimed = jobStore.modify("m", j -> j.claim(NOW));
        assertTrue(claimed.isPresent());
        assertTrue(jobStore.modify("m", j -> j.claim(NOW)).isEmpty(), "second claim must be declined");

        ScrapeJob stored = jobStore.get("m").orElseThrow();
        assertEquals(JobStatus.RUNNING, stored.getStatus());
        assertEquals(NOW, stored.getRunningSince());
        assertTrue(jobStore.modify("missing", j -> true).isEmpty());
    }

    @Test
    void concurrentModifyShouldNotLoseUpdates() throws Exception {
        jobStore.create(newJob("counter", new ScheduleSpec.Hourly(0), null));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 10; i++) {
                        jobStore.modify("counter", j -> {
                            j.setRunCount(j.getRunCount() + 1);
                            return true;
                        });
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(40, jobStore.get("counter").orElseThrow().getRunCount());
    }

    @Test
    void findDueAndFilterShouldQueryByState() {
        jobStore.create(newJob("due-late", new ScheduleSpec.Hourly(0), NOW.minusSeconds(10)));
        jobStore.create(newJob("due-early", new ScheduleSpec.Hourly(0), NOW.minusSeconds(3600)));
        jobStore.create(newJob("future", new ScheduleSpec.Hourly(0), NOW.plusSeconds(10)));
        ScrapeJob running = newJob("running", new ScheduleSpec.Hourly(0), NOW.minusSeconds(5));
        running.setStatus(JobStatus.RUNNING);
        running.setConfigName("news");
        jobStore.create(running);

        assertEquals(List.of("due-early", "due-late"), ids(jobStore.findDue(NOW)));
        assertEquals(List.of("running"), ids(jobStore.filter(JobStatus.RUNNING, null)));
        assertEquals(List.of("running"), ids(jobStore.filter(null, "news")));
        assertEquals(3, jobStore.filter(JobStatus.PENDING, "shop").size());
    }

    @Test
    void deleteShouldRemoveDocument() {
        jobStore.create(newJob("gone", new ScheduleSpec.Hourly(0), null));

        assertTrue(jobStore.delete("gone"));
        assertFalse(jobStore.delete("gone"));
    }

    @Test
    void repairShouldMoveUnreadableDocumentsToQuarantine() {
        jobStore.create(newJob("good", new ScheduleSpec.Daily(LocalTime.of(9, 0)), null));
        mongoTemplate.insert(new Document("_id", "half").append("note", "no schedule"), ScrapeJobDocument.COLLECTION);
        mongoTemplate.insert(new Document("_id", "odd").append("configName", "shop").append("status", "exploded")
                .append("schedule", new Document("type", "daily").append("time", "09:00")), ScrapeJobDocument.COLLECTION);

        RepairReport report = jobStore.repair();

        assertEquals(3, report.scanned());
        assertEquals(1, report.valid());
        assertEquals(2, report.quarantined());
        assertEquals(List.of("good"), ids(jobStore.list()));
        List<Document> quarantined = mongoTemplate.findAll(Document.class, MongoJobStore.QUARANTINE_COLLECTION);
        assertEquals(2, quarantined.size());
        for (Document d : quarantined) {
            assertNotNull(d.get("originalId"));
            assertNotNull(d.get("quarantinedAt"));
        }
    }

    private static ScrapeJob newJob(String id, ScheduleSpec schedule, Instant nextRun) {
        ScrapeJob job = new ScrapeJob();
        job.setId(id);
        job.setConfigName("shop");
        job.setSchedule(schedule);
        job.setNextRun(nextRun);
        return job;
    }

    private static List<String> ids(List<ScrapeJob> jobs) {
        List<String> ids = new ArrayList<>();
        for (ScrapeJob j : jobs) {
            ids.add(j.getId());
        }
        return ids;
    }
}
