package io.scrapejobs.config;

import io.scrapejobs.internal.mongo.ScrapeJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the scrape job store.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code scrapejobs.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code scrape_jobs})</h3>
 * <ul>
 *   <li><b>idx_due</b>: { nextRun: 1, status: 1 }
 *       <br/>Used by the scheduler tick to find due jobs.</li>
 *   <li><b>idx_config_status</b>: { configName: 1, status: 1 }
 *       <br/>Used by job listing filters.</li>
 *   <li><b>idx_created</b>: { createdAt: 1 }
 *       <br/>Listing order.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scrape_jobs.createIndex({ nextRun: 1, status: 1 }, { name: "idx_due" });
 * db.scrape_jobs.createIndex({ configName: 1, status: 1 }, { name: "idx_config_status" });
 * db.scrape_jobs.createIndex({ createdAt: 1 }, { name: "idx_created" });
 * </pre>
 */
public class ScrapeJobsMongoIndexConfig {

    public static final String IDX_DUE = "idx_due";
    public static final String IDX_CONFIG_STATUS = "idx_config_status";
    public static final String IDX_CREATED = "idx_created";

    private final MongoTemplate mongoTemplate;

    public ScrapeJobsMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScrapeJobDocument.class).ensureIndex(dueIndex());
        mongoTemplate.indexOps(ScrapeJobDocument.class).ensureIndex(configStatusIndex());
        mongoTemplate.indexOps(ScrapeJobDocument.class).ensureIndex(createdIndex());
    }

    public static Index dueIndex() {
        return new Index()
                .on("nextRun", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named(IDX_DUE);
    }

    public static Index configStatusIndex() {
        return new Index()
                .on("configName", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named(IDX_CONFIG_STATUS);
    }

    public static Index createdIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CREATED);
    }
}
