package io.buddy4j.config;

import io.buddy4j.internal.mongo.TaskDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the task collection.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code buddy.ensure-indexes-on-startup=true}; in
 * production they are usually managed by migrations or ops scripts.
 *
 * <h3>Indexes (collection: {@code buddy_tasks})</h3>
 * <ul>
 *   <li><b>idx_status_due</b>: { status: 1, dueDate: 1 }
 *       <br/>Used by the deadline, stale and recurrence sweeps and by status filters.</li>
 *   <li><b>idx_parent</b>: { parentId: 1 }
 *       <br/>Used by cascade deletes and progress roll-up.</li>
 *   <li><b>idx_dependencies</b>: { dependencies: 1 }
 *       <br/>Multikey index used to find and release dependents of a completed task.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.buddy_tasks.createIndex({ status: 1, dueDate: 1 }, { name: "idx_status_due" });
 * db.buddy_tasks.createIndex({ parentId: 1 }, { name: "idx_parent" });
 * db.buddy_tasks.createIndex({ dependencies: 1 }, { name: "idx_dependencies" });
 * </pre>
 */
public class BuddyMongoIndexConfig {

    public static final String IDX_STATUS_DUE = "idx_status_due";
    public static final String IDX_PARENT = "idx_parent";
    public static final String IDX_DEPENDENCIES = "idx_dependencies";

    private final MongoTemplate mongoTemplate;

    public BuddyMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(TaskDocument.class).ensureIndex(statusDueIndex());
        mongoTemplate.indexOps(TaskDocument.class).ensureIndex(parentIndex());
        mongoTemplate.indexOps(TaskDocument.class).ensureIndex(dependenciesIndex());
    }

    public static Index statusDueIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("dueDate", Sort.Direction.ASC)
                .named(IDX_STATUS_DUE);
    }

    public static Index parentIndex() {
        return new Index().on("parentId", Sort.Direction.ASC).named(IDX_PARENT);
    }

    public static Index dependenciesIndex() {
        return new Index().on("dependencies", Sort.Direction.ASC).named(IDX_DEPENDENCIES);
    }
}
