package io.buddy4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.buddy4j.core.DeadlineAlert;
import io.buddy4j.core.Milestone;
import io.buddy4j.core.Notification;
import io.buddy4j.core.PriorityScorer;
import io.buddy4j.core.Recurrence;
import io.buddy4j.core.StorageUnavailableException;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.store.AbstractTaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB persistence layer for tasks.
 *
 * <p>Each task is one {@link TaskDocument}. Conditional writes use {@code findAndReplace} filtered on
 * {@code _id} and {@code revision}, so a writer holding a stale copy replaces nothing and
 * {@link AbstractTaskStore} retries with a fresh read.
 */
public class MongoTaskStore extends AbstractTaskStore {

    private static final Logger log = LoggerFactory.getLogger(MongoTaskStore.class);

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;

    public MongoTaskStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock, PriorityScorer scorer) {
        super(objectMapper, clock, scorer);
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Pings the database; the connection itself is owned by the {@link MongoTemplate}.
     */
    @Override
    public void open() {
        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("MongoDB is not reachable", e);
        }
        log.info("Task collection ready collection={}", mongoTemplate.getCollectionName(TaskDocument.class));
    }

    @Override
    public void close() {
    }

    @Override
    protected Optional<Task> find(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, TaskDocument.class)).map(this::toTask);
    }

    @Override
    protected List<Task> findAll() {
        return toTasks(mongoTemplate.find(new Query().with(Sort.by(Sort.Order.asc("createdAt"))), TaskDocument.class));
    }

    @Override
    protected List<Task> query(TaskFilter filter) {
        Query q = new Query().with(Sort.by(Sort.Order.asc("createdAt")));
        Criteria c = buildCriteria(filter);
        if (c != null) {
            q.addCriteria(c);
        }
        return toTasks(mongoTemplate.find(q, TaskDocument.class));
    }

    @Override
    protected void insert(Task task) {
        try {
            mongoTemplate.insert(toDocument(task));
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException("Task id already exists: " + task.getId(), e);
        } catch (DataAccessResourceFailureException e) {
            throw new StorageUnavailableException("Failed to insert task " + task.getId(), e);
        }
    }

    @Override
    protected boolean replace(Task task, long expectedRevision) {
        Query q = new Query(Criteria.where("_id").is(task.getId()).and("revision").is(expectedRevision));
        try {
            return mongoTemplate.findAndReplace(q, toDocument(task)) != null;
        } catch (DataAccessResourceFailureException e) {
            throw new StorageUnavailableException("Failed to write task " + task.getId(), e);
        }
    }

    @Override
    protected boolean remove(String id) {
        Query q = new Query(Criteria.where("_id").is(id));
        try {
            return mongoTemplate.remove(q, TaskDocument.class).getDeletedCount() > 0;
        } catch (DataAccessResourceFailureException e) {
            throw new StorageUnavailableException("Failed to delete task " + id, e);
        }
    }

    /**
     * Not transactional: a failure between the delete and the insert leaves the collection partially
     * restored.
     */
    @Override
    protected void replaceAll(List<Task> tasks) {
        List<TaskDocument> docs = new ArrayList<>(tasks.size());
        tasks.forEach(t -> docs.add(toDocument(t)));
        try {
            mongoTemplate.remove(new Query(), TaskDocument.class);
            if (!docs.isEmpty()) {
                mongoTemplate.insertAll(docs);
            }
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to replace task collection", e);
        }
        log.info("Replaced task collection count={}", docs.size());
    }

    private static Criteria buildCriteria(TaskFilter filter) {
        List<Criteria> parts = new ArrayList<>(8);

        if (filter.statuses() != null) {
            parts.add(Criteria.where("status").in(filter.statuses()));
        }
        if (filter.excludeTerminal()) {
            parts.add(Criteria.where("status").nin(TaskStatus.COMPLETED, TaskStatus.CANCELLED));
        }
        if (filter.priority() != null) {
            parts.add(Criteria.where("priority").is(filter.priority()));
        }
        if (filter.assignedHandler() != null) {
            parts.add(Criteria.where("assignedHandler").is(filter.assignedHandler()));
        }
        if (filter.parentId() != null) {
            parts.add(Criteria.where("parentId").is(filter.parentId()));
        }
        if (filter.dependsOn() != null) {
            parts.add(Criteria.where("dependencies").is(filter.dependsOn()));
        }
        if (filter.tag() != null) {
            parts.add(Criteria.where("tags").is(filter.tag()));
        }
        if (filter.dueBefore() != null) {
            parts.add(Criteria.where("dueDate").ne(null).lt(filter.dueBefore()));
        }

        if (parts.isEmpty()) {
            return null;
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    private List<Task> toTasks(List<TaskDocument> docs) {
        List<Task> tasks = new ArrayList<>(docs.size());
        for (TaskDocument d : docs) {
            if (d != null) {
                tasks.add(toTask(d));
            }
        }
        return tasks;
    }

    TaskDocument toDocument(Task task) {
        TaskDocument doc = new TaskDocument();
        doc.setId(task.getId());
        doc.setTitle(task.getTitle());
        doc.setDescription(task.getDescription());
        doc.setStatus(task.getStatus());
        doc.setPriority(task.getPriority());
        doc.setDynamicPriorityScore(task.getDynamicPriorityScore());
        doc.setDueDate(task.getDueDate());
        doc.setDependencies(new ArrayList<>(task.getDependencies()));
        doc.setSubtasks(new ArrayList<>(task.getSubtasks()));
        doc.setParentId(task.getParentId());
        doc.setAssignedHandler(task.getAssignedHandler());
        doc.setProgress(task.getProgress());
        doc.setRecurrence(objectMapper.convertValue(task.getRecurrence(), MAP));
        doc.setNextOccurrence(task.getNextOccurrence());
        doc.setRecurrenceOf(task.getRecurrenceOf());
        doc.setEstimatedHours(task.getEstimatedHours());
        doc.setTags(new ArrayList<>(task.getTags()));
        doc.setMilestones(toMaps(task.getMilestones()));
        doc.setNotifications(toMaps(task.getNotifications()));
        doc.setCreatedAt(task.getCreatedAt());
        doc.setUpdatedAt(task.getUpdatedAt());
        doc.setLastActivityAt(task.getLastActivityAt());
        if (task.getLastDeadlineAlert() != null) {
            doc.setLastDeadlineAlert(objectMapper.convertValue(task.getLastDeadlineAlert(), MAP));
        }
        doc.setStaleFlaggedAt(task.getStaleFlaggedAt());
        doc.setRevision(task.getRevision());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Task)}.
     */
    Task toTask(TaskDocument doc) {
        Task task = new Task(doc.getTitle());
        task.setId(doc.getId());
        task.setDescription(doc.getDescription() == null ? "" : doc.getDescription());
        task.setStatus(doc.getStatus());
        task.setPriority(doc.getPriority());
        task.setDynamicPriorityScore(doc.getDynamicPriorityScore());
        task.setDueDate(doc.getDueDate());
        task.setDependencies(toSet(doc.getDependencies()));
        task.setSubtasks(toSet(doc.getSubtasks()));
        task.setParentId(doc.getParentId());
        task.setAssignedHandler(doc.getAssignedHandler());
        task.setProgress(doc.getProgress());
        task.setRecurrence(doc.getRecurrence() == null
                ? Recurrence.none()
                : objectMapper.convertValue(doc.getRecurrence(), Recurrence.class));
        task.setNextOccurrence(doc.getNextOccurrence());
        task.setRecurrenceOf(doc.getRecurrenceOf());
        task.setEstimatedHours(doc.getEstimatedHours());
        task.setTags(toSet(doc.getTags()));
        task.setMilestones(fromMaps(doc.getMilestones(), Milestone.class));
        task.setNotifications(fromMaps(doc.getNotifications(), Notification.class));
        task.setCreatedAt(doc.getCreatedAt());
        task.setUpdatedAt(doc.getUpdatedAt());
        task.setLastActivityAt(doc.getLastActivityAt());
        if (doc.getLastDeadlineAlert() != null) {
            task.setLastDeadlineAlert(objectMapper.convertValue(doc.getLastDeadlineAlert(), DeadlineAlert.class));
        }
        task.setStaleFlaggedAt(doc.getStaleFlaggedAt());
        task.setRevision(doc.getRevision());
        return task;
    }

    private static Set<String> toSet(List<String> values) {
        return values == null ? null : new LinkedHashSet<>(values);
    }

    private List<Map<String, Object>> toMaps(List<?> values) {
        List<Map<String, Object>> maps = new ArrayList<>(values.size());
        for (Object v : values) {
            maps.add(objectMapper.convertValue(v, MAP));
        }
        return maps;
    }

    private <T> List<T> fromMaps(List<Map<String, Object>> maps, Class<T> type) {
        if (maps == null) {
            return null;
        }
        List<T> values = new ArrayList<>(maps.size());
        for (Map<String, Object> m : maps) {
            values.add(objectMapper.convertValue(m, type));
        }
        return values;
    }
}
