package io.github.flameyossnowy.skeletal.mongodb;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import io.github.flameyossnowy.skeletal.api.config.SkeletalConfig;
import io.github.flameyossnowy.skeletal.api.exceptions.PermanentTaskException;
import io.github.flameyossnowy.skeletal.api.tasks.RelationTask;
import io.github.flameyossnowy.skeletal.api.tasks.TaskCodec;
import io.github.flameyossnowy.skeletal.api.tasks.TaskDispatcher;
import io.github.flameyossnowy.skeletal.api.tasks.TaskQueue;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.lte;
import static com.mongodb.client.model.Filters.or;

/**
 * Durable task queue in a MongoDB collection.
 *
 * <p>A worker leases a task by atomically pushing its {@code lease_until} into the future; a
 * worker that dies mid-task loses the lease when it expires and the task runs again. Completed
 * and permanently failed tasks are deleted, other failures are retried with exponential
 * back-off until {@code maxAttempts} is reached.</p>
 */
public class MongoTaskQueue implements TaskQueue, AutoCloseable {
    public static final String COLLECTION = "_skeletal_tasks";
    static final String TYPE = "type";
    static final String PAYLOAD = "payload";
    static final String ATTEMPTS = "attempts";
    static final String AVAILABLE_AT = "available_at";
    static final String LEASE_UNTIL = "lease_until";

    private final MongoCollection<Document> collection;
    private final TaskCodec codec;
    private final int maxAttempts;
    private final Duration backoff;
    private final Duration lease;
    private final Clock clock;
    private volatile TaskDispatcher dispatcher;
    private ScheduledExecutorService poller;

    public MongoTaskQueue(@NotNull MongoDatabase database, @NotNull SkeletalConfig config) {
        this(database.getCollection(COLLECTION), new TaskCodec(), config.maxTaskAttempts(), config.retryBackoff(),
            Duration.ofMinutes(5), Clock.systemUTC());
    }

    public MongoTaskQueue(@NotNull MongoCollection<Document> collection, @NotNull TaskCodec codec, int maxAttempts,
                          @NotNull Duration backoff, @NotNull Duration lease, @NotNull Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.collection = collection;
        this.codec = codec;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.lease = lease;
        this.clock = clock;
    }

    @Override
    public void bind(@NotNull TaskDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void enqueue(@NotNull RelationTask task) {
        Document document = new Document(TYPE, task.type().name())
            .append(PAYLOAD, codec.encode(task))
            .append(ATTEMPTS, 0)
            .append(AVAILABLE_AT, Date.from(clock.instant()))
            .append(LEASE_UNTIL, null);
        try {
            collection.insertOne(document);
        } catch (MongoException e) {
            throw MongoErrors.translate(e);
        }
    }

    /**
     * Leases and runs at most one due task.
     *
     * @return false when no task was due
     */
    public boolean pollOnce() {
        TaskDispatcher target = dispatcher;
        if (target == null) {
            throw new IllegalStateException("No dispatcher bound to this queue");
        }
        Instant now = clock.instant();
        Document leased = collection.findOneAndUpdate(
            and(lte(AVAILABLE_AT, Date.from(now)), or(eq(LEASE_UNTIL, null), lte(LEASE_UNTIL, Date.from(now)))),
            Updates.combine(Updates.set(LEASE_UNTIL, Date.from(now.plus(lease))), Updates.inc(ATTEMPTS, 1)),
            new FindOneAndUpdateOptions().sort(Sorts.ascending(AVAILABLE_AT)).returnDocument(ReturnDocument.AFTER));
        if (leased == null) return false;

        ObjectId id = leased.getObjectId("_id");
        int attempts = leased.get(ATTEMPTS, Number.class).intValue();
        RelationTask task = null;
        try {
            task = codec.decode(leased.getString(PAYLOAD));
            target.dispatch(task);
            collection.deleteOne(eq("_id", id));
        } catch (PermanentTaskException e) {
            Logging.error("Dropping task " + (task == null ? id : task) + ": " + e.getMessage(), e);
            collection.deleteOne(eq("_id", id));
        } catch (RuntimeException e) {
            if (attempts >= maxAttempts) {
                Logging.error("Giving up on task " + task + " after " + attempts + " attempt(s)", e);
                collection.deleteOne(eq("_id", id));
            } else {
                long delay = backoff.toMillis() << Math.min(attempts - 1, 20);
                Logging.warn("Task " + task + " failed (attempt " + attempts + "), retrying in " + delay + "ms: " + e.getMessage());
                collection.updateOne(eq("_id", id), Updates.combine(
                    Updates.set(AVAILABLE_AT, Date.from(clock.instant().plusMillis(delay))),
                    Updates.set(LEASE_UNTIL, null)));
            }
        }
        return true;
    }

    /**
     * Runs due tasks until none is left.
     *
     * @return the number of tasks leased
     */
    public int drain() {
        int leased = 0;
        while (pollOnce()) leased++;
        return leased;
    }

    /**
     * Starts polling on a daemon thread every {@code interval}.
     */
    public synchronized void start(@NotNull Duration interval) {
        if (poller != null) {
            throw new IllegalStateException("Already polling");
        }
        poller = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "skeletal-mongo-tasks");
            thread.setDaemon(true);
            return thread;
        });
        poller.scheduleWithFixedDelay(() -> {
            try {
                drain();
            } catch (RuntimeException e) {
                Logging.error("Polling the task queue failed", e);
            }
        }, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (poller == null) return;
        poller.shutdown();
        try {
            if (!poller.awaitTermination(5, TimeUnit.SECONDS)) {
                poller.shutdownNow();
            }
        } catch (InterruptedException e) {
            poller.shutdownNow();
            Thread.currentThread().interrupt();
        }
        poller = null;
    }
}
