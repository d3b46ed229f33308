package com.bastion.accessservice.domain.query;

import com.bastion.accessservice.domain.port.EventStore;
import com.bastion.eventmodel.EventEnvelope;
import com.bastion.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Feeds committed events into the read views on a dedicated worker thread.
 * <p>
 * Events are consumed in commit order. For every aggregate an event is applied only if its
 * sequence is above the last one applied for that aggregate, so views never move backwards and
 * redelivered events are no-ops. The same bookkeeping is kept per view, so when one view fails
 * on an event the retry only reaches the views that have not applied it yet. The worker wakes up on every commit and also polls at a fixed
 * interval. There is no bound on how far the views may trail the journal.
 */
public class QueryProjector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueryProjector.class);

    private final EventStore eventStore;
    private final List<Projection> projections;
    private final Duration pollInterval;
    private final int batchSize;
    private final ScheduledExecutorService worker;
    private final Map<String, Long> appliedSequences = new ConcurrentHashMap<>();
    private final List<Map<String, Long>> viewSequences;
    private final AtomicBoolean wakeUpPending = new AtomicBoolean();

    private volatile long processedPosition;
    private volatile Instant processedAt;
    private volatile boolean running;

    public QueryProjector(EventStore eventStore, List<Projection> projections, Duration pollInterval,
                          int batchSize, MetricFactory metrics) {
        this.eventStore = eventStore;
        this.projections = List.copyOf(projections);
        this.viewSequences = this.projections.stream()
                .<Map<String, Long>>map(projection -> new ConcurrentHashMap<>())
                .toList();
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.worker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "bastion-projector");
            thread.setDaemon(true);
            return thread;
        });
        metrics.gauge("bastion.projection.lag", "Committed events not yet applied to the read views",
                this::lag);
    }

    public void start() {
        running = true;
        eventStore.onCommit(this::wakeUp);
        worker.scheduleWithFixedDelay(this::drainLogged, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Query projector started with {} projections", projections.size());
    }

    @Override
    public void close() {
        running = false;
        worker.shutdownNow();
        log.info("Query projector stopped at position {}", processedPosition);
    }

    /**
     * Applies every committed event not yet seen. Also called by the worker; callers on other
     * threads simply run a catch-up pass themselves.
     */
    public synchronized void catchUp() {
        List<EventEnvelope<?>> batch = eventStore.readAfter(processedPosition, batchSize);
        while (!batch.isEmpty()) {
            for (EventEnvelope<?> event : batch) {
                project(event);
            }
            batch = eventStore.readAfter(processedPosition, batchSize);
        }
    }

    private void project(EventEnvelope<?> event) {
        String key = aggregateKey(event.aggregate().aggregateType(), event.aggregate().aggregateId());
        long applied = appliedSequences.getOrDefault(key, 0L);
        if (event.sequence() <= applied) {
            log.debug("Skipping {} at sequence {}, already at {}", key, event.sequence(), applied);
        } else {
            for (int i = 0; i < projections.size(); i++) {
                Map<String, Long> viewApplied = viewSequences.get(i);
                if (event.sequence() > viewApplied.getOrDefault(key, 0L)) {
                    projections.get(i).apply(event);
                    viewApplied.put(key, event.sequence());
                }
            }
            appliedSequences.put(key, event.sequence());
        }
        processedPosition = event.position();
        processedAt = event.occurredAt();
    }

    private void wakeUp() {
        if (running && wakeUpPending.compareAndSet(false, true)) {
            try {
                worker.execute(this::drainLogged);
            } catch (RejectedExecutionException e) {
                log.debug("Projector is shut down, commit notification dropped");
            }
        }
    }

    private void drainLogged() {
        wakeUpPending.set(false);
        try {
            catchUp();
        } catch (RuntimeException e) {
            log.error("Projection failed after position {}, retrying on next pass", processedPosition, e);
        }
    }

    /** Last sequence applied for the aggregate, 0 if none. */
    public long appliedSequence(String aggregateType, String aggregateId) {
        return appliedSequences.getOrDefault(aggregateKey(aggregateType, aggregateId), 0L);
    }

    /** Global position of the last event the views have consumed. */
    public long processedPosition() {
        return processedPosition;
    }

    /** Commit time of the last consumed event, null before the first one. */
    public Instant processedAt() {
        return processedAt;
    }

    /** Committed events the views have not consumed yet. */
    public long lag() {
        return Math.max(0, eventStore.headPosition() - processedPosition);
    }

    public boolean isRunning() {
        return running && !worker.isShutdown();
    }

    private static String aggregateKey(String aggregateType, String aggregateId) {
        return aggregateType + "/" + aggregateId;
    }
}
