package com.bastion.accessservice.domain.port;

import com.bastion.eventmodel.AggregateType;
import com.bastion.eventmodel.EventEnvelope;

import java.util.List;

/**
 * Append-only event journal with optimistic concurrency per aggregate and a global change feed.
 */
public interface EventStore {

    /**
     * Events of one aggregate in sequence order, empty if the aggregate was never written.
     */
    List<EventEnvelope<?>> readStream(String instanceId, AggregateType type, String aggregateId);

    /**
     * Appends events to a single aggregate atomically.
     *
     * @param expectedSequence sequence the caller's decision was based on, 0 for a new aggregate
     * @return the committed events carrying their global positions
     * @throws ConcurrentAppendException if the aggregate's current sequence differs
     */
    List<EventEnvelope<?>> append(List<EventEnvelope<?>> events, long expectedSequence);

    /**
     * Committed events with a global position greater than {@code position}, in commit order.
     */
    List<EventEnvelope<?>> readAfter(long position, int maxEvents);

    /** Position of the last committed event, 0 when empty. */
    long headPosition();

    /**
     * Registers a callback invoked after every commit. Callbacks must return quickly.
     */
    void onCommit(Runnable listener);
}
