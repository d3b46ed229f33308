package com.bastion.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /**
     * Creates an uncommitted event (position 0) with a generated eventId and version 1.
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            String instanceId,
            String resourceOwner,
            String creatorId,
            String correlationId,
            Instant occurredAt,
            String aggregateId,
            long sequence,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                occurredAt,
                producer,
                instanceId,
                resourceOwner,
                creatorId,
                correlationId == null ? UUID.randomUUID().toString() : correlationId,
                EventAggregate.of(eventType.aggregateType(), aggregateId, sequence),
                0L,
                payload
        );
    }

    /**
     * Creates the event that follows {@code previous} on the same aggregate, inheriting its tenancy
     * and correlation and taking the next sequence.
     */
    public static <T> EventEnvelope<T> createNext(
            EventEnvelope<?> previous,
            EventType eventType,
            String producer,
            String creatorId,
            Instant occurredAt,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                occurredAt,
                producer,
                previous.instanceId(),
                previous.resourceOwner(),
                creatorId,
                previous.correlationId(),
                new EventAggregate(
                        previous.aggregate().aggregateType(),
                        previous.aggregate().aggregateId(),
                        previous.sequence() + 1),
                0L,
                payload
        );
    }
}
