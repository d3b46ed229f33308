package com.bastion.eventmodel;

import java.time.Instant;

/**
 * Canonical envelope for every event written to the event store.
 *
 * <p>The envelope carries identification, tenancy, attribution and ordering metadata next to the
 * event-specific payload. {@code position} is assigned by the store on commit and is 0 until then.
 *
 * @param <T> the type of the event-specific payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** The type of this event (e.g. "user.grant.added"). */
        String eventType,

        /** Schema version of this event type, starts at 1. */
        int eventVersion,

        /** When the event was created. */
        Instant occurredAt,

        /** Name of the service that produced this event. */
        String producer,

        /** Instance the event belongs to. */
        String instanceId,

        /** Organization (or instance) owning the aggregate. */
        String resourceOwner,

        /** User whose command produced this event. */
        String creatorId,

        /** Correlation ID linking the event to the request that caused it. */
        String correlationId,

        /** The aggregate this event relates to, with its new sequence. */
        EventAggregate aggregate,

        /** Global commit position in the store, 0 before commit. */
        long position,

        /** Event-specific data. */
        T payload) {

    /** Copy of this envelope carrying the commit position assigned by the store. */
    public EventEnvelope<T> withPosition(long newPosition) {
        return new EventEnvelope<>(eventId, eventType, eventVersion, occurredAt, producer, instanceId,
                resourceOwner, creatorId, correlationId, aggregate, newPosition, payload);
    }

    /** Shortcut for {@code aggregate().sequence()}. */
    public long sequence() {
        return aggregate.sequence();
    }
}
