package com.bastion.accessservice.domain;

import com.bastion.eventmodel.EventEnvelope;

import java.time.Instant;

/**
 * Returned synchronously by every successful command.
 *
 * @param sequence      aggregate sequence after the change
 * @param changeDate    commit time of the change, null if the aggregate has never been written
 * @param resourceOwner organization (or instance) owning the aggregate
 */
public record ChangeDetails(long sequence, Instant changeDate, String resourceOwner) {

    public static ChangeDetails of(EventEnvelope<?> committed) {
        return new ChangeDetails(committed.sequence(), committed.occurredAt(), committed.resourceOwner());
    }
}
