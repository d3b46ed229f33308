package com.bastion.eventmodel;

/**
 * The aggregate an event belongs to and its position in that aggregate's stream.
 *
 * @param aggregateType the kind of aggregate, e.g. "usergrant", "instance"
 * @param aggregateId unique identifier of the aggregate instance
 * @param sequence version of the aggregate after this event, starting at 1 and increasing by one
 */
public record EventAggregate(String aggregateType, String aggregateId, long sequence) {

    public static EventAggregate of(AggregateType type, String aggregateId, long sequence) {
        return new EventAggregate(type.value(), aggregateId, sequence);
    }
}
