package com.bastion.accessservice.domain.port;

/**
 * Thrown by an {@link EventStore} when the aggregate moved past the expected sequence.
 */
public class ConcurrentAppendException extends RuntimeException {

    private final String aggregateId;
    private final long expectedSequence;
    private final long actualSequence;

    public ConcurrentAppendException(String aggregateId, long expectedSequence, long actualSequence) {
        super("aggregate " + aggregateId + " is at sequence " + actualSequence
                + ", expected " + expectedSequence);
        this.aggregateId = aggregateId;
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long expectedSequence() {
        return expectedSequence;
    }

    public long actualSequence() {
        return actualSequence;
    }
}
