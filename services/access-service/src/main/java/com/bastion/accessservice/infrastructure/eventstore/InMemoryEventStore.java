package com.bastion.accessservice.infrastructure.eventstore;

import com.bastion.accessservice.domain.port.ConcurrentAppendException;
import com.bastion.accessservice.domain.port.EventStore;
import com.bastion.eventmodel.AggregateType;
import com.bastion.eventmodel.EventEnvelope;
import com.bastion.eventmodel.EventSerializer;
import com.bastion.eventmodel.EventValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Journal kept in memory as serialized JSON, for local runs and tests.
 * <p>
 * Appends are serialized by a single lock, which also assigns global positions, so the change
 * feed order equals commit order. Listeners run on the committing thread after the lock is
 * released.
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final EventPayloadRegistry payloadRegistry;
    private final List<StoredEvent> journal = new ArrayList<>();
    private final Map<String, List<StoredEvent>> streams = new HashMap<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public InMemoryEventStore(EventPayloadRegistry payloadRegistry) {
        this.payloadRegistry = payloadRegistry;
    }

    @Override
    public List<EventEnvelope<?>> readStream(String instanceId, AggregateType type, String aggregateId) {
        List<StoredEvent> stream;
        synchronized (this) {
            stream = List.copyOf(streams.getOrDefault(streamKey(type.value(), aggregateId), List.of()));
        }
        return stream.stream()
                .filter(e -> e.instanceId().equals(instanceId))
                .<EventEnvelope<?>>map(this::decode)
                .toList();
    }

    @Override
    public List<EventEnvelope<?>> append(List<EventEnvelope<?>> events, long expectedSequence) {
        if (events.isEmpty()) {
            return List.of();
        }
        EventEnvelope<?> first = events.get(0);
        String key = streamKey(first.aggregate().aggregateType(), first.aggregate().aggregateId());
        for (EventEnvelope<?> event : events) {
            var validation = EventValidator.validate(event);
            if (!validation.valid()) {
                throw new IllegalArgumentException("Invalid event " + event.eventType() + ": " + validation.errors());
            }
            if (!key.equals(streamKey(event.aggregate().aggregateType(), event.aggregate().aggregateId()))) {
                throw new IllegalArgumentException("All events of one append must belong to the same aggregate");
            }
        }

        var committed = new ArrayList<EventEnvelope<?>>(events.size());
        synchronized (this) {
            List<StoredEvent> stream = streams.computeIfAbsent(key, k -> new ArrayList<>());
            long current = stream.isEmpty() ? 0 : stream.get(stream.size() - 1).sequence();
            if (current != expectedSequence) {
                throw new ConcurrentAppendException(first.aggregate().aggregateId(), expectedSequence, current);
            }
            long sequence = current;
            for (EventEnvelope<?> event : events) {
                if (event.sequence() != ++sequence) {
                    throw new IllegalArgumentException("Event sequence " + event.sequence()
                            + " does not follow " + (sequence - 1) + " on " + key);
                }
            }
            for (EventEnvelope<?> event : events) {
                EventEnvelope<?> positioned = event.withPosition(journal.size() + 1L);
                var stored = new StoredEvent(positioned.position(), positioned.instanceId(), positioned.sequence(),
                        positioned.eventType(), EventSerializer.serialize(positioned));
                journal.add(stored);
                stream.add(stored);
                committed.add(positioned);
            }
        }
        log.debug("Committed {} event(s) to {} up to sequence {}", committed.size(), key,
                committed.get(committed.size() - 1).sequence());
        listeners.forEach(this::notifyListener);
        return List.copyOf(committed);
    }

    @Override
    public List<EventEnvelope<?>> readAfter(long position, int maxEvents) {
        List<StoredEvent> slice;
        synchronized (this) {
            int from = (int) Math.min(Math.max(position, 0), journal.size());
            int to = Math.min(journal.size(), from + maxEvents);
            slice = List.copyOf(journal.subList(from, to));
        }
        return slice.stream().<EventEnvelope<?>>map(this::decode).toList();
    }

    @Override
    public synchronized long headPosition() {
        return journal.size();
    }

    @Override
    public void onCommit(Runnable listener) {
        listeners.add(listener);
    }

    private void notifyListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Commit listener failed", e);
        }
    }

    private EventEnvelope<?> decode(StoredEvent stored) {
        return EventSerializer.deserialize(stored.json(), payloadRegistry.payloadType(stored.eventType()));
    }

    private static String streamKey(String aggregateType, String aggregateId) {
        return aggregateType + "/" + aggregateId;
    }

    private record StoredEvent(long position, String instanceId, long sequence, String eventType, String json) {
    }
}
