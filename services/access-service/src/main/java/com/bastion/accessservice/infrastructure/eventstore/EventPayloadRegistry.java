package com.bastion.accessservice.infrastructure.eventstore;

import com.bastion.eventmodel.EventType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps each event type to the payload class it is deserialized into.
 */
public final class EventPayloadRegistry {

    private final Map<EventType, Class<?>> payloadTypes = new EnumMap<>(EventType.class);

    public EventPayloadRegistry register(Map<EventType, Class<?>> types) {
        payloadTypes.putAll(types);
        return this;
    }

    /**
     * @throws IllegalArgumentException if the type is unknown or has no registered payload
     */
    public Class<?> payloadType(String eventType) {
        Class<?> type = EventType.fromString(eventType).map(payloadTypes::get).orElse(null);
        if (type == null) {
            throw new IllegalArgumentException("No payload type registered for event type " + eventType);
        }
        return type;
    }
}
