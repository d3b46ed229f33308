package com.bastion.accessservice.domain.grant;

import com.bastion.eventmodel.EventType;

import java.util.List;
import java.util.Map;

/**
 * Payloads of the events on a user grant stream.
 */
public final class UserGrantEvents {

    private UserGrantEvents() {
        // holder
    }

    public record Added(String userId, String projectId, String projectGrantId, List<String> roleKeys) {
    }

    public record Changed(String userId, List<String> roleKeys) {
    }

    public record Deactivated(String userId) {
    }

    public record Reactivated(String userId) {
    }

    public record Removed(String userId, String projectId, String projectGrantId) {
    }

    /** Payload class per event type, for deserializing the journal. */
    public static Map<EventType, Class<?>> payloadTypes() {
        return Map.of(
                EventType.USER_GRANT_ADDED, Added.class,
                EventType.USER_GRANT_CHANGED, Changed.class,
                EventType.USER_GRANT_DEACTIVATED, Deactivated.class,
                EventType.USER_GRANT_REACTIVATED, Reactivated.class,
                EventType.USER_GRANT_REMOVED, Removed.class);
    }
}
