package com.bastion.eventmodel;

import java.util.Optional;

/**
 * All known event types. The {@code value} field holds the canonical string stored with each
 * event.
 */
public enum EventType {

    // ---- User grant events ----
    USER_GRANT_ADDED("user.grant.added", AggregateType.USER_GRANT),
    USER_GRANT_CHANGED("user.grant.changed", AggregateType.USER_GRANT),
    USER_GRANT_DEACTIVATED("user.grant.deactivated", AggregateType.USER_GRANT),
    USER_GRANT_REACTIVATED("user.grant.reactivated", AggregateType.USER_GRANT),
    USER_GRANT_REMOVED("user.grant.removed", AggregateType.USER_GRANT),

    // ---- Instance settings ----
    SECURITY_POLICY_SET("instance.policy.security.set", AggregateType.INSTANCE),

    // ---- Identity providers (written by the provider management surface) ----
    IDP_CONFIG_ADDED("instance.idp.config.added", AggregateType.IDP_CONFIG),
    IDP_CONFIG_REMOVED("instance.idp.config.removed", AggregateType.IDP_CONFIG),
    LOGIN_POLICY_IDP_ADDED("instance.policy.login.idpprovider.added", AggregateType.INSTANCE),
    LOGIN_POLICY_IDP_REMOVED("instance.policy.login.idpprovider.removed", AggregateType.INSTANCE);

    private final String value;
    private final AggregateType aggregateType;

    EventType(String value, AggregateType aggregateType) {
        this.value = value;
        this.aggregateType = aggregateType;
    }

    /** The canonical string representation (e.g. "user.grant.added"). */
    public String value() {
        return value;
    }

    /** The aggregate whose stream carries this event. */
    public AggregateType aggregateType() {
        return aggregateType;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "user.grant.added")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
