package com.bastion.eventmodel;

import java.util.Optional;

/** Aggregate roots that own an event stream. */
public enum AggregateType {
    USER_GRANT("usergrant"),
    INSTANCE("instance"),
    IDP_CONFIG("idpconfig");

    private final String value;

    AggregateType(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    public String value() {
        return value;
    }

    public static Optional<AggregateType> fromString(String value) {
        for (AggregateType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
