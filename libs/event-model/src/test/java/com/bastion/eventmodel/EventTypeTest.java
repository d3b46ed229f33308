package com.bastion.eventmodel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventType")
class EventTypeTest {

    @Test
    @DisplayName("string values are unique")
    void uniqueValues() {
        var seen = new HashSet<String>();
        for (EventType type : EventType.values()) {
            assertThat(seen.add(type.value())).as(type.name()).isTrue();
        }
    }

    @Test
    @DisplayName("fromString() resolves known values and rejects unknown ones")
    void fromString() {
        assertThat(EventType.fromString("user.grant.removed")).contains(EventType.USER_GRANT_REMOVED);
        assertThat(EventType.fromString("user.grant.exploded")).isEmpty();
        assertThat(EventType.isKnown("instance.policy.security.set")).isTrue();
    }

    @Test
    @DisplayName("login policy attachments live on the instance stream")
    void loginPolicyOnInstance() {
        assertThat(EventType.LOGIN_POLICY_IDP_ADDED.aggregateType()).isEqualTo(AggregateType.INSTANCE);
        assertThat(EventType.IDP_CONFIG_ADDED.aggregateType()).isEqualTo(AggregateType.IDP_CONFIG);
        assertThat(AggregateType.fromString("usergrant")).contains(AggregateType.USER_GRANT);
    }
}
