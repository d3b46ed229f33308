package com.bastion.accessservice.infrastructure.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bastion.accessservice.domain.ChangeDetails;
import com.bastion.accessservice.domain.grant.UserGrantState;
import com.bastion.accessservice.domain.query.UserGrantFilter;
import com.bastion.management.v1.UserGrantQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

@DisplayName("GrpcMappers")
class GrpcMappersTest {

    @Test
    @DisplayName("combines list criteria into one filter")
    void combinesCriteria() {
        UserGrantFilter filter = GrpcMappers.userGrantFilter(List.of(
                UserGrantQuery.newBuilder().setUserId("user-1").build(),
                UserGrantQuery.newBuilder().setRoleKey("viewer").build(),
                UserGrantQuery.newBuilder()
                        .setState(com.bastion.management.v1.UserGrantState.USER_GRANT_STATE_INACTIVE)
                        .build()));

        assertThat(filter).isEqualTo(new UserGrantFilter("user-1", null, null, "viewer", UserGrantState.INACTIVE));
    }

    @Test
    @DisplayName("no criteria matches everything")
    void emptyCriteria() {
        assertThat(GrpcMappers.userGrantFilter(List.of())).isEqualTo(UserGrantFilter.all());
    }

    @Test
    @DisplayName("rejects the same criterion twice and an unspecified state")
    void rejectsAmbiguousCriteria() {
        assertThatThrownBy(() -> GrpcMappers.userGrantFilter(List.of(
                UserGrantQuery.newBuilder().setUserId("a").build(),
                UserGrantQuery.newBuilder().setUserId("b").build())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GrpcMappers.userGrantFilter(List.of(
                UserGrantQuery.newBuilder()
                        .setState(com.bastion.management.v1.UserGrantState.USER_GRANT_STATE_UNSPECIFIED)
                        .build())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("details without a change date leave the timestamp unset")
    void detailsWithoutChangeDate() {
        var details = GrpcMappers.details(new ChangeDetails(0, null, "instance-1"));

        assertThat(details.hasChangeDate()).isFalse();
        assertThat(details.getResourceOwner()).isEqualTo("instance-1");
    }

    @Test
    @DisplayName("timestamps keep nanosecond precision")
    void timestamp() {
        var ts = GrpcMappers.timestamp(Instant.ofEpochSecond(1_700_000_000L, 123_456_789));

        assertThat(ts.getSeconds()).isEqualTo(1_700_000_000L);
        assertThat(ts.getNanos()).isEqualTo(123_456_789);
    }
}
