package com.bastion.accessservice.infrastructure.health;

import com.bastion.accessservice.domain.query.QueryProjector;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports whether the query projector is running and how far the read views trail the journal.
 * Lag alone never marks the service down since the views have no lag bound.
 */
public class ProjectionLagHealthIndicator implements HealthIndicator {

    private final QueryProjector projector;

    public ProjectionLagHealthIndicator(QueryProjector projector) {
        this.projector = projector;
    }

    @Override
    public Health health() {
        Health.Builder builder = projector.isRunning() ? Health.up() : Health.down();
        builder.withDetail("lag", projector.lag())
                .withDetail("processedPosition", projector.processedPosition());
        if (projector.processedAt() != null) {
            builder.withDetail("processedAt", projector.processedAt().toString());
        }
        return builder.build();
    }
}
