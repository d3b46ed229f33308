package com.bastion.accessservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Type-safe configuration of the access service, bound from {@code bastion.service.*} and validated
 * at startup.
 *
 * <pre>
 * bastion:
 *   service:
 *     name: access-service
 *     environment: production
 *     grpc-port: 9090
 *     instance-id: default
 *     bulk-parallelism: 4
 *     consistency:
 *       max-wait: 60s
 *       tick: 100ms
 * </pre>
 *
 * @param name            service name used for logging, metrics, and as event producer. Required.
 * @param environment     deployment environment (development, staging, production)
 * @param grpcPort        port of the gRPC server, 0 disables it
 * @param instanceId      instance served when local seed data is loaded
 * @param bulkParallelism number of grants removed concurrently by a bulk removal
 * @param consistency     budget for read-after-write waits
 * @param seed            data loaded at startup for local runs
 */
@ConfigurationProperties(prefix = "bastion.service")
@Validated
public record AccessServiceProperties(
        @NotBlank String name,
        String environment,
        @Min(0) @Max(65535) int grpcPort,
        String instanceId,
        @Min(1) int bulkParallelism,
        @Valid Consistency consistency,
        Seed seed) {

    /**
     * Applies defaults for optional fields. Runs before Bean Validation, so defaults satisfy the
     * constraints.
     */
    public AccessServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (instanceId == null || instanceId.isBlank()) {
            instanceId = "default";
        }
        if (bulkParallelism <= 0) {
            bulkParallelism = 4;
        }
        if (consistency == null) {
            consistency = new Consistency(null, null);
        }
        if (seed == null) {
            seed = new Seed(null, null, null, null);
        }
    }

    /**
     * @param maxWait longest a read waits for the view to catch up
     * @param tick    interval between reads while waiting, also the projector's poll interval
     */
    public record Consistency(Duration maxWait, Duration tick) {
        public Consistency {
            if (maxWait == null) {
                maxWait = Duration.ofSeconds(60);
            }
            if (tick == null || tick.isZero() || tick.isNegative()) {
                tick = Duration.ofMillis(100);
            }
        }
    }

    /**
     * Directory entries and identity providers created at startup, for local runs without the
     * surrounding platform.
     */
    public record Seed(List<String> users, List<SeedProject> projects, List<SeedProjectGrant> projectGrants,
                       List<SeedIdentityProvider> identityProviders) {
        public Seed {
            users = users == null ? List.of() : List.copyOf(users);
            projects = projects == null ? List.of() : List.copyOf(projects);
            projectGrants = projectGrants == null ? List.of() : List.copyOf(projectGrants);
            identityProviders = identityProviders == null ? List.of() : List.copyOf(identityProviders);
        }

        public boolean isEmpty() {
            return users.isEmpty() && projects.isEmpty() && projectGrants.isEmpty() && identityProviders.isEmpty();
        }
    }

    public record SeedProject(String id, String owner, List<String> roleKeys) {
    }

    public record SeedProjectGrant(String id, String projectId, String grantedOrg, List<String> roleKeys) {
    }

    /**
     * @param autoLinking USERNAME or EMAIL to link automatically, empty for none
     */
    public record SeedIdentityProvider(String name, String type, boolean active, boolean linkingAllowed,
                                       boolean creationAllowed, boolean autoCreation, boolean autoUpdate,
                                       String autoLinking) {
    }
}
