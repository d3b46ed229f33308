package com.bastion.accessservice.config;

import com.bastion.accessservice.domain.command.CommandDispatcher;
import com.bastion.accessservice.domain.grant.UserGrantCommands;
import com.bastion.accessservice.domain.grant.UserGrantEvents;
import com.bastion.accessservice.domain.idp.IdentityProviderEvents;
import com.bastion.accessservice.domain.query.IdentityProviderProjection;
import com.bastion.accessservice.domain.query.QueryProjector;
import com.bastion.accessservice.domain.query.ReadAfterWrite;
import com.bastion.accessservice.domain.query.SecuritySettingsProjection;
import com.bastion.accessservice.domain.query.SettingsQueries;
import com.bastion.accessservice.domain.query.UserGrantProjection;
import com.bastion.accessservice.domain.query.UserGrantQueries;
import com.bastion.accessservice.domain.settings.SecurityPolicySet;
import com.bastion.accessservice.domain.settings.SecuritySettingsAggregate;
import com.bastion.accessservice.infrastructure.LocalSeedLoader;
import com.bastion.accessservice.infrastructure.directory.InMemoryProjectDirectory;
import com.bastion.accessservice.infrastructure.directory.InMemoryUserDirectory;
import com.bastion.accessservice.infrastructure.eventstore.EventPayloadRegistry;
import com.bastion.accessservice.infrastructure.eventstore.InMemoryEventStore;
import com.bastion.accessservice.infrastructure.grpc.CallerContextInterceptor;
import com.bastion.accessservice.infrastructure.grpc.GrpcCorrelationInterceptor;
import com.bastion.accessservice.infrastructure.grpc.GrpcExceptionInterceptor;
import com.bastion.accessservice.infrastructure.grpc.GrpcServerLifecycle;
import com.bastion.accessservice.infrastructure.grpc.SettingsGrpcService;
import com.bastion.accessservice.infrastructure.grpc.UserGrantGrpcService;
import com.bastion.accessservice.infrastructure.health.ProjectionLagHealthIndicator;
import com.bastion.accessservice.infrastructure.idp.EventSourcedIdentityProviderRegistry;
import com.bastion.eventmodel.EventType;
import com.bastion.observability.MetricFactory;
import com.bastion.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the access service: journal, directories, command handlers, read views and the gRPC surface.
 */
@Configuration
public class AccessServiceConfiguration {

    private static final int PROJECTOR_BATCH_SIZE = 500;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventPayloadRegistry eventPayloadRegistry() {
        return new EventPayloadRegistry()
                .register(UserGrantEvents.payloadTypes())
                .register(IdentityProviderEvents.payloadTypes())
                .register(Map.of(EventType.SECURITY_POLICY_SET, SecurityPolicySet.class));
    }

    @Bean
    public InMemoryEventStore eventStore(EventPayloadRegistry registry) {
        return new InMemoryEventStore(registry);
    }

    @Bean
    public InMemoryProjectDirectory projectDirectory() {
        return new InMemoryProjectDirectory();
    }

    @Bean
    public InMemoryUserDirectory userDirectory() {
        return new InMemoryUserDirectory();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, AccessServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper(AccessServiceProperties properties) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(properties.name()));
    }

    @Bean
    public CommandDispatcher commandDispatcher(Clock clock, MetricFactory metrics, SpanHelper spans) {
        return new CommandDispatcher(clock, metrics, spans);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService bulkExecutor(AccessServiceProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.bulkParallelism(), r -> {
            Thread thread = new Thread(r, "bastion-bulk-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public UserGrantCommands userGrantCommands(CommandDispatcher dispatcher, InMemoryEventStore eventStore,
                                               InMemoryProjectDirectory projects, InMemoryUserDirectory users,
                                               Clock clock, ExecutorService bulkExecutor,
                                               AccessServiceProperties properties) {
        return new UserGrantCommands(dispatcher, eventStore, projects, users, clock,
                () -> UUID.randomUUID().toString(), properties.name(), bulkExecutor);
    }

    @Bean
    public SecuritySettingsAggregate securitySettingsAggregate(CommandDispatcher dispatcher,
                                                               InMemoryEventStore eventStore, Clock clock,
                                                               AccessServiceProperties properties) {
        return new SecuritySettingsAggregate(dispatcher, eventStore, clock, properties.name());
    }

    @Bean
    public EventSourcedIdentityProviderRegistry identityProviderRegistry(InMemoryEventStore eventStore,
                                                                         Clock clock) {
        return new EventSourcedIdentityProviderRegistry(eventStore, clock);
    }

    @Bean
    public UserGrantProjection userGrantProjection() {
        return new UserGrantProjection();
    }

    @Bean
    public SecuritySettingsProjection securitySettingsProjection() {
        return new SecuritySettingsProjection();
    }

    @Bean
    public IdentityProviderProjection identityProviderProjection() {
        return new IdentityProviderProjection();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public QueryProjector queryProjector(InMemoryEventStore eventStore, UserGrantProjection userGrants,
                                         SecuritySettingsProjection settings,
                                         IdentityProviderProjection identityProviders, MetricFactory metrics,
                                         AccessServiceProperties properties) {
        return new QueryProjector(eventStore, List.of(userGrants, settings, identityProviders),
                properties.consistency().tick(), PROJECTOR_BATCH_SIZE, metrics);
    }

    @Bean
    public ReadAfterWrite readAfterWrite(AccessServiceProperties properties) {
        return new ReadAfterWrite(properties.consistency().maxWait(), properties.consistency().tick());
    }

    @Bean
    public UserGrantQueries userGrantQueries(CommandDispatcher dispatcher, UserGrantProjection projection,
                                             QueryProjector projector, ReadAfterWrite readAfterWrite) {
        return new UserGrantQueries(dispatcher, projection, projector, readAfterWrite);
    }

    @Bean
    public SettingsQueries settingsQueries(CommandDispatcher dispatcher, SecuritySettingsProjection settings,
                                           IdentityProviderProjection identityProviders, QueryProjector projector) {
        return new SettingsQueries(dispatcher, settings, identityProviders, projector);
    }

    @Bean
    public ProjectionLagHealthIndicator projectionLagHealthIndicator(QueryProjector projector) {
        return new ProjectionLagHealthIndicator(projector);
    }

    @Bean
    public LocalSeedLoader localSeedLoader(AccessServiceProperties properties, InMemoryProjectDirectory projects,
                                           InMemoryUserDirectory users,
                                           EventSourcedIdentityProviderRegistry identityProviders) {
        return new LocalSeedLoader(properties, projects, users, identityProviders);
    }

    @Bean
    public UserGrantGrpcService userGrantGrpcService(UserGrantCommands commands, UserGrantQueries queries) {
        return new UserGrantGrpcService(commands, queries);
    }

    @Bean
    public SettingsGrpcService settingsGrpcService(SecuritySettingsAggregate settings, SettingsQueries queries) {
        return new SettingsGrpcService(settings, queries);
    }

    @Bean
    public GrpcServerLifecycle grpcServer(AccessServiceProperties properties, UserGrantGrpcService userGrants,
                                          SettingsGrpcService settings, Clock clock) {
        return new GrpcServerLifecycle(properties.grpcPort(), List.of(userGrants, settings),
                List.of(new GrpcCorrelationInterceptor(), new CallerContextInterceptor(clock),
                        new GrpcExceptionInterceptor()));
    }
}
