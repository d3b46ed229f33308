package com.bastion.accessservice.infrastructure.grpc;

import io.grpc.BindableService;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.Server;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.protobuf.services.ProtoReflectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the gRPC server inside the Spring lifecycle.
 * <p>
 * Interceptors apply outermost first: correlation, caller context, then exception mapping.
 * Also registers the standard gRPC health and reflection services. Port 0 leaves the server off.
 */
public class GrpcServerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerLifecycle.class);

    private final int port;
    private final List<BindableService> services;
    private final List<ServerInterceptor> interceptors;
    private final HealthStatusManager health = new HealthStatusManager();
    private volatile Server server;

    /**
     * @param interceptors in call order, outermost first
     */
    public GrpcServerLifecycle(int port, List<BindableService> services, List<ServerInterceptor> interceptors) {
        this.port = port;
        this.services = List.copyOf(services);
        this.interceptors = List.copyOf(interceptors);
    }

    @Override
    public void start() {
        if (port == 0) {
            log.info("gRPC server disabled (port 0)");
            return;
        }
        var builder = Grpc.newServerBuilderForPort(port, InsecureServerCredentials.create());
        // ServerInterceptors.intercept runs the last interceptor first
        var innermostFirst = new ArrayList<>(interceptors);
        Collections.reverse(innermostFirst);
        for (BindableService service : services) {
            builder.addService(ServerInterceptors.intercept(service, innermostFirst));
        }
        builder.addService(health.getHealthService());
        builder.addService(ProtoReflectionService.newInstance());
        try {
            server = builder.build().start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start gRPC server on port " + port, e);
        }
        log.info("gRPC server listening on port {} with {} services", server.getPort(), services.size());
    }

    @Override
    public void stop() {
        Server current = server;
        if (current == null) {
            return;
        }
        health.enterTerminalState();
        current.shutdown();
        try {
            if (!current.awaitTermination(10, TimeUnit.SECONDS)) {
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.shutdownNow();
        }
        server = null;
        log.info("gRPC server stopped");
    }

    @Override
    public boolean isRunning() {
        Server current = server;
        return current != null && !current.isShutdown();
    }

    /** Bound port, -1 when not running. */
    public int port() {
        Server current = server;
        return current == null ? -1 : current.getPort();
    }
}
