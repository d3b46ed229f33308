package com.bastion.accessservice;

import com.bastion.accessservice.config.AccessServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point of the Bastion access service.
 *
 * <p>Serves user grant management and instance security settings over gRPC, backed by an
 * append-only event journal with eventually consistent read views. Actuator exposes health
 * (including projection lag) and Prometheus metrics over HTTP.
 */
@SpringBootApplication
@EnableConfigurationProperties(AccessServiceProperties.class)
public class AccessServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessServiceApplication.class, args);
    }
}
