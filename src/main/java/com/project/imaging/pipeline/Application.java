package com.project.imaging.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the pipeline application. The purpose of this class is ONLY to bootstrap
 * the context; table declarations live in {@code model}, populate logic in {@code service}.
 *
 * @SpringBootApplication triggers component scanning and auto-configuration of the JPA layer
 * against the external relational store.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {
    public static void main(String[] args) {
        // No embedded web server: the context starts, optionally populates, and exits.
        SpringApplication.run(Application.class, args);
    }
}
