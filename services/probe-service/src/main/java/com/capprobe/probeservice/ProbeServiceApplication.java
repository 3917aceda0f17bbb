package com.capprobe.probeservice;

import com.capprobe.probeservice.config.ProbeServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Probe service: answers capability queries for the LaTeX catalogue over HTTP.
 *
 * <ul>
 *   <li>{@code GET /api/v1/probes}: report for every catalogue probe
 *   <li>{@code GET /api/v1/probes/{name}}: presence verdict
 *   <li>{@code GET /api/v1/probes/{name}/functional}: functional verdict
 *   <li>{@code GET /api/v1/probes/{name}/path}: resolved path of a file probe
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(ProbeServiceProperties.class)
public class ProbeServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(ProbeServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ProbeServiceApplication.class, args);
        log.info("Probe service started successfully");
    }
}
