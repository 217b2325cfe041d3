package org.gtfslake.gtfs_rt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class of the GTFS-RT (General Transit Feed Specification - Real Time) server.
 * <p>
 * The server publishes the realtime state stored in a GTFS lake database as three
 * GTFS-RT feeds: service alerts, trip updates and vehicle positions. Feeds are built
 * on request from the lake, optionally cached in memcached, and served as protocol
 * buffers or JSON.
 * </p>
 *
 * <p>
 * Configuration is read from {@code application.yml}; an operator file named by the
 * {@code GTFS_RT_CONFIG} environment variable (default {@code ./config.yaml}) overrides
 * it when present.
 * </p>
 *
 * @since 1.0
 *
 * @see org.gtfslake.gtfs_rt.controller.GTFSRTController
 */
@SpringBootApplication
public class GTFSRTApplication {

    /**
     * Main entry point for the Spring Boot application.
     *
     * @param args command-line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(GTFSRTApplication.class, args);
    }
}
