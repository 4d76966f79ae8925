package com.dockeriot.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * IoT Ingestion Service
 *
 * Stores sensor measurements (and hero records) in PostgreSQL and lists them back over HTTP.
 * The schema is created on startup if absent; it is never migrated.
 */
@SpringBootApplication
public class IngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestionApplication.class, args);
    }
}
