package com.cranestats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the crane statistics backend.
 * Ingests crane statistic logs and predicts when maintenance tasks fall due.
 */
@SpringBootApplication
public class CraneStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CraneStatsApplication.class, args);
    }
}
