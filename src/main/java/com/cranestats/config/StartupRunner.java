package com.cranestats.config;

import com.cranestats.exception.IngestionException;
import com.cranestats.service.EquipmentAssignmentService;
import com.cranestats.service.LogIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Runs after the schema migration: applies the assignment seed file and, when enabled,
 * one ingestion batch over the configured log directory.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class StartupRunner implements CommandLineRunner {

    private final CraneStatsProperties properties;
    private final EquipmentAssignmentService assignmentService;
    private final LogIngestionService ingestionService;

    @Override
    public void run(String... args) {
        String seedFile = properties.getAssignments().getSeedFile();
        if (seedFile != null && !seedFile.isBlank()) {
            try {
                assignmentService.seed(seedFile);
            } catch (IOException e) {
                log.error("Could not read assignment seed file '{}': {}", seedFile, e.getMessage());
            }
        }

        if (properties.getIngest().isRunOnStartup()) {
            try {
                ingestionService.runBatch();
            } catch (IngestionException e) {
                log.error("Startup ingestion did not run: {}", e.getMessage());
            }
        }
    }
}
