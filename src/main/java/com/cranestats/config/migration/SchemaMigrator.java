package com.cranestats.config.migration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies pending {@link SchemaMigration}s in version order at startup and records each one
 * in schema_version. A store that cannot be migrated stops the application.
 */
@Component
@Order(0)
@RequiredArgsConstructor
@Slf4j
public class SchemaMigrator implements CommandLineRunner {

    static final String VERSION_TABLE = "schema_version";

    private final JdbcTemplate jdbcTemplate;
    private final List<SchemaMigration> migrations;

    @Override
    public void run(String... args) {
        migrate();
    }

    /**
     * @return number of migrations applied by this call
     */
    public int migrate() {
        try {
            jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + VERSION_TABLE + " (" +
                "version INT PRIMARY KEY, " +
                "description VARCHAR(255) NOT NULL, " +
                "applied_at TIMESTAMP NOT NULL)");

            Set<Integer> applied = new HashSet<>(
                jdbcTemplate.queryForList("SELECT version FROM " + VERSION_TABLE, Integer.class));

            List<SchemaMigration> pending = migrations.stream()
                .filter(m -> !applied.contains(m.version()))
                .sorted(Comparator.comparingInt(SchemaMigration::version))
                .toList();

            for (SchemaMigration migration : pending) {
                log.info("Applying schema migration V{}: {}", migration.version(), migration.description());
                migration.apply(jdbcTemplate);
                jdbcTemplate.update("INSERT INTO " + VERSION_TABLE + " (version, description, applied_at) VALUES (?, ?, ?)",
                    migration.version(), migration.description(), LocalDateTime.now());
            }

            log.info("Schema is at version {} ({} migration(s) applied now)", currentVersion(), pending.size());
            return pending.size();
        } catch (DataAccessException e) {
            log.error("Database is not reachable or could not be migrated", e);
            throw new IllegalStateException("Schema migration failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    public int currentVersion() {
        Integer version = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(version), 0) FROM " + VERSION_TABLE, Integer.class);
        return version != null ? version : 0;
    }
}
