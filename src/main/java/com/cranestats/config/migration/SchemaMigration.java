package com.cranestats.config.migration;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * One ordered schema step. Steps must be safe to re-run against a schema that already has them.
 */
public interface SchemaMigration {

    int version();

    String description();

    void apply(JdbcTemplate jdbcTemplate);
}
