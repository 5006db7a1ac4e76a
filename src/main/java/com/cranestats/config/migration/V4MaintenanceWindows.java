package com.cranestats.config.migration;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class V4MaintenanceWindows implements SchemaMigration {

    @Override
    public int version() {
        return 4;
    }

    @Override
    public String description() {
        return "create maintenance_windows";
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS maintenance_windows (" +
            "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
            "entity_id VARCHAR(50) NOT NULL, " +
            "entity_type VARCHAR(20) NOT NULL, " +
            "from_datetime TIMESTAMP NOT NULL, " +
            "to_datetime TIMESTAMP NOT NULL, " +
            "service_type VARCHAR(50), " +
            "task_description VARCHAR(500), " +
            "notes VARCHAR(1000))");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_window_entity_from " +
            "ON maintenance_windows (entity_id, entity_type, from_datetime)");
    }
}
