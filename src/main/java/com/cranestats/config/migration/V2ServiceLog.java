package com.cranestats.config.migration;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class V2ServiceLog implements SchemaMigration {

    @Override
    public int version() {
        return 2;
    }

    @Override
    public String description() {
        return "create service_log keyed by entity id and type";
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS service_log (" +
            "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
            "entity_id VARCHAR(50) NOT NULL, " +
            "entity_type VARCHAR(20) NOT NULL, " +
            "task_id VARCHAR(100) NOT NULL, " +
            "service_date TIMESTAMP NOT NULL, " +
            "serviced_at_value DOUBLE PRECISION, " +
            "serviced_by VARCHAR(100), " +
            "duration_hours DOUBLE PRECISION)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_service_key_date " +
            "ON service_log (entity_id, entity_type, task_id, service_date)");
    }
}
