package com.cranestats.config.migration;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class V3EquipmentAssignment implements SchemaMigration {

    @Override
    public int version() {
        return 3;
    }

    @Override
    public String description() {
        return "create equipment_assignment";
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS equipment_assignment (" +
            "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
            "composite_entity_id VARCHAR(50) NOT NULL, " +
            "member_entity_id VARCHAR(50) NOT NULL, " +
            "CONSTRAINT uk_assignment UNIQUE (composite_entity_id, member_entity_id))");
    }
}
