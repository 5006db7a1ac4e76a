package com.cranestats.config.migration;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class V1MetricSamples implements SchemaMigration {

    @Override
    public int version() {
        return 1;
    }

    @Override
    public String description() {
        return "create metric_samples";
    }

    @Override
    public void apply(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS metric_samples (" +
            "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
            "entity_id VARCHAR(50) NOT NULL, " +
            "metric_name VARCHAR(255) NOT NULL, " +
            "sample_time TIMESTAMP NOT NULL, " +
            "raw_value VARCHAR(1000), " +
            "numeric_value DOUBLE PRECISION, " +
            "CONSTRAINT uk_metric_sample UNIQUE (entity_id, metric_name, sample_time))");
    }
}
