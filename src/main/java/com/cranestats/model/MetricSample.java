package com.cranestats.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One normalized telemetry reading.
 *
 * Key design decisions:
 * - (entityId, metricName, sampleTime) is the natural key, enforced by a unique constraint
 * - rawValue keeps the payload as recorded, numericValue is the first number found in it
 * - rows are never updated after insert
 */
@Entity
@Table(name = "metric_samples", uniqueConstraints = {
    @UniqueConstraint(name = "uk_metric_sample", columnNames = {"entity_id", "metric_name", "sample_time"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false, length = 50)
    private String entityId;

    @Column(name = "metric_name", nullable = false)
    private String metricName;

    @Column(name = "sample_time", nullable = false)
    private LocalDateTime sampleTime;

    @Column(name = "raw_value", length = 1000)
    private String rawValue;

    /**
     * Null when the payload carries no number (e.g. a status word).
     */
    @Column(name = "numeric_value")
    private Double numericValue;
}
