package com.cranestats.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A completed maintenance action.
 *
 * Cranes and spreaders share this table; (entityId, entityType) is the compound identity.
 * Several records may exist per (entityId, entityType, taskId); the one with the latest
 * serviceDate is the authoritative "last service".
 */
@Entity
@Table(name = "service_log", indexes = {
    @Index(name = "idx_service_key_date", columnList = "entity_id,entity_type,task_id,service_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceLogRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false, length = 50)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 20)
    private EntityType entityType;

    @Column(name = "task_id", nullable = false, length = 100)
    private String taskId;

    @Column(name = "service_date", nullable = false)
    private LocalDateTime serviceDate;

    /**
     * Cumulative usage metric value when the service was done; null for calendar-only tasks.
     */
    @Column(name = "serviced_at_value")
    private Double servicedAtValue;

    @Column(name = "serviced_by", length = 100)
    private String servicedBy;

    @Column(name = "duration_hours")
    private Double durationHours;
}
