package com.cranestats.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A planned maintenance slot, written by the maintenance-plan importer.
 */
@Entity
@Table(name = "maintenance_windows", indexes = {
    @Index(name = "idx_window_entity_from", columnList = "entity_id,entity_type,from_datetime")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false, length = 50)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 20)
    private EntityType entityType;

    @Column(name = "from_datetime", nullable = false)
    private LocalDateTime fromDatetime;

    @Column(name = "to_datetime", nullable = false)
    private LocalDateTime toDatetime;

    @Column(name = "service_type", length = 50)
    private String serviceType;

    @Column(name = "task_description", length = 500)
    private String taskDescription;

    @Column(name = "notes", length = 1000)
    private String notes;
}
