package com.cranestats.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A crane (member) that a composite entity (spreader) has accrued usage on.
 * Not time-windowed: the member's whole recorded history counts.
 */
@Entity
@Table(name = "equipment_assignment", uniqueConstraints = {
    @UniqueConstraint(name = "uk_assignment", columnNames = {"composite_entity_id", "member_entity_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "composite_entity_id", nullable = false, length = 50)
    private String compositeEntityId;

    @Column(name = "member_entity_id", nullable = false, length = 50)
    private String memberEntityId;
}
