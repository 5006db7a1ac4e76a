package com.cranestats.repository;

import com.cranestats.model.EquipmentAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EquipmentAssignmentRepository extends JpaRepository<EquipmentAssignment, Long> {

    List<EquipmentAssignment> findByCompositeEntityIdOrderByMemberEntityIdAsc(String compositeEntityId);

    Optional<EquipmentAssignment> findByCompositeEntityIdAndMemberEntityId(String compositeEntityId, String memberEntityId);

    boolean existsByCompositeEntityIdAndMemberEntityId(String compositeEntityId, String memberEntityId);
}
