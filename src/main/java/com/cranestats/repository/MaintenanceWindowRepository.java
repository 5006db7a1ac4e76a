package com.cranestats.repository;

import com.cranestats.model.EntityType;
import com.cranestats.model.MaintenanceWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface MaintenanceWindowRepository extends JpaRepository<MaintenanceWindow, Long> {

    boolean existsByEntityIdAndEntityTypeAndFromDatetimeAndToDatetimeAndServiceType(
        String entityId, EntityType entityType, LocalDateTime from, LocalDateTime to, String serviceType);

    boolean existsByEntityIdAndEntityTypeAndFromDatetimeAndToDatetimeAndServiceTypeIsNull(
        String entityId, EntityType entityType, LocalDateTime from, LocalDateTime to);

    List<MaintenanceWindow> findAllByOrderByFromDatetimeAsc();

    List<MaintenanceWindow> findByEntityIdAndEntityTypeOrderByFromDatetimeAsc(String entityId, EntityType entityType);
}
