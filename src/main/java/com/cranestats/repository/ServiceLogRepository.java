package com.cranestats.repository;

import com.cranestats.model.EntityType;
import com.cranestats.model.ServiceLogRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ServiceLogRepository extends JpaRepository<ServiceLogRecord, Long> {

    Optional<ServiceLogRecord> findFirstByEntityIdAndEntityTypeAndTaskIdOrderByServiceDateDescIdDesc(
        String entityId, EntityType entityType, String taskId);

    List<ServiceLogRecord> findByEntityIdAndEntityTypeAndTaskIdOrderByServiceDateDesc(
        String entityId, EntityType entityType, String taskId);

    List<ServiceLogRecord> findByEntityIdAndEntityTypeOrderByServiceDateDesc(String entityId, EntityType entityType);
}
