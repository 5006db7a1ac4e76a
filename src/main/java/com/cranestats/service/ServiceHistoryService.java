package com.cranestats.service;

import com.cranestats.dto.ServiceLogRequest;
import com.cranestats.model.EntityType;
import com.cranestats.model.ServiceLogRecord;
import com.cranestats.repository.ServiceLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service history store: completed maintenance actions for cranes and spreaders.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ServiceHistoryService {

    private final ServiceLogRepository serviceLogRepository;

    @Transactional
    public ServiceLogRecord logServiceCompleted(ServiceLogRequest request) {
        ServiceLogRecord record = serviceLogRepository.save(ServiceLogRecord.builder()
            .entityId(request.getEntityId().strip())
            .entityType(request.getEntityType())
            .taskId(request.getTaskId().strip())
            .serviceDate(request.getServiceDate())
            .servicedAtValue(request.getServicedAtValue())
            .servicedBy(request.getServicedBy())
            .durationHours(request.getDurationHours())
            .build());
        log.info("Logged service {} for {} {} task={} on {}",
            record.getId(), record.getEntityType(), record.getEntityId(), record.getTaskId(), record.getServiceDate());
        return record;
    }

    /**
     * The record with the latest service date for the key; ties go to the most recently logged.
     */
    @Transactional(readOnly = true)
    public Optional<ServiceLogRecord> getLastServiceRecord(String entityId, EntityType entityType, String taskId) {
        return serviceLogRepository.findFirstByEntityIdAndEntityTypeAndTaskIdOrderByServiceDateDescIdDesc(
            entityId, entityType, taskId);
    }

    /**
     * Full history, newest first. A null taskId lists every task of the entity.
     */
    @Transactional(readOnly = true)
    public List<ServiceLogRecord> getHistory(String entityId, EntityType entityType, String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return serviceLogRepository.findByEntityIdAndEntityTypeOrderByServiceDateDesc(entityId, entityType);
        }
        return serviceLogRepository.findByEntityIdAndEntityTypeAndTaskIdOrderByServiceDateDesc(
            entityId, entityType, taskId);
    }

    /**
     * Administrative correction.
     *
     * @return false when no record has this id or the store failed
     */
    @Transactional
    public boolean deleteServiceLog(long id) {
        try {
            if (!serviceLogRepository.existsById(id)) {
                log.warn("Service log {} not found, nothing deleted", id);
                return false;
            }
            serviceLogRepository.deleteById(id);
            log.info("Deleted service log {}", id);
            return true;
        } catch (DataAccessException e) {
            log.error("Could not delete service log {}", id, e);
            return false;
        }
    }
}
