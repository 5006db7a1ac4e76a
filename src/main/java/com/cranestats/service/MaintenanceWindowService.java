package com.cranestats.service;

import com.cranestats.dto.MaintenanceWindowRequest;
import com.cranestats.model.EntityType;
import com.cranestats.model.MaintenanceWindow;
import com.cranestats.repository.MaintenanceWindowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Planned maintenance windows as imported from maintenance plans.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaintenanceWindowService {

    private final MaintenanceWindowRepository windowRepository;

    /**
     * Store a window unless the same slot already exists.
     *
     * @return the stored window, or empty for a duplicate
     * @throws IllegalArgumentException when the window ends before it starts
     */
    @Transactional
    public Optional<MaintenanceWindow> addWindow(MaintenanceWindowRequest request) {
        if (request.getToDatetime().isBefore(request.getFromDatetime())) {
            throw new IllegalArgumentException("INVALID_WINDOW: toDatetime is before fromDatetime");
        }
        String entityId = request.getEntityId().strip();
        String serviceType = blankToNull(request.getServiceType());

        boolean duplicate = serviceType == null
            ? windowRepository.existsByEntityIdAndEntityTypeAndFromDatetimeAndToDatetimeAndServiceTypeIsNull(
                entityId, request.getEntityType(), request.getFromDatetime(), request.getToDatetime())
            : windowRepository.existsByEntityIdAndEntityTypeAndFromDatetimeAndToDatetimeAndServiceType(
                entityId, request.getEntityType(), request.getFromDatetime(), request.getToDatetime(), serviceType);
        if (duplicate) {
            log.info("Maintenance window for {} {} at {} already exists", request.getEntityType(), entityId,
                request.getFromDatetime());
            return Optional.empty();
        }

        MaintenanceWindow window = windowRepository.save(MaintenanceWindow.builder()
            .entityId(entityId)
            .entityType(request.getEntityType())
            .fromDatetime(request.getFromDatetime())
            .toDatetime(request.getToDatetime())
            .serviceType(serviceType)
            .taskDescription(request.getTaskDescription())
            .notes(request.getNotes())
            .build());
        return Optional.of(window);
    }

    @Transactional(readOnly = true)
    public List<MaintenanceWindow> getWindows(String entityId, EntityType entityType) {
        if (entityId == null || entityType == null) {
            return windowRepository.findAllByOrderByFromDatetimeAsc();
        }
        return windowRepository.findByEntityIdAndEntityTypeOrderByFromDatetimeAsc(entityId, entityType);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
