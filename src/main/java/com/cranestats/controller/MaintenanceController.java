package com.cranestats.controller;

import com.cranestats.dto.AssignmentRequest;
import com.cranestats.dto.MaintenanceWindowRequest;
import com.cranestats.dto.ServiceLogRequest;
import com.cranestats.exception.ResourceNotFoundException;
import com.cranestats.model.EntityType;
import com.cranestats.model.MaintenanceWindow;
import com.cranestats.model.ServiceLogRecord;
import com.cranestats.service.EquipmentAssignmentService;
import com.cranestats.service.MaintenanceWindowService;
import com.cranestats.service.ServiceHistoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST Controller for maintenance records.
 *
 * Endpoints:
 * 1. /service-logs - Log, list and delete completed services
 * 2. /assignments - Cranes each spreader accrues usage on
 * 3. /maintenance-windows - Planned maintenance slots
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class MaintenanceController {

    private final ServiceHistoryService serviceHistoryService;
    private final EquipmentAssignmentService assignmentService;
    private final MaintenanceWindowService windowService;

    @PostMapping("/service-logs")
    public ResponseEntity<ServiceLogRecord> logService(@Valid @RequestBody ServiceLogRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(serviceHistoryService.logServiceCompleted(request));
    }

    @GetMapping("/service-logs")
    public ResponseEntity<List<ServiceLogRecord>> getServiceLogs(
            @RequestParam String entityId,
            @RequestParam EntityType entityType,
            @RequestParam(required = false) String taskId) {
        return ResponseEntity.ok(serviceHistoryService.getHistory(entityId, entityType, taskId));
    }

    @GetMapping("/service-logs/last")
    public ResponseEntity<ServiceLogRecord> getLastServiceLog(
            @RequestParam String entityId,
            @RequestParam EntityType entityType,
            @RequestParam String taskId) {
        return serviceHistoryService.getLastServiceRecord(entityId, entityType, taskId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ResourceNotFoundException(
                "No service recorded for " + entityType.toValue() + " " + entityId + " task " + taskId));
    }

    @DeleteMapping("/service-logs/{id}")
    public ResponseEntity<Void> deleteServiceLog(@PathVariable long id) {
        if (!serviceHistoryService.deleteServiceLog(id)) {
            throw new ResourceNotFoundException("Service log " + id + " could not be deleted");
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/assignments/{compositeEntityId}")
    public ResponseEntity<List<String>> getAssignments(@PathVariable String compositeEntityId) {
        return ResponseEntity.ok(assignmentService.members(compositeEntityId));
    }

    @PostMapping("/assignments")
    public ResponseEntity<Map<String, Boolean>> assign(@Valid @RequestBody AssignmentRequest request) {
        boolean created = assignmentService.assign(request.getCompositeEntityId(), request.getMemberEntityId());
        return ResponseEntity.status(created ? HttpStatus.CREATED : HttpStatus.OK).body(Map.of("created", created));
    }

    @DeleteMapping("/assignments")
    public ResponseEntity<Void> unassign(@RequestParam String compositeEntityId, @RequestParam String memberEntityId) {
        if (!assignmentService.unassign(compositeEntityId, memberEntityId)) {
            throw new ResourceNotFoundException(memberEntityId + " is not assigned to " + compositeEntityId);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/maintenance-windows")
    public ResponseEntity<List<MaintenanceWindow>> getWindows(
            @RequestParam(required = false) String entityId,
            @RequestParam(required = false) EntityType entityType) {
        return ResponseEntity.ok(windowService.getWindows(entityId, entityType));
    }

    /**
     * 201 with the stored window, or 409 when the same slot already exists.
     */
    @PostMapping("/maintenance-windows")
    public ResponseEntity<MaintenanceWindow> addWindow(@Valid @RequestBody MaintenanceWindowRequest request) {
        return windowService.addWindow(request)
            .map(window -> ResponseEntity.status(HttpStatus.CREATED).body(window))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build());
    }
}
