package com.cranestats.controller;

import com.cranestats.dto.PredictionResult;
import com.cranestats.dto.TaskSummary;
import com.cranestats.model.EntityType;
import com.cranestats.model.TaskCatalog;
import com.cranestats.service.PredictionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Slf4j
public class PredictionController {

    private final PredictionService predictionService;
    private final TaskCatalog taskCatalog;

    /**
     * GET /predictions?entityId=RMG04&entityType=crane&taskId=hoist_rope_inspection
     *
     * Always 200: prediction failures are carried in the result's error field.
     */
    @GetMapping("/predictions")
    public ResponseEntity<PredictionResult> predict(
            @RequestParam String entityId,
            @RequestParam EntityType entityType,
            @RequestParam String taskId) {
        log.info("Predicting {} {} task={}", entityType, entityId, taskId);
        return ResponseEntity.ok(predictionService.predictServiceDate(entityId, entityType, taskId));
    }

    @GetMapping("/tasks")
    public ResponseEntity<List<TaskSummary>> tasks() {
        return ResponseEntity.ok(taskCatalog.all().stream().map(TaskSummary::of).toList());
    }
}
