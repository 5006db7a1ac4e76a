package com.cranestats.controller;

import com.cranestats.dto.IngestionReport;
import com.cranestats.dto.SamplePoint;
import com.cranestats.dto.SampleRequest;
import com.cranestats.exception.ResourceNotFoundException;
import com.cranestats.model.TimedValue;
import com.cranestats.service.LogIngestionService;
import com.cranestats.service.TimeSeriesService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * REST Controller for telemetry.
 *
 * Endpoints:
 * 1. POST /ingest/run - Run one batch ingestion over the configured log directory
 * 2. POST /samples - Insert one sample (idempotent on entity, metric, timestamp)
 * 3. GET /samples - Samples for an entity/metric in [start, end]
 * 4. GET /samples/latest - Latest numeric sample for an entity/metric
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TelemetryController {

    private final LogIngestionService ingestionService;
    private final TimeSeriesService timeSeriesService;

    @PostMapping("/ingest/run")
    public ResponseEntity<IngestionReport> runIngestion() {
        log.info("Ingestion run requested");
        return ResponseEntity.ok(ingestionService.runBatch());
    }

    @PostMapping("/samples")
    public ResponseEntity<Map<String, String>> insertSample(@Valid @RequestBody SampleRequest request) {
        TimeSeriesService.InsertOutcome outcome = timeSeriesService.insertSample(
            request.getEntityId(), request.getMetricName(), request.getTimestamp(), request.getValue());
        return ResponseEntity.ok(Map.of("outcome", outcome.name()));
    }

    /**
     * GET /samples?entityId=RMG04&metric=Hoist%20Cycles&start=2025-06-01T00:00:00&end=2025-07-01T00:00:00
     */
    @GetMapping("/samples")
    public ResponseEntity<List<SamplePoint>> getSamples(
            @RequestParam String entityId,
            @RequestParam String metric,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end) {
        return ResponseEntity.ok(timeSeriesService.getValueRange(entityId, metric, start, end));
    }

    @GetMapping("/samples/latest")
    public ResponseEntity<TimedValue> getLatest(@RequestParam String entityId, @RequestParam String metric) {
        return timeSeriesService.getLatestValue(entityId, metric)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ResourceNotFoundException("No '" + metric + "' samples for " + entityId));
    }
}
