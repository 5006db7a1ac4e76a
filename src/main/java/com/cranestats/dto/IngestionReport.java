package com.cranestats.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one batch ingestion run.
 *
 * Tracks:
 * - filesScanned / filesFailed: files opened successfully vs skipped (bad archive, I/O error)
 * - entriesFailed: unreadable members of archives that were otherwise scanned
 * - candidateLines: lines passing the substring pre-filter
 * - inserted / duplicates: samples written vs already present under the natural key
 * - parseFailures: candidate lines skipped for structure or timestamp problems
 * - writeFailures: samples that could not be stored
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {

    private String runId;
    private int filesScanned;
    private int filesFailed;
    private int entriesFailed;
    private long linesRead;
    private long candidateLines;
    private long inserted;
    private long duplicates;
    private long parseFailures;
    private long writeFailures;
    private long durationMs;

    @Builder.Default
    private List<String> failedFiles = new ArrayList<>();

    @Builder.Default
    private List<String> failedEntries = new ArrayList<>();

    @Builder.Default
    private List<String> unmappedTags = new ArrayList<>();
}
