package com.cranestats.service;

import com.cranestats.dto.IngestionReport;

import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable context of one batch run. Counters are shared by worker threads.
 */
class IngestionRun {

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final long startedAt = System.currentTimeMillis();

    private final AtomicInteger filesScanned = new AtomicInteger();
    private final AtomicInteger filesFailed = new AtomicInteger();
    private final AtomicInteger entriesFailed = new AtomicInteger();
    private final AtomicLong linesRead = new AtomicLong();
    private final AtomicLong candidateLines = new AtomicLong();
    private final AtomicLong inserted = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong parseFailures = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();
    private final Queue<String> failedFiles = new ConcurrentLinkedQueue<>();
    private final Queue<String> failedEntries = new ConcurrentLinkedQueue<>();

    String id() {
        return id;
    }

    void fileScanned() {
        filesScanned.incrementAndGet();
    }

    void fileFailed(String name) {
        filesFailed.incrementAndGet();
        failedFiles.add(name);
    }

    /**
     * An archive member that could not be read; the archive itself still counts as scanned.
     */
    void entryFailed(String source) {
        entriesFailed.incrementAndGet();
        failedEntries.add(source);
    }

    void lineRead() {
        linesRead.incrementAndGet();
    }

    void candidate() {
        candidateLines.incrementAndGet();
    }

    void inserted() {
        inserted.incrementAndGet();
    }

    void duplicate() {
        duplicates.incrementAndGet();
    }

    void parseFailure() {
        parseFailures.incrementAndGet();
    }

    void writeFailure() {
        writeFailures.incrementAndGet();
    }

    IngestionReport toReport(List<String> unmappedTags) {
        return IngestionReport.builder()
            .runId(id)
            .filesScanned(filesScanned.get())
            .filesFailed(filesFailed.get())
            .entriesFailed(entriesFailed.get())
            .linesRead(linesRead.get())
            .candidateLines(candidateLines.get())
            .inserted(inserted.get())
            .duplicates(duplicates.get())
            .parseFailures(parseFailures.get())
            .writeFailures(writeFailures.get())
            .durationMs(System.currentTimeMillis() - startedAt)
            .failedFiles(List.copyOf(failedFiles))
            .failedEntries(List.copyOf(failedEntries))
            .unmappedTags(unmappedTags)
            .build();
    }
}
