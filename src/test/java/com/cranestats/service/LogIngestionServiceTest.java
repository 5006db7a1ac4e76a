package com.cranestats.service;

import com.cranestats.config.CraneStatsProperties;
import com.cranestats.dto.IngestionReport;
import com.cranestats.exception.IngestionException;
import com.cranestats.repository.MetricSampleRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Batch ingestion over a temporary log directory.
 *
 * Tests cover:
 * 1. Re-ingesting the same files adds nothing
 * 2. Malformed candidate lines are skipped with a warning, the rest of the file continues
 * 3. Mapped and unmapped tag naming
 * 4. Log files inside zip archives, corrupt archives and corrupt archive entries
 * 5. File selection order and cap
 * 6. Parallel workers
 */
@SpringBootTest
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
class LogIngestionServiceTest {

    @TempDir
    Path logDir;

    @Autowired
    private LogIngestionService ingestionService;

    @Autowired
    private TimeSeriesService timeSeriesService;

    @Autowired
    private MetricSampleRepository sampleRepository;

    @Autowired
    private CraneStatsProperties properties;

    @BeforeEach
    void setUp() {
        sampleRepository.deleteAll();
    }

    @AfterEach
    void tearDown() {
        properties.getIngest().setWorkers(1);
    }

    private static String line(String equipment, String tag, String timestamp, String value) {
        return timestamp + ": (17): TAG:[" + equipment + "/" + equipment + ":CRANE.STATISTIC.Perma." + tag + "] "
            + value;
    }

    private Path writeLog(String name, String... lines) throws IOException {
        return Files.write(logDir.resolve(name), List.of(lines), StandardCharsets.UTF_8);
    }

    @Test
    void testReingestingSameFilesAddsNothing() throws IOException {
        writeLog("RMG04_20250601.log",
            line("RMG04", "HoistCycles", "2025-06-01_10.00.00.000000", "1000"),
            "2025-06-01_10.00.01.000000: (18): heartbeat ok",
            line("RMG04", "HoistCycles", "2025-06-01_11.00.00.000000", "1010"),
            line("RMG04", "HoistCycles", "2025-06-01_12.00.00.000000", "1020"));

        IngestionReport first = ingestionService.ingestDirectory(logDir);
        assertEquals(1, first.getFilesScanned());
        assertEquals(4, first.getLinesRead());
        assertEquals(3, first.getCandidateLines());
        assertEquals(3, first.getInserted());
        assertEquals(0, first.getDuplicates());
        assertNotNull(first.getRunId());

        IngestionReport second = ingestionService.ingestDirectory(logDir);
        assertEquals(0, second.getInserted());
        assertEquals(3, second.getDuplicates());
        assertEquals(3, sampleRepository.count());
    }

    @Test
    void testBadTimestampIsSkippedAndLogged(CapturedOutput output) throws IOException {
        writeLog("RMG04.log",
            line("RMG04", "HoistCycles", "2025-06-01_25.61.00.000000", "1000"),
            line("RMG04", "HoistCycles", "2025-06-01_11.00.00.000000", "1010"));

        IngestionReport report = ingestionService.ingestDirectory(logDir);

        assertEquals(1, report.getParseFailures());
        assertEquals(1, report.getInserted());
        assertEquals(0, report.getFilesFailed());
        assertTrue(output.getOut().contains("RMG04.log L1: skipped, BAD_TIMESTAMP"));
    }

    @Test
    void testMappedAndUnmappedTagNames() throws IOException {
        writeLog("RMG07.log",
            line("RMG07", "HoistCycles", "2025-06-01_10.00.00.000000", "500"),
            line("RMG07", "GantryDistance", "2025-06-01_10.00.00.000000", "12.5 km"));

        IngestionReport report = ingestionService.ingestDirectory(logDir);

        assertEquals(2, report.getInserted());
        assertEquals(List.of("GantryDistance"), report.getUnmappedTags());
        assertEquals(500.0, timeSeriesService.getLatestValue("RMG07", "Hoist Cycles").orElseThrow().value());
        assertEquals(12.5, timeSeriesService.getLatestValue("RMG07", "GantryDistance").orElseThrow().value());
    }

    @Test
    void testOversizedPayloadIsStoredTruncated() throws IOException {
        writeLog("RMG04.log", line("RMG04", "HoistCycles", "2025-06-01_10.00.00.000000", "1000 " + "x".repeat(1200)));

        IngestionReport report = ingestionService.ingestDirectory(logDir);

        assertEquals(1, report.getInserted());
        assertEquals(0, report.getDuplicates());
        assertEquals(0, report.getWriteFailures());
        assertEquals(1000.0, timeSeriesService.getLatestValue("RMG04", "Hoist Cycles").orElseThrow().value());
    }

    @Test
    void testEquipmentOutsideConfiguredRangeIsIgnored() throws IOException {
        writeLog("RMG13.log", line("RMG13", "HoistCycles", "2025-06-01_10.00.00.000000", "500"));

        IngestionReport report = ingestionService.ingestDirectory(logDir);

        assertEquals(0, report.getCandidateLines());
        assertEquals(0, sampleRepository.count());
    }

    @Test
    void testInvalidUtf8IsIgnored() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write(new byte[] {(byte) 0xFF, (byte) 0xFE, 'x', '\n'});
        bytes.write((line("RMG04", "HoistCycles", "2025-06-01_10.00.00.000000", "1") + "\n")
            .getBytes(StandardCharsets.UTF_8));
        Files.write(logDir.resolve("binary.log"), bytes.toByteArray());

        IngestionReport report = ingestionService.ingestDirectory(logDir);

        assertEquals(1, report.getInserted());
        assertEquals(0, report.getFilesFailed());
    }

    @Test
    void testLogsInsideZipAreIngested() throws IOException {
        Path zip = logDir.resolve("archive_202506.zip");
        try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(zip))) {
            out.putNextEntry(new ZipEntry("logs/RMG12.log"));
            out.write((line("RMG12", "TwistlockCycles", "2025-06-02_08.30.00.250000", "77") + "\n")
                .getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
            out.putNextEntry(new ZipEntry("logs/readme.txt"));
            out.write((line("RMG12", "TwistlockCycles", "2025-06-02_09.30.00.000000", "78") + "\n")
                .getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }

        IngestionReport report = ingestionService.ingestDirectory(logDir);

        assertEquals(1, report.getFilesScanned());
        assertEquals(1, report.getInserted());
        assertEquals(LocalDateTime.of(2025, 6, 2, 8, 30, 0, 250_000_000),
            timeSeriesService.getLatestValue("RMG12", "Twistlock Cycles").orElseThrow().timestamp());
    }

    @Test
    void testCorruptZipIsSkipped() throws IOException {
        Files.write(logDir.resolve("broken.zip"), "this is not a zip archive".getBytes(StandardCharsets.UTF_8));
        writeLog("RMG04.log", line("RMG04", "HoistCycles", "2025-06-01_10.00.00.000000", "1000"));

        IngestionReport report = ingestionService.ingestDirectory(logDir);

        assertEquals(1, report.getFilesFailed());
        assertEquals(List.of("broken.zip"), report.getFailedFiles());
        assertEquals(1, report.getFilesScanned());
        assertEquals(1, report.getInserted());
    }

    @Test
    void testCorruptEntryInsideReadableZipIsCountedOnce() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream out = new ZipOutputStream(buffer)) {
            out.putNextEntry(new ZipEntry("RMG04.log"));
            out.write((line("RMG04", "HoistCycles", "2025-06-01_10.00.00.000000", "1000") + "\n")
                .getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
            out.putNextEntry(new ZipEntry("bad.log"));
            for (int i = 0; i < 50; i++) {
                out.write((line("RMG07", "HoistCycles", "2025-06-01_1" + (i % 10) + ".00.00.000000", "" + i) + "\n")
                    .getBytes(StandardCharsets.UTF_8));
            }
            out.closeEntry();
        }
        byte[] bytes = buffer.toByteArray();

        // First deflate byte of bad.log: BTYPE 11 is an invalid block type
        int nameAt = indexOf(bytes, "bad.log".getBytes(StandardCharsets.US_ASCII));
        int extraLength = (bytes[nameAt - 2] & 0xFF) | (bytes[nameAt - 1] & 0xFF) << 8;
        bytes[nameAt + "bad.log".length() + extraLength] = (byte) 0xFF;
        Files.write(logDir.resolve("archive.zip"), bytes);

        IngestionReport report = ingestionService.ingestDirectory(logDir);

        assertEquals(1, report.getFilesScanned());
        assertEquals(0, report.getFilesFailed());
        assertTrue(report.getFailedFiles().isEmpty());
        assertEquals(1, report.getEntriesFailed());
        assertEquals(List.of("archive.zip!bad.log"), report.getFailedEntries());
        assertEquals(1, report.getInserted());
    }

    private static int indexOf(byte[] data, byte[] target) {
        outer:
        for (int i = 0; i <= data.length - target.length; i++) {
            for (int j = 0; j < target.length; j++) {
                if (data[i + j] != target[j]) {
                    continue outer;
                }
            }
            return i;
        }
        throw new IllegalStateException("bytes not found");
    }

    @Test
    void testNewestFilesAreSelectedFirstUpToCap() throws IOException {
        Path older = writeLog("older.log", "x");
        Path newer = writeLog("newer.log", "y");
        Path ignored = writeLog("notes.txt", "z");
        Files.setLastModifiedTime(older, FileTime.from(Instant.parse("2025-01-01T00:00:00Z")));
        Files.setLastModifiedTime(newer, FileTime.from(Instant.parse("2025-06-01T00:00:00Z")));
        Files.setLastModifiedTime(ignored, FileTime.from(Instant.parse("2025-12-01T00:00:00Z")));

        assertEquals(List.of(newer, older), ingestionService.selectFiles(logDir, 10));
        assertEquals(List.of(newer), ingestionService.selectFiles(logDir, 1));
    }

    @Test
    void testParallelWorkersIngestEveryFile() throws IOException {
        properties.getIngest().setWorkers(3);
        for (int crane = 1; crane <= 6; crane++) {
            String id = String.format("RMG%02d", crane);
            writeLog(id + ".log",
                line(id, "HoistCycles", "2025-06-01_10.00.00.000000", "100"),
                line(id, "HoistCycles", "2025-06-01_11.00.00.000000", "200"));
        }

        IngestionReport report = ingestionService.ingestDirectory(logDir);

        assertEquals(6, report.getFilesScanned());
        assertEquals(12, report.getInserted());
        assertEquals(12, sampleRepository.count());
    }

    @Test
    void testMissingDirectoryFailsTheRun() {
        assertThrows(IngestionException.class, () -> ingestionService.ingestDirectory(logDir.resolve("missing")));
    }

    @Test
    void testRunBatchUsesConfiguredDirectory() {
        assertThrows(IngestionException.class, () -> ingestionService.runBatch());
    }
}
