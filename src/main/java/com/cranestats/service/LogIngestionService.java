package com.cranestats.service;

import com.cranestats.config.CraneStatsProperties;
import com.cranestats.dto.IngestionReport;
import com.cranestats.exception.IngestionException;
import com.cranestats.exception.MalformedLineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Batch ingestion of crane statistic logs into the time-series store.
 *
 * Algorithm:
 * 1. Load tag ids and the tag mapping for this run
 * 2. Pick the most recently modified .log/.zip files, up to maxFiles
 * 3. For each line: substring pre-filter, structured parse, tag resolution, idempotent insert
 *
 * Nothing below the run level aborts the batch: bad lines, bad archives and failed
 * writes are logged, counted in the report and skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogIngestionService {

    private static final String RUN_ID_KEY = "runId";

    private final CraneStatsProperties properties;
    private final TimeSeriesService timeSeriesService;
    private final TagMappingLoader tagMappingLoader;
    private final ResourceLoader resourceLoader;

    /**
     * Ingest the configured log directory.
     */
    public IngestionReport runBatch() {
        return ingestDirectory(Path.of(properties.getIngest().getLogDirectory()));
    }

    /**
     * @throws IngestionException when the directory or the tag-search file is missing
     */
    public IngestionReport ingestDirectory(Path directory) {
        IngestionRun run = new IngestionRun();
        MDC.put(RUN_ID_KEY, run.id());
        try {
            CraneStatsProperties.Ingest config = properties.getIngest();
            log.info("Starting log ingestion of '{}'", directory);

            if (!Files.isDirectory(directory)) {
                throw new IngestionException("Log directory '" + directory + "' not found");
            }

            List<String> tagIds = loadTagIds(config.getTagIdsFile());
            List<String> equipmentIds = LogLineParser.equipmentRange(
                config.getEquipmentPrefix(), config.getEquipmentStart(), config.getEquipmentEnd(),
                config.getEquipmentDigits());
            LogLineParser parser = LogLineParser.forEquipment(
                equipmentIds, config.getStatisticPrefix(), config.getStatisticType(), tagIds);
            TagResolver resolver = new TagResolver(tagMappingLoader.load(config.getTagMappingFile()));
            log.debug("Built {} search patterns from {} equipment ids and {} tag ids",
                parser.patternCount(), equipmentIds.size(), tagIds.size());

            List<Path> files = selectFiles(directory, config.getMaxFiles());
            log.info("Scanning {} file(s) in '{}'", files.size(), directory);

            if (config.getWorkers() > 1 && files.size() > 1) {
                processInParallel(files, parser, resolver, run, config.getWorkers());
            } else {
                for (Path file : files) {
                    processFile(file, parser, resolver, run);
                }
            }

            IngestionReport report = run.toReport(resolver.unmappedTags());
            if (!report.getUnmappedTags().isEmpty()) {
                log.info("Tags without mapping stored under their raw name: {}", report.getUnmappedTags());
            }
            log.info("Ingestion complete: {} files, {} candidate lines, {} inserted, {} duplicates, " +
                    "{} parse failures, {} write failures, {} failed files, {} failed archive entries in {} ms",
                report.getFilesScanned(), report.getCandidateLines(), report.getInserted(),
                report.getDuplicates(), report.getParseFailures(), report.getWriteFailures(),
                report.getFilesFailed(), report.getEntriesFailed(), report.getDurationMs());
            return report;
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    List<String> loadTagIds(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IngestionException("Tag ids file '" + location + "' not found");
        }
        try (BufferedReader reader = openReader(resource.getInputStream())) {
            List<String> tagIds = reader.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
            log.info("Loaded {} tag ids from '{}'", tagIds.size(), location);
            return tagIds;
        } catch (IOException | UncheckedIOException e) {
            throw new IngestionException("Could not read tag ids file '" + location + "'", e);
        }
    }

    /**
     * .log and .zip files, newest first, capped at maxFiles.
     */
    List<Path> selectFiles(Path directory, int maxFiles) {
        try (Stream<Path> listing = Files.list(directory)) {
            return listing
                .filter(Files::isRegularFile)
                .filter(path -> isLog(path) || isZip(path))
                .sorted(Comparator.comparing(LogIngestionService::lastModified).reversed())
                .limit(Math.max(maxFiles, 0))
                .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new IngestionException("Could not list log directory '" + directory + "'", e);
        }
    }

    private void processInParallel(List<Path> files, LogLineParser parser, TagResolver resolver,
                                   IngestionRun run, int workers) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, files.size()));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> {
                    MDC.put(RUN_ID_KEY, run.id());
                    try {
                        processFile(file, parser, resolver, run);
                    } finally {
                        MDC.remove(RUN_ID_KEY);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionException("Ingestion interrupted", e);
        } catch (ExecutionException e) {
            throw new IngestionException("Ingestion worker failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    void processFile(Path file, LogLineParser parser, TagResolver resolver, IngestionRun run) {
        String name = file.getFileName().toString();
        try {
            if (isZip(file)) {
                log.info("Processing ZIP: '{}'", name);
                processZip(file, parser, resolver, run);
            } else {
                log.info("Processing LOG: '{}'", name);
                try (BufferedReader reader = openReader(Files.newInputStream(file))) {
                    processLines(name, reader, parser, resolver, run);
                }
            }
            run.fileScanned();
        } catch (ZipException e) {
            log.error("Bad zip file '{}', skipping: {}", name, e.getMessage());
            run.fileFailed(name);
        } catch (IOException | UncheckedIOException e) {
            log.error("Could not read '{}', skipping: {}", name, e.getMessage());
            run.fileFailed(name);
        }
    }

    private void processZip(Path file, LogLineParser parser, TagResolver resolver, IngestionRun run)
            throws IOException {
        try (ZipFile zip = new ZipFile(file.toFile())) {
            List<? extends ZipEntry> entries = zip.stream()
                .filter(entry -> !entry.isDirectory())
                .filter(entry -> entry.getName().toLowerCase(Locale.ROOT).endsWith(".log"))
                .toList();
            for (ZipEntry entry : entries) {
                String source = file.getFileName() + "!" + entry.getName();
                log.debug("Processing inner file: {}", entry.getName());
                try (BufferedReader reader = openReader(zip.getInputStream(entry))) {
                    processLines(source, reader, parser, resolver, run);
                } catch (IOException | UncheckedIOException e) {
                    log.error("Corrupt archive entry '{}', skipping rest of entry: {}", source, e.getMessage());
                    run.entryFailed(source);
                }
            }
        }
    }

    private void processLines(String source, BufferedReader reader, LogLineParser parser,
                              TagResolver resolver, IngestionRun run) throws IOException {
        String line;
        long lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            handleLine(source, lineNumber, line, parser, resolver, run);
        }
    }

    void handleLine(String source, long lineNumber, String line, LogLineParser parser,
                    TagResolver resolver, IngestionRun run) {
        run.lineRead();
        if (!parser.isCandidate(line)) {
            return;
        }
        run.candidate();
        log.debug("{} L{}: found potential match: {}", source, lineNumber, line.strip());

        ParsedLine parsed;
        try {
            parsed = parser.parse(line);
        } catch (MalformedLineException e) {
            run.parseFailure();
            log.warn("{} L{}: skipped, {}", source, lineNumber, e.getMessage());
            return;
        }

        String metricName = resolver.resolve(parsed.tagDetail());
        try {
            TimeSeriesService.InsertOutcome outcome = timeSeriesService.insertSample(
                parsed.entityId(), metricName, parsed.timestamp(), parsed.payload());
            if (outcome == TimeSeriesService.InsertOutcome.INSERTED) {
                run.inserted();
                log.debug("{} L{}: stored {} '{}' = '{}'", source, lineNumber, parsed.entityId(), metricName,
                    parsed.payload());
            } else {
                run.duplicate();
            }
        } catch (DataAccessException e) {
            run.writeFailure();
            log.error("{} L{}: sample write failed for {} '{}': {}", source, lineNumber, parsed.entityId(),
                metricName, e.getMessage());
        }
    }

    private static BufferedReader openReader(InputStream in) {
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE)));
    }

    private static boolean isLog(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".log");
    }

    private static boolean isZip(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
