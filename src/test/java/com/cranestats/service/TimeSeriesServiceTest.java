package com.cranestats.service;

import com.cranestats.dto.SamplePoint;
import com.cranestats.model.MetricSample;
import com.cranestats.model.TimedValue;
import com.cranestats.repository.MetricSampleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Time-series store against the in-memory database.
 *
 * Tests cover:
 * 1. Idempotent insert on (entity, metric, timestamp)
 * 2. Numeric extraction from free-text payloads
 * 3. Inclusive range queries
 * 4. Point lookups skip non-numeric samples
 * 5. Oversized payloads are truncated, other constraint violations propagate
 */
@SpringBootTest
@ActiveProfiles("test")
class TimeSeriesServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 6, 1, 10, 0);

    @Autowired
    private TimeSeriesService timeSeriesService;

    @Autowired
    private MetricSampleRepository sampleRepository;

    @BeforeEach
    void setUp() {
        sampleRepository.deleteAll();
    }

    @Test
    void testSameKeyIsStoredOnce() {
        assertEquals(TimeSeriesService.InsertOutcome.INSERTED,
            timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0, "100"));
        assertEquals(TimeSeriesService.InsertOutcome.DUPLICATE,
            timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0, "999"));

        assertEquals(1, sampleRepository.count());
        assertEquals(100.0, timeSeriesService.getLatestValue("RMG04", "Hoist Cycles").orElseThrow().value());
    }

    @Test
    void testSameTimestampOnOtherMetricIsDistinct() {
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0, "100");
        timeSeriesService.insertSample("RMG04", "Twistlock Cycles", T0, "7");
        timeSeriesService.insertSample("RMG05", "Hoist Cycles", T0, "100");

        assertEquals(3, sampleRepository.count());
    }

    @Test
    void testPayloadKeepsRawTextAndNumericValue() {
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0, "12345 cycles");
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0.plusHours(1), "n/a");

        List<MetricSample> samples = sampleRepository.findRange("RMG04", "Hoist Cycles", T0, T0.plusHours(1));
        assertEquals(2, samples.size());
        assertEquals("12345 cycles", samples.get(0).getRawValue());
        assertEquals(12345.0, samples.get(0).getNumericValue());
        assertNull(samples.get(1).getNumericValue());

        // The later non-numeric sample is not a usable counter reading
        TimedValue latest = timeSeriesService.getLatestValue("RMG04", "Hoist Cycles").orElseThrow();
        assertEquals(T0, latest.timestamp());
    }

    @Test
    void testRangeIsInclusiveAndOrdered() {
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0.plusMinutes(20), "3");
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0, "1");
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0.plusMinutes(10), "2");
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0.plusMinutes(30), "4");

        List<SamplePoint> range = timeSeriesService.getValueRange("RMG04", "Hoist Cycles", T0, T0.plusMinutes(20));

        assertEquals(List.of(1.0, 2.0, 3.0), range.stream().map(SamplePoint::getNumericValue).toList());
        assertTrue(timeSeriesService.getValueRange("RMG04", "Hoist Cycles", T0.minusDays(2), T0.minusDays(1))
            .isEmpty());
    }

    @Test
    void testPointLookups() {
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0, "1000");
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0.plusDays(1), "1100");
        timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0.plusDays(2), "1250");

        assertEquals(1000.0, timeSeriesService.getEarliestValue("RMG04", "Hoist Cycles").orElseThrow().value());
        assertEquals(1250.0, timeSeriesService.getLatestValue("RMG04", "Hoist Cycles").orElseThrow().value());
        assertEquals(1100.0, timeSeriesService.getValueAtOrBefore("RMG04", "Hoist Cycles", T0.plusDays(1))
            .orElseThrow().value());
        assertEquals(1100.0, timeSeriesService.getValueAtOrBefore("RMG04", "Hoist Cycles", T0.plusHours(30))
            .orElseThrow().value());
        assertEquals(1250.0, timeSeriesService.getValueAtOrAfter("RMG04", "Hoist Cycles", T0.plusHours(30))
            .orElseThrow().value());
        assertTrue(timeSeriesService.getValueAtOrBefore("RMG04", "Hoist Cycles", T0.minusSeconds(1)).isEmpty());
        assertTrue(timeSeriesService.getLatestValue("RMG99", "Hoist Cycles").isEmpty());
    }

    @Test
    void testOversizedPayloadIsTruncated() {
        String payload = "1000 " + "x".repeat(1200);

        assertEquals(TimeSeriesService.InsertOutcome.INSERTED,
            timeSeriesService.insertSample("RMG04", "Hoist Cycles", T0, payload));

        MetricSample stored = sampleRepository.findRange("RMG04", "Hoist Cycles", T0, T0).get(0);
        assertEquals(TimeSeriesService.MAX_RAW_VALUE_LENGTH, stored.getRawValue().length());
        assertTrue(payload.startsWith(stored.getRawValue()));
        assertEquals(1000.0, stored.getNumericValue());
    }

    @Test
    void testViolationOtherThanNaturalKeyIsNotReportedAsDuplicate() {
        String metricName = "M".repeat(300);

        assertThrows(DataAccessException.class,
            () -> timeSeriesService.insertSample("RMG04", metricName, T0, "1"));
        assertEquals(0, sampleRepository.count());
    }

    @Test
    void testExtractNumber() {
        assertEquals(42.0, TimeSeriesService.extractNumber("42"));
        assertEquals(-3.5, TimeSeriesService.extractNumber("temp -3.5 C"));
        assertEquals(7.0, TimeSeriesService.extractNumber("7 of 9"));
        assertNull(TimeSeriesService.extractNumber("OFF"));
        assertNull(TimeSeriesService.extractNumber(null));
    }
}
