package com.cranestats.service;

import com.cranestats.dto.SamplePoint;
import com.cranestats.model.MetricSample;
import com.cranestats.model.TimedValue;
import com.cranestats.repository.MetricSampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Time-series store over metric_samples.
 *
 * Thread Safety Strategy:
 * - Inserts check the natural key first and rely on the unique constraint when two
 *   writers race on the same key; the loser reports DUPLICATE
 * - Any other constraint violation propagates so the caller counts a write failure
 * - Each insert runs in its own transaction so one failing row never rolls back others
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimeSeriesService {

    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+(?:\\.\\d+)?");

    /** Width of metric_samples.raw_value. */
    static final int MAX_RAW_VALUE_LENGTH = 1000;

    private final MetricSampleRepository sampleRepository;

    public enum InsertOutcome {
        INSERTED,
        DUPLICATE
    }

    /**
     * Store one sample unless its (entityId, metricName, timestamp) is already present.
     *
     * @throws org.springframework.dao.DataAccessException when the store fails
     */
    public InsertOutcome insertSample(String entityId, String metricName, LocalDateTime timestamp, String value) {
        if (sampleRepository.existsByEntityIdAndMetricNameAndSampleTime(entityId, metricName, timestamp)) {
            return InsertOutcome.DUPLICATE;
        }
        String rawValue = value;
        if (rawValue != null && rawValue.length() > MAX_RAW_VALUE_LENGTH) {
            log.warn("Payload of {}/{}@{} is {} characters, stored truncated to {}", entityId, metricName,
                timestamp, rawValue.length(), MAX_RAW_VALUE_LENGTH);
            rawValue = rawValue.substring(0, MAX_RAW_VALUE_LENGTH);
        }
        MetricSample sample = MetricSample.builder()
            .entityId(entityId)
            .metricName(metricName)
            .sampleTime(timestamp)
            .rawValue(rawValue)
            .numericValue(extractNumber(value))
            .build();
        try {
            sampleRepository.saveAndFlush(sample);
            return InsertOutcome.INSERTED;
        } catch (DataIntegrityViolationException e) {
            if (!sampleRepository.existsByEntityIdAndMetricNameAndSampleTime(entityId, metricName, timestamp)) {
                throw e;
            }
            // Another writer stored the same natural key between the check and the insert
            log.debug("Concurrent insert of {}/{}@{} treated as duplicate", entityId, metricName, timestamp);
            return InsertOutcome.DUPLICATE;
        }
    }

    /**
     * Samples in [start, end], oldest first. Empty when there is no data.
     */
    @Transactional(readOnly = true)
    public List<SamplePoint> getValueRange(String entityId, String metricName, LocalDateTime start, LocalDateTime end) {
        return sampleRepository.findRange(entityId, metricName, start, end).stream()
            .map(s -> SamplePoint.builder()
                .timestamp(s.getSampleTime())
                .rawValue(s.getRawValue())
                .numericValue(s.getNumericValue())
                .build())
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<TimedValue> getLatestValue(String entityId, String metricName) {
        return sampleRepository
            .findFirstByEntityIdAndMetricNameAndNumericValueIsNotNullOrderBySampleTimeDesc(entityId, metricName)
            .map(TimedValue::of);
    }

    @Transactional(readOnly = true)
    public Optional<TimedValue> getEarliestValue(String entityId, String metricName) {
        return sampleRepository
            .findFirstByEntityIdAndMetricNameAndNumericValueIsNotNullOrderBySampleTimeAsc(entityId, metricName)
            .map(TimedValue::of);
    }

    @Transactional(readOnly = true)
    public Optional<TimedValue> getValueAtOrBefore(String entityId, String metricName, LocalDateTime timestamp) {
        return sampleRepository
            .findFirstByEntityIdAndMetricNameAndNumericValueIsNotNullAndSampleTimeLessThanEqualOrderBySampleTimeDesc(
                entityId, metricName, timestamp)
            .map(TimedValue::of);
    }

    @Transactional(readOnly = true)
    public Optional<TimedValue> getValueAtOrAfter(String entityId, String metricName, LocalDateTime timestamp) {
        return sampleRepository
            .findFirstByEntityIdAndMetricNameAndNumericValueIsNotNullAndSampleTimeGreaterThanEqualOrderBySampleTimeAsc(
                entityId, metricName, timestamp)
            .map(TimedValue::of);
    }

    /**
     * First decimal number in a result payload, e.g. "12345 cycles" gives 12345.0.
     */
    static Double extractNumber(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = NUMBER.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        return Double.parseDouble(matcher.group());
    }
}
