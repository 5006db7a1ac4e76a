package com.cranestats.repository;

import com.cranestats.model.MetricSample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the metric_samples time series.
 *
 * Point lookups only consider samples with a numeric value, since those are what
 * usage computations consume.
 */
@Repository
public interface MetricSampleRepository extends JpaRepository<MetricSample, Long> {

    boolean existsByEntityIdAndMetricNameAndSampleTime(String entityId, String metricName, LocalDateTime sampleTime);

    /**
     * Samples for an entity/metric within [start, end], both inclusive, oldest first.
     */
    @Query("SELECT s FROM MetricSample s WHERE s.entityId = :entityId " +
           "AND s.metricName = :metricName " +
           "AND s.sampleTime >= :start AND s.sampleTime <= :end " +
           "ORDER BY s.sampleTime ASC")
    List<MetricSample> findRange(
        @Param("entityId") String entityId,
        @Param("metricName") String metricName,
        @Param("start") LocalDateTime start,
        @Param("end") LocalDateTime end
    );

    Optional<MetricSample> findFirstByEntityIdAndMetricNameAndNumericValueIsNotNullOrderBySampleTimeDesc(
        String entityId, String metricName);

    Optional<MetricSample> findFirstByEntityIdAndMetricNameAndNumericValueIsNotNullOrderBySampleTimeAsc(
        String entityId, String metricName);

    Optional<MetricSample> findFirstByEntityIdAndMetricNameAndNumericValueIsNotNullAndSampleTimeLessThanEqualOrderBySampleTimeDesc(
        String entityId, String metricName, LocalDateTime timestamp);

    Optional<MetricSample> findFirstByEntityIdAndMetricNameAndNumericValueIsNotNullAndSampleTimeGreaterThanEqualOrderBySampleTimeAsc(
        String entityId, String metricName, LocalDateTime timestamp);

    long countByEntityId(String entityId);
}
