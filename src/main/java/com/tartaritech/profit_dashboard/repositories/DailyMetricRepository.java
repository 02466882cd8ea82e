package com.tartaritech.profit_dashboard.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.tartaritech.profit_dashboard.entities.DailyMetric;
import com.tartaritech.profit_dashboard.enums.MetricSource;

import jakarta.persistence.LockModeType;

@Repository
public interface DailyMetricRepository extends JpaRepository<DailyMetric, Long> {

    /**
     * Loads the row for the composite key with a write lock held until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM DailyMetric m WHERE m.source = :source AND m.metricDate = :date AND m.campaignId = :campaignId")
    Optional<DailyMetric> findForUpdate(@Param("source") MetricSource source,
                                        @Param("date") LocalDate date,
                                        @Param("campaignId") String campaignId);

    List<DailyMetric> findByMetricDateBetweenOrderByMetricDateAsc(LocalDate start, LocalDate end);

    List<DailyMetric> findBySourceAndMetricDateBetweenOrderByMetricDateAsc(MetricSource source, LocalDate start, LocalDate end);
}
