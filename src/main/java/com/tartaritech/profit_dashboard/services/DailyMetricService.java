package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.tartaritech.profit_dashboard.dtos.SourceSummaryDTO;
import com.tartaritech.profit_dashboard.dtos.TimeSeriesPointDTO;
import com.tartaritech.profit_dashboard.entities.DailyMetric;
import com.tartaritech.profit_dashboard.enums.MetricSource;
import com.tartaritech.profit_dashboard.repositories.DailyMetricRepository;

/**
 * Daily metric rows keyed on (source, date, campaign). Writes overwrite the existing row under a
 * pessimistic lock so two syncs racing on the same key end with one row holding the last values.
 */
@Service
public class DailyMetricService {

    private static final Map<String, Function<DailyMetric, BigDecimal>> SERIES_METRICS = Map.of(
            "spend", DailyMetric::getSpend,
            "clicks", m -> BigDecimal.valueOf(m.getClicks() != null ? m.getClicks() : 0L),
            "impressions", m -> BigDecimal.valueOf(m.getImpressions() != null ? m.getImpressions() : 0L),
            "conversions", DailyMetric::getConversions,
            "revenue", DailyMetric::getRevenue,
            "shipping_revenue", DailyMetric::getShippingRevenue,
            "shipping_cost", DailyMetric::getShippingCost,
            "cogs", DailyMetric::getCogs,
            "orders", m -> BigDecimal.valueOf(m.getOrderCount() != null ? m.getOrderCount() : 0));

    private final DailyMetricRepository dailyMetricRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(DailyMetricService.class);

    public DailyMetricService(DailyMetricRepository dailyMetricRepository,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.dailyMetricRepository = dailyMetricRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Inserts or overwrites the row for the record's key. Each call runs in its own transaction;
     * an insert that loses the race against a concurrent insert is retried once as an update.
     */
    public DailyMetric upsert(DailyMetric incoming) {
        return upsert(incoming, false);
    }

    /**
     * Same as {@link #upsert(DailyMetric)}, but when {@code preserveCogs} is set an existing row
     * keeps the cogs it holds at the time the lock is taken.
     */
    public DailyMetric upsert(DailyMetric incoming, boolean preserveCogs) {
        if (incoming.getCampaignId() == null) {
            incoming.setCampaignId(DailyMetric.ACCOUNT_LEVEL);
        }
        try {
            return transactionTemplate.execute(status -> lockAndWrite(incoming, preserveCogs));
        } catch (DataIntegrityViolationException e) {
            logger.warn("Concurrent insert for {} {} campaign '{}', retrying as update",
                    incoming.getSource(), incoming.getMetricDate(), incoming.getCampaignId());
            return transactionTemplate.execute(status -> lockAndWrite(incoming, preserveCogs));
        }
    }

    public int upsertAll(List<DailyMetric> records) {
        records.forEach(this::upsert);
        logger.info("Upserted {} daily metric rows", records.size());
        return records.size();
    }

    @Transactional(readOnly = true)
    public SourceSummaryDTO getSourceSummary(MetricSource source, int days) {
        List<DailyMetric> metrics = findLastDays(source, days);

        SourceSummaryDTO summary = new SourceSummaryDTO();
        summary.setSource(source);
        summary.setDays(days);
        for (DailyMetric m : metrics) {
            summary.setSpend(summary.getSpend().add(orZero(m.getSpend())));
            summary.setClicks(summary.getClicks() + (m.getClicks() != null ? m.getClicks() : 0L));
            summary.setImpressions(summary.getImpressions() + (m.getImpressions() != null ? m.getImpressions() : 0L));
            summary.setConversions(summary.getConversions().add(orZero(m.getConversions())));
            summary.setRevenue(summary.getRevenue().add(orZero(m.getRevenue())));
            summary.setShippingRevenue(summary.getShippingRevenue().add(orZero(m.getShippingRevenue())));
            summary.setShippingCost(summary.getShippingCost().add(orZero(m.getShippingCost())));
            summary.setCogs(summary.getCogs().add(orZero(m.getCogs())));
            summary.setOrderCount(summary.getOrderCount() + (m.getOrderCount() != null ? m.getOrderCount() : 0));
        }
        if (summary.getImpressions() > 0) {
            summary.setCtr(BigDecimal.valueOf(summary.getClicks())
                    .multiply(BigDecimal.valueOf(100))
                    .divide(BigDecimal.valueOf(summary.getImpressions()), 4, RoundingMode.HALF_UP));
        }
        return summary;
    }

    /**
     * Daily values of one metric, campaigns summed per day.
     */
    @Transactional(readOnly = true)
    public List<TimeSeriesPointDTO> getTimeSeries(MetricSource source, String metric, int days) {
        Function<DailyMetric, BigDecimal> extractor = SERIES_METRICS.get(metric);
        if (extractor == null) {
            throw new IllegalArgumentException("Unknown metric: " + metric
                    + ". Expected one of " + new TreeMap<>(SERIES_METRICS).keySet());
        }

        Map<LocalDate, BigDecimal> byDate = new TreeMap<>();
        for (DailyMetric m : findLastDays(source, days)) {
            byDate.merge(m.getMetricDate(), orZero(extractor.apply(m)), BigDecimal::add);
        }
        return byDate.entrySet().stream()
                .map(e -> new TimeSeriesPointDTO(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    private DailyMetric lockAndWrite(DailyMetric incoming, boolean preserveCogs) {
        return dailyMetricRepository.findForUpdate(incoming.getSource(), incoming.getMetricDate(), incoming.getCampaignId())
                .map(existing -> {
                    BigDecimal lockedCogs = existing.getCogs();
                    existing.copyValuesFrom(incoming);
                    if (preserveCogs) {
                        existing.setCogs(lockedCogs != null ? lockedCogs : BigDecimal.ZERO);
                    }
                    return dailyMetricRepository.saveAndFlush(existing);
                })
                .orElseGet(() -> dailyMetricRepository.saveAndFlush(incoming));
    }

    private List<DailyMetric> findLastDays(MetricSource source, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Days must be at least 1");
        }
        LocalDate today = LocalDate.now(clock);
        return dailyMetricRepository.findBySourceAndMetricDateBetweenOrderByMetricDateAsc(source, today.minusDays(days), today);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
