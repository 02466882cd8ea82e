package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.profit_dashboard.dtos.MonthlySummaryDTO;
import com.tartaritech.profit_dashboard.entities.DailyMetric;
import com.tartaritech.profit_dashboard.enums.MetricSource;
import com.tartaritech.profit_dashboard.repositories.DailyMetricRepository;
import com.tartaritech.profit_dashboard.repositories.OrderRepository;

/**
 * Combines ad platform spend and Shopify revenue into calendar-month summaries.
 *
 * <p>Every monetary field of a range total is the sum of the same field over its months; ratios
 * are always recomputed from those sums and are null when their denominator is zero.
 */
@Service
public class MetricsAggregationService {

    private static final DateTimeFormatter OUTPUT_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final DailyMetricRepository dailyMetricRepository;
    private final OrderRepository orderRepository;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(MetricsAggregationService.class);

    public MetricsAggregationService(DailyMetricRepository dailyMetricRepository,
                                     OrderRepository orderRepository,
                                     Clock clock) {
        this.dailyMetricRepository = dailyMetricRepository;
        this.orderRepository = orderRepository;
        this.clock = clock;
    }

    /**
     * Summary of one month restricted to the given sources; null or empty means all sources.
     */
    @Transactional(readOnly = true)
    public MonthlySummaryDTO summarizeMonth(YearMonth month, Set<MetricSource> sources) {
        Set<MetricSource> requested = normalize(sources);
        List<DailyMetric> metrics = dailyMetricRepository
                .findByMetricDateBetweenOrderByMetricDateAsc(month.atDay(1), month.atEndOfMonth())
                .stream()
                .filter(m -> requested.contains(m.getSource()))
                .collect(Collectors.toList());
        return buildMonth(month, metrics, requested);
    }

    /**
     * One summary per calendar month from start to end inclusive, months without data included.
     */
    @Transactional(readOnly = true)
    public List<MonthlySummaryDTO> summarizeRange(YearMonth start, YearMonth end) {
        if (start == null || end == null || end.isBefore(start)) {
            throw new IllegalArgumentException("Invalid month range: " + start + " to " + end);
        }
        logger.info("Summarizing metrics from {} to {}", start, end);

        Map<YearMonth, List<DailyMetric>> byMonth = dailyMetricRepository
                .findByMetricDateBetweenOrderByMetricDateAsc(start.atDay(1), end.atEndOfMonth())
                .stream()
                .collect(Collectors.groupingBy(m -> YearMonth.from(m.getMetricDate())));

        Set<MetricSource> all = EnumSet.allOf(MetricSource.class);
        List<MonthlySummaryDTO> result = new ArrayList<>();
        YearMonth current = start;
        while (!current.isAfter(end)) {
            result.add(buildMonth(current, byMonth.getOrDefault(current, List.of()), all));
            current = current.plusMonths(1);
        }

        logger.info("Returning {} monthly summaries", result.size());
        return result;
    }

    /**
     * Months from the one containing (today - days) up to the current month.
     */
    @Transactional(readOnly = true)
    public List<MonthlySummaryDTO> summarizeLastDays(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Days must be at least 1");
        }
        LocalDate today = LocalDate.now(clock);
        return summarizeRange(YearMonth.from(today.minusDays(days)), YearMonth.from(today));
    }

    @Transactional(readOnly = true)
    public MonthlySummaryDTO summarizeTotals(YearMonth start, YearMonth end) {
        return combine(summarizeRange(start, end));
    }

    /**
     * Field-wise sum of the given months with ratios recomputed from the sums.
     */
    public MonthlySummaryDTO combine(List<MonthlySummaryDTO> months) {
        MonthlySummaryDTO total = new MonthlySummaryDTO();
        boolean anyGap = false;

        for (MonthlySummaryDTO m : months) {
            total.setRevenue(total.getRevenue().add(m.getRevenue()));
            total.setShippingRevenue(total.getShippingRevenue().add(m.getShippingRevenue()));
            total.setShippingCost(total.getShippingCost().add(m.getShippingCost()));
            total.setCogs(total.getCogs().add(m.getCogs()));
            total.setOrderCount(total.getOrderCount() + m.getOrderCount());
            total.setAdSpend(total.getAdSpend().add(m.getAdSpend()));
            total.setGoogleAdsSpend(total.getGoogleAdsSpend().add(m.getGoogleAdsSpend()));
            total.setMetaAdsSpend(total.getMetaAdsSpend().add(m.getMetaAdsSpend()));
            total.setClicks(total.getClicks() + m.getClicks());
            total.setImpressions(total.getImpressions() + m.getImpressions());
            total.setConversions(total.getConversions().add(m.getConversions()));
            total.setOrdersMissingEstimate(total.getOrdersMissingEstimate() + m.getOrdersMissingEstimate());
            total.getSources().addAll(m.getSources());
            total.setPartial(total.isPartial() || m.isPartial());
            anyGap |= m.isSingleSource();
        }

        total.setSingleSource(anyGap);
        if (!total.hasData()) {
            total.getWarnings().add(MonthlySummaryDTO.WARNING_NO_DATA);
        } else if (anyGap) {
            total.getWarnings().add(MonthlySummaryDTO.WARNING_AGGREGATION_GAP);
        }
        applyDerivedMetrics(total);
        return total;
    }

    private MonthlySummaryDTO buildMonth(YearMonth month, List<DailyMetric> metrics, Set<MetricSource> requested) {
        MonthlySummaryDTO summary = new MonthlySummaryDTO();
        summary.setMonth(month.format(OUTPUT_FORMATTER));

        for (DailyMetric m : metrics) {
            summary.getSources().add(m.getSource());
            if (m.getSource().isAdSource()) {
                BigDecimal spend = orZero(m.getSpend());
                summary.setAdSpend(summary.getAdSpend().add(spend));
                if (m.getSource() == MetricSource.GOOGLE_ADS) {
                    summary.setGoogleAdsSpend(summary.getGoogleAdsSpend().add(spend));
                } else {
                    summary.setMetaAdsSpend(summary.getMetaAdsSpend().add(spend));
                }
                summary.setClicks(summary.getClicks() + orZero(m.getClicks()));
                summary.setImpressions(summary.getImpressions() + orZero(m.getImpressions()));
                summary.setConversions(summary.getConversions().add(orZero(m.getConversions())));
            } else {
                summary.setRevenue(summary.getRevenue().add(orZero(m.getRevenue())));
                summary.setShippingRevenue(summary.getShippingRevenue().add(orZero(m.getShippingRevenue())));
                summary.setShippingCost(summary.getShippingCost().add(orZero(m.getShippingCost())));
                summary.setCogs(summary.getCogs().add(orZero(m.getCogs())));
                summary.setOrderCount(summary.getOrderCount() + (m.getOrderCount() != null ? m.getOrderCount() : 0));
            }
        }

        LocalDate today = LocalDate.now(clock);
        if (month.equals(YearMonth.from(today))) {
            summary.setPartial(true);
            summary.setDaysElapsed(today.getDayOfMonth());
            summary.setDaysInMonth(month.lengthOfMonth());
        }

        if (requested.contains(MetricSource.SHOPIFY)) {
            summary.setOrdersMissingEstimate(orderRepository
                    .countByOrderDateBetweenAndShippingCostEstimatedIsNull(month.atDay(1), month.atEndOfMonth()));
        }

        if (!summary.hasData()) {
            summary.getWarnings().add(MonthlySummaryDTO.WARNING_NO_DATA);
        } else if (isAggregationGap(summary.getSources(), requested)) {
            logger.warn("Month {} only has data from {}, totals are single-sourced", summary.getMonth(), summary.getSources());
            summary.setSingleSource(true);
            summary.getWarnings().add(MonthlySummaryDTO.WARNING_AGGREGATION_GAP);
        }

        applyDerivedMetrics(summary);
        return summary;
    }

    // both sides were asked for but only one of them reported
    private boolean isAggregationGap(Set<MetricSource> present, Set<MetricSource> requested) {
        boolean adsRequested = requested.stream().anyMatch(MetricSource::isAdSource);
        boolean shopifyRequested = requested.contains(MetricSource.SHOPIFY);
        if (!adsRequested || !shopifyRequested) {
            return false;
        }
        boolean hasAds = present.stream().anyMatch(MetricSource::isAdSource);
        boolean hasShopify = present.contains(MetricSource.SHOPIFY);
        return hasAds != hasShopify;
    }

    private void applyDerivedMetrics(MonthlySummaryDTO summary) {
        summary.setRevenue(money(summary.getRevenue()));
        summary.setShippingRevenue(money(summary.getShippingRevenue()));
        summary.setShippingCost(money(summary.getShippingCost()));
        summary.setCogs(money(summary.getCogs()));
        summary.setAdSpend(money(summary.getAdSpend()));
        summary.setGoogleAdsSpend(money(summary.getGoogleAdsSpend()));
        summary.setMetaAdsSpend(money(summary.getMetaAdsSpend()));
        summary.setConversions(money(summary.getConversions()));

        BigDecimal totalRevenue = summary.getRevenue().add(summary.getShippingRevenue());
        summary.setTotalRevenue(totalRevenue);
        summary.setProfit(totalRevenue.subtract(summary.getTotalExpenses()));

        summary.setRoas(ratio(totalRevenue, summary.getAdSpend()));
        summary.setPoas(ratio(totalRevenue.subtract(summary.getShippingCost()), summary.getAdSpend()));
        summary.setProfitMargin(ratio(summary.getProfit().multiply(ONE_HUNDRED), totalRevenue));
        summary.setCtr(ratio(BigDecimal.valueOf(summary.getClicks()).multiply(ONE_HUNDRED),
                BigDecimal.valueOf(summary.getImpressions())));
    }

    private static Set<MetricSource> normalize(Set<MetricSource> sources) {
        return sources == null || sources.isEmpty() ? EnumSet.allOf(MetricSource.class) : EnumSet.copyOf(sources);
    }

    // null means "not available"
    private static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return null;
        }
        return numerator.divide(denominator, 4, RoundingMode.HALF_UP);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
