package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.tartaritech.profit_dashboard.dtos.MonthlySummaryDTO;

/**
 * Creates projection engines seeded with the latest monthly actuals.
 */
@Service
public class ProjectionService {

    private final MetricsAggregationService metricsAggregationService;
    private final Clock clock;
    private final List<BigDecimal> presetMultipliers;
    private final int futureMonths;
    private final Logger logger = LoggerFactory.getLogger(ProjectionService.class);

    public ProjectionService(MetricsAggregationService metricsAggregationService,
                             Clock clock,
                             @Value("${projection.preset-multipliers:2,3,6,1,0}") String presetMultipliers,
                             @Value("${projection.future-months:5}") int futureMonths) {
        this.metricsAggregationService = metricsAggregationService;
        this.clock = clock;
        this.presetMultipliers = Arrays.stream(presetMultipliers.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(BigDecimal::new)
                .collect(Collectors.toList());
        this.futureMonths = futureMonths;
    }

    public ProjectionEngine createProjection(int days) {
        LocalDate today = LocalDate.now(clock);
        List<MonthlySummaryDTO> months = metricsAggregationService.summarizeLastDays(days);

        ProjectionEngine engine = new ProjectionEngine(presetMultipliers, futureMonths);
        engine.initProjection(months, YearMonth.from(today), today.getDayOfMonth());

        logger.info("Projection initialized from {} months of actuals, base month index {}",
                months.size(), engine.getBaseMonthIndex());
        return engine;
    }
}
