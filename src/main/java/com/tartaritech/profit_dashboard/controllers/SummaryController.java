package com.tartaritech.profit_dashboard.controllers;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tartaritech.profit_dashboard.dtos.MonthlySummaryDTO;
import com.tartaritech.profit_dashboard.enums.MetricSource;
import com.tartaritech.profit_dashboard.services.MetricsAggregationService;

@RestController
@RequestMapping("/api/summary")
@CrossOrigin(origins = "*")
public class SummaryController {

    private static final int DEFAULT_DAYS = 90;

    private final MetricsAggregationService metricsAggregationService;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(SummaryController.class);

    public SummaryController(MetricsAggregationService metricsAggregationService, Clock clock) {
        this.metricsAggregationService = metricsAggregationService;
        this.clock = clock;
    }

    /**
     * Monthly rows for an explicit {@code start}/{@code end} range (yyyy-MM), or for the last
     * {@code days} days when no range is given.
     */
    @GetMapping("/monthly")
    public ResponseEntity<Object> getMonthlySummaries(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) Integer days) {
        try {
            List<MonthlySummaryDTO> summaries;
            if (start != null || end != null) {
                summaries = metricsAggregationService.summarizeRange(parseMonth(start), parseMonth(end));
            } else {
                summaries = metricsAggregationService.summarizeLastDays(days != null ? days : DEFAULT_DAYS);
            }
            return ResponseEntity.ok(summaries);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error fetching monthly summaries", e);
            return ResponseEntity.internalServerError().body(errorResponse("Error fetching summaries: " + e.getMessage()));
        }
    }

    @GetMapping("/monthly/{month}")
    public ResponseEntity<Object> getMonthSummary(@PathVariable String month,
                                                  @RequestParam(required = false) String sources) {
        try {
            return ResponseEntity.ok(metricsAggregationService.summarizeMonth(parseMonth(month), parseSources(sources)));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error fetching summary for {}", month, e);
            return ResponseEntity.internalServerError().body(errorResponse("Error fetching summary: " + e.getMessage()));
        }
    }

    @GetMapping("/totals")
    public ResponseEntity<Object> getTotals(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {
        try {
            YearMonth endMonth = end != null ? parseMonth(end) : YearMonth.now(clock);
            YearMonth startMonth = start != null ? parseMonth(start)
                    : YearMonth.from(LocalDate.now(clock).minusDays(DEFAULT_DAYS));
            return ResponseEntity.ok(metricsAggregationService.summarizeTotals(startMonth, endMonth));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error fetching totals", e);
            return ResponseEntity.internalServerError().body(errorResponse("Error fetching totals: " + e.getMessage()));
        }
    }

    private YearMonth parseMonth(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Both start and end months are required (yyyy-MM)");
        }
        return YearMonth.parse(value);
    }

    private Set<MetricSource> parseSources(String sources) {
        if (sources == null || sources.isBlank()) {
            return EnumSet.allOf(MetricSource.class);
        }
        return Arrays.stream(sources.split(","))
                .map(String::trim)
                .map(MetricSource::fromValue)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(MetricSource.class)));
    }

    private Map<String, Object> errorResponse(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("message", message);
        return error;
    }
}
