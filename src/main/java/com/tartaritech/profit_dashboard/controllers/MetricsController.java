package com.tartaritech.profit_dashboard.controllers;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tartaritech.profit_dashboard.dtos.DailyMetricDTO;
import com.tartaritech.profit_dashboard.dtos.MetricsPushRequestDTO;
import com.tartaritech.profit_dashboard.entities.DailyMetric;
import com.tartaritech.profit_dashboard.enums.MetricSource;
import com.tartaritech.profit_dashboard.exceptions.InvalidApiKeyException;
import com.tartaritech.profit_dashboard.services.DailyMetricService;
import com.tartaritech.profit_dashboard.services.ShopifyRollupService;
import com.tartaritech.profit_dashboard.utils.SyncApiKeyValidator;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/metrics")
@CrossOrigin(origins = "*")
public class MetricsController {

    private final DailyMetricService dailyMetricService;
    private final ShopifyRollupService shopifyRollupService;
    private final SyncApiKeyValidator syncApiKeyValidator;
    private final Logger logger = LoggerFactory.getLogger(MetricsController.class);

    public MetricsController(DailyMetricService dailyMetricService,
                             ShopifyRollupService shopifyRollupService,
                             SyncApiKeyValidator syncApiKeyValidator) {
        this.dailyMetricService = dailyMetricService;
        this.shopifyRollupService = shopifyRollupService;
        this.syncApiKeyValidator = syncApiKeyValidator;
    }

    @PostMapping("/push")
    public ResponseEntity<Object> pushMetrics(
            @RequestHeader(value = SyncApiKeyValidator.HEADER, required = false) String apiKey,
            @Valid @RequestBody MetricsPushRequestDTO request) {
        try {
            syncApiKeyValidator.validate(apiKey);
            logger.info("Received {} daily metric rows from {}", request.getDailyMetrics().size(), request.getOrigin());

            List<DailyMetric> records = request.getDailyMetrics().stream()
                    .map(DailyMetricDTO::toEntity)
                    .collect(Collectors.toList());
            int upserted = dailyMetricService.upsertAll(records);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("records_upserted", upserted);
            return ResponseEntity.ok(response);
        } catch (InvalidApiKeyException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error storing pushed metrics", e);
            return ResponseEntity.internalServerError().body(errorResponse("Error storing metrics: " + e.getMessage()));
        }
    }

    @PostMapping("/shopify/rollup")
    public ResponseEntity<Object> rollupShopify(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        try {
            List<DailyMetricDTO> rows = shopifyRollupService.rollupOrders(start, end);
            return ResponseEntity.ok(rows);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error rolling up Shopify orders from {} to {}", start, end, e);
            return ResponseEntity.internalServerError().body(errorResponse("Error rolling up orders: " + e.getMessage()));
        }
    }

    @GetMapping("/{source}/summary")
    public ResponseEntity<Object> getSourceSummary(@PathVariable String source,
                                                   @RequestParam(defaultValue = "30") int days) {
        try {
            return ResponseEntity.ok(dailyMetricService.getSourceSummary(MetricSource.fromValue(source), days));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error fetching {} summary", source, e);
            return ResponseEntity.internalServerError().body(errorResponse("Error fetching summary: " + e.getMessage()));
        }
    }

    @GetMapping("/{source}/series/{metric}")
    public ResponseEntity<Object> getTimeSeries(@PathVariable String source,
                                                @PathVariable String metric,
                                                @RequestParam(defaultValue = "30") int days) {
        try {
            return ResponseEntity.ok(dailyMetricService.getTimeSeries(MetricSource.fromValue(source), metric, days));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error fetching {} series for {}", metric, source, e);
            return ResponseEntity.internalServerError().body(errorResponse("Error fetching series: " + e.getMessage()));
        }
    }

    private Map<String, Object> errorResponse(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("message", message);
        return error;
    }
}
