package com.tartaritech.profit_dashboard.controllers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tartaritech.profit_dashboard.dtos.BatchRecomputeResultDTO;
import com.tartaritech.profit_dashboard.dtos.RecomputeRequestDTO;
import com.tartaritech.profit_dashboard.dtos.RecomputeResultDTO;
import com.tartaritech.profit_dashboard.dtos.RuleUsageDTO;
import com.tartaritech.profit_dashboard.exceptions.ResourceNotFoundException;
import com.tartaritech.profit_dashboard.exceptions.ShippingRuleConfigurationException;
import com.tartaritech.profit_dashboard.services.OrderShippingService;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/shipping")
@CrossOrigin(origins = "*")
@Validated
public class ShippingCalculationController {

    private final OrderShippingService orderShippingService;
    private final Logger logger = LoggerFactory.getLogger(ShippingCalculationController.class);

    public ShippingCalculationController(OrderShippingService orderShippingService) {
        this.orderShippingService = orderShippingService;
    }

    @PostMapping("/calculate")
    public ResponseEntity<?> calculateOrders(@Valid @RequestBody RecomputeRequestDTO request) {
        try {
            logger.info("Request to recompute shipping for {} orders", request.getOrderIds().size());
            BatchRecomputeResultDTO result = orderShippingService.recomputeMany(request.getOrderIds(), request.getLookbackDays());
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            logger.error("Error recomputing shipping estimates", e);
            return ResponseEntity.internalServerError().body(errorResponse("Error recomputing shipping: " + e.getMessage()));
        }
    }

    @PostMapping("/calculate/{orderId}")
    public ResponseEntity<?> calculateOrder(@PathVariable String orderId) {
        try {
            RecomputeResultDTO result = orderShippingService.recomputeOne(orderId);
            return ResponseEntity.ok(result);
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse(e.getMessage()));
        } catch (ShippingRuleConfigurationException e) {
            logger.warn("Misconfigured shipping profile {} while recomputing order {}", e.getProfileId(), orderId);
            Map<String, Object> error = errorResponse(e.getMessage());
            error.put("status", "MISCONFIGURED_RULE");
            error.put("profile_id", e.getProfileId());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
        } catch (Exception e) {
            logger.error("Error recomputing shipping for order {}", orderId, e);
            return ResponseEntity.internalServerError().body(errorResponse("Error recomputing shipping: " + e.getMessage()));
        }
    }

    @PostMapping("/calculate-all")
    public ResponseEntity<?> calculateAll(@RequestParam(defaultValue = "30") int days) {
        try {
            logger.info("Request to recompute shipping for all orders of the last {} days", days);
            return ResponseEntity.ok(orderShippingService.recomputeAll(days));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error recomputing shipping for all orders", e);
            return ResponseEntity.internalServerError().body(errorResponse("Error recomputing shipping: " + e.getMessage()));
        }
    }

    @GetMapping("/orders/{orderId}/breakdown")
    public ResponseEntity<?> getOrderBreakdown(@PathVariable String orderId) {
        try {
            return ResponseEntity.ok(orderShippingService.getOrderBreakdown(orderId));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse(e.getMessage()));
        } catch (ShippingRuleConfigurationException e) {
            Map<String, Object> error = errorResponse(e.getMessage());
            error.put("status", "MISCONFIGURED_RULE");
            error.put("profile_id", e.getProfileId());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
        } catch (Exception e) {
            logger.error("Error building shipping breakdown for order {}", orderId, e);
            return ResponseEntity.internalServerError().body(errorResponse("Error building breakdown: " + e.getMessage()));
        }
    }

    @GetMapping("/usage")
    public ResponseEntity<?> getRuleUsage(@RequestParam(defaultValue = "30") int days) {
        try {
            List<RuleUsageDTO> usage = orderShippingService.getRuleUsageDetails(days);
            return ResponseEntity.ok(usage);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error fetching shipping rule usage", e);
            return ResponseEntity.internalServerError().body(errorResponse("Error fetching rule usage: " + e.getMessage()));
        }
    }

    private Map<String, Object> errorResponse(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("message", message);
        return error;
    }
}
