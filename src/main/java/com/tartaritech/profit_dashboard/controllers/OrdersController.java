package com.tartaritech.profit_dashboard.controllers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tartaritech.profit_dashboard.dtos.OrderDTO;
import com.tartaritech.profit_dashboard.dtos.OrderSyncRequestDTO;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;
import com.tartaritech.profit_dashboard.exceptions.InvalidApiKeyException;
import com.tartaritech.profit_dashboard.services.OrderSyncService;
import com.tartaritech.profit_dashboard.utils.SyncApiKeyValidator;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/orders")
@CrossOrigin(origins = "*")
public class OrdersController {

    private final OrderSyncService orderSyncService;
    private final SyncApiKeyValidator syncApiKeyValidator;
    private final Logger logger = LoggerFactory.getLogger(OrdersController.class);

    public OrdersController(OrderSyncService orderSyncService, SyncApiKeyValidator syncApiKeyValidator) {
        this.orderSyncService = orderSyncService;
        this.syncApiKeyValidator = syncApiKeyValidator;
    }

    @PostMapping("/push")
    public ResponseEntity<Object> pushOrders(
            @RequestHeader(value = SyncApiKeyValidator.HEADER, required = false) String apiKey,
            @Valid @RequestBody OrderSyncRequestDTO request) {
        try {
            syncApiKeyValidator.validate(apiKey);
            int stored = orderSyncService.upsertOrders(request.getOrders());

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("orders_stored", stored);
            return ResponseEntity.ok(response);
        } catch (InvalidApiKeyException e) {
            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("success", false);
            errorResponse.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(errorResponse);
        } catch (Exception e) {
            logger.error("Error storing pushed orders", e);
            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("success", false);
            errorResponse.put("message", "Error storing orders: " + e.getMessage());
            return ResponseEntity.internalServerError().body(errorResponse);
        }
    }

    @GetMapping
    public ResponseEntity<Object> getOrders(
            @RequestParam(defaultValue = "30") int days,
            @RequestParam(required = false) ShippingEstimateStatus status) {
        try {
            List<OrderDTO> orders = orderSyncService.getRecentOrders(days, status);
            logger.info("Returning {} orders", orders.size());
            return ResponseEntity.ok(orders);
        } catch (IllegalArgumentException e) {
            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("success", false);
            errorResponse.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
        } catch (Exception e) {
            logger.error("Error fetching orders", e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
