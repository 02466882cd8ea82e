package com.tartaritech.profit_dashboard.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import com.tartaritech.profit_dashboard.dtos.RecomputeResultDTO;
import com.tartaritech.profit_dashboard.exceptions.ResourceNotFoundException;
import com.tartaritech.profit_dashboard.exceptions.ShippingRuleConfigurationException;
import com.tartaritech.profit_dashboard.services.OrderShippingService;

class ShippingCalculationControllerTest {

    @Test
    void calculateOrder_returnsResult() {
        OrderShippingService service = mock(OrderShippingService.class);
        ShippingCalculationController controller = new ShippingCalculationController(service);
        RecomputeResultDTO result = new RecomputeResultDTO();
        result.setOrderId("1001");
        when(service.recomputeOne("1001")).thenReturn(result);

        ResponseEntity<?> res = controller.calculateOrder("1001");

        assertEquals(200, res.getStatusCode().value());
        assertSame(result, res.getBody());
    }

    @Test
    void calculateOrder_unknownOrderIs404() {
        OrderShippingService service = mock(OrderShippingService.class);
        ShippingCalculationController controller = new ShippingCalculationController(service);
        when(service.recomputeOne("404")).thenThrow(new ResourceNotFoundException("Order not found: 404"));

        ResponseEntity<?> res = controller.calculateOrder("404");

        assertEquals(404, res.getStatusCode().value());
    }

    @Test
    void calculateOrder_misconfiguredRuleIs422WithProfileId() {
        OrderShippingService service = mock(OrderShippingService.class);
        ShippingCalculationController controller = new ShippingCalculationController(service);
        when(service.recomputeOne("1001"))
                .thenThrow(new ShippingRuleConfigurationException(7L, "FIXED rule requires 'amount'"));

        ResponseEntity<?> res = controller.calculateOrder("1001");

        assertEquals(422, res.getStatusCode().value());
        @SuppressWarnings("unchecked")
        Map<String, Object> body = (Map<String, Object>) res.getBody();
        assertEquals("MISCONFIGURED_RULE", body.get("status"));
        assertEquals(7L, body.get("profile_id"));
    }

    @Test
    void getRuleUsage_rejectsBadWindow() {
        OrderShippingService service = mock(OrderShippingService.class);
        ShippingCalculationController controller = new ShippingCalculationController(service);
        when(service.getRuleUsageDetails(0)).thenThrow(new IllegalArgumentException("Days must be at least 1"));

        ResponseEntity<?> res = controller.getRuleUsage(0);

        assertEquals(400, res.getStatusCode().value());
    }
}
