package com.tartaritech.profit_dashboard.dtos;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

@DisplayName("OrderDTO Validation Tests")
class OrderDTOTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setup() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void close() {
        factory.close();
    }

    private OrderDTO pushed() {
        OrderDTO dto = new OrderDTO();
        dto.setId("1001");
        dto.setOrderDate(LocalDate.of(2024, 3, 18));
        return dto;
    }

    @Test
    @DisplayName("Should reject a pushed order whose items are null")
    void shouldRejectNullItems() {
        OrderDTO dto = pushed();
        dto.setLineItems(null);

        OrderSyncRequestDTO request = new OrderSyncRequestDTO(List.of(dto));
        Set<ConstraintViolation<OrderSyncRequestDTO>> violations = validator.validate(request);

        assertEquals(1, violations.size());
        ConstraintViolation<OrderSyncRequestDTO> violation = violations.iterator().next();
        assertEquals("orders[0].lineItems", violation.getPropertyPath().toString());
        assertEquals("Items are required", violation.getMessage());
    }

    @Test
    @DisplayName("Should accept a pushed order with an empty item list")
    void shouldAcceptEmptyItems() {
        OrderSyncRequestDTO request = new OrderSyncRequestDTO(List.of(pushed()));

        assertTrue(validator.validate(request).isEmpty());
    }
}
