package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderDTO {

    @NotBlank(message = "Order id is required")
    private String id;

    private Integer orderNumber;

    @NotNull(message = "Order date is required")
    private LocalDate orderDate;

    private String customerEmail;

    private String currency;

    private String financialStatus;

    private BigDecimal subtotal = BigDecimal.ZERO;

    private BigDecimal totalDiscounts = BigDecimal.ZERO;

    private BigDecimal totalPrice = BigDecimal.ZERO;

    private BigDecimal shippingCharged = BigDecimal.ZERO;

    // read-only, written by shipping recompute
    private BigDecimal shippingCostEstimated;

    private Long matchedRuleId;

    private ShippingEstimateStatus shippingEstimateStatus;

    @Valid
    @NotNull(message = "Items are required")
    @JsonProperty("items")
    private List<LineItemDTO> lineItems = new ArrayList<>();

    public OrderDTO(Order entity) {
        this.id = entity.getId();
        this.orderNumber = entity.getOrderNumber();
        this.orderDate = entity.getOrderDate();
        this.customerEmail = entity.getCustomerEmail();
        this.currency = entity.getCurrency();
        this.financialStatus = entity.getFinancialStatus();
        this.subtotal = entity.getSubtotal();
        this.totalDiscounts = entity.getTotalDiscounts();
        this.totalPrice = entity.getTotalPrice();
        this.shippingCharged = entity.getShippingCharged();
        this.shippingCostEstimated = entity.getShippingCostEstimated();
        this.matchedRuleId = entity.getMatchedRuleId();
        this.shippingEstimateStatus = entity.getShippingEstimateStatus();
        this.lineItems = entity.getLineItems().stream()
            .map(LineItemDTO::new)
            .collect(Collectors.toList());
    }
}
