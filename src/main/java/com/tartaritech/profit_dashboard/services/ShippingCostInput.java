package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Values a cost rule can read: the order subtotal, the quantity of the items the rule
 * matched, and what the customer paid for shipping.
 */
@Getter
@AllArgsConstructor
@ToString
public class ShippingCostInput {

    private final BigDecimal orderSubtotal;
    private final int quantity;
    private final BigDecimal shippingCharged;
}
