package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import com.tartaritech.profit_dashboard.entities.CostRule;
import com.tartaritech.profit_dashboard.entities.LineItem;
import com.tartaritech.profit_dashboard.entities.MatchCondition;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;
import com.tartaritech.profit_dashboard.enums.MatchField;
import com.tartaritech.profit_dashboard.enums.MatchOperator;

final class ShippingTestData {

    static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private ShippingTestData() {
    }

    static ShippingProfile profile(long id, String name, int priority, String titleContains, CostRule costRule) {
        ShippingProfile profile = new ShippingProfile();
        profile.setId(id);
        profile.setName(name);
        profile.setPriority(priority);
        profile.setActive(true);
        profile.setMatchCondition(new MatchCondition(MatchField.PRODUCT_TITLE, MatchOperator.CONTAINS, titleContains, false));
        profile.setCostRule(costRule);
        profile.setCreatedAt(T0.plusSeconds(id));
        return profile;
    }

    static Order order(String id, String subtotal, String shippingCharged, LineItem... items) {
        Order order = new Order();
        order.setId(id);
        order.setOrderDate(LocalDate.of(2024, 3, 15));
        order.setSubtotal(new BigDecimal(subtotal));
        order.setShippingCharged(new BigDecimal(shippingCharged));
        for (LineItem item : items) {
            order.addLineItem(item);
        }
        return order;
    }

    static LineItem item(String productTitle, int quantity) {
        return LineItem.create(productTitle, null, quantity, new BigDecimal("10.00"));
    }

    static BigDecimal money(String value) {
        return new BigDecimal(value);
    }
}
