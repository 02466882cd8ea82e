package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.tartaritech.profit_dashboard.dtos.DailyMetricDTO;
import com.tartaritech.profit_dashboard.entities.DailyMetric;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.enums.MetricSource;
import com.tartaritech.profit_dashboard.repositories.OrderRepository;

/**
 * Builds the account-level SHOPIFY daily rows from stored orders.
 */
@Service
public class ShopifyRollupService {

    private final OrderRepository orderRepository;
    private final DailyMetricService dailyMetricService;
    private final BigDecimal fallbackMarkup;
    private final Logger logger = LoggerFactory.getLogger(ShopifyRollupService.class);

    public ShopifyRollupService(OrderRepository orderRepository,
                                DailyMetricService dailyMetricService,
                                @Value("${shipping.rollup.fallback-markup:1.05}") BigDecimal fallbackMarkup) {
        this.orderRepository = orderRepository;
        this.dailyMetricService = dailyMetricService;
        this.fallbackMarkup = fallbackMarkup;
    }

    /**
     * Rolls the orders dated in [start, end] up into one row per day. Days without orders are
     * left as they are. Shipping cost uses the order's estimate, or the charged shipping times
     * the fallback markup when the order has not been estimated yet.
     */
    public List<DailyMetricDTO> rollupOrders(LocalDate start, LocalDate end) {
        if (start == null || end == null || end.isBefore(start)) {
            throw new IllegalArgumentException("Invalid date range: " + start + " to " + end);
        }

        Map<LocalDate, DailyMetric> byDate = new TreeMap<>();
        int estimated = 0;
        int fallback = 0;

        for (Order order : orderRepository.findByOrderDateBetweenOrderByOrderDateAsc(start, end)) {
            DailyMetric day = byDate.computeIfAbsent(order.getOrderDate(),
                    date -> DailyMetric.create(MetricSource.SHOPIFY, date, DailyMetric.ACCOUNT_LEVEL));

            BigDecimal shippingCharged = orZero(order.getShippingCharged());
            BigDecimal shippingCost;
            if (order.getShippingCostEstimated() != null) {
                shippingCost = order.getShippingCostEstimated();
                estimated++;
            } else {
                shippingCost = shippingCharged.multiply(fallbackMarkup);
                fallback++;
            }

            day.setRevenue(day.getRevenue().add(orZero(order.getSubtotal()).subtract(orZero(order.getTotalDiscounts()))));
            day.setShippingRevenue(day.getShippingRevenue().add(shippingCharged));
            day.setShippingCost(day.getShippingCost().add(shippingCost));
            day.setOrderCount(day.getOrderCount() + 1);
        }

        List<DailyMetricDTO> written = new ArrayList<>();
        for (DailyMetric day : byDate.values()) {
            day.setRevenue(day.getRevenue().setScale(2, RoundingMode.HALF_UP));
            day.setShippingRevenue(day.getShippingRevenue().setScale(2, RoundingMode.HALF_UP));
            day.setShippingCost(day.getShippingCost().setScale(2, RoundingMode.HALF_UP));

            // cogs are pushed separately and must survive the rollup
            written.add(new DailyMetricDTO(dailyMetricService.upsert(day, true)));
        }

        logger.info("Shopify rollup {} to {}: {} days written, {} orders with estimates, {} using fallback markup {}",
                start, end, written.size(), estimated, fallback, fallbackMarkup);
        return written;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
