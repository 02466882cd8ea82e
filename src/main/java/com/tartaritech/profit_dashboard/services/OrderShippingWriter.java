package com.tartaritech.profit_dashboard.services;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.profit_dashboard.dtos.RecomputeResultDTO;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;
import com.tartaritech.profit_dashboard.exceptions.ResourceNotFoundException;
import com.tartaritech.profit_dashboard.exceptions.ShippingRuleConfigurationException;
import com.tartaritech.profit_dashboard.repositories.OrderRepository;

/**
 * Per-order transactional writes of shipping estimates. Kept apart from
 * {@link OrderShippingService} so every order of a batch commits on its own.
 */
@Service
public class OrderShippingWriter {

    private final OrderRepository orderRepository;
    private final ShippingEstimator shippingEstimator;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(OrderShippingWriter.class);

    public OrderShippingWriter(OrderRepository orderRepository, ShippingEstimator shippingEstimator, Clock clock) {
        this.orderRepository = orderRepository;
        this.shippingEstimator = shippingEstimator;
        this.clock = clock;
    }

    /**
     * Estimates the order against the given profiles and stores the result. A misconfigured
     * rule keeps the stored estimate, marks the order MISCONFIGURED_RULE and rethrows.
     */
    @Transactional(noRollbackFor = ShippingRuleConfigurationException.class)
    public RecomputeResultDTO recompute(String orderId, List<ShippingProfile> profiles) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));

        ShippingEstimate estimate;
        try {
            estimate = shippingEstimator.estimate(order, profiles);
        } catch (ShippingRuleConfigurationException e) {
            order.markMisconfigured(Instant.now(clock));
            orderRepository.save(order);
            logger.warn("Order {} flagged MISCONFIGURED_RULE by profile {}", orderId, e.getProfileId());
            throw e;
        }

        order.applyShippingEstimate(estimate.getTotalCost(), estimate.getPrimaryRuleId(),
                estimate.getAppliedRuleIds(), estimate.getStatus(), Instant.now(clock));
        orderRepository.save(order);

        logger.debug("Order {} shipping estimate stored: {} ({})", orderId, estimate.getTotalCost(), estimate.getStatus());
        return toResult(order.getId(), estimate);
    }

    @Transactional(readOnly = true)
    public RecomputeResultDTO preview(String orderId, List<ShippingProfile> profiles) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));
        return toResult(order.getId(), shippingEstimator.estimate(order, profiles));
    }

    static RecomputeResultDTO toResult(String orderId, ShippingEstimate estimate) {
        return new RecomputeResultDTO(orderId,
                estimate.getStatus(),
                estimate.getTotalCost(),
                estimate.getPrimaryRuleId(),
                new LinkedHashSet<>(estimate.getAppliedRuleIds()),
                new ArrayList<>(estimate.getBreakdown()),
                new ArrayList<>(estimate.getMatchedItems()));
    }
}
