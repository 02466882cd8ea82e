package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.profit_dashboard.dtos.LineItemDTO;
import com.tartaritech.profit_dashboard.dtos.OrderDTO;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;
import com.tartaritech.profit_dashboard.repositories.OrderRepository;

/**
 * Stores orders pushed by the Shopify sync. Shipping estimate fields belong to the recompute
 * service and survive a re-sync.
 */
@Service
public class OrderSyncService {

    private final OrderRepository orderRepository;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(OrderSyncService.class);

    public OrderSyncService(OrderRepository orderRepository, Clock clock) {
        this.orderRepository = orderRepository;
        this.clock = clock;
    }

    @Transactional
    public int upsertOrders(List<OrderDTO> orders) {
        int created = 0;
        for (OrderDTO dto : orders) {
            Order order = orderRepository.findById(dto.getId()).orElse(null);
            if (order == null) {
                order = new Order();
                order.setId(dto.getId());
                created++;
            }
            copyOrderData(dto, order);
            orderRepository.save(order);
        }
        logger.info("Order sync stored {} orders ({} new, {} updated)", orders.size(), created, orders.size() - created);
        return orders.size();
    }

    @Transactional(readOnly = true)
    public List<OrderDTO> getRecentOrders(int days, ShippingEstimateStatus status) {
        if (days < 1) {
            throw new IllegalArgumentException("Days must be at least 1");
        }
        LocalDate since = LocalDate.now(clock).minusDays(days);
        List<Order> orders = status != null
                ? orderRepository.findByShippingEstimateStatusAndOrderDateGreaterThanEqualOrderByOrderDateAsc(status, since)
                : orderRepository.findByOrderDateGreaterThanEqualOrderByOrderDateAsc(since);
        return orders.stream()
                .map(OrderDTO::new)
                .collect(Collectors.toList());
    }

    private void copyOrderData(OrderDTO dto, Order order) {
        order.setOrderNumber(dto.getOrderNumber());
        order.setOrderDate(dto.getOrderDate());
        order.setCustomerEmail(dto.getCustomerEmail());
        if (dto.getCurrency() != null) {
            order.setCurrency(dto.getCurrency());
        }
        order.setFinancialStatus(dto.getFinancialStatus());
        order.setSubtotal(orZero(dto.getSubtotal()));
        order.setTotalDiscounts(orZero(dto.getTotalDiscounts()));
        order.setTotalPrice(orZero(dto.getTotalPrice()));
        order.setShippingCharged(orZero(dto.getShippingCharged()));
        order.replaceLineItems(dto.getLineItems().stream()
                .map(LineItemDTO::toEntity)
                .collect(Collectors.toList()));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
