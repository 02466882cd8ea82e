package com.tartaritech.profit_dashboard.repositories;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;

@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    List<Order> findByOrderDateGreaterThanEqualOrderByOrderDateAsc(LocalDate since);

    List<Order> findByOrderDateBetweenOrderByOrderDateAsc(LocalDate start, LocalDate end);

    List<Order> findByShippingEstimateStatusAndOrderDateGreaterThanEqualOrderByOrderDateAsc(
            ShippingEstimateStatus status, LocalDate since);

    long countByOrderDateBetweenAndShippingCostEstimatedIsNull(LocalDate start, LocalDate end);
}
