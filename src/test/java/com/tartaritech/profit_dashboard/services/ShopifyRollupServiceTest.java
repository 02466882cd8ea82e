package com.tartaritech.profit_dashboard.services;

import static com.tartaritech.profit_dashboard.services.ShippingTestData.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.tartaritech.profit_dashboard.entities.DailyMetric;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.enums.MetricSource;
import com.tartaritech.profit_dashboard.repositories.OrderRepository;

@ExtendWith(MockitoExtension.class)
@DisplayName("ShopifyRollupService Unit Tests")
class ShopifyRollupServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private DailyMetricService dailyMetricService;

    private ShopifyRollupService service;

    @BeforeEach
    void setup() {
        service = new ShopifyRollupService(orderRepository, dailyMetricService, new BigDecimal("1.05"));
    }

    @Test
    @DisplayName("Should roll orders of a day into one row, preferring estimates over the markup")
    void shouldRollUpOneDay() {
        Order estimated = order("1", "100.00", "10.00", item("Shirt", 1));
        estimated.setTotalDiscounts(money("20.00"));
        estimated.setShippingCostEstimated(money("6.00"));
        Order unestimated = order("2", "50.00", "8.00", item("Mug", 1));

        when(orderRepository.findByOrderDateBetweenOrderByOrderDateAsc(DAY, DAY)).thenReturn(List.of(estimated, unestimated));
        when(dailyMetricService.upsert(any(DailyMetric.class), eq(true))).thenAnswer(inv -> inv.getArgument(0));

        service.rollupOrders(DAY, DAY);

        ArgumentCaptor<DailyMetric> captor = ArgumentCaptor.forClass(DailyMetric.class);
        verify(dailyMetricService).upsert(captor.capture(), eq(true));
        verify(dailyMetricService, never()).upsert(any(DailyMetric.class));
        DailyMetric row = captor.getValue();
        assertEquals(MetricSource.SHOPIFY, row.getSource());
        assertEquals(money("130.00"), row.getRevenue());
        assertEquals(money("18.00"), row.getShippingRevenue());
        // 6.00 estimated + 8.00 * 1.05
        assertEquals(money("14.40"), row.getShippingCost());
        assertEquals(2, row.getOrderCount());
        assertEquals(0, BigDecimal.ZERO.compareTo(row.getCogs()));
    }

    @Test
    @DisplayName("Should leave days without orders untouched")
    void shouldSkipEmptyRange() {
        when(orderRepository.findByOrderDateBetweenOrderByOrderDateAsc(DAY, DAY.plusDays(2))).thenReturn(List.of());

        assertTrue(service.rollupOrders(DAY, DAY.plusDays(2)).isEmpty());
        verifyNoInteractions(dailyMetricService);
    }

    @Test
    @DisplayName("Should reject an inverted range")
    void shouldRejectInvertedRange() {
        assertThrows(IllegalArgumentException.class, () -> service.rollupOrders(DAY, DAY.minusDays(1)));
    }
}
