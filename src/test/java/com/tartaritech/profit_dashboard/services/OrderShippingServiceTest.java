package com.tartaritech.profit_dashboard.services;

import static com.tartaritech.profit_dashboard.services.ShippingTestData.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;

import com.tartaritech.profit_dashboard.dtos.BatchRecomputeResultDTO;
import com.tartaritech.profit_dashboard.dtos.RecomputeFailureDTO;
import com.tartaritech.profit_dashboard.dtos.RuleUsageDTO;
import com.tartaritech.profit_dashboard.entities.CostRule;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;
import com.tartaritech.profit_dashboard.enums.CostRuleType;
import com.tartaritech.profit_dashboard.enums.RecomputeFailureReason;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;
import com.tartaritech.profit_dashboard.repositories.OrderRepository;
import com.tartaritech.profit_dashboard.repositories.ShippingProfileRepository;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("OrderShippingService Unit Tests")
class OrderShippingServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-20T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 20);

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private ShippingProfileRepository shippingProfileRepository;

    private OrderShippingService service;

    private final ShippingProfile shirts = profile(1, "Shirts", 10, "shirt", CostRule.perItem(money("2.00")));
    private final ShippingProfile vases = profile(2, "Vases", 5, "vase", new CostRule(CostRuleType.FIXED, null, null, null, null));

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ShippingEstimator estimator = new ShippingEstimator(new ShippingRuleMatcher(), new ShippingCostCalculator());
        OrderShippingWriter writer = new OrderShippingWriter(orderRepository, estimator, clock);
        service = new OrderShippingService(writer, orderRepository, shippingProfileRepository, clock);
        ReflectionTestUtils.setField(service, "parallelism", 2);

        when(shippingProfileRepository.findByActiveTrueOrderByPriorityAscCreatedAtAscIdAsc())
                .thenReturn(List.of(vases, shirts));
    }

    @Nested
    @DisplayName("recomputeMany")
    class RecomputeManyTests {

        @Test
        @DisplayName("Should persist the good orders and flag the misconfigured one")
        void shouldTolerateOneBadOrder() {
            Order o1 = order("o1", "10.00", "5.00", item("Red Shirt", 1));
            Order o2 = order("o2", "10.00", "5.00", item("Blue Shirt", 2));
            Order o3 = order("o3", "10.00", "5.00", item("Glass Vase", 1));
            Order o4 = order("o4", "10.00", "5.00", item("Green Shirt", 3));
            Order o5 = order("o5", "10.00", "5.00", item("Mug", 1));
            for (Order o : List.of(o1, o2, o3, o4, o5)) {
                when(orderRepository.findById(o.getId())).thenReturn(Optional.of(o));
            }
            when(orderRepository.findByOrderDateGreaterThanEqualOrderByOrderDateAsc(any())).thenReturn(List.of());

            BatchRecomputeResultDTO result = service.recomputeMany(List.of("o1", "o2", "o3", "o4", "o5"), 30);

            assertEquals(5, result.getRequested());
            assertEquals(4, result.getSucceededCount());
            assertEquals(1, result.getFailedCount());

            RecomputeFailureDTO failure = result.getFailed().get(0);
            assertEquals("o3", failure.getOrderId());
            assertEquals(RecomputeFailureReason.MISCONFIGURED_RULE, failure.getReason());
            assertEquals(2L, failure.getProfileId());

            verify(orderRepository, times(5)).save(any(Order.class));
            assertEquals(ShippingEstimateStatus.MISCONFIGURED_RULE, o3.getShippingEstimateStatus());
            assertEquals(money("2.00"), o1.getShippingCostEstimated());
            assertEquals(money("4.00"), o2.getShippingCostEstimated());
            assertEquals(money("6.00"), o4.getShippingCostEstimated());
            assertNull(o3.getShippingCostEstimated());

            assertEquals(3L, result.getStatusCounts().get(ShippingEstimateStatus.CALCULATED));
            assertEquals(1L, result.getStatusCounts().get(ShippingEstimateStatus.NO_RULE_MATCHED));
            assertEquals(1L, result.getStatusCounts().get(ShippingEstimateStatus.MISCONFIGURED_RULE));
        }

        @Test
        @DisplayName("Should keep the request order in the result and report unknown ids")
        void shouldReportUnknownOrders() {
            Order o1 = order("o1", "10.00", "5.00", item("Red Shirt", 1));
            when(orderRepository.findById("o1")).thenReturn(Optional.of(o1));
            when(orderRepository.findById("ghost")).thenReturn(Optional.empty());
            when(orderRepository.findByOrderDateGreaterThanEqualOrderByOrderDateAsc(any())).thenReturn(List.of());

            BatchRecomputeResultDTO result = service.recomputeMany(List.of("ghost", "o1", "o1"), 30);

            assertEquals(2, result.getRequested());
            assertEquals("o1", result.getSucceeded().get(0).getOrderId());
            assertEquals(RecomputeFailureReason.NOT_FOUND, result.getFailed().get(0).getReason());
        }

        @Test
        @DisplayName("Should load the rule set once for the whole batch")
        void shouldSnapshotRulesOnce() {
            for (String id : List.of("a", "b", "c")) {
                when(orderRepository.findById(id)).thenReturn(Optional.of(order(id, "10.00", "5.00", item("Shirt", 1))));
            }
            when(orderRepository.findByOrderDateGreaterThanEqualOrderByOrderDateAsc(any())).thenReturn(List.of());

            service.recomputeMany(List.of("a", "b", "c"), 30);

            verify(shippingProfileRepository, times(1)).findByActiveTrueOrderByPriorityAscCreatedAtAscIdAsc();
        }
    }

    @Nested
    @DisplayName("Rule usage")
    class RuleUsageTests {

        @Test
        @DisplayName("Should count orders per applied rule inside the window")
        void shouldCountByScanning() {
            Order a = order("a", "10.00", "0.00");
            a.getAppliedRuleIds().addAll(Set.of(1L, 2L));
            Order b = order("b", "10.00", "0.00");
            b.getAppliedRuleIds().add(1L);
            when(orderRepository.findByOrderDateGreaterThanEqualOrderByOrderDateAsc(TODAY.minusDays(30)))
                    .thenReturn(List.of(a, b));

            Map<Long, Long> usage = service.getRuleUsage(30);

            assertEquals(Map.of(1L, 2L, 2L, 1L), usage);
        }

        @Test
        @DisplayName("Should not double count after recomputing the same order")
        void shouldNotDoubleCount() {
            Order o1 = order("o1", "10.00", "5.00", item("Red Shirt", 1));
            when(orderRepository.findById("o1")).thenReturn(Optional.of(o1));
            when(orderRepository.findByOrderDateGreaterThanEqualOrderByOrderDateAsc(any())).thenReturn(List.of(o1));

            service.recomputeOne("o1");
            BatchRecomputeResultDTO result = service.recomputeMany(List.of("o1"), 30);

            assertEquals(Map.of(1L, 1L), result.getRuleUsage());
        }

        @Test
        @DisplayName("Should name rules and keep deleted ones")
        void shouldDescribeUsage() {
            Order a = order("a", "10.00", "0.00");
            a.getAppliedRuleIds().addAll(Set.of(1L, 99L));
            Order b = order("b", "10.00", "0.00");
            b.getAppliedRuleIds().add(1L);
            when(orderRepository.findByOrderDateGreaterThanEqualOrderByOrderDateAsc(any())).thenReturn(List.of(a, b));
            when(shippingProfileRepository.findAll()).thenReturn(List.of(shirts));

            List<RuleUsageDTO> usage = service.getRuleUsageDetails(30);

            assertEquals(2, usage.size());
            assertEquals("Shirts", usage.get(0).getRuleName());
            assertEquals(2L, usage.get(0).getUsageCount());
            assertNull(usage.get(1).getRuleName());
        }

        @Test
        @DisplayName("Should reject a non-positive window")
        void shouldRejectBadWindow() {
            assertThrows(IllegalArgumentException.class, () -> service.getRuleUsage(0));
        }
    }
}
