package com.tartaritech.profit_dashboard.services;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.tartaritech.profit_dashboard.dtos.BatchRecomputeResultDTO;
import com.tartaritech.profit_dashboard.dtos.RecomputeFailureDTO;
import com.tartaritech.profit_dashboard.dtos.RecomputeResultDTO;
import com.tartaritech.profit_dashboard.dtos.RuleUsageDTO;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;
import com.tartaritech.profit_dashboard.enums.RecomputeFailureReason;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;
import com.tartaritech.profit_dashboard.exceptions.ResourceNotFoundException;
import com.tartaritech.profit_dashboard.exceptions.ShippingRuleConfigurationException;
import com.tartaritech.profit_dashboard.repositories.OrderRepository;
import com.tartaritech.profit_dashboard.repositories.ShippingProfileRepository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Recomputes and reports stored shipping estimates.
 *
 * <p>Rule usage is never counted incrementally. It is derived by scanning the applied rule ids of
 * the orders inside the lookback window, so recomputing the same order twice cannot inflate it.
 */
@Service
public class OrderShippingService {

    private final OrderShippingWriter orderShippingWriter;
    private final OrderRepository orderRepository;
    private final ShippingProfileRepository shippingProfileRepository;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(OrderShippingService.class);

    @Value("${shipping.recompute.parallelism:4}")
    private int parallelism;

    public OrderShippingService(OrderShippingWriter orderShippingWriter,
                                OrderRepository orderRepository,
                                ShippingProfileRepository shippingProfileRepository,
                                Clock clock) {
        this.orderShippingWriter = orderShippingWriter;
        this.orderRepository = orderRepository;
        this.shippingProfileRepository = shippingProfileRepository;
        this.clock = clock;
    }

    /**
     * Recomputes one order against the current active rules. Errors propagate to the caller.
     */
    public RecomputeResultDTO recomputeOne(String orderId) {
        logger.info("Recomputing shipping estimate for order {}", orderId);
        return orderShippingWriter.recompute(orderId, loadActiveProfiles());
    }

    /**
     * Recomputes the given orders in parallel. Every order commits on its own and a failing order
     * is reported in the result without stopping the others.
     */
    public BatchRecomputeResultDTO recomputeMany(List<String> orderIds, int lookbackDays) {
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(orderIds));
        List<ShippingProfile> profiles = loadActiveProfiles();
        int concurrency = Math.max(1, parallelism);

        logger.info("Recomputing shipping for {} orders against {} active profiles (parallelism: {})",
                ids.size(), profiles.size(), concurrency);

        List<Outcome> outcomes = Flux.fromIterable(ids)
                .flatMap(orderId ->
                    Mono.fromCallable(() -> recomputeIsolated(orderId, profiles))
                        .subscribeOn(Schedulers.boundedElastic()),
                    concurrency
                )
                .collectList()
                .block();

        Map<String, Outcome> byId = outcomes == null ? Map.of()
                : outcomes.stream().collect(Collectors.toMap(o -> o.orderId, Function.identity()));

        BatchRecomputeResultDTO result = new BatchRecomputeResultDTO();
        result.setRequested(ids.size());
        result.setLookbackDays(lookbackDays);

        Map<ShippingEstimateStatus, Long> statusCounts = new EnumMap<>(ShippingEstimateStatus.class);
        for (String orderId : ids) {
            Outcome outcome = byId.get(orderId);
            if (outcome == null) {
                continue;
            }
            if (outcome.result != null) {
                result.getSucceeded().add(outcome.result);
                statusCounts.merge(outcome.result.getStatus(), 1L, Long::sum);
            } else {
                result.getFailed().add(outcome.failure);
                if (outcome.failure.getReason() == RecomputeFailureReason.MISCONFIGURED_RULE) {
                    statusCounts.merge(ShippingEstimateStatus.MISCONFIGURED_RULE, 1L, Long::sum);
                }
            }
        }
        result.setStatusCounts(statusCounts);
        result.setRuleUsage(getRuleUsage(lookbackDays));

        logger.info("Shipping recompute finished: {} succeeded, {} failed",
                result.getSucceededCount(), result.getFailedCount());
        return result;
    }

    /**
     * Recomputes every order dated inside the lookback window.
     */
    public BatchRecomputeResultDTO recomputeAll(int lookbackDays) {
        List<String> orderIds = orderRepository.findByOrderDateGreaterThanEqualOrderByOrderDateAsc(windowStart(lookbackDays))
                .stream()
                .map(Order::getId)
                .collect(Collectors.toList());
        logger.info("Recomputing all {} orders from the last {} days", orderIds.size(), lookbackDays);
        return recomputeMany(orderIds, lookbackDays);
    }

    public RecomputeResultDTO getOrderBreakdown(String orderId) {
        return orderShippingWriter.preview(orderId, loadActiveProfiles());
    }

    public Map<Long, Long> getRuleUsage(int lookbackDays) {
        Map<Long, Long> usage = new TreeMap<>();
        for (Order order : orderRepository.findByOrderDateGreaterThanEqualOrderByOrderDateAsc(windowStart(lookbackDays))) {
            for (Long ruleId : order.getAppliedRuleIds()) {
                usage.merge(ruleId, 1L, Long::sum);
            }
        }
        return usage;
    }

    /**
     * Usage per rule with the rule name, most used first. Deleted rules keep their counts with a
     * null name.
     */
    public List<RuleUsageDTO> getRuleUsageDetails(int lookbackDays) {
        Map<Long, String> names = shippingProfileRepository.findAll().stream()
                .collect(Collectors.toMap(ShippingProfile::getId, ShippingProfile::getName));

        return getRuleUsage(lookbackDays).entrySet().stream()
                .map(e -> new RuleUsageDTO(e.getKey(), names.get(e.getKey()), e.getValue(), lookbackDays))
                .sorted(Comparator.comparingLong(RuleUsageDTO::getUsageCount).reversed()
                        .thenComparing(RuleUsageDTO::getRuleId))
                .collect(Collectors.toList());
    }

    private List<ShippingProfile> loadActiveProfiles() {
        return shippingProfileRepository.findByActiveTrueOrderByPriorityAscCreatedAtAscIdAsc();
    }

    private LocalDate windowStart(int lookbackDays) {
        if (lookbackDays < 1) {
            throw new IllegalArgumentException("Lookback days must be at least 1");
        }
        return LocalDate.now(clock).minusDays(lookbackDays);
    }

    private Outcome recomputeIsolated(String orderId, List<ShippingProfile> profiles) {
        try {
            return Outcome.success(orderId, orderShippingWriter.recompute(orderId, profiles));
        } catch (ResourceNotFoundException e) {
            logger.warn("Order {} not found during batch recompute", orderId);
            return Outcome.failure(new RecomputeFailureDTO(orderId, RecomputeFailureReason.NOT_FOUND, e.getMessage(), null));
        } catch (ShippingRuleConfigurationException e) {
            logger.warn("Order {} skipped, misconfigured shipping profile {}: {}", orderId, e.getProfileId(), e.getMessage());
            return Outcome.failure(new RecomputeFailureDTO(orderId, RecomputeFailureReason.MISCONFIGURED_RULE,
                    e.getMessage(), e.getProfileId()));
        } catch (Exception e) {
            logger.error("Error recomputing shipping for order {}", orderId, e);
            return Outcome.failure(new RecomputeFailureDTO(orderId, RecomputeFailureReason.ERROR, e.getMessage(), null));
        }
    }

    private static final class Outcome {
        private final String orderId;
        private final RecomputeResultDTO result;
        private final RecomputeFailureDTO failure;

        private Outcome(String orderId, RecomputeResultDTO result, RecomputeFailureDTO failure) {
            this.orderId = orderId;
            this.result = result;
            this.failure = failure;
        }

        static Outcome success(String orderId, RecomputeResultDTO result) {
            return new Outcome(orderId, result, null);
        }

        static Outcome failure(RecomputeFailureDTO failure) {
            return new Outcome(failure.getOrderId(), null, failure);
        }
    }
}
