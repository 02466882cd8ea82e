package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tartaritech.profit_dashboard.dtos.ItemMatchDTO;
import com.tartaritech.profit_dashboard.dtos.ShippingBreakdownDTO;
import com.tartaritech.profit_dashboard.entities.LineItem;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;

/**
 * Estimates an order's shipping cost. Each line item is matched on its own, items are grouped
 * by the profile they matched, and every group is costed once.
 */
@Component
public class ShippingEstimator {

    private final ShippingRuleMatcher shippingRuleMatcher;
    private final ShippingCostCalculator shippingCostCalculator;
    private final Logger logger = LoggerFactory.getLogger(ShippingEstimator.class);

    public ShippingEstimator(ShippingRuleMatcher shippingRuleMatcher, ShippingCostCalculator shippingCostCalculator) {
        this.shippingRuleMatcher = shippingRuleMatcher;
        this.shippingCostCalculator = shippingCostCalculator;
    }

    public ShippingEstimate estimate(Order order, List<ShippingProfile> profiles) {
        List<ItemMatchDTO> matchedItems = new ArrayList<>();
        Map<Long, ProfileGroup> groups = new LinkedHashMap<>();

        for (LineItem item : order.getLineItems()) {
            Optional<ShippingProfile> profile = shippingRuleMatcher.matchOrDefault(item, profiles);

            matchedItems.add(new ItemMatchDTO(
                    item.getProductTitle(),
                    item.getVariantTitle(),
                    item.getQuantity() != null ? item.getQuantity() : 0,
                    profile.map(ShippingProfile::getId).orElse(null),
                    profile.map(ShippingProfile::getName).orElse(ItemMatchDTO.NO_RULE_MATCH)));

            profile.ifPresent(p -> groups.computeIfAbsent(p.getId(), id -> new ProfileGroup(p)).items.add(item));
        }

        if (groups.isEmpty()) {
            logger.debug("No shipping rule matched any of the {} items of order {}",
                    order.getLineItems().size(), order.getId());
            return new ShippingEstimate(null, ShippingEstimateStatus.NO_RULE_MATCHED, null,
                    Set.of(), List.of(), matchedItems);
        }

        BigDecimal total = BigDecimal.ZERO;
        List<ShippingBreakdownDTO> breakdown = new ArrayList<>();
        for (ProfileGroup group : groups.values()) {
            BigDecimal cost = shippingCostCalculator.calculate(order, group.profile, group.items);
            total = total.add(cost);
            breakdown.add(new ShippingBreakdownDTO(
                    group.profile.getId(),
                    group.profile.getName(),
                    group.items.stream().map(LineItem::getProductTitle).collect(Collectors.toList()),
                    group.subtotal(),
                    cost));
        }

        Set<Long> appliedRuleIds = new LinkedHashSet<>(groups.keySet());
        Long primaryRuleId = appliedRuleIds.size() == 1 ? appliedRuleIds.iterator().next() : null;

        logger.debug("Order {} estimated at {} using rules {}", order.getId(), total, appliedRuleIds);
        return new ShippingEstimate(total, ShippingEstimateStatus.CALCULATED, primaryRuleId,
                appliedRuleIds, breakdown, matchedItems);
    }

    private static class ProfileGroup {
        private final ShippingProfile profile;
        private final List<LineItem> items = new ArrayList<>();

        ProfileGroup(ShippingProfile profile) {
            this.profile = profile;
        }

        BigDecimal subtotal() {
            return items.stream()
                    .map(item -> item.getTotal() != null ? item.getTotal() : BigDecimal.ZERO)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
        }
    }
}
