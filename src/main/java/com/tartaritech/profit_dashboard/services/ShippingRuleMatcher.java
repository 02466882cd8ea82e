package com.tartaritech.profit_dashboard.services;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.tartaritech.profit_dashboard.entities.LineItem;
import com.tartaritech.profit_dashboard.entities.MatchCondition;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;
import com.tartaritech.profit_dashboard.enums.MatchField;

/**
 * Finds the shipping profile that applies to a line item. Profiles are evaluated in
 * (priority, creation time, id) order and the first satisfied condition wins.
 */
@Component
public class ShippingRuleMatcher {

    public static final Comparator<ShippingProfile> EVALUATION_ORDER = Comparator
            .comparing(ShippingProfile::getPriority, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ShippingProfile::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ShippingProfile::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * First active profile whose condition holds for the item, or empty.
     */
    public Optional<ShippingProfile> match(LineItem item, List<ShippingProfile> profiles) {
        return activeInEvaluationOrder(profiles).stream()
                .filter(profile -> matches(profile.getMatchCondition(), item))
                .findFirst();
    }

    /**
     * Same as {@link #match} but falls back to the first active profile flagged as default.
     */
    public Optional<ShippingProfile> matchOrDefault(LineItem item, List<ShippingProfile> profiles) {
        List<ShippingProfile> ordered = activeInEvaluationOrder(profiles);
        for (ShippingProfile profile : ordered) {
            if (matches(profile.getMatchCondition(), item)) {
                return Optional.of(profile);
            }
        }
        return ordered.stream()
                .filter(ShippingProfile::isDefaultProfile)
                .findFirst();
    }

    public List<ShippingProfile> activeInEvaluationOrder(List<ShippingProfile> profiles) {
        return profiles.stream()
                .filter(ShippingProfile::isActive)
                .sorted(EVALUATION_ORDER)
                .collect(Collectors.toList());
    }

    public boolean matches(MatchCondition condition, LineItem item) {
        if (condition == null || condition.getField() == null) {
            return false;
        }
        return matches(condition, fieldValue(condition.getField(), item));
    }

    public boolean matches(MatchCondition condition, String fieldValue) {
        if (condition == null || condition.getOperator() == null) {
            return false;
        }
        String actual = fieldValue != null ? fieldValue : "";
        String expected = condition.getValue() != null ? condition.getValue() : "";

        if (!condition.isCaseSensitive()) {
            actual = actual.toLowerCase(Locale.ROOT);
            expected = expected.toLowerCase(Locale.ROOT);
        }

        return condition.getOperator().test(actual, expected);
    }

    private String fieldValue(MatchField field, LineItem item) {
        switch (field) {
            case PRODUCT_TITLE:
                return item.getProductTitle();
            case VARIANT_TITLE:
                return item.getVariantTitle();
            default:
                return null;
        }
    }
}
