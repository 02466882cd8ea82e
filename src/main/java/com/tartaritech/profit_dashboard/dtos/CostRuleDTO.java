package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.entities.CostRule;
import com.tartaritech.profit_dashboard.enums.CostRuleType;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CostRuleDTO {

    @NotNull(message = "Cost rule type is required")
    private CostRuleType type;

    @DecimalMin(value = "0.0", message = "Base cost cannot be negative")
    private BigDecimal baseCost;

    @DecimalMin(value = "0.0", message = "Per item cost cannot be negative")
    private BigDecimal perItemCost;

    @DecimalMin(value = "0.0", message = "Percentage cannot be negative")
    private BigDecimal percentage;

    private BigDecimal adjustment;

    public CostRuleDTO(CostRule entity) {
        this.type = entity.getType();
        this.baseCost = entity.getBaseCost();
        this.perItemCost = entity.getPerItemCost();
        this.percentage = entity.getPercentage();
        this.adjustment = entity.getAdjustment();
    }

    public CostRule toEntity() {
        return new CostRule(type, baseCost, perItemCost, percentage, adjustment);
    }
}
