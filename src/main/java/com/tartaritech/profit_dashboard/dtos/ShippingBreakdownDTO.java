package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;
import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Cost contributed by one shipping profile to an order.
 */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ShippingBreakdownDTO {

    private Long profileId;
    private String profileName;
    private List<String> items;
    private BigDecimal subtotal;
    private BigDecimal cost;
}
