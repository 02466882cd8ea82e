package com.tartaritech.profit_dashboard.dtos;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

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
public class ItemMatchDTO {

    public static final String NO_RULE_MATCH = "No Rule Match";

    private String productTitle;
    private String variantTitle;
    private int quantity;
    private Long profileId;
    private String profileName;
}
