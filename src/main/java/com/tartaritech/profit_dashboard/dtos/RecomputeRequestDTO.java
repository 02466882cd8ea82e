package com.tartaritech.profit_dashboard.dtos;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
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
public class RecomputeRequestDTO {

    @NotEmpty(message = "At least one order id is required")
    private List<String> orderIds;

    @Min(value = 1, message = "Lookback window must be at least one day")
    private int lookbackDays = 30;
}
