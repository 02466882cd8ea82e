package com.tartaritech.profit_dashboard.dtos;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MetricsPushRequestDTO {

    @NotEmpty(message = "At least one daily metric is required")
    @Valid
    private List<DailyMetricDTO> dailyMetrics;

    // free-form identifier of the pushing script
    private String origin = "sync_script";
}
