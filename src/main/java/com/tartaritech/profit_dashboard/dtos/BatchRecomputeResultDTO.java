package com.tartaritech.profit_dashboard.dtos;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchRecomputeResultDTO {

    private int requested;

    private List<RecomputeResultDTO> succeeded = new ArrayList<>();

    private List<RecomputeFailureDTO> failed = new ArrayList<>();

    private Map<ShippingEstimateStatus, Long> statusCounts = new EnumMap<>(ShippingEstimateStatus.class);

    private int lookbackDays;

    // rule id -> orders in the lookback window that used it
    private Map<Long, Long> ruleUsage = new LinkedHashMap<>();

    public int getSucceededCount() {
        return succeeded.size();
    }

    public int getFailedCount() {
        return failed.size();
    }
}
