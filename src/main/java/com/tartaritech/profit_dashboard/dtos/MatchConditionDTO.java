package com.tartaritech.profit_dashboard.dtos;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.entities.MatchCondition;
import com.tartaritech.profit_dashboard.enums.MatchField;
import com.tartaritech.profit_dashboard.enums.MatchOperator;

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
public class MatchConditionDTO {

    @NotNull(message = "Match field is required")
    private MatchField field;

    private MatchOperator operator = MatchOperator.CONTAINS;

    @NotNull(message = "Match value is required")
    private String value;

    private boolean caseSensitive;

    public MatchConditionDTO(MatchCondition entity) {
        this.field = entity.getField();
        this.operator = entity.getOperator();
        this.value = entity.getValue();
        this.caseSensitive = entity.isCaseSensitive();
    }

    public MatchCondition toEntity() {
        return new MatchCondition(field, operator != null ? operator : MatchOperator.CONTAINS, value, caseSensitive);
    }
}
